package com.vehicle.anomaly.engine.detectors;

import com.vehicle.anomaly.config.DetectionConfig;
import com.vehicle.anomaly.engine.AnomalyDetector;
import com.vehicle.anomaly.engine.DetectionContext;
import com.vehicle.anomaly.engine.DetectorOutcome;
import com.vehicle.anomaly.model.AnomalyResult;
import com.vehicle.anomaly.model.AnomalyType;
import com.vehicle.anomaly.model.HistoryEntry;
import com.vehicle.anomaly.model.Severity;
import com.vehicle.anomaly.model.TelemetrySample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Compares each reading against the recent readings of the same session.
 * Flags readings whose Z-score against the session's earlier samples exceeds
 * the configured threshold.
 */
@Component
public class PatternDeviationDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(PatternDeviationDetector.class);

    static final double PATTERN_CONFIDENCE = 0.8;

    private final DetectionConfig.PatternAnalysis settings;

    public PatternDeviationDetector(DetectionConfig config) {
        this.settings = config.getPattern();
    }

    @Override
    public AnomalyType getAnomalyType() {
        return AnomalyType.PATTERN;
    }

    @Override
    public DetectorOutcome detect(DetectionContext context) {
        return DetectorOutcome.ok(getAnomalyType(), evaluate(context.getSessionId(), context.getSample(),
                context.getHistory(), context.getTimestamp()));
    }

    /**
     * @param history session buffer after the append; its last entry is the current sample
     */
    public List<AnomalyResult> evaluate(String sessionId, TelemetrySample sample,
                                        List<HistoryEntry> history, Instant timestamp) {
        if (history.size() < settings.getMinHistory()) {
            return Collections.emptyList();
        }
        List<HistoryEntry> reference = history.subList(0, history.size() - 1);

        List<AnomalyResult> results = new ArrayList<>();
        for (String parameter : sample.parameterNames()) {
            double[] values = referenceValues(reference, parameter);
            if (values.length < settings.getMinPoints()) {
                continue;
            }
            double mean = mean(values);
            double std = populationStd(values, mean);
            if (std == 0.0) {
                continue;
            }

            double current = sample.get(parameter);
            double z = Math.abs(current - mean) / std;
            if (z <= settings.getZScoreThreshold()) {
                continue;
            }
            log.debug("Session {} {} z={} (mean={}, std={})", sessionId, parameter, z, mean, std);

            results.add(AnomalyResult.builder()
                    .parameterName(parameter)
                    .value(current)
                    .anomalyScore(Math.min(z / settings.getZScoreThreshold(), 1.0))
                    .confidence(PATTERN_CONFIDENCE)
                    .severity(z < settings.getHighZScore() ? Severity.MEDIUM : Severity.HIGH)
                    .anomalyType(AnomalyType.PATTERN)
                    .description(String.format("%s deviates significantly from recent pattern (Z-score: %.2f)",
                            parameter, z))
                    .recommendedAction("Investigate cause of " + ParameterNames.humanize(parameter) + " variation")
                    .timestamp(timestamp)
                    .build());
        }
        return results;
    }

    private static double[] referenceValues(List<HistoryEntry> reference, String parameter) {
        return reference.stream()
                .map(HistoryEntry::getSample)
                .filter(s -> s.has(parameter))
                .mapToDouble(s -> s.get(parameter))
                .toArray();
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    private static double populationStd(double[] values, double mean) {
        double squares = 0.0;
        for (double v : values) {
            double d = v - mean;
            squares += d * d;
        }
        return Math.sqrt(squares / values.length);
    }
}
