package com.vehicle.anomaly.engine.detectors;

import com.vehicle.anomaly.engine.AnomalyDetector;
import com.vehicle.anomaly.engine.DetectionContext;
import com.vehicle.anomaly.engine.DetectorOutcome;
import com.vehicle.anomaly.engine.threshold.ParameterThreshold;
import com.vehicle.anomaly.engine.threshold.ParameterThresholdTable;
import com.vehicle.anomaly.model.AnomalyResult;
import com.vehicle.anomaly.model.AnomalyType;
import com.vehicle.anomaly.model.Severity;
import com.vehicle.anomaly.model.TelemetrySample;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Flags readings outside their absolute limits (HIGH, or CRITICAL once the
 * breach reaches 20% of the bound) and readings inside the limits but outside
 * the optimal range (LOW).
 *
 * Score is the breach relative to the crossed bound, capped at 1.0:
 * COOLANT_TEMP=130 against max=110 scores (130-110)/110 = 0.18.
 */
@Component
public class ThresholdDetector implements AnomalyDetector {

    static final double LIMIT_CONFIDENCE = 0.9;
    static final double OPTIMAL_CONFIDENCE = 0.7;

    // A breach reaching 20% of the bound's magnitude is critical
    private static final double WIDEN = 1.2;
    private static final double NARROW = 0.8;

    private final ParameterThresholdTable thresholds;

    public ThresholdDetector(ParameterThresholdTable thresholds) {
        this.thresholds = thresholds;
    }

    @Override
    public AnomalyType getAnomalyType() {
        return AnomalyType.THRESHOLD;
    }

    @Override
    public DetectorOutcome detect(DetectionContext context) {
        return DetectorOutcome.ok(getAnomalyType(), evaluate(context.getSample(), context.getTimestamp()));
    }

    public List<AnomalyResult> evaluate(TelemetrySample sample, Instant timestamp) {
        List<AnomalyResult> results = new ArrayList<>();
        for (Map.Entry<String, Double> reading : sample.asMap().entrySet()) {
            ParameterThreshold threshold = thresholds.get(reading.getKey());
            if (threshold == null) {
                continue;
            }
            String parameter = reading.getKey();
            double value = reading.getValue();

            if (!threshold.isWithinLimits(value)) {
                double bound = value < threshold.getMin() ? threshold.getMin() : threshold.getMax();
                results.add(AnomalyResult.builder()
                        .parameterName(parameter)
                        .value(value)
                        .anomalyScore(breachScore(value, bound))
                        .confidence(LIMIT_CONFIDENCE)
                        .severity(isCriticalBreach(value, threshold) ? Severity.CRITICAL : Severity.HIGH)
                        .anomalyType(AnomalyType.THRESHOLD)
                        .description(String.format("%s value %s outside safe range [%s, %s]",
                                parameter, value, threshold.getMin(), threshold.getMax()))
                        .recommendedAction("Check " + ParameterNames.humanize(parameter) + " system immediately")
                        .timestamp(timestamp)
                        .build());
            } else if (!threshold.isWithinOptimalRange(value)) {
                double bound = value < threshold.getOptimalMin() ? threshold.getOptimalMin() : threshold.getOptimalMax();
                results.add(AnomalyResult.builder()
                        .parameterName(parameter)
                        .value(value)
                        .anomalyScore(breachScore(value, bound))
                        .confidence(OPTIMAL_CONFIDENCE)
                        .severity(Severity.LOW)
                        .anomalyType(AnomalyType.THRESHOLD)
                        .description(String.format("%s value %s outside optimal range (%s, %s)",
                                parameter, value, threshold.getOptimalMin(), threshold.getOptimalMax()))
                        .recommendedAction("Monitor " + ParameterNames.humanize(parameter) + " trends")
                        .timestamp(timestamp)
                        .build());
            }
        }
        return results;
    }

    /**
     * Upper breach: value &gt;= max * 1.2 (max &gt;= 0). Lower breach: value &lt;= min * 0.8 (min &gt;= 0).
     * Negative bounds are mirrored so the margin always widens the range.
     */
    static boolean isCriticalBreach(double value, ParameterThreshold threshold) {
        double max = threshold.getMax();
        double min = threshold.getMin();
        if (value > max) {
            double criticalAbove = max >= 0 ? max * WIDEN : max * NARROW;
            return value >= criticalAbove;
        }
        double criticalBelow = min >= 0 ? min * NARROW : min * WIDEN;
        return value <= criticalBelow;
    }

    // A zero bound has no magnitude to scale by; any breach of it is maximal
    static double breachScore(double value, double bound) {
        double magnitude = Math.abs(bound);
        if (magnitude == 0.0) {
            return 1.0;
        }
        return Math.min(Math.abs(value - bound) / magnitude, 1.0);
    }
}
