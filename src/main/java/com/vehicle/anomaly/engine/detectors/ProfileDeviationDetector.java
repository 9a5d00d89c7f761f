package com.vehicle.anomaly.engine.detectors;

import com.vehicle.anomaly.engine.AnomalyDetector;
import com.vehicle.anomaly.engine.DetectionContext;
import com.vehicle.anomaly.engine.DetectorOutcome;
import com.vehicle.anomaly.model.AnomalyResult;
import com.vehicle.anomaly.model.AnomalyType;
import com.vehicle.anomaly.model.BaselineStats;
import com.vehicle.anomaly.model.Severity;
import com.vehicle.anomaly.model.TelemetrySample;
import com.vehicle.anomaly.model.VehicleBaselineProfile;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Compares readings with the vehicle's own historical baseline. A reading
 * further than two standard deviations from the baseline mean is flagged.
 */
@Component
public class ProfileDeviationDetector implements AnomalyDetector {

    static final double TOLERANCE_STDS = 2.0;
    static final double MEDIUM_RATIO = 1.5;
    static final double PROFILE_CONFIDENCE = 0.75;

    @Override
    public AnomalyType getAnomalyType() {
        return AnomalyType.PROFILE;
    }

    @Override
    public DetectorOutcome detect(DetectionContext context) {
        return DetectorOutcome.ok(getAnomalyType(), evaluate(context.getVehicleId(), context.getSample(),
                context.getProfile(), context.getTimestamp()));
    }

    public List<AnomalyResult> evaluate(String vehicleId, TelemetrySample sample,
                                        VehicleBaselineProfile profile, Instant timestamp) {
        if (vehicleId == null || profile == null || !profile.hasBaseline()) {
            return Collections.emptyList();
        }

        List<AnomalyResult> results = new ArrayList<>();
        for (String parameter : sample.parameterNames()) {
            BaselineStats baseline = profile.getBaselineParameters().get(parameter);
            if (baseline == null) {
                continue;
            }
            double value = sample.get(parameter);
            double expected = baseline.getMean();
            double tolerance = TOLERANCE_STDS * baseline.getStd();
            double deviation = Math.abs(value - expected);
            if (tolerance <= 0.0 || deviation <= tolerance) {
                continue;
            }

            double ratio = deviation / tolerance;
            results.add(AnomalyResult.builder()
                    .parameterName(parameter)
                    .value(value)
                    .anomalyScore(Math.min(ratio / 2.0, 1.0))
                    .confidence(PROFILE_CONFIDENCE)
                    .severity(ratio < MEDIUM_RATIO ? Severity.LOW : Severity.MEDIUM)
                    .anomalyType(AnomalyType.PROFILE)
                    .description(String.format("%s deviates from vehicle baseline (expected: %.1f)",
                            parameter, expected))
                    .recommendedAction("Compare with historical " + ParameterNames.humanize(parameter) + " values")
                    .timestamp(timestamp)
                    .build());
        }
        return results;
    }
}
