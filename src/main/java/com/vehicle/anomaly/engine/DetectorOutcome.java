package com.vehicle.anomaly.engine;

import com.vehicle.anomaly.model.AnomalyResult;
import com.vehicle.anomaly.model.AnomalyType;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * Result of running one detector: either its (possibly empty) list of
 * anomalies, or the reason it could not evaluate. Both contribute nothing
 * extra to the engine's output, but they stay distinguishable for logs,
 * metrics and tests.
 */
@ToString
@EqualsAndHashCode
public final class DetectorOutcome {

    private final AnomalyType anomalyType;
    private final List<AnomalyResult> anomalies;
    private final String failureReason;

    private DetectorOutcome(AnomalyType anomalyType, List<AnomalyResult> anomalies, String failureReason) {
        this.anomalyType = anomalyType;
        this.anomalies = anomalies;
        this.failureReason = failureReason;
    }

    public static DetectorOutcome ok(AnomalyType anomalyType, List<AnomalyResult> anomalies) {
        return new DetectorOutcome(anomalyType, List.copyOf(anomalies), null);
    }

    public static DetectorOutcome failed(AnomalyType anomalyType, String reason) {
        return new DetectorOutcome(anomalyType, Collections.emptyList(), reason);
    }

    public AnomalyType getAnomalyType() {
        return anomalyType;
    }

    public boolean isFailed() {
        return failureReason != null;
    }

    /**
     * Empty for failed outcomes.
     */
    public List<AnomalyResult> getAnomalies() {
        return anomalies;
    }

    public String getFailureReason() {
        return failureReason;
    }
}
