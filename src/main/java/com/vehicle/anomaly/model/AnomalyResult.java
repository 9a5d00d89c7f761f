package com.vehicle.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A single finding emitted by one detector for one parameter.
 * Results are only created for anomalous evaluations, so {@code anomaly} is always true.
 */
@Value
@Builder
public class AnomalyResult {

    String parameterName;

    double value;

    // Detector-specific magnitude, see the producing detector
    double anomalyScore;

    @Builder.Default
    boolean anomaly = true;

    // 0.0 - 1.0
    double confidence;

    Severity severity;

    AnomalyType anomalyType;

    String description;

    String recommendedAction;

    Instant timestamp;
}
