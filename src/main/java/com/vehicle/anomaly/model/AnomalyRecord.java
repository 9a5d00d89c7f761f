package com.vehicle.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted form of an {@link AnomalyResult}, tagged with the session it was detected in.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyRecord {

    private String recordId;

    private String sessionId;

    // null for calls without a vehicle id
    private String vehicleId;

    private String parameterName;

    private double value;

    private double anomalyScore;

    private double confidence;

    private Severity severity;

    private AnomalyType anomalyType;

    // "<type>: <description>"
    private String description;

    private String recommendedAction;

    // epoch millis
    private long timestamp;

    public static AnomalyRecord from(String sessionId, String vehicleId, AnomalyResult result) {
        return AnomalyRecord.builder()
                .sessionId(sessionId)
                .vehicleId(vehicleId)
                .parameterName(result.getParameterName())
                .value(result.getValue())
                .anomalyScore(result.getAnomalyScore())
                .confidence(result.getConfidence())
                .severity(result.getSeverity())
                .anomalyType(result.getAnomalyType())
                .description(result.getAnomalyType().code() + ": " + result.getDescription())
                .recommendedAction(result.getRecommendedAction())
                .timestamp(result.getTimestamp().toEpochMilli())
                .build();
    }
}
