package com.vehicle.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalySummary {

    private String sessionId;

    private int timePeriodHours;

    private int totalAnomalies;

    // keyed by Severity.code(), every severity present
    @Builder.Default
    private Map<String, Integer> severityBreakdown = new LinkedHashMap<>();

    // keyed by AnomalyType.code(), every type present
    @Builder.Default
    private Map<String, Integer> anomalyTypes = new LinkedHashMap<>();

    @Builder.Default
    private List<ParameterCount> mostAffectedParameters = new ArrayList<>();

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    public record ParameterCount(String parameterName, int count) {}
}
