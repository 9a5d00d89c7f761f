package com.vehicle.anomaly.config;

import com.vehicle.anomaly.engine.rules.RuleCondition;
import com.vehicle.anomaly.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables for the detection engine. Threshold table and contextual rules
 * default to the W222 calibration; map keys must be written in bracket
 * notation in application.yml (e.g. {@code thresholds.[ENGINE_RPM].max}) to
 * keep their case.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "telemetry.detection")
public class DetectionConfig {

    private History history = new History();

    private PatternAnalysis pattern = new PatternAnalysis();

    private Models models = new Models();

    private Persistence persistence = new Persistence();

    private Map<String, ThresholdProperties> thresholds = defaultThresholds();

    private List<RuleProperties> contextualRules = defaultContextualRules();

    @Data
    public static class History {
        // Samples kept per session before the oldest is evicted
        private int bufferSize = 100;

        // Buffers whose newest sample is older than this are swept
        private int sessionTtlHours = 24;

        private int cleanupIntervalMinutes = 30;
    }

    @Data
    public static class PatternAnalysis {
        // Minimum session buffer length (current sample included)
        private int minHistory = 10;

        // Minimum reference points per parameter
        private int minPoints = 5;

        private double zScoreThreshold = 3.0;

        // z at or above this is HIGH, below is MEDIUM
        private double highZScore = 4.0;
    }

    @Data
    public static class Models {
        // Directory scanned once at start-up for *.json model files
        private String directory = "models";

        // Only models whose name contains this (case-insensitive) are scored
        private String nameFilter = "anomaly";

        // Per-call budget for decisionFunction + predict
        private long timeoutMs = 250;

        // Upper bound on threads running model calls, shared by all sessions
        private int scoringThreads = 4;
    }

    @Data
    public static class Persistence {
        // Aerospike record TTL for anomaly records, -1 = namespace default
        private int anomalyRecordTtlDays = 30;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ThresholdProperties {
        private Double min;
        private Double max;
        private Double optimalMin;
        private Double optimalMax;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RuleProperties {
        private String name;
        private String primaryParameter;
        private Severity severity;
        private String description;
        private String action;
        private List<ConditionProperties> conditions = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConditionProperties {
        private String parameter;
        private RuleCondition.Operator operator;
        private Double value;
        // Second operand of ABS_DIFFERENCE_GREATER_THAN
        private String otherParameter;
    }

    public static Map<String, ThresholdProperties> defaultThresholds() {
        Map<String, ThresholdProperties> t = new LinkedHashMap<>();
        t.put("ENGINE_RPM", new ThresholdProperties(600.0, 6500.0, 800.0, 4000.0));
        t.put("COOLANT_TEMP", new ThresholdProperties(70.0, 110.0, 85.0, 95.0));
        t.put("ENGINE_LOAD", new ThresholdProperties(0.0, 100.0, 10.0, 80.0));
        t.put("SPEED", new ThresholdProperties(0.0, 250.0, 0.0, 180.0));
        t.put("OIL_PRESSURE", new ThresholdProperties(1.5, 8.0, 2.5, 6.0));
        t.put("TRANS_TEMP", new ThresholdProperties(60.0, 120.0, 80.0, 100.0));
        t.put("AIR_PRESSURE_FL", new ThresholdProperties(8.0, 16.0, 10.0, 14.0));
        t.put("AIR_PRESSURE_FR", new ThresholdProperties(8.0, 16.0, 10.0, 14.0));
        t.put("FUEL_LEVEL", new ThresholdProperties(0.0, 100.0, 10.0, 90.0));
        return t;
    }

    public static List<RuleProperties> defaultContextualRules() {
        List<RuleProperties> rules = new ArrayList<>();
        rules.add(new RuleProperties("high_rpm_low_speed", "ENGINE_RPM", Severity.MEDIUM,
                "High RPM at low speed - possible transmission issue or aggressive driving",
                "Check transmission fluid and driving patterns",
                new ArrayList<>(List.of(
                        condition("ENGINE_RPM", RuleCondition.Operator.GREATER_THAN, 3000.0),
                        condition("SPEED", RuleCondition.Operator.LESS_THAN, 30.0)))));
        rules.add(new RuleProperties("high_temp_normal_load", "COOLANT_TEMP", Severity.HIGH,
                "High coolant temperature with normal load - possible cooling system issue",
                "Check cooling system, thermostat, and coolant levels",
                new ArrayList<>(List.of(
                        condition("COOLANT_TEMP", RuleCondition.Operator.GREATER_THAN, 100.0),
                        condition("ENGINE_LOAD", RuleCondition.Operator.LESS_THAN, 50.0)))));
        rules.add(new RuleProperties("low_oil_pressure", "OIL_PRESSURE", Severity.CRITICAL,
                "Low oil pressure at operating RPM - immediate attention required",
                "Stop engine immediately and check oil level and pump",
                new ArrayList<>(List.of(
                        condition("OIL_PRESSURE", RuleCondition.Operator.LESS_THAN, 2.0),
                        condition("ENGINE_RPM", RuleCondition.Operator.GREATER_THAN, 1000.0)))));
        rules.add(new RuleProperties("air_suspension_imbalance", "AIR_PRESSURE_FL", Severity.MEDIUM,
                "Air suspension pressure imbalance detected",
                "Check air suspension system and struts",
                new ArrayList<>(List.of(
                        new ConditionProperties("AIR_PRESSURE_FL",
                                RuleCondition.Operator.ABS_DIFFERENCE_GREATER_THAN, 2.0, "AIR_PRESSURE_FR")))));
        rules.add(new RuleProperties("transmission_overheating", "TRANS_TEMP", Severity.HIGH,
                "Transmission overheating detected",
                "Reduce load and check transmission cooling system",
                new ArrayList<>(List.of(
                        condition("TRANS_TEMP", RuleCondition.Operator.GREATER_THAN, 110.0)))));
        return rules;
    }

    private static ConditionProperties condition(String parameter, RuleCondition.Operator operator, double value) {
        return new ConditionProperties(parameter, operator, value, null);
    }
}
