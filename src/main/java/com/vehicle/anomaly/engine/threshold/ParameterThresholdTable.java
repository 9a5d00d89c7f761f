package com.vehicle.anomaly.engine.threshold;

import com.vehicle.anomaly.config.DetectionConfig;
import com.vehicle.anomaly.config.DetectionConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable per-parameter threshold configuration, validated once at start-up.
 */
@Component
public class ParameterThresholdTable {

    private static final Logger log = LoggerFactory.getLogger(ParameterThresholdTable.class);

    private final Map<String, ParameterThreshold> thresholds;

    @Autowired
    public ParameterThresholdTable(DetectionConfig config) {
        this(config.getThresholds());
    }

    public ParameterThresholdTable(Map<String, DetectionConfig.ThresholdProperties> properties) {
        if (properties == null) {
            throw new DetectionConfigException("Threshold table is missing");
        }
        Map<String, ParameterThreshold> table = new LinkedHashMap<>();
        for (Map.Entry<String, DetectionConfig.ThresholdProperties> entry : properties.entrySet()) {
            table.put(entry.getKey(), validate(entry.getKey(), entry.getValue()));
        }
        this.thresholds = Collections.unmodifiableMap(table);
        log.info("Loaded thresholds for {} parameters: {}", table.size(), table.keySet());
    }

    public ParameterThreshold get(String parameter) {
        return thresholds.get(parameter);
    }

    public boolean contains(String parameter) {
        return thresholds.containsKey(parameter);
    }

    public Map<String, ParameterThreshold> asMap() {
        return thresholds;
    }

    private static ParameterThreshold validate(String parameter, DetectionConfig.ThresholdProperties p) {
        if (parameter == null || parameter.isBlank()) {
            throw new DetectionConfigException("Threshold entry with blank parameter name");
        }
        if (p == null) {
            throw new DetectionConfigException("Threshold for " + parameter + " has no values");
        }
        double min = required(parameter, "min", p.getMin());
        double max = required(parameter, "max", p.getMax());
        double optimalMin = required(parameter, "optimal-min", p.getOptimalMin());
        double optimalMax = required(parameter, "optimal-max", p.getOptimalMax());

        if (min >= max) {
            throw new DetectionConfigException(String.format(
                    "Threshold for %s: min (%s) must be below max (%s)", parameter, min, max));
        }
        if (optimalMin >= optimalMax) {
            throw new DetectionConfigException(String.format(
                    "Threshold for %s: optimal range [%s, %s] is empty", parameter, optimalMin, optimalMax));
        }
        if (optimalMin < min || optimalMax > max) {
            throw new DetectionConfigException(String.format(
                    "Threshold for %s: optimal range [%s, %s] is not inside [%s, %s]",
                    parameter, optimalMin, optimalMax, min, max));
        }
        return new ParameterThreshold(min, max, optimalMin, optimalMax);
    }

    private static double required(String parameter, String field, Double value) {
        if (value == null || !Double.isFinite(value)) {
            throw new DetectionConfigException(
                    "Threshold for " + parameter + " is missing a finite '" + field + "'");
        }
        return value;
    }
}
