package com.vehicle.anomaly.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One snapshot of named telemetry readings taken at a single point in time.
 *
 * Readings keep the producer's insertion order, which matters for the
 * detectors that fall back to "the first parameter" or break ties by order.
 * Null and non-finite readings are dropped on construction and behave exactly
 * like parameters the producer never sent.
 */
public final class TelemetrySample {

    private static final TelemetrySample EMPTY = new TelemetrySample(Collections.emptyMap());

    private final Map<String, Double> readings;

    private TelemetrySample(Map<String, Double> readings) {
        this.readings = readings;
    }

    public static TelemetrySample of(Map<String, ? extends Number> readings) {
        Objects.requireNonNull(readings, "readings");
        Map<String, Double> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Number> entry : readings.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            double value = entry.getValue().doubleValue();
            if (Double.isFinite(value)) {
                copy.put(entry.getKey(), value);
            }
        }
        return new TelemetrySample(Collections.unmodifiableMap(copy));
    }

    public static TelemetrySample empty() {
        return EMPTY;
    }

    public boolean has(String parameter) {
        return readings.containsKey(parameter);
    }

    /**
     * @throws IllegalArgumentException if the parameter is not part of this sample
     */
    public double get(String parameter) {
        Double value = readings.get(parameter);
        if (value == null) {
            throw new IllegalArgumentException("Parameter not present in sample: " + parameter);
        }
        return value;
    }

    /**
     * Only the statistical feature assembly substitutes defaults for missing
     * readings. Every other detector checks {@link #has(String)} and skips.
     */
    public double getOrDefault(String parameter, double defaultValue) {
        return readings.getOrDefault(parameter, defaultValue);
    }

    public Set<String> parameterNames() {
        return readings.keySet();
    }

    public Map<String, Double> asMap() {
        return readings;
    }

    public int size() {
        return readings.size();
    }

    public boolean isEmpty() {
        return readings.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TelemetrySample)) return false;
        return readings.equals(((TelemetrySample) o).readings);
    }

    @Override
    public int hashCode() {
        return readings.hashCode();
    }

    @Override
    public String toString() {
        return "TelemetrySample" + readings;
    }
}
