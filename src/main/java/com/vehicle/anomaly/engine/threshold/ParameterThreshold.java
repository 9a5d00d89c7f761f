package com.vehicle.anomaly.engine.threshold;

import lombok.Value;

/**
 * Absolute and optimal operating range of one parameter.
 * Invariant (checked by {@link ParameterThresholdTable}):
 * min &lt; max, optimalMin &lt; optimalMax, [optimalMin, optimalMax] inside [min, max].
 */
@Value
public class ParameterThreshold {

    double min;
    double max;
    double optimalMin;
    double optimalMax;

    public boolean isWithinLimits(double value) {
        return value >= min && value <= max;
    }

    public boolean isWithinOptimalRange(double value) {
        return value >= optimalMin && value <= optimalMax;
    }
}
