package com.vehicle.anomaly.engine.isolationforest;

import com.vehicle.anomaly.model.TelemetrySample;

import java.util.List;

/**
 * Builds the 8-dimensional feature vector the statistical models were trained on.
 *
 * Order is fixed and must match training:
 *   [0] ENGINE_RPM
 *   [1] COOLANT_TEMP
 *   [2] ENGINE_LOAD
 *   [3] SPEED
 *   [4] OIL_PRESSURE
 *   [5] TRANS_TEMP
 *   [6] AIR_PRESSURE_FL
 *   [7] AIR_PRESSURE_FR
 * A parameter missing from the sample contributes 0.0.
 */
public final class FeatureExtractor {

    public static final List<String> FEATURE_NAMES = List.of(
            "ENGINE_RPM",
            "COOLANT_TEMP",
            "ENGINE_LOAD",
            "SPEED",
            "OIL_PRESSURE",
            "TRANS_TEMP",
            "AIR_PRESSURE_FL",
            "AIR_PRESSURE_FR"
    );

    public static final int FEATURE_COUNT = FEATURE_NAMES.size();

    private static final double MISSING_VALUE = 0.0;

    private FeatureExtractor() {}

    public static double[] extract(TelemetrySample sample) {
        double[] features = new double[FEATURE_COUNT];
        for (int i = 0; i < FEATURE_COUNT; i++) {
            features[i] = sample.getOrDefault(FEATURE_NAMES.get(i), MISSING_VALUE);
        }
        return features;
    }
}
