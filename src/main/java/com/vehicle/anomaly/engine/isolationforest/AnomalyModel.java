package com.vehicle.anomaly.engine.isolationforest;

/**
 * A pre-trained unsupervised outlier model, scored on the fixed feature
 * vector built by {@link FeatureExtractor}. Implementations must be immutable
 * and safe to call from several threads at once.
 */
public interface AnomalyModel {

    int OUTLIER = -1;
    int INLIER = 1;

    /**
     * Signed outlier score: negative for outliers, positive for inliers.
     */
    double decisionFunction(double[] features);

    /**
     * @return {@link #OUTLIER} or {@link #INLIER}
     */
    int predict(double[] features);
}
