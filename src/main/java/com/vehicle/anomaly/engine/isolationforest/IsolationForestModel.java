package com.vehicle.anomaly.engine.isolationforest;

/**
 * Adapts an {@link IsolationForest} to the outlier-model contract using the
 * scikit-learn convention the models were exported with:
 * decision = -s(x) - offset, outlier when decision &lt; 0.
 * With the default offset of -0.5 a point is an outlier once s(x) exceeds 0.5.
 */
public class IsolationForestModel implements AnomalyModel {

    public static final double DEFAULT_OFFSET = -0.5;

    private final IsolationForest forest;
    private final double offset;

    public IsolationForestModel(IsolationForest forest) {
        this(forest, DEFAULT_OFFSET);
    }

    public IsolationForestModel(IsolationForest forest, double offset) {
        if (forest == null || forest.getTrees() == null || forest.getTrees().isEmpty()) {
            throw new IllegalArgumentException("Isolation forest has no trees");
        }
        if (forest.getFeatureCount() != 0 && forest.getFeatureCount() != FeatureExtractor.FEATURE_COUNT) {
            throw new IllegalArgumentException(String.format(
                    "Forest was trained on %d features, detector supplies %d",
                    forest.getFeatureCount(), FeatureExtractor.FEATURE_COUNT));
        }
        this.forest = forest;
        this.offset = offset;
    }

    @Override
    public double decisionFunction(double[] features) {
        return -forest.anomalyScore(features) - offset;
    }

    @Override
    public int predict(double[] features) {
        return decisionFunction(features) < 0 ? OUTLIER : INLIER;
    }

    public IsolationForest getForest() {
        return forest;
    }
}
