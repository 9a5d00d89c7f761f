package com.vehicle.anomaly.engine.isolationforest;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IsolationForestModelTest {

    private static IsolationForest forest;

    @BeforeAll
    static void trainForest() {
        forest = new IsolationForest();
        forest.train(normalOperation(1000, new Random(7)), 100, 256, 42L);
    }

    @Test
    void predict_typicalReading_inlier() {
        IsolationForestModel model = new IsolationForestModel(forest);
        double[] typical = {2000, 90, 40, 80, 4.0, 90, 12.0, 12.0};

        assertThat(model.decisionFunction(typical)).isPositive();
        assertThat(model.predict(typical)).isEqualTo(AnomalyModel.INLIER);
    }

    @Test
    void predict_farOutsideTrainingData_outlier() {
        IsolationForestModel model = new IsolationForestModel(forest);
        double[] extreme = {7500, 130, 99, 10, 0.5, 140, 4.0, 20.0};

        assertThat(model.decisionFunction(extreme)).isNegative();
        assertThat(model.predict(extreme)).isEqualTo(AnomalyModel.OUTLIER);
    }

    @Test
    void decisionFunction_isNegatedScoreMinusOffset() {
        IsolationForestModel model = new IsolationForestModel(forest, -0.6);
        double[] point = {2000, 90, 40, 80, 4.0, 90, 12.0, 12.0};

        assertThat(model.decisionFunction(point)).isEqualTo(-forest.anomalyScore(point) + 0.6);
    }

    @Test
    void training_isReproducibleForSameSeed() {
        IsolationForest again = new IsolationForest();
        again.train(normalOperation(1000, new Random(7)), 100, 256, 42L);
        double[] point = {3000, 95, 60, 120, 3.0, 95, 11.0, 13.0};

        assertThat(again.anomalyScore(point)).isEqualTo(forest.anomalyScore(point));
    }

    @Test
    void constructor_forestWithoutTrees_rejected() {
        assertThatThrownBy(() -> new IsolationForestModel(new IsolationForest()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_forestWithOtherFeatureCount_rejected() {
        IsolationForest threeFeatures = new IsolationForest();
        threeFeatures.train(new double[][]{{1, 2, 3}, {2, 3, 4}, {3, 4, 5}}, 5, 3, 1L);

        assertThatThrownBy(() -> new IsolationForestModel(threeFeatures))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("3 features");
    }

    @Test
    void anomalyScore_wrongDimension_rejected() {
        assertThatThrownBy(() -> forest.anomalyScore(new double[]{1, 2}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void train_emptyData_rejected() {
        assertThatThrownBy(() -> new IsolationForest().train(new double[0][], 10, 256, 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    static double[][] normalOperation(int n, Random random) {
        double[] mean = {2000, 90, 40, 80, 4.0, 90, 12.0, 12.0};
        double[] spread = {300, 3, 10, 20, 0.5, 4, 0.5, 0.5};
        double[][] data = new double[n][mean.length];
        for (int i = 0; i < n; i++) {
            for (int f = 0; f < mean.length; f++) {
                data[i][f] = mean[f] + random.nextGaussian() * spread[f];
            }
        }
        return data;
    }
}
