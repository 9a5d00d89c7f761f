package com.vehicle.anomaly.engine.isolationforest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest (Liu, Ting and Zhou, 2008). Training is only used to
 * produce model files and fixtures; the detection engine loads finished
 * forests from disk and scores them.
 */
public class IsolationForest {

    private List<IsolationTree> trees = new ArrayList<>();
    private int sampleSize;
    private int featureCount;

    public IsolationForest() {}

    /**
     * Grow {@code numTrees} trees, each on a random sub-sample of {@code data}.
     *
     * @param data       training vectors, all of the same length
     * @param numTrees   number of trees (typically 100)
     * @param sampleSize points per tree (typically 256)
     * @param seed       random seed, fixed for reproducible forests
     */
    public void train(double[][] data, int numTrees, int sampleSize, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train on an empty data set");
        }
        this.featureCount = data[0].length;
        this.sampleSize = Math.min(sampleSize, data.length);
        int heightLimit = (int) Math.ceil(Math.log(this.sampleSize) / Math.log(2));

        Random random = new Random(seed);
        List<IsolationTree> grown = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            grown.add(IsolationTree.grow(subsample(data, this.sampleSize, random), heightLimit, random));
        }
        this.trees = grown;
    }

    /**
     * s(x, n) = 2^(-E(h(x)) / c(n)). Close to 1.0 for points isolated early,
     * well below 0.5 for points deep inside the training distribution.
     *
     * @throws IllegalArgumentException if the point has the wrong dimension
     */
    public double anomalyScore(double[] point) {
        if (featureCount > 0 && point.length != featureCount) {
            throw new IllegalArgumentException(String.format(
                    "Expected %d features, got %d", featureCount, point.length));
        }
        if (trees.isEmpty()) return 0.0;

        double meanPath = 0.0;
        for (IsolationTree tree : trees) {
            meanPath += tree.pathLength(point);
        }
        meanPath /= trees.size();

        double normaliser = IsolationNode.averagePathLength(sampleSize);
        if (normaliser <= 0) return 0.0;
        return Math.pow(2.0, -meanPath / normaliser);
    }

    private static double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        // Partial Fisher-Yates over indices
        int[] idx = new int[data.length];
        for (int i = 0; i < idx.length; i++) idx[i] = i;
        double[][] picked = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(idx.length - i);
            int swap = idx[i];
            idx[i] = idx[j];
            idx[j] = swap;
            picked[i] = data[idx[i]];
        }
        return picked;
    }

    public List<IsolationTree> getTrees() { return trees; }
    public void setTrees(List<IsolationTree> trees) { this.trees = trees; }
    public int getSampleSize() { return sampleSize; }
    public void setSampleSize(int sampleSize) { this.sampleSize = sampleSize; }
    public int getFeatureCount() { return featureCount; }
    public void setFeatureCount(int featureCount) { this.featureCount = featureCount; }
}
