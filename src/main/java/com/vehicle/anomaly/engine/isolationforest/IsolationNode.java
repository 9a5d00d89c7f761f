package com.vehicle.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Node of an isolation tree. Serialized with short property names to keep
 * model files small.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IsolationNode {

    private static final double EULER_GAMMA = 0.5772156649;

    @JsonProperty("f")
    private int feature;

    @JsonProperty("v")
    private double threshold;

    @JsonProperty("l")
    private IsolationNode left;

    @JsonProperty("r")
    private IsolationNode right;

    // training points that ended in this leaf
    @JsonProperty("s")
    private int leafSize;

    @JsonProperty("e")
    private boolean leaf;

    public IsolationNode() {}

    static IsolationNode split(int feature, double threshold, IsolationNode left, IsolationNode right) {
        IsolationNode node = new IsolationNode();
        node.feature = feature;
        node.threshold = threshold;
        node.left = left;
        node.right = right;
        return node;
    }

    static IsolationNode leaf(int size) {
        IsolationNode node = new IsolationNode();
        node.leafSize = size;
        node.leaf = true;
        return node;
    }

    double pathLength(double[] point, int depth) {
        IsolationNode node = this;
        while (!node.leaf) {
            node = point[node.feature] < node.threshold ? node.left : node.right;
            depth++;
        }
        return depth + averagePathLength(node.leafSize);
    }

    /**
     * Expected path length of an unsuccessful BST search over n points:
     * c(n) = 2H(n-1) - 2(n-1)/n, with H(i) approximated by ln(i) + Euler's constant.
     */
    public static double averagePathLength(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    public int getFeature() { return feature; }
    public double getThreshold() { return threshold; }
    public IsolationNode getLeft() { return left; }
    public IsolationNode getRight() { return right; }
    public int getLeafSize() { return leafSize; }
    public boolean isLeaf() { return leaf; }
}
