package com.vehicle.anomaly.engine.isolationforest;

import java.util.Random;

public class IsolationTree {

    private IsolationNode root;

    public IsolationTree() {}

    public IsolationTree(IsolationNode root) {
        this.root = root;
    }

    static IsolationTree grow(double[][] points, int heightLimit, Random random) {
        return new IsolationTree(grow(points, 0, heightLimit, random));
    }

    private static IsolationNode grow(double[][] points, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || points.length <= 1) {
            return IsolationNode.leaf(points.length);
        }

        int feature = random.nextInt(points[0].length);
        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (double[] p : points) {
            lo = Math.min(lo, p[feature]);
            hi = Math.max(hi, p[feature]);
        }
        // Constant along the chosen feature: cannot isolate further
        if (lo >= hi) {
            return IsolationNode.leaf(points.length);
        }

        double threshold = lo + random.nextDouble() * (hi - lo);
        int below = 0;
        for (double[] p : points) {
            if (p[feature] < threshold) below++;
        }
        double[][] left = new double[below][];
        double[][] right = new double[points.length - below][];
        int li = 0;
        int ri = 0;
        for (double[] p : points) {
            if (p[feature] < threshold) {
                left[li++] = p;
            } else {
                right[ri++] = p;
            }
        }

        return IsolationNode.split(feature, threshold,
                grow(left, depth + 1, heightLimit, random),
                grow(right, depth + 1, heightLimit, random));
    }

    public double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }

    public IsolationNode getRoot() { return root; }
    public void setRoot(IsolationNode root) { this.root = root; }
}
