package com.signal.anomaly.engine.isolationforest;

import java.util.Random;

public class IsolationTree {

    private final IsolationNode root;

    public IsolationTree(IsolationNode root) {
        this.root = root;
    }

    public static IsolationTree build(double[] data, int maxDepth, Random random) {
        return new IsolationTree(buildNode(data, 0, maxDepth, random));
    }

    private static IsolationNode buildNode(double[] data, int depth, int maxDepth, Random random) {
        int n = data.length;

        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.externalNode(n);
        }

        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double v : data) {
            if (v < min) min = v;
            if (v > max) max = v;
        }

        // Nothing left to separate
        if (min >= max) {
            return IsolationNode.externalNode(n);
        }

        double splitValue = min + random.nextDouble() * (max - min);

        int leftCount = 0;
        for (double v : data) {
            if (v < splitValue) leftCount++;
        }

        double[] leftData = new double[leftCount];
        double[] rightData = new double[n - leftCount];
        int li = 0, ri = 0;
        for (double v : data) {
            if (v < splitValue) {
                leftData[li++] = v;
            } else {
                rightData[ri++] = v;
            }
        }

        IsolationNode left = buildNode(leftData, depth + 1, maxDepth, random);
        IsolationNode right = buildNode(rightData, depth + 1, maxDepth, random);

        return IsolationNode.internalNode(splitValue, left, right);
    }

    public double pathLength(double value) {
        return root.pathLength(value, 0);
    }

    public IsolationNode getRoot() { return root; }
}
