package com.signal.anomaly.engine.isolationforest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Isolation Forest over scalar samples. Built fresh for every window; nothing is
 * kept between fits.
 */
public class IsolationForest {

    private List<IsolationTree> trees = new ArrayList<>();
    private int sampleSize;

    /**
     * Train the isolation forest on the given data.
     *
     * @param data       training samples
     * @param numTrees   number of trees in the forest (typically 100)
     * @param sampleSize sub-sampling size per tree (typically 256)
     * @param seed       random seed for reproducibility
     */
    public void fit(double[] data, int numTrees, int sampleSize, long seed) {
        this.sampleSize = Math.min(sampleSize, data.length);
        int maxDepth = (int) Math.ceil(Math.log(this.sampleSize) / Math.log(2));
        this.trees = new ArrayList<>(numTrees);

        Random random = new Random(seed);

        for (int i = 0; i < numTrees; i++) {
            double[] sample = subsample(data, this.sampleSize, random);
            trees.add(IsolationTree.build(sample, maxDepth, random));
        }
    }

    /**
     * Compute anomaly score for a single value.
     *
     * @return score between 0.0 (normal) and 1.0 (anomalous)
     */
    public double anomalyScore(double value) {
        if (trees.isEmpty()) return 0.0;

        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(value);
        }
        avgPathLength /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;

        // s(x, n) = 2^(-E(h(x)) / c(n))
        return Math.pow(2.0, -avgPathLength / c);
    }

    public double[] anomalyScores(double[] values) {
        double[] scores = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scores[i] = anomalyScore(values[i]);
        }
        return scores;
    }

    private double[] subsample(double[] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        double[] sample = new double[size];
        // Partial Fisher-Yates shuffle on indices
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    public int getTreeCount() { return trees.size(); }
    public int getSampleSize() { return sampleSize; }
}
