package com.signal.anomaly.engine.isolationforest;

import com.signal.anomaly.engine.DetectionConfigurationException;
import com.signal.anomaly.engine.OutlierScorer;
import com.signal.anomaly.engine.ScoringException;

import java.util.Arrays;

/**
 * {@link OutlierScorer} backed by a freshly trained {@link IsolationForest}.
 *
 * Each batch is fit and scored on its own. A sample is flagged when its anomaly score
 * lies strictly above the {@code (1 - contamination)} quantile of the batch's scores,
 * so roughly a {@code contamination} share of a batch is flagged and a constant batch
 * is not flagged at all.
 */
public class IsolationForestScorer implements OutlierScorer {

    private final double contamination;
    private final int numTrees;
    private final int sampleSize;
    private final long seed;
    private final int minBatchSize;

    public IsolationForestScorer(double contamination, int numTrees, int sampleSize, long seed, int minBatchSize) {
        if (!(contamination > 0.0 && contamination <= 0.5)) {
            throw new DetectionConfigurationException("contamination",
                    "contamination must be in (0, 0.5], got " + contamination);
        }
        if (numTrees < 1) {
            throw new DetectionConfigurationException("numTrees", "numTrees must be >= 1, got " + numTrees);
        }
        if (sampleSize < 2) {
            throw new DetectionConfigurationException("sampleSize", "sampleSize must be >= 2, got " + sampleSize);
        }
        if (minBatchSize < 2) {
            throw new DetectionConfigurationException("minBatchSize",
                    "minBatchSize must be >= 2, got " + minBatchSize);
        }
        this.contamination = contamination;
        this.numTrees = numTrees;
        this.sampleSize = sampleSize;
        this.seed = seed;
        this.minBatchSize = minBatchSize;
    }

    @Override
    public boolean[] score(double[] samples) {
        if (samples == null || samples.length < minBatchSize) {
            throw new ScoringException(String.format("Batch of %d samples is below the minimum of %d",
                    samples == null ? 0 : samples.length, minBatchSize));
        }
        for (int i = 0; i < samples.length; i++) {
            if (!Double.isFinite(samples[i])) {
                throw new ScoringException("Non-finite value " + samples[i] + " at batch position " + i);
            }
        }

        IsolationForest forest = new IsolationForest();
        forest.fit(samples, numTrees, sampleSize, seed);
        double[] scores = forest.anomalyScores(samples);

        double threshold = quantile(scores, 1.0 - contamination);
        boolean[] outliers = new boolean[samples.length];
        for (int i = 0; i < scores.length; i++) {
            outliers[i] = scores[i] > threshold;
        }
        return outliers;
    }

    @Override
    public int minBatchSize() {
        return minBatchSize;
    }

    /**
     * Quantile with linear interpolation between closest ranks.
     */
    static double quantile(double[] values, double q) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double pos = q * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        if (lo == hi) return sorted[lo];
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (pos - lo);
    }

    public double getContamination() { return contamination; }
    public int getNumTrees() { return numTrees; }
    public int getSampleSize() { return sampleSize; }
    public long getSeed() { return seed; }
}
