package com.signal.anomaly.engine;

/**
 * Port to a batch outlier model. Each call is an independent fit-and-score over the
 * given samples; no state is carried between calls.
 */
public interface OutlierScorer {

    /**
     * Fit on the batch and classify every sample of it.
     *
     * @param samples batch in window order
     * @return one flag per sample, index-aligned with {@code samples}; {@code true} = outlier
     * @throws ScoringException if the batch is smaller than {@link #minBatchSize()}
     *                          or cannot be scored
     */
    boolean[] score(double[] samples);

    /**
     * Smallest batch this scorer accepts.
     */
    int minBatchSize();
}
