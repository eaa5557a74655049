package com.signal.anomaly.sink;

import com.signal.anomaly.model.DetectionSummary;
import com.signal.anomaly.model.Verdict;

import java.util.List;

/**
 * Downstream consumer of the verdict stream. Batches arrive in stream order, each
 * one non-empty; {@link #complete} is called once after the final flush.
 */
public interface VerdictSink {

    void accept(List<Verdict> batch);

    default void complete(DetectionSummary summary) {
    }
}
