package com.signal.anomaly.engine;

import com.signal.anomaly.model.Sample;
import com.signal.anomaly.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Sliding-window anomaly detector.
 *
 * Samples are buffered until the window holds {@code windowSize} of them. Every full
 * window is scored from scratch by the {@link OutlierScorer}; verdicts are emitted for
 * the samples of that window that have not been emitted before, then the oldest
 * {@code slideSize} samples are evicted. The remaining {@code windowSize - slideSize}
 * samples stay as context for the next window.
 *
 * In steady state this emits positions {@code [W-S, W)} of each window. The first full
 * window emits all of {@code [0, W)}, since none of it has been emitted yet.
 *
 * Each sample receives at most one verdict and verdicts come out in strictly
 * increasing stream index. A sample can only go without a verdict if a scoring
 * failure held the window back long enough for it to be pushed out.
 *
 * The last {@code minBatchSize - 1} slid-out samples are retained as context for the
 * final flush only, so a short tail (e.g. one sample after a full slide) still forms
 * a batch the scorer accepts. They are never emitted twice.
 *
 * Not thread-safe: one instance per stream, driven by a single caller.
 */
public class WindowedAnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(WindowedAnomalyDetector.class);

    public static final int MAX_WINDOW_SIZE = 100_000;

    private final int windowSize;
    private final int slideSize;
    private final OutlierScorer scorer;
    private final int minBatchSize;

    private final Deque<Sample> buffer = new ArrayDeque<>();
    // Already-emitted samples slid out of the window, newest last. Flush context only.
    private final Deque<Sample> retired = new ArrayDeque<>();
    private long nextIndex;

    // Every index below this has either been emitted or evicted.
    private long emittedWatermark;

    private long emittedCount;
    private long evictedWithoutVerdictCount;
    private boolean closed;

    public WindowedAnomalyDetector(int windowSize, int slideSize, OutlierScorer scorer) {
        if (windowSize < 1 || windowSize > MAX_WINDOW_SIZE) {
            throw new DetectionConfigurationException("windowSize",
                    "windowSize must be in [1, " + MAX_WINDOW_SIZE + "], got " + windowSize);
        }
        if (slideSize < 1 || slideSize > windowSize) {
            throw new DetectionConfigurationException("slideSize",
                    "slideSize must be in [1, windowSize=" + windowSize + "], got " + slideSize);
        }
        if (scorer == null) {
            throw new DetectionConfigurationException("scorer", "scorer must not be null");
        }
        if (windowSize < scorer.minBatchSize()) {
            throw new DetectionConfigurationException("windowSize",
                    "windowSize must be >= the scorer's minimum batch of " + scorer.minBatchSize()
                            + ", got " + windowSize);
        }
        this.windowSize = windowSize;
        this.slideSize = slideSize;
        this.scorer = scorer;
        this.minBatchSize = Math.max(1, scorer.minBatchSize());
    }

    /**
     * Add one value to the stream.
     *
     * @return verdicts released by this call, in stream order; empty while the window
     *         is still filling
     * @throws ScoringException if the window could not be scored. Nothing is emitted
     *                          and the window is not slid; the next call retries.
     */
    public List<Verdict> ingest(double value) {
        if (closed) {
            throw new IllegalStateException("Detector has been flushed and no longer accepts samples");
        }

        buffer.addLast(new Sample(nextIndex++, value));
        if (buffer.size() < windowSize) {
            return Collections.emptyList();
        }

        while (buffer.size() > windowSize) {
            evictOldest();
        }

        List<Verdict> verdicts = scoreAndReconcile(new ArrayList<>(buffer));

        for (int i = 0; i < slideSize; i++) {
            retire(buffer.removeFirst());
        }
        return verdicts;
    }

    /**
     * Drain the buffer at end of stream or on early termination. The remaining buffer
     * (possibly shorter than a window) is scored once and every sample not yet emitted
     * gets its verdict. A buffer below the scorer's minimum batch is topped up with the
     * most recent retired samples. After a successful flush the detector is closed and further
     * flushes return an empty list.
     *
     * @throws ScoringException if the final batch could not be scored; the detector
     *                          stays open with its buffer intact
     */
    public List<Verdict> flush() {
        if (closed) {
            return Collections.emptyList();
        }

        List<Verdict> verdicts = hasPending() ? scoreAndReconcile(flushBatch()) : Collections.emptyList();

        buffer.clear();
        retired.clear();
        closed = true;
        log.debug("Detector flushed: {} final verdicts, {} emitted in total", verdicts.size(), emittedCount);
        return verdicts;
    }

    private boolean hasPending() {
        return !buffer.isEmpty() && buffer.peekLast().index() >= emittedWatermark;
    }

    private List<Sample> flushBatch() {
        List<Sample> batch = new ArrayList<>(buffer);
        Iterator<Sample> context = retired.descendingIterator();
        while (batch.size() < minBatchSize && context.hasNext()) {
            batch.add(0, context.next());
        }
        return batch;
    }

    private void retire(Sample sample) {
        if (minBatchSize <= 1) {
            return;
        }
        retired.addLast(sample);
        while (retired.size() > minBatchSize - 1) {
            retired.removeFirst();
        }
    }

    private void evictOldest() {
        Sample evicted = buffer.removeFirst();
        if (evicted.index() >= emittedWatermark) {
            evictedWithoutVerdictCount++;
            emittedWatermark = evicted.index() + 1;
            log.warn("Sample {} left the window without a verdict after earlier scoring failures",
                    evicted.index());
        }
    }

    private List<Verdict> scoreAndReconcile(List<Sample> batch) {
        double[] values = new double[batch.size()];
        int pos = 0;
        for (Sample sample : batch) {
            values[pos++] = sample.value();
        }

        boolean[] outliers = scorer.score(values);
        if (outliers == null || outliers.length != values.length) {
            throw new ScoringException(String.format("Scorer returned %s flags for a batch of %d",
                    outliers == null ? "no" : String.valueOf(outliers.length), values.length));
        }

        List<Verdict> verdicts = new ArrayList<>();
        pos = 0;
        for (Sample sample : batch) {
            if (sample.index() >= emittedWatermark) {
                verdicts.add(Verdict.of(sample, outliers[pos]));
            }
            pos++;
        }

        if (!verdicts.isEmpty()) {
            emittedWatermark = verdicts.get(verdicts.size() - 1).getIndex() + 1;
            emittedCount += verdicts.size();
        }
        return verdicts;
    }

    public int getWindowSize() { return windowSize; }
    public int getSlideSize() { return slideSize; }
    public int getBufferedCount() { return buffer.size(); }
    public long getIngestedCount() { return nextIndex; }
    public long getEmittedCount() { return emittedCount; }
    public long getEvictedWithoutVerdictCount() { return evictedWithoutVerdictCount; }

    /**
     * Buffered samples that have not been given a verdict yet.
     */
    public long getPendingCount() {
        return buffer.stream().filter(s -> s.index() >= emittedWatermark).count();
    }

    public boolean isClosed() { return closed; }
}
