package com.signal.anomaly.sink;

import com.signal.anomaly.model.DetectionSummary;
import com.signal.anomaly.model.Verdict;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps every verdict in memory. Backs the REST responses and gives the full series
 * with its anomalies for plotting.
 */
public class CollectingVerdictSink implements VerdictSink {

    private final List<Verdict> verdicts = new ArrayList<>();
    private DetectionSummary summary;

    @Override
    public void accept(List<Verdict> batch) {
        verdicts.addAll(batch);
    }

    @Override
    public void complete(DetectionSummary summary) {
        this.summary = summary;
    }

    public List<Verdict> getVerdicts() {
        return Collections.unmodifiableList(verdicts);
    }

    public List<Verdict> getAnomalies() {
        return verdicts.stream().filter(Verdict::isAnomaly).toList();
    }

    public DetectionSummary getSummary() {
        return summary;
    }
}
