package com.signal.anomaly.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger activeRuns;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.activeRuns = registry.gauge("detection.active.runs", new AtomicInteger(0));
    }

    public void recordRunStarted() {
        activeRuns.incrementAndGet();
    }

    public void recordRunFinished(double anomalyRatio) {
        activeRuns.decrementAndGet();
        DistributionSummary.builder("detection.run.anomaly_ratio")
                .register(registry)
                .record(anomalyRatio);
    }

    public void recordWindowScored(String phase) {
        Counter.builder("detection.window.scored")
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    public void recordWindowFailed(String phase) {
        Counter.builder("detection.window.failed")
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    public void recordVerdicts(long normal, long anomalous) {
        Counter.builder("detection.verdict.count")
                .tag("anomaly", "false")
                .register(registry)
                .increment(normal);
        Counter.builder("detection.verdict.count")
                .tag("anomaly", "true")
                .register(registry)
                .increment(anomalous);
    }

    public void recordEvictedWithoutVerdict(long count) {
        Counter.builder("detection.sample.evicted")
                .register(registry)
                .increment(count);
    }
}
