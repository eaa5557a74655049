package com.signal.anomaly.runner;

import com.signal.anomaly.config.DetectionConfig;
import com.signal.anomaly.model.DetectionSettings;
import com.signal.anomaly.model.DetectionSummary;
import com.signal.anomaly.service.AnomalyDetectionService;
import com.signal.anomaly.signal.SyntheticSignalSource;
import com.signal.anomaly.sink.ConsoleVerdictSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Streams the synthetic signal through the detector and prints every verdict to the
 * terminal, anomalies in red. Only runs when the "demo" Spring profile is active.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=demo
 *
 * Signal shape and detector parameters come from the {@code detection.*} properties;
 * set {@code detection.console.delay-ms=50} for a live-feed feel.
 */
@Component
@Profile("demo")
@Order(1)
public class StreamDemoRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(StreamDemoRunner.class);

    private final AnomalyDetectionService detectionService;
    private final DetectionConfig detectionConfig;

    public StreamDemoRunner(AnomalyDetectionService detectionService, DetectionConfig detectionConfig) {
        this.detectionService = detectionService;
        this.detectionConfig = detectionConfig;
    }

    @Override
    public void run(String... args) {
        log.info("=== Starting streaming demo ===");

        SyntheticSignalSource source = new SyntheticSignalSource(detectionConfig.getSignal(), System.currentTimeMillis());
        ConsoleVerdictSink sink = new ConsoleVerdictSink(System.out,
                detectionConfig.getConsole().isColor(), detectionConfig.getConsole().getDelayMs());
        DetectionSettings settings = detectionConfig.toSettings().toBuilder()
                .maxSamples(detectionConfig.getDemo().getMaxSamples())
                .build();

        if (detectionConfig.getSignal().getLength() <= 0 && settings.getMaxSamples() <= 0) {
            log.warn("Signal is unbounded and detection.demo.max-samples is 0; the demo runs until the process is stopped");
        }

        DetectionSummary summary = detectionService.run(source, sink, settings);

        log.info("=== Streaming demo complete: {} anomalies in {} samples ===",
                summary.getAnomalies(), summary.getSamplesIngested());
    }
}
