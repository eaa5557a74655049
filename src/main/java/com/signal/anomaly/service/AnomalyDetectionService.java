package com.signal.anomaly.service;

import com.signal.anomaly.config.DetectionConfig;
import com.signal.anomaly.config.MetricsConfig;
import com.signal.anomaly.engine.OutlierScorer;
import com.signal.anomaly.engine.OutlierScorerFactory;
import com.signal.anomaly.engine.ScoringException;
import com.signal.anomaly.engine.WindowedAnomalyDetector;
import com.signal.anomaly.model.DetectionReport;
import com.signal.anomaly.model.DetectionSettings;
import com.signal.anomaly.model.DetectionSummary;
import com.signal.anomaly.model.SignalPoint;
import com.signal.anomaly.model.SignalSettings;
import com.signal.anomaly.model.Verdict;
import com.signal.anomaly.signal.SignalSource;
import com.signal.anomaly.signal.SyntheticSignalSource;
import com.signal.anomaly.signal.ValueListSignalSource;
import com.signal.anomaly.sink.CollectingVerdictSink;
import com.signal.anomaly.sink.VerdictSink;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.List;

/**
 * Drives a signal source through a fresh {@link WindowedAnomalyDetector} and forwards
 * the verdict batches to a sink.
 *
 * Flow:
 * 1. Build scorer + detector from the effective settings (fails fast on bad geometry)
 * 2. Pull values one at a time and ingest them
 * 3. Forward every non-empty batch to the sink
 * 4. On a scoring failure, log it and keep pulling; the detector retries on the next sample
 * 5. At end of stream (or after maxSamples), flush the detector
 * 6. Hand the summary to the sink and return it
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final DetectionConfig detectionConfig;
    private final OutlierScorerFactory scorerFactory;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;

    public AnomalyDetectionService(DetectionConfig detectionConfig,
                                   OutlierScorerFactory scorerFactory,
                                   MetricsConfig metricsConfig,
                                   Tracer tracer) {
        this.detectionConfig = detectionConfig;
        this.scorerFactory = scorerFactory;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
    }

    /**
     * Configured defaults with any non-null override applied.
     */
    public DetectionSettings resolveSettings(Integer windowSize, Integer slideSize,
                                             Double contamination, Long seed) {
        DetectionSettings.DetectionSettingsBuilder builder = detectionConfig.toSettings().toBuilder();
        if (windowSize != null) builder.windowSize(windowSize);
        if (slideSize != null) builder.slideSize(slideSize);
        if (contamination != null) builder.contamination(contamination);
        if (seed != null) builder.seed(seed);
        return builder.build();
    }

    /**
     * @throws com.signal.anomaly.engine.DetectionConfigurationException on invalid settings
     */
    public WindowedAnomalyDetector newDetector(DetectionSettings settings) {
        OutlierScorer scorer = scorerFactory.create(settings);
        return new WindowedAnomalyDetector(settings.getWindowSize(), settings.getSlideSize(), scorer);
    }

    @Observed(name = "detection.run", contextualName = "run-detection")
    public DetectionSummary run(SignalSource source, VerdictSink sink, DetectionSettings settings) {
        WindowedAnomalyDetector detector = newDetector(settings);

        log.info("Starting detection on {} (window={}, slide={}, contamination={}, seed={})",
                source.describe(), settings.getWindowSize(), settings.getSlideSize(),
                settings.getContamination(), settings.getSeed());
        metricsConfig.recordRunStarted();

        RunCounters counters = new RunCounters();
        boolean stoppedEarly = false;
        long reportedEvictions = 0;

        try {
            Iterator<SignalPoint> points = source.iterator();
            while (points.hasNext()) {
                if (settings.getMaxSamples() > 0 && detector.getIngestedCount() >= settings.getMaxSamples()) {
                    stoppedEarly = true;
                    log.info("Stopping after {} samples; flushing remaining buffer", detector.getIngestedCount());
                    break;
                }

                double value = points.next().value();
                try {
                    List<Verdict> verdicts = scoreWindow("ingest", () -> detector.ingest(value));
                    // A full window always releases at least one new verdict
                    if (!verdicts.isEmpty()) {
                        counters.windowsScored++;
                        metricsConfig.recordWindowScored("ingest");
                    }
                    deliver(verdicts, sink, counters);
                } catch (ScoringException e) {
                    counters.windowsFailed++;
                    metricsConfig.recordWindowFailed("ingest");
                    log.warn("Scoring failed for window ending at sample {}: {}. Retrying on next sample.",
                            detector.getIngestedCount() - 1, e.getMessage());
                }

                long evicted = detector.getEvictedWithoutVerdictCount();
                if (evicted > reportedEvictions) {
                    metricsConfig.recordEvictedWithoutVerdict(evicted - reportedEvictions);
                    reportedEvictions = evicted;
                }
            }

            long unclassified = 0;
            try {
                boolean pending = detector.getPendingCount() > 0;
                List<Verdict> tail = scoreWindow("flush", detector::flush);
                if (pending) {
                    counters.windowsScored++;
                    metricsConfig.recordWindowScored("flush");
                }
                deliver(tail, sink, counters);
            } catch (ScoringException e) {
                counters.windowsFailed++;
                unclassified = detector.getPendingCount();
                metricsConfig.recordWindowFailed("flush");
                log.warn("Final flush failed, {} samples left unclassified: {}", unclassified, e.getMessage());
            }

            DetectionSummary summary = DetectionSummary.builder()
                    .samplesIngested(detector.getIngestedCount())
                    .verdictsEmitted(detector.getEmittedCount())
                    .anomalies(counters.anomalies)
                    .windowsScored(counters.windowsScored)
                    .windowsFailed(counters.windowsFailed)
                    .evictedWithoutVerdict(detector.getEvictedWithoutVerdictCount())
                    .unclassified(unclassified)
                    .stoppedEarly(stoppedEarly)
                    .settings(settings)
                    .build();

            sink.complete(summary);
            metricsConfig.recordRunFinished(summary.getAnomalyRatio());

            log.info("Detection finished on {}: {} samples, {} verdicts, {} anomalies, {} windows scored, {} failed",
                    source.describe(), summary.getSamplesIngested(), summary.getVerdictsEmitted(),
                    summary.getAnomalies(), summary.getWindowsScored(), summary.getWindowsFailed());
            return summary;
        } catch (RuntimeException e) {
            metricsConfig.recordRunFinished(0.0);
            throw e;
        }
    }

    /**
     * Run detection over a finite list of values and collect the full result.
     */
    public DetectionReport detect(List<Double> values, DetectionSettings settings) {
        return collect(new ValueListSignalSource(values), settings);
    }

    /**
     * Run detection over the synthetic test signal and collect the full result.
     * An unbounded signal requires {@code settings.maxSamples > 0}.
     */
    public DetectionReport detectSynthetic(SignalSettings signalSettings, DetectionSettings settings) {
        if (signalSettings.getLength() <= 0 && settings.getMaxSamples() <= 0) {
            throw new IllegalArgumentException("An unbounded synthetic signal needs maxSamples > 0");
        }
        return collect(new SyntheticSignalSource(signalSettings, System.currentTimeMillis()), settings);
    }

    private DetectionReport collect(SignalSource source, DetectionSettings settings) {
        CollectingVerdictSink sink = new CollectingVerdictSink();
        DetectionSummary summary = run(source, sink, settings);
        return DetectionReport.builder()
                .summary(summary)
                .verdicts(sink.getVerdicts())
                .anomalyIndices(sink.getAnomalies().stream().map(Verdict::getIndex).toList())
                .build();
    }

    private List<Verdict> scoreWindow(String phase, WindowCall call) {
        Span span = tracer.nextSpan().name("detection.window." + phase).start();
        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            List<Verdict> verdicts = call.run();
            span.tag("verdicts", String.valueOf(verdicts.size()));
            return verdicts;
        } catch (RuntimeException e) {
            span.error(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private void deliver(List<Verdict> verdicts, VerdictSink sink, RunCounters counters) {
        if (verdicts.isEmpty()) {
            return;
        }
        long anomalous = verdicts.stream().filter(Verdict::isAnomaly).count();
        counters.anomalies += anomalous;
        metricsConfig.recordVerdicts(verdicts.size() - anomalous, anomalous);

        if (anomalous > 0) {
            log.debug("Window released {} verdicts ({} anomalies) up to sample {}",
                    verdicts.size(), anomalous, verdicts.get(verdicts.size() - 1).getIndex());
        }
        sink.accept(verdicts);
    }

    @FunctionalInterface
    private interface WindowCall {
        List<Verdict> run();
    }

    private static class RunCounters {
        long anomalies;
        long windowsScored;
        long windowsFailed;
    }
}
