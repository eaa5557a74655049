package com.signal.anomaly.service;

import com.signal.anomaly.config.DetectionConfig;
import com.signal.anomaly.config.MetricsConfig;
import com.signal.anomaly.engine.DetectionConfigurationException;
import com.signal.anomaly.engine.OutlierScorerFactory;
import com.signal.anomaly.engine.isolationforest.IsolationForestScorerFactory;
import com.signal.anomaly.model.DetectionReport;
import com.signal.anomaly.model.DetectionSettings;
import com.signal.anomaly.model.DetectionSummary;
import com.signal.anomaly.model.SignalSettings;
import com.signal.anomaly.model.Verdict;
import com.signal.anomaly.signal.ValueListSignalSource;
import com.signal.anomaly.sink.CollectingVerdictSink;
import com.signal.anomaly.sink.VerdictSink;
import com.signal.anomaly.testutil.ScriptedScorer;
import com.signal.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static com.signal.anomaly.testutil.TestDataFactory.indices;
import static com.signal.anomaly.testutil.TestDataFactory.range;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectionServiceTest {

    @Mock private OutlierScorerFactory scorerFactory;

    private DetectionConfig detectionConfig;
    private SimpleMeterRegistry registry;
    private AnomalyDetectionService service;

    @BeforeEach
    void setUp() {
        detectionConfig = new DetectionConfig();
        registry = new SimpleMeterRegistry();
        service = new AnomalyDetectionService(detectionConfig, scorerFactory,
                new MetricsConfig(registry), Tracer.NOOP);
    }

    @Test
    void run_finiteSource_emitsOneVerdictPerSampleInOrder() {
        when(scorerFactory.create(any())).thenReturn(new ScriptedScorer());
        CollectingVerdictSink sink = new CollectingVerdictSink();

        DetectionSummary summary = service.run(new ValueListSignalSource(TestDataFactory.ramp(23)),
                sink, TestDataFactory.settings(5, 2));

        assertThat(indices(sink.getVerdicts())).isEqualTo(range(0, 23));
        assertThat(summary.getSamplesIngested()).isEqualTo(23);
        assertThat(summary.getVerdictsEmitted()).isEqualTo(23);
        // Retrains at samples 5, 7, ..., 23; the last slide leaves nothing for the flush
        assertThat(summary.getWindowsScored()).isEqualTo(10);
        assertThat(summary.getWindowsFailed()).isZero();
        assertThat(sink.getSummary()).isSameAs(summary);
    }

    @Test
    void run_sinkReceivesOnlyNonEmptyBatches() {
        when(scorerFactory.create(any())).thenReturn(new ScriptedScorer());
        VerdictSink sink = mock(VerdictSink.class);

        service.run(new ValueListSignalSource(TestDataFactory.ramp(10)), sink, TestDataFactory.settings(5, 2));

        // 0..4, 5..6, 7..8, then the flush with 9
        verify(sink, times(4)).accept(argThat(batch -> !batch.isEmpty()));
        verify(sink).complete(any(DetectionSummary.class));
    }

    @Test
    void run_countsAnomaliesFromScorerFlags() {
        when(scorerFactory.create(any())).thenReturn(new ScriptedScorer(100.0, 1));
        CollectingVerdictSink sink = new CollectingVerdictSink();

        DetectionSummary summary = service.run(
                new ValueListSignalSource(TestDataFactory.flatWithSpikes(30, 3, 12, 29)),
                sink, TestDataFactory.settings(10, 4));

        assertThat(summary.getAnomalies()).isEqualTo(3);
        assertThat(sink.getAnomalies()).extracting(Verdict::getIndex).containsExactly(3L, 12L, 29L);
        assertThat(registry.get("detection.verdict.count").tag("anomaly", "true").counter().count())
                .isEqualTo(3.0);
    }

    @Test
    void run_scoringFailure_isIsolatedToItsWindow() {
        when(scorerFactory.create(any())).thenReturn(new ScriptedScorer().failOnCalls(2));
        CollectingVerdictSink sink = new CollectingVerdictSink();

        DetectionSummary summary = service.run(new ValueListSignalSource(TestDataFactory.ramp(12)),
                sink, TestDataFactory.settings(5, 2));

        assertThat(indices(sink.getVerdicts())).isEqualTo(range(0, 12));
        assertThat(summary.getWindowsFailed()).isEqualTo(1);
        assertThat(summary.getEvictedWithoutVerdict()).isZero();
        assertThat(registry.get("detection.window.failed").tag("phase", "ingest").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void run_finalFlushFails_reportsUnclassifiedSamples() {
        // 6 samples: one retrain, then the flush is the second scoring call
        when(scorerFactory.create(any())).thenReturn(new ScriptedScorer().failOnCalls(2));
        CollectingVerdictSink sink = new CollectingVerdictSink();

        DetectionSummary summary = service.run(new ValueListSignalSource(TestDataFactory.ramp(6)),
                sink, TestDataFactory.settings(5, 2));

        assertThat(indices(sink.getVerdicts())).isEqualTo(range(0, 5));
        assertThat(summary.getUnclassified()).isEqualTo(1);
        assertThat(summary.getWindowsFailed()).isEqualTo(1);
    }

    @Test
    void run_maxSamples_stopsEarlyAndStillFlushes() {
        when(scorerFactory.create(any())).thenReturn(new ScriptedScorer());
        CollectingVerdictSink sink = new CollectingVerdictSink();
        DetectionSettings settings = TestDataFactory.settings(5, 2).toBuilder().maxSamples(8).build();

        DetectionSummary summary = service.run(new ValueListSignalSource(TestDataFactory.ramp(50)), sink, settings);

        assertThat(summary.isStoppedEarly()).isTrue();
        assertThat(summary.getSamplesIngested()).isEqualTo(8);
        assertThat(indices(sink.getVerdicts())).isEqualTo(range(0, 8));
    }

    @Test
    void run_invalidGeometry_failsBeforeReadingTheSource() {
        when(scorerFactory.create(any())).thenReturn(new ScriptedScorer());
        VerdictSink sink = mock(VerdictSink.class);

        assertThatThrownBy(() -> service.run(ValueListSignalSource.of(1, 2, 3), sink,
                TestDataFactory.settings(3, 4)))
                .isInstanceOf(DetectionConfigurationException.class);
        verifyNoInteractions(sink);
    }

    @Test
    void detect_withIsolationForest_isDeterministicAcrossRuns() {
        AnomalyDetectionService realService = new AnomalyDetectionService(detectionConfig,
                new IsolationForestScorerFactory(), new MetricsConfig(registry), Tracer.NOOP);
        List<Double> values = TestDataFactory.flatWithSpikes(250, 10, 120, 201);
        DetectionSettings settings = realService.resolveSettings(null, null, null, null);

        DetectionReport first = realService.detect(values, settings);
        DetectionReport second = realService.detect(values, settings);

        assertThat(second.getVerdicts()).isEqualTo(first.getVerdicts());
        assertThat(indices(first.getVerdicts())).isEqualTo(range(0, 250));
        assertThat(first.getAnomalyIndices()).contains(10L, 120L, 201L);
    }

    @Test
    void detect_withIsolationForest_fullSlideLeavingOneSampleTail_classifiesEverySample() {
        AnomalyDetectionService realService = new AnomalyDetectionService(detectionConfig,
                new IsolationForestScorerFactory(), new MetricsConfig(registry), Tracer.NOOP);

        DetectionReport report = realService.detect(TestDataFactory.flatWithSpikes(11, 3),
                realService.resolveSettings(5, 5, null, null));

        assertThat(indices(report.getVerdicts())).isEqualTo(range(0, 11));
        assertThat(report.getSummary().getUnclassified()).isZero();
        assertThat(report.getSummary().getWindowsFailed()).isZero();
    }

    @Test
    void detect_withIsolationForest_windowBelowMinimumBatch_isRejectedUpFront() {
        AnomalyDetectionService realService = new AnomalyDetectionService(detectionConfig,
                new IsolationForestScorerFactory(), new MetricsConfig(registry), Tracer.NOOP);
        DetectionSettings settings = realService.resolveSettings(1, 1, null, null);

        assertThatThrownBy(() -> realService.detect(TestDataFactory.flatWithSpikes(10, 3), settings))
                .isInstanceOf(DetectionConfigurationException.class)
                .extracting("field").isEqualTo("windowSize");
    }

    @Test
    void detectSynthetic_coversWholeSignal() {
        AnomalyDetectionService realService = new AnomalyDetectionService(detectionConfig,
                new IsolationForestScorerFactory(), new MetricsConfig(registry), Tracer.NOOP);
        SignalSettings signal = SignalSettings.builder().length(300).build();

        DetectionReport report = realService.detectSynthetic(signal, realService.resolveSettings(null, null, null, null));

        assertThat(report.getSummary().getVerdictsEmitted()).isEqualTo(300);
        assertThat(report.getSummary().getAnomalies()).isPositive();
        assertThat(report.getAnomalyIndices()).hasSize((int) report.getSummary().getAnomalies());
    }

    @Test
    void detectSynthetic_unboundedWithoutLimit_isRejected() {
        SignalSettings signal = SignalSettings.builder().length(0).build();

        assertThatThrownBy(() -> service.detectSynthetic(signal, TestDataFactory.settings(5, 2)))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(scorerFactory);
    }

    @Test
    void resolveSettings_appliesOverridesOnTopOfConfiguredDefaults() {
        detectionConfig.setWindowSize(60);
        detectionConfig.getScorer().setNumTrees(50);

        DetectionSettings defaults = service.resolveSettings(null, null, null, null);
        DetectionSettings overridden = service.resolveSettings(20, 5, 0.2, 7L);

        assertThat(defaults.getWindowSize()).isEqualTo(60);
        assertThat(defaults.getSlideSize()).isEqualTo(40);
        assertThat(defaults.getContamination()).isEqualTo(0.1);
        assertThat(overridden.getWindowSize()).isEqualTo(20);
        assertThat(overridden.getSlideSize()).isEqualTo(5);
        assertThat(overridden.getContamination()).isEqualTo(0.2);
        assertThat(overridden.getSeed()).isEqualTo(7L);
        assertThat(overridden.getNumTrees()).isEqualTo(50);
    }

    @Test
    void run_metricsGaugeReturnsToZeroAfterRun() {
        when(scorerFactory.create(any())).thenReturn(new ScriptedScorer());

        service.run(new ValueListSignalSource(TestDataFactory.ramp(8)), new CollectingVerdictSink(),
                TestDataFactory.settings(5, 2));

        assertThat(registry.get("detection.active.runs").gauge().value()).isEqualTo(0.0);
        assertThat(registry.get("detection.window.scored").tag("phase", "flush").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void run_collectsBatchesInArrivalOrder() {
        when(scorerFactory.create(any())).thenReturn(new ScriptedScorer());
        List<List<Verdict>> batches = new ArrayList<>();

        service.run(new ValueListSignalSource(TestDataFactory.ramp(9)), batches::add, TestDataFactory.settings(5, 2));

        assertThat(batches.stream().map(TestDataFactory::indices).toList()).containsExactly(
                List.of(0L, 1L, 2L, 3L, 4L),
                List.of(5L, 6L),
                List.of(7L, 8L));
    }
}
