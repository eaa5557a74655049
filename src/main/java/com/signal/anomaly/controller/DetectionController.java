package com.signal.anomaly.controller;

import com.signal.anomaly.config.DetectionConfig;
import com.signal.anomaly.engine.DetectionConfigurationException;
import com.signal.anomaly.engine.WindowedAnomalyDetector;
import com.signal.anomaly.model.DetectionReport;
import com.signal.anomaly.model.DetectionRequest;
import com.signal.anomaly.model.DetectionSettings;
import com.signal.anomaly.model.SignalSettings;
import com.signal.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/detections")
@Tag(name = "Detections", description = "Run sliding-window anomaly detection over a series")
public class DetectionController {

    static final int MAX_SYNTHETIC_LENGTH = 100_000;

    private final AnomalyDetectionService detectionService;
    private final DetectionConfig detectionConfig;

    public DetectionController(AnomalyDetectionService detectionService,
                               DetectionConfig detectionConfig) {
        this.detectionService = detectionService;
        this.detectionConfig = detectionConfig;
    }

    @Operation(summary = "Detect anomalies in a submitted series",
            description = "Streams the values through a sliding-window Isolation Forest detector and returns " +
                    "one verdict per value, in order, plus run counters. Omitted parameters use the configured defaults.")
    @PostMapping
    public ResponseEntity<?> detect(@RequestBody DetectionRequest request) {
        if (request.getValues() == null || request.getValues().isEmpty()) {
            return badRequest("values must be a non-empty list", "values");
        }
        if (request.getValues().stream().anyMatch(v -> v == null || !Double.isFinite(v))) {
            return badRequest("values must all be finite numbers", "values");
        }

        if (request.getWindowSize() != null && request.getWindowSize() > WindowedAnomalyDetector.MAX_WINDOW_SIZE) {
            return badRequest("windowSize must be <= " + WindowedAnomalyDetector.MAX_WINDOW_SIZE, "windowSize");
        }

        DetectionSettings settings = detectionService.resolveSettings(request.getWindowSize(),
                request.getSlideSize(), request.getContamination(), request.getSeed());
        try {
            DetectionReport report = detectionService.detect(request.getValues(), settings);
            return ResponseEntity.ok(report);
        } catch (DetectionConfigurationException e) {
            return badRequest(e.getMessage(), e.getField());
        }
    }

    @Operation(summary = "Detect anomalies in a synthetic signal",
            description = "Generates a seasonal signal with drift, noise and injected spikes, then runs detection over it. " +
                    "Useful for exploring window and slide settings.")
    @PostMapping("/synthetic")
    public ResponseEntity<?> detectSynthetic(
            @Parameter(description = "Number of points to generate", example = "300")
            @RequestParam(required = false) Integer length,
            @Parameter(description = "Generator seed", example = "42")
            @RequestParam(required = false) Long signalSeed,
            @Parameter(description = "Probability of an injected spike per point", example = "0.1")
            @RequestParam(required = false) Double anomalyProbability,
            @Parameter(description = "Point at which drift starts", example = "100")
            @RequestParam(required = false) Integer driftStart,
            @Parameter(description = "Drift added per point after driftStart", example = "0.02")
            @RequestParam(required = false) Double driftRate,
            @Parameter(description = "Window size override", example = "100")
            @RequestParam(required = false) Integer windowSize,
            @Parameter(description = "Slide size override", example = "40")
            @RequestParam(required = false) Integer slideSize,
            @Parameter(description = "Contamination override", example = "0.1")
            @RequestParam(required = false) Double contamination,
            @Parameter(description = "Scorer seed override", example = "42")
            @RequestParam(required = false) Long seed) {

        SignalSettings.SignalSettingsBuilder signal = detectionConfig.getSignal().toBuilder();
        if (length != null) signal.length(length);
        if (signalSeed != null) signal.seed(signalSeed);
        if (anomalyProbability != null) signal.anomalyProbability(anomalyProbability);
        if (driftStart != null) signal.driftStart(driftStart);
        if (driftRate != null) signal.driftRate(driftRate);
        SignalSettings signalSettings = signal.build();

        if (signalSettings.getLength() <= 0 || signalSettings.getLength() > MAX_SYNTHETIC_LENGTH) {
            return badRequest("length must be in [1, " + MAX_SYNTHETIC_LENGTH + "]", "length");
        }
        if (signalSettings.getAnomalyProbability() < 0 || signalSettings.getAnomalyProbability() > 1) {
            return badRequest("anomalyProbability must be in [0, 1]", "anomalyProbability");
        }

        if (windowSize != null && windowSize > WindowedAnomalyDetector.MAX_WINDOW_SIZE) {
            return badRequest("windowSize must be <= " + WindowedAnomalyDetector.MAX_WINDOW_SIZE, "windowSize");
        }

        DetectionSettings settings = detectionService.resolveSettings(windowSize, slideSize, contamination, seed);
        try {
            return ResponseEntity.ok(detectionService.detectSynthetic(signalSettings, settings));
        } catch (DetectionConfigurationException e) {
            return badRequest(e.getMessage(), e.getField());
        }
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }
}
