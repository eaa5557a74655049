package com.signal.anomaly.controller;

import com.signal.anomaly.config.DetectionConfig;
import com.signal.anomaly.engine.WindowedAnomalyDetector;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View and modify the default detection parameters")
public class ConfigController {

    private final DetectionConfig detectionConfig;

    public ConfigController(DetectionConfig detectionConfig) {
        this.detectionConfig = detectionConfig;
    }

    @Operation(summary = "Get default detection parameters")
    @GetMapping("/detection")
    public ResponseEntity<Map<String, Object>> getDetectionConfig() {
        return ResponseEntity.ok(Map.of(
                "windowSize", detectionConfig.getWindowSize(),
                "slideSize", detectionConfig.getSlideSize(),
                "contamination", detectionConfig.getScorer().getContamination(),
                "seed", detectionConfig.getScorer().getSeed(),
                "numTrees", detectionConfig.getScorer().getNumTrees(),
                "sampleSize", detectionConfig.getScorer().getSampleSize()
        ));
    }

    @Operation(summary = "Update default detection parameters",
            description = "Applies to runs started afterwards. Changes reset on restart.")
    @PutMapping("/detection")
    public ResponseEntity<?> updateDetectionConfig(@RequestBody Map<String, Object> body) {
        DetectionConfig.Scorer scorer = detectionConfig.getScorer();
        int window = toInt(body, "windowSize", detectionConfig.getWindowSize());
        int slide = toInt(body, "slideSize", detectionConfig.getSlideSize());
        double contamination = toDouble(body, "contamination", scorer.getContamination());
        long seed = toLong(body, "seed", scorer.getSeed());
        int numTrees = toInt(body, "numTrees", scorer.getNumTrees());
        int sampleSize = toInt(body, "sampleSize", scorer.getSampleSize());

        if (window < 1) return badRequest("windowSize must be >= 1", "windowSize");
        if (window > WindowedAnomalyDetector.MAX_WINDOW_SIZE) return badRequest("windowSize must be <= " + WindowedAnomalyDetector.MAX_WINDOW_SIZE, "windowSize");
        if (window < scorer.getMinBatchSize()) return badRequest("windowSize must be >= minBatchSize (" + scorer.getMinBatchSize() + ")", "windowSize");
        if (slide < 1) return badRequest("slideSize must be >= 1", "slideSize");
        if (slide > window) return badRequest("slideSize must not exceed windowSize", "slideSize");
        if (!(contamination > 0 && contamination <= 0.5)) return badRequest("contamination must be in (0, 0.5]", "contamination");
        if (numTrees < 1) return badRequest("numTrees must be >= 1", "numTrees");
        if (sampleSize < 2) return badRequest("sampleSize must be >= 2", "sampleSize");

        detectionConfig.setWindowSize(window);
        detectionConfig.setSlideSize(slide);
        scorer.setContamination(contamination);
        scorer.setSeed(seed);
        scorer.setNumTrees(numTrees);
        scorer.setSampleSize(sampleSize);

        return getDetectionConfig();
    }

    // ── Helpers ──

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }

    private double toDouble(Map<String, Object> body, String key, double defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.doubleValue();
        try { return Double.parseDouble(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private long toLong(Map<String, Object> body, String key, long defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.longValue();
        try { return Long.parseLong(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }

    private int toInt(Map<String, Object> body, String key, int defaultVal) {
        Object v = body.get(key);
        if (v == null) return defaultVal;
        if (v instanceof Number n) return n.intValue();
        try { return Integer.parseInt(v.toString()); } catch (NumberFormatException e) { return defaultVal; }
    }
}
