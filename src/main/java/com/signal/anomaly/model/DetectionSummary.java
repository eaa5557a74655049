package com.signal.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Counters describing a completed detection run")
public class DetectionSummary {

    @Schema(description = "Samples pulled from the source and ingested", example = "300")
    private long samplesIngested;

    @Schema(description = "Verdicts emitted (one per sample at most)", example = "300")
    private long verdictsEmitted;

    @Schema(description = "Verdicts flagged as anomalies", example = "31")
    private long anomalies;

    @Schema(description = "Windows successfully scored, including the final flush", example = "6")
    private long windowsScored;

    @Schema(description = "Windows whose scoring call failed", example = "0")
    private long windowsFailed;

    @Schema(description = "Samples evicted from the window before any verdict could be emitted", example = "0")
    private long evictedWithoutVerdict;

    @Schema(description = "Samples left without a verdict because the final flush failed", example = "0")
    private long unclassified;

    @Schema(description = "Whether the run stopped before the source was exhausted", example = "false")
    private boolean stoppedEarly;

    @Schema(description = "Effective parameters of the run")
    private DetectionSettings settings;

    public double getAnomalyRatio() {
        return verdictsEmitted == 0 ? 0.0 : (double) anomalies / verdictsEmitted;
    }
}
