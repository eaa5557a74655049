package com.signal.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Effective parameters of one detection run: window geometry plus the scorer's knobs.
 * Built from {@code detection.*} defaults with per-request overrides applied on top.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Effective parameters used for a detection run")
public class DetectionSettings {

    @Schema(description = "Number of samples in each scored window (W)", example = "100")
    private int windowSize;

    @Schema(description = "Number of newest samples claimed per retrain, and evicted per slide (S)", example = "40")
    private int slideSize;

    @Schema(description = "Expected outlier fraction per window, in (0, 0.5]", example = "0.1")
    private double contamination;

    @Schema(description = "Seed for the scorer's random generator", example = "42")
    private long seed;

    @Schema(description = "Number of isolation trees built per window", example = "100")
    private int numTrees;

    @Schema(description = "Sub-sampling size per tree", example = "256")
    private int sampleSize;

    @Schema(description = "Smallest batch the scorer accepts", example = "2")
    private int minBatchSize;

    // 0 = pull until the source is exhausted
    @Schema(description = "Stop pulling from the source after this many samples (0 = unbounded)", example = "0")
    private long maxSamples;
}
