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
@Schema(description = "Final inlier/outlier decision for one sample of the stream")
public class Verdict {

    @Schema(description = "Position of the sample in the original stream (0-based)", example = "117")
    private long index;

    @Schema(description = "Observed value", example = "93.41")
    private double value;

    @Schema(description = "Whether the sample was classified as an outlier in its window", example = "true")
    private boolean anomaly;

    public static Verdict of(Sample sample, boolean anomaly) {
        return new Verdict(sample.index(), sample.value(), anomaly);
    }
}
