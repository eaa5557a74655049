package com.signal.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A finite series submitted for windowed anomaly detection. Omitted parameters use the configured defaults.")
public class DetectionRequest {

    @Schema(description = "Series values in arrival order", example = "[50.2, 51.7, 49.9, 120.4, 50.8]")
    private List<Double> values;

    @Schema(description = "Window size override", example = "100")
    private Integer windowSize;

    @Schema(description = "Slide size override", example = "40")
    private Integer slideSize;

    @Schema(description = "Contamination override", example = "0.1")
    private Double contamination;

    @Schema(description = "Scorer seed override", example = "42")
    private Long seed;
}
