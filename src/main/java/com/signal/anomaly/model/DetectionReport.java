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
@Schema(description = "Result of running windowed anomaly detection over a series")
public class DetectionReport {

    @Schema(description = "Run counters and effective parameters")
    private DetectionSummary summary;

    @Schema(description = "One verdict per classified sample, in stream order")
    private List<Verdict> verdicts;

    @Schema(description = "Stream indices of the samples flagged as anomalies", example = "[12, 57, 140]")
    private List<Long> anomalyIndices;
}
