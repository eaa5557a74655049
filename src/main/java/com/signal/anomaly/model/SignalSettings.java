package com.signal.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Shape of the synthetic test signal: seasonal sine + linear drift + uniform noise
 * + randomly injected spikes.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Parameters of the synthetic signal generator")
public class SignalSettings {

    // <= 0 means unbounded
    @Builder.Default
    @Schema(description = "Number of points to generate (<= 0 for an unbounded stream)", example = "300")
    private int length = 300;

    @Builder.Default
    @Schema(description = "Mean level of the signal", example = "50")
    private double baseline = 50.0;

    @Builder.Default
    @Schema(description = "Amplitude of the seasonal component", example = "10")
    private double amplitude = 10.0;

    @Builder.Default
    @Schema(description = "Frequency of the seasonal component (cycles per point)", example = "0.1")
    private double frequency = 0.1;

    @Builder.Default
    @Schema(description = "Half-width of the uniform noise band", example = "5")
    private double noiseLevel = 5.0;

    @Builder.Default
    @Schema(description = "Point at which linear drift starts", example = "100")
    private int driftStart = 100;

    @Builder.Default
    @Schema(description = "Drift added per point after driftStart", example = "0.02")
    private double driftRate = 0.02;

    @Builder.Default
    @Schema(description = "Probability of injecting a spike at any point", example = "0.1")
    private double anomalyProbability = 0.1;

    @Builder.Default
    @Schema(description = "Lower bound of an injected spike's magnitude", example = "20")
    private double anomalyMinMagnitude = 20.0;

    @Builder.Default
    @Schema(description = "Upper bound of an injected spike's magnitude", example = "50")
    private double anomalyMaxMagnitude = 50.0;

    @Builder.Default
    @Schema(description = "Seed for the generator", example = "42")
    private long seed = 42L;
}
