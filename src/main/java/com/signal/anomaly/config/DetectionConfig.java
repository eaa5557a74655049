package com.signal.anomaly.config;

import com.signal.anomaly.model.DetectionSettings;
import com.signal.anomaly.model.SignalSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Samples per scored window (W).
    private int windowSize = 100;

    // Newest samples claimed per retrain, also the eviction count per slide (S). 1 <= S <= W.
    private int slideSize = 40;

    private Scorer scorer = new Scorer();

    // Defaults for the synthetic signal generator.
    private SignalSettings signal = new SignalSettings();

    private Console console = new Console();

    private Demo demo = new Demo();

    @Data
    public static class Scorer {
        // Expected outlier fraction per window, in (0, 0.5].
        private double contamination = 0.1;
        private long seed = 42L;
        private int numTrees = 100;
        private int sampleSize = 256;
        // Batches below this size (e.g. a tiny final flush) fail scoring.
        private int minBatchSize = 2;
    }

    @Data
    public static class Console {
        private boolean color = true;
        // Pause between printed verdicts to mimic a live feed. 0 disables.
        private long delayMs = 0;
    }

    @Data
    public static class Demo {
        // Stop the demo stream after this many samples. 0 = until the source ends.
        private long maxSamples = 0;
    }

    public DetectionSettings toSettings() {
        return DetectionSettings.builder()
                .windowSize(windowSize)
                .slideSize(slideSize)
                .contamination(scorer.getContamination())
                .seed(scorer.getSeed())
                .numTrees(scorer.getNumTrees())
                .sampleSize(scorer.getSampleSize())
                .minBatchSize(scorer.getMinBatchSize())
                .maxSamples(0)
                .build();
    }
}
