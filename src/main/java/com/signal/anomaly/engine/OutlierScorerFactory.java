package com.signal.anomaly.engine;

import com.signal.anomaly.model.DetectionSettings;

/**
 * Builds the scorer used by one detection run.
 */
public interface OutlierScorerFactory {

    OutlierScorer create(DetectionSettings settings);
}
