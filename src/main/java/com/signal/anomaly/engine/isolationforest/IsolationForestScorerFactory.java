package com.signal.anomaly.engine.isolationforest;

import com.signal.anomaly.engine.OutlierScorer;
import com.signal.anomaly.engine.OutlierScorerFactory;
import com.signal.anomaly.model.DetectionSettings;
import org.springframework.stereotype.Component;

@Component
public class IsolationForestScorerFactory implements OutlierScorerFactory {

    @Override
    public OutlierScorer create(DetectionSettings settings) {
        return new IsolationForestScorer(settings.getContamination(), settings.getNumTrees(),
                settings.getSampleSize(), settings.getSeed(), settings.getMinBatchSize());
    }
}
