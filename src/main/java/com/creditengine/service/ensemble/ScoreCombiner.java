package com.creditengine.service.ensemble;

import com.creditengine.config.ScoringConstants;
import com.creditengine.config.ScoringProperties;
import com.creditengine.model.FeatureSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Weighted vote of the three predictors, producing the final credit score.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScoreCombiner {

    private final RuleCascadePredictor ruleCascadePredictor;
    private final IterativeResidualPredictor iterativeResidualPredictor;
    private final LayeredWeightedPredictor layeredWeightedPredictor;
    private final ScoringProperties properties;

    /**
     * @return integer credit score in [300, 900]
     */
    public int combine(FeatureSet features) {
        double ruleCascade = ruleCascadePredictor.predict(features);
        double iterativeResidual = iterativeResidualPredictor.predict(features);
        double layered = layeredWeightedPredictor.predict(features);

        log.debug("Predictor scores - {}: {}, {}: {}, {}: {}",
                ruleCascadePredictor.name(), ruleCascade,
                iterativeResidualPredictor.name(), iterativeResidual,
                layeredWeightedPredictor.name(), layered);

        ScoringProperties.Ensemble weights = properties.ensemble();
        double combined = ruleCascade * weights.ruleCascadeWeight()
                + iterativeResidual * weights.iterativeResidualWeight()
                + layered * weights.layeredWeight();

        return ScoringConstants.clampScore(Math.round(combined));
    }
}
