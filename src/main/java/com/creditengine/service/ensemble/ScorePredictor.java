package com.creditengine.service.ensemble;

import com.creditengine.model.FeatureSet;

/**
 * One member of the scoring ensemble.
 *
 * Implementations are pure: the same features always give the same score,
 * and the score is clamped to the credit-score scale before it is returned.
 */
public interface ScorePredictor {

    String name();

    double predict(FeatureSet features);
}
