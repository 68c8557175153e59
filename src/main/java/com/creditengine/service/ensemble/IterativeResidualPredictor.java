package com.creditengine.service.ensemble;

import com.creditengine.config.ScoringConstants;
import com.creditengine.model.FeatureSet;
import org.springframework.stereotype.Component;

/**
 * Fixed five-step recurrence: each step adds a shrinking share of the
 * payment-versus-default residual to the running score.
 */
@Component
public class IterativeResidualPredictor implements ScorePredictor {

    static final double BASE_SCORE = 520;
    static final int ITERATIONS = 5;

    @Override
    public String name() {
        return "iterative-residual";
    }

    @Override
    public double predict(FeatureSet features) {
        double score = BASE_SCORE;

        for (int i = 0; i < ITERATIONS; i++) {
            double residual = residual(features, i);
            score += residual * (0.1 * (ITERATIONS - i));
        }

        return ScoringConstants.clampScore(score);
    }

    private double residual(FeatureSet features, int iteration) {
        double targetAdjustment = features.paymentConsistency() * 50 - features.defaultRiskIndex() * 100;
        return targetAdjustment / (iteration + 1);
    }
}
