package com.creditengine.service.ensemble;

import com.creditengine.config.ScoringConstants;
import com.creditengine.model.FeatureSet;
import org.springframework.stereotype.Component;

/**
 * Threshold rules over stability, payment, digital and risk features.
 *
 * Every rule adds or subtracts a fixed delta, so rule order only groups them
 * for reading.
 */
@Component
public class RuleCascadePredictor implements ScorePredictor {

    static final double BASE_SCORE = 500;

    @Override
    public String name() {
        return "rule-cascade";
    }

    @Override
    public double predict(FeatureSet features) {
        double score = BASE_SCORE;

        // Income and payment stability
        if (features.incomeConsistency() > 0.8) score += 80;
        else if (features.incomeConsistency() > 0.5) score += 40;

        if (features.paymentConsistency() > 0.85) score += 100;
        else if (features.paymentConsistency() > 0.7) score += 50;

        // Digital behavior
        if (features.digitalMaturity() > 0.7) score += 60;
        if (features.transactionVelocity() > 0.5) score += 40;

        // Risk factors
        if (features.leverageRatio() < 0.3) score += 70;
        else if (features.leverageRatio() > 0.6) score -= 80;

        if (features.emergencyBuffer() > 3) score += 50;
        else if (features.emergencyBuffer() < 1) score -= 60;

        return ScoringConstants.clampScore(score);
    }
}
