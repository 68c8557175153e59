package com.creditengine.service;

import com.creditengine.config.ScoringConstants;
import com.creditengine.config.ScoringProperties;
import com.creditengine.model.ApplicantInput;
import com.creditengine.model.FeatureSet;
import com.creditengine.model.LendingDecision;
import com.creditengine.model.RiskAssessment;
import com.creditengine.model.RiskBand;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Turns the combined score and features into loan terms and a decision.
 *
 * All derived values are clamped at their boundaries instead of raising:
 * probability and confidence to [0,1], rate to the pricing range, loan amount
 * to the regulatory cap, accuracy to [0.65, 0.95].
 */
@Service
@RequiredArgsConstructor
public class RiskAssessor {

    private final ScoringProperties properties;

    public RiskAssessment assess(ApplicantInput input, FeatureSet features, int creditScore) {
        double defaultProbability = defaultProbability(features, creditScore);
        long maxLoan = maxLoanAmount(input.monthlyIncome(), creditScore, defaultProbability);
        double interestRate = interestRate(creditScore, defaultProbability);

        return new RiskAssessment(
                defaultProbability,
                maxLoan,
                interestRate,
                emiToIncomeRatio(maxLoan, interestRate, input.monthlyIncome()),
                decide(creditScore, defaultProbability, features),
                confidence(features),
                predictionAccuracy(features)
        );
    }

    public double defaultProbability(FeatureSet features, int creditScore) {
        double baseProbability = Math.max(0, (800.0 - creditScore) / 500);
        double riskAdjustment = features.defaultRiskIndex() * 0.3;
        double stabilityAdjustment = (1 - features.incomeConsistency()) * 0.2;

        return clamp(baseProbability + riskAdjustment + stabilityAdjustment, 0, 1);
    }

    public long maxLoanAmount(double monthlyIncome, int creditScore, double defaultProbability) {
        ScoringProperties.Lending lending = properties.lending();
        double loanCap = properties.regulatory().loanCap();

        double baseAmount = Math.min(loanCap, monthlyIncome * 12 * lending.annualIncomeShare());
        double scoreMultiplier = Math.min(lending.maxScoreMultiplier(), creditScore / 600.0);
        double riskAdjustment = Math.max(lending.minRiskAdjustment(), 1 - defaultProbability);

        long amount = Math.round(baseAmount * scoreMultiplier * riskAdjustment);
        // The score multiplier can lift the amount above the cap
        return Math.min(amount, (long) Math.floor(loanCap));
    }

    public double interestRate(int creditScore, double defaultProbability) {
        ScoringProperties.Pricing pricing = properties.pricing();
        double scoreAdjustment = Math.max(0, (750.0 - creditScore) / 50);
        double riskPremium = defaultProbability * 10;

        return clamp(pricing.baseRate() + scoreAdjustment + riskPremium, pricing.minRate(), pricing.maxRate());
    }

    /**
     * Monthly interest on the eligible amount as a percentage of monthly income.
     */
    public double emiToIncomeRatio(long maxLoan, double interestRate, double monthlyIncome) {
        return (maxLoan * interestRate / 1200) / monthlyIncome * 100;
    }

    /**
     * Decision rules:
     * - Approve: score >= 700, default probability < 0.1, payment consistency > 0.8
     * - Review: score >= 550 and default probability < 0.3
     * - Reject: everything else
     */
    public LendingDecision decide(int creditScore, double defaultProbability, FeatureSet features) {
        if (creditScore >= 700 && defaultProbability < 0.1 && features.paymentConsistency() > 0.8) {
            return LendingDecision.APPROVE;
        } else if (creditScore >= 550 && defaultProbability < 0.3) {
            return LendingDecision.REVIEW;
        } else {
            return LendingDecision.REJECT;
        }
    }

    public double confidence(FeatureSet features) {
        return Math.min(1, (features.informativeFraction() + features.paymentConsistency()) / 2);
    }

    public double predictionAccuracy(FeatureSet features) {
        return clamp((features.finiteFraction() + features.paymentConsistency()) / 2,
                ScoringConstants.MIN_PREDICTION_ACCURACY, ScoringConstants.MAX_PREDICTION_ACCURACY);
    }

    public RiskBand riskBand(int creditScore) {
        return RiskBand.fromScore(creditScore, properties.bands());
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
