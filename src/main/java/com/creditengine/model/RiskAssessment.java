package com.creditengine.model;

/**
 * Loan terms and decision derived from the combined score and features.
 *
 * Internal to one assessment: compliance and insights are attached afterwards
 * when the {@link RiskScore} is assembled.
 */
public record RiskAssessment(
        double defaultProbability,   // [0,1]
        long maxLoanAmount,          // [0, regulatory loan cap]
        double interestRate,         // Annual %, within the pricing range
        double emiToIncomeRatio,     // % of monthly income
        LendingDecision decision,
        double confidence,           // [0,1]
        double predictionAccuracy    // [0.65,0.95]
) {
    public RiskAssessment {
        if (decision == null) {
            throw new IllegalArgumentException("Decision cannot be null");
        }
    }
}
