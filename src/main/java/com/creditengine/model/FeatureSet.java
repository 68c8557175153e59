package com.creditengine.model;

/**
 * Features derived from one applicant. Exists only inside a single assessment.
 *
 * Bounded features (payment consistency, digital maturity and the four risk
 * indices) lie in [0,1]. Income consistency is uncapped and payment trend may
 * be negative.
 */
public record FeatureSet(
        double incomeConsistency,
        double incomeToExpenseRatio,
        double disposableIncome,
        double paymentConsistency,
        double paymentTrend,
        double digitalMaturity,
        double transactionVelocity,
        double leverageRatio,
        double emergencyBuffer,
        double defaultRiskIndex,
        double ageRisk,
        double employmentRisk,
        double locationRisk
) {
    public static final int FEATURE_COUNT = 13;

    /**
     * All features in declaration order, as fed to the layered predictor.
     */
    public double[] toVector() {
        return new double[]{
                incomeConsistency, incomeToExpenseRatio, disposableIncome,
                paymentConsistency, paymentTrend,
                digitalMaturity, transactionVelocity,
                leverageRatio, emergencyBuffer, defaultRiskIndex,
                ageRisk, employmentRisk, locationRisk
        };
    }

    /**
     * Share of features carrying a usable, non-zero signal.
     */
    public double informativeFraction() {
        int count = 0;
        for (double value : toVector()) {
            if (Double.isFinite(value) && value != 0) count++;
        }
        return (double) count / FEATURE_COUNT;
    }

    /**
     * Share of features that are finite numbers.
     */
    public double finiteFraction() {
        int count = 0;
        for (double value : toVector()) {
            if (Double.isFinite(value)) count++;
        }
        return (double) count / FEATURE_COUNT;
    }
}
