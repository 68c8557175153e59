package com.creditengine.service;

import com.creditengine.model.ApplicantInput;
import com.creditengine.model.EmploymentType;
import com.creditengine.model.FeatureSet;
import org.springframework.stereotype.Component;

/**
 * Derives the scoring features from one applicant's raw attributes.
 *
 * Stateless: every feature is a pure function of the input record, and the
 * result always carries all features.
 */
@Component
public class FeatureExtractor {

    private static final double MONTHS_PER_YEAR = 12.0;
    private static final double DAYS_PER_MONTH = 30.0;
    private static final double UPI_SATURATION = 50.0;

    public FeatureSet extract(ApplicantInput input) {
        double income = input.monthlyIncome();
        double expenses = input.monthlyExpenses();
        double[] payments = input.paymentOnTimeHistory();

        double leverageRatio = (input.existingLoanEmi() + input.creditCardOutstanding()) / income;
        double emergencyBuffer = input.emergencySavings() / expenses;

        return new FeatureSet(
                input.incomeStabilityMonths() / MONTHS_PER_YEAR,
                income / expenses,
                Math.max(0, income - expenses - input.existingLoanEmi()),
                paymentConsistency(payments),
                paymentTrend(payments),
                digitalMaturity(input),
                input.upiTransactionsPerMonth() / DAYS_PER_MONTH,
                leverageRatio,
                emergencyBuffer,
                defaultRiskIndex(input.previousLoanDefaults(), leverageRatio, emergencyBuffer),
                ageRisk(input.age()),
                employmentRisk(input),
                locationRisk(input.cityTier())
        );
    }

    /**
     * 1 minus the population standard deviation of the on-time percentages,
     * scaled to [0,1]. Identical values give 1.0.
     */
    double paymentConsistency(double[] scores) {
        double mean = 0;
        for (double score : scores) {
            mean += score;
        }
        mean /= scores.length;

        double variance = 0;
        for (double score : scores) {
            variance += (score - mean) * (score - mean);
        }
        variance /= scores.length;

        return Math.max(0, 1 - Math.sqrt(variance) / 100);
    }

    /**
     * Least-squares slope of the on-time percentages against positions 1..n.
     * Positive means payment behavior improves across the observed channels.
     */
    double paymentTrend(double[] scores) {
        int n = scores.length;
        double sumX = n * (n + 1) / 2.0;
        double sumX2 = n * (n + 1) * (2 * n + 1) / 6.0;
        double sumY = 0;
        double sumXY = 0;
        for (int i = 0; i < n; i++) {
            sumY += scores[i];
            sumXY += scores[i] * (i + 1);
        }
        return (n * sumXY - sumX * sumY) / (n * sumX2 - sumX * sumX);
    }

    double digitalMaturity(ApplicantInput input) {
        double score = (input.upiTransactionsPerMonth() / UPI_SATURATION) * 0.4
                + (input.digitalWalletUsage() / 100) * 0.3
                + (input.onlineBillPayments() / 100) * 0.3;
        return Math.min(1, score);
    }

    double defaultRiskIndex(int previousDefaults, double leverageRatio, double emergencyBuffer) {
        double risk = previousDefaults * 0.3;
        if (leverageRatio > 0.4) risk += 0.2;
        if (emergencyBuffer < 1) risk += 0.15;
        return Math.min(1, risk);
    }

    double ageRisk(int age) {
        if (age < 21 || age > 65) return 0.3;
        if (age < 25 || age > 60) return 0.1;
        return 0;
    }

    double employmentRisk(ApplicantInput input) {
        double risk = 0;

        if (input.employmentType() == EmploymentType.UNEMPLOYED) risk += 0.5;
        else if (input.employmentType() == EmploymentType.STUDENT) risk += 0.3;
        else if (input.isDailyWageIncome()) risk += 0.2;

        if (input.yearsOfEmployment() < 1) risk += 0.1;

        return Math.min(1, risk);
    }

    double locationRisk(int cityTier) {
        return switch (cityTier) {
            case 1 -> 0;
            case 2 -> 0.05;
            case 3 -> 0.1;
            default -> 0.15;
        };
    }
}
