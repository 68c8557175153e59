package com.creditengine.service;

import com.creditengine.model.FeatureSet;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fixed-template explanations keyed on feature thresholds.
 *
 * Each list is emitted in a fixed priority order; nothing is ranked or sorted.
 */
@Component
public class InsightGenerator {

    public List<String> improvementSuggestions(FeatureSet features) {
        List<String> suggestions = new ArrayList<>();

        if (features.paymentConsistency() < 0.8) {
            suggestions.add("Improve bill payment consistency to boost credit score by 50-80 points");
        }
        if (features.emergencyBuffer() < 2) {
            suggestions.add("Build emergency savings to 2-3 months of expenses for better risk profile");
        }
        if (features.digitalMaturity() < 0.5) {
            suggestions.add("Increase digital payment usage to demonstrate financial behavior");
        }
        if (features.leverageRatio() > 0.4) {
            suggestions.add("Reduce existing debt burden to improve debt-to-income ratio");
        }

        return suggestions;
    }

    public List<String> riskFactors(FeatureSet features) {
        List<String> factors = new ArrayList<>();

        if (features.leverageRatio() > 0.5) factors.add("High existing debt burden");
        if (features.paymentConsistency() < 0.7) factors.add("Inconsistent payment history");
        if (features.emergencyBuffer() < 1) factors.add("Insufficient emergency savings");
        if (features.incomeConsistency() < 0.6) factors.add("Unstable income pattern");

        return factors;
    }

    public List<String> insights(FeatureSet features) {
        String adoption = features.digitalMaturity() > 0.7 ? "High" : "Moderate";
        return List.of(
                String.format(Locale.ROOT, "ML Confidence: %.1f%% based on payment behavior",
                        features.paymentConsistency() * 100),
                String.format(Locale.ROOT, "Risk Prediction: %.1f%% likelihood of successful repayment",
                        (1 - features.defaultRiskIndex()) * 100),
                String.format(Locale.ROOT, "Digital Maturity: %.1f%% - %s digital adoption",
                        features.digitalMaturity() * 100, adoption)
        );
    }
}
