package com.creditengine.model;

import com.creditengine.config.ScoringConstants;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

/**
 * Complete credit-risk assessment of one applicant.
 *
 * This is the only artifact the engine hands back; the caller owns it.
 * IMMUTABLE: all lists are unmodifiable copies, so a returned score can be shared
 * across threads or cached by the presentation layer as-is.
 *
 * JSON names follow the interchange format used by the ingestion and
 * presentation layers.
 */
@Builder
public record RiskScore(
        @JsonProperty("user_id") String userId,
        @JsonProperty("credit_score") int creditScore,
        @JsonProperty("risk_band") RiskBand riskBand,
        @JsonProperty("decision") LendingDecision decision,
        @JsonProperty("max_eligible_amount") long maxEligibleAmount,
        @JsonProperty("interest_rate") double interestRate,
        @JsonProperty("emi_to_income_ratio") double emiToIncomeRatio,
        @JsonProperty("default_probability") double defaultProbability,
        @JsonProperty("confidence_score") double confidenceScore,
        @JsonProperty("improvement_suggestions") List<String> improvementSuggestions,
        @JsonProperty("rbi_compliant") boolean compliant,
        @JsonProperty("rbi_violations") List<String> violations,
        @JsonProperty("ml_insights") List<String> insights,
        @JsonProperty("risk_factors") List<String> riskFactors,
        @JsonProperty("prediction_accuracy") double predictionAccuracy
) {
    public RiskScore {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID cannot be null or empty");
        }
        if (creditScore < ScoringConstants.MIN_SCORE || creditScore > ScoringConstants.MAX_SCORE) {
            throw new IllegalArgumentException("Credit score out of range: " + creditScore);
        }
        if (riskBand == null || decision == null) {
            throw new IllegalArgumentException("Risk band and decision cannot be null");
        }
        improvementSuggestions = copyOf(improvementSuggestions);
        violations = copyOf(violations);
        insights = copyOf(insights);
        riskFactors = copyOf(riskFactors);
        if (compliant != violations.isEmpty()) {
            throw new IllegalArgumentException("Compliance flag disagrees with violations for " + userId);
        }
    }

    private static List<String> copyOf(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
