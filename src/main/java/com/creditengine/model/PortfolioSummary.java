package com.creditengine.model;

import com.creditengine.config.ScoringConstants;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view over a batch of assessments.
 *
 * Holds the figures a portfolio dashboard shows (decision mix, band
 * distribution, averages); rendering them is the presentation layer's job.
 */
public record PortfolioSummary(
        int applicantCount,
        Map<LendingDecision, Long> decisionCounts,
        Map<RiskBand, Long> bandCounts,
        double averageCreditScore,
        double averageDefaultProbability,
        long highConfidenceCount,
        long compliantCount,
        long totalEligibleAmount
) {
    public PortfolioSummary {
        decisionCounts = decisionCounts == null ? Map.of() : Map.copyOf(decisionCounts);
        bandCounts = bandCounts == null ? Map.of() : Map.copyOf(bandCounts);
    }

    public static PortfolioSummary of(List<RiskScore> scores) {
        Map<LendingDecision, Long> decisions = new EnumMap<>(LendingDecision.class);
        for (LendingDecision decision : LendingDecision.values()) {
            decisions.put(decision, 0L);
        }
        Map<RiskBand, Long> bands = new EnumMap<>(RiskBand.class);
        for (RiskBand band : RiskBand.values()) {
            bands.put(band, 0L);
        }

        if (scores == null || scores.isEmpty()) {
            return new PortfolioSummary(0, decisions, bands, 0, 0, 0, 0, 0);
        }

        double scoreSum = 0;
        double probabilitySum = 0;
        long highConfidence = 0;
        long compliant = 0;
        long totalEligible = 0;

        for (RiskScore score : scores) {
            decisions.merge(score.decision(), 1L, Long::sum);
            bands.merge(score.riskBand(), 1L, Long::sum);
            scoreSum += score.creditScore();
            probabilitySum += score.defaultProbability();
            if (score.confidenceScore() > ScoringConstants.HIGH_CONFIDENCE_THRESHOLD) highConfidence++;
            if (score.compliant()) compliant++;
            totalEligible += score.maxEligibleAmount();
        }

        int count = scores.size();
        return new PortfolioSummary(
                count,
                decisions,
                bands,
                scoreSum / count,
                probabilitySum / count,
                highConfidence,
                compliant,
                totalEligible);
    }

    public long count(LendingDecision decision) {
        return decisionCounts.getOrDefault(decision, 0L);
    }

    public long count(RiskBand band) {
        return bandCounts.getOrDefault(band, 0L);
    }
}
