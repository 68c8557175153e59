package com.creditengine.service;

import com.creditengine.model.ApplicantInput;
import com.creditengine.model.ComplianceResult;
import com.creditengine.model.FeatureSet;
import com.creditengine.model.LendingDecision;
import com.creditengine.model.RiskAssessment;
import com.creditengine.model.RiskScore;
import com.creditengine.service.ensemble.ScoreCombiner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the full scoring pipeline for one applicant.
 *
 * Flow:
 * 1. Extract features from the raw input
 * 2. Score with the three predictors and combine into the credit score
 * 3. Derive default probability, loan terms and decision
 * 4. Check compliance and generate suggestions, insights and risk factors
 * 5. Assemble the immutable RiskScore
 *
 * Pure and synchronous: no I/O, no shared mutable state. The same input
 * always yields an equal RiskScore, and calls are safe from any thread.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditScoringService {

    private final FeatureExtractor featureExtractor;
    private final ScoreCombiner scoreCombiner;
    private final RiskAssessor riskAssessor;
    private final ComplianceChecker complianceChecker;
    private final InsightGenerator insightGenerator;

    public RiskScore assess(ApplicantInput input) {
        if (input == null) {
            throw new IllegalArgumentException("Applicant input cannot be null");
        }

        log.debug("Starting assessment for applicant: {}", input.userId());

        FeatureSet features = featureExtractor.extract(input);
        int creditScore = scoreCombiner.combine(features);
        RiskAssessment assessment = riskAssessor.assess(input, features, creditScore);
        ComplianceResult compliance = complianceChecker.check(input, assessment);

        RiskScore riskScore = RiskScore.builder()
                .userId(input.userId())
                .creditScore(creditScore)
                .riskBand(riskAssessor.riskBand(creditScore))
                .decision(assessment.decision())
                .maxEligibleAmount(assessment.maxLoanAmount())
                .interestRate(assessment.interestRate())
                .emiToIncomeRatio(assessment.emiToIncomeRatio())
                .defaultProbability(assessment.defaultProbability())
                .confidenceScore(assessment.confidence())
                .improvementSuggestions(insightGenerator.improvementSuggestions(features))
                .compliant(compliance.compliant())
                .violations(compliance.violations())
                .insights(insightGenerator.insights(features))
                .riskFactors(insightGenerator.riskFactors(features))
                .predictionAccuracy(assessment.predictionAccuracy())
                .build();

        log.info("Assessment completed for applicant: {} - Score: {}, Band: {}, Decision: {}",
                input.userId(), creditScore, riskScore.riskBand(), riskScore.decision());

        if (!riskScore.compliant()) {
            log.warn("Applicant {} fails {} compliance check(s): {}",
                    input.userId(), riskScore.violations().size(), riskScore.violations());
        } else if (riskScore.decision() == LendingDecision.REJECT) {
            log.info("Applicant {} rejected with default probability {}",
                    input.userId(), riskScore.defaultProbability());
        }

        return riskScore;
    }
}
