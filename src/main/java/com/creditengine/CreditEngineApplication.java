package com.creditengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Spring Boot entry point for the credit scoring engine.
 *
 * The engine turns one applicant's raw attributes into a full credit-risk
 * assessment:
 * - Feature extraction (income, payment, digital and risk features)
 * - Three independent score predictors combined with fixed weights
 * - Default probability, loan sizing, pricing and lending decision
 * - Regulatory compliance verdict and textual insights
 *
 * Architecture flow:
 * ApplicantInput -> FeatureExtractor -> Predictors -> ScoreCombiner
 *     -> RiskAssessor -> ComplianceChecker + InsightGenerator -> RiskScore
 *
 * No web server, database or broker is started. I/O layers (file ingestion,
 * dashboards, CSV export) inject {@code CreditScoringService} or
 * {@code BatchAssessmentService} and own everything outside the pipeline.
 */
@SpringBootApplication
@ConfigurationPropertiesScan  // Binds ScoringProperties once at startup
public class CreditEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreditEngineApplication.class, args);
    }
}
