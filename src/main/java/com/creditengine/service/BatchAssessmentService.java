package com.creditengine.service;

import com.creditengine.config.AssessmentExecutorConfig;
import com.creditengine.model.ApplicantInput;
import com.creditengine.model.LendingDecision;
import com.creditengine.model.PortfolioSummary;
import com.creditengine.model.RiskScore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Assesses many applicants in parallel.
 *
 * PARALLELISM:
 * ============
 * Applicants are independent: each pipeline reads only its own input, so
 * they are fanned out over the assessment executor with no locking.
 * Results come back in input order regardless of completion order.
 *
 * FAILURE HANDLING:
 * =================
 * Inputs are validated when constructed, so a failure here is a programming
 * error. The first failure is logged and rethrown; partial results are not
 * returned.
 */
@Service
@Slf4j
public class BatchAssessmentService {

    private final CreditScoringService creditScoringService;
    private final Executor executor;

    public BatchAssessmentService(CreditScoringService creditScoringService,
                                  @Qualifier(AssessmentExecutorConfig.ASSESSMENT_EXECUTOR) Executor executor) {
        this.creditScoringService = creditScoringService;
        this.executor = executor;
    }

    public List<RiskScore> assessAll(Collection<ApplicantInput> applicants) {
        if (applicants == null || applicants.isEmpty()) {
            return List.of();
        }

        log.info("Starting batch assessment of {} applicants", applicants.size());

        List<CompletableFuture<RiskScore>> futures = applicants.stream()
                .map(applicant -> CompletableFuture.supplyAsync(
                        () -> creditScoringService.assess(applicant), executor))
                .toList();

        try {
            List<RiskScore> scores = futures.stream()
                    .map(CompletableFuture::join)
                    .toList();
            log.info("Finished batch assessment of {} applicants", scores.size());
            return scores;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Batch assessment failed: {}", cause.getMessage(), cause);
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Batch assessment failed", cause);
        }
    }

    /**
     * Assess the batch and aggregate the results.
     */
    public PortfolioSummary assessPortfolio(Collection<ApplicantInput> applicants) {
        PortfolioSummary summary = PortfolioSummary.of(assessAll(applicants));
        log.info("Portfolio summary: {} applicants, average score {}, approved {}, compliant {}",
                summary.applicantCount(), Math.round(summary.averageCreditScore()),
                summary.count(LendingDecision.APPROVE), summary.compliantCount());
        return summary;
    }
}
