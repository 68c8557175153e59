package com.creditengine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Process-wide scoring policy table: ensemble weights, pricing, loan sizing,
 * regulatory caps, risk-band boundaries and batch concurrency.
 *
 * Bound once at startup from {@code credit.scoring.*} and immutable afterwards,
 * so every worker thread reads the same values without locking.
 * Invalid tables (weights not summing to 1, inverted rate range, unordered
 * bands) fail startup through Bean Validation.
 */
@Validated
@ConfigurationProperties(prefix = "credit.scoring")
public record ScoringProperties(
        @Valid @NotNull Ensemble ensemble,
        @Valid @NotNull Pricing pricing,
        @Valid @NotNull Lending lending,
        @Valid @NotNull Regulatory regulatory,
        @Valid @NotNull Bands bands,
        @Valid @NotNull Batch batch) {

    /**
     * The same table that {@code application.yml} ships, for callers that
     * use the engine without a Spring context.
     */
    public static ScoringProperties defaults() {
        return new ScoringProperties(
                new Ensemble(0.40, 0.35, 0.25),
                new Pricing(12.0, 10.0, 26.0),
                new Lending(0.3, 1.5, 0.3),
                new Regulatory(125_000, 26.0, 5_000, 50.0),
                new Bands(750, 650, 550, 450),
                new Batch(3));
    }

    /**
     * Weights of the three predictors in the combined score.
     */
    public record Ensemble(
            @PositiveOrZero double ruleCascadeWeight,
            @PositiveOrZero double iterativeResidualWeight,
            @PositiveOrZero double layeredWeight) {

        @AssertTrue(message = "ensemble weights must sum to 1")
        public boolean isNormalized() {
            return Math.abs(ruleCascadeWeight + iterativeResidualWeight + layeredWeight - 1.0) < 1e-9;
        }
    }

    /**
     * Annual interest rate policy, in percent.
     */
    public record Pricing(
            @Positive double baseRate,
            @Positive double minRate,
            @Positive double maxRate) {

        @AssertTrue(message = "minRate must not exceed maxRate")
        public boolean isRangeValid() {
            return minRate <= maxRate;
        }
    }

    /**
     * Loan sizing: share of annual income that may be lent, ceiling on the
     * score multiplier and floor on the default-risk haircut.
     */
    public record Lending(
            @Positive double annualIncomeShare,
            @Positive double maxScoreMultiplier,
            @Positive double minRiskAdjustment) {
    }

    /**
     * Regulatory thresholds checked by the compliance checker.
     */
    public record Regulatory(
            @Positive double loanCap,
            @Positive double rateCap,
            @Positive double minimumIncome,
            @Positive double maxEmiToIncomePercent) {
    }

    /**
     * Lower score bound of each risk band; anything below {@code poor} is Very Poor.
     */
    public record Bands(int excellent, int good, int fair, int poor) {

        @AssertTrue(message = "band boundaries must be strictly descending")
        public boolean isOrdered() {
            return excellent > good && good > fair && fair > poor;
        }
    }

    public record Batch(@Min(1) int concurrency) {
    }
}
