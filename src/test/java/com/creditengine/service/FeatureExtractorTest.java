package com.creditengine.service;

import com.creditengine.ApplicantFixtures;
import com.creditengine.model.ApplicantInput;
import com.creditengine.model.EmploymentType;
import com.creditengine.model.FeatureSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FeatureExtractor Tests")
class FeatureExtractorTest {

    private final FeatureExtractor extractor = new FeatureExtractor();

    @Test
    @DisplayName("Should derive every feature of the average applicant")
    void extractsAllFeatures() {
        FeatureSet features = extractor.extract(ApplicantFixtures.averageApplicantAtIncomeFloor());

        assertThat(features.incomeConsistency()).isEqualTo(1.0);
        assertThat(features.incomeToExpenseRatio()).isCloseTo(5_000.0 / 3_000, within(1e-12));
        assertThat(features.disposableIncome()).isEqualTo(1_500.0);
        assertThat(features.paymentConsistency()).isCloseTo(1 - Math.sqrt(12.5) / 100, within(1e-12));
        assertThat(features.paymentTrend()).isCloseTo(2.0, within(1e-12));
        assertThat(features.digitalMaturity()).isCloseTo(0.46, within(1e-12));
        assertThat(features.transactionVelocity()).isCloseTo(20.0 / 30, within(1e-12));
        assertThat(features.leverageRatio()).isCloseTo(0.1, within(1e-12));
        assertThat(features.emergencyBuffer()).isEqualTo(2.0);
        assertThat(features.defaultRiskIndex()).isZero();
        assertThat(features.ageRisk()).isZero();
        assertThat(features.employmentRisk()).isZero();
        assertThat(features.locationRisk()).isEqualTo(0.05);
        assertThat(features.toVector()).hasSize(FeatureSet.FEATURE_COUNT);
    }

    @Test
    @DisplayName("Income consistency is not capped at 1")
    void incomeConsistencyUncapped() {
        FeatureSet features = extractor.extract(ApplicantFixtures.strongApplicant());

        assertThat(features.incomeConsistency()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Disposable income never goes negative")
    void disposableIncomeFloored() {
        FeatureSet features = extractor.extract(ApplicantFixtures.weakApplicant());

        assertThat(features.disposableIncome()).isZero();
    }

    @Nested
    @DisplayName("Payment behavior")
    class PaymentBehavior {

        @Test
        @DisplayName("Identical on-time values give maximal consistency and a flat trend")
        void zeroVarianceIsFullyConsistent() {
            double[] flat = {40, 40, 40, 40};

            assertThat(extractor.paymentConsistency(flat)).isEqualTo(1.0);
            assertThat(extractor.paymentTrend(flat)).isZero();
        }

        @Test
        @DisplayName("Consistency is floored at zero")
        void consistencyFlooredAtZero() {
            assertThat(extractor.paymentConsistency(new double[]{0, 100, 0, 100})).isEqualTo(0.5);
            assertThat(extractor.paymentConsistency(new double[]{0, 1_000, 0, 1_000})).isZero();
        }

        @Test
        @DisplayName("Improving and degrading histories give opposite slopes")
        void trendSign() {
            assertThat(extractor.paymentTrend(new double[]{60, 70, 80, 90})).isCloseTo(10.0, within(1e-12));
            assertThat(extractor.paymentTrend(new double[]{90, 80, 70, 60})).isCloseTo(-10.0, within(1e-12));
        }
    }

    @Nested
    @DisplayName("Risk indices")
    class RiskIndices {

        @Test
        @DisplayName("Default risk accumulates defaults, leverage and thin savings, capped at 1")
        void defaultRiskIndex() {
            assertThat(extractor.defaultRiskIndex(0, 0.2, 3)).isZero();
            assertThat(extractor.defaultRiskIndex(1, 0.2, 3)).isCloseTo(0.3, within(1e-12));
            assertThat(extractor.defaultRiskIndex(0, 0.5, 0.5)).isCloseTo(0.35, within(1e-12));
            assertThat(extractor.defaultRiskIndex(5, 0.9, 0.1)).isEqualTo(1.0);
        }

        @ParameterizedTest(name = "age {0} -> {1}")
        @CsvSource({"18, 0.3", "20, 0.3", "21, 0.1", "24, 0.1", "25, 0.0", "60, 0.0", "61, 0.1", "65, 0.1", "66, 0.3"})
        void ageRisk(int age, double expected) {
            assertThat(extractor.ageRisk(age)).isEqualTo(expected);
        }

        @ParameterizedTest(name = "tier {0} -> {1}")
        @CsvSource({"1, 0.0", "2, 0.05", "3, 0.1", "4, 0.15"})
        void locationRisk(int tier, double expected) {
            assertThat(extractor.locationRisk(tier)).isEqualTo(expected);
        }

        @ParameterizedTest(name = "{0} with {1} years -> {2}")
        @CsvSource({
                "SALARIED, 5, 0.0",
                "SALARIED, 0.5, 0.1",
                "SELF_EMPLOYED, 2, 0.0",
                "DAILY_WAGE, 2, 0.2",
                "STUDENT, 0, 0.4",
                "UNEMPLOYED, 0, 0.6"
        })
        void employmentRisk(EmploymentType type, double years, double expected) {
            ApplicantInput input = ApplicantFixtures.strongApplicant().toBuilder()
                    .employmentType(type)
                    .yearsOfEmployment(years)
                    .build();

            assertThat(extractor.employmentRisk(input)).isCloseTo(expected, within(1e-12));
        }

        @Test
        @DisplayName("Daily-wage income type counts as daily-wage employment")
        void dailyWageIncomeType() {
            ApplicantInput input = ApplicantFixtures.strongApplicant().toBuilder()
                    .employmentType(EmploymentType.SELF_EMPLOYED)
                    .incomeType("daily_wage")
                    .build();

            assertThat(extractor.employmentRisk(input)).isEqualTo(0.2);
        }
    }

    @Test
    @DisplayName("Digital maturity is capped at 1")
    void digitalMaturityCapped() {
        ApplicantInput heavyUser = ApplicantFixtures.strongApplicant().toBuilder()
                .upiTransactionsPerMonth(500)
                .digitalWalletUsage(100)
                .onlineBillPayments(100)
                .build();

        assertThat(extractor.digitalMaturity(heavyUser)).isEqualTo(1.0);
    }
}
