package com.creditengine.service;

import com.creditengine.config.ScoringProperties;
import com.creditengine.model.ApplicantInput;
import com.creditengine.model.ComplianceResult;
import com.creditengine.model.RiskAssessment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Checks assessed loan terms against the RBI digital lending thresholds.
 *
 * Four clauses are evaluated independently, in a fixed order, and every
 * failing clause is reported:
 * 1. Eligible amount within the loan cap
 * 2. Interest rate within the rate cap
 * 3. Monthly income at or above the income floor
 * 4. EMI-to-income ratio within the ceiling
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ComplianceChecker {

    private final ScoringProperties properties;

    public ComplianceResult check(ApplicantInput input, RiskAssessment assessment) {
        ScoringProperties.Regulatory regulatory = properties.regulatory();
        List<String> violations = new ArrayList<>();

        if (assessment.maxLoanAmount() > regulatory.loanCap()) {
            violations.add(String.format(Locale.ROOT,
                    "Loan amount exceeds RBI limit of %,.0f", regulatory.loanCap()));
        }
        if (assessment.interestRate() > regulatory.rateCap()) {
            violations.add(String.format(Locale.ROOT,
                    "Interest rate exceeds RBI cap of %.0f%%", regulatory.rateCap()));
        }
        if (input.monthlyIncome() < regulatory.minimumIncome()) {
            violations.add(String.format(Locale.ROOT,
                    "Income below minimum threshold of %,.0f", regulatory.minimumIncome()));
        }
        if (assessment.emiToIncomeRatio() > regulatory.maxEmiToIncomePercent()) {
            violations.add(String.format(Locale.ROOT,
                    "EMI-to-income ratio %.1f%% exceeds the %.0f%% ceiling",
                    assessment.emiToIncomeRatio(), regulatory.maxEmiToIncomePercent()));
        }

        if (!violations.isEmpty()) {
            log.debug("Compliance violations for applicant {}: {}", input.userId(), violations);
        }
        return new ComplianceResult(violations);
    }
}
