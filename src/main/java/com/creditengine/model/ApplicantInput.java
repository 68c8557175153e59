package com.creditengine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Raw attributes of one applicant, as handed over by the ingestion layer.
 *
 * IMMUTABLE: one record per assessment, never modified by the engine.
 *
 * The compact constructor is the engine's only input gate. Income and
 * expenses are divisors further down the pipeline, so a non-positive value
 * would otherwise surface as NaN or Infinity in the score. Malformed input is
 * rejected here, before any assessment starts.
 */
@Builder(toBuilder = true)
public record ApplicantInput(
        @JsonProperty("user_id") String userId,
        @JsonProperty("monthly_income") double monthlyIncome,
        @JsonProperty("monthly_expenses") double monthlyExpenses,
        @JsonProperty("existing_loan_emi") double existingLoanEmi,
        @JsonProperty("credit_card_outstanding") double creditCardOutstanding,
        @JsonProperty("income_stability_months") int incomeStabilityMonths,
        @JsonProperty("electricity_bill_on_time") double electricityBillOnTime,
        @JsonProperty("dth_recharge_on_time") double dthRechargeOnTime,
        @JsonProperty("internet_bill_on_time") double internetBillOnTime,
        @JsonProperty("rent_payment_on_time") double rentPaymentOnTime,
        @JsonProperty("upi_transactions_per_month") int upiTransactionsPerMonth,
        @JsonProperty("digital_wallet_usage") double digitalWalletUsage,
        @JsonProperty("online_bill_payments") double onlineBillPayments,
        @JsonProperty("emergency_savings") double emergencySavings,
        @JsonProperty("previous_loan_defaults") int previousLoanDefaults,
        @JsonProperty("age") int age,
        @JsonProperty("employment_type") EmploymentType employmentType,
        @JsonProperty("income_type") String incomeType,
        @JsonProperty("years_of_employment") double yearsOfEmployment,
        @JsonProperty("city_tier") int cityTier
) {
    private static final String DAILY_WAGE_INCOME = "daily_wage";

    public ApplicantInput {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID cannot be null or empty");
        }
        if (!(monthlyIncome > 0) || Double.isInfinite(monthlyIncome)) {
            throw new IllegalArgumentException("Monthly income must be positive: " + userId);
        }
        if (!(monthlyExpenses > 0) || Double.isInfinite(monthlyExpenses)) {
            throw new IllegalArgumentException("Monthly expenses must be positive: " + userId);
        }
        if (employmentType == null) {
            throw new IllegalArgumentException("Employment type cannot be null: " + userId);
        }
        if (cityTier < 1 || cityTier > 4) {
            throw new IllegalArgumentException("City tier must be between 1 and 4: " + userId);
        }

        requireNonNegative("existingLoanEmi", existingLoanEmi);
        requireNonNegative("creditCardOutstanding", creditCardOutstanding);
        requireNonNegative("incomeStabilityMonths", incomeStabilityMonths);
        requirePercentage("electricityBillOnTime", electricityBillOnTime);
        requirePercentage("dthRechargeOnTime", dthRechargeOnTime);
        requirePercentage("internetBillOnTime", internetBillOnTime);
        requirePercentage("rentPaymentOnTime", rentPaymentOnTime);
        requireNonNegative("upiTransactionsPerMonth", upiTransactionsPerMonth);
        requirePercentage("digitalWalletUsage", digitalWalletUsage);
        requirePercentage("onlineBillPayments", onlineBillPayments);
        requireNonNegative("emergencySavings", emergencySavings);
        requireNonNegative("previousLoanDefaults", previousLoanDefaults);
        requireNonNegative("age", age);
        requireNonNegative("yearsOfEmployment", yearsOfEmployment);
    }

    /**
     * On-time percentages in fixed channel order: electricity, DTH, internet, rent.
     */
    public double[] paymentOnTimeHistory() {
        return new double[]{electricityBillOnTime, dthRechargeOnTime, internetBillOnTime, rentPaymentOnTime};
    }

    public boolean isDailyWageIncome() {
        return employmentType == EmploymentType.DAILY_WAGE || DAILY_WAGE_INCOME.equalsIgnoreCase(incomeType);
    }

    private static void requireNonNegative(String field, double value) {
        // Also rejects NaN
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(field + " must be a non-negative finite number, was " + value);
        }
    }

    private static void requirePercentage(String field, double value) {
        requireNonNegative(field, value);
        if (value > 100) {
            throw new IllegalArgumentException(field + " must not exceed 100, was " + value);
        }
    }
}
