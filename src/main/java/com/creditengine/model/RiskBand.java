package com.creditengine.model;

import com.creditengine.config.ScoringProperties;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk band derived from the credit score.
 */
public enum RiskBand {
    EXCELLENT("Excellent"),  // Strong repayment profile
    GOOD("Good"),
    FAIR("Fair"),
    POOR("Poor"),
    VERY_POOR("Very Poor");  // Major red flags

    private final String label;

    RiskBand(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static RiskBand fromScore(int score, ScoringProperties.Bands bands) {
        if (score >= bands.excellent()) return EXCELLENT;
        if (score >= bands.good()) return GOOD;
        if (score >= bands.fair()) return FAIR;
        if (score >= bands.poor()) return POOR;
        return VERY_POOR;
    }
}
