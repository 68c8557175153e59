package com.creditengine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Final lending decision. Re-derived on every assessment, never stored.
 */
public enum LendingDecision {
    APPROVE("Approve"),   // Auto-approve
    REVIEW("Review"),     // Needs human review
    REJECT("Reject");     // Credit denied

    private final String label;

    LendingDecision(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
