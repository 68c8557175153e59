package com.creditengine.model;

import java.util.List;

/**
 * Outcome of the regulatory check. Compliance is derived from the violation
 * list, so the flag and the list always agree.
 */
public record ComplianceResult(List<String> violations) {

    public ComplianceResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public boolean compliant() {
        return violations.isEmpty();
    }
}
