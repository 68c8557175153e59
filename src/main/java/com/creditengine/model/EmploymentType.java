package com.creditengine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Applicant's employment category.
 */
public enum EmploymentType {
    SALARIED("salaried"),
    SELF_EMPLOYED("self_employed"),
    DAILY_WAGE("daily_wage"),
    STUDENT("student"),
    UNEMPLOYED("unemployed");

    private final String label;

    EmploymentType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static EmploymentType fromLabel(String value) {
        for (EmploymentType type : values()) {
            if (type.label.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown employment type: " + value);
    }
}
