package com.buildcheck.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a validation issue.
 */
public enum IssueSeverity {
    /**
     * Hard incompatibility: the build cannot work as selected.
     */
    ERROR("error"),

    /**
     * Advisory: the build works but deserves a second look.
     */
    WARNING("warning");

    private final String label;

    IssueSeverity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
