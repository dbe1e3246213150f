package com.buildcheck.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Fit of a candidate component against the current build.
 */
public enum CompatibilityStatus {
    /** No rule fails. */
    COMPATIBLE,

    /** Only an advisory rule triggered; the component can still be added. */
    WARNING,

    /** A hard rule fails; the component must not be added. */
    INCOMPATIBLE,

    /** The component's category is not recognized. */
    UNKNOWN;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
