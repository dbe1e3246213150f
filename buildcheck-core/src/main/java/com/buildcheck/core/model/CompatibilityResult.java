package com.buildcheck.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Classification of one candidate against a build.
 *
 * @param status fit status
 * @param message explanation naming the concrete mismatch; null when compatible or unknown
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompatibilityResult(
    CompatibilityStatus status,
    String message
) {
    private static final CompatibilityResult COMPATIBLE = new CompatibilityResult(CompatibilityStatus.COMPATIBLE, null);
    private static final CompatibilityResult UNKNOWN = new CompatibilityResult(CompatibilityStatus.UNKNOWN, null);

    /**
     * Compact constructor with validation.
     */
    public CompatibilityResult {
        Objects.requireNonNull(status, "status must not be null");
    }

    public static CompatibilityResult compatible() {
        return COMPATIBLE;
    }

    public static CompatibilityResult unknown() {
        return UNKNOWN;
    }

    public static CompatibilityResult warning(String message) {
        return new CompatibilityResult(CompatibilityStatus.WARNING, message);
    }

    public static CompatibilityResult incompatible(String message) {
        return new CompatibilityResult(CompatibilityStatus.INCOMPATIBLE, message);
    }

    /**
     * Returns whether the candidate may be added to the build (compatible or warning).
     *
     * @return false only for incompatible candidates and unknown categories
     */
    @JsonIgnore
    public boolean isSelectable() {
        return status == CompatibilityStatus.COMPATIBLE || status == CompatibilityStatus.WARNING;
    }
}
