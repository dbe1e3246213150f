package com.buildcheck.core.compat;

import com.buildcheck.core.model.CompatibilityResult;
import com.buildcheck.core.model.Component;

import java.util.Objects;

/**
 * A search candidate paired with its classification against the current build.
 *
 * @param component the candidate
 * @param compatibility its classification
 */
public record RatedCandidate(
    Component component,
    CompatibilityResult compatibility
) {
    /**
     * Compact constructor with validation.
     */
    public RatedCandidate {
        Objects.requireNonNull(compatibility, "compatibility must not be null");
    }
}
