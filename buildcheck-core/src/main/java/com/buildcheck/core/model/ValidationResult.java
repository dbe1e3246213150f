package com.buildcheck.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate outcome of validating a build snapshot.
 *
 * <p>{@code valid} and {@code complete} are independent: an empty build is valid but
 * incomplete, and a full build with a socket mismatch is complete but invalid.
 *
 * @param valid true when no issue has ERROR severity
 * @param complete true when every required slot is filled
 * @param issues errors and warnings, errors first in check order
 * @param powerAnalysis power budget of the build
 * @param missingComponents types of the empty required slots
 */
public record ValidationResult(
    boolean valid,
    boolean complete,
    List<ValidationIssue> issues,
    PowerAnalysis powerAnalysis,
    List<ComponentType> missingComponents
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationResult {
        Objects.requireNonNull(powerAnalysis, "powerAnalysis must not be null");
        issues = issues == null ? List.of() : List.copyOf(issues);
        missingComponents = missingComponents == null ? List.of() : List.copyOf(missingComponents);
    }

    /**
     * Returns the error-level issues.
     *
     * @return errors in report order
     */
    @JsonIgnore
    public List<ValidationIssue> errors() {
        return issues.stream().filter(ValidationIssue::isError).toList();
    }

    /**
     * Returns the warning-level issues.
     *
     * @return warnings in report order
     */
    @JsonIgnore
    public List<ValidationIssue> warnings() {
        return issues.stream().filter(issue -> !issue.isError()).toList();
    }
}
