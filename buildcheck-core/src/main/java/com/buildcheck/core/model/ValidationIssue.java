package com.buildcheck.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * One constraint violation found while validating a build.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * ValidationIssue issue = ValidationIssue.error(
 *     IssueCode.GPU_TOO_LONG,
 *     "GPU (400mm) exceeds case clearance (350mm)",
 *     List.of(ComponentType.GPU, ComponentType.CASE),
 *     "Select a GPU up to 350mm or a case with at least 400mm clearance (50mm over)"
 * );
 * }</pre>
 *
 * @param type severity
 * @param code issue identifier
 * @param message human-readable description with the concrete values
 * @param affectedComponents component types involved
 * @param suggestion optional remedy
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationIssue(
    IssueSeverity type,
    IssueCode code,
    String message,
    List<ComponentType> affectedComponents,
    String suggestion
) {
    /**
     * Compact constructor with validation.
     */
    public ValidationIssue {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        affectedComponents = affectedComponents == null ? List.of() : List.copyOf(affectedComponents);
    }

    /**
     * Create an error-level issue.
     *
     * @param code issue code
     * @param message message
     * @param affected component types involved
     * @param suggestion optional remedy
     * @return a new ValidationIssue with ERROR severity
     */
    public static ValidationIssue error(IssueCode code, String message, List<ComponentType> affected, String suggestion) {
        return new ValidationIssue(IssueSeverity.ERROR, code, message, affected, suggestion);
    }

    /**
     * Create a warning-level issue.
     *
     * @param code issue code
     * @param message message
     * @param affected component types involved
     * @param suggestion optional remedy
     * @return a new ValidationIssue with WARNING severity
     */
    public static ValidationIssue warning(IssueCode code, String message, List<ComponentType> affected, String suggestion) {
        return new ValidationIssue(IssueSeverity.WARNING, code, message, affected, suggestion);
    }

    @JsonIgnore
    public boolean isError() {
        return type == IssueSeverity.ERROR;
    }
}
