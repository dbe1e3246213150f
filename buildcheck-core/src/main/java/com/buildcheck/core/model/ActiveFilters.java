package com.buildcheck.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Search-narrowing constraints derived from a build. A null field places no constraint.
 *
 * @param socket CPU socket to lock searches to
 * @param memoryType memory generation to lock searches to
 * @param formFactor motherboard form factor to lock searches to
 */
public record ActiveFilters(
    @JsonProperty("socket") String socket,
    @JsonProperty("memory_type") String memoryType,
    @JsonProperty("form_factor") String formFactor
) {
    private static final ActiveFilters NONE = new ActiveFilters(null, null, null);

    public static ActiveFilters none() {
        return NONE;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return socket == null && memoryType == null && formFactor == null;
    }
}
