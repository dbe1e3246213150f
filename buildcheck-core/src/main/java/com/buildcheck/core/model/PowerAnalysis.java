package com.buildcheck.core.model;

import java.util.Objects;

/**
 * Power budget derived from a build.
 *
 * @param totalTdp estimated total draw in watts, buffers included
 * @param recommendedPsu recommended PSU wattage, snapped to the tier ladder
 * @param currentPsu wattage of the selected PSU, null without a PSU
 * @param headroom {@code currentPsu - totalTdp}, null without a PSU
 * @param efficiencyAtLoad load at the recommended wattage, e.g. {@code "37%"}
 */
public record PowerAnalysis(
    int totalTdp,
    int recommendedPsu,
    Integer currentPsu,
    Integer headroom,
    String efficiencyAtLoad
) {
    /**
     * Compact constructor with validation.
     */
    public PowerAnalysis {
        Objects.requireNonNull(efficiencyAtLoad, "efficiencyAtLoad must not be null");
    }
}
