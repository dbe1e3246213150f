package com.buildcheck.core.power;

import java.util.List;
import java.util.Objects;

/**
 * Full PSU recommendation for a build.
 *
 * @param breakdown itemized draw
 * @param recommendedWattage recommended wattage on the tier ladder
 * @param recommendedTier tier label, e.g. {@code "750W"} or {@code "1500W+"}
 * @param efficiencyAtLoad load at the recommended wattage, e.g. {@code "42%"}
 * @param notes advisory notes in display order
 */
public record PsuRecommendation(
    PowerBreakdown breakdown,
    int recommendedWattage,
    String recommendedTier,
    String efficiencyAtLoad,
    List<String> notes
) {
    /**
     * Compact constructor with validation.
     */
    public PsuRecommendation {
        Objects.requireNonNull(breakdown, "breakdown must not be null");
        Objects.requireNonNull(recommendedTier, "recommendedTier must not be null");
        Objects.requireNonNull(efficiencyAtLoad, "efficiencyAtLoad must not be null");
        notes = notes == null ? List.of() : List.copyOf(notes);
    }
}
