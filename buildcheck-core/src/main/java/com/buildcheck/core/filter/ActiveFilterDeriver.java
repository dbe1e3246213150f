package com.buildcheck.core.filter;

import com.buildcheck.core.model.ActiveFilters;
import com.buildcheck.core.model.Build;
import com.buildcheck.core.model.PcCase;
import com.buildcheck.core.util.SupportedValues;

import java.util.List;
import java.util.Objects;

/**
 * Turns a build into the constraints the search layer applies when listing candidates
 * for the next slot.
 *
 * <p>Each filter is derived independently:
 * <ul>
 *   <li><b>socket:</b> from the CPU, else the motherboard</li>
 *   <li><b>memory_type:</b> from the motherboard when it supports exactly one generation,
 *       else from the RAM; a multi-generation board without RAM locks nothing</li>
 *   <li><b>form_factor:</b> the first of ATX, Micro-ATX, Mini-ITX the case supports</li>
 * </ul>
 *
 * <p>Only one form factor is returned even when the case supports several; the search
 * layer expects a single value per filter.
 */
public final class ActiveFilterDeriver {

    /** Form factors in the order they are preferred as a search target. */
    static final List<String> FORM_FACTOR_PRIORITY = List.of("ATX", "Micro-ATX", "Mini-ITX");

    private ActiveFilterDeriver() {
        // Utility class
    }

    /**
     * Derives the active filters of a build.
     *
     * @param build build snapshot
     * @return filters, each null when unconstrained
     */
    public static ActiveFilters deriveActiveFilters(Build build) {
        Objects.requireNonNull(build, "build must not be null");
        return new ActiveFilters(socket(build), memoryType(build), formFactor(build.pcCase()));
    }

    private static String socket(Build build) {
        if (build.cpu() != null) {
            return build.cpu().socket();
        }
        if (build.motherboard() != null) {
            return build.motherboard().socket();
        }
        return null;
    }

    private static String memoryType(Build build) {
        if (build.motherboard() != null && build.motherboard().memoryType().size() == 1) {
            return build.motherboard().memoryType().get(0);
        }
        if (build.ram() != null) {
            return build.ram().memoryType();
        }
        return null;
    }

    private static String formFactor(PcCase pcCase) {
        if (pcCase == null) {
            return null;
        }
        for (String candidate : FORM_FACTOR_PRIORITY) {
            boolean supported = pcCase.formFactorSupport().stream()
                .anyMatch(value -> SupportedValues.matches(value, candidate));
            if (supported) {
                return candidate;
            }
        }
        return null;
    }
}
