package com.buildcheck.core.power;

/**
 * Result of checking a PSU wattage against a CPU/GPU pair.
 *
 * @param sufficient whether the PSU meets the (optionally headroom-adjusted) requirement
 * @param margin PSU wattage minus the minimum draw; negative when underpowered
 * @param loadPercentage minimum draw as a percentage of the PSU wattage
 */
public record PsuSufficiency(
    boolean sufficient,
    int margin,
    double loadPercentage
) {
}
