package com.buildcheck.core.power;

import java.util.ArrayList;
import java.util.List;

/**
 * Itemized power draw estimate, all values in watts.
 *
 * @param cpuPower CPU draw (maximum TDP preferred over nominal)
 * @param gpuPower GPU board power
 * @param basePower fixed allowance for motherboard, storage and fans
 * @param transientBuffer reserve for GPU power spikes
 * @param overclockBuffer reserve for overclocking
 * @param totalDraw sum of all of the above
 */
public record PowerBreakdown(
    int cpuPower,
    int gpuPower,
    int basePower,
    int transientBuffer,
    int overclockBuffer,
    int totalDraw
) {
    private static final String RULE = "─────────────";

    /**
     * Formats the breakdown for display. Zero-valued CPU, GPU and buffer lines are omitted.
     *
     * @return display lines ending with the total
     */
    public List<String> lines() {
        List<String> lines = new ArrayList<>();
        lines.add("Base System: " + basePower + "W");
        if (cpuPower > 0) {
            lines.add("CPU: " + cpuPower + "W");
        }
        if (gpuPower > 0) {
            lines.add("GPU: " + gpuPower + "W");
        }
        if (transientBuffer > 0) {
            lines.add("Transient Buffer: " + transientBuffer + "W");
        }
        if (overclockBuffer > 0) {
            lines.add("Overclock Buffer: " + overclockBuffer + "W");
        }
        lines.add(RULE);
        lines.add("Total Draw: " + totalDraw + "W");
        return List.copyOf(lines);
    }
}
