package com.buildcheck.core.power;

import com.buildcheck.core.model.Build;
import com.buildcheck.core.model.PowerAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the power budget of a build and the PSU wattage to recommend for it.
 *
 * <p><b>Policy:</b>
 * <ol>
 *   <li>CPU draw is the documented maximum TDP when present, else the nominal TDP.</li>
 *   <li>A fixed {@value #BASE_POWER}W covers motherboard, storage and fans.</li>
 *   <li>A transient buffer is reserved by GPU power: 0 below 200W, 75W below 300W,
 *       150W below 400W, 200W from 400W up.</li>
 *   <li>Overclocking adds 20% of CPU + GPU draw.</li>
 *   <li>The recommendation is 1.5x the total, rounded, then snapped up to the first
 *       tier of {@code 450, 550, 650, 750, 850, 1000, 1200, 1500}. Above 1500W the
 *       wattage stays at 1500 and the tier reads {@code "1500W+"}.</li>
 * </ol>
 *
 * <p>All methods are pure functions of their arguments. Totals saturate at
 * {@link Integer#MAX_VALUE} instead of overflowing.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * // 65W CPU, no GPU: 165W draw, 248W raw, 450W tier
 * PowerAnalysis analysis = PowerCalculator.calculatePowerRequirements(build);
 * analysis.recommendedPsu(); // 450
 * }</pre>
 */
public final class PowerCalculator {

    private static final Logger log = LoggerFactory.getLogger(PowerCalculator.class);

    /** Allowance for motherboard, storage and fans. */
    public static final int BASE_POWER = 100;

    /** Multiplier that keeps the PSU near its efficiency sweet spot. */
    public static final double HEADROOM_MULTIPLIER = 1.5;

    /** Fraction of CPU + GPU draw reserved for overclocking. */
    public static final double OVERCLOCK_FACTOR = 0.2;

    private static final List<Integer> PSU_TIERS = List.of(450, 550, 650, 750, 850, 1000, 1200, 1500);
    private static final int TOP_TIER = 1500;

    private static final int HIGH_POWER_GPU_WATTS = 300;

    private PowerCalculator() {
        // Utility class
    }

    /**
     * Calculates the power budget of a build without overclocking.
     *
     * @param build build snapshot
     * @return power analysis
     */
    public static PowerAnalysis calculatePowerRequirements(Build build) {
        return calculatePowerRequirements(build, false);
    }

    /**
     * Calculates the power budget of a build.
     *
     * @param build build snapshot
     * @param overclocking whether to reserve the overclocking buffer
     * @return power analysis
     */
    public static PowerAnalysis calculatePowerRequirements(Build build, boolean overclocking) {
        PowerBreakdown breakdown = breakdown(build, overclocking);
        int recommended = snapToTier(rawRecommendation(breakdown.totalDraw()));

        Integer currentPsu = build.psu() != null ? build.psu().wattage() : null;
        Integer headroom = currentPsu != null ? currentPsu - breakdown.totalDraw() : null;

        return new PowerAnalysis(
            breakdown.totalDraw(),
            recommended,
            currentPsu,
            headroom,
            efficiencyAtLoad(breakdown.totalDraw(), recommended)
        );
    }

    /**
     * Produces the full PSU recommendation with itemized draw, tier label and notes.
     *
     * @param build build snapshot
     * @param overclocking whether to reserve the overclocking buffer
     * @return recommendation
     */
    public static PsuRecommendation recommend(Build build, boolean overclocking) {
        PowerBreakdown breakdown = breakdown(build, overclocking);
        int raw = rawRecommendation(breakdown.totalDraw());
        int recommended = snapToTier(raw);
        double loadPercentage = loadPercentage(breakdown.totalDraw(), recommended);

        List<String> notes = new ArrayList<>();
        if (breakdown.gpuPower() >= HIGH_POWER_GPU_WATTS) {
            notes.add("High-power GPU detected. Consider a PSU with 12VHPWR connector for best results.");
        }
        if (breakdown.transientBuffer() > 0) {
            notes.add("Added " + breakdown.transientBuffer() + "W buffer for GPU transient power spikes.");
        }
        if (overclocking) {
            notes.add("Added " + breakdown.overclockBuffer() + "W for overclocking headroom.");
        }
        notes.add(efficiencyNote(loadPercentage));
        if (build.cpu() == null && build.gpu() == null) {
            notes.add("Add components to get an accurate PSU recommendation.");
        }

        log.debug("PSU recommendation: draw={}W raw={}W tier={}", breakdown.totalDraw(), raw, tierLabel(raw));

        return new PsuRecommendation(
            breakdown,
            recommended,
            tierLabel(raw),
            efficiencyAtLoad(breakdown.totalDraw(), recommended),
            notes
        );
    }

    /**
     * Itemizes the draw of a build.
     *
     * @param build build snapshot
     * @param overclocking whether to reserve the overclocking buffer
     * @return breakdown
     */
    public static PowerBreakdown breakdown(Build build, boolean overclocking) {
        int cpuPower = build.cpu() != null ? build.cpu().powerDraw() : 0;
        int gpuPower = build.gpu() != null ? build.gpu().powerDraw() : 0;
        int transientBuffer = transientBuffer(gpuPower);
        int overclockBuffer = overclocking ? saturate(Math.round(((long) cpuPower + gpuPower) * OVERCLOCK_FACTOR)) : 0;
        int totalDraw = saturate((long) BASE_POWER + cpuPower + gpuPower + transientBuffer + overclockBuffer);

        return new PowerBreakdown(cpuPower, gpuPower, BASE_POWER, transientBuffer, overclockBuffer, totalDraw);
    }

    /**
     * Returns the transient spike reserve for a GPU power draw.
     *
     * @param gpuPower GPU board power in watts
     * @return 0, 75, 150 or 200
     */
    public static int transientBuffer(int gpuPower) {
        if (gpuPower >= 400) {
            return 200;
        }
        if (gpuPower >= 300) {
            return 150;
        }
        if (gpuPower >= 200) {
            return 75;
        }
        return 0;
    }

    /**
     * Snaps a wattage up to the first tier that covers it, capping at the top tier.
     *
     * @param watts raw wattage
     * @return tier wattage
     */
    public static int snapToTier(int watts) {
        for (int tier : PSU_TIERS) {
            if (watts <= tier) {
                return tier;
            }
        }
        return TOP_TIER;
    }

    /**
     * Returns the tier label for a raw wattage, e.g. {@code "650W"}, or {@code "1500W+"}
     * beyond the top tier.
     *
     * @param watts raw wattage
     * @return tier label
     */
    public static String tierLabel(int watts) {
        if (watts > TOP_TIER) {
            return TOP_TIER + "W+";
        }
        return snapToTier(watts) + "W";
    }

    /**
     * Returns the minimum draw of a CPU/GPU pair, without headroom.
     *
     * @param cpuTdp CPU draw in watts
     * @param gpuTdp GPU draw in watts
     * @return minimum wattage
     */
    public static int minimumWattage(int cpuTdp, int gpuTdp) {
        return saturate((long) BASE_POWER + cpuTdp + gpuTdp + transientBuffer(gpuTdp));
    }

    /**
     * Checks a PSU wattage against a CPU/GPU pair.
     *
     * @param psuWattage PSU wattage, must be positive
     * @param cpuTdp CPU draw in watts
     * @param gpuTdp GPU draw in watts
     * @param includeHeadroom whether the PSU must also cover the 1.5x headroom
     * @return sufficiency, margin and load
     * @throws IllegalArgumentException if {@code psuWattage} is not positive
     */
    public static PsuSufficiency checkSufficiency(int psuWattage, int cpuTdp, int gpuTdp, boolean includeHeadroom) {
        if (psuWattage <= 0) {
            throw new IllegalArgumentException("PSU wattage must be positive: " + psuWattage);
        }
        int minimum = minimumWattage(cpuTdp, gpuTdp);
        int required = includeHeadroom ? rawRecommendation(minimum) : minimum;

        return new PsuSufficiency(
            psuWattage >= required,
            psuWattage - minimum,
            (double) minimum / psuWattage * 100
        );
    }

    private static int rawRecommendation(int totalDraw) {
        return saturate(Math.round(totalDraw * HEADROOM_MULTIPLIER));
    }

    // Sums clamp at Integer.MAX_VALUE so totals never decrease as inputs grow.
    private static int saturate(long watts) {
        return (int) Math.min(watts, Integer.MAX_VALUE);
    }

    private static double loadPercentage(int totalDraw, int wattage) {
        return (double) totalDraw / wattage * 100;
    }

    private static String efficiencyAtLoad(int totalDraw, int wattage) {
        return Math.round(loadPercentage(totalDraw, wattage)) + "%";
    }

    private static String efficiencyNote(double loadPercentage) {
        if (loadPercentage < 20) {
            return "Very low load - PSU may be oversized";
        } else if (loadPercentage <= 50) {
            return "Excellent efficiency range (20-50% load)";
        } else if (loadPercentage <= 80) {
            return "Good efficiency range (50-80% load)";
        }
        return "High load - consider a higher wattage PSU";
    }
}
