package com.buildcheck.core.compat;

import com.buildcheck.core.model.Build;
import com.buildcheck.core.model.CompatibilityResult;
import com.buildcheck.core.model.Component;
import com.buildcheck.core.model.Cooler;
import com.buildcheck.core.model.Cpu;
import com.buildcheck.core.model.Gpu;
import com.buildcheck.core.model.Motherboard;
import com.buildcheck.core.model.PcCase;
import com.buildcheck.core.model.PowerAnalysis;
import com.buildcheck.core.model.Psu;
import com.buildcheck.core.model.Ram;
import com.buildcheck.core.model.Storage;
import com.buildcheck.core.power.PowerCalculator;
import com.buildcheck.core.util.SupportedValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Classifies a candidate component against the components already in a build.
 *
 * <p>Each category has a fixed, ordered rule list. Rules only look at populated slots;
 * an empty slot makes its rule pass. The first failing rule decides the result, so a
 * hard mismatch early in the list hides later advisories.
 *
 * <h2>Rules by candidate category</h2>
 * <ul>
 *   <li><b>CPU:</b> motherboard socket (hard), cooler socket support (soft)</li>
 *   <li><b>GPU:</b> case clearance (hard), clearance under 20mm (soft), GPU's own PSU recommendation (soft)</li>
 *   <li><b>Motherboard:</b> CPU socket, RAM memory type, case form factor (all hard)</li>
 *   <li><b>RAM:</b> motherboard memory type, CPU memory type (both hard)</li>
 *   <li><b>PSU:</b> wattage below the build's recommended PSU (soft)</li>
 *   <li><b>Case:</b> GPU clearance, cooler clearance, motherboard form factor (all hard)</li>
 *   <li><b>Cooler:</b> CPU socket (hard), case clearance (hard), clearance under 10mm (soft), TDP rating below CPU draw (soft)</li>
 *   <li><b>Storage:</b> M.2 drive with no known M.2 slot on the motherboard (soft)</li>
 * </ul>
 *
 * <p>Unrecognized categories and null candidates classify as unknown; this class never throws
 * for a well-formed build.
 */
public final class CompatibilityChecker {

    private static final Logger log = LoggerFactory.getLogger(CompatibilityChecker.class);

    /** GPU clearance below which a fitting card is flagged as a tight fit. */
    public static final int GPU_TIGHT_MARGIN_MM = 20;

    /** Cooler clearance below which a fitting cooler is flagged as a tight fit. */
    public static final int COOLER_TIGHT_MARGIN_MM = 10;

    private static final String M2_FORM_FACTOR = "M.2-2280";

    private CompatibilityChecker() {
        // Utility class
    }

    /**
     * Classifies a candidate against a build.
     *
     * @param candidate component under consideration, may be null
     * @param build current build
     * @return classification; {@code unknown} for null or unrecognized candidates
     */
    public static CompatibilityResult checkComponentCompatibility(Component candidate, Build build) {
        Objects.requireNonNull(build, "build must not be null");
        if (candidate == null) {
            return CompatibilityResult.unknown();
        }

        CompatibilityResult result = switch (candidate.type()) {
            case CPU -> checkCpu((Cpu) candidate, build);
            case GPU -> checkGpu((Gpu) candidate, build);
            case MOTHERBOARD -> checkMotherboard((Motherboard) candidate, build);
            case RAM -> checkRam((Ram) candidate, build);
            case PSU -> checkPsu((Psu) candidate, build);
            case CASE -> checkCase((PcCase) candidate, build);
            case COOLER -> checkCooler((Cooler) candidate, build);
            case STORAGE -> checkStorage((Storage) candidate, build);
            case UNKNOWN -> CompatibilityResult.unknown();
        };

        log.debug("{} {} -> {}", candidate.type().label(), candidate.model(), result.status());
        return result;
    }

    /**
     * Classifies a list of candidates, e.g. one page of search results.
     *
     * @param candidates candidates in display order
     * @param build current build
     * @return one entry per candidate, in the same order
     */
    public static List<RatedCandidate> checkAll(List<? extends Component> candidates, Build build) {
        List<RatedCandidate> rated = new ArrayList<>(candidates.size());
        for (Component candidate : candidates) {
            rated.add(new RatedCandidate(candidate, checkComponentCompatibility(candidate, build)));
        }
        return List.copyOf(rated);
    }

    private static CompatibilityResult checkCpu(Cpu cpu, Build build) {
        Motherboard motherboard = build.motherboard();
        if (motherboard != null && !Objects.equals(cpu.socket(), motherboard.socket())) {
            return CompatibilityResult.incompatible(String.format(
                "Socket mismatch: This CPU uses %s, but your motherboard (%s) has %s",
                cpu.socket(), motherboard.model(), motherboard.socket()));
        }

        Cooler cooler = build.cooler();
        if (cooler != null && !SupportedValues.contains(cooler.socketSupport(), cpu.socket())) {
            return CompatibilityResult.warning(String.format(
                "Your cooler (%s) may not support %s socket", cooler.model(), cpu.socket()));
        }

        return CompatibilityResult.compatible();
    }

    private static CompatibilityResult checkGpu(Gpu gpu, Build build) {
        PcCase pcCase = build.pcCase();
        if (pcCase != null && gpu.lengthMm() != null && pcCase.maxGpuLengthMm() != null) {
            int length = gpu.lengthMm();
            int clearance = pcCase.maxGpuLengthMm();
            if (length > clearance) {
                return CompatibilityResult.incompatible(String.format(
                    "Too long: This GPU is %dmm, but your case (%s) only fits %dmm (%dmm over)",
                    length, pcCase.model(), clearance, length - clearance));
            }
            int margin = clearance - length;
            if (margin < GPU_TIGHT_MARGIN_MM) {
                return CompatibilityResult.warning(String.format(
                    "Tight fit: Only %dmm clearance in your case (%s)", margin, pcCase.model()));
            }
        }

        Psu psu = build.psu();
        Integer recommended = gpu.recommendedPsuWatts();
        if (psu != null && psu.wattage() != null && recommended != null && recommended > 0
            && psu.wattage() < recommended) {
            return CompatibilityResult.warning(String.format(
                "Your PSU (%s, %dW) may be insufficient. This GPU recommends %dW",
                psu.model(), psu.wattage(), recommended));
        }

        return CompatibilityResult.compatible();
    }

    private static CompatibilityResult checkMotherboard(Motherboard motherboard, Build build) {
        Cpu cpu = build.cpu();
        if (cpu != null && !Objects.equals(motherboard.socket(), cpu.socket())) {
            return CompatibilityResult.incompatible(String.format(
                "Socket mismatch: This motherboard has %s, but your CPU (%s) uses %s",
                motherboard.socket(), cpu.model(), cpu.socket()));
        }

        Ram ram = build.ram();
        if (ram != null && !SupportedValues.contains(motherboard.memoryType(), ram.memoryType())) {
            return CompatibilityResult.incompatible(String.format(
                "Memory mismatch: This motherboard supports %s, but your RAM (%s) is %s",
                SupportedValues.format(motherboard.memoryType()), ram.model(), ram.memoryType()));
        }

        PcCase pcCase = build.pcCase();
        if (pcCase != null && !SupportedValues.contains(pcCase.formFactorSupport(), motherboard.formFactor())) {
            return CompatibilityResult.incompatible(String.format(
                "Form factor mismatch: This %s motherboard won't fit in your case (%s)",
                motherboard.formFactor(), pcCase.model()));
        }

        return CompatibilityResult.compatible();
    }

    private static CompatibilityResult checkRam(Ram ram, Build build) {
        Motherboard motherboard = build.motherboard();
        if (motherboard != null && !SupportedValues.contains(motherboard.memoryType(), ram.memoryType())) {
            return CompatibilityResult.incompatible(String.format(
                "Memory mismatch: This %s RAM won't work with your motherboard (%s) which supports %s",
                ram.memoryType(), motherboard.model(), SupportedValues.format(motherboard.memoryType())));
        }

        Cpu cpu = build.cpu();
        if (cpu != null && !SupportedValues.contains(cpu.memoryType(), ram.memoryType())) {
            return CompatibilityResult.incompatible(String.format(
                "Memory mismatch: Your CPU (%s) doesn't support %s memory", cpu.model(), ram.memoryType()));
        }

        return CompatibilityResult.compatible();
    }

    private static CompatibilityResult checkPsu(Psu psu, Build build) {
        PowerAnalysis analysis = PowerCalculator.calculatePowerRequirements(build);
        int required = analysis.recommendedPsu();
        int wattage = psu.wattage() != null ? psu.wattage() : 0;

        if (wattage < required) {
            List<String> drawing = new ArrayList<>();
            if (build.cpu() != null) {
                drawing.add(build.cpu().model());
            }
            if (build.gpu() != null) {
                drawing.add(build.gpu().model());
            }
            String forComponents = drawing.isEmpty() ? "" : " for your " + String.join(" + ", drawing);
            return CompatibilityResult.warning(String.format(
                "Insufficient wattage: This %dW PSU is %dW below the recommended %dW%s",
                wattage, required - wattage, required, forComponents));
        }

        return CompatibilityResult.compatible();
    }

    private static CompatibilityResult checkCase(PcCase pcCase, Build build) {
        Gpu gpu = build.gpu();
        if (gpu != null && gpu.lengthMm() != null && pcCase.maxGpuLengthMm() != null
            && gpu.lengthMm() > pcCase.maxGpuLengthMm()) {
            return CompatibilityResult.incompatible(String.format(
                "GPU won't fit: Your GPU (%s) is %dmm, but this case only fits %dmm (%dmm over)",
                gpu.model(), gpu.lengthMm(), pcCase.maxGpuLengthMm(), gpu.lengthMm() - pcCase.maxGpuLengthMm()));
        }

        Cooler cooler = build.cooler();
        if (cooler != null && cooler.heightMm() != null && pcCase.maxCoolerHeightMm() != null
            && cooler.heightMm() > pcCase.maxCoolerHeightMm()) {
            return CompatibilityResult.incompatible(String.format(
                "Cooler won't fit: Your cooler (%s) is %dmm tall, but this case only fits %dmm (%dmm over)",
                cooler.model(), cooler.heightMm(), pcCase.maxCoolerHeightMm(),
                cooler.heightMm() - pcCase.maxCoolerHeightMm()));
        }

        Motherboard motherboard = build.motherboard();
        if (motherboard != null && !SupportedValues.contains(pcCase.formFactorSupport(), motherboard.formFactor())) {
            return CompatibilityResult.incompatible(String.format(
                "Form factor mismatch: Your motherboard (%s) is %s, which this case doesn't support",
                motherboard.model(), motherboard.formFactor()));
        }

        return CompatibilityResult.compatible();
    }

    private static CompatibilityResult checkCooler(Cooler cooler, Build build) {
        Cpu cpu = build.cpu();
        if (cpu != null && !SupportedValues.contains(cooler.socketSupport(), cpu.socket())) {
            return CompatibilityResult.incompatible(String.format(
                "Socket mismatch: This cooler doesn't support %s socket used by your CPU (%s)",
                cpu.socket(), cpu.model()));
        }

        PcCase pcCase = build.pcCase();
        if (pcCase != null && cooler.heightMm() != null && pcCase.maxCoolerHeightMm() != null) {
            int height = cooler.heightMm();
            int clearance = pcCase.maxCoolerHeightMm();
            if (height > clearance) {
                return CompatibilityResult.incompatible(String.format(
                    "Too tall: This %dmm cooler won't fit in your case (%s) which allows %dmm max (%dmm over)",
                    height, pcCase.model(), clearance, height - clearance));
            }
            int margin = clearance - height;
            if (margin < COOLER_TIGHT_MARGIN_MM) {
                return CompatibilityResult.warning(String.format(
                    "Tight fit: Only %dmm clearance in your case (%s)", margin, pcCase.model()));
            }
        }

        Integer rating = cooler.tdpRating();
        if (cpu != null && rating != null && rating > 0 && rating < cpu.powerDraw()) {
            return CompatibilityResult.warning(String.format(
                "May run hot: This cooler is rated for %dW, but your CPU (%s) draws %dW",
                rating, cpu.model(), cpu.powerDraw()));
        }

        return CompatibilityResult.compatible();
    }

    private static CompatibilityResult checkStorage(Storage storage, Build build) {
        Motherboard motherboard = build.motherboard();
        if (motherboard != null && M2_FORM_FACTOR.equals(storage.formFactor())) {
            Integer m2Slots = motherboard.m2Slots();
            if (m2Slots == null || m2Slots == 0) {
                return CompatibilityResult.warning(String.format(
                    "M.2 slot availability unknown: Verify your motherboard (%s) has M.2 slots",
                    motherboard.model()));
            }
        }

        return CompatibilityResult.compatible();
    }
}
