package com.buildcheck.core.validation;

import com.buildcheck.core.model.Build;
import com.buildcheck.core.model.ComponentType;
import com.buildcheck.core.model.Cooler;
import com.buildcheck.core.model.Cpu;
import com.buildcheck.core.model.Gpu;
import com.buildcheck.core.model.IssueCode;
import com.buildcheck.core.model.Motherboard;
import com.buildcheck.core.model.PcCase;
import com.buildcheck.core.model.PowerAnalysis;
import com.buildcheck.core.model.Ram;
import com.buildcheck.core.model.ValidationIssue;
import com.buildcheck.core.model.ValidationResult;
import com.buildcheck.core.power.PowerCalculator;
import com.buildcheck.core.util.SupportedValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.buildcheck.core.compat.CompatibilityChecker.COOLER_TIGHT_MARGIN_MM;
import static com.buildcheck.core.compat.CompatibilityChecker.GPU_TIGHT_MARGIN_MM;

/**
 * Validates a whole build and aggregates every violation into one report.
 *
 * <p>Unlike {@link com.buildcheck.core.compat.CompatibilityChecker}, which stops at the first
 * failing rule for one candidate, the validator evaluates every pairwise check
 * independently and reports all of them.
 *
 * <p><b>Checks:</b>
 * <ul>
 *   <li>Errors: {@code SOCKET_MISMATCH}, {@code MEMORY_TYPE_MISMATCH}, {@code GPU_TOO_LONG},
 *       {@code COOLER_TOO_TALL}, {@code COOLER_SOCKET_MISMATCH}, {@code FORM_FACTOR_MISMATCH}</li>
 *   <li>Warnings: {@code PSU_INSUFFICIENT}, {@code GPU_CLEARANCE_TIGHT},
 *       {@code COOLER_CLEARANCE_TIGHT}, {@code COOLER_TDP_LOW}</li>
 * </ul>
 *
 * <p>Empty slots are reported in {@code missingComponents} only; they never produce issues.
 */
public final class BuildValidator {

    private static final Logger log = LoggerFactory.getLogger(BuildValidator.class);

    /** Required types in reporting order. */
    private static final List<ComponentType> REQUIRED = List.of(
        ComponentType.CPU,
        ComponentType.GPU,
        ComponentType.MOTHERBOARD,
        ComponentType.RAM,
        ComponentType.PSU,
        ComponentType.CASE,
        ComponentType.COOLER
    );

    private BuildValidator() {
        // Utility class
    }

    /**
     * Validates a build snapshot.
     *
     * @param build build to validate
     * @return aggregate validation result
     */
    public static ValidationResult validateBuild(Build build) {
        Objects.requireNonNull(build, "build must not be null");

        List<ComponentType> missing = missingComponents(build);
        PowerAnalysis powerAnalysis = PowerCalculator.calculatePowerRequirements(build);

        List<ValidationIssue> issues = new ArrayList<>();
        checkSocket(build, issues);
        checkMemoryType(build, issues);
        checkGpuClearance(build, issues);
        checkCoolerClearance(build, issues);
        checkCoolerSocket(build, issues);
        checkFormFactor(build, issues);

        checkPsuWattage(build, powerAnalysis, issues);
        checkGpuMargin(build, issues);
        checkCoolerMargin(build, issues);
        checkCoolerRating(build, issues);

        boolean valid = issues.stream().noneMatch(ValidationIssue::isError);
        boolean complete = missing.isEmpty();

        log.debug("Validated build: valid={}, complete={}, issues={}, missing={}",
            valid, complete, issues.size(), missing);

        return new ValidationResult(valid, complete, issues, powerAnalysis, missing);
    }

    private static List<ComponentType> missingComponents(Build build) {
        List<ComponentType> missing = new ArrayList<>();
        for (ComponentType type : REQUIRED) {
            boolean present = switch (type) {
                case CPU -> build.cpu() != null;
                case GPU -> build.gpu() != null;
                case MOTHERBOARD -> build.motherboard() != null;
                case RAM -> build.ram() != null;
                case PSU -> build.psu() != null;
                case CASE -> build.pcCase() != null;
                case COOLER -> build.cooler() != null;
                case STORAGE, UNKNOWN -> true;
            };
            if (!present) {
                missing.add(type);
            }
        }
        return missing;
    }

    private static void checkSocket(Build build, List<ValidationIssue> issues) {
        Cpu cpu = build.cpu();
        Motherboard motherboard = build.motherboard();
        if (cpu == null || motherboard == null || Objects.equals(cpu.socket(), motherboard.socket())) {
            return;
        }
        issues.add(ValidationIssue.error(
            IssueCode.SOCKET_MISMATCH,
            String.format("CPU socket (%s) does not match motherboard socket (%s)", cpu.socket(), motherboard.socket()),
            List.of(ComponentType.CPU, ComponentType.MOTHERBOARD),
            String.format("Select a motherboard with %s socket", cpu.socket())));
    }

    private static void checkMemoryType(Build build, List<ValidationIssue> issues) {
        Ram ram = build.ram();
        Motherboard motherboard = build.motherboard();
        if (ram == null || motherboard == null || SupportedValues.contains(motherboard.memoryType(), ram.memoryType())) {
            return;
        }
        String supported = SupportedValues.format(motherboard.memoryType());
        issues.add(ValidationIssue.error(
            IssueCode.MEMORY_TYPE_MISMATCH,
            String.format("RAM type (%s) is not supported by motherboard (%s)", ram.memoryType(), supported),
            List.of(ComponentType.RAM, ComponentType.MOTHERBOARD),
            String.format("Select %s RAM", supported)));
    }

    private static void checkGpuClearance(Build build, List<ValidationIssue> issues) {
        Gpu gpu = build.gpu();
        PcCase pcCase = build.pcCase();
        if (gpu == null || pcCase == null || gpu.lengthMm() == null || pcCase.maxGpuLengthMm() == null) {
            return;
        }
        int overage = gpu.lengthMm() - pcCase.maxGpuLengthMm();
        if (overage <= 0) {
            return;
        }
        issues.add(ValidationIssue.error(
            IssueCode.GPU_TOO_LONG,
            String.format("GPU (%dmm) exceeds case clearance (%dmm) by %dmm",
                gpu.lengthMm(), pcCase.maxGpuLengthMm(), overage),
            List.of(ComponentType.GPU, ComponentType.CASE),
            "Select a shorter GPU or a larger case"));
    }

    private static void checkCoolerClearance(Build build, List<ValidationIssue> issues) {
        Cooler cooler = build.cooler();
        PcCase pcCase = build.pcCase();
        if (cooler == null || pcCase == null || cooler.heightMm() == null || pcCase.maxCoolerHeightMm() == null) {
            return;
        }
        int overage = cooler.heightMm() - pcCase.maxCoolerHeightMm();
        if (overage <= 0) {
            return;
        }
        issues.add(ValidationIssue.error(
            IssueCode.COOLER_TOO_TALL,
            String.format("Cooler (%dmm) exceeds case clearance (%dmm) by %dmm",
                cooler.heightMm(), pcCase.maxCoolerHeightMm(), overage),
            List.of(ComponentType.COOLER, ComponentType.CASE),
            "Select a lower profile cooler or a larger case"));
    }

    private static void checkCoolerSocket(Build build, List<ValidationIssue> issues) {
        Cooler cooler = build.cooler();
        Cpu cpu = build.cpu();
        if (cooler == null || cpu == null || SupportedValues.contains(cooler.socketSupport(), cpu.socket())) {
            return;
        }
        issues.add(ValidationIssue.error(
            IssueCode.COOLER_SOCKET_MISMATCH,
            String.format("Cooler does not support %s socket (supports %s)",
                cpu.socket(), SupportedValues.format(cooler.socketSupport())),
            List.of(ComponentType.COOLER, ComponentType.CPU),
            String.format("Select a cooler that supports %s", cpu.socket())));
    }

    private static void checkFormFactor(Build build, List<ValidationIssue> issues) {
        Motherboard motherboard = build.motherboard();
        PcCase pcCase = build.pcCase();
        if (motherboard == null || pcCase == null
            || SupportedValues.contains(pcCase.formFactorSupport(), motherboard.formFactor())) {
            return;
        }
        issues.add(ValidationIssue.error(
            IssueCode.FORM_FACTOR_MISMATCH,
            String.format("Case does not support %s motherboards (supports %s)",
                motherboard.formFactor(), SupportedValues.format(pcCase.formFactorSupport())),
            List.of(ComponentType.MOTHERBOARD, ComponentType.CASE),
            String.format("Select a case that supports %s", motherboard.formFactor())));
    }

    private static void checkPsuWattage(Build build, PowerAnalysis analysis, List<ValidationIssue> issues) {
        if (build.psu() == null) {
            return;
        }
        int wattage = build.psu().wattage() != null ? build.psu().wattage() : 0;
        if (analysis.recommendedPsu() <= wattage) {
            return;
        }
        issues.add(ValidationIssue.warning(
            IssueCode.PSU_INSUFFICIENT,
            String.format("PSU wattage (%dW) is below recommended (%dW)", wattage, analysis.recommendedPsu()),
            List.of(ComponentType.PSU),
            String.format("Consider a %dW or higher PSU", analysis.recommendedPsu())));
    }

    private static void checkGpuMargin(Build build, List<ValidationIssue> issues) {
        Gpu gpu = build.gpu();
        PcCase pcCase = build.pcCase();
        if (gpu == null || pcCase == null || gpu.lengthMm() == null || pcCase.maxGpuLengthMm() == null) {
            return;
        }
        int margin = pcCase.maxGpuLengthMm() - gpu.lengthMm();
        if (margin < 0 || margin >= GPU_TIGHT_MARGIN_MM) {
            return;
        }
        issues.add(ValidationIssue.warning(
            IssueCode.GPU_CLEARANCE_TIGHT,
            String.format("GPU (%dmm) leaves only %dmm of case clearance (%dmm)",
                gpu.lengthMm(), margin, pcCase.maxGpuLengthMm()),
            List.of(ComponentType.GPU, ComponentType.CASE),
            "Verify exact clearance before purchasing"));
    }

    private static void checkCoolerMargin(Build build, List<ValidationIssue> issues) {
        Cooler cooler = build.cooler();
        PcCase pcCase = build.pcCase();
        if (cooler == null || pcCase == null || cooler.heightMm() == null || pcCase.maxCoolerHeightMm() == null) {
            return;
        }
        int margin = pcCase.maxCoolerHeightMm() - cooler.heightMm();
        if (margin < 0 || margin >= COOLER_TIGHT_MARGIN_MM) {
            return;
        }
        issues.add(ValidationIssue.warning(
            IssueCode.COOLER_CLEARANCE_TIGHT,
            String.format("Cooler (%dmm) leaves only %dmm of case clearance (%dmm)",
                cooler.heightMm(), margin, pcCase.maxCoolerHeightMm()),
            List.of(ComponentType.COOLER, ComponentType.CASE),
            "Verify exact clearance before purchasing"));
    }

    private static void checkCoolerRating(Build build, List<ValidationIssue> issues) {
        Cooler cooler = build.cooler();
        Cpu cpu = build.cpu();
        if (cooler == null || cpu == null || cooler.tdpRating() == null || cooler.tdpRating() <= 0) {
            return;
        }
        if (cooler.tdpRating() >= cpu.powerDraw()) {
            return;
        }
        issues.add(ValidationIssue.warning(
            IssueCode.COOLER_TDP_LOW,
            String.format("Cooler is rated for %dW but the CPU draws %dW", cooler.tdpRating(), cpu.powerDraw()),
            List.of(ComponentType.COOLER, ComponentType.CPU),
            "Consider a cooler rated for the CPU's maximum power"));
    }
}
