package com.buildcheck.core.report;

import com.buildcheck.core.model.Build;
import com.buildcheck.core.model.CompatibilityResult;
import com.buildcheck.core.power.PowerCalculator;
import com.buildcheck.core.validation.BuildValidator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.buildcheck.core.TestComponents.compatibleBuild;
import static com.buildcheck.core.TestComponents.cpu;
import static com.buildcheck.core.TestComponents.gpu;
import static com.buildcheck.core.TestComponents.pcCase;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConsoleReport}.
 */
class ConsoleReportTest {

    private final ConsoleReport plain = new ConsoleReport(false);

    @Test
    void validation_invalidBuild_listsErrorsAndMissingParts() {
        Build build = Build.empty()
            .with(cpu("AM5", 105))
            .with(gpu(450, 400))
            .with(pcCase(List.of("ATX"), 350, 170));

        String report = plain.validation(BuildValidator.validateBuild(build));

        assertThat(report)
            .startsWith("Build has 1 error(s)\n")
            .contains("Missing: Motherboard, RAM, PSU, Cooler")
            .contains("[ERROR] GPU_TOO_LONG: GPU (400mm) exceeds case clearance (350mm)")
            .contains("Recommended PSU: 1500W")
            .doesNotContain("\u001B[");
    }

    @Test
    void validation_validBuild_reportsCurrentPsu() {
        String report = plain.validation(BuildValidator.validateBuild(compatibleBuild()));

        assertThat(report)
            .startsWith("Build is compatible\n")
            .contains("Current PSU:     850W")
            .doesNotContain("Missing:");
    }

    @Test
    void recommendation_printsBreakdownAndNotes() {
        String report = plain.recommendation(PowerCalculator.recommend(Build.empty().with(cpu("AM5", 65)), false));

        assertThat(report)
            .contains("  Base System: 100W\n")
            .contains("  Total Draw: 165W\n")
            .contains("Recommended PSU: 450W")
            .contains("Load at recommended: 37%")
            .contains("  * Excellent efficiency range (20-50% load)");
    }

    @Test
    void compatibility_colorsStatusWhenEnabled() {
        String colored = new ConsoleReport(true).compatibility(CompatibilityResult.incompatible("Too long"));

        assertThat(colored).contains("\u001B[31mINCOMPATIBLE\u001B[0m: Too long");
        assertThat(plain.compatibility(CompatibilityResult.compatible())).isEqualTo("COMPATIBLE");
    }
}
