package com.buildcheck.core.power;

import com.buildcheck.core.model.Build;
import com.buildcheck.core.model.PowerAnalysis;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static com.buildcheck.core.TestComponents.cpu;
import static com.buildcheck.core.TestComponents.gpu;
import static com.buildcheck.core.TestComponents.psu;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

/**
 * Tests for {@link PowerCalculator}.
 */
class PowerCalculatorTest {

    @Test
    void calculate_cpuOnly_snapsToLowestTier() {
        // Given
        Build build = Build.empty().with(cpu("AM5", 65));

        // When
        PowerAnalysis analysis = PowerCalculator.calculatePowerRequirements(build);

        // Then: 165W draw, 247.5 rounds to 248, first tier covering 248 is 450
        assertThat(analysis.totalTdp()).isEqualTo(165);
        assertThat(analysis.recommendedPsu()).isEqualTo(450);
        assertThat(analysis.currentPsu()).isNull();
        assertThat(analysis.headroom()).isNull();
        assertThat(analysis.efficiencyAtLoad()).isEqualTo("37%");
    }

    @Test
    void calculate_emptyBuild_countsBasePowerOnly() {
        PowerAnalysis analysis = PowerCalculator.calculatePowerRequirements(Build.empty());

        assertThat(analysis.totalTdp()).isEqualTo(100);
        assertThat(analysis.recommendedPsu()).isEqualTo(450);
    }

    @Test
    void calculate_prefersCpuMaxTdp() {
        Build build = Build.empty().with(cpu("AM5", 105, 142, List.of("DDR5")));

        assertThat(PowerCalculator.calculatePowerRequirements(build).totalTdp()).isEqualTo(242);
    }

    @Test
    void calculate_zeroMaxTdp_fallsBackToNominal() {
        Build build = Build.empty().with(cpu("AM5", 105, 0, List.of("DDR5")));

        assertThat(PowerCalculator.calculatePowerRequirements(build).totalTdp()).isEqualTo(205);
    }

    @Test
    void calculate_withPsu_reportsHeadroom() {
        Build build = Build.empty().with(cpu("AM5", 105)).with(gpu(200, 300)).with(psu(750));

        PowerAnalysis analysis = PowerCalculator.calculatePowerRequirements(build);

        // 100 + 105 + 200 + 75
        assertThat(analysis.totalTdp()).isEqualTo(480);
        assertThat(analysis.recommendedPsu()).isEqualTo(750);
        assertThat(analysis.currentPsu()).isEqualTo(750);
        assertThat(analysis.headroom()).isEqualTo(270);
    }

    @Test
    void calculate_beyondTopTier_capsAt1500() {
        Build build = Build.empty().with(cpu("LGA1700", 253)).with(gpu(600, 336));

        PowerAnalysis analysis = PowerCalculator.calculatePowerRequirements(build);

        assertThat(analysis.recommendedPsu()).isEqualTo(1500);
    }

    @Test
    void calculate_hugeDraw_saturatesInsteadOfOverflowing() {
        // Given
        Build build = Build.empty()
            .with(cpu("AM5", Integer.MAX_VALUE - 100))
            .with(gpu(Integer.MAX_VALUE - 100, 300));

        // When
        PowerAnalysis analysis = PowerCalculator.calculatePowerRequirements(build, true);

        // Then
        assertThat(analysis.totalTdp()).isEqualTo(Integer.MAX_VALUE);
        assertThat(analysis.recommendedPsu()).isEqualTo(1500);
        assertThat(analysis.efficiencyAtLoad()).doesNotStartWith("-");
        assertThat(PowerCalculator.minimumWattage(Integer.MAX_VALUE, Integer.MAX_VALUE)).isEqualTo(Integer.MAX_VALUE);
    }

    @ParameterizedTest
    @CsvSource({
        "0, 0",
        "199, 0",
        "200, 75",
        "250, 75",
        "299, 75",
        "300, 150",
        "399, 150",
        "400, 200",
        "600, 200"
    })
    void transientBuffer_followsFourTierSteps(int gpuPower, int expected) {
        assertThat(PowerCalculator.transientBuffer(gpuPower)).isEqualTo(expected);
    }

    @Test
    void transientBuffer_isNotTheTwoTierVariant() {
        // A two-step policy (0 below 300W, 150W from 300W) would give 0 here.
        assertThat(PowerCalculator.transientBuffer(250)).isEqualTo(75).isNotZero();
        assertThat(PowerCalculator.transientBuffer(450)).isEqualTo(200).isNotEqualTo(150);
    }

    @Test
    void recommendation_usesOnePointFiveMultiplier() {
        // 100 + 253 + 200 + 75 = 628W draw
        Build build = Build.empty().with(cpu("LGA1700", 253)).with(gpu(200, 300));

        PsuRecommendation recommendation = PowerCalculator.recommend(build, false);

        // 1.5x gives 942W -> 1000W; a 1.2x policy would give 754W -> 850W
        assertThat(recommendation.breakdown().totalDraw()).isEqualTo(628);
        assertThat(recommendation.recommendedWattage()).isEqualTo(1000).isNotEqualTo(850);
        assertThat(recommendation.recommendedTier()).isEqualTo("1000W");
    }

    @ParameterizedTest
    @CsvSource({
        "0, 450",
        "450, 450",
        "451, 550",
        "650, 650",
        "1001, 1200",
        "1500, 1500",
        "2000, 1500"
    })
    void snapToTier_roundsUpToLadder(int watts, int expected) {
        assertThat(PowerCalculator.snapToTier(watts)).isEqualTo(expected);
    }

    @Test
    void tierLabel_aboveTopTier_readsPlus() {
        assertThat(PowerCalculator.tierLabel(1283)).isEqualTo("1500W");
        assertThat(PowerCalculator.tierLabel(1501)).isEqualTo("1500W+");
        assertThat(PowerCalculator.tierLabel(248)).isEqualTo("450W");
    }

    @Test
    void recommend_highPowerGpu_addsNotesInOrder() {
        Build build = Build.empty().with(cpu("AM5", 120)).with(gpu(450, 336));

        PsuRecommendation recommendation = PowerCalculator.recommend(build, true);

        // 100 + 120 + 450 + 200 + round(570 * 0.2) = 984W draw, 1476W raw
        assertThat(recommendation.breakdown().overclockBuffer()).isEqualTo(114);
        assertThat(recommendation.breakdown().totalDraw()).isEqualTo(984);
        assertThat(recommendation.recommendedWattage()).isEqualTo(1500);
        assertThat(recommendation.notes()).containsExactly(
            "High-power GPU detected. Consider a PSU with 12VHPWR connector for best results.",
            "Added 200W buffer for GPU transient power spikes.",
            "Added 114W for overclocking headroom.",
            "Good efficiency range (50-80% load)"
        );
    }

    @Test
    void recommend_emptyBuild_asksForComponents() {
        PsuRecommendation recommendation = PowerCalculator.recommend(Build.empty(), false);

        assertThat(recommendation.notes()).containsExactly(
            "Excellent efficiency range (20-50% load)",
            "Add components to get an accurate PSU recommendation."
        );
    }

    @Test
    void breakdown_lines_omitZeroEntries() {
        PowerBreakdown breakdown = PowerCalculator.breakdown(Build.empty().with(cpu("AM5", 65)), false);

        assertThat(breakdown.lines()).containsExactly(
            "Base System: 100W",
            "CPU: 65W",
            "─────────────",
            "Total Draw: 165W"
        );
    }

    @Test
    void minimumWattage_includesBaseAndBuffer() {
        assertThat(PowerCalculator.minimumWattage(125, 320)).isEqualTo(100 + 125 + 320 + 150);
    }

    @Test
    void checkSufficiency_withHeadroom_requiresOnePointFiveTimesMinimum() {
        // minimum 100 + 125 + 320 + 150 = 695W, with headroom 1043W
        PsuSufficiency withoutHeadroom = PowerCalculator.checkSufficiency(850, 125, 320, false);
        PsuSufficiency withHeadroom = PowerCalculator.checkSufficiency(850, 125, 320, true);

        assertThat(withoutHeadroom.sufficient()).isTrue();
        assertThat(withoutHeadroom.margin()).isEqualTo(155);
        assertThat(withHeadroom.sufficient()).isFalse();
        assertThat(withHeadroom.loadPercentage()).isCloseTo(81.76, offset(0.01));
    }

    @Test
    void checkSufficiency_nonPositiveWattage_throws() {
        assertThatThrownBy(() -> PowerCalculator.checkSufficiency(0, 65, 0, false))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("positive");
    }

    @Test
    void calculate_repeatedCalls_areIdentical() {
        Build build = Build.empty().with(cpu("AM5", 105)).with(gpu(320, 300)).with(psu(850));

        assertThat(PowerCalculator.calculatePowerRequirements(build))
            .isEqualTo(PowerCalculator.calculatePowerRequirements(build));
    }
}
