package com.buildcheck.core.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.buildcheck.core.TestComponents.compatibleBuild;
import static com.buildcheck.core.TestComponents.cpu;
import static com.buildcheck.core.TestComponents.gpu;
import static com.buildcheck.core.TestComponents.psu;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Build}.
 */
class BuildTest {

    @Test
    void with_placesComponentInItsSlotWithoutMutatingReceiver() {
        Build empty = Build.empty();

        Build build = empty.with(cpu("AM5", 105));

        assertThat(build.cpu().socket()).isEqualTo("AM5");
        assertThat(empty.cpu()).isNull();
        assertThat(build.selected()).containsExactly(Slot.CPU);
    }

    @Test
    void with_replacesPreviousOccupant() {
        Build build = Build.empty().with(psu(650)).with(psu(850));

        assertThat(build.psu().wattage()).isEqualTo(850);
    }

    @Test
    void with_unrecognizedComponent_throws() {
        UnrecognizedComponent fan = new UnrecognizedComponent("fan-1", null, "Fan", null, null, null, null);

        assertThatThrownBy(() -> Build.empty().with(fan))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void without_clearsSlot() {
        Build build = compatibleBuild().without(Slot.GPU);

        assertThat(build.gpu()).isNull();
        assertThat(build.get(Slot.GPU)).isNull();
        assertThat(build.selected()).doesNotContain(Slot.GPU).hasSize(7);
    }

    @Test
    void totalPrice_skipsUnknownPrices() {
        Build build = Build.empty()
            .with(cpu("AM5", 105))
            .with(gpu(200, 300))
            .with(new Psu("psu-2", "Seasonic", "Focus", null, null, null, List.of(), 750, null, null, null));

        assertThat(build.totalPrice()).isEqualByComparingTo(new BigDecimal("1898.99"));
    }

    @Test
    void componentType_fromLabel_ignoresCaseAndFallsBackToUnknown() {
        assertThat(ComponentType.fromLabel("motherboard")).isEqualTo(ComponentType.MOTHERBOARD);
        assertThat(ComponentType.fromLabel("Fan")).isEqualTo(ComponentType.UNKNOWN);
    }

    @Test
    void slot_lookups() {
        assertThat(Slot.forKey("case")).contains(Slot.CASE);
        assertThat(Slot.forKey("Case")).isEmpty();
        assertThat(Slot.forType(ComponentType.COOLER)).contains(Slot.COOLER);
        assertThat(Slot.forType(ComponentType.UNKNOWN)).isEmpty();
        assertThat(Slot.STORAGE.required()).isFalse();
    }
}
