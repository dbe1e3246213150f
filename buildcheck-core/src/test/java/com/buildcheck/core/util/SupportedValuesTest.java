package com.buildcheck.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SupportedValues}.
 */
class SupportedValuesTest {

    @ParameterizedTest
    @CsvSource({
        "Micro-ATX, microatx",
        "Micro ATX, microatx",
        "'  Mini - ITX ', miniitx",
        "LGA1700, lga1700"
    })
    void normalize_dropsCaseHyphensAndWhitespace(String raw, String expected) {
        assertThat(SupportedValues.normalize(raw)).isEqualTo(expected);
    }

    @Test
    void contains_emptyList_isUnrestricted() {
        assertThat(SupportedValues.contains(List.of(), "DDR4")).isTrue();
        assertThat(SupportedValues.contains(null, "DDR4")).isTrue();
    }

    @Test
    void contains_requiresWholeValueMatch() {
        List<String> supported = List.of("Micro-ATX", "Mini-ITX");

        assertThat(SupportedValues.contains(supported, "micro atx")).isTrue();
        assertThat(SupportedValues.contains(supported, "ATX")).isFalse();
        assertThat(SupportedValues.contains(List.of("AM4"), "AM")).isFalse();
    }

    @Test
    void contains_missingValue_isNotSupported() {
        assertThat(SupportedValues.contains(List.of("AM5"), null)).isFalse();
        assertThat(SupportedValues.contains(List.of("AM5"), " ")).isFalse();
    }

    @Test
    void format_joinsWithSlash() {
        assertThat(SupportedValues.format(List.of("DDR4", "DDR5"))).isEqualTo("DDR4/DDR5");
        assertThat(SupportedValues.format(List.of())).isEqualTo("Unknown");
    }

    @Test
    void immutable_dropsNullAndBlankEntries() {
        List<String> values = SupportedValues.immutable(Arrays.asList("AM5", null, " ", "AM4"));

        assertThat(values).containsExactly("AM5", "AM4");
        assertThat(SupportedValues.immutable(null)).isEmpty();
    }
}
