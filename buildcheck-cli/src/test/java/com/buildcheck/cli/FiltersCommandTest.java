package com.buildcheck.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FiltersCommand}.
 */
class FiltersCommandTest extends CommandTestSupport {

    @Test
    void filters_printsDerivedFilters() throws IOException {
        Path build = write("build.json", "{\"cpu\": %s, \"case\": %s}".formatted(CPU, CASE_SMALL));

        int exitCode = run("filters", build.toString());

        assertThat(exitCode).isZero();
        assertThat(output())
            .contains("\"socket\" : \"AM5\"")
            .contains("\"form_factor\" : \"ATX\"")
            .contains("\"memory_type\" : null");
    }

    @Test
    void filters_componentInWrongSlot_exitsTwo() throws IOException {
        Path build = write("build.json", "{\"gpu\": %s}".formatted(CPU));

        assertThat(run("filters", build.toString())).isEqualTo(2);
    }
}
