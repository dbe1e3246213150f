package com.buildcheck.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CheckCommand}.
 */
class CheckCommandTest extends CommandTestSupport {

    @Test
    void check_socketMismatch_printsIncompatible() throws IOException {
        Path candidate = write("cpu.json", CPU);
        Path build = write("build.json", "{\"motherboard\": %s}".formatted(MOTHERBOARD_INTEL));

        int exitCode = run("check", candidate.toString(), "--build", build.toString(), "-c", plainConfig().toString());

        assertThat(exitCode).isZero();
        assertThat(output()).startsWith("INCOMPATIBLE: Socket mismatch").contains("AM5").contains("LGA1700");
    }

    @Test
    void check_withoutBuild_isCompatible() throws IOException {
        Path candidate = write("gpu.json", GPU_LONG);

        run("check", candidate.toString(), "-c", plainConfig().toString());

        assertThat(output().trim()).isEqualTo("COMPATIBLE");
    }

    @Test
    void check_array_ratesEachCandidate() throws IOException {
        Path candidates = write("gpus.json", "[%s, %s]".formatted(GPU_LONG, CPU));
        Path build = write("build.json", "{\"case\": %s}".formatted(CASE_SMALL));

        run("check", candidates.toString(), "-b", build.toString(), "--format", "json");

        assertThat(output())
            .contains("\"status\" : \"incompatible\"")
            .contains("\"status\" : \"compatible\"");
    }

    @Test
    void check_malformedCandidate_exitsTwo() throws IOException {
        Path candidate = write("cpu.json", "{not json");

        assertThat(run("check", candidate.toString())).isEqualTo(2);
    }
}
