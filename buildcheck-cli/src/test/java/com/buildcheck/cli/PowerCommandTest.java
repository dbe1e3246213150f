package com.buildcheck.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PowerCommand}.
 */
class PowerCommandTest extends CommandTestSupport {

    @Test
    void power_printsBreakdownAndTier() throws IOException {
        Path build = write("build.json", "{\"cpu\": %s, \"gpu\": %s}".formatted(CPU, GPU_LONG));

        int exitCode = run("power", build.toString(), "-c", plainConfig().toString());

        assertThat(exitCode).isZero();
        assertThat(output())
            .contains("Transient Buffer: 200W")
            .contains("Total Draw: 855W")
            .contains("Recommended PSU: 1500W")
            .doesNotContain("Overclock Buffer");
    }

    @Test
    void power_overclockFlag_addsBuffer() throws IOException {
        Path build = write("build.json", "{\"cpu\": %s, \"gpu\": %s}".formatted(CPU, GPU_LONG));

        run("power", build.toString(), "--overclock", "-c", plainConfig().toString());

        // round((105 + 450) * 0.2)
        assertThat(output()).contains("Overclock Buffer: 111W").contains("Added 111W for overclocking headroom.");
    }

    @Test
    void power_configDefault_canBeNegated() throws IOException {
        Path build = write("build.json", "{\"cpu\": %s}".formatted(CPU));
        Path config = write("oc.yaml", """
            power:
              overclocking: true
            output:
              colors: false
            """);

        run("power", build.toString(), "--no-overclock", "-c", config.toString());

        assertThat(output()).doesNotContain("Overclock Buffer");
    }

    @Test
    void power_jsonFormat_printsRecommendation() throws IOException {
        Path build = write("build.json", "{\"cpu\": %s}".formatted(CPU));

        run("power", build.toString(), "--format", "json");

        assertThat(output())
            .contains("\"recommendedWattage\" : 450")
            .contains("\"recommendedTier\" : \"450W\"");
    }
}
