package com.buildcheck.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ExportCommand} and {@link ListCommand}.
 */
class ExportCommandTest extends CommandTestSupport {

    @Test
    void export_defaultFormat_isPcPartPicker() throws IOException {
        Path build = write("build.json", "{\"cpu\": %s, \"gpu\": %s}".formatted(CPU, GPU_LONG));

        int exitCode = run("export", build.toString(), "-c", plainConfig().toString());

        assertThat(exitCode).isZero();
        assertThat(output())
            .startsWith("[PCPartPicker Build List]")
            .contains("Video Card|NVIDIA GeForce RTX 4090|$1599.00")
            .contains("**Total**||**$1898.99**");
    }

    @Test
    void export_linkToFile_usesConfiguredAppUrl() throws IOException {
        Path build = write("build.json", "{\"cpu\": %s}".formatted(CPU));
        Path config = write("link.yaml", """
            export:
              defaultFormat: link
              appUrl: "https://builds.example.com"
            """);
        Path target = tempDir.resolve("link.txt");

        int exitCode = run("export", build.toString(), "-c", config.toString(), "-o", target.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(target)).startsWith("https://builds.example.com/build?state=");
        assertThat(output()).isEmpty();
    }

    @Test
    void export_emptyBuild_exitsTwo() throws IOException {
        Path build = write("build.json", "{}");

        assertThat(run("export", build.toString(), "--format", "reddit")).isEqualTo(2);
    }

    @Test
    void export_unknownFormat_exitsTwo() throws IOException {
        Path build = write("build.json", "{\"cpu\": %s}".formatted(CPU));

        assertThat(run("export", build.toString(), "--format", "csv")).isEqualTo(2);
    }

    @Test
    void list_formats_showsEveryFormatter() {
        int exitCode = run("list", "formats");

        assertThat(exitCode).isZero();
        assertThat(output())
            .contains("PCPartPicker (ID: pcpartpicker)")
            .contains("Reddit Markdown (ID: reddit)")
            .contains("JSON (ID: json)")
            .contains("Share Link (ID: link)");
    }

    @Test
    void list_unknownType_exitsOne() {
        assertThat(run("list", "scanners")).isEqualTo(1);
    }
}
