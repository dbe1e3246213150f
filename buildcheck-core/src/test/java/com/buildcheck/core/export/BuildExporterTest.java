package com.buildcheck.core.export;

import com.buildcheck.core.export.impl.ShareLinkFormatter;
import com.buildcheck.core.model.Build;
import com.buildcheck.core.model.Psu;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.buildcheck.core.TestComponents.compatibleBuild;
import static com.buildcheck.core.TestComponents.cpu;
import static com.buildcheck.core.TestComponents.gpu;
import static com.buildcheck.core.TestComponents.pcCase;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link BuildExporter} and the registered formatters.
 */
class BuildExporterTest {

    private final BuildExporter exporter = BuildExporter.discover();
    private final ExportContext context = ExportContext.defaults();

    @Test
    void discover_findsAllRegisteredFormats() {
        assertThat(exporter.formatters())
            .extracting(BuildFormatter::getId)
            .containsExactly("pcpartpicker", "reddit", "json", "link");
    }

    @Test
    void export_pcPartPicker_listsComponentsInSlotOrder() {
        Build build = Build.empty()
            .with(pcCase(List.of("ATX"), 350, 170))
            .with(cpu("AM5", 105));

        ExportResult result = exporter.export(build, "pcpartpicker", context);

        assertThat(result.formatted()).isEqualTo(String.join("\n",
            "[PCPartPicker Build List]",
            "",
            "Type|Item|Price",
            ":----|:----|:----",
            "CPU|AMD Ryzen 7 7700X|$299.99",
            "Case|Fractal Design North|$139.99",
            "**Total**||**$439.98**",
            "",
            "*Generated by BuildCheck*"));
        assertThat(result.totalPrice()).isEqualByComparingTo("439.98");
        assertThat(result.componentCount()).isEqualTo(2);
        assertThat(result.shareUrl()).isNull();
    }

    @Test
    void export_reddit_usesTableLabels() {
        ExportResult result = exporter.export(compatibleBuild(), "reddit", context);

        assertThat(result.formatted())
            .startsWith("| Component | Selection | Price |\n|:----------|:----------|------:|\n")
            .contains("| Video Card | NVIDIA GeForce RTX 4090 | $1599.00 |")
            .contains("| CPU Cooler | Noctua NH-D15 | $109.95 |")
            .contains("| Storage | Samsung 990 Pro 2TB | $169.99 |");
        assertThat(result.componentCount()).isEqualTo(8);
    }

    @Test
    void export_unknownPrice_showsNotAvailable() {
        Build build = Build.empty().with(new Psu(
            "psu-2", "Seasonic", "Focus GX-750", null, "mid-range", null, List.of(), 750, "80+ Gold", "Full", "ATX"));

        ExportResult result = exporter.export(build, "pcpartpicker", context);

        assertThat(result.formatted()).contains("Power Supply|Seasonic Focus GX-750|N/A");
        assertThat(result.totalPrice()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void export_json_wrapsComponentsAndTotal() {
        Build build = Build.empty().with(cpu("AM5", 105)).with(gpu(200, 300));

        ExportResult result = exporter.export(build, "json", context);

        assertThat(result.formatted())
            .contains("\"components\"")
            .contains("\"component_type\" : \"CPU\"")
            .contains("\"totalPrice\" : 1898.99");
    }

    @Test
    void export_link_encodesBuildIntoState() {
        Build build = compatibleBuild();

        ExportResult result = exporter.export(build, "link", new ExportContext("https://builds.example.com/"));

        assertThat(result.shareUrl()).startsWith("https://builds.example.com/build?state=");
        assertThat(result.formatted()).isEqualTo(result.shareUrl());
        String state = result.shareUrl().substring(result.shareUrl().indexOf("state=") + "state=".length());
        assertThat(state).doesNotContain("=", "+", "/");
        assertThat(ShareLinkFormatter.decode(result.shareUrl())).isEqualTo(build);
    }

    @Test
    void decode_linkWithExtraQueryParameters_ignoresThem() {
        Build build = compatibleBuild();
        String link = exporter.export(build, "link", context).shareUrl();

        assertThat(ShareLinkFormatter.decode(link + "&ref=reddit")).isEqualTo(build);
        assertThat(ShareLinkFormatter.decode(link + "#summary")).isEqualTo(build);
    }

    @Test
    void export_emptyBuild_isRejected() {
        assertThatThrownBy(() -> exporter.export(Build.empty(), "reddit", context))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Build is empty");
    }

    @Test
    void export_unknownFormat_isRejected() {
        assertThatThrownBy(() -> exporter.export(compatibleBuild(), "csv", context))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("csv")
            .hasMessageContaining("pcpartpicker");
    }
}
