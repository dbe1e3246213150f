package com.buildcheck.core.codec;

import com.buildcheck.core.model.Build;
import com.buildcheck.core.model.Component;
import com.buildcheck.core.model.ComponentType;
import com.buildcheck.core.model.Cpu;
import com.buildcheck.core.model.Motherboard;
import com.buildcheck.core.model.UnrecognizedComponent;
import com.buildcheck.core.model.ValidationResult;
import com.buildcheck.core.validation.BuildValidator;
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
 * Tests for {@link BuildCodec}.
 */
class BuildCodecTest {

    @Test
    void writeBuild_thenReadBuild_preservesEveryField() {
        Build build = compatibleBuild();

        Build decoded = BuildCodec.readBuild(BuildCodec.writeBuild(build));

        assertThat(decoded).isEqualTo(build);
    }

    @Test
    void writeBuild_emptyBuild_isEmptyObject() {
        String json = BuildCodec.writeBuild(Build.empty());

        assertThat(BuildCodec.readBuild(json)).isEqualTo(Build.empty());
        assertThat(json.replaceAll("\\s", "")).isEqualTo("{}");
    }

    @Test
    void writeBuild_usesSlotKeysAndTypeLabels() {
        String json = BuildCodec.writeBuildCompact(Build.empty().with(pcCase(List.of("ATX"), 350, 170)));

        assertThat(json)
            .startsWith("{\"case\":{\"component_type\":\"Case\"")
            .contains("\"max_gpu_length_mm\":350")
            .contains("\"price_usd\":139.99");
    }

    @Test
    void readComponent_catalogueRecord_decodesCategoryFields() {
        Component component = BuildCodec.readComponent("""
            {
              "objectID": "cpu-7800x3d",
              "component_type": "CPU",
              "brand": "AMD",
              "model": "Ryzen 7 7800X3D",
              "price_usd": 449.00,
              "socket": "AM5",
              "tdp_watts": 120,
              "memory_type": "DDR5",
              "compatibility_tags": ["am5", "ddr5"],
              "popularity": 97
            }
            """);

        assertThat(component).isInstanceOf(Cpu.class);
        Cpu cpu = (Cpu) component;
        assertThat(cpu.socket()).isEqualTo("AM5");
        assertThat(cpu.tdpWatts()).isEqualTo(120);
        assertThat(cpu.memoryType()).containsExactly("DDR5");
        assertThat(cpu.price()).isEqualByComparingTo(new BigDecimal("449"));
        assertThat(cpu.compatibilityTags()).containsExactly("am5", "ddr5");
    }

    @Test
    void readComponent_unknownCategory_isUnrecognized() {
        Component component = BuildCodec.readComponent("""
            {"component_type": "Fan", "brand": "Noctua", "model": "NF-A12x25"}
            """);

        assertThat(component).isInstanceOf(UnrecognizedComponent.class);
        assertThat(component.type()).isEqualTo(ComponentType.UNKNOWN);
        assertThat(component.displayName()).isEqualTo("Noctua NF-A12x25");
    }

    @Test
    void readComponents_array_keepsOrder() {
        List<Component> components = BuildCodec.readComponents("""
            [
              {"component_type": "GPU", "model": "A", "length_mm": 300},
              {"component_type": "GPU", "model": "B", "length_mm": 320}
            ]
            """);

        assertThat(components).extracting(Component::model).containsExactly("A", "B");
    }

    @Test
    void readValidationRequest_decodesSlotsAndNulls() {
        Build build = BuildCodec.readValidationRequest("""
            {
              "components": {
                "cpu": {"component_type": "CPU", "model": "Ryzen 7 7700X", "socket": "AM5", "tdp_watts": 105},
                "motherboard": {
                  "component_type": "Motherboard",
                  "model": "B650",
                  "socket": "AM5",
                  "memory_type": ["DDR5"],
                  "form_factor": "ATX"
                },
                "gpu": null
              }
            }
            """);

        assertThat(build.cpu().socket()).isEqualTo("AM5");
        assertThat(build.motherboard()).isInstanceOf(Motherboard.class);
        assertThat(build.gpu()).isNull();
    }

    @Test
    void readValidationRequest_endToEnd_flagsGpuTooLong() {
        Build build = BuildCodec.readValidationRequest("""
            {
              "components": {
                "cpu": {"component_type": "CPU", "socket": "AM5", "tdp_watts": 105},
                "gpu": {"component_type": "GPU", "tdp_watts": 450, "length_mm": 400},
                "case": {"component_type": "Case", "max_gpu_length_mm": 350, "form_factor_support": ["ATX"]}
              }
            }
            """);

        ValidationResult result = BuildValidator.validateBuild(build);
        String json = BuildCodec.writeResult(result);

        assertThat(result.valid()).isFalse();
        assertThat(json)
            .contains("\"code\" : \"GPU_TOO_LONG\"")
            .contains("\"type\" : \"error\"")
            .contains("\"valid\" : false");
    }

    @Test
    void readValidationRequest_unknownSlotKey_isRejected() {
        assertThatThrownBy(() -> BuildCodec.readValidationRequest("""
            {"components": {"fan": {"component_type": "Fan"}}}
            """))
            .isInstanceOf(InvalidBuildRequestException.class)
            .hasMessageContaining("fan");
    }

    @Test
    void readValidationRequest_extraTopLevelKey_isRejected() {
        assertThatThrownBy(() -> BuildCodec.readValidationRequest("""
            {"components": {}, "format": "reddit"}
            """))
            .isInstanceOf(InvalidBuildRequestException.class)
            .hasMessageContaining("format");
    }

    @Test
    void readValidationRequest_componentInWrongSlot_isRejected() {
        assertThatThrownBy(() -> BuildCodec.readValidationRequest("""
            {"components": {"cpu": {"component_type": "GPU", "tdp_watts": 200}}}
            """))
            .isInstanceOf(InvalidBuildRequestException.class)
            .hasMessageContaining("expects CPU but got GPU");
    }

    @Test
    void readValidationRequest_missingComponents_isRejected() {
        assertThatThrownBy(() -> BuildCodec.readValidationRequest("{}"))
            .isInstanceOf(InvalidBuildRequestException.class);
        assertThatThrownBy(() -> BuildCodec.readValidationRequest("{\"components\": []}"))
            .isInstanceOf(InvalidBuildRequestException.class);
    }

    @Test
    void readValidationRequest_malformedJson_isRejected() {
        assertThatThrownBy(() -> BuildCodec.readValidationRequest("{\"components\": {"))
            .isInstanceOf(InvalidBuildRequestException.class)
            .hasMessageStartingWith("Malformed JSON");
        assertThatThrownBy(() -> BuildCodec.readValidationRequest(" "))
            .isInstanceOf(InvalidBuildRequestException.class);
    }

    @Test
    void readValidationRequest_fractionalWattage_isRejected() {
        String request = """
            {"components": {"gpu": {"component_type": "GPU", "model": "RTX 4080", "tdp_watts": 299.9}}}
            """;

        assertThatThrownBy(() -> BuildCodec.readValidationRequest(request))
            .isInstanceOf(InvalidBuildRequestException.class)
            .hasMessageStartingWith("Invalid gpu");
    }

    @Test
    void readValidationRequest_negativeWattage_isRejected() {
        String request = """
            {"components": {"cpu": {"component_type": "CPU", "socket": "AM5", "tdp_watts": -500}}}
            """;

        assertThatThrownBy(() -> BuildCodec.readValidationRequest(request))
            .isInstanceOf(InvalidBuildRequestException.class)
            .hasMessage("Invalid cpu: 'tdp_watts' must not be negative (-500)");
    }

    @Test
    void readComponent_negativeDimension_isRejected() {
        assertThatThrownBy(() -> BuildCodec.readComponent(
            "{\"component_type\": \"Case\", \"max_gpu_length_mm\": -1}"))
            .isInstanceOf(InvalidBuildRequestException.class)
            .hasMessageContaining("max_gpu_length_mm");
    }

    @Test
    void readComponent_wattageBeyondIntRange_isRejected() {
        assertThatThrownBy(() -> BuildCodec.readComponent(
            "{\"component_type\": \"GPU\", \"tdp_watts\": 99999999999}"))
            .isInstanceOf(InvalidBuildRequestException.class);
    }

    @Test
    void readComponent_zeroWattage_isAccepted() {
        Component component = BuildCodec.readComponent("{\"component_type\": \"CPU\", \"max_tdp_watts\": 0}");

        assertThat(component).isInstanceOf(Cpu.class);
        assertThat(((Cpu) component).maxTdpWatts()).isZero();
    }

    @Test
    void readBuild_roundTripsSparseBuild() {
        Build build = Build.empty().with(cpu("AM5", 65)).with(gpu(200, null));

        assertThat(BuildCodec.readBuild(BuildCodec.writeBuild(build))).isEqualTo(build);
    }
}
