package com.buildcheck.core.model;

import com.buildcheck.core.util.SupportedValues;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Memory kit record. {@code memoryType} is a single generation such as DDR5.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Ram(
    @JsonProperty("objectID") String objectId,
    @JsonProperty("brand") String brand,
    @JsonProperty("model") String model,
    @JsonProperty("price_usd") BigDecimal price,
    @JsonProperty("performance_tier") String performanceTier,
    @JsonProperty("image_url") String imageUrl,
    @JsonProperty("compatibility_tags") List<String> compatibilityTags,
    @JsonProperty("memory_type") String memoryType,
    @JsonProperty("speed_mhz") Integer speedMhz,
    @JsonProperty("capacity_gb") Integer capacityGb,
    @JsonProperty("modules") Integer modules,
    @JsonProperty("cas_latency") Integer casLatency,
    @JsonProperty("voltage") Double voltage,
    @JsonProperty("rgb") Boolean rgb
) implements Component {

    public Ram {
        compatibilityTags = SupportedValues.immutable(compatibilityTags);
    }

    @Override
    public ComponentType type() {
        return ComponentType.RAM;
    }
}
