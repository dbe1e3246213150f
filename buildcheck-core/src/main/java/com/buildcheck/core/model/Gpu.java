package com.buildcheck.core.model;

import com.buildcheck.core.util.SupportedValues;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Graphics card record.
 *
 * @param objectId catalogue identifier
 * @param brand manufacturer
 * @param model model name
 * @param price price in USD
 * @param performanceTier performance tier label
 * @param imageUrl optional image URL
 * @param compatibilityTags catalogue tags (informational only)
 * @param lengthMm card length, compared against case GPU clearance
 * @param tdpWatts board power
 * @param vramGb video memory size
 * @param memoryType video memory type, e.g. GDDR6X
 * @param memoryBandwidthGbps memory bandwidth
 * @param pcieVersion PCIe generation
 * @param powerConnectors power connector description
 * @param recommendedPsuWatts vendor PSU recommendation, optional
 * @param releaseDate release date as published in the catalogue
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Gpu(
    @JsonProperty("objectID") String objectId,
    @JsonProperty("brand") String brand,
    @JsonProperty("model") String model,
    @JsonProperty("price_usd") BigDecimal price,
    @JsonProperty("performance_tier") String performanceTier,
    @JsonProperty("image_url") String imageUrl,
    @JsonProperty("compatibility_tags") List<String> compatibilityTags,
    @JsonProperty("length_mm") Integer lengthMm,
    @JsonProperty("tdp_watts") Integer tdpWatts,
    @JsonProperty("vram_gb") Integer vramGb,
    @JsonProperty("memory_type") String memoryType,
    @JsonProperty("memory_bandwidth_gbps") Double memoryBandwidthGbps,
    @JsonProperty("pcie_version") String pcieVersion,
    @JsonProperty("power_connectors") String powerConnectors,
    @JsonProperty("recommended_psu_watts") Integer recommendedPsuWatts,
    @JsonProperty("release_date") String releaseDate
) implements Component {

    /**
     * Compact constructor normalizing list fields.
     */
    public Gpu {
        compatibilityTags = SupportedValues.immutable(compatibilityTags);
    }

    @Override
    public ComponentType type() {
        return ComponentType.GPU;
    }

    /**
     * Returns the board power, 0 when the catalogue does not declare it.
     *
     * @return power draw in watts
     */
    public int powerDraw() {
        return tdpWatts != null ? tdpWatts : 0;
    }
}
