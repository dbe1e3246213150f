package com.buildcheck.core.model;

import com.buildcheck.core.util.SupportedValues;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Processor record.
 *
 * @param objectId catalogue identifier
 * @param brand manufacturer
 * @param model model name
 * @param price price in USD
 * @param performanceTier performance tier label
 * @param imageUrl optional image URL
 * @param compatibilityTags catalogue tags (informational only)
 * @param socket socket standard, e.g. AM5 or LGA1700
 * @param tdpWatts nominal thermal design power
 * @param maxTdpWatts documented maximum package power, preferred over {@code tdpWatts} for power budgets
 * @param cores core count
 * @param threads thread count
 * @param baseClockGhz base clock
 * @param boostClockGhz boost clock
 * @param memoryType supported memory generations; empty means unrestricted
 * @param pcieVersion PCIe generation
 * @param integratedGraphics whether the CPU has an iGPU
 * @param releaseDate release date as published in the catalogue
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Cpu(
    @JsonProperty("objectID") String objectId,
    @JsonProperty("brand") String brand,
    @JsonProperty("model") String model,
    @JsonProperty("price_usd") BigDecimal price,
    @JsonProperty("performance_tier") String performanceTier,
    @JsonProperty("image_url") String imageUrl,
    @JsonProperty("compatibility_tags") List<String> compatibilityTags,
    @JsonProperty("socket") String socket,
    @JsonProperty("tdp_watts") Integer tdpWatts,
    @JsonProperty("max_tdp_watts") Integer maxTdpWatts,
    @JsonProperty("cores") Integer cores,
    @JsonProperty("threads") Integer threads,
    @JsonProperty("base_clock_ghz") Double baseClockGhz,
    @JsonProperty("boost_clock_ghz") Double boostClockGhz,
    @JsonProperty("memory_type") List<String> memoryType,
    @JsonProperty("pcie_version") String pcieVersion,
    @JsonProperty("integrated_graphics") Boolean integratedGraphics,
    @JsonProperty("release_date") String releaseDate
) implements Component {

    /**
     * Compact constructor normalizing list fields.
     */
    public Cpu {
        compatibilityTags = SupportedValues.immutable(compatibilityTags);
        memoryType = SupportedValues.immutable(memoryType);
    }

    @Override
    public ComponentType type() {
        return ComponentType.CPU;
    }

    /**
     * Returns the power figure used for budgets and cooler sizing: the documented
     * maximum when present, else the nominal TDP, else 0.
     *
     * @return effective power draw in watts
     */
    public int powerDraw() {
        if (maxTdpWatts != null && maxTdpWatts > 0) {
            return maxTdpWatts;
        }
        return tdpWatts != null ? tdpWatts : 0;
    }
}
