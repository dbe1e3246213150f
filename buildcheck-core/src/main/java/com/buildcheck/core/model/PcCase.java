package com.buildcheck.core.model;

import com.buildcheck.core.util.SupportedValues;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Chassis record (catalogue type {@code "Case"}).
 *
 * @param objectId catalogue identifier
 * @param brand manufacturer
 * @param model model name
 * @param price price in USD
 * @param performanceTier performance tier label
 * @param imageUrl optional image URL
 * @param compatibilityTags catalogue tags (informational only)
 * @param formFactorSupport supported motherboard form factors; empty means unrestricted
 * @param maxGpuLengthMm GPU clearance
 * @param maxCoolerHeightMm CPU cooler clearance
 * @param maxPsuLengthMm PSU clearance
 * @param driveBays35 3.5" bays
 * @param driveBays25 2.5" bays
 * @param radiatorSupport supported radiator sizes
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PcCase(
    @JsonProperty("objectID") String objectId,
    @JsonProperty("brand") String brand,
    @JsonProperty("model") String model,
    @JsonProperty("price_usd") BigDecimal price,
    @JsonProperty("performance_tier") String performanceTier,
    @JsonProperty("image_url") String imageUrl,
    @JsonProperty("compatibility_tags") List<String> compatibilityTags,
    @JsonProperty("form_factor_support") List<String> formFactorSupport,
    @JsonProperty("max_gpu_length_mm") Integer maxGpuLengthMm,
    @JsonProperty("max_cooler_height_mm") Integer maxCoolerHeightMm,
    @JsonProperty("max_psu_length_mm") Integer maxPsuLengthMm,
    @JsonProperty("drive_bays_35") Integer driveBays35,
    @JsonProperty("drive_bays_25") Integer driveBays25,
    @JsonProperty("radiator_support") List<String> radiatorSupport
) implements Component {

    /**
     * Compact constructor normalizing list fields.
     */
    public PcCase {
        compatibilityTags = SupportedValues.immutable(compatibilityTags);
        formFactorSupport = SupportedValues.immutable(formFactorSupport);
        radiatorSupport = SupportedValues.immutable(radiatorSupport);
    }

    @Override
    public ComponentType type() {
        return ComponentType.CASE;
    }
}
