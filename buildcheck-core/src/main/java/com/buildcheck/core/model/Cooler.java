package com.buildcheck.core.model;

import com.buildcheck.core.util.SupportedValues;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * CPU cooler record.
 *
 * @param objectId catalogue identifier
 * @param brand manufacturer
 * @param model model name
 * @param price price in USD
 * @param performanceTier performance tier label
 * @param imageUrl optional image URL
 * @param compatibilityTags catalogue tags (informational only)
 * @param coolerType Air or Liquid
 * @param socketSupport supported CPU sockets; empty means unrestricted
 * @param heightMm cooler height, compared against case clearance
 * @param radiatorSizeMm radiator size for liquid coolers
 * @param tdpRating rated heat dissipation in watts, optional
 * @param rgb RGB lighting
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Cooler(
    @JsonProperty("objectID") String objectId,
    @JsonProperty("brand") String brand,
    @JsonProperty("model") String model,
    @JsonProperty("price_usd") BigDecimal price,
    @JsonProperty("performance_tier") String performanceTier,
    @JsonProperty("image_url") String imageUrl,
    @JsonProperty("compatibility_tags") List<String> compatibilityTags,
    @JsonProperty("cooler_type") String coolerType,
    @JsonProperty("socket_support") List<String> socketSupport,
    @JsonProperty("height_mm") Integer heightMm,
    @JsonProperty("radiator_size_mm") Integer radiatorSizeMm,
    @JsonProperty("tdp_rating") Integer tdpRating,
    @JsonProperty("rgb") Boolean rgb
) implements Component {

    /**
     * Compact constructor normalizing list fields.
     */
    public Cooler {
        compatibilityTags = SupportedValues.immutable(compatibilityTags);
        socketSupport = SupportedValues.immutable(socketSupport);
    }

    @Override
    public ComponentType type() {
        return ComponentType.COOLER;
    }
}
