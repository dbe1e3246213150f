package com.buildcheck.core.model;

import com.buildcheck.core.util.SupportedValues;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Power supply record.
 *
 * @param objectId catalogue identifier
 * @param brand manufacturer
 * @param model model name
 * @param price price in USD
 * @param performanceTier performance tier label
 * @param imageUrl optional image URL
 * @param compatibilityTags catalogue tags (informational only)
 * @param wattage rated output
 * @param efficiencyRating 80 PLUS rating
 * @param modular modularity (Full, Semi, No)
 * @param formFactor PSU form factor (ATX, SFX)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Psu(
    @JsonProperty("objectID") String objectId,
    @JsonProperty("brand") String brand,
    @JsonProperty("model") String model,
    @JsonProperty("price_usd") BigDecimal price,
    @JsonProperty("performance_tier") String performanceTier,
    @JsonProperty("image_url") String imageUrl,
    @JsonProperty("compatibility_tags") List<String> compatibilityTags,
    @JsonProperty("wattage") Integer wattage,
    @JsonProperty("efficiency_rating") String efficiencyRating,
    @JsonProperty("modular") String modular,
    @JsonProperty("form_factor") String formFactor
) implements Component {

    public Psu {
        compatibilityTags = SupportedValues.immutable(compatibilityTags);
    }

    @Override
    public ComponentType type() {
        return ComponentType.PSU;
    }
}
