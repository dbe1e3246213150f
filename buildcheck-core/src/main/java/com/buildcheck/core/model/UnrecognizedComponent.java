package com.buildcheck.core.model;

import com.buildcheck.core.util.SupportedValues;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Catalogue record whose {@code component_type} is missing or not a known category.
 *
 * <p>Only the common fields are kept. Such a record can be classified (its status is
 * always unknown) but never placed in a {@link Build}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UnrecognizedComponent(
    @JsonProperty("objectID") String objectId,
    @JsonProperty("brand") String brand,
    @JsonProperty("model") String model,
    @JsonProperty("price_usd") BigDecimal price,
    @JsonProperty("performance_tier") String performanceTier,
    @JsonProperty("image_url") String imageUrl,
    @JsonProperty("compatibility_tags") List<String> compatibilityTags
) implements Component {

    public UnrecognizedComponent {
        compatibilityTags = SupportedValues.immutable(compatibilityTags);
    }

    @Override
    public ComponentType type() {
        return ComponentType.UNKNOWN;
    }
}
