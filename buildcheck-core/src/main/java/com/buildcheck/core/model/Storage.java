package com.buildcheck.core.model;

import com.buildcheck.core.util.SupportedValues;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Storage drive record. {@code formFactor} is e.g. {@code M.2-2280} or {@code 2.5"}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Storage(
    @JsonProperty("objectID") String objectId,
    @JsonProperty("brand") String brand,
    @JsonProperty("model") String model,
    @JsonProperty("price_usd") BigDecimal price,
    @JsonProperty("performance_tier") String performanceTier,
    @JsonProperty("image_url") String imageUrl,
    @JsonProperty("compatibility_tags") List<String> compatibilityTags,
    @JsonProperty("storage_type") String storageType,
    @JsonProperty("capacity_gb") Integer capacityGb,
    @JsonProperty("interface") String storageInterface,
    @JsonProperty("form_factor") String formFactor
) implements Component {

    public Storage {
        compatibilityTags = SupportedValues.immutable(compatibilityTags);
    }

    @Override
    public ComponentType type() {
        return ComponentType.STORAGE;
    }
}
