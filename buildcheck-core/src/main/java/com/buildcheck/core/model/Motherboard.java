package com.buildcheck.core.model;

import com.buildcheck.core.util.SupportedValues;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Motherboard record.
 *
 * @param objectId catalogue identifier
 * @param brand manufacturer
 * @param model model name
 * @param price price in USD
 * @param performanceTier performance tier label
 * @param imageUrl optional image URL
 * @param compatibilityTags catalogue tags (informational only)
 * @param socket CPU socket
 * @param chipset chipset name
 * @param formFactor board form factor (ATX, Micro-ATX, Mini-ITX, ...)
 * @param memoryType supported memory generations; empty means unrestricted
 * @param memorySlots DIMM slot count
 * @param maxMemoryGb maximum supported memory
 * @param m2Slots M.2 slot count; null when the catalogue does not say
 * @param wifi onboard Wi-Fi
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Motherboard(
    @JsonProperty("objectID") String objectId,
    @JsonProperty("brand") String brand,
    @JsonProperty("model") String model,
    @JsonProperty("price_usd") BigDecimal price,
    @JsonProperty("performance_tier") String performanceTier,
    @JsonProperty("image_url") String imageUrl,
    @JsonProperty("compatibility_tags") List<String> compatibilityTags,
    @JsonProperty("socket") String socket,
    @JsonProperty("chipset") String chipset,
    @JsonProperty("form_factor") String formFactor,
    @JsonProperty("memory_type") List<String> memoryType,
    @JsonProperty("memory_slots") Integer memorySlots,
    @JsonProperty("max_memory_gb") Integer maxMemoryGb,
    @JsonProperty("m2_slots") Integer m2Slots,
    @JsonProperty("wifi") Boolean wifi
) implements Component {

    /**
     * Compact constructor normalizing list fields.
     */
    public Motherboard {
        compatibilityTags = SupportedValues.immutable(compatibilityTags);
        memoryType = SupportedValues.immutable(memoryType);
    }

    @Override
    public ComponentType type() {
        return ComponentType.MOTHERBOARD;
    }
}
