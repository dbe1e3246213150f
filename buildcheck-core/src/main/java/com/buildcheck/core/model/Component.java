package com.buildcheck.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.math.BigDecimal;
import java.util.List;

/**
 * A catalogue record for one piece of hardware.
 *
 * <p>Components are discriminated by the {@code component_type} JSON property. Every
 * category is its own immutable record; {@link UnrecognizedComponent} absorbs records whose
 * type is not one of the known categories so that decoding a single candidate never fails
 * on an unfamiliar category.
 *
 * <p>The interface is sealed so that {@code switch} expressions over {@link #type()} are
 * checked for exhaustiveness by the compiler.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "component_type",
    defaultImpl = UnrecognizedComponent.class
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = Cpu.class, name = "CPU"),
    @JsonSubTypes.Type(value = Gpu.class, name = "GPU"),
    @JsonSubTypes.Type(value = Motherboard.class, name = "Motherboard"),
    @JsonSubTypes.Type(value = Ram.class, name = "RAM"),
    @JsonSubTypes.Type(value = Psu.class, name = "PSU"),
    @JsonSubTypes.Type(value = PcCase.class, name = "Case"),
    @JsonSubTypes.Type(value = Cooler.class, name = "Cooler"),
    @JsonSubTypes.Type(value = Storage.class, name = "Storage")
})
public sealed interface Component
    permits Cpu, Gpu, Motherboard, Ram, Psu, PcCase, Cooler, Storage, UnrecognizedComponent {

    /**
     * Returns the hardware category of this component.
     *
     * @return component type, {@link ComponentType#UNKNOWN} for unrecognized records
     */
    ComponentType type();

    /** Catalogue object identifier. */
    String objectId();

    /** Manufacturer. */
    String brand();

    /** Model name. */
    String model();

    /** Price in USD, null when unknown. */
    BigDecimal price();

    /** Performance tier label (budget, mid-range, high-end, enthusiast). */
    String performanceTier();

    /** Product image URL, optional. */
    String imageUrl();

    /**
     * Catalogue tags. Carried for round-tripping only; no compatibility rule reads them.
     *
     * @return immutable tag list, never null
     */
    List<String> compatibilityTags();

    /**
     * Returns "brand model", skipping a missing brand.
     *
     * @return display name
     */
    default String displayName() {
        if (brand() == null || brand().isBlank()) {
            return model();
        }
        return brand() + " " + model();
    }
}
