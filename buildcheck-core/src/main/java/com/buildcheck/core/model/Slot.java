package com.buildcheck.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Named positions of a {@link Build}, in display order.
 *
 * <p>Each slot holds at most one component of its {@link ComponentType}. Storage is
 * optional; every other slot is required for a complete build.
 */
public enum Slot {
    CPU("cpu", ComponentType.CPU, true),
    MOTHERBOARD("motherboard", ComponentType.MOTHERBOARD, true),
    GPU("gpu", ComponentType.GPU, true),
    RAM("ram", ComponentType.RAM, true),
    PSU("psu", ComponentType.PSU, true),
    CASE("case", ComponentType.CASE, true),
    COOLER("cooler", ComponentType.COOLER, true),
    STORAGE("storage", ComponentType.STORAGE, false);

    private final String key;
    private final ComponentType componentType;
    private final boolean required;

    Slot(String key, ComponentType componentType, boolean required) {
        this.key = key;
        this.componentType = componentType;
        this.required = required;
    }

    /**
     * Returns the JSON key of this slot ({@code "cpu"}, {@code "case"}, ...).
     *
     * @return slot key
     */
    public String key() {
        return key;
    }

    /**
     * Returns the component type this slot accepts.
     *
     * @return component type
     */
    public ComponentType componentType() {
        return componentType;
    }

    /**
     * Returns whether a build must fill this slot to be complete.
     *
     * @return true for required slots
     */
    public boolean required() {
        return required;
    }

    /**
     * Looks up a slot by JSON key (exact, case-sensitive).
     *
     * @param key slot key
     * @return the slot, or empty for unrecognized keys
     */
    public static Optional<Slot> forKey(String key) {
        return Arrays.stream(values())
            .filter(slot -> slot.key.equals(key))
            .findFirst();
    }

    /**
     * Looks up the slot accepting a component type.
     *
     * @param type component type
     * @return the slot, or empty for {@link ComponentType#UNKNOWN}
     */
    public static Optional<Slot> forType(ComponentType type) {
        return Arrays.stream(values())
            .filter(slot -> slot.componentType == type)
            .findFirst();
    }
}
