package com.buildcheck.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Hardware categories a component can belong to.
 *
 * <p>The label is the value carried in the {@code component_type} property of catalogue
 * records and in {@code missingComponents}/{@code affectedComponents} of validation output.
 */
public enum ComponentType {
    /** Central processing unit */
    CPU("CPU"),

    /** Graphics card */
    GPU("GPU"),

    /** Motherboard */
    MOTHERBOARD("Motherboard"),

    /** Memory kit */
    RAM("RAM"),

    /** Power supply unit */
    PSU("PSU"),

    /** Chassis */
    CASE("Case"),

    /** CPU cooler (air or liquid) */
    COOLER("Cooler"),

    /** SSD or HDD */
    STORAGE("Storage"),

    /** Unknown or unclassified component */
    UNKNOWN("Unknown");

    private final String label;

    ComponentType(String label) {
        this.label = label;
    }

    /**
     * Returns the catalogue label of this type.
     *
     * @return label such as {@code "Motherboard"}
     */
    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Resolves a catalogue label. Matching ignores case; unrecognized labels map to {@link #UNKNOWN}.
     *
     * @param label label to resolve, may be null
     * @return matching type or {@link #UNKNOWN}
     */
    @JsonCreator
    public static ComponentType fromLabel(String label) {
        if (label == null) {
            return UNKNOWN;
        }
        for (ComponentType type : values()) {
            if (type.label.equalsIgnoreCase(label.trim())) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
