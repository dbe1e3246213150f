package com.buildcheck.core.export;

import com.buildcheck.core.model.Build;
import com.buildcheck.core.model.Component;
import com.buildcheck.core.model.Slot;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * One row of a parts list.
 *
 * @param slot slot the component occupies
 * @param component the component
 */
public record ExportLine(Slot slot, Component component) {

    /**
     * Lists the selected components of a build in slot order.
     *
     * @param build build to list
     * @return one line per selected slot
     * @throws IllegalArgumentException if no slot is filled
     */
    public static List<ExportLine> of(Build build) {
        List<ExportLine> lines = new ArrayList<>();
        for (Slot slot : build.selected()) {
            lines.add(new ExportLine(slot, build.get(slot)));
        }
        if (lines.isEmpty()) {
            throw new IllegalArgumentException("Build is empty");
        }
        return List.copyOf(lines);
    }

    /**
     * Returns the parts-list label of the slot.
     *
     * @return label such as "Video Card" or "CPU Cooler"
     */
    public String label() {
        return switch (slot) {
            case CPU -> "CPU";
            case MOTHERBOARD -> "Motherboard";
            case GPU -> "Video Card";
            case RAM -> "Memory";
            case PSU -> "Power Supply";
            case CASE -> "Case";
            case COOLER -> "CPU Cooler";
            case STORAGE -> "Storage";
        };
    }

    /**
     * Returns "brand model" of the component.
     *
     * @return display name
     */
    public String name() {
        return component.displayName();
    }

    /**
     * Returns the price as {@code $12.34}, or {@code N/A} when unknown or zero.
     *
     * @return formatted price
     */
    public String price() {
        BigDecimal price = component.price();
        if (price == null || price.signum() == 0) {
            return "N/A";
        }
        return formatPrice(price);
    }

    /**
     * Formats an amount as dollars with two decimals, e.g. {@code $1234.50}.
     *
     * @param amount amount in USD
     * @return formatted amount
     */
    public static String formatPrice(BigDecimal amount) {
        return "$" + amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
