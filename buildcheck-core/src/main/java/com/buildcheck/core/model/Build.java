package com.buildcheck.core.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of a PC build: eight typed slots, each empty (null) or holding one component.
 *
 * <p>A build is a value. {@link #with(Component)} and {@link #without(Slot)} return new
 * snapshots and never modify the receiver, so every engine call sees an immutable input.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Build build = Build.empty()
 *     .with(cpu)
 *     .with(motherboard);
 *
 * Build withoutCpu = build.without(Slot.CPU);
 * }</pre>
 *
 * @param cpu processor slot
 * @param motherboard motherboard slot
 * @param gpu graphics card slot
 * @param ram memory slot
 * @param psu power supply slot
 * @param pcCase case slot
 * @param cooler CPU cooler slot
 * @param storage storage slot (optional for completeness)
 */
public record Build(
    Cpu cpu,
    Motherboard motherboard,
    Gpu gpu,
    Ram ram,
    Psu psu,
    PcCase pcCase,
    Cooler cooler,
    Storage storage
) {
    private static final Build EMPTY = new Build(null, null, null, null, null, null, null, null);

    /**
     * Returns a build with every slot empty.
     *
     * @return empty build
     */
    public static Build empty() {
        return EMPTY;
    }

    /**
     * Returns a copy with the component placed in its slot, replacing any previous occupant.
     *
     * @param component component to place
     * @return new build
     * @throws IllegalArgumentException if the component's category is not recognized
     */
    public Build with(Component component) {
        Objects.requireNonNull(component, "component must not be null");
        return switch (component.type()) {
            case CPU -> new Build((Cpu) component, motherboard, gpu, ram, psu, pcCase, cooler, storage);
            case MOTHERBOARD -> new Build(cpu, (Motherboard) component, gpu, ram, psu, pcCase, cooler, storage);
            case GPU -> new Build(cpu, motherboard, (Gpu) component, ram, psu, pcCase, cooler, storage);
            case RAM -> new Build(cpu, motherboard, gpu, (Ram) component, psu, pcCase, cooler, storage);
            case PSU -> new Build(cpu, motherboard, gpu, ram, (Psu) component, pcCase, cooler, storage);
            case CASE -> new Build(cpu, motherboard, gpu, ram, psu, (PcCase) component, cooler, storage);
            case COOLER -> new Build(cpu, motherboard, gpu, ram, psu, pcCase, (Cooler) component, storage);
            case STORAGE -> new Build(cpu, motherboard, gpu, ram, psu, pcCase, cooler, (Storage) component);
            case UNKNOWN -> throw new IllegalArgumentException(
                "Component " + component.displayName() + " has no slot: unrecognized component type");
        };
    }

    /**
     * Returns a copy with the slot cleared.
     *
     * @param slot slot to clear
     * @return new build
     */
    public Build without(Slot slot) {
        Objects.requireNonNull(slot, "slot must not be null");
        return switch (slot) {
            case CPU -> new Build(null, motherboard, gpu, ram, psu, pcCase, cooler, storage);
            case MOTHERBOARD -> new Build(cpu, null, gpu, ram, psu, pcCase, cooler, storage);
            case GPU -> new Build(cpu, motherboard, null, ram, psu, pcCase, cooler, storage);
            case RAM -> new Build(cpu, motherboard, gpu, null, psu, pcCase, cooler, storage);
            case PSU -> new Build(cpu, motherboard, gpu, ram, null, pcCase, cooler, storage);
            case CASE -> new Build(cpu, motherboard, gpu, ram, psu, null, cooler, storage);
            case COOLER -> new Build(cpu, motherboard, gpu, ram, psu, pcCase, null, storage);
            case STORAGE -> new Build(cpu, motherboard, gpu, ram, psu, pcCase, cooler, null);
        };
    }

    /**
     * Reads a slot.
     *
     * @param slot slot to read
     * @return the component in the slot, or null when empty
     */
    public Component get(Slot slot) {
        return switch (slot) {
            case CPU -> cpu;
            case MOTHERBOARD -> motherboard;
            case GPU -> gpu;
            case RAM -> ram;
            case PSU -> psu;
            case CASE -> pcCase;
            case COOLER -> cooler;
            case STORAGE -> storage;
        };
    }

    /**
     * Lists the occupied slots in slot order.
     *
     * @return occupied slots
     */
    public List<Slot> selected() {
        List<Slot> occupied = new ArrayList<>();
        for (Slot slot : Slot.values()) {
            if (get(slot) != null) {
                occupied.add(slot);
            }
        }
        return List.copyOf(occupied);
    }

    /**
     * Sums the prices of selected components; unknown prices count as zero.
     *
     * @return total price in USD
     */
    public BigDecimal totalPrice() {
        BigDecimal total = BigDecimal.ZERO;
        for (Slot slot : selected()) {
            BigDecimal price = get(slot).price();
            if (price != null) {
                total = total.add(price);
            }
        }
        return total;
    }
}
