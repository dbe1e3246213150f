package com.buildcheck.core.model;

/**
 * Machine-readable identifiers of validation issues.
 */
public enum IssueCode {
    /** CPU socket differs from motherboard socket. */
    SOCKET_MISMATCH,

    /** RAM generation is not supported by the motherboard. */
    MEMORY_TYPE_MISMATCH,

    /** GPU is longer than the case GPU clearance. */
    GPU_TOO_LONG,

    /** Cooler is taller than the case cooler clearance. */
    COOLER_TOO_TALL,

    /** Cooler does not list the CPU socket. */
    COOLER_SOCKET_MISMATCH,

    /** Case does not accept the motherboard form factor. */
    FORM_FACTOR_MISMATCH,

    /** PSU wattage is below the recommendation. */
    PSU_INSUFFICIENT,

    /** GPU fits with less than 20mm to spare. */
    GPU_CLEARANCE_TIGHT,

    /** Cooler fits with less than 10mm to spare. */
    COOLER_CLEARANCE_TIGHT,

    /** Cooler TDP rating is below the CPU power draw. */
    COOLER_TDP_LOW
}
