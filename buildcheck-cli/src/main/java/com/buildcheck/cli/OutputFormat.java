package com.buildcheck.cli;

/**
 * Report format of commands that print engine results.
 */
public enum OutputFormat {
    /** Human-readable report. */
    TEXT,

    /** Indented JSON of the result record. */
    JSON
}
