package com.buildcheck.core.export;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Output of a {@link BuildFormatter}.
 *
 * @param formatted the exported text
 * @param totalPrice sum of the known component prices
 * @param componentCount number of listed components
 * @param shareUrl share link, only set by the link format
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExportResult(
    String formatted,
    BigDecimal totalPrice,
    int componentCount,
    String shareUrl
) {
    /**
     * Compact constructor with validation.
     */
    public ExportResult {
        Objects.requireNonNull(formatted, "formatted must not be null");
        Objects.requireNonNull(totalPrice, "totalPrice must not be null");
    }
}
