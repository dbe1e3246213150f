package com.buildcheck.core.util;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Membership helpers for "supported values" fields such as {@code memory_type},
 * {@code socket_support} and {@code form_factor_support}.
 *
 * <p><b>Matching rules:</b>
 * <ul>
 *   <li>Comparison ignores case, hyphens and whitespace: {@code "Micro-ATX"} equals {@code "Micro ATX"}.</li>
 *   <li>Matching is exact after normalization, so {@code "ATX"} does not match {@code "Micro-ATX"}.</li>
 *   <li>An empty list places no restriction and accepts any value.</li>
 * </ul>
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * SupportedValues.contains(List.of("ATX", "Micro-ATX"), "micro atx"); // true
 * SupportedValues.contains(List.of("Micro-ATX"), "ATX");              // false
 * SupportedValues.contains(List.of(), "E-ATX");                       // true
 * }</pre>
 */
public final class SupportedValues {

    private static final Pattern SEPARATORS = Pattern.compile("[-\\s]");
    private static final String UNKNOWN = "Unknown";

    private SupportedValues() {
        // Utility class
    }

    /**
     * Normalizes a value for comparison: lowercase, hyphens and whitespace removed.
     *
     * @param value raw value
     * @return normalized value, empty string for null
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return SEPARATORS.matcher(value.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    /**
     * Returns true if two values are equal after normalization.
     *
     * @param left first value
     * @param right second value
     * @return true when both normalize to the same non-empty string
     */
    public static boolean matches(String left, String right) {
        String normalizedLeft = normalize(left);
        return !normalizedLeft.isEmpty() && normalizedLeft.equals(normalize(right));
    }

    /**
     * Checks whether {@code value} is among the supported values.
     *
     * @param supported supported values; null or empty means unrestricted
     * @param value value to look up
     * @return true if the list is empty or contains the value after normalization
     */
    public static boolean contains(List<String> supported, String value) {
        if (supported == null || supported.isEmpty()) {
            return true;
        }
        if (value == null || value.isBlank()) {
            return false;
        }
        return supported.stream().anyMatch(item -> matches(item, value));
    }

    /**
     * Formats supported values for messages, e.g. {@code "DDR4/DDR5"}.
     *
     * @param supported supported values
     * @return values joined with '/', or "Unknown" when empty
     */
    public static String format(List<String> supported) {
        if (supported == null || supported.isEmpty()) {
            return UNKNOWN;
        }
        return String.join("/", supported);
    }

    /**
     * Copies a list field into its canonical immutable form.
     *
     * <p>Null becomes an empty list; null and blank entries are dropped.
     *
     * @param values raw list, may be null
     * @return immutable list
     */
    public static List<String> immutable(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .filter(Objects::nonNull)
            .filter(value -> !value.isBlank())
            .toList();
    }
}
