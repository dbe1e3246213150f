package com.buildcheck.core.export;

import com.buildcheck.core.model.Build;

/**
 * Interface for build export formats.
 *
 * <p>Formatters turn a build into text that can be pasted elsewhere: a parts-list table,
 * a Reddit comment, a JSON document or a share link. They list components only and never
 * evaluate compatibility.
 *
 * <p>Formatters are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class PlainTextFormatter implements BuildFormatter {
 *     @Override
 *     public String getId() {
 *         return "plain";
 *     }
 *
 *     @Override
 *     public ExportResult format(Build build, ExportContext context) {
 *         List<ExportLine> lines = ExportLine.of(build);
 *         String text = lines.stream()
 *             .map(line -> line.label() + ": " + line.name())
 *             .collect(Collectors.joining("\n"));
 *         return new ExportResult(text, build.totalPrice(), lines.size(), null);
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.buildcheck.core.export.BuildFormatter}
 *
 * @see BuildExporter
 * @see ExportContext
 */
public interface BuildFormatter {

    /**
     * Returns unique identifier for this format.
     *
     * <p>Used on the command line and in configuration. Lowercase (e.g., "reddit", "link").
     *
     * @return unique format identifier
     */
    String getId();

    /**
     * Returns human-readable name for display.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Formats a build.
     *
     * @param build build to export, with at least one selected component
     * @param context export settings
     * @return formatted export
     * @throws IllegalArgumentException if the build cannot be expressed in this format
     */
    ExportResult format(Build build, ExportContext context);
}
