package com.buildcheck.core.export;

import com.buildcheck.core.model.Build;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Registry of {@link BuildFormatter}s keyed by id.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * BuildExporter exporter = BuildExporter.discover();
 * ExportResult result = exporter.export(build, "reddit", ExportContext.defaults());
 * }</pre>
 */
public class BuildExporter {

    private static final Logger log = LoggerFactory.getLogger(BuildExporter.class);

    private final Map<String, BuildFormatter> formatters;
    private final List<String> order;

    /**
     * Creates an exporter over the given formatters. A later formatter with a duplicate id
     * is ignored.
     *
     * @param formatters available formatters
     */
    public BuildExporter(List<BuildFormatter> formatters) {
        Map<String, BuildFormatter> byId = new LinkedHashMap<>();
        for (BuildFormatter formatter : formatters) {
            BuildFormatter previous = byId.putIfAbsent(formatter.getId(), formatter);
            if (previous != null) {
                log.warn("Duplicate export format id '{}': keeping {}, ignoring {}",
                    formatter.getId(), previous.getClass().getName(), formatter.getClass().getName());
            }
        }
        this.formatters = Map.copyOf(byId);
        this.order = List.copyOf(byId.keySet());
    }

    /**
     * Creates an exporter over every formatter registered via {@link ServiceLoader}.
     *
     * @return exporter with discovered formatters
     */
    public static BuildExporter discover() {
        log.debug("Discovering export formatters via ServiceLoader");
        List<BuildFormatter> found = new ArrayList<>();
        ServiceLoader.load(BuildFormatter.class).forEach(found::add);
        log.debug("Found {} export formatters", found.size());
        return new BuildExporter(found);
    }

    /**
     * Lists the available formatters in registration order.
     *
     * @return formatters
     */
    public List<BuildFormatter> formatters() {
        return order.stream().map(formatters::get).toList();
    }

    /**
     * Looks up a formatter.
     *
     * @param id format id
     * @return the formatter, or empty when unknown
     */
    public Optional<BuildFormatter> find(String id) {
        return Optional.ofNullable(formatters.get(id));
    }

    /**
     * Exports a build.
     *
     * @param build build to export
     * @param formatId format id
     * @param context export settings
     * @return formatted export
     * @throws IllegalArgumentException if the format is unknown or the build is empty
     */
    public ExportResult export(Build build, String formatId, ExportContext context) {
        Objects.requireNonNull(build, "build must not be null");
        Objects.requireNonNull(context, "context must not be null");
        BuildFormatter formatter = find(formatId).orElseThrow(() -> new IllegalArgumentException(
            "Unknown export format: " + formatId + " (available: " + String.join(", ", order) + ")"));

        ExportResult result = formatter.format(build, context);
        log.debug("Exported {} components as {}", result.componentCount(), formatId);
        return result;
    }
}
