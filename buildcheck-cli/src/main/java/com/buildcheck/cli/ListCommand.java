package com.buildcheck.cli;

import com.buildcheck.core.export.BuildExporter;
import com.buildcheck.core.export.BuildFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list available export formats.
 *
 * <p>Discovers formatters via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * buildcheck list formats
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available export formats",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(index = "0", description = "Type to list: formats")
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "formats", "format" -> listFormats();
            default -> {
                log.error("Unknown type: {}. Use: formats", type);
                yield 1;
            }
        };
    }

    private int listFormats() {
        System.out.println("Available Export Formats:");
        System.out.println();

        List<BuildFormatter> formatters = BuildExporter.discover().formatters();
        for (BuildFormatter formatter : formatters) {
            System.out.printf("  • %s (ID: %s)%n", formatter.getDisplayName(), formatter.getId());
        }

        if (formatters.isEmpty()) {
            System.out.println("  No export formats found.");
        }

        return 0;
    }
}
