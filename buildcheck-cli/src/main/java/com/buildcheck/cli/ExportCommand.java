package com.buildcheck.cli;

import com.buildcheck.core.codec.BuildCodec;
import com.buildcheck.core.codec.InvalidBuildRequestException;
import com.buildcheck.core.config.BuildCheckConfig;
import com.buildcheck.core.export.BuildExporter;
import com.buildcheck.core.export.ExportContext;
import com.buildcheck.core.export.ExportResult;
import com.buildcheck.core.model.Build;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to export a build as a parts list, JSON document or share link.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Reddit table to stdout
 * buildcheck export build.json --format reddit
 *
 * # Share link to a file
 * buildcheck export build.json --format link -o link.txt
 * }</pre>
 */
@Command(
    name = "export",
    description = "Export a build (see 'list formats')",
    mixinStandardHelpOptions = true
)
public class ExportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExportCommand.class);

    @Parameters(index = "0", description = "Build JSON file")
    private Path buildFile;

    @Option(names = {"-f", "--format"}, description = "Format id (default: export.defaultFormat from config)")
    private String formatId;

    @Option(names = {"-o", "--output"}, description = "Write to file instead of stdout")
    private Path outputFile;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ./buildcheck.yaml)")
    private Path configFile;

    @Override
    public Integer call() {
        BuildCheckConfig config = CommandSupport.config(configFile);
        String format = formatId != null ? formatId : config.export().defaultFormat();

        Build build;
        try {
            build = BuildCodec.readBuild(CommandSupport.read(buildFile));
        } catch (InvalidBuildRequestException | UncheckedIOException e) {
            log.error("Invalid build {}: {}", buildFile, e.getMessage());
            return CommandSupport.EXIT_INPUT_ERROR;
        }

        ExportResult result;
        try {
            result = BuildExporter.discover().export(build, format, new ExportContext(config.export().appUrl()));
        } catch (IllegalArgumentException e) {
            log.error("Export failed: {}", e.getMessage());
            return CommandSupport.EXIT_INPUT_ERROR;
        }

        if (outputFile == null) {
            System.out.println(result.formatted());
            return CommandSupport.EXIT_OK;
        }

        try {
            Files.writeString(outputFile, result.formatted() + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to write {}: {}", outputFile, e.getMessage());
            return CommandSupport.EXIT_INPUT_ERROR;
        }
        log.info("Exported {} components ({}) to {}", result.componentCount(), format, outputFile);
        return CommandSupport.EXIT_OK;
    }
}
