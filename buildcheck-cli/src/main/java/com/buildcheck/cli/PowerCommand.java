package com.buildcheck.cli;

import com.buildcheck.core.codec.BuildCodec;
import com.buildcheck.core.codec.InvalidBuildRequestException;
import com.buildcheck.core.config.BuildCheckConfig;
import com.buildcheck.core.model.Build;
import com.buildcheck.core.power.PowerCalculator;
import com.buildcheck.core.power.PsuRecommendation;
import com.buildcheck.core.report.ConsoleReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to recommend a PSU for a build.
 */
@Command(
    name = "power",
    description = "Recommend a PSU for a build",
    mixinStandardHelpOptions = true
)
public class PowerCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PowerCommand.class);

    @Parameters(index = "0", description = "Build JSON file")
    private Path buildFile;

    @Option(names = "--overclock", negatable = true,
        description = "Reserve overclocking headroom (default: power.overclocking from config)")
    private Boolean overclock;

    @Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES}", defaultValue = "TEXT")
    private OutputFormat format;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ./buildcheck.yaml)")
    private Path configFile;

    @Override
    public Integer call() {
        BuildCheckConfig config = CommandSupport.config(configFile);

        Build build;
        try {
            build = BuildCodec.readBuild(CommandSupport.read(buildFile));
        } catch (InvalidBuildRequestException | UncheckedIOException e) {
            log.error("Invalid build {}: {}", buildFile, e.getMessage());
            return CommandSupport.EXIT_INPUT_ERROR;
        }

        boolean overclocking = overclock != null ? overclock : config.power().overclocking();
        PsuRecommendation recommendation = PowerCalculator.recommend(build, overclocking);

        if (format == OutputFormat.JSON) {
            System.out.println(BuildCodec.writeResult(recommendation));
        } else {
            System.out.print(new ConsoleReport(config.output().colors()).recommendation(recommendation));
        }
        return CommandSupport.EXIT_OK;
    }
}
