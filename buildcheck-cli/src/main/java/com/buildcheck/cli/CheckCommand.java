package com.buildcheck.cli;

import com.buildcheck.core.codec.BuildCodec;
import com.buildcheck.core.codec.InvalidBuildRequestException;
import com.buildcheck.core.compat.CompatibilityChecker;
import com.buildcheck.core.compat.RatedCandidate;
import com.buildcheck.core.config.BuildCheckConfig;
import com.buildcheck.core.model.Build;
import com.buildcheck.core.model.Component;
import com.buildcheck.core.report.ConsoleReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to classify candidate components against a build.
 *
 * <p>The candidate file holds one component or an array of components, e.g. a page of
 * search results. Each is reported as compatible, warning, incompatible or unknown.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * buildcheck check gpu.json --build build.json
 * buildcheck check search-page.json --build build.json --format json
 * }</pre>
 */
@Command(
    name = "check",
    description = "Classify candidate components against a build",
    mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Parameters(index = "0", description = "Candidate component JSON file (object or array)")
    private Path candidateFile;

    @Option(names = {"-b", "--build"}, description = "Current build JSON file (default: empty build)")
    private Path buildFile;

    @Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES}", defaultValue = "TEXT")
    private OutputFormat format;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ./buildcheck.yaml)")
    private Path configFile;

    @Override
    public Integer call() {
        BuildCheckConfig config = CommandSupport.config(configFile);

        List<Component> candidates;
        Build build;
        try {
            candidates = BuildCodec.readComponents(CommandSupport.read(candidateFile));
            build = buildFile != null ? BuildCodec.readBuild(CommandSupport.read(buildFile)) : Build.empty();
        } catch (InvalidBuildRequestException | UncheckedIOException e) {
            log.error("Invalid input: {}", e.getMessage());
            return CommandSupport.EXIT_INPUT_ERROR;
        }

        List<RatedCandidate> rated = CompatibilityChecker.checkAll(candidates, build);

        if (format == OutputFormat.JSON) {
            Object payload = rated.size() == 1 ? rated.get(0).compatibility() : rated;
            System.out.println(BuildCodec.writeResult(payload));
        } else {
            ConsoleReport report = new ConsoleReport(config.output().colors());
            for (RatedCandidate candidate : rated) {
                if (rated.size() > 1) {
                    System.out.print(candidate.component().displayName() + " - ");
                }
                System.out.println(report.compatibility(candidate.compatibility()));
            }
        }

        return CommandSupport.EXIT_OK;
    }
}
