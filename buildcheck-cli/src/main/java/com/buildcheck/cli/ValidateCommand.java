package com.buildcheck.cli;

import com.buildcheck.core.codec.BuildCodec;
import com.buildcheck.core.codec.InvalidBuildRequestException;
import com.buildcheck.core.config.BuildCheckConfig;
import com.buildcheck.core.model.Build;
import com.buildcheck.core.model.ValidationResult;
import com.buildcheck.core.report.ConsoleReport;
import com.buildcheck.core.validation.BuildValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to validate a whole build.
 *
 * <p>Reads a validation request ({@code {"components": {...}}}) and prints every
 * compatibility error and warning together with the power analysis.
 *
 * <p><b>Exit codes:</b> 0 when the build has no errors, 1 when it has errors,
 * 2 when the request cannot be read or decoded.
 */
@Command(
    name = "validate",
    description = "Validate a build request and report errors and warnings",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Validation request JSON file")
    private Path requestFile;

    @Option(names = "--format", description = "Output format: ${COMPLETION-CANDIDATES}", defaultValue = "TEXT")
    private OutputFormat format;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ./buildcheck.yaml)")
    private Path configFile;

    @Override
    public Integer call() {
        BuildCheckConfig config = CommandSupport.config(configFile);

        Build build;
        try {
            build = BuildCodec.readValidationRequest(CommandSupport.read(requestFile));
        } catch (InvalidBuildRequestException | UncheckedIOException e) {
            log.error("Invalid request {}: {}", requestFile, e.getMessage());
            return CommandSupport.EXIT_INPUT_ERROR;
        }

        log.info("Validating build from {}", requestFile);
        ValidationResult result = BuildValidator.validateBuild(build);

        if (format == OutputFormat.JSON) {
            System.out.println(BuildCodec.writeResult(result));
        } else {
            System.out.print(new ConsoleReport(config.output().colors()).validation(result));
        }

        return result.valid() ? CommandSupport.EXIT_OK : CommandSupport.EXIT_INVALID;
    }
}
