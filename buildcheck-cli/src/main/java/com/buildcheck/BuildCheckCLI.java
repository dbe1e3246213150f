package com.buildcheck;

import ch.qos.logback.classic.Level;
import com.buildcheck.cli.CheckCommand;
import com.buildcheck.cli.ExportCommand;
import com.buildcheck.cli.FiltersCommand;
import com.buildcheck.cli.ListCommand;
import com.buildcheck.cli.PowerCommand;
import com.buildcheck.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for BuildCheck.
 *
 * <p>BuildCheck validates PC builds: pairwise part compatibility, whole-build validation,
 * PSU sizing, search filters and parts-list export.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code validate} - Validate a build request and report errors and warnings</li>
 *   <li>{@code check} - Classify one candidate against a build</li>
 *   <li>{@code power} - Recommend a PSU for a build</li>
 *   <li>{@code filters} - Derive search filters from a build</li>
 *   <li>{@code export} - Export a build as a parts list or share link</li>
 *   <li>{@code list} - List available export formats</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Validate a build
 * buildcheck validate request.json
 *
 * # Check a GPU against the current build
 * buildcheck check gpu.json --build build.json
 *
 * # Recommend a PSU with overclocking headroom
 * buildcheck power build.json --overclock
 * }</pre>
 */
@Command(
    name = "buildcheck",
    mixinStandardHelpOptions = true,
    version = "BuildCheck 1.0.0-SNAPSHOT",
    description = "PC build compatibility validation and power budgeting",
    subcommands = {
        ValidateCommand.class,
        CheckCommand.class,
        PowerCommand.class,
        FiltersCommand.class,
        ExportCommand.class,
        ListCommand.class
    }
)
public class BuildCheckCLI implements Runnable {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("BuildCheck - PC build compatibility validation");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'buildcheck --help' to see available commands");
        System.out.println("Use 'buildcheck <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    /**
     * Builds the command line with global options applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        BuildCheckCLI cli = new BuildCheckCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
