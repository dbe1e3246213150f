package com.buildcheck.cli;

import com.buildcheck.core.codec.BuildCodec;
import com.buildcheck.core.codec.InvalidBuildRequestException;
import com.buildcheck.core.filter.ActiveFilterDeriver;
import com.buildcheck.core.model.Build;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to print the search filters a build implies, as JSON.
 */
@Command(
    name = "filters",
    description = "Derive search filters (socket, memory type, form factor) from a build",
    mixinStandardHelpOptions = true
)
public class FiltersCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FiltersCommand.class);

    @Parameters(index = "0", description = "Build JSON file")
    private Path buildFile;

    @Override
    public Integer call() {
        Build build;
        try {
            build = BuildCodec.readBuild(CommandSupport.read(buildFile));
        } catch (InvalidBuildRequestException | UncheckedIOException e) {
            log.error("Invalid build {}: {}", buildFile, e.getMessage());
            return CommandSupport.EXIT_INPUT_ERROR;
        }

        System.out.println(BuildCodec.writeResult(ActiveFilterDeriver.deriveActiveFilters(build)));
        return CommandSupport.EXIT_OK;
    }
}
