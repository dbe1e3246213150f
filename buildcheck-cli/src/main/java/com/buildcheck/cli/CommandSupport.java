package com.buildcheck.cli;

import com.buildcheck.core.config.BuildCheckConfig;
import com.buildcheck.core.config.ConfigLoader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared plumbing for commands: input files, configuration and exit codes.
 */
final class CommandSupport {

    /** Command succeeded. */
    static final int EXIT_OK = 0;

    /** Validation found errors. */
    static final int EXIT_INVALID = 1;

    /** Input could not be read or decoded. */
    static final int EXIT_INPUT_ERROR = 2;

    private CommandSupport() {
        // Utility class
    }

    /**
     * Reads a UTF-8 input file.
     *
     * @param path file to read
     * @return file content
     * @throws UncheckedIOException if the file cannot be read
     */
    static String read(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + path, e);
        }
    }

    /**
     * Loads the given configuration file, or {@code buildcheck.yaml} from the working
     * directory when none is given.
     *
     * @param configFile explicit config file, may be null
     * @return configuration
     */
    static BuildCheckConfig config(Path configFile) {
        return configFile != null ? ConfigLoader.load(configFile) : ConfigLoader.loadDefault();
    }
}
