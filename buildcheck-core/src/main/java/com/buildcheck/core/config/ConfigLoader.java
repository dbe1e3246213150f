package com.buildcheck.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading BuildCheck configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code buildcheck.yaml} into {@link BuildCheckConfig}.
 * If the config file is missing or invalid, returns {@link BuildCheckConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * BuildCheckConfig config = ConfigLoader.load(Paths.get("buildcheck.yaml"));
 *
 * if (config.power().overclocking()) {
 *     // Reserve overclocking headroom
 * }
 * }</pre>
 */
public final class ConfigLoader {

    /** File name looked up in the working directory when no path is given. */
    public static final String DEFAULT_FILE_NAME = "buildcheck.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link BuildCheckConfig#defaults()}.
     *
     * @param configPath path to {@code buildcheck.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static BuildCheckConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return BuildCheckConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return BuildCheckConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            BuildCheckConfig config = YAML_MAPPER.readValue(configPath.toFile(), BuildCheckConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return BuildCheckConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return BuildCheckConfig.defaults();
        }
    }

    /**
     * Loads {@code buildcheck.yaml} from the working directory when present, else defaults
     * without a warning.
     *
     * @return loaded configuration or defaults
     */
    public static BuildCheckConfig loadDefault() {
        Path path = Path.of(DEFAULT_FILE_NAME);
        if (!Files.exists(path)) {
            log.debug("No {} in working directory. Using defaults.", DEFAULT_FILE_NAME);
            return BuildCheckConfig.defaults();
        }
        return load(path);
    }
}
