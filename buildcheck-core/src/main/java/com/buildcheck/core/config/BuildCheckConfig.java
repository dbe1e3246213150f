package com.buildcheck.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for BuildCheck.
 *
 * <p>Loaded from {@code buildcheck.yaml}. Omitted sections and fields take their defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * power:
 *   overclocking: false
 *
 * export:
 *   defaultFormat: reddit
 *   appUrl: "https://builds.example.com"
 *
 * output:
 *   colors: true
 * }</pre>
 *
 * @param power power calculation settings
 * @param export export settings
 * @param output console output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BuildCheckConfig(
    @JsonProperty("power") PowerConfig power,
    @JsonProperty("export") ExportConfig export,
    @JsonProperty("output") OutputConfig output
) {
    /**
     * Compact constructor filling omitted sections.
     */
    public BuildCheckConfig {
        if (power == null) {
            power = PowerConfig.defaults();
        }
        if (export == null) {
            export = ExportConfig.defaults();
        }
        if (output == null) {
            output = OutputConfig.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static BuildCheckConfig defaults() {
        return new BuildCheckConfig(PowerConfig.defaults(), ExportConfig.defaults(), OutputConfig.defaults());
    }

    /**
     * Power calculation settings.
     *
     * @param overclocking reserve the overclocking buffer unless overridden per command
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PowerConfig(
        @JsonProperty("overclocking") boolean overclocking
    ) {
        public static PowerConfig defaults() {
            return new PowerConfig(false);
        }
    }

    /**
     * Export settings.
     *
     * @param defaultFormat format id used when none is given
     * @param appUrl base URL for share links
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExportConfig(
        @JsonProperty("defaultFormat") String defaultFormat,
        @JsonProperty("appUrl") String appUrl
    ) {
        public ExportConfig {
            if (defaultFormat == null || defaultFormat.isBlank()) {
                defaultFormat = "pcpartpicker";
            }
            if (appUrl == null || appUrl.isBlank()) {
                appUrl = "http://localhost:3000";
            }
        }

        public static ExportConfig defaults() {
            return new ExportConfig(null, null);
        }
    }

    /**
     * Console output settings.
     *
     * @param colors use ANSI colors in text reports
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("colors") Boolean colors
    ) {
        public OutputConfig {
            if (colors == null) {
                colors = Boolean.TRUE;
            }
        }

        public static OutputConfig defaults() {
            return new OutputConfig(true);
        }
    }
}
