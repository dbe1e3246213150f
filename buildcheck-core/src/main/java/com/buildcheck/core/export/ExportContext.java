package com.buildcheck.core.export;

import java.util.Objects;

/**
 * Context provided to formatters during export.
 *
 * @param appUrl base URL of the web application share links point at
 */
public record ExportContext(String appUrl) {

    public static final String DEFAULT_APP_URL = "http://localhost:3000";

    /**
     * Compact constructor with validation.
     */
    public ExportContext {
        Objects.requireNonNull(appUrl, "appUrl must not be null");
        while (appUrl.endsWith("/")) {
            appUrl = appUrl.substring(0, appUrl.length() - 1);
        }
    }

    /**
     * Creates a context pointing at the local development server.
     *
     * @return default context
     */
    public static ExportContext defaults() {
        return new ExportContext(DEFAULT_APP_URL);
    }
}
