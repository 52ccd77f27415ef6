package com.ammann.updatetracker.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralised path constants for the REST API.
 *
 * <p>All resource classes reference these constants to ensure consistent URL
 * construction across the application.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1 endpoints. */
    public static final String BASE_URL_V1 = "/api/v1";

    /** Path constants for tracked container endpoints. */
    public static final class Container {
        private Container() {}

        public static final String BASE = "/containers";
    }

    /** Path constants for batch job endpoints. */
    public static final class Batch {
        private Batch() {}

        public static final String BASE = "/batch";

        public static final String RUNS = "/runs";
    }
}
