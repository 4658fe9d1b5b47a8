/* (C)2026 */
package com.ammann.regimeshift.properties;

/**
 * Registry of REST API path constants used across all JAX-RS resources.
 */
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Alert subscription and evaluation endpoints
     */
    public static final class Alerts {
        private Alerts() {}

        public static final String BASE = "/alerts";
        public static final String SUBSCRIBE = "/subscribe";
        public static final String STATUS = "/status";
        public static final String EVALUATE = "/evaluate";
        public static final String TEST = "/test";
    }

    /**
     * Early-warning signal endpoints
     */
    public static final class Signals {
        private Signals() {}

        public static final String BASE = "/signals";
        public static final String METRICS = "/metrics";
        public static final String SPECIES = "/species";
        public static final String REBUILD = "/rebuild";
    }
}
