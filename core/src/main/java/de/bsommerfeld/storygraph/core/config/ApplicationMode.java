package de.bsommerfeld.storygraph.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running mode. {@code PROD} persists stories to SQLite, {@code TEST} keeps
 * everything in memory and forgets it on shutdown.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    public static final String PROPERTY = "storygraph.mode";
    public static final String ENVIRONMENT = "STORYGRAPH_MODE";

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Resolves the mode from the {@code storygraph.mode} system property, then
     * the {@code STORYGRAPH_MODE} environment variable. Unset or unknown
     * values fall back to {@code PROD}.
     */
    public static ApplicationMode get() {
        String mode = System.getProperty(PROPERTY);
        if (mode == null || mode.isBlank()) {
            mode = System.getenv(ENVIRONMENT);
        }
        return parse(mode);
    }

    static ApplicationMode parse(String mode) {
        if (mode == null || mode.isBlank()) {
            return PROD;
        }
        try {
            return ApplicationMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}', using PROD", mode);
            return PROD;
        }
    }

    public boolean usesPersistentStorage() {
        return this == PROD;
    }
}
