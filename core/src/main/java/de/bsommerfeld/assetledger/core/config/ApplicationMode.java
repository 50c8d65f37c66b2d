package de.bsommerfeld.assetledger.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Which data directory the ledger runs against.
 *
 * <p>
 * {@link #PROD} keeps configuration, store and backups in the platform
 * app-data directory. {@link #TEST} gives every run a fresh directory under
 * {@code java.io.tmpdir}, so integration runs start from an empty store and
 * never touch recorded assets.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    static final String PROPERTY = "app.mode";
    static final String ENV_VARIABLE = "APP_MODE";

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * The mode requested by the {@code app.mode} system property, falling back
     * to the {@code APP_MODE} environment variable. Unset or unknown values
     * mean {@link #PROD}.
     */
    public static ApplicationMode get() {
        String requested = System.getProperty(PROPERTY);
        if (requested == null || requested.isBlank()) {
            requested = System.getenv(ENV_VARIABLE);
        }
        return parse(requested);
    }

    /** Case-insensitive lookup; blank or unknown text yields {@link #PROD}. */
    static ApplicationMode parse(String requested) {
        if (requested == null || requested.isBlank())
            return PROD;
        for (ApplicationMode mode : values()) {
            if (mode.name().equalsIgnoreCase(requested.strip()))
                return mode;
        }
        LOG.warn("Unknown application mode '{}', running against the real data directory", requested);
        return PROD;
    }

    public boolean isTest() {
        return this == TEST;
    }
}
