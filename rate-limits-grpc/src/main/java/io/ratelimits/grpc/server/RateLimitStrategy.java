package io.ratelimits.grpc.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named key policies selectable from configuration.
 */
public enum RateLimitStrategy {
    GLOBAL("global"),
    PER_METHOD("per-method");

    private static final Logger LOG = LoggerFactory.getLogger(RateLimitStrategy.class);

    private final String configName;

    RateLimitStrategy(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Anything other than {@code per-method} selects {@link #GLOBAL}.
     */
    public static RateLimitStrategy fromName(String name) {
        if (PER_METHOD.configName.equalsIgnoreCase(name)) {
            return PER_METHOD;
        }
        if (name != null && !GLOBAL.configName.equalsIgnoreCase(name)) {
            LOG.warn("Unknown rate limit strategy '{}', using '{}'", name, GLOBAL.configName);
        }
        return GLOBAL;
    }
}
