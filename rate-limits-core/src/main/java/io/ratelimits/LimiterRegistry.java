package io.ratelimits;

/**
 * {@link Limiter} lookup for integrations that partition traffic into independent budgets, i.e. one per
 * RPC method.  Implementations create a limiter the first time a key is seen and must hand out the same
 * instance for that key afterwards, even under concurrent first use.
 */
public interface LimiterRegistry {
    Limiter getOrCreate(String key);

    /**
     * @return Number of keys currently holding a limiter
     */
    int size();
}
