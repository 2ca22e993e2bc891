package io.ratelimits.registry;

import io.ratelimits.LimiterRegistry;
import io.ratelimits.MetricRegistry;
import io.ratelimits.RateLimitConfig;
import io.ratelimits.limiter.TokenBucketLimiter;

import java.util.function.LongSupplier;

/**
 * Creates the {@link LimiterRegistry} matching a {@link RateLimitConfig}: token buckets sized by the config,
 * held by a {@link BoundedLimiterRegistry} when {@link RateLimitConfig#getMaxKeys()} is set and by a
 * {@link DefaultLimiterRegistry} otherwise.
 */
public final class LimiterRegistries {
    private LimiterRegistries() {}

    public static LimiterRegistry forConfig(RateLimitConfig<?> config, LongSupplier nanoClock, MetricRegistry registry) {
        if (config.getMaxKeys() > 0) {
            return new BoundedLimiterRegistry(config.getMaxKeys(), TokenBucketLimiter.factory(config, nanoClock), registry);
        }
        return new DefaultLimiterRegistry(TokenBucketLimiter.factory(config, nanoClock), registry);
    }

    public static LimiterRegistry forConfig(RateLimitConfig<?> config, MetricRegistry registry) {
        return forConfig(config, System::nanoTime, registry);
    }
}
