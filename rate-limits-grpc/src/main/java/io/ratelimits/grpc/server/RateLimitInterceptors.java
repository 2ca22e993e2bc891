package io.ratelimits.grpc.server;

import io.ratelimits.MetricRegistry;
import io.ratelimits.grpc.config.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Factories for commonly used {@link RateLimitServerInterceptor} setups.
 */
public final class RateLimitInterceptors {
    private static final Logger LOG = LoggerFactory.getLogger(RateLimitInterceptors.class);

    /**
     * Build the rate limit stage described by the server settings.
     *
     * @return The interceptor, or empty when rate limiting is disabled
     */
    public static Optional<RateLimitServerInterceptor> fromConfig(ServerConfig config, MetricRegistry registry) {
        if (!config.isRateLimitEnabled()) {
            LOG.info("Rate limiting disabled");
            return Optional.empty();
        }

        RateLimitServerInterceptor interceptor = RateLimitServerInterceptor.newBuilder(new GrpcRateLimitConfigBuilder()
                        .requestsPerSecond(config.getRateLimitRequestsPerSecond())
                        .burstSize(config.getRateLimitBurstSize())
                        .maxKeys(config.getRateLimitMaxKeys())
                        .strategy(config.getRateLimitStrategy())
                        .build())
                .metricRegistry(registry)
                .build();

        LOG.atInfo()
                .addKeyValue("requests_per_second", interceptor.getConfig().getRequestsPerSecond())
                .addKeyValue("burst_size", interceptor.getConfig().getBurstSize())
                .addKeyValue("strategy", config.getRateLimitStrategy().getConfigName())
                .log("Rate limiting enabled");
        return Optional.of(interceptor);
    }

    /**
     * One budget shared by every call on the server.
     */
    public static RateLimitServerInterceptor global(int requestsPerSecond, int burstSize) {
        return RateLimitServerInterceptor.newBuilder(new GrpcRateLimitConfigBuilder()
                        .requestsPerSecond(requestsPerSecond)
                        .burstSize(burstSize)
                        .keyGlobal()
                        .build())
                .build();
    }

    /**
     * An independent budget for each method.
     */
    public static RateLimitServerInterceptor perMethod(int requestsPerSecond, int burstSize) {
        return RateLimitServerInterceptor.newBuilder(new GrpcRateLimitConfigBuilder()
                        .requestsPerSecond(requestsPerSecond)
                        .burstSize(burstSize)
                        .keyByMethod()
                        .build())
                .build();
    }

    private RateLimitInterceptors() {
    }
}
