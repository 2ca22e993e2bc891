package io.ratelimits.grpc.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import io.ratelimits.grpc.server.RateLimitStrategy;

import java.time.Duration;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Immutable server settings.  Build with {@link #newBuilder()} or load from environment variables with
 * {@link #fromEnvironment()}.  Unset variables keep their defaults, malformed values fail fast with an
 * {@link IllegalArgumentException} naming the variable.
 */
public final class ServerConfig {
    public static final String APP_NAME = "APP_NAME";
    public static final String APP_VERSION = "APP_VERSION";
    public static final String GRPC_PORT = "GRPC_PORT";

    public static final String RATE_LIMIT_ENABLED = "RATE_LIMIT_ENABLED";
    public static final String RATE_LIMIT_REQUESTS_PER_SEC = "RATE_LIMIT_REQUESTS_PER_SEC";
    public static final String RATE_LIMIT_BURST_SIZE = "RATE_LIMIT_BURST_SIZE";
    public static final String RATE_LIMIT_STRATEGY = "RATE_LIMIT_STRATEGY";
    public static final String RATE_LIMIT_MAX_KEYS = "RATE_LIMIT_MAX_KEYS";

    public static final String GRPC_MAX_CONNECTION_IDLE = "GRPC_MAX_CONNECTION_IDLE";
    public static final String GRPC_MAX_CONNECTION_AGE = "GRPC_MAX_CONNECTION_AGE";
    public static final String GRPC_MAX_CONNECTION_AGE_GRACE = "GRPC_MAX_CONNECTION_AGE_GRACE";
    public static final String GRPC_KEEPALIVE_TIME = "GRPC_KEEPALIVE_TIME";
    public static final String GRPC_KEEPALIVE_TIMEOUT = "GRPC_KEEPALIVE_TIMEOUT";
    public static final String GRPC_KEEPALIVE_MIN_TIME = "GRPC_KEEPALIVE_MIN_TIME";
    public static final String GRPC_PERMIT_WITHOUT_STREAM = "GRPC_PERMIT_WITHOUT_STREAM";
    public static final String GRPC_MAX_RECV_MSG_SIZE = "GRPC_MAX_RECV_MSG_SIZE";
    public static final String GRPC_MAX_CONCURRENT_STREAMS = "GRPC_MAX_CONCURRENT_STREAMS";

    private static final int FOUR_MEBIBYTES = 4 * 1024 * 1024;

    public static class Builder {
        private String appName = "rate-limits-server";
        private String appVersion = "v1.0.0";
        private int grpcPort = 50051;

        private boolean rateLimitEnabled = true;
        private int rateLimitRequestsPerSecond = 100;
        private int rateLimitBurstSize = 200;
        private RateLimitStrategy rateLimitStrategy = RateLimitStrategy.GLOBAL;
        private int rateLimitMaxKeys = 0;

        private Duration maxConnectionIdle = Duration.ofSeconds(15);
        private Duration maxConnectionAge = Duration.ofSeconds(30);
        private Duration maxConnectionAgeGrace = Duration.ofSeconds(5);
        private Duration keepAliveTime = Duration.ofSeconds(5);
        private Duration keepAliveTimeout = Duration.ofSeconds(1);
        private Duration permitKeepAliveTime = Duration.ofSeconds(5);
        private boolean permitKeepAliveWithoutCalls = false;
        private int maxInboundMessageSize = FOUR_MEBIBYTES;
        private int maxConcurrentCallsPerConnection = 1000;

        public Builder appName(String appName) {
            this.appName = appName;
            return this;
        }

        public Builder appVersion(String appVersion) {
            this.appVersion = appVersion;
            return this;
        }

        public Builder grpcPort(int grpcPort) {
            Preconditions.checkArgument(grpcPort >= 0 && grpcPort <= 65535, "grpcPort out of range: %s", grpcPort);
            this.grpcPort = grpcPort;
            return this;
        }

        /**
         * When false no rate limit interceptor is installed at all.
         */
        public Builder rateLimitEnabled(boolean rateLimitEnabled) {
            this.rateLimitEnabled = rateLimitEnabled;
            return this;
        }

        public Builder rateLimitRequestsPerSecond(int requestsPerSecond) {
            this.rateLimitRequestsPerSecond = requestsPerSecond;
            return this;
        }

        public Builder rateLimitBurstSize(int burstSize) {
            this.rateLimitBurstSize = burstSize;
            return this;
        }

        public Builder rateLimitStrategy(RateLimitStrategy strategy) {
            this.rateLimitStrategy = Preconditions.checkNotNull(strategy, "strategy may not be null");
            return this;
        }

        public Builder rateLimitMaxKeys(int maxKeys) {
            this.rateLimitMaxKeys = maxKeys;
            return this;
        }

        public Builder maxConnectionIdle(Duration maxConnectionIdle) {
            this.maxConnectionIdle = maxConnectionIdle;
            return this;
        }

        public Builder maxConnectionAge(Duration maxConnectionAge) {
            this.maxConnectionAge = maxConnectionAge;
            return this;
        }

        public Builder maxConnectionAgeGrace(Duration maxConnectionAgeGrace) {
            this.maxConnectionAgeGrace = maxConnectionAgeGrace;
            return this;
        }

        public Builder keepAliveTime(Duration keepAliveTime) {
            this.keepAliveTime = keepAliveTime;
            return this;
        }

        public Builder keepAliveTimeout(Duration keepAliveTimeout) {
            this.keepAliveTimeout = keepAliveTimeout;
            return this;
        }

        public Builder permitKeepAliveTime(Duration permitKeepAliveTime) {
            this.permitKeepAliveTime = permitKeepAliveTime;
            return this;
        }

        public Builder permitKeepAliveWithoutCalls(boolean permit) {
            this.permitKeepAliveWithoutCalls = permit;
            return this;
        }

        public Builder maxInboundMessageSize(int bytes) {
            this.maxInboundMessageSize = bytes;
            return this;
        }

        public Builder maxConcurrentCallsPerConnection(int maxCalls) {
            this.maxConcurrentCallsPerConnection = maxCalls;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(this);
        }
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Load settings from the process environment.
     */
    public static ServerConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Load settings from environment style variables.
     *
     * @param env Variable lookup returning null for unset variables
     */
    public static ServerConfig fromEnvironment(Function<String, String> env) {
        Builder builder = newBuilder();
        EnvReader reader = new EnvReader(env);

        reader.string(APP_NAME, builder::appName);
        reader.string(APP_VERSION, builder::appVersion);
        reader.string(GRPC_PORT, value -> builder.grpcPort(parsePort(GRPC_PORT, value)));

        reader.bool(RATE_LIMIT_ENABLED, builder::rateLimitEnabled);
        reader.integer(RATE_LIMIT_REQUESTS_PER_SEC, builder::rateLimitRequestsPerSecond);
        reader.integer(RATE_LIMIT_BURST_SIZE, builder::rateLimitBurstSize);
        reader.string(RATE_LIMIT_STRATEGY, value -> builder.rateLimitStrategy(RateLimitStrategy.fromName(value)));
        reader.integer(RATE_LIMIT_MAX_KEYS, builder::rateLimitMaxKeys);

        reader.seconds(GRPC_MAX_CONNECTION_IDLE, builder::maxConnectionIdle);
        reader.seconds(GRPC_MAX_CONNECTION_AGE, builder::maxConnectionAge);
        reader.seconds(GRPC_MAX_CONNECTION_AGE_GRACE, builder::maxConnectionAgeGrace);
        reader.seconds(GRPC_KEEPALIVE_TIME, builder::keepAliveTime);
        reader.seconds(GRPC_KEEPALIVE_TIMEOUT, builder::keepAliveTimeout);
        reader.seconds(GRPC_KEEPALIVE_MIN_TIME, builder::permitKeepAliveTime);
        reader.bool(GRPC_PERMIT_WITHOUT_STREAM, builder::permitKeepAliveWithoutCalls);
        reader.integer(GRPC_MAX_RECV_MSG_SIZE, builder::maxInboundMessageSize);
        reader.integer(GRPC_MAX_CONCURRENT_STREAMS, builder::maxConcurrentCallsPerConnection);

        return builder.build();
    }

    // Accepts both "50051" and the ":50051" listen address form
    private static int parsePort(String name, String value) {
        String port = value.startsWith(":") ? value.substring(1) : value;
        return EnvReader.parseInt(name, port);
    }

    private final String appName;
    private final String appVersion;
    private final int grpcPort;
    private final boolean rateLimitEnabled;
    private final int rateLimitRequestsPerSecond;
    private final int rateLimitBurstSize;
    private final RateLimitStrategy rateLimitStrategy;
    private final int rateLimitMaxKeys;
    private final Duration maxConnectionIdle;
    private final Duration maxConnectionAge;
    private final Duration maxConnectionAgeGrace;
    private final Duration keepAliveTime;
    private final Duration keepAliveTimeout;
    private final Duration permitKeepAliveTime;
    private final boolean permitKeepAliveWithoutCalls;
    private final int maxInboundMessageSize;
    private final int maxConcurrentCallsPerConnection;

    private ServerConfig(Builder builder) {
        this.appName = builder.appName;
        this.appVersion = builder.appVersion;
        this.grpcPort = builder.grpcPort;
        this.rateLimitEnabled = builder.rateLimitEnabled;
        this.rateLimitRequestsPerSecond = builder.rateLimitRequestsPerSecond;
        this.rateLimitBurstSize = builder.rateLimitBurstSize;
        this.rateLimitStrategy = builder.rateLimitStrategy;
        this.rateLimitMaxKeys = builder.rateLimitMaxKeys;
        this.maxConnectionIdle = builder.maxConnectionIdle;
        this.maxConnectionAge = builder.maxConnectionAge;
        this.maxConnectionAgeGrace = builder.maxConnectionAgeGrace;
        this.keepAliveTime = builder.keepAliveTime;
        this.keepAliveTimeout = builder.keepAliveTimeout;
        this.permitKeepAliveTime = builder.permitKeepAliveTime;
        this.permitKeepAliveWithoutCalls = builder.permitKeepAliveWithoutCalls;
        this.maxInboundMessageSize = builder.maxInboundMessageSize;
        this.maxConcurrentCallsPerConnection = builder.maxConcurrentCallsPerConnection;
    }

    public String getAppName() {
        return appName;
    }

    public String getAppVersion() {
        return appVersion;
    }

    public int getGrpcPort() {
        return grpcPort;
    }

    public boolean isRateLimitEnabled() {
        return rateLimitEnabled;
    }

    public int getRateLimitRequestsPerSecond() {
        return rateLimitRequestsPerSecond;
    }

    public int getRateLimitBurstSize() {
        return rateLimitBurstSize;
    }

    public RateLimitStrategy getRateLimitStrategy() {
        return rateLimitStrategy;
    }

    public int getRateLimitMaxKeys() {
        return rateLimitMaxKeys;
    }

    public Duration getMaxConnectionIdle() {
        return maxConnectionIdle;
    }

    public Duration getMaxConnectionAge() {
        return maxConnectionAge;
    }

    public Duration getMaxConnectionAgeGrace() {
        return maxConnectionAgeGrace;
    }

    public Duration getKeepAliveTime() {
        return keepAliveTime;
    }

    public Duration getKeepAliveTimeout() {
        return keepAliveTimeout;
    }

    public Duration getPermitKeepAliveTime() {
        return permitKeepAliveTime;
    }

    public boolean isPermitKeepAliveWithoutCalls() {
        return permitKeepAliveWithoutCalls;
    }

    public int getMaxInboundMessageSize() {
        return maxInboundMessageSize;
    }

    public int getMaxConcurrentCallsPerConnection() {
        return maxConcurrentCallsPerConnection;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("appName", appName)
                .add("appVersion", appVersion)
                .add("grpcPort", grpcPort)
                .add("rateLimitEnabled", rateLimitEnabled)
                .add("rateLimitRequestsPerSecond", rateLimitRequestsPerSecond)
                .add("rateLimitBurstSize", rateLimitBurstSize)
                .add("rateLimitStrategy", rateLimitStrategy.getConfigName())
                .add("rateLimitMaxKeys", rateLimitMaxKeys)
                .toString();
    }

    private static final class EnvReader {
        private final Function<String, String> env;

        EnvReader(Function<String, String> env) {
            this.env = env;
        }

        void string(String name, Consumer<String> setter) {
            String value = env.apply(name);
            if (!Strings.isNullOrEmpty(value)) {
                setter.accept(value.trim());
            }
        }

        void integer(String name, IntConsumer setter) {
            string(name, value -> setter.accept(parseInt(name, value)));
        }

        void seconds(String name, Consumer<Duration> setter) {
            string(name, value -> setter.accept(Duration.ofSeconds(parseInt(name, value))));
        }

        void bool(String name, Consumer<Boolean> setter) {
            string(name, value -> setter.accept(parseBoolean(name, value)));
        }

        static int parseInt(String name, String value) {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid integer for " + name + ": '" + value + "'", e);
            }
        }

        static boolean parseBoolean(String name, String value) {
            switch (value.toLowerCase(Locale.ROOT)) {
                case "1":
                case "t":
                case "true":
                    return true;
                case "0":
                case "f":
                case "false":
                    return false;
                default:
                    throw new IllegalArgumentException("Invalid boolean for " + name + ": '" + value + "'");
            }
        }
    }
}
