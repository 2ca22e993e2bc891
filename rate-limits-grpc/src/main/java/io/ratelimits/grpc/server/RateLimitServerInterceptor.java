/**
 * Copyright 2018 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.ratelimits.grpc.server;

import com.google.common.base.Preconditions;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCall.Listener;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.ratelimits.LimiterRegistry;
import io.ratelimits.MetricIds;
import io.ratelimits.MetricRegistry;
import io.ratelimits.RateLimitConfig;
import io.ratelimits.grpc.error.CodeException;
import io.ratelimits.grpc.error.ErrorCode;
import io.ratelimits.internal.EmptyMetricRegistry;
import io.ratelimits.registry.LimiterRegistries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LoggingEventBuilder;

import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * {@link ServerInterceptor} that enforces a token bucket rate limit per key and fails the call with
 * RESOURCE_EXHAUSTED when the bucket for the call's key is empty.  Rejected calls never reach the next
 * stage.  Admitted calls are forwarded untouched.
 */
public class RateLimitServerInterceptor implements ServerInterceptor {
    private static final Logger LOG = LoggerFactory.getLogger(RateLimitServerInterceptor.class);

    static final String LIMIT_EXCEEDED_MESSAGE = "Rate limit exceeded. Maximum %d requests per second allowed.";

    private final RateLimitConfig<GrpcServerRequestContext> config;

    private final LimiterRegistry limiters;

    private final MetricRegistry registry;

    private final Supplier<Metadata> trailerSupplier;

    public static class Builder {
        private final RateLimitConfig<GrpcServerRequestContext> config;
        private LimiterRegistry limiters;
        private MetricRegistry registry = EmptyMetricRegistry.INSTANCE;
        private LongSupplier clock = System::nanoTime;
        private Supplier<Metadata> trailerSupplier = Metadata::new;

        public Builder(RateLimitConfig<GrpcServerRequestContext> config) {
            this.config = Preconditions.checkNotNull(config, "config may not be null");
        }

        /**
         * Registry holding the limiter for each key.  By default one is created from the config using the
         * builder's clock and metric registry.  Supplying one lets several interceptors share budgets.
         *
         * @param limiters
         * @return Chainable builder
         */
        public Builder limiterRegistry(LimiterRegistry limiters) {
            this.limiters = limiters;
            return this;
        }

        public Builder metricRegistry(MetricRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Monotonic clock used by limiters created by this builder.  Ignored when a limiter registry is
         * supplied.
         *
         * @param clock
         * @return Chainable builder
         */
        public Builder nanoClock(LongSupplier clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Supplier for additional Metadata to return when the rate limit has been reached.  The error code
         * trailers are always added.
         *
         * @param supplier
         * @return Chainable builder
         */
        public Builder trailerSupplier(Supplier<Metadata> supplier) {
            this.trailerSupplier = supplier;
            return this;
        }

        public RateLimitServerInterceptor build() {
            return new RateLimitServerInterceptor(this);
        }
    }

    public static Builder newBuilder(RateLimitConfig<GrpcServerRequestContext> config) {
        return new Builder(config);
    }

    private RateLimitServerInterceptor(Builder builder) {
        this.config = builder.config;
        this.registry = builder.registry;
        this.limiters = builder.limiters != null
                ? builder.limiters
                : LimiterRegistries.forConfig(builder.config, builder.clock, builder.registry);
        this.trailerSupplier = builder.trailerSupplier;
    }

    @Override
    public <ReqT, RespT> Listener<ReqT> interceptCall(final ServerCall<ReqT, RespT> call,
                                                      final Metadata headers,
                                                      final ServerCallHandler<ReqT, RespT> next) {
        final String key = config.resolveKey(new GrpcServerRequestContext() {
            @Override
            public ServerCall<?, ?> getCall() {
                return call;
            }

            @Override
            public Metadata getHeaders() {
                return headers;
            }
        });

        if (limiters.getOrCreate(key).tryAcquire()) {
            return next.startCall(call, headers);
        }

        final String method = call.getMethodDescriptor().getFullMethodName();
        LoggingEventBuilder event = LOG.atWarn()
                .addKeyValue("method", method)
                .addKeyValue("rate_limit_key", key)
                .addKeyValue("requests_per_second", config.getRequestsPerSecond())
                .addKeyValue("burst_size", config.getBurstSize());
        String requestId = RequestIdServerInterceptor.currentRequestId();
        if (requestId != null) {
            event = event.addKeyValue("request_id", requestId);
        }
        event.log("Rate limit exceeded");

        registry.counter(MetricIds.RATE_LIMIT_EXCEEDED_NAME,
                MetricIds.METHOD_TAG, method,
                MetricIds.KEY_TAG, key).increment();

        CodeException error = ErrorCode.RESOURCE_EXHAUSTED.withMessage(LIMIT_EXCEEDED_MESSAGE, config.getRequestsPerSecond());
        Metadata trailers = trailerSupplier.get();
        trailers.merge(error.toTrailers());
        call.close(error.toStatus(), trailers);
        return new ServerCall.Listener<ReqT>() {};
    }

    public RateLimitConfig<GrpcServerRequestContext> getConfig() {
        return config;
    }

    public LimiterRegistry getLimiterRegistry() {
        return limiters;
    }
}
