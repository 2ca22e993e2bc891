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
package io.ratelimits;

import io.ratelimits.internal.Preconditions;

/**
 * Immutable rate limit settings shared by every {@link Limiter} created for a registry: the sustained
 * requests per second, the burst size and the policy used to derive a key from a request.
 * <p>
 * Non-positive values are replaced by defaults when the config is built: requests per second defaults to
 * {@value #DEFAULT_REQUESTS_PER_SECOND} and the burst size to twice the requests per second.
 *
 * @param <ContextT> Request context handed to the {@link KeyResolver}
 */
public final class RateLimitConfig<ContextT> {
    public static final int DEFAULT_REQUESTS_PER_SECOND = 100;

    public abstract static class Builder<BuilderT extends Builder<BuilderT, ContextT>, ContextT> {
        private int requestsPerSecond = DEFAULT_REQUESTS_PER_SECOND;
        private int burstSize = 0;
        private int maxKeys = 0;
        private KeyResolver<ContextT> keyResolver = KeyResolver.global();

        /**
         * Sustained number of requests admitted per second for each key.
         * @param requestsPerSecond
         * @return Chainable builder
         */
        public BuilderT requestsPerSecond(int requestsPerSecond) {
            this.requestsPerSecond = requestsPerSecond;
            return self();
        }

        /**
         * Maximum number of requests that may be admitted back to back after a key has been idle.
         * @param burstSize
         * @return Chainable builder
         */
        public BuilderT burstSize(int burstSize) {
            this.burstSize = burstSize;
            return self();
        }

        /**
         * Cap on the number of keys tracked at once.  Least recently used keys are forgotten once the cap is
         * exceeded.  Zero or less (the default) tracks every key for the lifetime of the registry.
         * @param maxKeys
         * @return Chainable builder
         */
        public BuilderT maxKeys(int maxKeys) {
            this.maxKeys = maxKeys;
            return self();
        }

        public BuilderT keyResolver(KeyResolver<ContextT> keyResolver) {
            Preconditions.checkNotNull(keyResolver, "keyResolver may not be null");
            this.keyResolver = keyResolver;
            return self();
        }

        protected abstract BuilderT self();

        public RateLimitConfig<ContextT> build() {
            return new RateLimitConfig<>(this);
        }
    }

    public static final class SimpleBuilder<ContextT> extends Builder<SimpleBuilder<ContextT>, ContextT> {
        @Override
        protected SimpleBuilder<ContextT> self() {
            return this;
        }
    }

    public static <ContextT> SimpleBuilder<ContextT> newBuilder() {
        return new SimpleBuilder<>();
    }

    private final int requestsPerSecond;
    private final int burstSize;
    private final int maxKeys;
    private final KeyResolver<ContextT> keyResolver;

    private RateLimitConfig(Builder<?, ContextT> builder) {
        this.requestsPerSecond = builder.requestsPerSecond > 0 ? builder.requestsPerSecond : DEFAULT_REQUESTS_PER_SECOND;
        this.burstSize = builder.burstSize > 0 ? builder.burstSize
                : (int) Math.min(Integer.MAX_VALUE, 2L * this.requestsPerSecond);
        this.maxKeys = Math.max(0, builder.maxKeys);
        this.keyResolver = builder.keyResolver;
    }

    public int getRequestsPerSecond() {
        return requestsPerSecond;
    }

    public int getBurstSize() {
        return burstSize;
    }

    public int getMaxKeys() {
        return maxKeys;
    }

    public KeyResolver<ContextT> getKeyResolver() {
        return keyResolver;
    }

    /**
     * Resolve the rate limit key for a request, falling back to {@link KeyResolver#UNKNOWN_KEY}.
     */
    public String resolveKey(ContextT context) {
        String key = keyResolver.resolve(context);
        return key != null ? key : KeyResolver.UNKNOWN_KEY;
    }

    @Override
    public String toString() {
        return "RateLimitConfig [requestsPerSecond=" + requestsPerSecond
                + ", burstSize=" + burstSize
                + ", maxKeys=" + maxKeys + "]";
    }
}
