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
package io.ratelimits.limiter;

import io.ratelimits.Limiter;
import io.ratelimits.RateLimitConfig;
import io.ratelimits.internal.Preconditions;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * Token bucket {@link Limiter}.  Tokens accumulate continuously at {@code requestsPerSecond} up to
 * {@code burstSize} and every admitted request consumes exactly one.  The bucket starts full.
 * <p>
 * {@link #tryAcquire()} never waits.  Refill and consumption happen under a per instance lock so that
 * concurrent callers sharing a bucket cannot double spend a token.
 */
public class TokenBucketLimiter implements Limiter {
    private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    public static class Builder {
        private int requestsPerSecond = RateLimitConfig.DEFAULT_REQUESTS_PER_SECOND;
        private int burstSize = RateLimitConfig.DEFAULT_REQUESTS_PER_SECOND * 2;
        private LongSupplier clock = System::nanoTime;

        public Builder requestsPerSecond(int requestsPerSecond) {
            this.requestsPerSecond = requestsPerSecond;
            return this;
        }

        public Builder burstSize(int burstSize) {
            this.burstSize = burstSize;
            return this;
        }

        /**
         * Monotonic clock in nanoseconds.  Defaults to {@link System#nanoTime()}.
         */
        public Builder nanoClock(LongSupplier clock) {
            this.clock = clock;
            return this;
        }

        public TokenBucketLimiter build() {
            return new TokenBucketLimiter(this);
        }
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Factory creating one full bucket per key with the rate and burst of the provided config.
     */
    public static Function<String, Limiter> factory(RateLimitConfig<?> config, LongSupplier nanoClock) {
        return key -> newBuilder()
                .requestsPerSecond(config.getRequestsPerSecond())
                .burstSize(config.getBurstSize())
                .nanoClock(nanoClock)
                .build();
    }

    private final int requestsPerSecond;
    private final int burstSize;
    private final LongSupplier clock;
    private final ReentrantLock lock = new ReentrantLock();

    private double tokens;
    private long lastRefillNanos;

    protected TokenBucketLimiter(Builder builder) {
        Preconditions.checkArgument(builder.requestsPerSecond > 0, "requestsPerSecond must be > 0 but was %d", builder.requestsPerSecond);
        Preconditions.checkArgument(builder.burstSize > 0, "burstSize must be > 0 but was %d", builder.burstSize);
        Preconditions.checkNotNull(builder.clock, "clock may not be null");

        this.requestsPerSecond = builder.requestsPerSecond;
        this.burstSize = builder.burstSize;
        this.clock = builder.clock;
        this.tokens = burstSize;
        this.lastRefillNanos = clock.getAsLong();
    }

    @Override
    public boolean tryAcquire() {
        lock.lock();
        try {
            refill();
            if (tokens >= 1.0) {
                tokens -= 1.0;
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return Tokens available at this instant, including any fraction accumulated towards the next one
     */
    public double getAvailableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    // Caller must hold the lock
    private void refill() {
        final long now = clock.getAsLong();
        final long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }

        tokens = Math.min(burstSize, tokens + elapsed * (double) requestsPerSecond / NANOS_PER_SECOND);
        lastRefillNanos = now;
    }

    @Override
    public int getRequestsPerSecond() {
        return requestsPerSecond;
    }

    @Override
    public int getBurstSize() {
        return burstSize;
    }

    @Override
    public String toString() {
        return "TokenBucketLimiter [requestsPerSecond=" + requestsPerSecond + ", burstSize=" + burstSize + "]";
    }
}
