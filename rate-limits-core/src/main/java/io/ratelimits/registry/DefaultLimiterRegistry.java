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
package io.ratelimits.registry;

import io.ratelimits.Limiter;
import io.ratelimits.LimiterRegistry;
import io.ratelimits.MetricIds;
import io.ratelimits.MetricRegistry;
import io.ratelimits.internal.EmptyMetricRegistry;
import io.ratelimits.internal.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * {@link LimiterRegistry} that creates a limiter the first time a key is seen and keeps it for the lifetime
 * of the registry.  Lookups of existing keys only take the shared read lock.  A miss upgrades to the write
 * lock and checks again before constructing, so concurrent first use of a key yields a single limiter.
 * <p>
 * Entries are never removed.  With a high cardinality key policy (i.e. per client address) prefer
 * {@link BoundedLimiterRegistry}.
 */
public class DefaultLimiterRegistry implements LimiterRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(DefaultLimiterRegistry.class);

    private final Map<String, Limiter> limiters = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Function<String, Limiter> limiterFactory;

    public DefaultLimiterRegistry(Function<String, Limiter> limiterFactory) {
        this(limiterFactory, EmptyMetricRegistry.INSTANCE);
    }

    public DefaultLimiterRegistry(Function<String, Limiter> limiterFactory, MetricRegistry registry) {
        this.limiterFactory = Preconditions.checkNotNull(limiterFactory, "limiterFactory may not be null");
        registry.gauge(MetricIds.RATE_LIMIT_KEYS_NAME, this::size);
    }

    @Override
    public Limiter getOrCreate(String key) {
        lock.readLock().lock();
        try {
            Limiter limiter = limiters.get(key);
            if (limiter != null) {
                return limiter;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            Limiter limiter = limiters.get(key);
            if (limiter == null) {
                limiter = Preconditions.checkNotNull(limiterFactory.apply(key), "limiterFactory returned null for " + key);
                limiters.put(key, limiter);
                LOG.debug("Created limiter for key '{}': {}", key, limiter);
            }
            return limiter;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return limiters.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
