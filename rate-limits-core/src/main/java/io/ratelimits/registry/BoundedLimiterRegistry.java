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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * {@link LimiterRegistry} holding at most {@code maxKeys} limiters.  When a new key pushes the registry over
 * its cap the least recently used key is forgotten; if that key shows up again it starts over with a full
 * bucket.
 * <p>
 * Every lookup reorders the underlying map, so unlike {@link DefaultLimiterRegistry} all access goes through
 * a single exclusive lock.
 */
public class BoundedLimiterRegistry implements LimiterRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(BoundedLimiterRegistry.class);

    private final int maxKeys;
    private final Function<String, Limiter> limiterFactory;
    private final MetricRegistry.Counter evictedCounter;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, Limiter> limiters;

    public BoundedLimiterRegistry(int maxKeys, Function<String, Limiter> limiterFactory) {
        this(maxKeys, limiterFactory, EmptyMetricRegistry.INSTANCE);
    }

    public BoundedLimiterRegistry(int maxKeys, Function<String, Limiter> limiterFactory, MetricRegistry registry) {
        Preconditions.checkArgument(maxKeys > 0, "maxKeys must be > 0 but was %d", maxKeys);
        this.maxKeys = maxKeys;
        this.limiterFactory = Preconditions.checkNotNull(limiterFactory, "limiterFactory may not be null");
        this.evictedCounter = registry.counter(MetricIds.RATE_LIMIT_EVICTED_NAME);
        this.limiters = new LinkedHashMap<String, Limiter>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Limiter> eldest) {
                if (size() > BoundedLimiterRegistry.this.maxKeys) {
                    LOG.debug("Evicting limiter for key '{}'", eldest.getKey());
                    evictedCounter.increment();
                    return true;
                }
                return false;
            }
        };
        registry.gauge(MetricIds.RATE_LIMIT_KEYS_NAME, this::size);
    }

    @Override
    public Limiter getOrCreate(String key) {
        lock.lock();
        try {
            Limiter limiter = limiters.get(key);
            if (limiter == null) {
                limiter = Preconditions.checkNotNull(limiterFactory.apply(key), "limiterFactory returned null for " + key);
                limiters.put(key, limiter);
            }
            return limiter;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return limiters.size();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxKeys() {
        return maxKeys;
    }
}
