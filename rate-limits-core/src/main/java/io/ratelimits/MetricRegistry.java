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

import java.util.function.Supplier;

/**
 * Metrics sink used by the limiter registries and server interceptors.  Every method has a no-op default, so an
 * adapter only implements the meter types its backend supports.  See {@link MetricIds} for the names in use.
 */
public interface MetricRegistry {
    /**
     * Receives samples for a distribution, i.e. request latency in nanoseconds.
     */
    interface SampleListener {
        void addSample(Number value);

        default void addLongSample(long value) {
            addSample(value);
        }

        default void addDoubleSample(double value) {
            addSample(value);
        }
    }

    /**
     * Monotonic event count, i.e. rejected or evicted keys.
     */
    interface Counter {
        void increment();
    }

    /**
     * Look up or create a distribution.
     *
     * @param id Metric name relative to the adapter's prefix
     * @param tagNameValuePairs Pairs of tag name and tag value.  Number of parameters must be a multiple of 2.
     * @return SampleListener for the caller to add samples
     */
    default SampleListener distribution(String id, String... tagNameValuePairs) {
        return value -> {};
    }

    /**
     * Register a gauge polled from the supplier whenever the backend reports.  Registering the same id and
     * tags again replaces the supplier.
     *
     * @param id Metric name relative to the adapter's prefix
     * @param supplier Current value
     * @param tagNameValuePairs Pairs of tag name and tag value.  Number of parameters must be a multiple of 2.
     */
    default void gauge(String id, Supplier<Number> supplier, String... tagNameValuePairs) {
    }

    /**
     * Look up or create a counter.  Repeated calls with the same id and tags must be backed by the same meter
     * since interceptors resolve counters per call.
     *
     * @param id Metric name relative to the adapter's prefix
     * @param tagNameValuePairs Pairs of tag name and tag value.  Number of parameters must be a multiple of 2.
     */
    default Counter counter(String id, String... tagNameValuePairs) {
        return () -> {};
    }
}
