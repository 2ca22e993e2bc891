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

/**
 * Common metric ids
 */
public final class MetricIds {
    public static final String RATE_LIMIT_EXCEEDED_NAME = "rate_limit.exceeded";
    public static final String RATE_LIMIT_KEYS_NAME = "rate_limit.keys";
    public static final String RATE_LIMIT_EVICTED_NAME = "rate_limit.evicted";
    public static final String REQUESTS_NAME = "grpc.requests";
    public static final String REQUEST_LATENCY_NAME = "grpc.request.latency";
    public static final String ACTIVE_NAME = "grpc.active";

    public static final String METHOD_TAG = "method";
    public static final String KEY_TAG = "key";
    public static final String STATUS_CODE_TAG = "status_code";

    private MetricIds() {}
}
