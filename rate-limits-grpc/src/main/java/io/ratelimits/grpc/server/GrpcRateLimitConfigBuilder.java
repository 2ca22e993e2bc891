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

import io.grpc.Attributes;
import io.grpc.Metadata;
import io.ratelimits.KeyResolver;
import io.ratelimits.RateLimitConfig;

/**
 * {@link RateLimitConfig} builder with key policies that understand gRPC calls.
 */
public class GrpcRateLimitConfigBuilder extends RateLimitConfig.Builder<GrpcRateLimitConfigBuilder, GrpcServerRequestContext> {
    /**
     * All calls share a single budget.  This is the default.
     * @return Chainable builder
     */
    public GrpcRateLimitConfigBuilder keyGlobal() {
        return keyResolver(KeyResolver.global());
    }

    /**
     * Each fully qualified method, i.e. {@code hello.HelloService/GetHello}, gets its own budget.
     * @return Chainable builder
     */
    public GrpcRateLimitConfigBuilder keyByMethod() {
        return keyResolver(GrpcServerRequestContext::getFullMethodName);
    }

    /**
     * Key the limit by a request header, i.e. a client or tenant id.  Calls without the header share the
     * {@link KeyResolver#UNKNOWN_KEY} budget.
     * @return Chainable builder
     */
    public GrpcRateLimitConfigBuilder keyByHeader(Metadata.Key<String> header) {
        return keyResolver(context -> context.getHeaders().get(header));
    }

    /**
     * Key the limit by a transport attribute, i.e. {@link io.grpc.Grpc#TRANSPORT_ATTR_REMOTE_ADDR} for a per
     * client address budget.  Calls without the attribute share the {@link KeyResolver#UNKNOWN_KEY} budget.
     * @return Chainable builder
     */
    public GrpcRateLimitConfigBuilder keyByAttribute(Attributes.Key<?> attribute) {
        return keyResolver(context -> {
            Object value = context.getCall().getAttributes().get(attribute);
            return value != null ? value.toString() : null;
        });
    }

    /**
     * Apply one of the named built-in key policies.
     * @return Chainable builder
     */
    public GrpcRateLimitConfigBuilder strategy(RateLimitStrategy strategy) {
        switch (strategy) {
            case PER_METHOD:
                return keyByMethod();
            case GLOBAL:
            default:
                return keyGlobal();
        }
    }

    @Override
    protected GrpcRateLimitConfigBuilder self() {
        return this;
    }
}
