package io.ratelimits.grpc.server;

import io.grpc.Metadata;
import io.grpc.ServerCall;

public interface GrpcServerRequestContext {
    ServerCall<?, ?> getCall();
    Metadata getHeaders();

    default String getFullMethodName() {
        return getCall().getMethodDescriptor().getFullMethodName();
    }
}
