package io.ratelimits.grpc.server;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import io.grpc.BindableService;
import io.grpc.ServerInterceptor;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;
import io.ratelimits.MetricRegistry;
import io.ratelimits.grpc.config.ServerConfig;

import java.util.List;
import java.util.Optional;

/**
 * Ordered chain of server interceptors, listed outermost first.  A call passes through the stages in the
 * order they were added before reaching the service, and its response passes back in reverse.
 * <p>
 * {@link ServerInterceptors#intercept(ServerServiceDefinition, List)} runs the <em>last</em> interceptor of its
 * list first, so the stages are handed to it reversed.
 */
public final class ServerInterceptorPipeline {
    public static class Builder {
        private final ImmutableList.Builder<ServerInterceptor> stages = ImmutableList.builder();

        public Builder add(ServerInterceptor interceptor) {
            stages.add(Preconditions.checkNotNull(interceptor, "interceptor may not be null"));
            return this;
        }

        /**
         * Add the stage if present.  Used for stages that may be switched off by configuration.
         */
        public Builder add(Optional<? extends ServerInterceptor> interceptor) {
            interceptor.ifPresent(this::add);
            return this;
        }

        public ServerInterceptorPipeline build() {
            return new ServerInterceptorPipeline(stages.build());
        }
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * The standard server chain: request id, metrics, rate limit (when enabled), logging and error conversion.
     * Rejected calls are therefore tagged and counted but never reach logging, error conversion or the handler.
     */
    public static ServerInterceptorPipeline defaults(ServerConfig config, MetricRegistry registry) {
        return newBuilder()
                .add(new RequestIdServerInterceptor())
                .add(new MetricsServerInterceptor(registry))
                .add(RateLimitInterceptors.fromConfig(config, registry))
                .add(new LoggingServerInterceptor())
                .add(new ErrorConversionServerInterceptor())
                .build();
    }

    private final List<ServerInterceptor> stages;

    private ServerInterceptorPipeline(List<ServerInterceptor> stages) {
        this.stages = stages;
    }

    /**
     * @return Stages, outermost first
     */
    public List<ServerInterceptor> getStages() {
        return stages;
    }

    public ServerServiceDefinition intercept(ServerServiceDefinition service) {
        return ServerInterceptors.intercept(service, Lists.reverse(stages));
    }

    public ServerServiceDefinition intercept(BindableService service) {
        return intercept(service.bindService());
    }
}
