package io.ratelimits.grpc.server;

import io.ratelimits.KeyResolver;
import io.ratelimits.grpc.config.ServerConfig;
import io.ratelimits.internal.EmptyMetricRegistry;
import io.ratelimits.registry.BoundedLimiterRegistry;
import io.ratelimits.registry.DefaultLimiterRegistry;
import org.junit.Assert;
import org.junit.Test;
import org.mockito.Mockito;

import java.util.Optional;

public class RateLimitInterceptorsTest {
    private static GrpcServerRequestContext contextFor(String fullMethodName) {
        GrpcServerRequestContext context = Mockito.mock(GrpcServerRequestContext.class);
        Mockito.when(context.getFullMethodName()).thenReturn(fullMethodName);
        return context;
    }

    @Test
    public void disabledInstallsNothing() {
        Optional<RateLimitServerInterceptor> interceptor = RateLimitInterceptors.fromConfig(
                ServerConfig.newBuilder().rateLimitEnabled(false).build(), EmptyMetricRegistry.INSTANCE);

        Assert.assertFalse(interceptor.isPresent());
    }

    @Test
    public void enabledUsesConfiguredValues() {
        RateLimitServerInterceptor interceptor = RateLimitInterceptors.fromConfig(ServerConfig.newBuilder()
                        .rateLimitRequestsPerSecond(7)
                        .rateLimitBurstSize(9)
                        .build(), EmptyMetricRegistry.INSTANCE)
                .get();

        Assert.assertEquals(7, interceptor.getConfig().getRequestsPerSecond());
        Assert.assertEquals(9, interceptor.getConfig().getBurstSize());
        Assert.assertEquals(KeyResolver.GLOBAL_KEY, interceptor.getConfig().resolveKey(contextFor("a/b")));
        Assert.assertTrue(interceptor.getLimiterRegistry() instanceof DefaultLimiterRegistry);
    }

    @Test
    public void perMethodStrategyKeysByMethod() {
        RateLimitServerInterceptor interceptor = RateLimitInterceptors.fromConfig(ServerConfig.newBuilder()
                        .rateLimitStrategy(RateLimitStrategy.PER_METHOD)
                        .build(), EmptyMetricRegistry.INSTANCE)
                .get();

        Assert.assertEquals("hello.HelloService/GetHello",
                interceptor.getConfig().resolveKey(contextFor("hello.HelloService/GetHello")));
    }

    @Test
    public void maxKeysSelectsBoundedRegistry() {
        RateLimitServerInterceptor interceptor = RateLimitInterceptors.fromConfig(ServerConfig.newBuilder()
                        .rateLimitMaxKeys(16)
                        .build(), EmptyMetricRegistry.INSTANCE)
                .get();

        Assert.assertTrue(interceptor.getLimiterRegistry() instanceof BoundedLimiterRegistry);
        Assert.assertEquals(16, ((BoundedLimiterRegistry) interceptor.getLimiterRegistry()).getMaxKeys());
    }

    @Test
    public void nonPositiveValuesFallBackToDefaults() {
        RateLimitServerInterceptor interceptor = RateLimitInterceptors.fromConfig(ServerConfig.newBuilder()
                        .rateLimitRequestsPerSecond(0)
                        .rateLimitBurstSize(-1)
                        .build(), EmptyMetricRegistry.INSTANCE)
                .get();

        Assert.assertEquals(100, interceptor.getConfig().getRequestsPerSecond());
        Assert.assertEquals(200, interceptor.getConfig().getBurstSize());
    }

    @Test
    public void helperFactories() {
        RateLimitServerInterceptor global = RateLimitInterceptors.global(5, 10);
        Assert.assertEquals(5, global.getConfig().getRequestsPerSecond());
        Assert.assertEquals(10, global.getConfig().getBurstSize());
        Assert.assertEquals(KeyResolver.GLOBAL_KEY, global.getConfig().resolveKey(contextFor("a/b")));

        RateLimitServerInterceptor perMethod = RateLimitInterceptors.perMethod(5, 10);
        Assert.assertEquals("a/b", perMethod.getConfig().resolveKey(contextFor("a/b")));
    }

    @Test
    public void strategyNames() {
        Assert.assertEquals(RateLimitStrategy.PER_METHOD, RateLimitStrategy.fromName("per-method"));
        Assert.assertEquals(RateLimitStrategy.PER_METHOD, RateLimitStrategy.fromName("PER-METHOD"));
        Assert.assertEquals(RateLimitStrategy.GLOBAL, RateLimitStrategy.fromName("global"));
        Assert.assertEquals(RateLimitStrategy.GLOBAL, RateLimitStrategy.fromName("per-tenant"));
        Assert.assertEquals(RateLimitStrategy.GLOBAL, RateLimitStrategy.fromName(null));
    }
}
