package io.ratelimits.spectator;

import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.patterns.PolledMeter;
import io.ratelimits.MetricIds;
import io.ratelimits.MetricRegistry;
import org.junit.Assert;
import org.junit.Test;

import java.util.concurrent.atomic.AtomicInteger;

public class SpectatorMetricRegistryTest {
    private final DefaultRegistry registry = new DefaultRegistry();
    private final SpectatorMetricRegistry metricRegistry = new SpectatorMetricRegistry(registry, registry.createId("test"));

    @Test
    public void counterIsTaggedAndShared() {
        metricRegistry.counter(MetricIds.RATE_LIMIT_EXCEEDED_NAME, "method", "svc/m", "key", "global").increment();
        metricRegistry.counter(MetricIds.RATE_LIMIT_EXCEEDED_NAME, "method", "svc/m", "key", "global").increment();
        metricRegistry.counter(MetricIds.RATE_LIMIT_EXCEEDED_NAME, "method", "svc/other", "key", "global").increment();

        Assert.assertEquals(2, registry.counter("test.rate_limit.exceeded", "method", "svc/m", "key", "global").count());
        Assert.assertEquals(1, registry.counter("test.rate_limit.exceeded", "method", "svc/other", "key", "global").count());
    }

    @Test
    public void distributionRecordsLongSamples() {
        MetricRegistry.SampleListener listener = metricRegistry.distribution(MetricIds.REQUEST_LATENCY_NAME, "method", "svc/m");
        listener.addLongSample(10);
        listener.addLongSample(32);

        Assert.assertEquals(2, registry.distributionSummary("test.grpc.request.latency", "method", "svc/m").count());
        Assert.assertEquals(42, registry.distributionSummary("test.grpc.request.latency", "method", "svc/m").totalAmount());
    }

    @Test
    public void gaugeIsPolled() {
        AtomicInteger value = new AtomicInteger(3);
        metricRegistry.gauge(MetricIds.ACTIVE_NAME, value::get);

        PolledMeter.update(registry);
        Assert.assertEquals(3.0, registry.gauge("test.grpc.active").value(), 0.0);
    }
}
