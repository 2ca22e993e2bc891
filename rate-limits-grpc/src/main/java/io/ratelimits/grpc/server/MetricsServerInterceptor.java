package io.ratelimits.grpc.server;

import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCall.Listener;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.ratelimits.MetricIds;
import io.ratelimits.MetricRegistry;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * {@link ServerInterceptor} recording a call count and latency distribution per method and status code, and a
 * gauge of calls in flight.
 */
public class MetricsServerInterceptor implements ServerInterceptor {
    private final MetricRegistry registry;
    private final LongSupplier clock;
    private final AtomicInteger active = new AtomicInteger();

    public MetricsServerInterceptor(MetricRegistry registry) {
        this(registry, System::nanoTime);
    }

    public MetricsServerInterceptor(MetricRegistry registry, LongSupplier clock) {
        this.registry = registry;
        this.clock = clock;
        registry.gauge(MetricIds.ACTIVE_NAME, this::getActive);
    }

    public int getActive() {
        return active.get();
    }

    @Override
    public <ReqT, RespT> Listener<ReqT> interceptCall(final ServerCall<ReqT, RespT> call,
                                                      final Metadata headers,
                                                      final ServerCallHandler<ReqT, RespT> next) {
        final String method = call.getMethodDescriptor().getFullMethodName();
        final long startTime = clock.getAsLong();
        final AtomicBoolean done = new AtomicBoolean(false);
        active.incrementAndGet();

        ServerCall<ReqT, RespT> measured = new ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT>(call) {
            @Override
            public void close(Status status, Metadata trailers) {
                try {
                    super.close(status, trailers);
                } finally {
                    if (done.compareAndSet(false, true)) {
                        active.decrementAndGet();
                        record(method, status.getCode(), clock.getAsLong() - startTime);
                    }
                }
            }
        };

        final Listener<ReqT> delegate;
        try {
            delegate = next.startCall(measured, headers);
        } catch (RuntimeException e) {
            if (done.compareAndSet(false, true)) {
                active.decrementAndGet();
            }
            throw e;
        }

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT>(delegate) {
            @Override
            public void onCancel() {
                try {
                    super.onCancel();
                } finally {
                    if (done.compareAndSet(false, true)) {
                        active.decrementAndGet();
                        record(method, Status.Code.CANCELLED, clock.getAsLong() - startTime);
                    }
                }
            }
        };
    }

    private void record(String method, Status.Code code, long latencyNanos) {
        String statusCode = Integer.toString(code.value());
        registry.counter(MetricIds.REQUESTS_NAME,
                MetricIds.METHOD_TAG, method,
                MetricIds.STATUS_CODE_TAG, statusCode).increment();
        registry.distribution(MetricIds.REQUEST_LATENCY_NAME,
                MetricIds.METHOD_TAG, method,
                MetricIds.STATUS_CODE_TAG, statusCode).addLongSample(latencyNanos);
    }
}
