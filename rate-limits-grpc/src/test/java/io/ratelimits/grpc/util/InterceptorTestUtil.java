package io.ratelimits.grpc.util;

import io.grpc.MethodDescriptor;
import io.grpc.ServerServiceDefinition;
import io.grpc.stub.ServerCalls;
import io.ratelimits.grpc.StringMarshaller;
import org.junit.Assert;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

public class InterceptorTestUtil {

    public static final MethodDescriptor<String, String> METHOD_DESCRIPTOR = unary("service/method");

    public static final MethodDescriptor<String, String> OTHER_METHOD_DESCRIPTOR = unary("service/other");

    public static final String TEST_METRIC_NAME = "unit.test";

    public static MethodDescriptor<String, String> unary(String fullMethodName) {
        return MethodDescriptor.<String, String>newBuilder()
                .setType(MethodDescriptor.MethodType.UNARY)
                .setFullMethodName(fullMethodName)
                .setRequestMarshaller(StringMarshaller.INSTANCE)
                .setResponseMarshaller(StringMarshaller.INSTANCE)
                .build();
    }

    /**
     * Service exposing {@link #METHOD_DESCRIPTOR} and {@link #OTHER_METHOD_DESCRIPTOR}, both backed by the
     * same handler.
     */
    public static ServerServiceDefinition service(ServerCalls.UnaryMethod<String, String> method) {
        return ServerServiceDefinition.builder("service")
                .addMethod(METHOD_DESCRIPTOR, ServerCalls.asyncUnaryCall(method))
                .addMethod(OTHER_METHOD_DESCRIPTOR, ServerCalls.asyncUnaryCall(method))
                .build();
    }

    public static ServerCalls.UnaryMethod<String, String> echo() {
        return (req, observer) -> {
            observer.onNext(req);
            observer.onCompleted();
        };
    }

    /**
     * Server side bookkeeping may finish after the client has seen the status, so poll for a while.
     */
    public static void assertEventually(long expected, LongSupplier actual) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (actual.getAsLong() != expected && System.nanoTime() < deadline) {
            try {
                TimeUnit.MILLISECONDS.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        Assert.assertEquals(expected, actual.getAsLong());
    }
}
