package io.ratelimits.grpc.server;

import io.grpc.CallOptions;
import io.grpc.Metadata;
import io.grpc.ServerInterceptors;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.ClientCalls;
import io.grpc.stub.ServerCalls;
import io.ratelimits.grpc.error.CodeException;
import io.ratelimits.grpc.error.ErrorCode;
import io.ratelimits.grpc.util.InProcessServerRule;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;

import static io.ratelimits.grpc.util.InterceptorTestUtil.METHOD_DESCRIPTOR;
import static io.ratelimits.grpc.util.InterceptorTestUtil.service;

public class ErrorConversionServerInterceptorTest {
    @Rule
    public InProcessServerRule server = new InProcessServerRule();

    private StatusRuntimeException callExpectingFailure(ServerCalls.UnaryMethod<String, String> method) {
        server.start(ServerInterceptors.intercept(service(method), new ErrorConversionServerInterceptor()));
        try {
            ClientCalls.blockingUnaryCall(server.channel(), METHOD_DESCRIPTOR, CallOptions.DEFAULT, "request");
            Assert.fail("Should have failed");
            return null;
        } catch (StatusRuntimeException e) {
            return e;
        }
    }

    @Test
    public void thrownCodeExceptionBecomesMappedStatus() {
        StatusRuntimeException e = callExpectingFailure((req, observer) -> {
            throw ErrorCode.NOT_FOUND.withMessage("user %s not found", "42");
        });

        Assert.assertEquals(Status.Code.NOT_FOUND, e.getStatus().getCode());
        Assert.assertEquals("user 42 not found", e.getStatus().getDescription());
        Assert.assertEquals("ERR404P05", e.getTrailers().get(CodeException.ERROR_CODE_KEY));
        Assert.assertEquals("404", e.getTrailers().get(CodeException.HTTP_STATUS_KEY));
    }

    @Test
    public void codeExceptionPassedToObserverBecomesMappedStatus() {
        StatusRuntimeException e = callExpectingFailure((req, observer) ->
                observer.onError(ErrorCode.PERMISSION_DENIED.toException()));

        Assert.assertEquals(Status.Code.PERMISSION_DENIED, e.getStatus().getCode());
        Assert.assertEquals("permission denied", e.getStatus().getDescription());
        Assert.assertEquals("ERR403P07", e.getTrailers().get(CodeException.ERROR_CODE_KEY));
        Assert.assertEquals("403", e.getTrailers().get(CodeException.HTTP_STATUS_KEY));
    }

    @Test
    public void unexpectedExceptionBecomesInternal() {
        StatusRuntimeException e = callExpectingFailure((req, observer) -> {
            throw new IllegalStateException("boom");
        });

        Assert.assertEquals(Status.Code.INTERNAL, e.getStatus().getCode());
        Assert.assertEquals("boom", e.getStatus().getDescription());
        Assert.assertEquals("ERR500P00", e.getTrailers().get(CodeException.ERROR_CODE_KEY));
        Assert.assertEquals("500", e.getTrailers().get(CodeException.HTTP_STATUS_KEY));
    }

    @Test
    public void statusExceptionsPassThrough() {
        StatusRuntimeException e = callExpectingFailure((req, observer) ->
                observer.onError(Status.FAILED_PRECONDITION.withDescription("not ready").asRuntimeException()));

        Assert.assertEquals(Status.Code.FAILED_PRECONDITION, e.getStatus().getCode());
        Assert.assertEquals("not ready", e.getStatus().getDescription());
        Assert.assertNull(e.getTrailers().get(CodeException.ERROR_CODE_KEY));
    }

    @Test
    public void codeExceptionAsStatusRuntimeExceptionKeepsSingleTrailerValue() {
        StatusRuntimeException e = callExpectingFailure((req, observer) ->
                observer.onError(ErrorCode.UNAVAILABLE.toException().toStatusRuntimeException()));

        Assert.assertEquals(Status.Code.UNAVAILABLE, e.getStatus().getCode());
        int count = 0;
        for (String ignored : e.getTrailers().getAll(CodeException.ERROR_CODE_KEY)) {
            count++;
        }
        Assert.assertEquals(1, count);
        Assert.assertEquals("ERR503P14", e.getTrailers().get(CodeException.ERROR_CODE_KEY));
    }

    @Test
    public void exceptionAfterCloseDoesNotReplaceStatus() {
        StatusRuntimeException e = callExpectingFailure((req, observer) -> {
            observer.onError(ErrorCode.ABORTED.toException());
            throw new IllegalStateException("too late");
        });

        Assert.assertEquals(Status.Code.ABORTED, e.getStatus().getCode());
        Assert.assertEquals("ERR409P10", e.getTrailers().get(CodeException.ERROR_CODE_KEY));
    }

    @Test
    public void convertLeavesOkAndCauselessStatusesAlone() {
        Metadata trailers = new Metadata();
        Assert.assertSame(Status.OK, ErrorConversionServerInterceptor.convert(Status.OK, trailers));

        Status unknown = Status.UNKNOWN.withDescription("no cause");
        Assert.assertSame(unknown, ErrorConversionServerInterceptor.convert(unknown, trailers));
        Assert.assertFalse(trailers.containsKey(CodeException.ERROR_CODE_KEY));
    }

    @Test
    public void convertMapsExceptionWithoutMessageToClassName() {
        Metadata trailers = new Metadata();
        Status status = ErrorConversionServerInterceptor.convert(
                Status.UNKNOWN.withCause(new NullPointerException()), trailers);

        Assert.assertEquals(Status.Code.INTERNAL, status.getCode());
        Assert.assertEquals(NullPointerException.class.getName(), status.getDescription());
        Assert.assertEquals("ERR500P00", trailers.get(CodeException.ERROR_CODE_KEY));
    }
}
