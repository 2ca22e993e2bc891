package io.ratelimits.grpc.server;

import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCall.Listener;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import io.ratelimits.grpc.error.CodeException;
import io.ratelimits.grpc.error.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ServerInterceptor} translating application errors into gRPC statuses at the call boundary.
 * <ul>
 *     <li>{@link CodeException}s become their mapped status, with the error code and HTTP status in the
 *     trailers</li>
 *     <li>{@link StatusRuntimeException} and {@link StatusException} pass through unchanged</li>
 *     <li>any other failure becomes INTERNAL carrying the exception message</li>
 * </ul>
 * Errors passed to {@code StreamObserver.onError} and exceptions thrown by the handler are both covered.
 */
public class ErrorConversionServerInterceptor implements ServerInterceptor {
    private static final Logger LOG = LoggerFactory.getLogger(ErrorConversionServerInterceptor.class);

    @Override
    public <ReqT, RespT> Listener<ReqT> interceptCall(final ServerCall<ReqT, RespT> call,
                                                      final Metadata headers,
                                                      final ServerCallHandler<ReqT, RespT> next) {
        final ConvertingServerCall<ReqT, RespT> converting = new ConvertingServerCall<>(call);
        final Listener<ReqT> delegate;
        try {
            delegate = next.startCall(converting, headers);
        } catch (RuntimeException e) {
            converting.closeWithError(e);
            return new ServerCall.Listener<ReqT>() {};
        }

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT>(delegate) {
            @Override
            public void onMessage(ReqT message) {
                try {
                    super.onMessage(message);
                } catch (RuntimeException e) {
                    converting.closeWithError(e);
                }
            }

            @Override
            public void onHalfClose() {
                try {
                    super.onHalfClose();
                } catch (RuntimeException e) {
                    converting.closeWithError(e);
                }
            }

            @Override
            public void onReady() {
                try {
                    super.onReady();
                } catch (RuntimeException e) {
                    converting.closeWithError(e);
                }
            }
        };
    }

    /**
     * Map a closing status onto the status sent to the client, adding error code trailers where applicable.
     */
    static Status convert(Status status, Metadata trailers) {
        final Throwable cause = status.getCause();
        if (status.isOk() || cause == null) {
            return status;
        }

        if (cause instanceof CodeException) {
            CodeException codeException = (CodeException) cause;
            // A CodeException wrapped in a StatusRuntimeException already carries the code trailers
            trailers.removeAll(CodeException.ERROR_CODE_KEY);
            trailers.removeAll(CodeException.HTTP_STATUS_KEY);
            trailers.merge(codeException.toTrailers());
            return codeException.toStatus();
        }

        if (cause instanceof StatusRuntimeException || cause instanceof StatusException) {
            return status;
        }

        if (status.getCode() == Status.Code.UNKNOWN) {
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
            CodeException internal = new CodeException(ErrorCode.INTERNAL, message, cause);
            trailers.merge(internal.toTrailers());
            return internal.toStatus();
        }
        return status;
    }

    private static final class ConvertingServerCall<ReqT, RespT> extends ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT> {
        private final AtomicBoolean closed = new AtomicBoolean(false);

        ConvertingServerCall(ServerCall<ReqT, RespT> delegate) {
            super(delegate);
        }

        @Override
        public void close(Status status, Metadata trailers) {
            if (closed.compareAndSet(false, true)) {
                super.close(convert(status, trailers), trailers);
            } else {
                LOG.debug("Ignoring close with {} for already closed call", status.getCode());
            }
        }

        void closeWithError(RuntimeException e) {
            if (closed.get()) {
                LOG.error("Uncaught exception after call was closed", e);
                return;
            }
            LOG.debug("Converting uncaught exception", e);
            Metadata trailers = Status.trailersFromThrowable(e);
            close(Status.fromThrowable(e), trailers != null ? trailers : new Metadata());
        }
    }
}
