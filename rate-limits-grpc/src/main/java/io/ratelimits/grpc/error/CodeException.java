package io.ratelimits.grpc.error;

import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;

/**
 * Unchecked exception carrying an {@link ErrorCode}.  Handlers may throw it, or pass it to
 * {@code StreamObserver.onError}, and the ErrorConversionServerInterceptor turns it into the mapped gRPC status
 * with the machine readable code and HTTP status in the trailers.
 */
public class CodeException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public static final Metadata.Key<String> ERROR_CODE_KEY =
            Metadata.Key.of("x-error-code", Metadata.ASCII_STRING_MARSHALLER);
    public static final Metadata.Key<String> HTTP_STATUS_KEY =
            Metadata.Key.of("x-http-status", Metadata.ASCII_STRING_MARSHALLER);

    private final ErrorCode errorCode;

    public CodeException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public CodeException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public Status toStatus() {
        return Status.fromCode(errorCode.getGrpcCode())
                .withDescription(getMessage())
                .withCause(this);
    }

    public Metadata toTrailers() {
        Metadata trailers = new Metadata();
        trailers.put(ERROR_CODE_KEY, errorCode.getCode());
        trailers.put(HTTP_STATUS_KEY, Integer.toString(errorCode.getHttpStatus()));
        return trailers;
    }

    public StatusRuntimeException toStatusRuntimeException() {
        return toStatus().asRuntimeException(toTrailers());
    }
}
