package io.ratelimits.grpc.error;

import io.grpc.Status;

import java.util.EnumMap;
import java.util.Map;

/**
 * Machine readable error codes returned to clients alongside the gRPC status.  Codes follow the pattern
 * {@code ERRxxxPyy} where {@code xxx} is the equivalent HTTP status and {@code yy} a sequence number.
 */
public enum ErrorCode {
    INTERNAL("ERR500P00", 500, Status.Code.INTERNAL, "internal server error"),
    CANCELLED("ERR499P01", 499, Status.Code.CANCELLED, "request cancelled"),
    UNKNOWN("ERR500P02", 500, Status.Code.UNKNOWN, "unknown error"),
    INVALID_ARGUMENT("ERR400P03", 400, Status.Code.INVALID_ARGUMENT, "invalid argument"),
    DEADLINE_EXCEEDED("ERR504P04", 504, Status.Code.DEADLINE_EXCEEDED, "deadline exceeded"),
    NOT_FOUND("ERR404P05", 404, Status.Code.NOT_FOUND, "not found"),
    ALREADY_EXISTS("ERR409P06", 409, Status.Code.ALREADY_EXISTS, "already exists"),
    PERMISSION_DENIED("ERR403P07", 403, Status.Code.PERMISSION_DENIED, "permission denied"),
    RESOURCE_EXHAUSTED("ERR429P08", 429, Status.Code.RESOURCE_EXHAUSTED, "resource exhausted"),
    FAILED_PRECONDITION("ERR400P09", 400, Status.Code.FAILED_PRECONDITION, "failed precondition"),
    ABORTED("ERR409P10", 409, Status.Code.ABORTED, "aborted"),
    OUT_OF_RANGE("ERR400P11", 400, Status.Code.OUT_OF_RANGE, "out of range"),
    UNIMPLEMENTED("ERR501P12", 501, Status.Code.UNIMPLEMENTED, "unimplemented"),
    UNAVAILABLE("ERR503P14", 503, Status.Code.UNAVAILABLE, "service unavailable"),
    DATA_LOSS("ERR500P15", 500, Status.Code.DATA_LOSS, "data loss"),
    UNAUTHENTICATED("ERR401P16", 401, Status.Code.UNAUTHENTICATED, "unauthenticated");

    private static final Map<Status.Code, ErrorCode> BY_GRPC_CODE = new EnumMap<>(Status.Code.class);

    static {
        for (ErrorCode errorCode : values()) {
            BY_GRPC_CODE.put(errorCode.grpcCode, errorCode);
        }
    }

    private final String code;
    private final int httpStatus;
    private final Status.Code grpcCode;
    private final String message;

    ErrorCode(String code, int httpStatus, Status.Code grpcCode, String message) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.grpcCode = grpcCode;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public Status.Code getGrpcCode() {
        return grpcCode;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return Exception carrying this code and its default message
     */
    public CodeException toException() {
        return new CodeException(this, message);
    }

    /**
     * @param format {@link String#format} pattern replacing the default message, ignored when null or empty.
     *               Used verbatim when no arguments are given.
     * @param args
     * @return Exception carrying this code and the formatted message
     */
    public CodeException withMessage(String format, Object... args) {
        if (format == null || format.isEmpty()) {
            return toException();
        }
        return new CodeException(this, args.length > 0 ? String.format(format, args) : format);
    }

    /**
     * @return true if the throwable, or any of its causes, is a {@link CodeException} with this code
     */
    public boolean is(Throwable t) {
        for (Throwable current = t; current != null; current = current.getCause()) {
            if (current instanceof CodeException && ((CodeException) current).getErrorCode() == this) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    /**
     * @return The error code for a gRPC status code, {@link #INTERNAL} for codes without one (i.e. OK)
     */
    public static ErrorCode fromGrpcCode(Status.Code grpcCode) {
        return BY_GRPC_CODE.getOrDefault(grpcCode, INTERNAL);
    }
}
