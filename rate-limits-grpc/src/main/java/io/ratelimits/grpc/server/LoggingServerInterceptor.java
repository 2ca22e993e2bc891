package io.ratelimits.grpc.server;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableSet;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCall.Listener;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.spi.LoggingEventBuilder;

import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * {@link ServerInterceptor} logging the start and outcome of every call.  Successful calls are logged at INFO
 * and failed calls at ERROR, with method, status, duration and the request and response payloads.  The
 * request id is placed in the MDC under {@value #REQUEST_ID_MDC_KEY} while logging.
 * <p>
 * Payloads are omitted for high frequency methods such as health checks and for messages whose text form
 * exceeds {@value #MAX_PAYLOAD_LENGTH} characters.
 */
public class LoggingServerInterceptor implements ServerInterceptor {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingServerInterceptor.class);

    public static final String REQUEST_ID_MDC_KEY = "request_id";

    static final int MAX_PAYLOAD_LENGTH = 1000;

    static final Set<String> HIGH_FREQUENCY_METHODS = ImmutableSet.of(
            "grpc.health.v1.Health/Check",
            "grpc.health.v1.Health/Watch",
            "grpc.reflection.v1alpha.ServerReflection/ServerReflectionInfo",
            "grpc.reflection.v1.ServerReflection/ServerReflectionInfo");

    private final Ticker ticker;

    public LoggingServerInterceptor() {
        this(Ticker.systemTicker());
    }

    public LoggingServerInterceptor(Ticker ticker) {
        this.ticker = ticker;
    }

    @Override
    public <ReqT, RespT> Listener<ReqT> interceptCall(final ServerCall<ReqT, RespT> call,
                                                      final Metadata headers,
                                                      final ServerCallHandler<ReqT, RespT> next) {
        final String method = call.getMethodDescriptor().getFullMethodName();
        final String requestId = RequestIdServerInterceptor.currentRequestId();
        final boolean logPayloads = !HIGH_FREQUENCY_METHODS.contains(method);
        final Stopwatch stopwatch = Stopwatch.createStarted(ticker);
        final Payloads payloads = new Payloads();

        withRequestId(requestId, () -> LOG.atInfo()
                .addKeyValue("method", method)
                .log("gRPC request received"));

        ServerCall<ReqT, RespT> logged = new ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT>(call) {
            @Override
            public void sendMessage(RespT message) {
                if (logPayloads) {
                    payloads.response = message;
                }
                super.sendMessage(message);
            }

            @Override
            public void close(Status status, Metadata trailers) {
                try {
                    super.close(status, trailers);
                } finally {
                    withRequestId(requestId, () -> logCompletion(method, status, stopwatch, payloads));
                }
            }
        };

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT>(next.startCall(logged, headers)) {
            @Override
            public void onMessage(ReqT message) {
                if (logPayloads && payloads.request == null) {
                    payloads.request = message;
                }
                super.onMessage(message);
            }
        };
    }

    private static void logCompletion(String method, Status status, Stopwatch stopwatch, Payloads payloads) {
        LoggingEventBuilder event = status.isOk() ? LOG.atInfo() : LOG.atError();
        event = event.addKeyValue("method", method)
                .addKeyValue("grpc_status", status.getCode().name())
                .addKeyValue("status_code", status.getCode().value())
                .addKeyValue("duration_ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));
        event = addPayload(event, "request", payloads.request);
        event = addPayload(event, "response", payloads.response);

        if (status.isOk()) {
            event.log("gRPC request completed");
        } else {
            if (status.getDescription() != null) {
                event = event.addKeyValue("error", status.getDescription());
            }
            if (status.getCause() != null) {
                event = event.setCause(status.getCause());
            }
            event.log("gRPC request failed");
        }
    }

    private static LoggingEventBuilder addPayload(LoggingEventBuilder event, String name, Object payload) {
        if (payload == null) {
            return event;
        }
        String text = String.valueOf(payload);
        if (text.length() > MAX_PAYLOAD_LENGTH) {
            return event.addKeyValue(name + "_payload_size", text.length());
        }
        return event.addKeyValue(name + "_payload", text);
    }

    /**
     * Run the action with the request id in the MDC, restoring whatever value the thread had before.
     */
    static void withRequestId(String requestId, Runnable action) {
        if (requestId == null) {
            action.run();
            return;
        }
        final String previous = MDC.get(REQUEST_ID_MDC_KEY);
        MDC.put(REQUEST_ID_MDC_KEY, requestId);
        try {
            action.run();
        } finally {
            if (previous != null) {
                MDC.put(REQUEST_ID_MDC_KEY, previous);
            } else {
                MDC.remove(REQUEST_ID_MDC_KEY);
            }
        }
    }

    private static final class Payloads {
        volatile Object request;
        volatile Object response;
    }
}
