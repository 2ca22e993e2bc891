package io.ratelimits.grpc.server;

import com.google.common.base.Strings;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.ForwardingServerCall;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCall.Listener;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link ServerInterceptor} that tags every call with a request id.  The id is taken from the
 * {@code x-request-id} header, or generated when absent, and is then
 * <ul>
 *     <li>written back into the request headers seen by later stages</li>
 *     <li>attached to the gRPC {@link Context} under {@link #REQUEST_ID_CONTEXT_KEY} for later stages and
 *     the handler</li>
 *     <li>echoed to the client in the response headers, or in the trailers of a trailers-only response</li>
 * </ul>
 */
public class RequestIdServerInterceptor implements ServerInterceptor {
    public static final String REQUEST_ID_HEADER = "x-request-id";

    public static final Metadata.Key<String> REQUEST_ID_KEY =
            Metadata.Key.of(REQUEST_ID_HEADER, Metadata.ASCII_STRING_MARSHALLER);

    public static final Context.Key<String> REQUEST_ID_CONTEXT_KEY = Context.key("request-id");

    private final Supplier<String> idGenerator;

    public RequestIdServerInterceptor() {
        this(() -> UUID.randomUUID().toString());
    }

    public RequestIdServerInterceptor(Supplier<String> idGenerator) {
        this.idGenerator = idGenerator;
    }

    /**
     * @return Request id of the call being processed on this thread, or null outside of a call
     */
    public static String currentRequestId() {
        return REQUEST_ID_CONTEXT_KEY.get();
    }

    @Override
    public <ReqT, RespT> Listener<ReqT> interceptCall(final ServerCall<ReqT, RespT> call,
                                                      final Metadata headers,
                                                      final ServerCallHandler<ReqT, RespT> next) {
        String requestId = headers.get(REQUEST_ID_KEY);
        if (Strings.isNullOrEmpty(requestId)) {
            requestId = idGenerator.get();
            headers.put(REQUEST_ID_KEY, requestId);
        }

        final String id = requestId;
        ServerCall<ReqT, RespT> tagged = new ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT>(call) {
            // ServerCall methods are never invoked concurrently
            private boolean headersSent = false;

            @Override
            public void sendHeaders(Metadata responseHeaders) {
                responseHeaders.removeAll(REQUEST_ID_KEY);
                responseHeaders.put(REQUEST_ID_KEY, id);
                headersSent = true;
                super.sendHeaders(responseHeaders);
            }

            @Override
            public void close(Status status, Metadata trailers) {
                if (!headersSent) {
                    trailers.removeAll(REQUEST_ID_KEY);
                    trailers.put(REQUEST_ID_KEY, id);
                }
                super.close(status, trailers);
            }
        };

        Context context = Context.current().withValue(REQUEST_ID_CONTEXT_KEY, id);
        return Contexts.interceptCall(context, tagged, headers, next);
    }
}
