package io.ratelimits.grpc.util;

import io.grpc.Channel;
import io.grpc.ClientInterceptors;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.Server;
import io.grpc.ServerServiceDefinition;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.MetadataUtils;
import org.junit.rules.ExternalResource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Starts an in-process server for a test and tears it down afterwards.  Response headers and trailers of the
 * latest call made through {@link #channel()} are captured.
 */
public class InProcessServerRule extends ExternalResource {
    private final AtomicReference<Metadata> responseHeaders = new AtomicReference<>();
    private final AtomicReference<Metadata> responseTrailers = new AtomicReference<>();

    private Server server;
    private ManagedChannel channel;

    public void start(ServerServiceDefinition service) {
        String name = InProcessServerBuilder.generateName();
        try {
            server = InProcessServerBuilder.forName(name)
                    .addService(service)
                    .build()
                    .start();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        channel = InProcessChannelBuilder.forName(name).build();
    }

    public Channel channel() {
        responseHeaders.set(null);
        responseTrailers.set(null);
        return ClientInterceptors.intercept(channel,
                MetadataUtils.newCaptureMetadataInterceptor(responseHeaders, responseTrailers));
    }

    public Channel channel(Metadata requestHeaders) {
        return ClientInterceptors.intercept(channel(), MetadataUtils.newAttachHeadersInterceptor(requestHeaders));
    }

    public Metadata responseHeaders() {
        return responseHeaders.get();
    }

    public Metadata responseTrailers() {
        return responseTrailers.get();
    }

    @Override
    protected void after() {
        if (channel != null) {
            channel.shutdownNow();
        }
        if (server != null) {
            server.shutdownNow();
            try {
                server.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
