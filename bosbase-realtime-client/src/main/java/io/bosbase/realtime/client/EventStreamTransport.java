package io.bosbase.realtime.client;

import io.bosbase.realtime.core.EventStreamParser;
import io.bosbase.realtime.core.Protocol;
import io.bosbase.realtime.core.RealtimeException;
import io.bosbase.realtime.core.ServerSentEvent;
import io.bosbase.realtime.http.spi.HttpClientAdapter;
import io.bosbase.realtime.http.spi.HttpClientException;
import io.bosbase.realtime.http.spi.HttpClientRequest;
import io.bosbase.realtime.http.spi.HttpClientResponse;
import io.bosbase.realtime.http.spi.HttpTimeoutException;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Receive-only {@link FrameTransport} reading a {@code text/event-stream} response.
 */
public final class EventStreamTransport implements FrameTransport<ServerSentEvent> {

    private final HttpClientAdapter http;
    private final Duration connectTimeout;

    public EventStreamTransport(HttpClientAdapter http) {
        this(http, null);
    }

    /**
     * @param connectTimeout how long to wait for the stream's response headers, or {@code null} for no bound
     */
    public EventStreamTransport(HttpClientAdapter http, Duration connectTimeout) {
        this.http = Objects.requireNonNull(http, "http");
        this.connectTimeout = connectTimeout;
    }

    @Override
    public FrameChannel<ServerSentEvent> open(ConnectionTarget target) throws Exception {
        HttpClientRequest request = HttpClientRequest.get(target.uri())
                .headers(target.headers())
                .header(Protocol.H_ACCEPT, Protocol.CT_EVENT_STREAM)
                .timeout(connectTimeout)
                .build();

        HttpClientResponse response;
        try {
            response = http.sendStreaming(request);
        } catch (HttpTimeoutException e) {
            throw new RealtimeException.HandshakeTimeout(e.getMessage(), e);
        } catch (HttpClientException e) {
            throw new RealtimeException.ConnectionFailure("Event stream request to " + target.uri() + " failed", e);
        }

        InputStream body = response.bodyAsStream();
        if (response.statusCode() >= 400 || body == null) {
            if (body != null) body.close();
            throw new ClientResponseException(target.uri(), response.statusCode(), null);
        }
        return new EventStreamChannel(body);
    }

    static final class EventStreamChannel implements FrameChannel<ServerSentEvent> {
        private final EventStreamParser parser;
        private volatile boolean closed;

        EventStreamChannel(InputStream body) {
            this.parser = new EventStreamParser(body);
        }

        @Override
        public CompletableFuture<Void> send(String text) {
            return CompletableFuture.failedFuture(new UnsupportedOperationException("event streams are receive-only"));
        }

        @Override
        public ServerSentEvent receive() throws Exception {
            if (closed) return null;
            try {
                return parser.next();
            } catch (IOException e) {
                if (closed) return null;
                throw e;
            }
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            try {
                parser.close();
            } catch (IOException ignored) {
                // the stream is being discarded
            }
        }
    }
}
