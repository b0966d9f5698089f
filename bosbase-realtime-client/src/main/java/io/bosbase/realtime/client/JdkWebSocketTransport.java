package io.bosbase.realtime.client;

import io.bosbase.realtime.core.RealtimeException;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket {@link FrameTransport} using {@link java.net.http.WebSocket}.
 *
 * <p>Fragmented messages are reassembled; binary messages are decoded as UTF-8 text.
 */
public final class JdkWebSocketTransport implements FrameTransport<String> {

    private final HttpClient http;
    private final Duration connectTimeout;

    public JdkWebSocketTransport(HttpClient http) {
        this(http, null);
    }

    public JdkWebSocketTransport(HttpClient http, Duration connectTimeout) {
        this.http = Objects.requireNonNull(http, "http");
        this.connectTimeout = connectTimeout;
    }

    @Override
    public FrameChannel<String> open(ConnectionTarget target) throws Exception {
        WebSocketChannel channel = new WebSocketChannel();
        WebSocket.Builder builder = http.newWebSocketBuilder();
        if (connectTimeout != null) {
            builder.connectTimeout(connectTimeout);
        }
        target.headers().forEach(builder::header);

        try {
            WebSocket ws = builder.buildAsync(target.uri(), channel).get();
            channel.attach(ws);
            return channel;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new RealtimeException.ConnectionFailure("WebSocket handshake with " + target.uri() + " failed", cause);
        }
    }

    private record Closed(int statusCode, Throwable error) {}

    static final class WebSocketChannel implements FrameChannel<String>, WebSocket.Listener {
        private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
        private final StringBuilder text = new StringBuilder();
        private final ByteArrayOutputStream binary = new ByteArrayOutputStream();
        private final Object sendLock = new Object();

        private volatile WebSocket ws;
        private volatile boolean closed;
        private CompletableFuture<?> lastSend = CompletableFuture.completedFuture(null);

        void attach(WebSocket ws) {
            this.ws = ws;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            text.append(data);
            if (last) {
                inbound.add(text.toString());
                text.setLength(0);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            byte[] chunk = new byte[data.remaining()];
            data.get(chunk);
            binary.writeBytes(chunk);
            if (last) {
                inbound.add(binary.toString(StandardCharsets.UTF_8));
                binary.reset();
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            inbound.add(new Closed(statusCode, null));
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            inbound.add(new Closed(-1, error));
        }

        /**
         * The JDK WebSocket rejects a send while the previous one is still in flight, so sends are chained.
         */
        @Override
        public CompletableFuture<Void> send(String frame) {
            WebSocket socket = ws;
            if (socket == null || closed) {
                return CompletableFuture.failedFuture(
                        new RealtimeException.ConnectionFailure("Unable to send websocket message - socket not initialized."));
            }
            synchronized (sendLock) {
                CompletableFuture<Void> next = lastSend
                        .handle((v, e) -> null)
                        .thenCompose(v -> socket.sendText(frame, true))
                        .thenApply(w -> null);
                lastSend = next;
                return next;
            }
        }

        @Override
        public String receive() throws Exception {
            Object item = inbound.take();
            if (item instanceof Closed c) {
                inbound.add(c);
                if (c.error() != null && !closed) {
                    throw new RealtimeException.ConnectionFailure("WebSocket failed", c.error());
                }
                return null;
            }
            return (String) item;
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            inbound.add(new Closed(WebSocket.NORMAL_CLOSURE, null));
            WebSocket socket = ws;
            if (socket != null && !socket.isOutputClosed()) {
                socket.sendClose(WebSocket.NORMAL_CLOSURE, "")
                        .orTimeout(1, TimeUnit.SECONDS)
                        .whenComplete((w, e) -> socket.abort());
            } else if (socket != null) {
                socket.abort();
            }
        }
    }
}
