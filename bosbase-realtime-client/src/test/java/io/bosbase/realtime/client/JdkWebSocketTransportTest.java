package io.bosbase.realtime.client;

import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class JdkWebSocketTransportTest {

    private MockWebServer server;
    private JdkWebSocketTransport transport;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        transport = new JdkWebSocketTransport(HttpClient.newHttpClient(), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    private URI wsUri(String pathAndQuery) {
        return URI.create(server.url(pathAndQuery).toString().replaceFirst("^http", "ws"));
    }

    @Test
    void exchangesTextFrames() throws Exception {
        server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                webSocket.send("{\"type\":\"ready\",\"clientId\":\"c1\"}");
            }

            @Override
            public void onMessage(WebSocket webSocket, String text) {
                webSocket.send("echo:" + text);
            }
        }));

        try (FrameChannel<String> channel = transport.open(new ConnectionTarget(wsUri("/api/pubsub?token=tok"), Map.of()))) {
            assertThat(channel.receive()).isEqualTo("{\"type\":\"ready\",\"clientId\":\"c1\"}");

            channel.send("one").get(2, TimeUnit.SECONDS);
            channel.send("two").get(2, TimeUnit.SECONDS);

            assertThat(channel.receive()).isEqualTo("echo:one");
            assertThat(channel.receive()).isEqualTo("echo:two");
        }

        RecordedRequest handshake = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(handshake.getPath()).isEqualTo("/api/pubsub?token=tok");
    }

    @Test
    void serverCloseEndsReceive() throws Exception {
        server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                webSocket.close(1000, "bye");
            }
        }));

        try (FrameChannel<String> channel = transport.open(new ConnectionTarget(wsUri("/api/pubsub"), Map.of()))) {
            assertThat(channel.receive()).isNull();
            assertThat(channel.receive()).isNull();
        }
    }

    @Test
    void localCloseUnblocksReceiveAndRejectsSends() throws Exception {
        server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {}));

        FrameChannel<String> channel = transport.open(new ConnectionTarget(wsUri("/api/pubsub"), Map.of()));
        channel.close();

        assertThat(channel.receive()).isNull();
        assertThat(channel.send("late")).isCompletedExceptionally();
    }
}
