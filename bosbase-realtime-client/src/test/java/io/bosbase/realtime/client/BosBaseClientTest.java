package io.bosbase.realtime.client;

import io.bosbase.realtime.json.spi.JsonCodec;
import io.bosbase.realtime.json.spi.JsonCodecs;
import io.bosbase.realtime.json.spi.JsonException;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BosBaseClientTest {

    private final JsonCodec json = JsonCodecs.load();

    private MockWebServer server;
    private BosBaseClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        client = BosBaseClient.builder()
                .baseUrl(server.url("/").uri())
                .ackTimeout(Duration.ofSeconds(2))
                .handshakeTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void tearDown() throws Exception {
        client.close();
        server.shutdown();
    }

    @Test
    void buildRequiresBaseUrl() {
        assertThatThrownBy(() -> BosBaseClient.builder().build()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void publishRoundTripOverWebSocket() throws Exception {
        List<Map<String, Object>> received = new CopyOnWriteArrayList<>();
        server.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                webSocket.send("{\"type\":\"ready\",\"clientId\":\"c1\"}");
            }

            @Override
            public void onMessage(WebSocket webSocket, String text) {
                Map<String, Object> frame;
                try {
                    frame = json.readObject(text);
                } catch (JsonException e) {
                    throw new IllegalStateException(e);
                }
                received.add(frame);
                webSocket.send("{\"type\":\"published\",\"id\":\"m1\",\"topic\":\"" + frame.get("topic")
                        + "\",\"created\":\"2024-01-01\",\"requestId\":\"" + frame.get("requestId") + "\"}");
            }
        }));
        client.authStore().save("tok", Map.of());

        PublishAck ack = client.pubsub().publish("chat", Map.of("text", "hi")).get(5, TimeUnit.SECONDS);

        assertThat(ack.id()).isEqualTo("m1");
        assertThat(ack.topic()).isEqualTo("chat");
        assertThat(client.pubsub().clientId()).isEqualTo("c1");
        assertThat(received).hasSize(1);
        assertThat(received.get(0)).containsEntry("type", "publish").containsEntry("data", Map.of("text", "hi"));

        RecordedRequest handshake = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(handshake.getPath()).isEqualTo("/api/pubsub?token=tok");
    }

    @Test
    void realtimeSubscribeOverEventStream() throws Exception {
        server.enqueue(new MockResponse()
                .addHeader("Content-Type", "text/event-stream")
                .setBody("id: abc\nevent: PB_CONNECT\ndata: {\"clientId\":\"abc\"}\n\n"));
        server.enqueue(new MockResponse().setResponseCode(204));

        Subscription sub = client.realtime().subscribe("posts", m -> {}).get(5, TimeUnit.SECONDS);

        assertThat(sub.topicKey()).isEqualTo("posts");
        RecordedRequest stream = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(stream.getPath()).isEqualTo("/api/realtime");
        assertThat(stream.getHeader("Accept")).isEqualTo("text/event-stream");
        assertThat(stream.getHeader("Accept-Language")).isEqualTo("en-US");

        RecordedRequest submit = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(submit.getMethod()).isEqualTo("POST");
        assertThat(json.readObject(submit.getBody().readUtf8()))
                .containsEntry("clientId", "abc")
                .containsEntry("subscriptions", List.of("posts"));
    }
}
