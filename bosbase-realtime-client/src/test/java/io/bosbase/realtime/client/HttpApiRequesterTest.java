package io.bosbase.realtime.client;

import io.bosbase.realtime.http.spi.JdkHttpClientAdapter;
import io.bosbase.realtime.json.spi.JsonCodec;
import io.bosbase.realtime.json.spi.JsonCodecs;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpApiRequesterTest {

    private final JsonCodec json = JsonCodecs.load();

    private MockWebServer server;
    private AuthStore authStore;
    private HttpApiRequester requester;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        authStore = new AuthStore();
        requester = new HttpApiRequester(server.url("/").uri(), JdkHttpClientAdapter.create(), json,
                authStore, "en-US", Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void postsJsonWithAuthAndLanguage() throws Exception {
        authStore.save("tok", Map.of("id", "u1"));
        server.enqueue(new MockResponse().setResponseCode(204));

        Object result = requester.send("/api/realtime", "POST", Map.of(), Map.of(),
                Map.of("clientId", "abc", "subscriptions", List.of("posts")));

        assertThat(result).isNull();
        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getPath()).isEqualTo("/api/realtime");
        assertThat(recorded.getHeader("Authorization")).isEqualTo("tok");
        assertThat(recorded.getHeader("Accept-Language")).isEqualTo("en-US");
        assertThat(recorded.getHeader("Content-Type")).startsWith("application/json");
        Map<String, Object> body = json.readObject(recorded.getBody().readUtf8());
        assertThat(body).containsEntry("clientId", "abc").containsEntry("subscriptions", List.of("posts"));
    }

    @Test
    void decodesJsonAndAppendsQuery() throws Exception {
        server.enqueue(new MockResponse()
                .addHeader("Content-Type", "application/json")
                .setBody("{\"ok\":true}"));

        Object result = requester.send("api/health", "GET", Map.of("b", "2", "a", "1"), Map.of("Accept-Language", "fr"), null);

        assertThat(result).isEqualTo(Map.of("ok", true));
        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getPath()).isEqualTo("/api/health?a=1&b=2");
        assertThat(recorded.getHeader("Accept-Language")).isEqualTo("fr");
        assertThat(recorded.getHeader("Authorization")).isNull();
    }

    @Test
    void errorStatusCarriesServerMessage() {
        server.enqueue(new MockResponse()
                .setResponseCode(403)
                .setBody("{\"message\":\"Only admins can access this action.\",\"data\":{}}"));

        assertThatThrownBy(() -> requester.send("/api/realtime", "POST", Map.of(), Map.of(), Map.of()))
                .isInstanceOfSatisfying(ClientResponseException.class, e -> {
                    assertThat(e.status()).isEqualTo(403);
                    assertThat(e.getMessage()).isEqualTo("Only admins can access this action.");
                    assertThat(e.response()).containsKey("data");
                    assertThat(e.url().getPath()).isEqualTo("/api/realtime");
                });
    }

    @Test
    void transportFailureHasStatusZero() throws Exception {
        URI dead = server.url("/").uri();
        server.shutdown();
        HttpApiRequester offline = new HttpApiRequester(dead, JdkHttpClientAdapter.create(), json,
                authStore, "en-US", Duration.ofSeconds(2));

        assertThatThrownBy(() -> offline.send("/api/health", "GET", Map.of(), Map.of(), null))
                .isInstanceOfSatisfying(ClientResponseException.class, e -> {
                    assertThat(e.status()).isZero();
                    assertThat(e.isAbort()).isFalse();
                    assertThat(e.isTimeout()).isFalse();
                });
    }

    @Test
    void slowServerIsReportedAsTimeout() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        HttpApiRequester impatient = new HttpApiRequester(server.url("/").uri(), JdkHttpClientAdapter.create(), json,
                authStore, "en-US", Duration.ofMillis(200));

        assertThatThrownBy(() -> impatient.send("/api/realtime", "POST", Map.of(), Map.of(), Map.of("clientId", "c1")))
                .isInstanceOfSatisfying(ClientResponseException.class, e -> {
                    assertThat(e.status()).isZero();
                    assertThat(e.isTimeout()).isTrue();
                    assertThat(e).hasMessageContaining("/api/realtime").hasMessageContaining("200 ms");
                });
    }
}
