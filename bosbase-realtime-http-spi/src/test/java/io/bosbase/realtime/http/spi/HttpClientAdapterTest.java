package io.bosbase.realtime.http.spi;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpClientAdapterTest {

    private MockWebServer server;

    static Stream<Arguments> adapters() {
        return Stream.of(
                Arguments.of("jdk", JdkHttpClientAdapter.create()),
                Arguments.of("okhttp", OkHttpClientAdapter.create()));
    }

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("adapters")
    void postsBodyAndReadsResponse(String name, HttpClientAdapter adapter) throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("X-Reply", "yes")
                .setBody("{\"ok\":true}"));

        HttpClientRequest request = HttpClientRequest.builder(server.url("/api/realtime").uri(), "POST")
                .header("Content-Type", "application/json")
                .header("Authorization", "tok")
                .body("{\"clientId\":\"c1\"}".getBytes(StandardCharsets.UTF_8))
                .timeout(Duration.ofSeconds(5))
                .build();

        HttpClientResponse response = adapter.send(request);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.isSuccessful()).isTrue();
        assertThat(response.header("X-Reply")).contains("yes");
        assertThat(new String(response.body(), StandardCharsets.UTF_8)).isEqualTo("{\"ok\":true}");

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getHeader("Authorization")).isEqualTo("tok");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"clientId\":\"c1\"}");
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("adapters")
    void errorStatusIsReturnedNotThrown(String name, HttpClientAdapter adapter) throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"message\":\"missing\"}"));

        HttpClientResponse response = adapter.send(HttpClientRequest.get(server.url("/x").uri()).build());

        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(response.isSuccessful()).isFalse();
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("adapters")
    void streamsBody(String name, HttpClientAdapter adapter) throws Exception {
        server.enqueue(new MockResponse()
                .addHeader("Content-Type", "text/event-stream")
                .setBody("event: a\ndata: 1\n\n"));

        HttpClientResponse response = adapter.sendStreaming(HttpClientRequest.get(server.url("/api/realtime").uri())
                .header("Accept", "text/event-stream")
                .build());

        try (InputStream in = response.bodyAsStream()) {
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("event: a\ndata: 1\n\n");
        }
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("adapters")
    void timeoutIsReported(String name, HttpClientAdapter adapter) {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));

        HttpClientRequest request = HttpClientRequest.get(server.url("/slow").uri())
                .timeout(Duration.ofMillis(200))
                .build();

        assertThatThrownBy(() -> adapter.send(request))
                .isInstanceOfSatisfying(HttpTimeoutException.class, e -> {
                    assertThat(e.uri()).isEqualTo(request.uri());
                    assertThat(e.timeout()).isEqualTo(Duration.ofMillis(200));
                    assertThat(e).hasMessageContaining("/slow").hasMessageContaining("200 ms");
                });
    }
}
