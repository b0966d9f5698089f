package io.bosbase.realtime.client;

import io.bosbase.realtime.core.BackoffPolicy;
import io.bosbase.realtime.core.EnvelopeCodec;
import io.bosbase.realtime.core.ServerSentEvent;
import io.bosbase.realtime.http.spi.HttpClientAdapter;
import io.bosbase.realtime.http.spi.JdkHttpClientAdapter;
import io.bosbase.realtime.json.spi.JsonCodec;
import io.bosbase.realtime.json.spi.JsonCodecs;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builder for {@link BosBaseClient}.
 *
 * <p>Only the base URL is required. By default the JDK {@link HttpClient} carries API requests, the event stream
 * and the WebSocket, and the JSON codec is discovered with {@link JsonCodecs#load()}.
 */
public final class BosBaseClientBuilder {
    private URI baseUrl;
    private AuthStore authStore;
    private String lang = RealtimeSettings.DEFAULT_LANG;
    private HttpClient httpClient;
    private HttpClientAdapter httpClientAdapter;
    private JsonCodec jsonCodec;
    private ApiRequester apiRequester;
    private Duration ackTimeout = RealtimeSettings.DEFAULT_ACK_TIMEOUT;
    private Duration handshakeTimeout = RealtimeSettings.DEFAULT_HANDSHAKE_TIMEOUT;
    private Duration requestTimeout;
    private BackoffPolicy backoff = BackoffPolicy.defaults();
    private int maxReconnectAttempts = RealtimeSettings.DEFAULT_MAX_RECONNECT_ATTEMPTS;
    private FrameTransport<String> pubSubTransport;
    private FrameTransport<ServerSentEvent> realtimeTransport;

    BosBaseClientBuilder() {
    }

    public BosBaseClientBuilder baseUrl(String baseUrl) {
        return baseUrl(URI.create(Objects.requireNonNull(baseUrl, "baseUrl")));
    }

    public BosBaseClientBuilder baseUrl(URI baseUrl) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        return this;
    }

    /**
     * Shares an auth holder, e.g. with other clients. A fresh, empty one is used otherwise.
     */
    public BosBaseClientBuilder authStore(AuthStore authStore) {
        this.authStore = Objects.requireNonNull(authStore, "authStore");
        return this;
    }

    public BosBaseClientBuilder lang(String lang) {
        this.lang = lang;
        return this;
    }

    /**
     * Uses the given JDK client for HTTP and WebSocket traffic.
     */
    public BosBaseClientBuilder httpClient(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        return this;
    }

    /**
     * Uses a custom HTTP adapter (e.g. OkHttp) for API requests and the event stream.
     */
    public BosBaseClientBuilder httpClientAdapter(HttpClientAdapter httpClientAdapter) {
        this.httpClientAdapter = Objects.requireNonNull(httpClientAdapter, "httpClientAdapter");
        return this;
    }

    public BosBaseClientBuilder jsonCodec(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        return this;
    }

    /**
     * Replaces the HTTP-based requester used to submit record subscriptions.
     */
    public BosBaseClientBuilder apiRequester(ApiRequester apiRequester) {
        this.apiRequester = Objects.requireNonNull(apiRequester, "apiRequester");
        return this;
    }

    public BosBaseClientBuilder ackTimeout(Duration ackTimeout) {
        this.ackTimeout = Objects.requireNonNull(ackTimeout, "ackTimeout");
        return this;
    }

    public BosBaseClientBuilder handshakeTimeout(Duration handshakeTimeout) {
        this.handshakeTimeout = Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");
        return this;
    }

    /**
     * Timeout of individual API requests; unlimited if not set.
     */
    public BosBaseClientBuilder requestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        return this;
    }

    public BosBaseClientBuilder backoff(BackoffPolicy backoff) {
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        return this;
    }

    public BosBaseClientBuilder maxReconnectAttempts(int maxReconnectAttempts) {
        this.maxReconnectAttempts = maxReconnectAttempts;
        return this;
    }

    public BosBaseClientBuilder pubSubTransport(FrameTransport<String> pubSubTransport) {
        this.pubSubTransport = Objects.requireNonNull(pubSubTransport, "pubSubTransport");
        return this;
    }

    public BosBaseClientBuilder realtimeTransport(FrameTransport<ServerSentEvent> realtimeTransport) {
        this.realtimeTransport = Objects.requireNonNull(realtimeTransport, "realtimeTransport");
        return this;
    }

    /**
     * Builds the client. No connection is opened until the first realtime operation.
     *
     * @throws IllegalStateException if no base URL was set or no JSON codec is available
     */
    public BosBaseClient build() {
        if (baseUrl == null) {
            throw new IllegalStateException("baseUrl must be set");
        }
        RealtimeSettings settings = new RealtimeSettings(ackTimeout, handshakeTimeout, backoff, maxReconnectAttempts, lang);

        AuthStore auth = authStore != null ? authStore : new AuthStore();
        JsonCodec json = jsonCodec != null ? jsonCodec : JsonCodecs.load();
        HttpClient jdk = httpClient != null ? httpClient : HttpClient.newHttpClient();
        HttpClientAdapter http = httpClientAdapter != null ? httpClientAdapter : JdkHttpClientAdapter.create(jdk);
        ApiRequester api = apiRequester != null
                ? apiRequester
                : new HttpApiRequester(baseUrl, http, json, auth, lang, requestTimeout);
        FrameTransport<String> ws = pubSubTransport != null
                ? pubSubTransport
                : new JdkWebSocketTransport(jdk, handshakeTimeout);
        FrameTransport<ServerSentEvent> sse = realtimeTransport != null
                ? realtimeTransport
                : new EventStreamTransport(http, handshakeTimeout);

        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(daemon("bosbase-timer"));
        ExecutorService requests = Executors.newCachedThreadPool(daemon("bosbase-request"));

        PubSubClient pubsub = new PubSubClient(baseUrl, auth, ws, new EnvelopeCodec(json), settings, scheduler);
        RealtimeClient realtime = new RealtimeClient(baseUrl, auth, sse, api, json, settings, scheduler, requests);
        return new BosBaseClient(auth, api, pubsub, realtime, scheduler, requests);
    }

    private static ThreadFactory daemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
