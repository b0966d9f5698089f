package io.bosbase.realtime.client;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Entry point bundling the auth holder, the API requester and both realtime bindings.
 *
 * <pre>{@code
 * try (BosBaseClient client = BosBaseClient.builder().baseUrl("http://127.0.0.1:8090").build()) {
 *     client.realtime().subscribe("posts/*", event -> System.out.println(event.action())).join();
 * }
 * }</pre>
 */
public final class BosBaseClient implements AutoCloseable {

    private final AuthStore authStore;
    private final ApiRequester api;
    private final PubSubClient pubsub;
    private final RealtimeClient realtime;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService ownedExecutor;

    BosBaseClient(AuthStore authStore,
                  ApiRequester api,
                  PubSubClient pubsub,
                  RealtimeClient realtime,
                  ScheduledExecutorService scheduler,
                  ExecutorService ownedExecutor) {
        this.authStore = Objects.requireNonNull(authStore, "authStore");
        this.api = Objects.requireNonNull(api, "api");
        this.pubsub = Objects.requireNonNull(pubsub, "pubsub");
        this.realtime = Objects.requireNonNull(realtime, "realtime");
        this.scheduler = scheduler;
        this.ownedExecutor = ownedExecutor;
    }

    public static BosBaseClientBuilder builder() {
        return new BosBaseClientBuilder();
    }

    /**
     * Creates a client with default settings.
     */
    public static BosBaseClient create(String baseUrl) {
        return builder().baseUrl(baseUrl).build();
    }

    public AuthStore authStore() {
        return authStore;
    }

    public ApiRequester api() {
        return api;
    }

    public PubSubClient pubsub() {
        return pubsub;
    }

    public RealtimeClient realtime() {
        return realtime;
    }

    /**
     * Closes both connections and releases the threads owned by this client.
     */
    @Override
    public void close() {
        pubsub.close();
        realtime.close();
        if (scheduler != null) scheduler.shutdownNow();
        if (ownedExecutor != null) ownedExecutor.shutdown();
    }
}
