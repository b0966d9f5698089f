package io.bosbase.realtime.client;

import io.bosbase.realtime.core.ConnectionState;
import io.bosbase.realtime.core.Protocol;
import io.bosbase.realtime.core.RealtimeException;
import io.bosbase.realtime.core.ServerSentEvent;
import io.bosbase.realtime.core.SubscriptionOptions;
import io.bosbase.realtime.core.TopicKeys;
import io.bosbase.realtime.core.Urls;
import io.bosbase.realtime.json.spi.JsonCodec;
import io.bosbase.realtime.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * Record-change notifications over the event stream at {@code /api/realtime}.
 *
 * <p>After the server's {@code PB_CONNECT} event the full list of active topic keys is posted back to
 * {@code /api/realtime}; the same happens whenever that list changes while connected. Events are delivered to the
 * listeners of the topic key matching the event name.
 */
public final class RealtimeClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RealtimeClient.class);

    private final URI baseUrl;
    private final AuthStore authStore;
    private final ApiRequester api;
    private final JsonCodec json;
    private final RealtimeSettings settings;
    private final Executor requestExecutor;
    private final SubscriptionRegistry<RealtimeMessage> registry = new SubscriptionRegistry<>();
    private final ConnectionManager<ServerSentEvent> connection;
    private final List<Consumer<List<String>>> disconnectListeners = new CopyOnWriteArrayList<>();

    private final Object submissionLock = new Object();
    // tail of the submission chain; each POST starts after the previous one finished
    private volatile CompletableFuture<Void> submission = CompletableFuture.completedFuture(null);

    /**
     * @param requestExecutor runs the blocking subscription submissions
     */
    public RealtimeClient(URI baseUrl,
                          AuthStore authStore,
                          FrameTransport<ServerSentEvent> transport,
                          ApiRequester api,
                          JsonCodec json,
                          RealtimeSettings settings,
                          ScheduledExecutorService scheduler,
                          Executor requestExecutor) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.authStore = Objects.requireNonNull(authStore, "authStore");
        this.api = Objects.requireNonNull(api, "api");
        this.json = Objects.requireNonNull(json, "json");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.requestExecutor = Objects.requireNonNull(requestExecutor, "requestExecutor");
        this.connection = new ConnectionManager<>("realtime", transport, this::target,
                registry, null, settings, scheduler, new Dispatcher());
    }

    public CompletableFuture<Subscription> subscribe(String topic, Consumer<RealtimeMessage> listener) {
        return subscribe(topic, SubscriptionOptions.none(), listener);
    }

    /**
     * Adds a listener for {@code topic} narrowed by {@code options}.
     *
     * <p>The returned future completes once the server knows about the subscription.
     *
     * @throws RealtimeException.Validation if the topic is blank or the options cannot be encoded
     */
    public CompletableFuture<Subscription> subscribe(String topic, SubscriptionOptions options,
                                                     Consumer<RealtimeMessage> listener) {
        if (topic == null || topic.isBlank()) {
            throw new RealtimeException.Validation("topic must be set.");
        }
        Objects.requireNonNull(listener, "listener");
        String key = TopicKeys.of(topic, options, json);

        UUID id = UUID.randomUUID();
        boolean first = registry.addListener(key, id, listener);
        CompletableFuture<Void> ack = new CompletableFuture<>();
        Subscription subscription = new Subscription(key, () -> removeListener(key, id), ack);

        CompletableFuture<Void> registered;
        if (!first) {
            registered = connection.ensureConnected().thenApply(clientId -> null);
        } else if (connection.isReady()) {
            registered = submitSubscriptions();
        } else {
            registered = connection.ensureConnected().thenCompose(clientId -> submission);
        }

        return registered.handle((v, e) -> {
            if (e == null) {
                ack.complete(null);
                return subscription;
            }
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            if (registry.removeListener(key, id).topicRemoved() && !registry.hasActiveTopics()) {
                connection.disconnect();
            }
            ack.completeExceptionally(cause);
            throw new CompletionException(cause);
        });
    }

    /**
     * Drops every subscription of {@code topic}, including those with options, or all subscriptions
     * when {@code topic} is {@code null}.
     */
    public CompletableFuture<Void> unsubscribe(String topic) {
        if (topic == null) {
            registry.clear();
            return afterRemoval();
        }
        registry.removeTopic(topic);
        return afterRemoval();
    }

    /**
     * Drops every subscription whose topic key starts with {@code prefix}.
     */
    public CompletableFuture<Void> unsubscribeByPrefix(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        registry.removeByPrefix(prefix);
        return afterRemoval();
    }

    /**
     * Registers a callback invoked with the dropped topic keys when the connection is lost for good.
     *
     * @return a handle that removes the callback
     */
    public Runnable onDisconnect(Consumer<List<String>> callback) {
        Objects.requireNonNull(callback, "callback");
        disconnectListeners.add(callback);
        return () -> disconnectListeners.remove(callback);
    }

    public boolean isConnected() {
        return connection.isReady();
    }

    public ConnectionState state() {
        return connection.state();
    }

    public String clientId() {
        return connection.clientId();
    }

    public List<String> activeTopics() {
        return registry.activeTopics();
    }

    public void disconnect() {
        connection.disconnect();
    }

    @Override
    public void close() {
        registry.clear();
        connection.disconnect();
    }

    private CompletableFuture<Void> removeListener(String key, UUID id) {
        if (!registry.removeListener(key, id).topicRemoved()) {
            return CompletableFuture.completedFuture(null);
        }
        return afterRemoval();
    }

    private CompletableFuture<Void> afterRemoval() {
        if (!registry.hasActiveTopics()) {
            connection.disconnect();
            return CompletableFuture.completedFuture(null);
        }
        if (!connection.isReady()) {
            return CompletableFuture.completedFuture(null);
        }
        return submitSubscriptions();
    }

    private CompletableFuture<Void> submitSubscriptions() {
        String clientId = connection.clientId();
        if (clientId == null) {
            return CompletableFuture.failedFuture(
                    new RealtimeException.ConnectionFailure("realtime connection not ready"));
        }
        return submitSubscriptions(clientId);
    }

    /**
     * Queues a POST of the active topic keys on behalf of {@code clientId}. Submissions run one at a time in call
     * order and read the keys when they start, so the last one to reach the server carries the latest set.
     */
    private CompletableFuture<Void> submitSubscriptions(String clientId) {
        synchronized (submissionLock) {
            CompletableFuture<Void> next = submission
                    .handle((v, e) -> null)
                    .thenRunAsync(() -> postSubscriptions(clientId), requestExecutor);
            submission = next;
            return next;
        }
    }

    private void postSubscriptions(String clientId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(Protocol.F_CLIENT_ID, clientId);
        body.put(Protocol.F_SUBSCRIPTIONS, registry.activeTopics());
        api.send(Protocol.PATH_REALTIME, "POST", Map.of(), Map.of(), body);
    }

    private ConnectionTarget target() {
        Map<String, String> headers = new LinkedHashMap<>();
        if (settings.lang() != null) {
            headers.put(Protocol.H_ACCEPT_LANGUAGE, settings.lang());
        }
        if (authStore.isValid()) {
            headers.put(Protocol.H_AUTHORIZATION, authStore.token());
        }
        return new ConnectionTarget(Urls.resolve(baseUrl, Protocol.PATH_REALTIME), headers);
    }

    private String clientIdOf(ServerSentEvent event) {
        if (event.id() != null && !event.id().isEmpty()) return event.id();
        if (event.data() == null) return "";
        try {
            Object id = json.readObject(event.data()).get(Protocol.F_CLIENT_ID);
            return id == null ? "" : id.toString();
        } catch (JsonException e) {
            log.debug("Unreadable connect event data: {}", e.getMessage());
            return "";
        }
    }

    private final class Dispatcher implements ConnectionManager.Listener<ServerSentEvent> {

        @Override
        public void onFrame(ServerSentEvent event) {
            if (Protocol.EVENT_CONNECT.equals(event.name())) {
                connection.markReady(clientIdOf(event));
                return;
            }
            if (event.data() == null) return;

            Map<String, Object> payload;
            try {
                payload = json.readObject(event.data());
            } catch (JsonException e) {
                log.debug("Ignoring {} event with unreadable data: {}", event.name(), e.getMessage());
                return;
            }
            registry.fanOut(event.name(), new RealtimeMessage(event.name(), payload));
        }

        @Override
        public void onReady(String clientId, boolean reconnected) {
            submitSubscriptions(clientId).whenComplete((v, e) -> {
                if (e != null) {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    log.warn("Failed to submit realtime subscriptions: {}", cause.getMessage());
                }
            });
        }

        @Override
        public void onGiveUp(RealtimeException cause) {
            List<String> dropped = registry.clear();
            log.warn("Realtime connection lost, dropping topics {}", dropped);
            for (Consumer<List<String>> callback : disconnectListeners) {
                try {
                    callback.accept(dropped);
                } catch (RuntimeException e) {
                    log.error("Error in realtime disconnect callback", e);
                }
            }
        }
    }
}
