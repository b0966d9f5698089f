package io.bosbase.realtime.client;

import io.bosbase.realtime.core.ConnectionState;
import io.bosbase.realtime.core.Envelope;
import io.bosbase.realtime.core.EnvelopeCodec;
import io.bosbase.realtime.core.Protocol;
import io.bosbase.realtime.core.RealtimeException;
import io.bosbase.realtime.core.Urls;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * Topic-based message bus over a WebSocket at {@code /api/pubsub}.
 *
 * <p>The connection is opened lazily by the first operation and closed again once the last topic is left.
 * Publishes, pings and subscribes are acknowledged by the server; an acknowledgement that does not arrive within
 * the configured ack timeout fails with {@link RealtimeException.AckTimeout}.
 *
 * <pre>{@code
 * Subscription sub = client.pubsub().subscribe("chat", msg -> System.out.println(msg.data())).join();
 * client.pubsub().publish("chat", Map.of("text", "hi")).join();
 * sub.unsubscribe();
 * }</pre>
 */
public final class PubSubClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PubSubClient.class);

    private final URI baseUrl;
    private final AuthStore authStore;
    private final EnvelopeCodec codec;
    private final SubscriptionRegistry<PubSubMessage> registry = new SubscriptionRegistry<>();
    private final PendingRequests<Envelope> pending;
    private final ConnectionManager<String> connection;
    private final List<Consumer<List<String>>> disconnectListeners = new CopyOnWriteArrayList<>();
    // topics subscribed on the current connection, with the acknowledgement of their subscribe command
    private final Map<String, CompletableFuture<Void>> serverTopics = new ConcurrentHashMap<>();

    public PubSubClient(URI baseUrl,
                        AuthStore authStore,
                        FrameTransport<String> transport,
                        EnvelopeCodec codec,
                        RealtimeSettings settings,
                        ScheduledExecutorService scheduler) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.authStore = Objects.requireNonNull(authStore, "authStore");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.pending = new PendingRequests<>(scheduler, settings.ackTimeout());
        this.connection = new ConnectionManager<>("pubsub", transport, this::target,
                registry, pending, settings, scheduler, new Dispatcher());
    }

    /**
     * Publishes {@code data} to {@code topic}.
     *
     * @throws RealtimeException.Validation if the topic is blank or the data cannot be encoded
     */
    public CompletableFuture<PublishAck> publish(String topic, Object data) {
        requireTopic(topic);
        String requestId = nextRequestId();
        String frame = codec.encode(Envelope.publish(topic, data, requestId));
        return exchange(requestId, frame).thenApply(ack -> PublishAck.from(ack, topic));
    }

    /**
     * Adds a listener for {@code topic}. The first listener of a topic makes the client subscribe on the server.
     *
     * <p>The returned future completes once the subscription has been sent; the server's confirmation is exposed
     * separately through {@link Subscription#acknowledged()}.
     */
    public CompletableFuture<Subscription> subscribe(String topic, Consumer<PubSubMessage> listener) {
        requireTopic(topic);
        Objects.requireNonNull(listener, "listener");

        UUID id = UUID.randomUUID();
        boolean first = registry.addListener(topic, id, listener);
        CompletableFuture<Void> ack = first ? new CompletableFuture<>() : CompletableFuture.completedFuture(null);
        Subscription subscription = new Subscription(topic, () -> removeListener(topic, id), ack);

        return connection.ensureConnected()
                .thenCompose(clientId -> first ? join(topic, ack) : CompletableFuture.<Void>completedFuture(null))
                .handle((v, e) -> {
                    if (e == null) return subscription;
                    if (registry.removeListener(topic, id).topicRemoved()) {
                        serverTopics.remove(topic, ack);
                        if (!registry.hasActiveTopics()) connection.disconnect();
                    }
                    ack.completeExceptionally(unwrap(e));
                    throw new CompletionException(unwrap(e));
                });
    }

    /**
     * Leaves {@code topic}, dropping all of its listeners, or every topic when {@code topic} is {@code null}.
     * The connection is closed once no topic remains.
     */
    public CompletableFuture<Void> unsubscribe(String topic) {
        if (topic == null) {
            List<String> removed = registry.clear();
            serverTopics.clear();
            if (removed.isEmpty() || !connection.isReady()) {
                connection.disconnect();
                return CompletableFuture.completedFuture(null);
            }
            return connection.send(codec.encode(Envelope.unsubscribe(null, null)))
                    .handle((v, e) -> {
                        if (e != null) log.debug("Unsubscribe-all was not delivered: {}", unwrap(e).getMessage());
                        connection.disconnect();
                        return null;
                    });
        }

        requireTopic(topic);
        if (!registry.isActive(topic)) {
            return CompletableFuture.completedFuture(null);
        }
        registry.removeTopic(topic);
        return leave(topic);
    }

    /**
     * Sends a ping; completes when the matching pong arrives.
     */
    public CompletableFuture<Void> ping() {
        String requestId = nextRequestId();
        return exchange(requestId, codec.encode(Envelope.ping(requestId))).thenApply(pong -> null);
    }

    /**
     * Registers a callback invoked with the dropped topics when the connection is lost for good.
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

    /**
     * @return the id assigned by the server in its ready frame, or {@code null} while not connected
     */
    public String clientId() {
        return connection.clientId();
    }

    public List<String> activeTopics() {
        return registry.activeTopics();
    }

    /**
     * Closes the connection without touching registered listeners.
     */
    public void disconnect() {
        connection.disconnect();
    }

    @Override
    public void close() {
        registry.clear();
        connection.disconnect();
    }

    private CompletableFuture<Void> removeListener(String topic, UUID id) {
        SubscriptionRegistry.Removal removal = registry.removeListener(topic, id);
        if (!removal.topicRemoved()) {
            return CompletableFuture.completedFuture(null);
        }
        return leave(topic);
    }

    private CompletableFuture<Void> leave(String topic) {
        serverTopics.remove(topic);
        if (!connection.isReady()) {
            if (!registry.hasActiveTopics()) connection.disconnect();
            return CompletableFuture.completedFuture(null);
        }
        String requestId = nextRequestId();
        String frame = codec.encode(Envelope.unsubscribe(topic, requestId));
        return sendTracked(requestId, frame, new CompletableFuture<>())
                .handle((v, e) -> {
                    if (e != null) log.debug("Unsubscribe from {} was not delivered: {}", topic, unwrap(e).getMessage());
                    if (!registry.hasActiveTopics()) connection.disconnect();
                    return null;
                });
    }

    private CompletableFuture<Envelope> exchange(String requestId, String frame) {
        return connection.ensureConnected().thenCompose(clientId -> {
            CompletableFuture<Envelope> reply = pending.register(requestId);
            connection.send(frame).whenComplete((v, e) -> {
                if (e != null) pending.reject(requestId, unwrap(e));
            });
            return reply;
        });
    }

    /**
     * Sends a command whose acknowledgement is reported to {@code ack} instead of the caller.
     *
     * @return a future completed once the frame was written
     */
    private CompletableFuture<Void> sendTracked(String requestId, String frame, CompletableFuture<Void> ack) {
        CompletableFuture<Envelope> reply = pending.register(requestId);
        reply.whenComplete((r, e) -> {
            if (e == null) {
                ack.complete(null);
                return;
            }
            Throwable cause = unwrap(e);
            if (cause instanceof RealtimeException.ConnectionFailure) {
                log.debug("Acknowledgement of {} lost: {}", requestId, cause.getMessage());
            } else {
                log.warn("Pubsub command {} was not acknowledged: {}", requestId, cause.getMessage());
            }
            ack.completeExceptionally(cause);
        });
        CompletableFuture<Void> written = connection.send(frame);
        written.whenComplete((v, e) -> {
            if (e != null) pending.reject(requestId, unwrap(e));
        });
        return written;
    }

    /**
     * Subscribes {@code topic} on the current connection unless that already happened, in which case {@code ack}
     * follows the earlier subscribe command.
     */
    private CompletableFuture<Void> join(String topic, CompletableFuture<Void> ack) {
        CompletableFuture<Void> sent = serverTopics.putIfAbsent(topic, ack);
        if (sent != null) {
            sent.whenComplete((v, e) -> {
                if (e == null) ack.complete(null);
                else ack.completeExceptionally(e);
            });
            return CompletableFuture.completedFuture(null);
        }
        String requestId = nextRequestId();
        return sendTracked(requestId, codec.encode(Envelope.subscribe(topic, requestId)), ack)
                .whenComplete((v, e) -> {
                    if (e != null) serverTopics.remove(topic, ack);
                });
    }

    private void subscribeActiveTopics() {
        List<String> topics = registry.activeTopics();
        if (!topics.isEmpty()) log.debug("Subscribing {} on the new pubsub connection", topics);
        for (String topic : topics) {
            join(topic, new CompletableFuture<>());
        }
    }

    private ConnectionTarget target() {
        URI endpoint = Urls.toWebSocket(Urls.resolve(baseUrl, Protocol.PATH_PUBSUB));
        String token = authStore.token();
        if (token != null && !token.isEmpty()) {
            endpoint = Urls.withQuery(endpoint, Map.of(Protocol.Q_TOKEN, token));
        }
        return new ConnectionTarget(endpoint, Map.of());
    }

    private static void requireTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new RealtimeException.Validation("topic must be set.");
        }
    }

    private static String nextRequestId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    private static Throwable unwrap(Throwable e) {
        Throwable t = e;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private final class Dispatcher implements ConnectionManager.Listener<String> {

        @Override
        public void onFrame(String text) {
            Envelope envelope = codec.decode(text).orElse(null);
            if (envelope == null) return;

            switch (envelope.type()) {
                case READY -> {
                    String id = envelope.clientId() != null ? envelope.clientId() : envelope.id();
                    connection.markReady(id == null ? "" : id);
                }
                case MESSAGE -> {
                    if (envelope.topic() == null) return;
                    PubSubMessage message = new PubSubMessage(
                            envelope.id() == null ? "" : envelope.id(),
                            envelope.topic(),
                            envelope.created() == null ? "" : envelope.created(),
                            envelope.data());
                    if (registry.fanOut(envelope.topic(), message) == 0) {
                        log.debug("Dropping message for topic {} without listeners", envelope.topic());
                    }
                }
                case PUBLISHED, SUBSCRIBED, UNSUBSCRIBED, PONG -> {
                    if (envelope.requestId() != null) pending.resolve(envelope.requestId(), envelope);
                }
                case ERROR -> {
                    String message = envelope.message() != null ? envelope.message() : "pubsub error";
                    if (envelope.requestId() == null || !pending.reject(envelope.requestId(),
                            new RealtimeException.ServerError(envelope.requestId(), message))) {
                        log.warn("Pubsub server error: {}", message);
                    }
                }
                default -> log.debug("Ignoring {} frame", envelope.type().wireName());
            }
        }

        @Override
        public void onReady(String clientId, boolean reconnected) {
            subscribeActiveTopics();
        }

        @Override
        public void onClosed() {
            serverTopics.clear();
        }

        @Override
        public void onGiveUp(RealtimeException cause) {
            List<String> dropped = registry.clear();
            log.warn("Pubsub connection lost, dropping topics {}", dropped);
            for (Consumer<List<String>> callback : disconnectListeners) {
                try {
                    callback.accept(dropped);
                } catch (RuntimeException e) {
                    log.error("Error in pubsub disconnect callback", e);
                }
            }
        }
    }
}
