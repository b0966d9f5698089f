package io.bosbase.realtime.client;

import io.bosbase.realtime.core.TopicKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Topic keys and their listeners.
 *
 * <p>A key is present only while it has at least one listener. Listeners are invoked outside the monitor,
 * in registration order.
 *
 * @param <M> the message type delivered to listeners
 */
public final class SubscriptionRegistry<M> {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    /**
     * Outcome of {@link #removeListener}.
     *
     * @param topicRemoved whether the last listener of the key was removed
     * @param remainingListeners listeners left across all keys
     */
    public record Removal(boolean topicRemoved, int remainingListeners) {}

    private final Map<String, Map<UUID, Consumer<? super M>>> topics = new LinkedHashMap<>();
    private int listenerCount;

    /**
     * @return {@code true} if this is the first listener of the key
     */
    public synchronized boolean addListener(String key, UUID id, Consumer<? super M> listener) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(listener, "listener");
        Map<UUID, Consumer<? super M>> listeners = topics.computeIfAbsent(key, k -> new LinkedHashMap<>());
        boolean first = listeners.isEmpty();
        if (listeners.put(id, listener) == null) listenerCount++;
        return first;
    }

    public synchronized Removal removeListener(String key, UUID id) {
        Map<UUID, Consumer<? super M>> listeners = topics.get(key);
        if (listeners == null) return new Removal(false, listenerCount);
        if (listeners.remove(id) != null) listenerCount--;
        if (!listeners.isEmpty()) return new Removal(false, listenerCount);
        topics.remove(key);
        return new Removal(true, listenerCount);
    }

    /**
     * Removes {@code topic} and every key derived from it by subscription options.
     *
     * @return whether any key remains
     */
    public synchronized boolean removeTopic(String topic) {
        removeKeys(key -> TopicKeys.matchesTopic(key, topic));
        return !topics.isEmpty();
    }

    /**
     * @return whether any key remains
     */
    public synchronized boolean removeByPrefix(String prefix) {
        removeKeys(key -> key.startsWith(prefix));
        return !topics.isEmpty();
    }

    /**
     * @return the keys that were registered
     */
    public synchronized List<String> clear() {
        List<String> removed = new ArrayList<>(topics.keySet());
        topics.clear();
        listenerCount = 0;
        return removed;
    }

    public synchronized List<String> activeTopics() {
        return new ArrayList<>(topics.keySet());
    }

    public synchronized boolean hasActiveTopics() {
        return !topics.isEmpty();
    }

    public synchronized boolean isActive(String key) {
        return topics.containsKey(key);
    }

    public synchronized int listenerCount() {
        return listenerCount;
    }

    public synchronized int listenerCount(String key) {
        Map<UUID, Consumer<? super M>> listeners = topics.get(key);
        return listeners == null ? 0 : listeners.size();
    }

    /**
     * Delivers {@code message} to every listener of {@code key}. A failing listener is logged and skipped.
     *
     * @return the number of listeners invoked
     */
    public int fanOut(String key, M message) {
        List<Consumer<? super M>> targets;
        synchronized (this) {
            Map<UUID, Consumer<? super M>> listeners = topics.get(key);
            if (listeners == null) return 0;
            targets = new ArrayList<>(listeners.values());
        }
        for (Consumer<? super M> listener : targets) {
            try {
                listener.accept(message);
            } catch (RuntimeException e) {
                log.error("Listener for topic {} failed", key, e);
            }
        }
        return targets.size();
    }

    private void removeKeys(Predicate<String> match) {
        Iterator<Map.Entry<String, Map<UUID, Consumer<? super M>>>> it = topics.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Map<UUID, Consumer<? super M>>> entry = it.next();
            if (match.test(entry.getKey())) {
                listenerCount -= entry.getValue().size();
                it.remove();
            }
        }
    }
}
