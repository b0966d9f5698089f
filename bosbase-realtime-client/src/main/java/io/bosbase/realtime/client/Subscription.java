package io.bosbase.realtime.client;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Handle for one registered listener.
 *
 * <p>{@link #unsubscribe()} removes only this listener; the topic itself is left once its last listener goes.
 */
public final class Subscription implements AutoCloseable {

    private final String topicKey;
    private final Supplier<CompletableFuture<Void>> remover;
    private final CompletableFuture<Void> acknowledged;
    private final AtomicBoolean active = new AtomicBoolean(true);

    Subscription(String topicKey, Supplier<CompletableFuture<Void>> remover, CompletableFuture<Void> acknowledged) {
        this.topicKey = Objects.requireNonNull(topicKey, "topicKey");
        this.remover = Objects.requireNonNull(remover, "remover");
        this.acknowledged = Objects.requireNonNull(acknowledged, "acknowledged");
    }

    /**
     * The registry key, i.e. the topic plus its encoded options if any.
     */
    public String topicKey() {
        return topicKey;
    }

    /**
     * Completes when the server confirmed the subscription, or exceptionally if it refused it or never answered.
     * Listeners stay registered either way.
     */
    public CompletableFuture<Void> acknowledged() {
        return acknowledged;
    }

    public boolean isActive() {
        return active.get();
    }

    /**
     * Removes this listener. Calling it again does nothing.
     */
    public CompletableFuture<Void> unsubscribe() {
        if (!active.compareAndSet(true, false)) {
            return CompletableFuture.completedFuture(null);
        }
        return remover.get();
    }

    @Override
    public void close() {
        unsubscribe();
    }
}
