package io.bosbase.realtime.client;

import io.bosbase.realtime.core.RealtimeException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Table of commands waiting for their acknowledgement, keyed by request id.
 *
 * <p>An entry is removed by whichever comes first: {@link #resolve}, {@link #reject}, {@link #rejectAll},
 * the ack timeout, or cancellation of the returned future. Futures are always completed outside the monitor.
 *
 * @param <T> the acknowledgement payload
 */
public final class PendingRequests<T> {

    private record Entry<T>(CompletableFuture<T> future, ScheduledFuture<?> timer) {}

    private final ScheduledExecutorService scheduler;
    private final Duration timeout;
    private final Map<String, Entry<T>> entries = new HashMap<>();

    public PendingRequests(ScheduledExecutorService scheduler, Duration timeout) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /**
     * Starts waiting for the acknowledgement of {@code requestId}.
     *
     * @throws IllegalStateException if the id is already pending
     */
    public CompletableFuture<T> register(String requestId) {
        Objects.requireNonNull(requestId, "requestId");
        CompletableFuture<T> future = new CompletableFuture<>();
        synchronized (this) {
            if (entries.containsKey(requestId)) {
                throw new IllegalStateException("Request " + requestId + " is already pending");
            }
            ScheduledFuture<?> timer = scheduler.schedule(
                    () -> expire(requestId, future), timeout.toMillis(), TimeUnit.MILLISECONDS);
            entries.put(requestId, new Entry<>(future, timer));
        }
        future.whenComplete((v, e) -> {
            if (future.isCancelled()) discard(requestId, future);
        });
        return future;
    }

    public boolean resolve(String requestId, T payload) {
        Entry<T> entry = take(requestId);
        if (entry == null) return false;
        return entry.future().complete(payload);
    }

    public boolean reject(String requestId, Throwable failure) {
        Entry<T> entry = take(requestId);
        if (entry == null) return false;
        return entry.future().completeExceptionally(failure);
    }

    /**
     * Fails every pending request.
     *
     * @return the number of requests that were pending
     */
    public int rejectAll(Throwable failure) {
        List<Entry<T>> drained;
        synchronized (this) {
            drained = new ArrayList<>(entries.values());
            entries.clear();
        }
        for (Entry<T> entry : drained) {
            entry.timer().cancel(false);
            entry.future().completeExceptionally(failure);
        }
        return drained.size();
    }

    public synchronized boolean contains(String requestId) {
        return entries.containsKey(requestId);
    }

    public synchronized int size() {
        return entries.size();
    }

    private Entry<T> take(String requestId) {
        if (requestId == null) return null;
        Entry<T> entry;
        synchronized (this) {
            entry = entries.remove(requestId);
        }
        if (entry != null) entry.timer().cancel(false);
        return entry;
    }

    private void expire(String requestId, CompletableFuture<T> future) {
        synchronized (this) {
            Entry<T> entry = entries.get(requestId);
            if (entry == null || entry.future() != future) return;
            entries.remove(requestId);
        }
        future.completeExceptionally(
                new RealtimeException.AckTimeout(requestId, "Timed out waiting for pubsub response."));
    }

    private void discard(String requestId, CompletableFuture<T> future) {
        Entry<T> entry;
        synchronized (this) {
            entry = entries.get(requestId);
            if (entry == null || entry.future() != future) return;
            entries.remove(requestId);
        }
        entry.timer().cancel(false);
    }
}
