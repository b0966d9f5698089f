package io.bosbase.realtime.client;

import io.bosbase.realtime.core.ConnectionState;
import io.bosbase.realtime.core.RealtimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Owns one logical connection: establishment, handshake timeout, reconnection with backoff and teardown.
 *
 * <p>Each physical attempt gets its own daemon receive thread and a generation number; callbacks from a
 * superseded attempt are ignored. Frames are handed to the {@link Listener} on the receive thread, in wire order.
 * The binding signals the end of its handshake with {@link #markReady(String)}.
 *
 * @param <F> the inbound frame type of the transport
 */
public final class ConnectionManager<F> {
    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    /**
     * Callbacks from the manager to its binding.
     */
    public interface Listener<F> {

        void onFrame(F frame);

        /**
         * Called after the handshake, before connect waiters are released.
         *
         * @param reconnected whether this connection replaced a lost one
         */
        void onReady(String clientId, boolean reconnected);

        /**
         * Called when the physical connection goes away, before any later {@link #onReady}. Runs under the
         * manager's lock and must not block.
         */
        default void onClosed() {
        }

        /**
         * Called when reconnection attempts are exhausted.
         */
        void onGiveUp(RealtimeException cause);
    }

    private final String name;
    private final FrameTransport<F> transport;
    private final Supplier<ConnectionTarget> targets;
    private final SubscriptionRegistry<?> registry;
    private final PendingRequests<?> pending;
    private final RealtimeSettings settings;
    private final ScheduledExecutorService scheduler;
    private final Listener<F> listener;

    private final Object lock = new Object();
    private ConnectionState state = ConnectionState.DISCONNECTED;
    private FrameChannel<F> channel;
    private CompletableFuture<String> connectSignal;
    private ScheduledFuture<?> handshakeTimer;
    private ScheduledFuture<?> reconnectTimer;
    private String clientId;
    private int attempts;
    private boolean manualClose;
    private long generation;

    /**
     * @param name short label used in thread names and log lines
     * @param pending requests to fail when the connection goes away, or {@code null} if the binding has none
     */
    public ConnectionManager(String name,
                             FrameTransport<F> transport,
                             Supplier<ConnectionTarget> targets,
                             SubscriptionRegistry<?> registry,
                             PendingRequests<?> pending,
                             RealtimeSettings settings,
                             ScheduledExecutorService scheduler,
                             Listener<F> listener) {
        this.name = Objects.requireNonNull(name, "name");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.targets = Objects.requireNonNull(targets, "targets");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.pending = pending;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Returns a future completed with the client id once the connection is ready.
     *
     * <p>Starts a connection attempt when idle; joins the one in progress (or the scheduled reconnect) otherwise.
     */
    public CompletableFuture<String> ensureConnected() {
        synchronized (lock) {
            if (state == ConnectionState.READY) {
                return CompletableFuture.completedFuture(clientId);
            }
            if (connectSignal == null) {
                connectSignal = new CompletableFuture<>();
            }
            CompletableFuture<String> waiter = connectSignal.copy();
            if (state == ConnectionState.DISCONNECTED && reconnectTimer == null) {
                manualClose = false;
                startAttempt();
            }
            return waiter;
        }
    }

    /**
     * Completes the handshake of the current attempt. Ignored unless an attempt is in progress.
     */
    public void markReady(String id) {
        CompletableFuture<String> signal;
        boolean reconnected;
        synchronized (lock) {
            if (state != ConnectionState.CONNECTING) {
                log.debug("Ignoring {} handshake in state {}", name, state);
                return;
            }
            cancel(handshakeTimer);
            handshakeTimer = null;
            reconnected = attempts > 0;
            attempts = 0;
            state = ConnectionState.READY;
            clientId = id;
            signal = connectSignal;
            connectSignal = null;
        }
        log.info("{} connection ready (clientId={}, reconnected={})", name, id, reconnected);

        try {
            listener.onReady(id, reconnected);
        } catch (RuntimeException e) {
            log.error("Error in {} ready handler", name, e);
        }
        if (signal != null) signal.complete(id);
    }

    /**
     * Writes a frame once the connection is ready, connecting first if needed.
     */
    public CompletableFuture<Void> send(String frame) {
        return ensureConnected().thenCompose(id -> {
            FrameChannel<F> ch;
            synchronized (lock) {
                ch = state == ConnectionState.READY ? channel : null;
            }
            if (ch == null) {
                return CompletableFuture.failedFuture(new RealtimeException.ConnectionFailure(
                        "Unable to send " + name + " message - connection not ready."));
            }
            return ch.send(frame);
        });
    }

    /**
     * Closes the connection without reconnecting. Idempotent.
     */
    public void disconnect() {
        FrameChannel<F> ch;
        CompletableFuture<String> signal;
        synchronized (lock) {
            manualClose = true;
            generation++;
            cancel(handshakeTimer);
            cancel(reconnectTimer);
            handshakeTimer = null;
            reconnectTimer = null;
            ch = channel;
            channel = null;
            state = ConnectionState.DISCONNECTED;
            clientId = null;
            attempts = 0;
            signal = connectSignal;
            connectSignal = null;
            closed();
        }

        if (ch != null) {
            ch.close();
            log.info("{} connection closed", name);
        }
        RealtimeException failure = new RealtimeException.ConnectionFailure(name + " connection closed");
        if (pending != null) pending.rejectAll(failure);
        if (signal != null) signal.completeExceptionally(failure);
    }

    public ConnectionState state() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isReady() {
        return state() == ConnectionState.READY;
    }

    public String clientId() {
        synchronized (lock) {
            return clientId;
        }
    }

    // guarded by lock
    private void startAttempt() {
        long gen = ++generation;
        state = ConnectionState.CONNECTING;
        clientId = null;
        handshakeTimer = scheduler.schedule(() -> handshakeExpired(gen),
                settings.handshakeTimeout().toMillis(), TimeUnit.MILLISECONDS);

        Thread t = new Thread(() -> receiveLoop(gen), "bosbase-" + name + "-" + gen);
        t.setDaemon(true);
        t.start();
    }

    private void receiveLoop(long gen) {
        FrameChannel<F> ch;
        try {
            ch = transport.open(targets.get());
        } catch (Exception e) {
            connectionLost(gen, e);
            return;
        }

        boolean current;
        synchronized (lock) {
            current = gen == generation;
            if (current) channel = ch;
        }
        if (!current) {
            ch.close();
            return;
        }
        log.debug("{} connection opened, waiting for handshake", name);

        try {
            F frame;
            while ((frame = ch.receive()) != null) {
                if (!isCurrent(gen)) return;
                try {
                    listener.onFrame(frame);
                } catch (RuntimeException e) {
                    log.error("Error while handling {} frame", name, e);
                }
            }
            connectionLost(gen, null);
        } catch (Exception e) {
            connectionLost(gen, e);
        }
    }

    private boolean isCurrent(long gen) {
        synchronized (lock) {
            return gen == generation;
        }
    }

    private void handshakeExpired(long gen) {
        synchronized (lock) {
            if (gen != generation || state != ConnectionState.CONNECTING) return;
        }
        connectionLost(gen, new RealtimeException.HandshakeTimeout(name + " handshake took too long."));
    }

    private void connectionLost(long gen, Throwable cause) {
        RealtimeException failure = toFailure(cause);
        FrameChannel<F> ch;
        CompletableFuture<String> signal = null;
        boolean giveUp = false;
        Duration delay = null;
        synchronized (lock) {
            if (gen != generation) return;
            generation++;
            ch = channel;
            channel = null;
            cancel(handshakeTimer);
            handshakeTimer = null;
            state = ConnectionState.DISCONNECTED;
            clientId = null;
            closed();

            boolean active = registry.hasActiveTopics();
            if (!manualClose && active && attempts < settings.maxReconnectAttempts()) {
                delay = settings.backoff().delay(attempts);
                attempts++;
                long next = generation;
                reconnectTimer = scheduler.schedule(() -> reconnect(next), delay.toMillis(), TimeUnit.MILLISECONDS);
            } else {
                giveUp = !manualClose && active;
                attempts = 0;
                signal = connectSignal;
                connectSignal = null;
            }
        }

        if (ch != null) ch.close();
        if (pending != null) pending.rejectAll(failure);

        if (delay != null) {
            log.debug("{} connection lost ({}), reconnecting in {} ms", name, failure.getMessage(), delay.toMillis());
            return;
        }
        if (signal != null) signal.completeExceptionally(failure);
        if (giveUp) {
            log.info("{} connection lost and reconnect attempts exhausted", name);
            try {
                listener.onGiveUp(failure);
            } catch (RuntimeException e) {
                log.error("Error in {} disconnect handler", name, e);
            }
        } else {
            log.debug("{} connection ended: {}", name, failure.getMessage());
        }
    }

    private void reconnect(long gen) {
        synchronized (lock) {
            if (gen != generation || manualClose || state != ConnectionState.DISCONNECTED) return;
            reconnectTimer = null;
            startAttempt();
        }
    }

    // guarded by lock
    private void closed() {
        try {
            listener.onClosed();
        } catch (RuntimeException e) {
            log.error("Error in {} close handler", name, e);
        }
    }

    private RealtimeException toFailure(Throwable cause) {
        if (cause == null) {
            return new RealtimeException.ConnectionFailure(name + " connection closed");
        }
        if (cause instanceof RealtimeException re) {
            return re;
        }
        if (cause instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        return new RealtimeException.ConnectionFailure(name + " connection failed: " + cause.getMessage(), cause);
    }

    private static void cancel(ScheduledFuture<?> timer) {
        if (timer != null) timer.cancel(false);
    }
}
