package io.bosbase.realtime.client;

import io.bosbase.realtime.core.BackoffPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Engine tuning shared by both bindings.
 *
 * @param ackTimeout how long a command waits for its acknowledgement
 * @param handshakeTimeout how long a connection attempt may take to become ready
 * @param backoff delays between reconnection attempts
 * @param maxReconnectAttempts reconnection attempts before giving up
 * @param lang value of the {@code Accept-Language} header
 */
public record RealtimeSettings(
        Duration ackTimeout,
        Duration handshakeTimeout,
        BackoffPolicy backoff,
        int maxReconnectAttempts,
        String lang
) {
    public static final Duration DEFAULT_ACK_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_HANDSHAKE_TIMEOUT = Duration.ofSeconds(15);
    public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 5;
    public static final String DEFAULT_LANG = "en-US";

    public RealtimeSettings {
        Objects.requireNonNull(ackTimeout, "ackTimeout");
        Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");
        Objects.requireNonNull(backoff, "backoff");
        if (ackTimeout.isNegative() || ackTimeout.isZero()) {
            throw new IllegalArgumentException("ackTimeout must be positive");
        }
        if (handshakeTimeout.isNegative() || handshakeTimeout.isZero()) {
            throw new IllegalArgumentException("handshakeTimeout must be positive");
        }
        if (maxReconnectAttempts < 0) {
            throw new IllegalArgumentException("maxReconnectAttempts must be >= 0");
        }
    }

    public static RealtimeSettings defaults() {
        return new RealtimeSettings(DEFAULT_ACK_TIMEOUT, DEFAULT_HANDSHAKE_TIMEOUT,
                BackoffPolicy.defaults(), DEFAULT_MAX_RECONNECT_ATTEMPTS, DEFAULT_LANG);
    }
}
