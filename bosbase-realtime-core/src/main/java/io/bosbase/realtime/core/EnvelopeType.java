package io.bosbase.realtime.core;

import java.util.Locale;
import java.util.Optional;

/**
 * Discriminator of pub/sub envelopes, as carried in the {@code type} field.
 */
public enum EnvelopeType {
    // server -> client
    READY,
    MESSAGE,
    PUBLISHED,
    SUBSCRIBED,
    UNSUBSCRIBED,
    PONG,
    ERROR,
    // client -> server
    PUBLISH,
    SUBSCRIBE,
    UNSUBSCRIBE,
    PING;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether an envelope of this type completes a pending request.
     */
    public boolean isAck() {
        return this == PUBLISHED || this == SUBSCRIBED || this == UNSUBSCRIBED || this == PONG;
    }

    /**
     * Maps a wire name to a type; unknown names are reported as empty so newer servers stay compatible.
     */
    public static Optional<EnvelopeType> fromWire(String value) {
        if (value == null || value.isEmpty()) return Optional.empty();
        for (EnvelopeType t : values()) {
            if (t.wireName().equals(value)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
