package io.bosbase.realtime.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single frame exchanged over the pub/sub channel.
 *
 * <p>Every field except {@code type} is optional; which ones are present depends on the type.
 *
 * @param type the discriminator
 * @param id server-assigned message id (message, published)
 * @param topic the topic the frame refers to
 * @param created server timestamp of the message
 * @param requestId correlates acks and errors with the command that caused them
 * @param clientId server-assigned connection id (ready)
 * @param message human-readable error detail (error)
 * @param data arbitrary JSON payload
 */
public record Envelope(
        EnvelopeType type,
        String id,
        String topic,
        String created,
        String requestId,
        String clientId,
        String message,
        Object data
) {
    public Envelope {
        Objects.requireNonNull(type, "type");
    }

    public static Envelope publish(String topic, Object data, String requestId) {
        return new Envelope(EnvelopeType.PUBLISH, null, topic, null, requestId, null, null, data);
    }

    public static Envelope subscribe(String topic, String requestId) {
        return new Envelope(EnvelopeType.SUBSCRIBE, null, topic, null, requestId, null, null, null);
    }

    /**
     * @param topic the topic to leave, or {@code null} to leave every topic
     */
    public static Envelope unsubscribe(String topic, String requestId) {
        return new Envelope(EnvelopeType.UNSUBSCRIBE, null, topic, null, requestId, null, null, null);
    }

    public static Envelope ping(String requestId) {
        return new Envelope(EnvelopeType.PING, null, null, null, requestId, null, null, null);
    }

    /**
     * Returns the present fields as an insertion-ordered map, {@code type} first.
     *
     * <p>A publish command always carries {@code data}, even when it is {@code null}.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(Protocol.F_TYPE, type.wireName());
        putIfPresent(out, Protocol.F_ID, id);
        putIfPresent(out, Protocol.F_TOPIC, topic);
        putIfPresent(out, Protocol.F_CREATED, created);
        if (type == EnvelopeType.PUBLISH || data != null) {
            out.put(Protocol.F_DATA, data);
        }
        putIfPresent(out, Protocol.F_REQUEST_ID, requestId);
        putIfPresent(out, Protocol.F_CLIENT_ID, clientId);
        putIfPresent(out, Protocol.F_MESSAGE, message);
        return out;
    }

    private static void putIfPresent(Map<String, Object> out, String key, String value) {
        if (value != null) out.put(key, value);
    }
}
