package io.bosbase.realtime.core;

import io.bosbase.realtime.json.spi.JsonCodec;
import io.bosbase.realtime.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts envelopes to and from their JSON text frames.
 */
public final class EnvelopeCodec {
    private static final Logger log = LoggerFactory.getLogger(EnvelopeCodec.class);

    private final JsonCodec json;

    public EnvelopeCodec(JsonCodec json) {
        this.json = Objects.requireNonNull(json, "json");
    }

    public JsonCodec json() {
        return json;
    }

    /**
     * Serializes an outbound command.
     *
     * @throws RealtimeException.Validation if the payload cannot be represented as JSON
     */
    public String encode(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        try {
            return json.writeString(envelope.toMap());
        } catch (JsonException e) {
            throw new RealtimeException.Validation("Unable to encode " + envelope.type().wireName() + " frame", e);
        }
    }

    /**
     * Parses an inbound frame.
     *
     * @return the envelope, or empty if the frame is not a JSON object or its type is unknown
     */
    public Optional<Envelope> decode(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        Map<String, Object> fields;
        try {
            fields = json.readObject(text);
        } catch (JsonException e) {
            log.debug("Ignoring malformed frame {}: {}", e.excerpt(), e.getMessage());
            return Optional.empty();
        }

        Optional<EnvelopeType> type = EnvelopeType.fromWire(string(fields.get(Protocol.F_TYPE)));
        if (type.isEmpty()) {
            log.debug("Ignoring frame with unknown type {}", fields.get(Protocol.F_TYPE));
            return Optional.empty();
        }

        return Optional.of(new Envelope(
                type.get(),
                string(fields.get(Protocol.F_ID)),
                string(fields.get(Protocol.F_TOPIC)),
                string(fields.get(Protocol.F_CREATED)),
                string(fields.get(Protocol.F_REQUEST_ID)),
                string(fields.get(Protocol.F_CLIENT_ID)),
                string(fields.get(Protocol.F_MESSAGE)),
                fields.get(Protocol.F_DATA)
        ));
    }

    private static String string(Object value) {
        if (value == null) return null;
        if (value instanceof String s) return s;
        if (value instanceof Map || value instanceof Iterable) return null;
        return String.valueOf(value);
    }
}
