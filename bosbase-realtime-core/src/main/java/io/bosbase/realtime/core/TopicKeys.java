package io.bosbase.realtime.core;

import io.bosbase.realtime.json.spi.JsonCodec;
import io.bosbase.realtime.json.spi.JsonException;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Builds topic keys: a topic optionally suffixed with a stable encoding of its subscription options.
 *
 * <p>The suffix is {@code ?options=} (or {@code &options=} when the topic already has a query) followed by the
 * percent-encoded JSON object {@code {"query":{...},"headers":{...}}} with keys sorted. Only ASCII letters and
 * digits are left unescaped.
 */
public final class TopicKeys {
    private TopicKeys() {}

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    public static String of(String topic, SubscriptionOptions options, JsonCodec json) {
        Objects.requireNonNull(topic, "topic");
        if (options == null || options.isEmpty()) return topic;

        Map<String, Object> payload = new LinkedHashMap<>();
        if (!options.query().isEmpty()) payload.put("query", new TreeMap<>(options.query()));
        if (!options.headers().isEmpty()) payload.put("headers", new TreeMap<>(options.headers()));

        String encoded;
        try {
            encoded = json.writeString(payload);
        } catch (JsonException e) {
            throw new RealtimeException.Validation("Unable to encode subscription options for " + topic, e);
        }
        return topic + (topic.contains("?") ? "&" : "?") + Protocol.Q_OPTIONS + "=" + percentEncode(encoded);
    }

    /**
     * Returns the topic part of a key, i.e. everything before the first {@code ?}.
     */
    public static String baseTopic(String topicKey) {
        int q = topicKey.indexOf('?');
        return q < 0 ? topicKey : topicKey.substring(0, q);
    }

    /**
     * Whether {@code topicKey} is {@code topic} itself or one of its option variants.
     */
    public static boolean matchesTopic(String topicKey, String topic) {
        String normalized = topic.contains("?") ? topic : topic + "?";
        return (topicKey + "?").startsWith(normalized);
    }

    static String percentEncode(String s) {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(bytes.length * 3);
        for (byte b : bytes) {
            int c = b & 0xFF;
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) {
                sb.append((char) c);
            } else {
                sb.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
            }
        }
        return sb.toString();
    }
}
