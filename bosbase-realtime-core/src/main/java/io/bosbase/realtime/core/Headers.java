package io.bosbase.realtime.core;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal helpers for case-insensitive header lookup.
 */
public final class Headers {
    private Headers() {}

    public static Optional<String> firstValue(Map<String, String> headers, String name) {
        if (headers == null || name == null) return Optional.empty();
        String target = name.toLowerCase(Locale.ROOT);

        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey() == null) continue;
            if (e.getKey().toLowerCase(Locale.ROOT).equals(target)) {
                return Optional.ofNullable(e.getValue());
            }
        }
        return Optional.empty();
    }

    public static boolean contains(Map<String, String> headers, String name) {
        return firstValue(headers, name).isPresent();
    }
}
