package io.bosbase.realtime.client;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * Where and how to open a physical connection, computed fresh for every attempt.
 *
 * @param uri the endpoint
 * @param headers extra request headers (normalized to an empty map if null)
 */
public record ConnectionTarget(URI uri, Map<String, String> headers) {
    public ConnectionTarget {
        Objects.requireNonNull(uri, "uri");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
