package io.bosbase.realtime.http.spi;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A request for an {@link HttpClientAdapter}.
 *
 * @param headers header values by name; later values replace earlier ones
 * @param body raw body, or {@code null} for none
 * @param timeout time allowed for the whole exchange, or {@code null} to use the adapter's default.
 *                Streaming requests apply it to obtaining the response, never to reading the body.
 */
public record HttpClientRequest(URI uri, String method, Map<String, String> headers, byte[] body, Duration timeout) {

    public HttpClientRequest {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(method, "method");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
    }

    public static Builder builder(URI uri, String method) {
        return new Builder(uri, method);
    }

    public static Builder get(URI uri) {
        return new Builder(uri, "GET");
    }

    public static final class Builder {
        private final URI uri;
        private final String method;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        private Duration timeout;

        private Builder(URI uri, String method) {
            this.uri = uri;
            this.method = method;
        }

        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> values) {
            if (values != null) headers.putAll(values);
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public HttpClientRequest build() {
            return new HttpClientRequest(uri, method, headers, body, timeout);
        }
    }
}
