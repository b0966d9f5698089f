package io.bosbase.realtime.http.spi;

import java.io.InputStream;
import java.util.Optional;

/**
 * Represents an HTTP response from an {@link HttpClientAdapter}.
 *
 * <p>Either {@link #body()} or {@link #bodyAsStream()} returns the content, depending on
 * whether the request was sent with {@link HttpClientAdapter#send} or {@link HttpClientAdapter#sendStreaming}.
 */
public interface HttpClientResponse {

    /**
     * @return the status code (e.g., 200, 404, 500)
     */
    int statusCode();

    /**
     * @param name the header name (case-insensitive)
     * @return the first header value, or empty if not present
     */
    Optional<String> header(String name);

    /**
     * @return the body bytes, or null for streaming responses
     */
    byte[] body();

    /**
     * @return the body stream, or null for buffered responses
     */
    InputStream bodyAsStream();

    default boolean isSuccessful() {
        return statusCode() >= 200 && statusCode() < 300;
    }
}
