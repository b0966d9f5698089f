package io.bosbase.realtime.http.spi;

import java.net.URI;
import java.time.Duration;

/**
 * The server did not answer {@link #uri()} within the request's timeout.
 */
public class HttpTimeoutException extends HttpClientException {

    private final URI uri;
    private final Duration timeout;

    public HttpTimeoutException(URI uri, Duration timeout, Throwable cause) {
        super(messageOf(uri, timeout), cause);
        this.uri = uri;
        this.timeout = timeout;
    }

    public URI uri() {
        return uri;
    }

    /**
     * @return the timeout that elapsed, or {@code null} if the client's own default applied
     */
    public Duration timeout() {
        return timeout;
    }

    private static String messageOf(URI uri, Duration timeout) {
        return timeout == null
                ? "Request to " + uri + " timed out"
                : "Request to " + uri + " timed out after " + timeout.toMillis() + " ms";
    }
}
