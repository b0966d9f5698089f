package io.bosbase.realtime.client;

import io.bosbase.realtime.core.RealtimeException;
import io.bosbase.realtime.http.spi.HttpTimeoutException;

import java.net.URI;
import java.util.Map;

/**
 * Failure of an HTTP API call: either a status code of 400 or above, or a transport error (status 0).
 */
public class ClientResponseException extends RealtimeException {

    private static final String DEFAULT_MESSAGE = "Something went wrong while processing your request.";

    private final URI url;
    private final int status;
    private final Map<String, Object> response;

    public ClientResponseException(URI url, int status, Map<String, Object> response) {
        this(url, status, response, null);
    }

    public ClientResponseException(URI url, int status, Map<String, Object> response, Throwable cause) {
        super(messageOf(response, cause), cause);
        this.url = url;
        this.status = status;
        this.response = response == null ? Map.of() : response;
    }

    public URI url() {
        return url;
    }

    /**
     * @return the HTTP status, or 0 when no response was received
     */
    public int status() {
        return status;
    }

    public Map<String, Object> response() {
        return response;
    }

    public boolean isAbort() {
        return getCause() instanceof InterruptedException;
    }

    /**
     * @return whether the server did not answer within the request timeout
     */
    public boolean isTimeout() {
        return getCause() instanceof HttpTimeoutException;
    }

    private static String messageOf(Map<String, Object> response, Throwable cause) {
        if (response != null && response.get("message") instanceof String m && !m.isEmpty()) {
            return m;
        }
        if (cause != null && cause.getMessage() != null) {
            return cause.getMessage();
        }
        return DEFAULT_MESSAGE;
    }
}
