package io.bosbase.realtime.client;

import java.util.Map;

/**
 * The HTTP request primitive the realtime engine depends on.
 */
public interface ApiRequester {

    /**
     * Sends a JSON API request.
     *
     * @param path path relative to the base URL, e.g. {@code /api/realtime}
     * @param method HTTP method
     * @param query query parameters, may be empty
     * @param headers extra headers, may be empty
     * @param body request body to encode as JSON, or {@code null}
     * @return the decoded JSON response, or {@code null} for an empty body
     * @throws ClientResponseException if the server answers with an error status or the call fails
     */
    Object send(String path, String method, Map<String, String> query, Map<String, String> headers, Object body);
}
