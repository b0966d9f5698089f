package io.bosbase.realtime.http.spi;

/**
 * Abstraction for HTTP client implementations.
 *
 * <p>The realtime client uses it for two things: plain JSON API calls (subscription submission)
 * and the long-lived event stream of record changes. Implementations exist for the JDK HttpClient
 * and OkHttp.
 *
 * <p>Implementations should be thread-safe and reusable.
 *
 * <p>Example usage:
 * <pre>{@code
 * HttpClientAdapter adapter = JdkHttpClientAdapter.create();
 * HttpClientRequest request = HttpClientRequest.get(URI.create("http://127.0.0.1:8090/api/health")).build();
 * HttpClientResponse response = adapter.send(request);
 * }</pre>
 */
public interface HttpClientAdapter {

    /**
     * Sends an HTTP request and returns the response with body as byte array.
     *
     * @param request the HTTP request to send
     * @return the HTTP response with body as bytes
     * @throws HttpClientException if the request fails
     * @throws HttpTimeoutException if the request times out
     */
    HttpClientResponse send(HttpClientRequest request) throws HttpClientException;

    /**
     * Sends an HTTP request and returns the response with body as a stream.
     *
     * <p>Use this method for event streams where the response is read incrementally.
     * The caller is responsible for closing the returned stream.
     *
     * @param request the HTTP request to send
     * @return the HTTP response with body as InputStream
     * @throws HttpClientException if the request fails
     * @throws HttpTimeoutException if the request times out
     */
    HttpClientResponse sendStreaming(HttpClientRequest request) throws HttpClientException;
}
