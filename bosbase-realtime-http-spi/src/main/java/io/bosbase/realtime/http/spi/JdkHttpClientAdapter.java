package io.bosbase.realtime.http.spi;

import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link HttpClientAdapter} implementation using the JDK HttpClient.
 * This is the default implementation when no other HTTP client library is configured.
 */
public final class JdkHttpClientAdapter implements HttpClientAdapter {

    private final HttpClient httpClient;

    public JdkHttpClientAdapter(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static JdkHttpClientAdapter create() {
        return new JdkHttpClientAdapter(HttpClient.newHttpClient());
    }

    public static JdkHttpClientAdapter create(HttpClient httpClient) {
        return new JdkHttpClientAdapter(httpClient);
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        try {
            HttpResponse<byte[]> response = httpClient.send(toJdkRequest(request), HttpResponse.BodyHandlers.ofByteArray());
            return new JdkResponse<>(response, response.body(), null);
        } catch (java.net.http.HttpTimeoutException e) {
            throw new HttpTimeoutException(request.uri(), request.timeout(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpClientException("Request interrupted", e);
        } catch (Exception e) {
            throw new HttpClientException(e);
        }
    }

    @Override
    public HttpClientResponse sendStreaming(HttpClientRequest request) throws HttpClientException {
        try {
            HttpResponse<InputStream> response = httpClient.send(toJdkRequest(request), HttpResponse.BodyHandlers.ofInputStream());
            return new JdkResponse<>(response, null, response.body());
        } catch (java.net.http.HttpTimeoutException e) {
            throw new HttpTimeoutException(request.uri(), request.timeout(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpClientException("Request interrupted", e);
        } catch (Exception e) {
            throw new HttpClientException(e);
        }
    }

    private static HttpRequest toJdkRequest(HttpClientRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri());

        HttpRequest.BodyPublisher bodyPublisher = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());

        builder.method(request.method(), bodyPublisher);
        request.headers().forEach(builder::header);

        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }

        return builder.build();
    }

    private static final class JdkResponse<T> implements HttpClientResponse {
        private final HttpResponse<T> response;
        private final byte[] bytes;
        private final InputStream stream;

        JdkResponse(HttpResponse<T> response, byte[] bytes, InputStream stream) {
            this.response = response;
            this.bytes = bytes;
            this.stream = stream;
        }

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public Optional<String> header(String name) {
            return response.headers().firstValue(name);
        }

        @Override
        public byte[] body() {
            return bytes;
        }

        @Override
        public InputStream bodyAsStream() {
            return stream;
        }
    }
}
