package io.bosbase.realtime.http.spi;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpClientAdapter} implementation using OkHttp.
 *
 * <p>Requires {@code com.squareup.okhttp3:okhttp} on the classpath.
 */
public final class OkHttpClientAdapter implements HttpClientAdapter {

    private final OkHttpClient httpClient;

    public OkHttpClientAdapter(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static OkHttpClientAdapter create() {
        return new OkHttpClientAdapter(new OkHttpClient());
    }

    public static OkHttpClientAdapter create(OkHttpClient httpClient) {
        return new OkHttpClientAdapter(httpClient);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        try (Response response = clientWithTimeout(request, false).newCall(toOkHttpRequest(request)).execute()) {
            ResponseBody body = response.body();
            return new OkResponse(response, body != null ? body.bytes() : null, null);
        } catch (InterruptedIOException e) {
            throw new HttpTimeoutException(request.uri(), request.timeout(), e);
        } catch (IOException e) {
            throw new HttpClientException(e);
        }
    }

    @Override
    public HttpClientResponse sendStreaming(HttpClientRequest request) throws HttpClientException {
        try {
            Response response = clientWithTimeout(request, true).newCall(toOkHttpRequest(request)).execute();
            ResponseBody body = response.body();
            return new OkResponse(response, null, body != null ? body.byteStream() : null);
        } catch (InterruptedIOException e) {
            throw new HttpTimeoutException(request.uri(), request.timeout(), e);
        } catch (IOException e) {
            throw new HttpClientException(e);
        }
    }

    /**
     * Event streams stay open indefinitely, so streaming calls never get a read timeout; their request
     * timeout bounds connecting only.
     */
    private OkHttpClient clientWithTimeout(HttpClientRequest request, boolean streaming) {
        if (streaming) {
            OkHttpClient.Builder builder = httpClient.newBuilder().readTimeout(0, TimeUnit.MILLISECONDS);
            if (request.timeout() != null) {
                builder.connectTimeout(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
            }
            return builder.build();
        }
        if (request.timeout() == null) {
            return httpClient;
        }
        long millis = request.timeout().toMillis();
        return httpClient.newBuilder()
                .readTimeout(millis, TimeUnit.MILLISECONDS)
                .writeTimeout(millis, TimeUnit.MILLISECONDS)
                .callTimeout(millis, TimeUnit.MILLISECONDS)
                .build();
    }

    private static Request toOkHttpRequest(HttpClientRequest request) {
        Request.Builder builder = new Request.Builder()
                .url(request.uri().toString());

        request.headers().forEach(builder::header);

        RequestBody body = null;
        if (request.body() != null) {
            String contentType = request.headers().get("Content-Type");
            MediaType mediaType = contentType != null ? MediaType.parse(contentType) : null;
            body = RequestBody.create(request.body(), mediaType);
        }

        switch (request.method()) {
            case "GET" -> builder.get();
            case "HEAD" -> builder.head();
            case "DELETE" -> { if (body != null) builder.delete(body); else builder.delete(); }
            case "POST" -> builder.post(body != null ? body : RequestBody.create(new byte[0], null));
            case "PUT" -> builder.put(body != null ? body : RequestBody.create(new byte[0], null));
            case "PATCH" -> builder.patch(body != null ? body : RequestBody.create(new byte[0], null));
            default -> builder.method(request.method(), body);
        }

        return builder.build();
    }

    private static final class OkResponse implements HttpClientResponse {
        private final Response response;
        private final byte[] bytes;
        private final InputStream stream;

        OkResponse(Response response, byte[] bytes, InputStream stream) {
            this.response = response;
            this.bytes = bytes;
            this.stream = stream;
        }

        @Override public int statusCode() { return response.code(); }
        @Override public Optional<String> header(String name) { return Optional.ofNullable(response.header(name)); }
        @Override public byte[] body() { return bytes; }
        @Override public InputStream bodyAsStream() { return stream; }
    }
}
