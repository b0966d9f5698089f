package io.bosbase.realtime.client;

import io.bosbase.realtime.core.Headers;
import io.bosbase.realtime.core.Protocol;
import io.bosbase.realtime.core.Urls;
import io.bosbase.realtime.http.spi.HttpClientAdapter;
import io.bosbase.realtime.http.spi.HttpClientException;
import io.bosbase.realtime.http.spi.HttpClientRequest;
import io.bosbase.realtime.http.spi.HttpClientResponse;
import io.bosbase.realtime.http.spi.HttpTimeoutException;
import io.bosbase.realtime.json.spi.JsonCodec;
import io.bosbase.realtime.json.spi.JsonException;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ApiRequester} over an {@link HttpClientAdapter}.
 *
 * <p>Adds {@code Accept-Language} and, while the {@link AuthStore} holds a token, {@code Authorization}
 * unless the caller supplied them.
 */
public final class HttpApiRequester implements ApiRequester {

    private final URI baseUrl;
    private final HttpClientAdapter http;
    private final JsonCodec json;
    private final AuthStore authStore;
    private final String lang;
    private final Duration timeout;

    public HttpApiRequester(URI baseUrl, HttpClientAdapter http, JsonCodec json, AuthStore authStore, String lang, Duration timeout) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.http = Objects.requireNonNull(http, "http");
        this.json = Objects.requireNonNull(json, "json");
        this.authStore = Objects.requireNonNull(authStore, "authStore");
        this.lang = lang;
        this.timeout = timeout;
    }

    @Override
    public Object send(String path, String method, Map<String, String> query, Map<String, String> headers, Object body) {
        URI url = Urls.withQuery(Urls.resolve(baseUrl, path), query);

        Map<String, String> h = new LinkedHashMap<>();
        if (headers != null) h.putAll(headers);
        if (lang != null && !Headers.contains(h, Protocol.H_ACCEPT_LANGUAGE)) {
            h.put(Protocol.H_ACCEPT_LANGUAGE, lang);
        }
        if (authStore.isValid() && !Headers.contains(h, Protocol.H_AUTHORIZATION)) {
            h.put(Protocol.H_AUTHORIZATION, authStore.token());
        }

        byte[] payload = null;
        if (body != null) {
            try {
                payload = json.writeBytes(body);
            } catch (JsonException e) {
                throw new ClientResponseException(url, 0, null, e);
            }
            if (!Headers.contains(h, Protocol.H_CONTENT_TYPE)) {
                h.put(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON);
            }
        }

        HttpClientRequest request = HttpClientRequest.builder(url, method)
                .headers(h)
                .body(payload)
                .timeout(timeout)
                .build();

        HttpClientResponse response;
        try {
            response = http.send(request);
        } catch (HttpTimeoutException e) {
            throw new ClientResponseException(url, 0, null, e);
        } catch (HttpClientException e) {
            throw new ClientResponseException(url, 0, null, e.getCause() != null ? e.getCause() : e);
        }

        Object decoded = decode(url, response);
        if (response.statusCode() >= 400) {
            throw new ClientResponseException(url, response.statusCode(), asMap(decoded));
        }
        return decoded;
    }

    private Object decode(URI url, HttpClientResponse response) {
        byte[] bytes = response.body();
        if (bytes == null || bytes.length == 0) return null;
        if (new String(bytes, StandardCharsets.UTF_8).isBlank()) return null;
        try {
            return json.readValue(bytes, Object.class);
        } catch (JsonException e) {
            if (response.statusCode() >= 400) return null;
            throw new ClientResponseException(url, response.statusCode(), null, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object decoded) {
        return decoded instanceof Map ? (Map<String, Object>) decoded : null;
    }
}
