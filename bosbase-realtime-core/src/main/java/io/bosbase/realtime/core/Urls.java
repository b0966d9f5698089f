package io.bosbase.realtime.core;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Utility to build endpoint URLs with lexicographically sorted query parameter keys.
 */
public final class Urls {
    private Urls() {}

    public static URI withQuery(URI base, Map<String, String> params) {
        Objects.requireNonNull(base, "base");
        if (params == null || params.isEmpty()) return base;

        TreeMap<String, String> sorted = new TreeMap<>();
        for (Map.Entry<String, String> e : params.entrySet()) {
            if (e.getKey() != null && e.getValue() != null) sorted.put(e.getKey(), e.getValue());
        }
        if (sorted.isEmpty()) return base;

        StringBuilder sb = new StringBuilder(base.toString());
        sb.append(base.getRawQuery() == null ? "?" : "&");

        boolean first = true;
        for (Map.Entry<String, String> e : sorted.entrySet()) {
            if (!first) sb.append("&");
            first = false;
            sb.append(encode(e.getKey())).append("=").append(encode(e.getValue()));
        }
        return URI.create(sb.toString());
    }

    /**
     * Appends {@code path} to the base URL, collapsing the slash between them.
     */
    public static URI resolve(URI base, String path) {
        Objects.requireNonNull(base, "base");
        String b = base.toString();
        while (b.endsWith("/")) b = b.substring(0, b.length() - 1);
        if (path == null || path.isEmpty()) return URI.create(b);
        return URI.create(path.startsWith("/") ? b + path : b + "/" + path);
    }

    /**
     * Maps {@code http}/{@code https} to {@code ws}/{@code wss}; other schemes are kept.
     */
    public static URI toWebSocket(URI uri) {
        Objects.requireNonNull(uri, "uri");
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        String target = switch (scheme) {
            case "https" -> "wss";
            case "http" -> "ws";
            default -> scheme;
        };
        if (target.equals(scheme)) return uri;
        return URI.create(target + uri.toString().substring(scheme.length()));
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
