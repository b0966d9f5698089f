package io.bosbase.realtime.core;

/**
 * BosBase realtime protocol constants (paths, query keys, header names, well-known event names).
 *
 * <p>This module intentionally contains no HTTP or WebSocket bindings.
 */
public final class Protocol {
    private Protocol() {}

    // Endpoints
    public static final String PATH_PUBSUB = "/api/pubsub";
    public static final String PATH_REALTIME = "/api/realtime";

    // Query parameter keys
    public static final String Q_TOKEN = "token";
    public static final String Q_OPTIONS = "options";

    // Envelope fields
    public static final String F_TYPE = "type";
    public static final String F_ID = "id";
    public static final String F_TOPIC = "topic";
    public static final String F_CREATED = "created";
    public static final String F_REQUEST_ID = "requestId";
    public static final String F_CLIENT_ID = "clientId";
    public static final String F_MESSAGE = "message";
    public static final String F_DATA = "data";
    public static final String F_SUBSCRIPTIONS = "subscriptions";

    // Event stream
    public static final String EVENT_CONNECT = "PB_CONNECT";
    public static final String EVENT_DEFAULT = "message";

    // HTTP headers
    public static final String H_ACCEPT = "Accept";
    public static final String H_ACCEPT_LANGUAGE = "Accept-Language";
    public static final String H_AUTHORIZATION = "Authorization";
    public static final String H_CONTENT_TYPE = "Content-Type";

    // Content types
    public static final String CT_EVENT_STREAM = "text/event-stream";
    public static final String CT_JSON = "application/json";
}
