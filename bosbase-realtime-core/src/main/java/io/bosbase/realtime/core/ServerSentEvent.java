package io.bosbase.realtime.core;

import java.util.Objects;

/**
 * One dispatched event of a line-oriented event stream.
 *
 * @param name the event name, {@code "message"} when the stream did not name it
 * @param data the {@code data} lines joined by {@code "\n"}, or {@code null} if none were sent
 * @param id the last {@code id} seen for this event, or {@code null}
 */
public record ServerSentEvent(String name, String data, String id) {
    public ServerSentEvent {
        Objects.requireNonNull(name, "name");
    }
}
