package io.bosbase.realtime.core;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented event-stream parser.
 *
 * <p>Accumulates {@code field: value} lines ({@code event}, {@code data}, {@code id}) until a blank
 * line, then emits one {@link ServerSentEvent}. Lines starting with {@code :} are comments and
 * unknown fields are ignored. State resets after every dispatch.
 *
 * <p>Use {@link #next()} to pull events from a stream, or {@link #accept(String)} to push lines
 * that were framed elsewhere.
 */
public final class EventStreamParser implements AutoCloseable {

    private final BufferedReader in;

    private String event;
    private final List<String> data = new ArrayList<>();
    private String id;
    private boolean pending;

    /**
     * Creates a push-style parser; {@link #next()} is unavailable.
     */
    public EventStreamParser() {
        this.in = null;
    }

    /**
     * Creates a new parser reading from the given input stream.
     *
     * @param is the input stream to read from
     */
    public EventStreamParser(InputStream is) {
        this.in = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
    }

    /**
     * Reads the next event from the stream.
     *
     * <p>An event still being accumulated when the stream ends is dispatched.
     *
     * @return the next event, or {@code null} if EOF is reached
     * @throws IOException if an I/O error occurs
     */
    public ServerSentEvent next() throws IOException {
        if (in == null) throw new IllegalStateException("parser has no input stream");

        String line;
        while ((line = in.readLine()) != null) {
            ServerSentEvent ev = accept(line);
            if (ev != null) return ev;
        }
        return pending ? dispatch() : null;
    }

    /**
     * Feeds a single line (without its terminator).
     *
     * @return the completed event if {@code line} was blank and a field had been seen, otherwise {@code null}
     */
    public ServerSentEvent accept(String line) {
        if (line.isEmpty()) {
            return pending ? dispatch() : null;
        }
        if (line.startsWith(":")) {
            return null;
        }

        int colon = line.indexOf(':');
        String field = colon < 0 ? line : line.substring(0, colon);
        String value = colon < 0 ? "" : line.substring(colon + 1).trim();

        switch (field) {
            case "event" -> event = value;
            case "data" -> data.add(value);
            case "id" -> id = value;
            default -> {
                return null;
            }
        }
        pending = true;
        return null;
    }

    private ServerSentEvent dispatch() {
        String name = (event == null || event.isEmpty()) ? Protocol.EVENT_DEFAULT : event;
        String joined = data.isEmpty() ? null : String.join("\n", data);
        ServerSentEvent ev = new ServerSentEvent(name, joined, id);

        event = null;
        data.clear();
        id = null;
        pending = false;
        return ev;
    }

    @Override
    public void close() throws IOException {
        if (in != null) in.close();
    }
}
