package io.bosbase.realtime.client;

/**
 * Opens physical connections that carry frames of type {@code F}.
 *
 * <p>The pub/sub binding uses text frames over a WebSocket, the record-change binding uses events
 * of a line-oriented event stream. Reconnection and backoff are handled once, in {@link ConnectionManager},
 * on top of this abstraction.
 *
 * @param <F> the inbound frame type
 */
public interface FrameTransport<F> {

    /**
     * Opens a connection; blocks until it is established or fails.
     *
     * @throws Exception if the connection could not be established
     */
    FrameChannel<F> open(ConnectionTarget target) throws Exception;
}
