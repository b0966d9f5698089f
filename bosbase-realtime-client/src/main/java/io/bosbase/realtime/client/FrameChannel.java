package io.bosbase.realtime.client;

import java.util.concurrent.CompletableFuture;

/**
 * An open physical connection.
 *
 * <p>{@link #receive()} is called from a single thread; {@link #send(String)} and {@link #close()}
 * may be called from any thread.
 *
 * @param <F> the inbound frame type
 */
public interface FrameChannel<F> extends AutoCloseable {

    /**
     * Writes one outbound text frame.
     *
     * @return a future completed once the frame was handed to the network
     */
    CompletableFuture<Void> send(String text);

    /**
     * Blocks until the next inbound frame arrives.
     *
     * @return the frame, or {@code null} once the connection has been closed
     * @throws Exception if the connection failed
     */
    F receive() throws Exception;

    /**
     * Closes the connection; a blocked {@link #receive()} returns {@code null}. Idempotent.
     */
    @Override
    void close();
}
