package io.bosbase.realtime.client;

import io.bosbase.realtime.core.RealtimeException;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * In-memory transport: each {@link #open} hands out a {@link Channel} the test drives directly.
 */
final class FakeTransport<F> implements FrameTransport<F> {

    final List<ConnectionTarget> targets = new CopyOnWriteArrayList<>();
    final AtomicInteger opens = new AtomicInteger();
    final AtomicInteger failures = new AtomicInteger();
    private final BlockingQueue<Channel<F>> opened = new LinkedBlockingQueue<>();

    @Override
    public FrameChannel<F> open(ConnectionTarget target) {
        targets.add(target);
        opens.incrementAndGet();
        if (failures.get() > 0) {
            failures.decrementAndGet();
            throw new RealtimeException.ConnectionFailure("connection refused");
        }
        Channel<F> channel = new Channel<>();
        opened.add(channel);
        return channel;
    }

    void failNextOpens(int count) {
        failures.set(count);
    }

    Channel<F> awaitChannel() throws InterruptedException {
        Channel<F> channel = opened.poll(5, TimeUnit.SECONDS);
        assertThat(channel).as("connection opened").isNotNull();
        return channel;
    }

    static final class Channel<F> implements FrameChannel<F> {
        private static final Object EOF = new Object();

        private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
        private final BlockingQueue<String> sent = new LinkedBlockingQueue<>();
        private volatile boolean closed;

        void push(F frame) {
            inbound.add(frame);
        }

        /**
         * Simulates the server closing the connection.
         */
        void drop() {
            inbound.add(EOF);
        }

        String awaitSent() throws InterruptedException {
            String frame = sent.poll(5, TimeUnit.SECONDS);
            assertThat(frame).as("frame sent").isNotNull();
            return frame;
        }

        String pollSent(long millis) throws InterruptedException {
            return sent.poll(millis, TimeUnit.MILLISECONDS);
        }

        boolean isClosed() {
            return closed;
        }

        @Override
        public CompletableFuture<Void> send(String text) {
            if (closed) {
                return CompletableFuture.failedFuture(new RealtimeException.ConnectionFailure("closed"));
            }
            sent.add(text);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        @SuppressWarnings("unchecked")
        public F receive() throws InterruptedException {
            Object item = inbound.take();
            if (item == EOF) {
                inbound.add(EOF);
                return null;
            }
            return (F) item;
        }

        @Override
        public void close() {
            closed = true;
            inbound.add(EOF);
        }
    }
}
