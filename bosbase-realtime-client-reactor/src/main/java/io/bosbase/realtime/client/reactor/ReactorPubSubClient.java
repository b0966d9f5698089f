package io.bosbase.realtime.client.reactor;

import io.bosbase.realtime.client.PubSubClient;
import io.bosbase.realtime.client.PubSubMessage;
import io.bosbase.realtime.client.PublishAck;
import io.bosbase.realtime.client.Subscription;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Reactor adapter over {@link PubSubClient}.
 */
public final class ReactorPubSubClient {

    private final PubSubClient delegate;

    public ReactorPubSubClient(PubSubClient delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public PubSubClient delegate() {
        return delegate;
    }

    public Mono<PublishAck> publish(String topic, Object data) {
        return Mono.defer(() -> Mono.fromFuture(delegate.publish(topic, data)));
    }

    public Mono<Void> ping() {
        return Mono.defer(() -> Mono.fromFuture(delegate.ping()));
    }

    /**
     * Messages of {@code topic}. Subscribing registers a listener, cancelling removes it.
     */
    public Flux<PubSubMessage> messages(String topic) {
        return Flux.create(sink -> {
            CompletableFuture<Subscription> subscription = delegate.subscribe(topic, sink::next);
            subscription.whenComplete((s, e) -> {
                if (e != null) sink.error(unwrap(e));
            });
            sink.onDispose(() -> subscription.thenAccept(Subscription::unsubscribe));
        }, FluxSink.OverflowStrategy.BUFFER);
    }

    static Throwable unwrap(Throwable e) {
        return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    }
}
