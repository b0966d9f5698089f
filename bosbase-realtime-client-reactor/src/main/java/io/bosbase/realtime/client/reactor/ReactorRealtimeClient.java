package io.bosbase.realtime.client.reactor;

import io.bosbase.realtime.client.RealtimeClient;
import io.bosbase.realtime.client.RealtimeMessage;
import io.bosbase.realtime.client.Subscription;
import io.bosbase.realtime.core.SubscriptionOptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Reactor adapter over {@link RealtimeClient}.
 */
public final class ReactorRealtimeClient {

    private final RealtimeClient delegate;

    public ReactorRealtimeClient(RealtimeClient delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public RealtimeClient delegate() {
        return delegate;
    }

    public Flux<RealtimeMessage> changes(String topic) {
        return changes(topic, SubscriptionOptions.none());
    }

    /**
     * Record changes of {@code topic}. Subscribing registers a listener, cancelling removes it.
     */
    public Flux<RealtimeMessage> changes(String topic, SubscriptionOptions options) {
        return Flux.create(sink -> {
            CompletableFuture<Subscription> subscription = delegate.subscribe(topic, options, sink::next);
            subscription.whenComplete((s, e) -> {
                if (e != null) sink.error(ReactorPubSubClient.unwrap(e));
            });
            sink.onDispose(() -> subscription.thenAccept(Subscription::unsubscribe));
        }, FluxSink.OverflowStrategy.BUFFER);
    }

    public Mono<Void> unsubscribe(String topic) {
        return Mono.defer(() -> Mono.fromFuture(delegate.unsubscribe(topic)));
    }
}
