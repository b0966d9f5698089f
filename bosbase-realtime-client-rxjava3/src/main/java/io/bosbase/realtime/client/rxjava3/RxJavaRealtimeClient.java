package io.bosbase.realtime.client.rxjava3;

import io.bosbase.realtime.client.RealtimeClient;
import io.bosbase.realtime.client.RealtimeMessage;
import io.bosbase.realtime.client.Subscription;
import io.bosbase.realtime.core.SubscriptionOptions;
import io.reactivex.rxjava3.core.BackpressureStrategy;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * RxJava 3 adapter over {@link RealtimeClient}.
 */
public final class RxJavaRealtimeClient {

    private final RealtimeClient delegate;

    public RxJavaRealtimeClient(RealtimeClient delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public RealtimeClient delegate() {
        return delegate;
    }

    public Flowable<RealtimeMessage> changes(String topic) {
        return changes(topic, SubscriptionOptions.none());
    }

    public Flowable<RealtimeMessage> changes(String topic, SubscriptionOptions options) {
        return Flowable.create(emitter -> {
            CompletableFuture<Subscription> subscription = delegate.subscribe(topic, options, emitter::onNext);
            subscription.whenComplete((s, e) -> {
                if (e != null) emitter.tryOnError(RxJavaPubSubClient.unwrap(e));
            });
            emitter.setCancellable(() -> subscription.thenAccept(Subscription::unsubscribe));
        }, BackpressureStrategy.BUFFER);
    }

    public Completable unsubscribe(String topic) {
        return Completable.defer(() -> Completable.fromCompletionStage(delegate.unsubscribe(topic)));
    }
}
