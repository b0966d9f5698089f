package io.bosbase.realtime.client.rxjava3;

import io.bosbase.realtime.client.PubSubClient;
import io.bosbase.realtime.client.PubSubMessage;
import io.bosbase.realtime.client.PublishAck;
import io.bosbase.realtime.client.Subscription;
import io.reactivex.rxjava3.core.BackpressureStrategy;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Single;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * RxJava 3 adapter over {@link PubSubClient}.
 */
public final class RxJavaPubSubClient {

    private final PubSubClient delegate;

    public RxJavaPubSubClient(PubSubClient delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public PubSubClient delegate() {
        return delegate;
    }

    public Single<PublishAck> publish(String topic, Object data) {
        return Single.defer(() -> Single.fromCompletionStage(delegate.publish(topic, data)));
    }

    public Completable ping() {
        return Completable.defer(() -> Completable.fromCompletionStage(delegate.ping()));
    }

    /**
     * Messages of {@code topic}. Subscribing registers a listener, cancelling removes it.
     */
    public Flowable<PubSubMessage> messages(String topic) {
        return Flowable.create(emitter -> {
            CompletableFuture<Subscription> subscription = delegate.subscribe(topic, emitter::onNext);
            subscription.whenComplete((s, e) -> {
                if (e != null) emitter.tryOnError(unwrap(e));
            });
            emitter.setCancellable(() -> subscription.thenAccept(Subscription::unsubscribe));
        }, BackpressureStrategy.BUFFER);
    }

    static Throwable unwrap(Throwable e) {
        return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    }
}
