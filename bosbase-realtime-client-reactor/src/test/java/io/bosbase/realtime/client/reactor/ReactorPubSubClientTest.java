package io.bosbase.realtime.client.reactor;

import io.bosbase.realtime.client.AuthStore;
import io.bosbase.realtime.client.PubSubClient;
import io.bosbase.realtime.client.PubSubMessage;
import io.bosbase.realtime.client.PublishAck;
import io.bosbase.realtime.client.RealtimeSettings;
import io.bosbase.realtime.core.EnvelopeCodec;
import io.bosbase.realtime.core.RealtimeException;
import io.bosbase.realtime.json.spi.JsonCodecs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReactorPubSubClientTest {

    private ScheduledExecutorService scheduler;
    private LoopbackTransport transport;
    private PubSubClient pubsub;
    private ReactorPubSubClient client;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        transport = new LoopbackTransport();
        pubsub = new PubSubClient(URI.create("http://localhost:8090"), new AuthStore(), transport,
                new EnvelopeCodec(JsonCodecs.load()), RealtimeSettings.defaults(), scheduler);
        client = new ReactorPubSubClient(pubsub);
    }

    @AfterEach
    void tearDown() {
        pubsub.close();
        scheduler.shutdownNow();
    }

    @Test
    void publishEmitsAck() {
        PublishAck ack = client.publish("chat", Map.of("text", "hi")).block(Duration.ofSeconds(5));

        assertThat(ack).isNotNull();
        assertThat(ack.topic()).isEqualTo("chat");
        assertThat(ack.id()).startsWith("m");
    }

    @Test
    void publishIsLazy() throws Exception {
        client.publish("chat", "x");
        Thread.sleep(100);

        assertThat(pubsub.isConnected()).isFalse();
    }

    @Test
    void invalidTopicSurfacesAsError() {
        assertThatThrownBy(() -> client.publish("", "x").block(Duration.ofSeconds(5)))
                .isInstanceOf(RealtimeException.Validation.class);
    }

    @Test
    void messagesFluxReceivesAndUnsubscribesOnDispose() throws Exception {
        List<PubSubMessage> received = new CopyOnWriteArrayList<>();
        Disposable subscription = client.messages("chat").subscribe(received::add);
        waitFor(() -> transport.topics.contains("chat"));

        client.publish("chat", "hello").block(Duration.ofSeconds(5));
        waitFor(() -> received.size() == 1);
        assertThat(received.get(0).data()).isEqualTo("hello");

        subscription.dispose();
        waitFor(() -> pubsub.activeTopics().isEmpty());
        waitFor(() -> !pubsub.isConnected());
    }

    @Test
    void pingCompletes() {
        client.ping().block(Duration.ofSeconds(5));

        assertThat(pubsub.clientId()).isEqualTo("loop");
    }

    private static void waitFor(java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) throw new AssertionError("condition not met in time");
            Thread.sleep(10);
        }
    }
}
