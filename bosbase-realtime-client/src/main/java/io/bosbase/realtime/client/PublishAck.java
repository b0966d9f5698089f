package io.bosbase.realtime.client;

import io.bosbase.realtime.core.Envelope;

/**
 * Server confirmation of a publish.
 */
public record PublishAck(String id, String topic, String created) {

    static PublishAck from(Envelope ack, String requestedTopic) {
        return new PublishAck(
                ack.id() == null ? "" : ack.id(),
                ack.topic() == null ? requestedTopic : ack.topic(),
                ack.created() == null ? "" : ack.created());
    }
}
