package io.bosbase.realtime.client;

/**
 * A message delivered on a pub/sub topic.
 *
 * @param id server-assigned message id
 * @param topic the topic it was published to
 * @param created server timestamp
 * @param data the published payload as decoded JSON
 */
public record PubSubMessage(String id, String topic, String created, Object data) {}
