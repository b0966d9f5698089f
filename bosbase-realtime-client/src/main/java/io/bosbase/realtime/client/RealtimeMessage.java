package io.bosbase.realtime.client;

import java.util.Map;

/**
 * A record-change event.
 *
 * @param topic the event name, i.e. the topic key it was addressed to
 * @param payload the decoded event data
 */
public record RealtimeMessage(String topic, Map<String, Object> payload) {

    public RealtimeMessage {
        payload = payload == null ? Map.of() : payload;
    }

    /**
     * @return {@code create}, {@code update} or {@code delete}, or {@code null} if absent
     */
    public String action() {
        Object action = payload.get("action");
        return action == null ? null : action.toString();
    }

    /**
     * @return the affected record, or an empty map if absent
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> record() {
        Object record = payload.get("record");
        return record instanceof Map ? (Map<String, Object>) record : Map.of();
    }
}
