package io.bosbase.realtime.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-subscription query parameters and headers of a record subscription.
 *
 * <p>Two subscriptions to the same topic with different options are distinct topic keys, see {@link TopicKeys}.
 */
public final class SubscriptionOptions {

    private static final SubscriptionOptions NONE = new SubscriptionOptions(Map.of(), Map.of());

    private final Map<String, Object> query;
    private final Map<String, String> headers;

    private SubscriptionOptions(Map<String, Object> query, Map<String, String> headers) {
        this.query = Collections.unmodifiableMap(query);
        this.headers = Collections.unmodifiableMap(headers);
    }

    public static SubscriptionOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Object> query() {
        return query;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public boolean isEmpty() {
        return query.isEmpty() && headers.isEmpty();
    }

    public static final class Builder {
        private final Map<String, Object> query = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder() {}

        public Builder filter(String filter) {
            return query("filter", filter);
        }

        public Builder expand(String expand) {
            return query("expand", expand);
        }

        public Builder fields(String fields) {
            return query("fields", fields);
        }

        /**
         * Adds a query parameter; {@code null} values are skipped.
         */
        public Builder query(String name, Object value) {
            if (name != null && value != null) query.put(name, value);
            return this;
        }

        public Builder header(String name, String value) {
            if (name != null && value != null) headers.put(name, value);
            return this;
        }

        public SubscriptionOptions build() {
            if (query.isEmpty() && headers.isEmpty()) return NONE;
            return new SubscriptionOptions(new LinkedHashMap<>(query), new LinkedHashMap<>(headers));
        }
    }
}
