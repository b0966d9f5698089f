package io.bosbase.realtime.core;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class UrlsTest {

    @Test
    void resolveCollapsesSlashes() {
        assertThat(Urls.resolve(URI.create("http://host:8090/"), "/api/realtime"))
                .isEqualTo(URI.create("http://host:8090/api/realtime"));
        assertThat(Urls.resolve(URI.create("http://host/base"), "api/pubsub"))
                .isEqualTo(URI.create("http://host/base/api/pubsub"));
    }

    @Test
    void queryIsSortedAndEncoded() {
        Map<String, String> params = new HashMap<>();
        params.put("token", "a b");
        params.put("alpha", "1");
        params.put("skip", null);

        assertThat(Urls.withQuery(URI.create("http://host/api"), params))
                .isEqualTo(URI.create("http://host/api?alpha=1&token=a+b"));
        assertThat(Urls.withQuery(URI.create("http://host/api?x=1"), Map.of("y", "2")))
                .isEqualTo(URI.create("http://host/api?x=1&y=2"));
    }

    @Test
    void mapsHttpSchemesToWebSocket() {
        assertThat(Urls.toWebSocket(URI.create("http://host/api/pubsub"))).isEqualTo(URI.create("ws://host/api/pubsub"));
        assertThat(Urls.toWebSocket(URI.create("https://host/api/pubsub"))).isEqualTo(URI.create("wss://host/api/pubsub"));
        assertThat(Urls.toWebSocket(URI.create("ws://host/x"))).isEqualTo(URI.create("ws://host/x"));
    }
}
