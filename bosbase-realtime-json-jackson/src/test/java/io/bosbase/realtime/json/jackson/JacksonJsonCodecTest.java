package io.bosbase.realtime.json.jackson;

import io.bosbase.realtime.json.spi.JsonCodec;
import io.bosbase.realtime.json.spi.JsonCodecs;
import io.bosbase.realtime.json.spi.JsonException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    private final JacksonJsonCodec codec = new JacksonJsonCodec();

    @Test
    void writesNullsAndKeepsInsertionOrder() throws Exception {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("type", "publish");
        value.put("data", null);

        assertThat(codec.writeString(value)).isEqualTo("{\"type\":\"publish\",\"data\":null}");
        assertThat(new String(codec.writeBytes(List.of(1, "a")), StandardCharsets.UTF_8)).isEqualTo("[1,\"a\"]");
    }

    @Test
    void readsObjects() throws Exception {
        Map<String, Object> value = codec.readObject("{\"a\":1,\"b\":{\"c\":[true]}}");

        assertThat(value).containsEntry("a", 1);
        assertThat(value.get("b")).isEqualTo(Map.of("c", List.of(true)));
    }

    @Test
    void readsTypedValues() throws Exception {
        assertThat(codec.readValue("[1,2]", Object.class)).isEqualTo(List.of(1, 2));
        assertThat(codec.readValue("\"x\"".getBytes(StandardCharsets.UTF_8), String.class)).isEqualTo("x");
        assertThat(codec.readValue(new ByteArrayInputStream("42".getBytes(StandardCharsets.UTF_8)), Integer.class))
                .isEqualTo(42);
    }

    @Test
    void rejectsNonObjects() {
        assertThatThrownBy(() -> codec.readObject("[1]")).isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readObject("null")).isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readObject(" ")).isInstanceOf(JsonException.class);
        assertThatThrownBy(() -> codec.readObject("{broken")).isInstanceOf(JsonException.class);
    }

    @Test
    void readFailuresKeepAnExcerptOfTheInput() {
        String longFrame = "{\"type\":\"message\",\"data\":\"" + "x".repeat(100);

        assertThatThrownBy(() -> codec.readObject("{broken"))
                .isInstanceOfSatisfying(JsonException.class, e -> assertThat(e.excerpt()).isEqualTo("{broken"));
        assertThatThrownBy(() -> codec.readObject(longFrame))
                .isInstanceOfSatisfying(JsonException.class, e -> {
                    assertThat(e.excerpt()).hasSize(67).endsWith("...");
                    assertThat(longFrame).startsWith(e.excerpt().substring(0, 64));
                });
        assertThatThrownBy(() -> codec.writeString(new Object()))
                .isInstanceOfSatisfying(JsonException.class, e -> assertThat(e.excerpt()).isNull());
    }

    @Test
    void serviceLoaderFindsJackson() {
        JsonCodec found = JsonCodecs.load();

        assertThat(found).isInstanceOf(JacksonJsonCodec.class);
    }
}
