package io.bosbase.realtime.json.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.bosbase.realtime.json.spi.JsonCodec;
import io.bosbase.realtime.json.spi.JsonException;

import java.io.InputStream;
import java.util.Map;
import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 * Provides JSON serialization/deserialization using Jackson.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the default ObjectMapper.
     *
     * <p>Unknown properties are ignored so newer servers can add envelope fields.
     */
    public JacksonJsonCodec() {
        this(new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .setSerializationInclusion(JsonInclude.Include.ALWAYS));
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public byte[] writeBytes(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to bytes", e);
        }
    }

    @Override
    public String writeString(Object value) throws JsonException {
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new JsonException("Failed to serialize object to string", e);
        }
    }

    @Override
    public <T> T readValue(byte[] data, Class<T> type) throws JsonException {
        try {
            return mapper.readValue(data, type);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize bytes to " + type.getName(), e);
        }
    }

    @Override
    public <T> T readValue(String json, Class<T> type) throws JsonException {
        try {
            return mapper.readValue(json, type);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize string to " + type.getName(), json, e);
        }
    }

    @Override
    public <T> T readValue(InputStream input, Class<T> type) throws JsonException {
        try {
            return mapper.readValue(input, type);
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize input stream to " + type.getName(), e);
        }
    }

    @Override
    public Map<String, Object> readObject(String json) throws JsonException {
        if (json == null || json.isBlank()) {
            throw new JsonException("Cannot read a JSON object from empty text");
        }
        try {
            Map<String, Object> value = mapper.readValue(json, OBJECT_TYPE);
            if (value == null) {
                throw new JsonException("Expected a JSON object but got null", json, null);
            }
            return value;
        } catch (JsonException e) {
            throw e;
        } catch (Exception e) {
            throw new JsonException("Failed to deserialize string to a JSON object", json, e);
        }
    }
}
