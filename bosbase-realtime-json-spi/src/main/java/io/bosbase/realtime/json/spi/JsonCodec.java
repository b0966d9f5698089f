package io.bosbase.realtime.json.spi;

import java.io.InputStream;
import java.util.Map;

/**
 * Minimal JSON codec interface providing serialization and deserialization.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>Realtime frames carry arbitrary JSON payloads, so untyped reads produce the
 * usual tree of {@link Map}, {@link java.util.List}, {@link String}, {@link Number},
 * {@link Boolean} and {@code null}.
 */
public interface JsonCodec {

    // ===== Serialization =====

    /**
     * Serializes an object to a JSON byte array.
     * @param value the object to serialize
     * @return JSON bytes
     * @throws JsonException if serialization fails
     */
    byte[] writeBytes(Object value) throws JsonException;

    /**
     * Serializes an object to a JSON string.
     * @param value the object to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(Object value) throws JsonException;

    // ===== Deserialization =====

    /**
     * Deserializes JSON bytes to a typed object.
     * @param data JSON bytes
     * @param type target class
     * @return deserialized object
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(byte[] data, Class<T> type) throws JsonException;

    /**
     * Deserializes JSON string to an object of the specified type.
     * @param json JSON string
     * @param type target class
     * @return deserialized object
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(String json, Class<T> type) throws JsonException;

    /**
     * Deserializes JSON input stream to an object of the specified type.
     * @param input JSON input stream
     * @param type target class
     * @return deserialized object
     * @throws JsonException if deserialization fails
     */
    <T> T readValue(InputStream input, Class<T> type) throws JsonException;

    /**
     * Deserializes a JSON object to a string-keyed map.
     * @param json JSON string (must be a JSON object)
     * @return the decoded object, insertion ordered
     * @throws JsonException if the text is not valid JSON or not an object
     */
    Map<String, Object> readObject(String json) throws JsonException;
}
