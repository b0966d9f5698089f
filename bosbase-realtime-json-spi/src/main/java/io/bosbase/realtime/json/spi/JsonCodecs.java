package io.bosbase.realtime.json.spi;

import java.util.Comparator;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Locates a {@link JsonCodec} through {@link ServiceLoader}.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    /**
     * Returns the codec of the highest priority provider, if any is installed.
     */
    public static Optional<JsonCodec> find() {
        return find(Thread.currentThread().getContextClassLoader());
    }

    public static Optional<JsonCodec> find(ClassLoader classLoader) {
        return ServiceLoader.load(JsonCodecProvider.class, classLoader).stream()
                .map(ServiceLoader.Provider::get)
                .max(Comparator.comparingInt(JsonCodecProvider::priority))
                .map(JsonCodecProvider::create);
    }

    /**
     * Like {@link #find()} but fails when no provider is installed.
     *
     * @throws IllegalStateException if no {@link JsonCodecProvider} is registered
     */
    public static JsonCodec load() {
        return find().orElseThrow(() -> new IllegalStateException(
                "No JsonCodecProvider found; add bosbase-realtime-json-jackson to the class path"));
    }
}
