package io.bosbase.realtime.json.spi;

/**
 * ServiceLoader entry point for {@link JsonCodec} implementations.
 *
 * <p>Implementations are registered in {@code META-INF/services/io.bosbase.realtime.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {

    /**
     * Higher values win when several providers are on the class path.
     */
    default int priority() {
        return 0;
    }

    JsonCodec create();
}
