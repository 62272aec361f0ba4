package io.recovery.util;

import java.util.Map;

/**
 * Codec between flat {@code Map<String, String>} objects and JSON text. Used for
 * message metadata and for dead-letter archive payloads.
 *
 * <p>The built-in {@link FlatJsonCodec} has no dependencies. Applications with a
 * JSON library on the classpath can supply their own implementation.
 */
public interface JsonCodec {

    static JsonCodec getDefault() {
        return FlatJsonCodec.INSTANCE;
    }

    /**
     * Encodes a map as a JSON object. A {@code null} map encodes as {@code "{}"}.
     */
    String toJson(Map<String, String> values);

    /**
     * Parses a JSON object whose values are strings or {@code null}. Null values
     * are dropped.
     *
     * @return parsed map, empty for {@code null} or blank input
     * @throws IllegalArgumentException if the input is not a flat JSON object
     */
    Map<String, String> parseObject(String json);
}
