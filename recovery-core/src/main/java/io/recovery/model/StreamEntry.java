package io.recovery.model;

import java.util.Map;
import java.util.Objects;

/**
 * One entry of an append-only stream: a store-assigned id and its field map.
 *
 * @param id     store-assigned id, ordered within the stream
 * @param fields immutable field map
 */
public record StreamEntry(String id, Map<String, String> fields) {

    public StreamEntry {
        Objects.requireNonNull(id, "id");
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }
}
