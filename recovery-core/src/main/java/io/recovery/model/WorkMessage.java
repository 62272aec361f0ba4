package io.recovery.model;

import java.util.Map;
import java.util.Objects;

/**
 * A unit of work read from the main stream.
 *
 * <p>Field names are shared with producers and with the dead-letter copy, so they
 * are exposed as constants. Accessors return {@code null} when a field is absent.
 *
 * @param id     stream message id
 * @param fields message fields
 */
public record WorkMessage(String id, Map<String, String> fields) {
    public static final String CANDIDATE_ID = "candidate_id";
    public static final String PRIORITY = "priority";
    public static final String ENQUEUED_AT = "enqueued_at";
    public static final String IDEMPOTENCY_KEY = "idempotency_key";
    public static final String METADATA = "metadata";
    public static final String REPLAYED_FROM_DL = "replayed_from_dl";
    public static final String REPLAYED_AT = "replayed_at";

    public WorkMessage {
        Objects.requireNonNull(id, "id");
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    public static WorkMessage from(StreamEntry entry) {
        return new WorkMessage(entry.id(), entry.fields());
    }

    public String subjectId() {
        return fields.get(CANDIDATE_ID);
    }

    public double priority() {
        String value = fields.get(PRIORITY);
        if (value == null || value.isEmpty()) {
            return 0.0;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    public String enqueuedAt() {
        return fields.get(ENQUEUED_AT);
    }

    public String idempotencyKey() {
        return fields.get(IDEMPOTENCY_KEY);
    }

    public String metadataJson() {
        return fields.get(METADATA);
    }

    /** Dead-letter id this message was replayed from, or {@code null} for first deliveries. */
    public String replayedFrom() {
        return fields.get(REPLAYED_FROM_DL);
    }
}
