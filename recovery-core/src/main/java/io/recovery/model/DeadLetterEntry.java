package io.recovery.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A message moved to the dead-letter stream after exceeding its retry ceiling.
 *
 * <p>On the wire the entry is a flat field map: dead-letter metadata under fixed
 * names, and every original field copied under the {@value #ORIGINAL_PREFIX}
 * prefix so it cannot collide with the metadata.
 *
 * @param id             dead-letter stream id, or {@code null} before the entry is written
 * @param originalMsgId  id of the message in the main stream
 * @param originalStream main stream key
 * @param reason         dead-letter reason code
 * @param deadLetteredAt ISO-8601 timestamp of the move
 * @param consumer       consumer identity that moved the message
 * @param originalFields original message fields, unprefixed
 */
public record DeadLetterEntry(
        String id,
        String originalMsgId,
        String originalStream,
        String reason,
        String deadLetteredAt,
        String consumer,
        Map<String, String> originalFields) {

    public static final String ORIGINAL_PREFIX = "orig_";
    public static final String ORIGINAL_MSG_ID = "original_msg_id";
    public static final String ORIGINAL_STREAM = "original_stream";
    public static final String REASON = "reason";
    public static final String DEAD_LETTERED_AT = "dead_lettered_at";
    public static final String CONSUMER = "consumer";

    /** Reason used when a message exhausts its reclaim attempts. */
    public static final String MAX_RECLAIMS_EXCEEDED = "max_reclaims_exceeded";

    public DeadLetterEntry {
        Objects.requireNonNull(originalMsgId, "originalMsgId");
        originalFields = originalFields == null ? Map.of() : Map.copyOf(originalFields);
    }

    /**
     * Rebuilds an entry from a dead-letter stream record. A record without
     * {@value #ORIGINAL_MSG_ID} is treated as its own original.
     */
    public static DeadLetterEntry from(StreamEntry entry) {
        Map<String, String> fields = entry.fields();
        Map<String, String> original = new LinkedHashMap<>();
        for (Map.Entry<String, String> field : fields.entrySet()) {
            if (field.getKey().startsWith(ORIGINAL_PREFIX)) {
                original.put(field.getKey().substring(ORIGINAL_PREFIX.length()), field.getValue());
            }
        }
        return new DeadLetterEntry(
                entry.id(),
                fields.getOrDefault(ORIGINAL_MSG_ID, entry.id()),
                fields.get(ORIGINAL_STREAM),
                fields.get(REASON),
                fields.get(DEAD_LETTERED_AT),
                fields.get(CONSUMER),
                original);
    }

    /** Flattens this entry into the field map written to the dead-letter stream. */
    public Map<String, String> toFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(ORIGINAL_MSG_ID, originalMsgId);
        putIfNotNull(fields, ORIGINAL_STREAM, originalStream);
        putIfNotNull(fields, REASON, reason);
        putIfNotNull(fields, DEAD_LETTERED_AT, deadLetteredAt);
        putIfNotNull(fields, CONSUMER, consumer);
        for (Map.Entry<String, String> field : originalFields.entrySet()) {
            if (!fields.containsKey(field.getKey()) && field.getValue() != null) {
                fields.put(ORIGINAL_PREFIX + field.getKey(), field.getValue());
            }
        }
        return fields;
    }

    public String subjectId() {
        return originalFields.get(WorkMessage.CANDIDATE_ID);
    }

    public String idempotencyKey() {
        return originalFields.get(WorkMessage.IDEMPOTENCY_KEY);
    }

    private static void putIfNotNull(Map<String, String> fields, String key, String value) {
        if (value != null) {
            fields.put(key, value);
        }
    }
}
