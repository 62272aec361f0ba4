package io.recovery.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A side-effect delivery task in the outbox table.
 *
 * <p>{@code processAfter} is the only retry-scheduling field; a {@code null}
 * value means the record is due immediately.
 */
public record OutboxRecord(
        long id,
        String aggregateType,
        String aggregateId,
        String eventKind,
        String payload,
        Instant createdAt,
        Instant processedAt,
        int retryCount,
        Instant processAfter,
        String claimedBy,
        Instant claimedAt,
        String lastError) {

    public OutboxRecord {
        Objects.requireNonNull(aggregateType, "aggregateType");
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(eventKind, "eventKind");
    }

    public boolean isProcessed() {
        return processedAt != null;
    }
}
