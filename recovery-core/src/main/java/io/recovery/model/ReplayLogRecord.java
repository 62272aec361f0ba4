package io.recovery.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable idempotency record for a dead-letter replay. At most one exists per
 * original message id.
 *
 * @param originalMsgId  main stream id the dead letter came from (unique)
 * @param dlMsgId        dead-letter stream id
 * @param candidateId    subject id, may be {@code null}
 * @param idempotencyKey producer idempotency key, may be {@code null}
 * @param newMsgId       id of the re-enqueued message, {@code null} until known
 * @param replayedBy     identity of the replaying process
 * @param replayedAt     time the record was written
 * @param status         {@link #STATUS_REPLAYED} or {@link #STATUS_ALREADY_PROCESSED}
 */
public record ReplayLogRecord(
        String originalMsgId,
        String dlMsgId,
        String candidateId,
        String idempotencyKey,
        String newMsgId,
        String replayedBy,
        Instant replayedAt,
        String status) {

    public static final String STATUS_REPLAYED = "replayed";
    public static final String STATUS_ALREADY_PROCESSED = "already_processed";

    public ReplayLogRecord {
        Objects.requireNonNull(originalMsgId, "originalMsgId");
        Objects.requireNonNull(replayedAt, "replayedAt");
        Objects.requireNonNull(status, "status");
    }
}
