package io.recovery.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Cold-storage copy of a dead-letter entry, written before the entry is trimmed
 * from the stream.
 *
 * @param dlMsgId        dead-letter stream id (unique)
 * @param originalMsgId  main stream id
 * @param candidateId    subject id, may be {@code null}
 * @param payload        JSON object holding every dead-letter field
 * @param reason         dead-letter reason code
 * @param deadLetteredAt time of the original move, may be {@code null}
 * @param archivedBy     identity of the archiving process
 */
public record DeadLetterArchiveRecord(
        String dlMsgId,
        String originalMsgId,
        String candidateId,
        String payload,
        String reason,
        Instant deadLetteredAt,
        String archivedBy) {

    public DeadLetterArchiveRecord {
        Objects.requireNonNull(dlMsgId, "dlMsgId");
        Objects.requireNonNull(payload, "payload");
    }
}
