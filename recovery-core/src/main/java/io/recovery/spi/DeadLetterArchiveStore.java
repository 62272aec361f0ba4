package io.recovery.spi;

import io.recovery.model.DeadLetterArchiveRecord;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * Cold storage for dead-letter entries trimmed from the stream.
 */
public interface DeadLetterArchiveStore {

    /**
     * Inserts the record, or refreshes {@code archived_at} if the dead-letter id is
     * already archived.
     *
     * @param archivedAt archive timestamp to write
     */
    void upsert(Connection conn, DeadLetterArchiveRecord record, Instant archivedAt);

    Optional<DeadLetterArchiveRecord> find(Connection conn, String dlMsgId);
}
