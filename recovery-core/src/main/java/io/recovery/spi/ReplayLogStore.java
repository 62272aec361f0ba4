package io.recovery.spi;

import io.recovery.model.ReplayLogRecord;

import java.sql.Connection;
import java.util.Optional;

/**
 * Durable idempotency ledger for dead-letter replays, keyed by original message id.
 */
public interface ReplayLogStore {

    Optional<ReplayLogRecord> findByOriginalMsgId(Connection conn, String originalMsgId);

    /**
     * Compare-and-insert on {@code originalMsgId}.
     *
     * @return {@code true} if the record was inserted, {@code false} if one already existed
     */
    boolean insertIfAbsent(Connection conn, ReplayLogRecord record);

    /**
     * Fills {@code new_msg_id} if it is still empty.
     *
     * @return rows updated
     */
    int recordNewMsgId(Connection conn, String originalMsgId, String newMsgId);

    /**
     * Deletes a {@code replayed} record whose {@code new_msg_id} was never filled,
     * releasing the ledger slot after a re-enqueue that did not happen.
     *
     * @return rows deleted
     */
    int deleteUnfinished(Connection conn, String originalMsgId);
}
