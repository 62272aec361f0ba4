package io.recovery.spi;

import io.recovery.model.OutboxRecord;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Consumer-side persistence for the outbox table. Rows are written by business
 * code in its own transactions; this SPI only claims and completes them.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries.
 */
public interface OutboxStore {

    /**
     * Marks up to {@code limit} due records as owned by {@code processorId} and
     * returns them, oldest first.
     *
     * <p>A record is due when {@code processed_at IS NULL} and {@code process_after}
     * is null or not after {@code now}. A record already claimed is skipped unless
     * its claim is older than {@code claimExpiry}.
     */
    List<OutboxRecord> claim(Connection conn, String processorId, Instant now, Instant claimExpiry, int limit);

    /**
     * Reads a record and locks its row for the rest of the caller's transaction.
     */
    Optional<OutboxRecord> findForUpdate(Connection conn, long id);

    /**
     * Sets {@code processed_at}, records {@code processed_by} and clears the claim.
     * {@code process_after} is left untouched.
     *
     * @return rows updated
     */
    int markProcessed(Connection conn, long id, String processorId, Instant processedAt);

    /**
     * Increments {@code retry_count}, sets {@code process_after}, records the error
     * and clears the claim. Writes no other scheduling field.
     *
     * @return rows updated
     */
    int scheduleRetry(Connection conn, long id, Instant processAfter, String error);

    /** Counts records not yet processed. */
    int countPending(Connection conn);
}
