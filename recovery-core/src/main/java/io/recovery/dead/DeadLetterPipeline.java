package io.recovery.dead;

import io.recovery.model.DeadLetterEntry;
import io.recovery.model.ReplayLogRecord;
import io.recovery.model.StreamEntry;
import io.recovery.model.WorkMessage;
import io.recovery.queue.DurableQueue;
import io.recovery.spi.ConnectionProvider;
import io.recovery.spi.MetricsExporter;
import io.recovery.spi.ReplayLogStore;
import io.recovery.spi.ReplayTracker;
import io.recovery.spi.StoreException;
import io.recovery.spi.StreamStore;
import io.recovery.util.SideEffects;
import io.recovery.util.Timestamps;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Moves poison messages out of a {@link DurableQueue} and replays them back.
 *
 * <p>Both directions write the durable copy first and remove the source second:
 * a dead letter is appended before the original is acknowledged, and a replay is
 * recorded in the {@link ReplayLogStore} before the message is re-enqueued. A
 * crash between the two steps leaves a recoverable state; a failed second step
 * is logged and the operation still reports success.
 *
 * <p>Without a replay log, replay idempotency falls back to the
 * {@link ReplayTracker} alone, which does not survive its TTL.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class DeadLetterPipeline {
    private static final Logger logger = Logger.getLogger(DeadLetterPipeline.class.getName());

    private final DurableQueue queue;
    private final StreamStore store;
    private final String deadLetterStreamKey;
    private final ConnectionProvider connectionProvider;
    private final ReplayLogStore replayLogStore;
    private final ReplayTracker replayTracker;
    private final ProcessedSubjectCheck processedCheck;
    private final int duplicateScanSize;
    private final String replayedBy;
    private final MetricsExporter metrics;

    private DeadLetterPipeline(Builder builder) {
        this.queue = Objects.requireNonNull(builder.queue, "queue");
        this.store = queue.store();
        this.deadLetterStreamKey = Objects.requireNonNull(builder.deadLetterStreamKey, "deadLetterStreamKey");
        if ((builder.connectionProvider == null) != (builder.replayLogStore == null)) {
            throw new IllegalArgumentException("connectionProvider and replayLogStore must be set together");
        }
        if (builder.duplicateScanSize < 0) {
            throw new IllegalArgumentException("duplicateScanSize must be >= 0");
        }
        this.connectionProvider = builder.connectionProvider;
        this.replayLogStore = builder.replayLogStore;
        this.replayTracker = builder.replayTracker;
        this.processedCheck = builder.processedCheck;
        this.duplicateScanSize = builder.duplicateScanSize;
        this.replayedBy = builder.replayedBy != null ? builder.replayedBy : queue.consumer();
        this.metrics = queue.metrics();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Appends {@code fields} to the dead-letter stream, then acknowledges the
     * original message.
     *
     * <p>If a dead letter for {@code messageId} already exists among the newest
     * entries, only the acknowledgment is repeated. A failed acknowledgment after
     * a successful append is logged and still reports success; the stale pending
     * entry is cleaned up by a later reclaim pass.
     *
     * @return {@code true} once the dead letter is durable
     */
    public boolean moveToDeadLetter(String messageId, Map<String, String> fields, String reason) {
        Objects.requireNonNull(messageId, "messageId");
        try {
            Optional<DeadLetterEntry> existing = scanForOriginal(messageId);
            if (existing.isPresent()) {
                logger.log(Level.INFO, "Message {0} already dead-lettered as {1}; acknowledging original",
                        new Object[]{messageId, existing.get().id()});
                acknowledgeOriginal(messageId);
                return true;
            }
            DeadLetterEntry entry = new DeadLetterEntry(
                    null,
                    messageId,
                    queue.streamKey(),
                    reason != null ? reason : DeadLetterEntry.MAX_RECLAIMS_EXCEEDED,
                    Timestamps.format(queue.clock().instant()),
                    queue.consumer(),
                    fields);
            // Unbounded append: ArchiveTrimmer enforces the length after archiving.
            String dlId = store.add(deadLetterStreamKey, entry.toFields(), 0);
            logger.log(Level.WARNING, "Dead-lettered message {0} as {1} (reason: {2})",
                    new Object[]{messageId, dlId, entry.reason()});
            SideEffects.bestEffort("metrics.deadLettered", metrics::incrementDeadLettered);
        } catch (StoreException e) {
            logger.log(Level.SEVERE, "Failed to dead-letter message " + messageId, e);
            return false;
        }
        acknowledgeOriginal(messageId);
        return true;
    }

    private void acknowledgeOriginal(String messageId) {
        try {
            long acked = store.ack(queue.streamKey(), queue.group(), List.of(messageId));
            if (acked == 0) {
                logger.log(Level.WARNING, "Acknowledge of dead-lettered message {0} matched no pending entry",
                        messageId);
            }
        } catch (StoreException e) {
            logger.log(Level.WARNING, "Failed to acknowledge dead-lettered message " + messageId
                    + "; a later reclaim pass will retry", e);
        }
        queue.clearReclaimAttempts(messageId);
    }

    /**
     * Re-enqueues a dead letter onto the work stream.
     *
     * @param dlMsgId               dead-letter stream id
     * @param checkIdempotency      skip if the original message was already replayed
     * @param checkAlreadyProcessed skip if the {@link ProcessedSubjectCheck} reports the subject as done
     * @return the new work stream id, or empty if nothing was enqueued
     */
    public Optional<String> replay(String dlMsgId, boolean checkIdempotency, boolean checkAlreadyProcessed) {
        Replay result = replayEntry(dlMsgId, checkIdempotency, checkAlreadyProcessed);
        return Optional.ofNullable(result.newMsgId);
    }

    /**
     * Replays dead letters oldest first, page by page.
     *
     * @param batchSize  page size
     * @param maxReplays stop after this many entries were visited, whether replayed,
     *                   skipped or failed
     */
    public ReplaySummary replayAll(int batchSize, int maxReplays,
            boolean checkIdempotency, boolean checkAlreadyProcessed) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        int replayed = 0;
        int skipped = 0;
        int errors = 0;
        int visited = 0;
        String cursor = null;
        while (visited < maxReplays) {
            List<StreamEntry> page;
            try {
                page = store.range(deadLetterStreamKey, cursor, batchSize);
            } catch (StoreException e) {
                logger.log(Level.SEVERE, "Failed to page dead-letter stream " + deadLetterStreamKey, e);
                errors++;
                break;
            }
            for (StreamEntry entry : page) {
                if (visited >= maxReplays) {
                    break;
                }
                visited++;
                switch (replayEntry(entry.id(), checkIdempotency, checkAlreadyProcessed).outcome) {
                    case REPLAYED -> replayed++;
                    case SKIPPED -> skipped++;
                    case FAILED -> errors++;
                }
            }
            if (page.size() < batchSize) {
                break;
            }
            cursor = page.get(page.size() - 1).id();
        }
        if (replayed > 0 || errors > 0) {
            logger.log(Level.INFO, "Replay finished: {0} replayed, {1} skipped, {2} errors",
                    new Object[]{replayed, skipped, errors});
        }
        return new ReplaySummary(replayed, skipped, errors);
    }

    private Replay replayEntry(String dlMsgId, boolean checkIdempotency, boolean checkAlreadyProcessed) {
        DeadLetterEntry entry;
        try {
            Optional<StreamEntry> raw = store.get(deadLetterStreamKey, dlMsgId);
            if (raw.isEmpty()) {
                logger.log(Level.FINE, "Dead letter {0} not found", dlMsgId);
                return Replay.SKIPPED;
            }
            entry = DeadLetterEntry.from(raw.get());
        } catch (StoreException e) {
            logger.log(Level.SEVERE, "Failed to read dead letter " + dlMsgId, e);
            return Replay.FAILED;
        }

        Instant now = queue.clock().instant();
        try {
            if (checkIdempotency && alreadyReplayed(entry)) {
                logger.log(Level.FINE, "Dead letter {0} (original {1}) already replayed",
                        new Object[]{dlMsgId, entry.originalMsgId()});
                SideEffects.bestEffort("metrics.replaySkipped", metrics::incrementReplaySkipped);
                return Replay.SKIPPED;
            }
            if (checkAlreadyProcessed && processedCheck != null && entry.subjectId() != null
                    && processedCheck.isProcessed(entry.subjectId())) {
                if (replayLogStore != null) {
                    insertLedgerRecord(entry, now, ReplayLogRecord.STATUS_ALREADY_PROCESSED);
                }
                markTracked(dlMsgId);
                logger.log(Level.INFO, "Subject {0} of dead letter {1} already processed; not replaying",
                        new Object[]{entry.subjectId(), dlMsgId});
                SideEffects.bestEffort("metrics.replaySkipped", metrics::incrementReplaySkipped);
                return Replay.SKIPPED;
            }
            if (replayLogStore != null && !insertLedgerRecord(entry, now, ReplayLogRecord.STATUS_REPLAYED)) {
                logger.log(Level.INFO, "Concurrent replay of original {0} already recorded; skipping",
                        entry.originalMsgId());
                SideEffects.bestEffort("metrics.replaySkipped", metrics::incrementReplaySkipped);
                return Replay.SKIPPED;
            }
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Replay precondition check failed; not replaying " + dlMsgId, e);
            return Replay.FAILED;
        }

        Map<String, String> fields = new LinkedHashMap<>(entry.originalFields());
        fields.put(WorkMessage.REPLAYED_FROM_DL, dlMsgId);
        fields.put(WorkMessage.REPLAYED_AT, Timestamps.format(now));
        String newMsgId;
        try {
            newMsgId = store.add(queue.streamKey(), fields, queue.maxLength());
        } catch (StoreException e) {
            logger.log(Level.SEVERE, "Failed to re-enqueue dead letter " + dlMsgId, e);
            releaseLedgerRecord(entry.originalMsgId());
            return Replay.FAILED;
        }
        SideEffects.bestEffort("metrics.enqueued", metrics::incrementEnqueued);

        if (replayLogStore != null) {
            SideEffects.bestEffort("replay log new_msg_id", () -> recordNewMsgId(entry.originalMsgId(), newMsgId));
        }
        try {
            store.delete(deadLetterStreamKey, List.of(dlMsgId));
        } catch (StoreException e) {
            logger.log(Level.WARNING, "Replayed dead letter " + dlMsgId + " could not be deleted", e);
        }
        markTracked(dlMsgId);
        SideEffects.bestEffort("metrics.replayed", metrics::incrementReplayed);
        logger.log(Level.INFO, "Replayed dead letter {0} (original {1}) as {2}",
                new Object[]{dlMsgId, entry.originalMsgId(), newMsgId});
        return Replay.replayed(newMsgId);
    }

    private boolean alreadyReplayed(DeadLetterEntry entry) throws SQLException {
        if (replayLogStore != null) {
            try (Connection conn = connectionProvider.getConnection()) {
                if (replayLogStore.findByOriginalMsgId(conn, entry.originalMsgId()).isPresent()) {
                    return true;
                }
            }
        }
        if (replayTracker != null) {
            try {
                return replayTracker.isReplayed(entry.id());
            } catch (StoreException e) {
                logger.log(Level.WARNING, "Replay tracker unavailable; relying on replay log", e);
            }
        }
        return false;
    }

    private boolean insertLedgerRecord(DeadLetterEntry entry, Instant now, String status) throws SQLException {
        ReplayLogRecord record = new ReplayLogRecord(
                entry.originalMsgId(),
                entry.id(),
                entry.subjectId(),
                entry.idempotencyKey(),
                null,
                replayedBy,
                now,
                status);
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return replayLogStore.insertIfAbsent(conn, record);
        }
    }

    private void recordNewMsgId(String originalMsgId, String newMsgId) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            replayLogStore.recordNewMsgId(conn, originalMsgId, newMsgId);
        } catch (SQLException e) {
            throw new StoreException("Failed to record new message id for " + originalMsgId, e);
        }
    }

    private void releaseLedgerRecord(String originalMsgId) {
        if (replayLogStore == null) {
            return;
        }
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            replayLogStore.deleteUnfinished(conn, originalMsgId);
        } catch (SQLException | StoreException e) {
            logger.log(Level.SEVERE, "Failed to release replay log record of " + originalMsgId
                    + "; the dead letter needs a replay without idempotency check", e);
        }
    }

    private void markTracked(String dlMsgId) {
        if (replayTracker != null) {
            SideEffects.bestEffort("replay tracker", () -> replayTracker.markReplayed(dlMsgId));
        }
    }

    /**
     * Returns the dead-letter stream length, {@code 0} if the store is unavailable.
     */
    public long deadLetterCount() {
        try {
            long depth = store.length(deadLetterStreamKey);
            SideEffects.bestEffort("metrics.deadLetterDepth", () -> metrics.recordDeadLetterDepth(depth));
            return depth;
        } catch (StoreException e) {
            logger.log(Level.SEVERE, "Failed to read length of " + deadLetterStreamKey, e);
            return 0;
        }
    }

    public Optional<DeadLetterEntry> find(String dlMsgId) {
        try {
            return store.get(deadLetterStreamKey, dlMsgId).map(DeadLetterEntry::from);
        } catch (StoreException e) {
            logger.log(Level.SEVERE, "Failed to read dead letter " + dlMsgId, e);
            return Optional.empty();
        }
    }

    /**
     * Looks for a dead letter of {@code originalMsgId} among the newest entries of
     * the dead-letter stream.
     */
    public Optional<DeadLetterEntry> findByOriginalMsgId(String originalMsgId) {
        try {
            return scanForOriginal(originalMsgId);
        } catch (StoreException e) {
            logger.log(Level.SEVERE, "Failed to scan " + deadLetterStreamKey, e);
            return Optional.empty();
        }
    }

    private Optional<DeadLetterEntry> scanForOriginal(String originalMsgId) {
        if (duplicateScanSize == 0) {
            return Optional.empty();
        }
        return store.reverseRange(deadLetterStreamKey, duplicateScanSize).stream()
                .filter(e -> originalMsgId.equals(e.fields().get(DeadLetterEntry.ORIGINAL_MSG_ID)))
                .findFirst()
                .map(DeadLetterEntry::from);
    }

    public DurableQueue queue() {
        return queue;
    }

    public String deadLetterStreamKey() {
        return deadLetterStreamKey;
    }

    private enum Outcome { REPLAYED, SKIPPED, FAILED }

    private static final class Replay {
        static final Replay SKIPPED = new Replay(Outcome.SKIPPED, null);
        static final Replay FAILED = new Replay(Outcome.FAILED, null);

        final Outcome outcome;
        final String newMsgId;

        private Replay(Outcome outcome, String newMsgId) {
            this.outcome = outcome;
            this.newMsgId = newMsgId;
        }

        static Replay replayed(String newMsgId) {
            return new Replay(Outcome.REPLAYED, newMsgId);
        }
    }

    /** Builder for {@link DeadLetterPipeline}. */
    public static final class Builder {
        private DurableQueue queue;
        private String deadLetterStreamKey = "m10:evaluate:dead-letter";
        private ConnectionProvider connectionProvider;
        private ReplayLogStore replayLogStore;
        private ReplayTracker replayTracker;
        private ProcessedSubjectCheck processedCheck;
        private int duplicateScanSize = 1000;
        private String replayedBy;

        private Builder() {
        }

        /**
         * Sets the work queue messages are dead-lettered from and replayed to.
         *
         * <p><b>Required.</b>
         *
         * @param queue the work queue
         * @return this builder
         */
        public Builder queue(DurableQueue queue) {
            this.queue = queue;
            return this;
        }

        /**
         * Sets the dead-letter stream key. The stream lives in the queue's store.
         *
         * <p>Optional. Defaults to {@code m10:evaluate:dead-letter}.
         *
         * @param deadLetterStreamKey stream key
         * @return this builder
         */
        public Builder deadLetterStreamKey(String deadLetterStreamKey) {
            this.deadLetterStreamKey = deadLetterStreamKey;
            return this;
        }

        /**
         * Sets the connection provider for the replay log.
         *
         * <p>Optional, but required together with {@link #replayLogStore}.
         *
         * @param connectionProvider connection provider
         * @return this builder
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Sets the durable replay ledger.
         *
         * <p>Optional. Without it concurrent replays of one message are not excluded.
         *
         * @param replayLogStore replay ledger
         * @return this builder
         */
        public Builder replayLogStore(ReplayLogStore replayLogStore) {
            this.replayLogStore = replayLogStore;
            return this;
        }

        /**
         * Sets the short-lived replay tracker.
         *
         * <p>Optional.
         *
         * @param replayTracker tracker
         * @return this builder
         */
        public Builder replayTracker(ReplayTracker replayTracker) {
            this.replayTracker = replayTracker;
            return this;
        }

        /**
         * Sets the business-state lookup used when replaying with
         * {@code checkAlreadyProcessed}.
         *
         * <p>Optional. Without it that flag has no effect.
         *
         * @param processedCheck lookup
         * @return this builder
         */
        public Builder processedCheck(ProcessedSubjectCheck processedCheck) {
            this.processedCheck = processedCheck;
            return this;
        }

        /**
         * Sets how many of the newest dead letters are scanned for an existing
         * copy before a message is dead-lettered.
         *
         * <p>Optional. Defaults to {@code 1000}. {@code 0} disables the scan.
         *
         * @param duplicateScanSize scan size
         * @return this builder
         */
        public Builder duplicateScanSize(int duplicateScanSize) {
            this.duplicateScanSize = duplicateScanSize;
            return this;
        }

        /**
         * Sets the identity written to {@code replayed_by}.
         *
         * <p>Optional. Defaults to the queue's consumer name.
         *
         * @param replayedBy identity
         * @return this builder
         */
        public Builder replayedBy(String replayedBy) {
            this.replayedBy = replayedBy;
            return this;
        }

        /**
         * @return a new {@link DeadLetterPipeline}
         * @throws NullPointerException if {@code queue} is null
         * @throws IllegalArgumentException if only one of {@code connectionProvider}
         *     and {@code replayLogStore} is set
         */
        public DeadLetterPipeline build() {
            return new DeadLetterPipeline(this);
        }
    }
}
