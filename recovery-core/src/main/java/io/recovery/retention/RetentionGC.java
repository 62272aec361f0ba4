package io.recovery.retention;

import io.recovery.lock.DistributedLock;
import io.recovery.model.PendingEntry;
import io.recovery.queue.DurableQueue;
import io.recovery.spi.ConnectionProvider;
import io.recovery.spi.MetricsExporter;
import io.recovery.spi.ReclaimAttemptStore;
import io.recovery.spi.RetentionPurger;
import io.recovery.spi.StoreException;
import io.recovery.util.DaemonThreadFactory;
import io.recovery.util.Identities;
import io.recovery.util.SideEffects;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Deletes aged rows from the archive, replay log and outbox tables, removes
 * expired locks, and drops reclaim counters of messages no longer pending.
 *
 * <p>Candidates are counted before anything is deleted, so a dry run reports the
 * same counts a real run would. Deletion proceeds in batches, each on its own
 * auto-committed connection, until a batch deletes fewer rows than the batch size.
 *
 * <p>{@link #runOnce()} holds the retention lock when one is configured, so only
 * one process runs a scheduled pass at a time.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class RetentionGC implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(RetentionGC.class.getName());

    private final ConnectionProvider connectionProvider;
    private final RetentionPurger deadLetterArchivePurger;
    private final RetentionPurger replayLogPurger;
    private final RetentionPurger outboxPurger;
    private final DistributedLock lock;
    private final String lockName;
    private final Duration lockTtl;
    private final String holderId;
    private final int deadLetterArchiveDays;
    private final int replayLogDays;
    private final int outboxDays;
    private final boolean dryRun;
    private final int batchSize;
    private final DurableQueue queue;
    private final int reclaimCounterScanSize;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final long intervalSeconds;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> gcTask;
    private volatile boolean closed;

    private RetentionGC(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.deadLetterArchiveDays < 0 || builder.replayLogDays < 0 || builder.outboxDays < 0) {
            throw new IllegalArgumentException("retention days must be >= 0");
        }
        if (builder.reclaimCounterScanSize <= 0) {
            throw new IllegalArgumentException("reclaimCounterScanSize must be > 0");
        }
        if (builder.intervalSeconds <= 0L) {
            throw new IllegalArgumentException("intervalSeconds must be > 0");
        }
        this.deadLetterArchivePurger = builder.deadLetterArchivePurger;
        this.replayLogPurger = builder.replayLogPurger;
        this.outboxPurger = builder.outboxPurger;
        this.lock = builder.lock;
        this.lockName = builder.lockName;
        this.lockTtl = builder.lockTtl;
        this.holderId = builder.holderId != null ? builder.holderId : Identities.uniqueHolderId("retention");
        this.deadLetterArchiveDays = builder.deadLetterArchiveDays;
        this.replayLogDays = builder.replayLogDays;
        this.outboxDays = builder.outboxDays;
        this.dryRun = builder.dryRun;
        this.batchSize = builder.batchSize;
        this.queue = builder.queue;
        this.reclaimCounterScanSize = builder.reclaimCounterScanSize;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.intervalSeconds = builder.intervalSeconds;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Applies the given retention windows to every configured table and cleans
     * expired locks.
     *
     * @param dryRun count candidates without deleting anything
     */
    public RetentionReport runAll(int deadLetterArchiveDays, int replayLogDays, int outboxDays, boolean dryRun) {
        Instant now = clock.instant();
        Map<String, TableRetention> tables = new LinkedHashMap<>();
        int errors = 0;
        errors += apply(deadLetterArchivePurger, now, deadLetterArchiveDays, dryRun, tables);
        errors += apply(replayLogPurger, now, replayLogDays, dryRun, tables);
        errors += apply(outboxPurger, now, outboxDays, dryRun, tables);

        TableRetention expiredLocks = new TableRetention(0, 0);
        if (lock != null) {
            long expired = lock.countExpired();
            long removed = dryRun ? 0 : lock.cleanupExpired();
            expiredLocks = new TableRetention(expired, removed);
        }

        RetentionReport report = new RetentionReport(tables, expiredLocks, dryRun, errors);
        logger.log(errors > 0 ? Level.WARNING : Level.INFO, "Retention pass{0}: {1}",
                new Object[]{dryRun ? " (dry run)" : "", report});
        return report;
    }

    private int apply(RetentionPurger purger, Instant now, int days, boolean dryRun,
            Map<String, TableRetention> tables) {
        if (purger == null) {
            return 0;
        }
        Instant cutoff = now.minus(Duration.ofDays(days));
        long candidates;
        try (Connection conn = connectionProvider.getConnection()) {
            candidates = purger.count(conn, cutoff);
        } catch (SQLException | StoreException e) {
            logger.log(Level.SEVERE, "Failed to count expired rows of " + purger.table(), e);
            tables.put(purger.table(), new TableRetention(0, 0));
            return 1;
        }
        if (dryRun || candidates == 0) {
            tables.put(purger.table(), new TableRetention(candidates, 0));
            return 0;
        }

        long deleted = 0;
        int errors = 0;
        try {
            int batch;
            do {
                batch = purgeBatch(purger, cutoff);
                deleted += batch;
            } while (batch >= batchSize);
        } catch (SQLException | StoreException e) {
            logger.log(Level.SEVERE, "Failed to purge " + purger.table() + " after " + deleted + " rows", e);
            errors = 1;
        }
        long total = deleted;
        SideEffects.bestEffort("metrics.retentionDeleted", () -> metrics.recordRetentionDeleted(purger.table(), total));
        tables.put(purger.table(), new TableRetention(candidates, deleted));
        return errors;
    }

    private int purgeBatch(RetentionPurger purger, Instant cutoff) throws SQLException {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return purger.purge(conn, cutoff, batchSize);
        }
    }

    /**
     * Deletes expired lock rows.
     *
     * @return rows deleted, {@code 0} without a configured lock
     */
    public int cleanupExpiredLocks() {
        return lock != null ? lock.cleanupExpired() : 0;
    }

    /**
     * Removes reclaim counters whose message is no longer in the pending-entry
     * list. Nothing is removed if the pending list cannot be read or holds more
     * entries than {@code reclaimCounterScanSize}.
     *
     * @param maxEntriesToCheck maximum counters examined
     */
    public ReclaimCounterGcResult gcReclaimAttempts(int maxEntriesToCheck) {
        if (queue == null || queue.attemptStore() == null) {
            return new ReclaimCounterGcResult(0, 0);
        }
        ReclaimAttemptStore attemptStore = queue.attemptStore();
        List<String> tracked;
        try {
            tracked = attemptStore.trackedIds(maxEntriesToCheck);
        } catch (StoreException e) {
            logger.log(Level.SEVERE, "Failed to list reclaim counters", e);
            return new ReclaimCounterGcResult(0, 0);
        }
        if (tracked.isEmpty()) {
            return new ReclaimCounterGcResult(0, 0);
        }
        Set<String> pendingIds;
        try {
            List<PendingEntry> scanned =
                    queue.store().pending(queue.streamKey(), queue.group(), reclaimCounterScanSize);
            long pendingTotal = queue.store().pendingCount(queue.streamKey(), queue.group());
            if (scanned.size() < pendingTotal) {
                logger.log(Level.WARNING, "Pending list holds {0} entries but only {1} were scanned; "
                        + "keeping all reclaim counters", new Object[]{pendingTotal, scanned.size()});
                return new ReclaimCounterGcResult(tracked.size(), 0);
            }
            pendingIds = scanned.stream()
                    .map(PendingEntry::id)
                    .collect(Collectors.toSet());
        } catch (StoreException e) {
            logger.log(Level.SEVERE, "Failed to read pending entries; keeping all reclaim counters", e);
            return new ReclaimCounterGcResult(tracked.size(), 0);
        }
        List<String> stale = tracked.stream().filter(id -> !pendingIds.contains(id)).toList();
        if (stale.isEmpty()) {
            return new ReclaimCounterGcResult(tracked.size(), 0);
        }
        try {
            attemptStore.clear(stale);
        } catch (StoreException e) {
            logger.log(Level.SEVERE, "Failed to remove stale reclaim counters", e);
            return new ReclaimCounterGcResult(tracked.size(), 0);
        }
        logger.log(Level.INFO, "Removed {0} stale reclaim counters of {1} checked",
                new Object[]{stale.size(), tracked.size()});
        return new ReclaimCounterGcResult(tracked.size(), stale.size());
    }

    /**
     * Runs one pass with the configured windows, under the retention lock when
     * one is configured. Also cleans reclaim counters when a queue is attached.
     *
     * @return the report, or {@code null} if the lock is held elsewhere or the pass is closed
     */
    public RetentionReport runOnce() {
        if (closed) {
            return null;
        }
        try {
            if (lock == null || lockName == null || lockName.isEmpty()) {
                return runConfigured();
            }
            return lock.runExclusive(lockName, holderId, lockTtl, this::runConfigured).orElse(null);
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Retention cycle failed", t);
            return null;
        }
    }

    private RetentionReport runConfigured() {
        RetentionReport report = runAll(deadLetterArchiveDays, replayLogDays, outboxDays, dryRun);
        if (queue != null && !dryRun) {
            gcReclaimAttempts(reclaimCounterScanSize);
        }
        return report;
    }

    /**
     * Starts the periodic retention loop. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("RetentionGC has been closed");
        }
        if (gcTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("retention-gc-"));
        gcTask = scheduler.scheduleWithFixedDelay(
                this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    /** Cancels the retention schedule and shuts down the scheduler thread. */
    @Override
    public synchronized void close() {
        closed = true;
        if (gcTask != null) {
            gcTask.cancel(false);
            gcTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /** Builder for {@link RetentionGC}. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private RetentionPurger deadLetterArchivePurger;
        private RetentionPurger replayLogPurger;
        private RetentionPurger outboxPurger;
        private DistributedLock lock;
        private String lockName = "retention_cleanup";
        private Duration lockTtl = Duration.ofMinutes(10);
        private String holderId;
        private int deadLetterArchiveDays = 90;
        private int replayLogDays = 30;
        private int outboxDays = 7;
        private boolean dryRun;
        private int batchSize = 500;
        private DurableQueue queue;
        private int reclaimCounterScanSize = 100_000;
        private MetricsExporter metrics;
        private Clock clock;
        private long intervalSeconds = 86_400;

        private Builder() {
        }

        /**
         * <p><b>Required.</b>
         *
         * @param connectionProvider connection provider for all purgers
         * @return this builder
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Sets the purger of archived dead letters. Optional.
         *
         * @param purger purger
         * @return this builder
         */
        public Builder deadLetterArchivePurger(RetentionPurger purger) {
            this.deadLetterArchivePurger = purger;
            return this;
        }

        /**
         * Sets the purger of replay log records. Optional.
         *
         * @param purger purger
         * @return this builder
         */
        public Builder replayLogPurger(RetentionPurger purger) {
            this.replayLogPurger = purger;
            return this;
        }

        /**
         * Sets the purger of processed outbox records. Optional.
         *
         * @param purger purger
         * @return this builder
         */
        public Builder outboxPurger(RetentionPurger purger) {
            this.outboxPurger = purger;
            return this;
        }

        /**
         * Sets the lock used for expired-lock cleanup and single-active passes.
         *
         * <p>Optional.
         *
         * @param lock distributed lock
         * @return this builder
         */
        public Builder lock(DistributedLock lock) {
            this.lock = lock;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code retention_cleanup}. An empty name runs
         * passes without locking.
         *
         * @param lockName lock name
         * @return this builder
         */
        public Builder lockName(String lockName) {
            this.lockName = lockName;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 10 minutes}.
         *
         * @param lockTtl lock TTL
         * @return this builder
         */
        public Builder lockTtl(Duration lockTtl) {
            this.lockTtl = lockTtl;
            return this;
        }

        /**
         * <p>Optional. Defaults to a generated {@code retention:<worker>:<suffix>} id.
         *
         * @param holderId lock holder identity
         * @return this builder
         */
        public Builder holderId(String holderId) {
            this.holderId = holderId;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 90}.
         *
         * @param days retention of archived dead letters
         * @return this builder
         */
        public Builder deadLetterArchiveDays(int days) {
            this.deadLetterArchiveDays = days;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 30}.
         *
         * @param days retention of replay log records
         * @return this builder
         */
        public Builder replayLogDays(int days) {
            this.replayLogDays = days;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 7}.
         *
         * @param days retention of processed outbox records
         * @return this builder
         */
        public Builder outboxDays(int days) {
            this.outboxDays = days;
            return this;
        }

        /**
         * Makes scheduled passes count without deleting.
         *
         * <p>Optional. Defaults to {@code false}.
         *
         * @param dryRun whether to suppress deletion
         * @return this builder
         */
        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 500}.
         *
         * @param batchSize rows deleted per statement
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Attaches the queue whose reclaim counters are cleaned on each pass.
         *
         * <p>Optional.
         *
         * @param queue work queue
         * @return this builder
         */
        public Builder queue(DurableQueue queue) {
            this.queue = queue;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 100000}. Counters are only cleaned when the
         * whole pending list fits in one scan.
         *
         * @param scanSize pending entries read when cleaning reclaim counters
         * @return this builder
         */
        public Builder reclaimCounterScanSize(int scanSize) {
            this.reclaimCounterScanSize = scanSize;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * <p>Optional. Defaults to the UTC system clock.
         *
         * @param clock clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * <p>Optional. Defaults to {@code 86400}.
         *
         * @param intervalSeconds interval between scheduled passes
         * @return this builder
         */
        public Builder intervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
            return this;
        }

        /**
         * @return a new {@link RetentionGC}
         * @throws NullPointerException if {@code connectionProvider} is null
         * @throws IllegalArgumentException if a numeric setting is out of range
         */
        public RetentionGC build() {
            return new RetentionGC(this);
        }
    }
}
