package io.recovery.outbox;

import io.recovery.lock.DistributedLock;
import io.recovery.model.OutboxRecord;
import io.recovery.reclaim.BackoffPolicy;
import io.recovery.reclaim.ExponentialBackoffPolicy;
import io.recovery.spi.ConnectionProvider;
import io.recovery.spi.MetricsExporter;
import io.recovery.spi.OutboxStore;
import io.recovery.spi.StoreException;
import io.recovery.util.DaemonThreadFactory;
import io.recovery.util.Identities;
import io.recovery.util.SideEffects;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Consumer side of the transactional outbox: claims due records, hands them to
 * an {@link OutboxHandler} and records the outcome.
 *
 * <p>{@link #claim} and {@link #complete} are the only claim and completion
 * entry points. A failed completion increments {@code retry_count} and moves
 * {@code process_after}, the single retry-scheduling column, to
 * {@code now + backoff(retry_count)}.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class OutboxProcessor implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(OutboxProcessor.class.getName());

    static final int MAX_ERROR_LENGTH = 4000;

    private final ConnectionProvider connectionProvider;
    private final OutboxStore outboxStore;
    private final OutboxHandler handler;
    private final String processorId;
    private final int batchSize;
    private final Duration claimTimeout;
    private final BackoffPolicy backoff;
    private final DistributedLock lock;
    private final String lockName;
    private final Duration lockTtl;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final long intervalMillis;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean closed;

    private OutboxProcessor(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.outboxStore = Objects.requireNonNull(builder.outboxStore, "outboxStore");
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.claimTimeout == null || builder.claimTimeout.isNegative() || builder.claimTimeout.isZero()) {
            throw new IllegalArgumentException("claimTimeout must be > 0");
        }
        if (builder.intervalMillis <= 0L) {
            throw new IllegalArgumentException("intervalMillis must be > 0");
        }
        this.handler = builder.handler;
        this.processorId = builder.processorId != null ? builder.processorId : Identities.uniqueHolderId("outbox");
        this.batchSize = builder.batchSize;
        this.claimTimeout = builder.claimTimeout;
        this.backoff = builder.backoff != null ? builder.backoff : ExponentialBackoffPolicy.outboxDefaults();
        this.lock = builder.lock;
        this.lockName = builder.lockName;
        this.lockTtl = builder.lockTtl;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.intervalMillis = builder.intervalMillis;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Claims up to {@code batchSize} due records for {@code processorId}.
     *
     * <p>A record is due when it is unprocessed, its {@code process_after} has
     * passed, and it is unclaimed or its claim is older than the claim timeout.
     *
     * @return claimed records, oldest first; empty if the store is unavailable
     */
    public List<OutboxRecord> claim(String processorId, int batchSize) {
        Objects.requireNonNull(processorId, "processorId");
        Instant now = clock.instant();
        try (Connection conn = connectionProvider.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                List<OutboxRecord> claimed = outboxStore.claim(conn, processorId, now, now.minus(claimTimeout), batchSize);
                conn.commit();
                return claimed;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException | StoreException e) {
            logger.log(Level.SEVERE, "Failed to claim outbox records", e);
            return List.of();
        }
    }

    /**
     * Records the outcome of delivering {@code eventId}.
     *
     * <p>On success sets {@code processed_at}. On failure increments
     * {@code retry_count}, sets {@code process_after = now + backoff(retry_count)}
     * and stores {@code error}. Both clear the claim. An unknown id is logged and
     * ignored.
     */
    public void complete(long eventId, String processorId, boolean success, String error) {
        Instant now = clock.instant();
        try (Connection conn = connectionProvider.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                Optional<OutboxRecord> current = outboxStore.findForUpdate(conn, eventId);
                if (current.isEmpty()) {
                    conn.rollback();
                    logger.log(Level.WARNING, "Outbox record {0} not found; completion ignored", eventId);
                    return;
                }
                if (success) {
                    outboxStore.markProcessed(conn, eventId, processorId, now);
                } else {
                    int retryCount = current.get().retryCount() + 1;
                    Instant processAfter = now.plus(backoff.delay(retryCount));
                    outboxStore.scheduleRetry(conn, eventId, processAfter, truncate(error));
                    logger.log(Level.WARNING, "Outbox record {0} failed (attempt {1}), retry after {2}: {3}",
                            new Object[]{eventId, retryCount, processAfter, error});
                }
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException | StoreException e) {
            logger.log(Level.SEVERE, "Failed to complete outbox record " + eventId, e);
            return;
        }
        if (success) {
            SideEffects.bestEffort("metrics.outboxProcessed", metrics::incrementOutboxProcessed);
        } else {
            SideEffects.bestEffort("metrics.outboxFailed", metrics::incrementOutboxFailed);
        }
    }

    /**
     * Claims one batch as this processor and delivers each record to the handler.
     * With a lock configured, does nothing while another processor holds it.
     *
     * @throws IllegalStateException if no handler is configured
     */
    public OutboxBatchResult processOnce() {
        if (handler == null) {
            throw new IllegalStateException("No OutboxHandler configured");
        }
        if (lock == null || lockName == null || lockName.isEmpty()) {
            return deliverBatch();
        }
        return lock.runExclusive(lockName, processorId, lockTtl, this::deliverBatch)
                .orElse(OutboxBatchResult.EMPTY);
    }

    private OutboxBatchResult deliverBatch() {
        List<OutboxRecord> records = claim(processorId, batchSize);
        int processed = 0;
        int failed = 0;
        for (OutboxRecord record : records) {
            try {
                handler.handle(record);
            } catch (Exception e) {
                logger.log(Level.FINE, "Handler failed for outbox record " + record.id(), e);
                complete(record.id(), processorId, false, e.toString());
                failed++;
                continue;
            }
            complete(record.id(), processorId, true, null);
            processed++;
        }
        if (!records.isEmpty()) {
            logger.log(Level.FINE, "Outbox batch: {0} claimed, {1} processed, {2} failed",
                    new Object[]{records.size(), processed, failed});
        }
        return new OutboxBatchResult(records.size(), processed, failed);
    }

    /**
     * Counts unprocessed records, {@code 0} if the store is unavailable.
     */
    public int pendingCount() {
        try (Connection conn = connectionProvider.getConnection()) {
            return outboxStore.countPending(conn);
        } catch (SQLException | StoreException e) {
            logger.log(Level.SEVERE, "Failed to count pending outbox records", e);
            return 0;
        }
    }

    /**
     * Starts periodic {@link #processOnce()} calls. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("OutboxProcessor has been closed");
        }
        if (handler == null) {
            throw new IllegalStateException("No OutboxHandler configured");
        }
        if (pollTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("outbox-processor-"));
        pollTask = scheduler.scheduleWithFixedDelay(
                this::runOnce, 0, intervalMillis, TimeUnit.MILLISECONDS);
    }

    private void runOnce() {
        if (closed) {
            return;
        }
        try {
            processOnce();
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Outbox processing cycle failed", t);
        }
    }

    public String processorId() {
        return processorId;
    }

    /** Cancels the processing schedule and shuts down the scheduler thread. */
    @Override
    public synchronized void close() {
        closed = true;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
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

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }

    /** Builder for {@link OutboxProcessor}. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private OutboxStore outboxStore;
        private OutboxHandler handler;
        private String processorId;
        private int batchSize = 10;
        private Duration claimTimeout = Duration.ofMinutes(5);
        private BackoffPolicy backoff;
        private DistributedLock lock;
        private String lockName = "outbox_processor";
        private Duration lockTtl = Duration.ofMinutes(1);
        private MetricsExporter metrics;
        private Clock clock;
        private long intervalMillis = 1000;

        private Builder() {
        }

        /**
         * Sets the connection provider.
         *
         * <p><b>Required.</b>
         *
         * @param connectionProvider connection provider
         * @return this builder
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Sets the outbox persistence.
         *
         * <p><b>Required.</b>
         *
         * @param outboxStore outbox store
         * @return this builder
         */
        public Builder outboxStore(OutboxStore outboxStore) {
            this.outboxStore = outboxStore;
            return this;
        }

        /**
         * Sets the delivery handler used by {@link OutboxProcessor#processOnce()}.
         *
         * <p>Optional when only {@code claim}/{@code complete} are called directly.
         *
         * @param handler handler
         * @return this builder
         */
        public Builder handler(OutboxHandler handler) {
            this.handler = handler;
            return this;
        }

        /**
         * Sets the processor identity used by {@link OutboxProcessor#processOnce()}.
         *
         * <p>Optional. Defaults to a generated {@code outbox:<worker>:<suffix>} id.
         *
         * @param processorId identity
         * @return this builder
         */
        public Builder processorId(String processorId) {
            this.processorId = processorId;
            return this;
        }

        /**
         * Sets the batch size used by {@link OutboxProcessor#processOnce()}.
         *
         * <p>Optional. Defaults to {@code 10}.
         *
         * @param batchSize records per batch
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets the age after which a claim is considered abandoned.
         *
         * <p>Optional. Defaults to {@code 5 minutes}.
         *
         * @param claimTimeout claim timeout
         * @return this builder
         */
        public Builder claimTimeout(Duration claimTimeout) {
            this.claimTimeout = claimTimeout;
            return this;
        }

        /**
         * Sets the retry backoff.
         *
         * <p>Optional. Defaults to {@link ExponentialBackoffPolicy#outboxDefaults()}.
         *
         * @param backoff backoff policy
         * @return this builder
         */
        public Builder backoff(BackoffPolicy backoff) {
            this.backoff = backoff;
            return this;
        }

        /**
         * Restricts {@link OutboxProcessor#processOnce()} to one active processor.
         *
         * <p>Optional. Without a lock every processor delivers concurrently.
         *
         * @param lock distributed lock
         * @return this builder
         */
        public Builder lock(DistributedLock lock) {
            this.lock = lock;
            return this;
        }

        /**
         * Sets the lock name.
         *
         * <p>Optional. Defaults to {@code outbox_processor}. An empty name disables locking.
         *
         * @param lockName lock name
         * @return this builder
         */
        public Builder lockName(String lockName) {
            this.lockName = lockName;
            return this;
        }

        /**
         * Sets the lock TTL.
         *
         * <p>Optional. Defaults to {@code 1 minute}.
         *
         * @param lockTtl lock TTL
         * @return this builder
         */
        public Builder lockTtl(Duration lockTtl) {
            this.lockTtl = lockTtl;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
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
         * Sets the clock.
         *
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
         * Sets the delay between batches when started.
         *
         * <p>Optional. Defaults to {@code 1000}.
         *
         * @param intervalMillis interval in milliseconds
         * @return this builder
         */
        public Builder intervalMillis(long intervalMillis) {
            this.intervalMillis = intervalMillis;
            return this;
        }

        /**
         * @return a new {@link OutboxProcessor}
         * @throws NullPointerException if {@code connectionProvider} or {@code outboxStore} is null
         * @throws IllegalArgumentException if a numeric setting is out of range
         */
        public OutboxProcessor build() {
            return new OutboxProcessor(this);
        }
    }
}
