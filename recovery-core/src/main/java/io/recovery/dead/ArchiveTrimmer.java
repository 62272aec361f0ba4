package io.recovery.dead;

import io.recovery.model.DeadLetterArchiveRecord;
import io.recovery.model.DeadLetterEntry;
import io.recovery.model.StreamEntry;
import io.recovery.spi.ConnectionProvider;
import io.recovery.spi.DeadLetterArchiveStore;
import io.recovery.spi.MetricsExporter;
import io.recovery.spi.StoreException;
import io.recovery.spi.StreamStore;
import io.recovery.util.DaemonThreadFactory;
import io.recovery.util.Identities;
import io.recovery.util.JsonCodec;
import io.recovery.util.SideEffects;
import io.recovery.util.Timestamps;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps the dead-letter stream bounded without losing entries: the oldest
 * entries beyond the maximum length are copied to a {@link DeadLetterArchiveStore}
 * and only then deleted from the stream.
 *
 * <p>Only entries whose archive write succeeded are deleted. Archiving is an
 * upsert on the dead-letter id, so a pass interrupted between the two steps is
 * safely repeated.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class ArchiveTrimmer implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ArchiveTrimmer.class.getName());

    private final StreamStore store;
    private final String deadLetterStreamKey;
    private final long maxLength;
    private final int batchSize;
    private final ConnectionProvider connectionProvider;
    private final DeadLetterArchiveStore archiveStore;
    private final JsonCodec jsonCodec;
    private final String archivedBy;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final long intervalSeconds;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> trimTask;
    private volatile boolean closed;

    private ArchiveTrimmer(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store");
        this.deadLetterStreamKey = Objects.requireNonNull(builder.deadLetterStreamKey, "deadLetterStreamKey");
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.archiveStore = Objects.requireNonNull(builder.archiveStore, "archiveStore");
        if (builder.maxLength < 0) {
            throw new IllegalArgumentException("maxLength must be >= 0");
        }
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.intervalSeconds <= 0L) {
            throw new IllegalArgumentException("intervalSeconds must be > 0");
        }
        this.maxLength = builder.maxLength;
        this.batchSize = builder.batchSize;
        this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
        this.archivedBy = builder.archivedBy != null ? builder.archivedBy : Identities.defaultWorkerId();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.intervalSeconds = builder.intervalSeconds;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the periodic archive loop. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("ArchiveTrimmer has been closed");
        }
        if (trimTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("dead-letter-archive-"));
        trimTask = scheduler.scheduleWithFixedDelay(
                this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    /**
     * Runs one pass against the configured maximum length.
     */
    public ArchiveResult runOnce() {
        if (closed) {
            return ArchiveResult.EMPTY;
        }
        try {
            return archiveAndTrim(maxLength);
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Archive cycle failed", t);
            return new ArchiveResult(0, 0, 1);
        }
    }

    /**
     * Archives and deletes the oldest entries until the stream is at most
     * {@code maxLength} long.
     */
    public ArchiveResult archiveAndTrim(long maxLength) {
        long length;
        try {
            length = store.length(deadLetterStreamKey);
        } catch (StoreException e) {
            logger.log(Level.SEVERE, "Failed to read length of " + deadLetterStreamKey, e);
            return new ArchiveResult(0, 0, 1);
        }
        long excess = length - maxLength;
        if (excess <= 0) {
            return ArchiveResult.EMPTY;
        }

        int archived = 0;
        int trimmed = 0;
        int errors = 0;
        String cursor = null;
        long remaining = excess;
        while (remaining > 0) {
            List<StreamEntry> page;
            try {
                page = store.range(deadLetterStreamKey, cursor, (int) Math.min(remaining, batchSize));
            } catch (StoreException e) {
                logger.log(Level.SEVERE, "Failed to read oldest entries of " + deadLetterStreamKey, e);
                errors++;
                break;
            }
            if (page.isEmpty()) {
                break;
            }
            cursor = page.get(page.size() - 1).id();
            remaining -= page.size();

            List<String> archivedIds = archive(page);
            archived += archivedIds.size();
            errors += page.size() - archivedIds.size();
            if (archivedIds.isEmpty()) {
                continue;
            }
            try {
                trimmed += (int) store.delete(deadLetterStreamKey, archivedIds);
            } catch (StoreException e) {
                logger.log(Level.SEVERE, "Archived " + archivedIds.size()
                        + " dead letters but failed to delete them; next pass re-archives", e);
                errors += archivedIds.size();
            }
        }

        int archivedCount = archived;
        SideEffects.bestEffort("metrics.archived", () -> metrics.recordArchived(archivedCount));
        ArchiveResult result = new ArchiveResult(archived, trimmed, errors);
        logger.log(errors > 0 ? Level.WARNING : Level.INFO,
                "Dead-letter archive pass on {0}: {1}", new Object[]{deadLetterStreamKey, result});
        return result;
    }

    private List<String> archive(List<StreamEntry> page) {
        List<String> archivedIds = new ArrayList<>(page.size());
        Instant now = clock.instant();
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            for (StreamEntry entry : page) {
                try {
                    archiveStore.upsert(conn, toRecord(entry), now);
                    archivedIds.add(entry.id());
                } catch (StoreException e) {
                    logger.log(Level.SEVERE, "Failed to archive dead letter " + entry.id(), e);
                }
            }
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to obtain connection for dead-letter archive", e);
        }
        return archivedIds;
    }

    private DeadLetterArchiveRecord toRecord(StreamEntry entry) {
        DeadLetterEntry deadLetter = DeadLetterEntry.from(entry);
        return new DeadLetterArchiveRecord(
                entry.id(),
                deadLetter.originalMsgId(),
                deadLetter.subjectId(),
                jsonCodec.toJson(entry.fields()),
                deadLetter.reason(),
                Timestamps.parseOrNull(deadLetter.deadLetteredAt()),
                archivedBy);
    }

    /** Cancels the archive schedule and shuts down the scheduler thread. */
    @Override
    public synchronized void close() {
        closed = true;
        if (trimTask != null) {
            trimTask.cancel(false);
            trimTask = null;
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

    /** Builder for {@link ArchiveTrimmer}. */
    public static final class Builder {
        private StreamStore store;
        private String deadLetterStreamKey = "m10:evaluate:dead-letter";
        private long maxLength = 10_000;
        private int batchSize = 500;
        private ConnectionProvider connectionProvider;
        private DeadLetterArchiveStore archiveStore;
        private JsonCodec jsonCodec;
        private String archivedBy;
        private MetricsExporter metrics;
        private Clock clock;
        private long intervalSeconds = 3600;

        private Builder() {
        }

        /**
         * Sets the store holding the dead-letter stream.
         *
         * <p><b>Required.</b>
         *
         * @param store stream store
         * @return this builder
         */
        public Builder store(StreamStore store) {
            this.store = store;
            return this;
        }

        /**
         * Sets the dead-letter stream key.
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
         * Sets the length {@link ArchiveTrimmer#runOnce()} trims to.
         *
         * <p>Optional. Defaults to {@code 10000}.
         *
         * @param maxLength maximum stream length
         * @return this builder
         */
        public Builder maxLength(long maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        /**
         * Sets how many entries are read and archived per round trip.
         *
         * <p>Optional. Defaults to {@code 500}.
         *
         * @param batchSize entries per page
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets the connection provider for the archive store.
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
         * Sets the cold storage.
         *
         * <p><b>Required.</b>
         *
         * @param archiveStore archive store
         * @return this builder
         */
        public Builder archiveStore(DeadLetterArchiveStore archiveStore) {
            this.archiveStore = archiveStore;
            return this;
        }

        /**
         * Sets the codec producing the archived payload.
         *
         * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
         *
         * @param jsonCodec codec
         * @return this builder
         */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        /**
         * Sets the identity written to {@code archived_by}.
         *
         * <p>Optional. Defaults to the worker id.
         *
         * @param archivedBy identity
         * @return this builder
         */
        public Builder archivedBy(String archivedBy) {
            this.archivedBy = archivedBy;
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
         * Sets the clock for {@code archived_at}.
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
         * Sets the interval in seconds between passes.
         *
         * <p>Optional. Defaults to {@code 3600}.
         *
         * @param intervalSeconds interval
         * @return this builder
         */
        public Builder intervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
            return this;
        }

        /**
         * @return a new {@link ArchiveTrimmer}
         * @throws NullPointerException if a required collaborator is null
         * @throws IllegalArgumentException if a numeric setting is out of range
         */
        public ArchiveTrimmer build() {
            return new ArchiveTrimmer(this);
        }
    }
}
