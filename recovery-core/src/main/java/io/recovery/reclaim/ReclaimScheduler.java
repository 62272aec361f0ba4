package io.recovery.reclaim;

import io.recovery.dead.DeadLetterPipeline;
import io.recovery.model.DeadLetterEntry;
import io.recovery.model.PendingEntry;
import io.recovery.model.StreamEntry;
import io.recovery.queue.DurableQueue;
import io.recovery.spi.ReclaimAttemptStore;
import io.recovery.spi.StoreException;
import io.recovery.spi.StreamStore;
import io.recovery.util.DaemonThreadFactory;
import io.recovery.util.SideEffects;

import java.time.Duration;
import java.util.ArrayList;
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
 * Periodic pass over a queue's pending-entry list that takes over stalled
 * messages and dead-letters the ones that keep failing.
 *
 * <p>A pending entry whose delivery count reached {@code maxAttempts} is
 * dead-lettered regardless of backoff. Any other entry is claimed once its idle
 * time reaches the required idle: the idle threshold for a message never
 * reclaimed, or {@code backoff(attempts)} after earlier reclaims when backoff is
 * enabled. At most {@code maxPerPass} entries are claimed per pass; the rest are
 * counted as skipped and re-evaluated next pass.
 *
 * <p>Safe to run from many workers at once: the store's claim is atomic per
 * entry, and an entry lost to another worker is simply not counted.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class ReclaimScheduler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(ReclaimScheduler.class.getName());

    private final DurableQueue queue;
    private final DeadLetterPipeline deadLetters;
    private final BackoffPolicy backoff;
    private final Duration idleThreshold;
    private final int maxAttempts;
    private final int maxPerPass;
    private final int scanSize;
    private final boolean useBackoff;
    private final long intervalMillis;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> reclaimTask;
    private volatile boolean closed;

    private ReclaimScheduler(Builder builder) {
        this.queue = Objects.requireNonNull(builder.queue, "queue");
        this.deadLetters = Objects.requireNonNull(builder.deadLetters, "deadLetters");
        if (builder.idleThreshold == null || builder.idleThreshold.isNegative()) {
            throw new IllegalArgumentException("idleThreshold must be >= 0");
        }
        if (builder.maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (builder.maxPerPass <= 0) {
            throw new IllegalArgumentException("maxPerPass must be > 0");
        }
        if (builder.scanSize <= 0) {
            throw new IllegalArgumentException("scanSize must be > 0");
        }
        if (builder.intervalMillis <= 0L) {
            throw new IllegalArgumentException("intervalMillis must be > 0");
        }
        this.backoff = builder.backoff != null ? builder.backoff : ExponentialBackoffPolicy.reclaimDefaults();
        this.idleThreshold = builder.idleThreshold;
        this.maxAttempts = builder.maxAttempts;
        this.maxPerPass = builder.maxPerPass;
        this.scanSize = builder.scanSize;
        this.useBackoff = builder.useBackoff;
        this.intervalMillis = builder.intervalMillis;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the periodic reclaim loop. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("ReclaimScheduler has been closed");
        }
        if (reclaimTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("reclaim-"));
        reclaimTask = scheduler.scheduleWithFixedDelay(
                this::runOnce, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * Runs one pass with the configured settings.
     *
     * @return the pass outcome, {@link ReclaimResult#EMPTY} once closed
     */
    public ReclaimResult runOnce() {
        if (closed) {
            return ReclaimResult.EMPTY;
        }
        try {
            return reclaimStalled(idleThreshold, maxAttempts, maxPerPass, useBackoff);
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Reclaim cycle failed", t);
            return new ReclaimResult(0, 0, 0, 0, 1);
        }
    }

    /**
     * Runs one reclaim pass.
     *
     * @param idleThreshold idle time required before a never-reclaimed message is claimed
     * @param maxAttempts   delivery count at which a message is dead-lettered
     * @param maxPerPass    maximum claims in this pass
     * @param useBackoff    whether earlier reclaims lengthen the required idle time
     */
    public ReclaimResult reclaimStalled(Duration idleThreshold, int maxAttempts, int maxPerPass, boolean useBackoff) {
        StreamStore store = queue.store();
        List<PendingEntry> pending;
        try {
            pending = store.pending(queue.streamKey(), queue.group(), scanSize);
        } catch (StoreException e) {
            logger.log(Level.SEVERE, "Failed to read pending entries of " + queue.streamKey(), e);
            return new ReclaimResult(0, 0, 0, 0, 1);
        }

        List<PendingEntry> exhausted = new ArrayList<>();
        List<String> candidates = new ArrayList<>();
        Duration minIdle = null;
        int deferred = 0;
        int skipped = 0;
        for (PendingEntry entry : pending) {
            if (entry.deliveryCount() >= maxAttempts) {
                exhausted.add(entry);
                continue;
            }
            Duration required = requiredIdle(entry.id(), idleThreshold, useBackoff);
            if (entry.idle().compareTo(required) < 0) {
                logger.log(Level.FINE, "Deferring {0}: idle {1} ms < required {2} ms",
                        new Object[]{entry.id(), entry.idle().toMillis(), required.toMillis()});
                deferred++;
                continue;
            }
            if (candidates.size() >= maxPerPass) {
                skipped++;
                continue;
            }
            candidates.add(entry.id());
            minIdle = minIdle == null || required.compareTo(minIdle) < 0 ? required : minIdle;
        }

        int errors = 0;
        int reclaimed = 0;
        if (!candidates.isEmpty()) {
            try {
                reclaimed = claim(store, candidates, minIdle);
            } catch (StoreException e) {
                logger.log(Level.SEVERE, "Failed to claim stalled messages of " + queue.streamKey(), e);
                errors++;
            }
        }

        int deadLettered = 0;
        for (PendingEntry entry : exhausted) {
            try {
                if (deadLetter(store, entry)) {
                    deadLettered++;
                } else {
                    errors++;
                }
            } catch (StoreException e) {
                logger.log(Level.SEVERE, "Failed to read exhausted message " + entry.id(), e);
                errors++;
            }
        }

        ReclaimResult result = new ReclaimResult(reclaimed, deadLettered, skipped, deferred, errors);
        SideEffects.bestEffort("metrics.reclaimPass",
                () -> queue.metrics().recordReclaimPass(result.reclaimed(), result.backoffDeferred(), result.skipped()));
        if (reclaimed > 0 || deadLettered > 0 || skipped > 0 || errors > 0) {
            logger.log(Level.INFO, "Reclaim pass on {0}: {1}", new Object[]{queue.streamKey(), result});
        }
        return result;
    }

    private Duration requiredIdle(String messageId, Duration idleThreshold, boolean useBackoff) {
        if (!useBackoff) {
            return idleThreshold;
        }
        long attempts = attempts(messageId);
        if (attempts < 1) {
            return idleThreshold;
        }
        return backoff.delay((int) Math.min(attempts, Integer.MAX_VALUE));
    }

    private long attempts(String messageId) {
        ReclaimAttemptStore attemptStore = queue.attemptStore();
        if (attemptStore == null) {
            return 0;
        }
        try {
            return attemptStore.get(messageId);
        } catch (StoreException e) {
            logger.log(Level.WARNING, "Reclaim counter of " + messageId + " unavailable; using idle threshold", e);
            return 0;
        }
    }

    private int claim(StreamStore store, List<String> ids, Duration minIdle) {
        Duration floor = minIdle.compareTo(Duration.ofMillis(1)) < 0 ? Duration.ofMillis(1) : minIdle;
        List<StreamEntry> claimed = store.claim(queue.streamKey(), queue.group(), queue.consumer(), floor, ids);
        ReclaimAttemptStore attemptStore = queue.attemptStore();
        for (StreamEntry entry : claimed) {
            if (attemptStore != null) {
                SideEffects.bestEffort("reclaim counter", () -> attemptStore.increment(entry.id()));
            }
            logger.log(Level.INFO, "Reclaimed {0}", entry.id());
        }
        if (claimed.size() < ids.size()) {
            logger.log(Level.FINE, "{0} of {1} candidates were taken by another consumer",
                    new Object[]{ids.size() - claimed.size(), ids.size()});
        }
        return claimed.size();
    }

    private boolean deadLetter(StreamStore store, PendingEntry entry) {
        Optional<StreamEntry> message = store.get(queue.streamKey(), entry.id());
        if (message.isEmpty()) {
            // Trimmed from the stream while pending; nothing left to preserve.
            logger.log(Level.WARNING, "Exhausted message {0} no longer in stream; acknowledging", entry.id());
            store.ack(queue.streamKey(), queue.group(), List.of(entry.id()));
            queue.clearReclaimAttempts(entry.id());
            return true;
        }
        return deadLetters.moveToDeadLetter(entry.id(), message.get().fields(), DeadLetterEntry.MAX_RECLAIMS_EXCEEDED);
    }

    /** Cancels the reclaim schedule and shuts down the scheduler thread. */
    @Override
    public synchronized void close() {
        closed = true;
        if (reclaimTask != null) {
            reclaimTask.cancel(false);
            reclaimTask = null;
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

    /** Builder for {@link ReclaimScheduler}. */
    public static final class Builder {
        private DurableQueue queue;
        private DeadLetterPipeline deadLetters;
        private BackoffPolicy backoff;
        private Duration idleThreshold = Duration.ofMinutes(5);
        private int maxAttempts = 3;
        private int maxPerPass = 20;
        private int scanSize = 100;
        private boolean useBackoff = true;
        private long intervalMillis = 30_000;

        private Builder() {
        }

        /**
         * Sets the queue whose pending entries are reclaimed.
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
         * Sets the pipeline exhausted messages are moved to.
         *
         * <p><b>Required.</b>
         *
         * @param deadLetters dead-letter pipeline
         * @return this builder
         */
        public Builder deadLetters(DeadLetterPipeline deadLetters) {
            this.deadLetters = deadLetters;
            return this;
        }

        /**
         * Sets the backoff applied after earlier reclaims.
         *
         * <p>Optional. Defaults to {@link ExponentialBackoffPolicy#reclaimDefaults()}.
         *
         * @param backoff backoff policy
         * @return this builder
         */
        public Builder backoff(BackoffPolicy backoff) {
            this.backoff = backoff;
            return this;
        }

        /**
         * Sets the idle time before a never-reclaimed message is taken over.
         *
         * <p>Optional. Defaults to {@code 5 minutes}.
         *
         * @param idleThreshold idle threshold
         * @return this builder
         */
        public Builder idleThreshold(Duration idleThreshold) {
            this.idleThreshold = idleThreshold;
            return this;
        }

        /**
         * Sets the delivery count at which a message is dead-lettered.
         *
         * <p>Optional. Defaults to {@code 3}.
         *
         * @param maxAttempts maximum deliveries
         * @return this builder
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        /**
         * Sets the maximum number of claims per pass.
         *
         * <p>Optional. Defaults to {@code 20}.
         *
         * @param maxPerPass claim cap
         * @return this builder
         */
        public Builder maxPerPass(int maxPerPass) {
            this.maxPerPass = maxPerPass;
            return this;
        }

        /**
         * Sets how many pending entries one pass examines.
         *
         * <p>Optional. Defaults to {@code 100}.
         *
         * @param scanSize pending entries per pass
         * @return this builder
         */
        public Builder scanSize(int scanSize) {
            this.scanSize = scanSize;
            return this;
        }

        /**
         * Enables or disables backoff for previously reclaimed messages.
         *
         * <p>Optional. Defaults to {@code true}.
         *
         * @param useBackoff whether to apply backoff
         * @return this builder
         */
        public Builder useBackoff(boolean useBackoff) {
            this.useBackoff = useBackoff;
            return this;
        }

        /**
         * Sets the delay between passes when started with {@link ReclaimScheduler#start()}.
         *
         * <p>Optional. Defaults to {@code 30000}.
         *
         * @param intervalMillis interval in milliseconds
         * @return this builder
         */
        public Builder intervalMillis(long intervalMillis) {
            this.intervalMillis = intervalMillis;
            return this;
        }

        /**
         * @return a new {@link ReclaimScheduler}
         * @throws NullPointerException if {@code queue} or {@code deadLetters} is null
         * @throws IllegalArgumentException if a numeric setting is out of range
         */
        public ReclaimScheduler build() {
            return new ReclaimScheduler(this);
        }
    }
}
