package io.recovery.queue;

import io.recovery.model.GroupCreation;
import io.recovery.model.PendingEntry;
import io.recovery.model.StreamEntry;
import io.recovery.model.StreamInfo;
import io.recovery.model.WorkMessage;
import io.recovery.spi.MetricsExporter;
import io.recovery.spi.ReclaimAttemptStore;
import io.recovery.spi.StoreException;
import io.recovery.spi.StreamStore;
import io.recovery.util.Identities;
import io.recovery.util.JsonCodec;
import io.recovery.util.SideEffects;
import io.recovery.util.Timestamps;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Work queue over one stream and one consumer group.
 *
 * <p>Every operation degrades to an empty or {@code false} result when the stream
 * store is unavailable; failures are logged, never thrown. The consumer group is
 * registered lazily on first use.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see io.recovery.reclaim.ReclaimScheduler
 * @see io.recovery.dead.DeadLetterPipeline
 */
public final class DurableQueue {
    private static final Logger logger = Logger.getLogger(DurableQueue.class.getName());

    private final StreamStore store;
    private final String streamKey;
    private final String group;
    private final String consumer;
    private final long maxLength;
    private final ReclaimAttemptStore attemptStore;
    private final MetricsExporter metrics;
    private final JsonCodec jsonCodec;
    private final Clock clock;

    private volatile boolean groupReady;

    private DurableQueue(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store");
        this.streamKey = Objects.requireNonNull(builder.streamKey, "streamKey");
        this.group = Objects.requireNonNull(builder.group, "group");
        this.consumer = builder.consumer != null ? builder.consumer : Identities.defaultWorkerId();
        if (builder.maxLength < 0) {
            throw new IllegalArgumentException("maxLength must be >= 0");
        }
        this.maxLength = builder.maxLength;
        this.attemptStore = builder.attemptStore;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers the consumer group if needed.
     *
     * @return the creation status, or empty if the store is unavailable
     */
    public Optional<GroupCreation> ensureGroup() {
        try {
            GroupCreation status = store.createGroup(streamKey, group);
            groupReady = true;
            if (status == GroupCreation.CREATED) {
                logger.log(Level.INFO, "Created consumer group {0} on {1}", new Object[]{group, streamKey});
            }
            return Optional.of(status);
        } catch (StoreException e) {
            logger.log(Level.SEVERE, "Failed to ensure consumer group " + group + " on " + streamKey, e);
            return Optional.empty();
        }
    }

    /**
     * Appends a message using the configured maximum stream length.
     *
     * @return the new message id, or empty if the append failed
     */
    public Optional<String> enqueue(Map<String, String> fields) {
        return enqueue(fields, maxLength);
    }

    /**
     * Appends a message. The store may trim the oldest entries to keep the stream
     * near {@code maxLength}; use {@link io.recovery.dead.ArchiveTrimmer} where
     * trimmed history must be kept.
     *
     * @param maxLength approximate bound, {@code 0} for unbounded
     * @return the new message id, or empty if the append failed
     */
    public Optional<String> enqueue(Map<String, String> fields, long maxLength) {
        Objects.requireNonNull(fields, "fields");
        if (!groupReady) {
            ensureGroup();
        }
        try {
            String id = store.add(streamKey, fields, maxLength);
            SideEffects.bestEffort("metrics.enqueued", metrics::incrementEnqueued);
            logger.log(Level.FINE, "Enqueued {0} to {1}", new Object[]{id, streamKey});
            return Optional.of(id);
        } catch (StoreException e) {
            logger.log(Level.SEVERE, "Failed to enqueue to " + streamKey, e);
            return Optional.empty();
        }
    }

    /**
     * Appends a work item for {@code subjectId} with the standard field layout.
     *
     * @param metadata       optional metadata, stored as a JSON object
     * @param idempotencyKey optional producer idempotency key
     * @return the new message id, or empty if the append failed
     */
    public Optional<String> enqueue(String subjectId, double priority,
            Map<String, String> metadata, String idempotencyKey) {
        Objects.requireNonNull(subjectId, "subjectId");
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(WorkMessage.CANDIDATE_ID, subjectId);
        fields.put(WorkMessage.PRIORITY, String.valueOf(priority));
        fields.put(WorkMessage.ENQUEUED_AT, Timestamps.format(clock.instant()));
        if (metadata != null && !metadata.isEmpty()) {
            fields.put(WorkMessage.METADATA, jsonCodec.toJson(metadata));
        }
        if (idempotencyKey != null && !idempotencyKey.isEmpty()) {
            fields.put(WorkMessage.IDEMPOTENCY_KEY, idempotencyKey);
        }
        return enqueue(fields);
    }

    /**
     * Reads messages never delivered to this group, blocking up to {@code block}.
     *
     * @return delivered messages; empty on timeout or store failure
     */
    public List<WorkMessage> consumeBatch(int batchSize, Duration block) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (!groupReady && ensureGroup().isEmpty()) {
            return List.of();
        }
        try {
            return store.readGroup(streamKey, group, consumer, batchSize, block).stream()
                    .map(WorkMessage::from)
                    .toList();
        } catch (StoreException e) {
            logger.log(Level.SEVERE, "Failed to consume from " + streamKey, e);
            return List.of();
        }
    }

    /**
     * Acknowledges a message and clears its reclaim counter.
     *
     * @return {@code true} if the message was pending and is now acknowledged
     */
    public boolean ack(String messageId) {
        try {
            boolean acked = store.ack(streamKey, group, List.of(messageId)) > 0;
            if (acked) {
                clearReclaimAttempts(messageId);
                SideEffects.bestEffort("metrics.acked", metrics::incrementAcked);
            }
            return acked;
        } catch (StoreException e) {
            logger.log(Level.SEVERE, "Failed to ack " + messageId, e);
            return false;
        }
    }

    /**
     * Acknowledges a message and deletes it from the stream.
     *
     * @return {@code true} if both calls reached the store
     */
    public boolean ackAndDelete(String messageId) {
        try {
            store.ack(streamKey, group, List.of(messageId));
            store.delete(streamKey, List.of(messageId));
            clearReclaimAttempts(messageId);
            SideEffects.bestEffort("metrics.acked", metrics::incrementAcked);
            return true;
        } catch (StoreException e) {
            logger.log(Level.SEVERE, "Failed to ack and delete " + messageId, e);
            return false;
        }
    }

    /**
     * Lists up to {@code count} delivered but unacknowledged messages.
     */
    public List<PendingEntry> pending(int count) {
        try {
            return store.pending(streamKey, group, count);
        } catch (StoreException e) {
            logger.log(Level.SEVERE, "Failed to list pending entries of " + streamKey, e);
            return List.of();
        }
    }

    /**
     * Takes ownership of pending messages idle for at least {@code idle}, without
     * backoff or dead-letter handling. Intended for workers adopting a crashed
     * peer's messages directly.
     *
     * @param scanSize maximum number of pending entries examined
     */
    public List<WorkMessage> claimStalled(Duration idle, int scanSize) {
        try {
            List<String> stalled = store.pending(streamKey, group, scanSize).stream()
                    .filter(p -> p.idle().compareTo(idle) >= 0)
                    .map(PendingEntry::id)
                    .toList();
            if (stalled.isEmpty()) {
                return List.of();
            }
            List<WorkMessage> claimed = store.claim(streamKey, group, consumer, idle, stalled).stream()
                    .map(WorkMessage::from)
                    .toList();
            for (WorkMessage message : claimed) {
                logger.log(Level.INFO, "Claimed stalled message {0} for subject {1}",
                        new Object[]{message.id(), message.subjectId()});
            }
            return claimed;
        } catch (StoreException e) {
            logger.log(Level.SEVERE, "Failed to claim stalled messages of " + streamKey, e);
            return List.of();
        }
    }

    /**
     * Reads one message by id.
     */
    public Optional<WorkMessage> read(String messageId) {
        try {
            return store.get(streamKey, messageId).map(WorkMessage::from);
        } catch (StoreException e) {
            logger.log(Level.SEVERE, "Failed to read " + messageId, e);
            return Optional.empty();
        }
    }

    /**
     * Returns stream length and pending count; zero counts if the store is unavailable.
     */
    public StreamInfo info() {
        try {
            long length = store.length(streamKey);
            long pendingCount = groupReady || ensureGroup().isPresent() ? store.pendingCount(streamKey, group) : 0;
            SideEffects.bestEffort("metrics.pending", () -> metrics.recordPending(pendingCount));
            return new StreamInfo(streamKey, group, length, pendingCount);
        } catch (StoreException e) {
            logger.log(Level.SEVERE, "Failed to read stream info of " + streamKey, e);
            return new StreamInfo(streamKey, group, 0, 0);
        }
    }

    /**
     * Clears the reclaim counter of {@code messageId} as a non-critical side effect.
     */
    public void clearReclaimAttempts(String messageId) {
        if (attemptStore != null) {
            SideEffects.bestEffort("clear reclaim attempts", () -> attemptStore.clear(messageId));
        }
    }

    public StreamStore store() {
        return store;
    }

    public String streamKey() {
        return streamKey;
    }

    public String group() {
        return group;
    }

    public String consumer() {
        return consumer;
    }

    public long maxLength() {
        return maxLength;
    }

    /** Returns the reclaim counter store, or {@code null} if counters are not tracked. */
    public ReclaimAttemptStore attemptStore() {
        return attemptStore;
    }

    public MetricsExporter metrics() {
        return metrics;
    }

    public Clock clock() {
        return clock;
    }

    /** Builder for {@link DurableQueue}. */
    public static final class Builder {
        private StreamStore store;
        private String streamKey = "m10:evaluate:stream";
        private String group = "m10:evaluate:group";
        private String consumer;
        private long maxLength = 100_000;
        private ReclaimAttemptStore attemptStore;
        private MetricsExporter metrics;
        private JsonCodec jsonCodec;
        private Clock clock;

        private Builder() {
        }

        /**
         * Sets the stream store.
         *
         * <p><b>Required.</b>
         *
         * @param store the stream store
         * @return this builder
         */
        public Builder store(StreamStore store) {
            this.store = store;
            return this;
        }

        /**
         * Sets the work stream key.
         *
         * <p>Optional. Defaults to {@code m10:evaluate:stream}.
         *
         * @param streamKey stream key
         * @return this builder
         */
        public Builder streamKey(String streamKey) {
            this.streamKey = streamKey;
            return this;
        }

        /**
         * Sets the consumer group name.
         *
         * <p>Optional. Defaults to {@code m10:evaluate:group}.
         *
         * @param group consumer group
         * @return this builder
         */
        public Builder group(String group) {
            this.group = group;
            return this;
        }

        /**
         * Sets this process's consumer identity within the group.
         *
         * <p>Optional. Defaults to the {@code HOSTNAME} environment variable or
         * {@code worker-<pid>}.
         *
         * @param consumer consumer name
         * @return this builder
         */
        public Builder consumer(String consumer) {
            this.consumer = consumer;
            return this;
        }

        /**
         * Sets the approximate maximum stream length applied on enqueue.
         *
         * <p>Optional. Defaults to {@code 100000}. {@code 0} disables trimming.
         *
         * @param maxLength maximum length
         * @return this builder
         */
        public Builder maxLength(long maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        /**
         * Sets the reclaim counter store; counters are cleared on ack.
         *
         * <p>Optional. Without it no counters are tracked.
         *
         * @param attemptStore counter store
         * @return this builder
         */
        public Builder attemptStore(ReclaimAttemptStore attemptStore) {
            this.attemptStore = attemptStore;
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
         * Sets the codec for the {@code metadata} field.
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
         * Sets the clock used for {@code enqueued_at} and derived timestamps.
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
         * Builds the queue. No store call is made until first use.
         *
         * @return a new {@link DurableQueue}
         * @throws NullPointerException if {@code store}, {@code streamKey} or {@code group} is null
         * @throws IllegalArgumentException if {@code maxLength} is negative
         */
        public DurableQueue build() {
            return new DurableQueue(this);
        }
    }
}
