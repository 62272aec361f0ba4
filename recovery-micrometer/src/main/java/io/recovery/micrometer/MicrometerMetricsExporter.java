package io.recovery.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.recovery.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code recovery.enqueue}: messages appended to the work stream</li>
 *   <li>{@code recovery.ack}: messages acknowledged</li>
 *   <li>{@code recovery.reclaim.reclaimed}, {@code .deferred}, {@code .skipped}: reclaim pass outcomes</li>
 *   <li>{@code recovery.dead_letter.moved}: messages dead-lettered</li>
 *   <li>{@code recovery.dead_letter.replayed}, {@code .replay_skipped}: replay outcomes</li>
 *   <li>{@code recovery.dead_letter.archived}: dead letters copied to cold storage</li>
 *   <li>{@code recovery.outbox.processed}, {@code .failed}: outbox completions</li>
 *   <li>{@code recovery.retention.deleted}: rows deleted, tagged with {@code table}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code recovery.dead_letter.depth}: last observed dead-letter stream length</li>
 *   <li>{@code recovery.pending}: last observed pending-entry count</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
    public static final String DEFAULT_PREFIX = "recovery";

    private final MeterRegistry registry;
    private final String namePrefix;
    private final Counter enqueued;
    private final Counter acked;
    private final Counter reclaimed;
    private final Counter reclaimDeferred;
    private final Counter reclaimSkipped;
    private final Counter deadLettered;
    private final Counter replayed;
    private final Counter replaySkipped;
    private final Counter archived;
    private final Counter outboxProcessed;
    private final Counter outboxFailed;
    private final Gauge deadLetterDepthGauge;
    private final Gauge pendingGauge;
    private final Map<String, Counter> retentionDeleted = new ConcurrentHashMap<>();

    private final AtomicLong deadLetterDepth = new AtomicLong();
    private final AtomicLong pending = new AtomicLong();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "recovery"}.
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Creates an exporter with a custom metric name prefix, for several queues in one registry.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "evaluate.recovery"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }
        this.registry = registry;
        this.namePrefix = namePrefix;

        this.enqueued = counter("enqueue", "Messages appended to the work stream");
        this.acked = counter("ack", "Messages acknowledged");
        this.reclaimed = counter("reclaim.reclaimed", "Stalled messages claimed by a reclaim pass");
        this.reclaimDeferred = counter("reclaim.deferred", "Stalled messages deferred by backoff");
        this.reclaimSkipped = counter("reclaim.skipped", "Eligible messages left for the next pass");
        this.deadLettered = counter("dead_letter.moved", "Messages moved to the dead-letter stream");
        this.replayed = counter("dead_letter.replayed", "Dead letters re-enqueued");
        this.replaySkipped = counter("dead_letter.replay_skipped", "Replays skipped as duplicate or unnecessary");
        this.archived = counter("dead_letter.archived", "Dead letters archived before trimming");
        this.outboxProcessed = counter("outbox.processed", "Outbox records delivered");
        this.outboxFailed = counter("outbox.failed", "Outbox records rescheduled after failure");

        this.deadLetterDepthGauge = Gauge.builder(namePrefix + ".dead_letter.depth", deadLetterDepth, AtomicLong::get)
                .description("Dead-letter stream length")
                .register(registry);
        this.pendingGauge = Gauge.builder(namePrefix + ".pending", pending, AtomicLong::get)
                .description("Messages delivered but not acknowledged")
                .register(registry);
    }

    private Counter counter(String suffix, String description) {
        return Counter.builder(namePrefix + "." + suffix)
                .description(description)
                .register(registry);
    }

    @Override
    public void incrementEnqueued() {
        if (closed) return;
        enqueued.increment();
    }

    @Override
    public void incrementAcked() {
        if (closed) return;
        acked.increment();
    }

    @Override
    public void recordReclaimPass(int reclaimed, int deferred, int skipped) {
        if (closed) return;
        this.reclaimed.increment(reclaimed);
        this.reclaimDeferred.increment(deferred);
        this.reclaimSkipped.increment(skipped);
    }

    @Override
    public void incrementDeadLettered() {
        if (closed) return;
        deadLettered.increment();
    }

    @Override
    public void incrementReplayed() {
        if (closed) return;
        replayed.increment();
    }

    @Override
    public void incrementReplaySkipped() {
        if (closed) return;
        replaySkipped.increment();
    }

    @Override
    public void recordArchived(int count) {
        if (closed) return;
        archived.increment(count);
    }

    @Override
    public void incrementOutboxProcessed() {
        if (closed) return;
        outboxProcessed.increment();
    }

    @Override
    public void incrementOutboxFailed() {
        if (closed) return;
        outboxFailed.increment();
    }

    @Override
    public void recordRetentionDeleted(String table, long deleted) {
        if (closed) return;
        retentionDeleted.computeIfAbsent(table, t -> Counter.builder(namePrefix + ".retention.deleted")
                .description("Rows deleted by retention")
                .tag("table", t)
                .register(registry))
                .increment(deleted);
    }

    @Override
    public void recordDeadLetterDepth(long depth) {
        if (closed) return;
        deadLetterDepth.set(depth);
    }

    @Override
    public void recordPending(long pending) {
        if (closed) return;
        this.pending.set(pending);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     */
    @Override
    public void close() {
        closed = true;
        List<Meter> meters = new ArrayList<>(List.of(enqueued, acked, reclaimed, reclaimDeferred, reclaimSkipped,
                deadLettered, replayed, replaySkipped, archived, outboxProcessed, outboxFailed,
                deadLetterDepthGauge, pendingGauge));
        meters.addAll(retentionDeleted.values());
        RuntimeException first = null;
        for (Meter meter : meters) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
