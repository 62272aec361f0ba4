package io.recovery.spi;

/**
 * Observability hook for exporting recovery counters and gauges.
 *
 * <p>Every call is a non-critical side effect: components invoke it through
 * {@link io.recovery.util.SideEffects} so an exporter failure never affects the
 * operation being measured. The {@link #NOOP} instance discards everything.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /** A message was appended to the work stream. */
    void incrementEnqueued();

    /** A message was acknowledged. */
    void incrementAcked();

    /**
     * Records the outcome of one reclaim pass.
     *
     * @param reclaimed      entries whose ownership was transferred
     * @param deferred       entries not yet idle long enough
     * @param skipped        eligible entries left for the next pass by the rate limit
     */
    void recordReclaimPass(int reclaimed, int deferred, int skipped);

    /** A message was moved to the dead-letter stream. */
    void incrementDeadLettered();

    /** A dead letter was re-enqueued. */
    void incrementReplayed();

    /** A replay was skipped because it had already happened or was not needed. */
    default void incrementReplaySkipped() {
    }

    /**
     * Records dead-letter entries copied to cold storage.
     *
     * @param count entries archived in one trim pass
     */
    default void recordArchived(int count) {
    }

    /** An outbox record was delivered. */
    void incrementOutboxProcessed();

    /** An outbox record failed and was rescheduled. */
    void incrementOutboxFailed();

    /**
     * Records rows deleted by retention GC.
     *
     * @param table   table name
     * @param deleted rows deleted
     */
    default void recordRetentionDeleted(String table, long deleted) {
    }

    /**
     * Records the current dead-letter stream length.
     *
     * @param depth number of entries
     */
    default void recordDeadLetterDepth(long depth) {
    }

    /**
     * Records the current pending-entry count of the work stream.
     *
     * @param pending number of entries
     */
    default void recordPending(long pending) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEnqueued() {
        }

        @Override
        public void incrementAcked() {
        }

        @Override
        public void recordReclaimPass(int reclaimed, int deferred, int skipped) {
        }

        @Override
        public void incrementDeadLettered() {
        }

        @Override
        public void incrementReplayed() {
        }

        @Override
        public void incrementOutboxProcessed() {
        }

        @Override
        public void incrementOutboxFailed() {
        }
    }
}
