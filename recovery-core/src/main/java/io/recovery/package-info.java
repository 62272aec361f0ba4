/**
 * Recovery backbone: a durable stream queue with consumer groups, stalled-message
 * reclamation, dead-lettering with idempotent replay, dead-letter archiving,
 * TTL-based distributed locks, an outbox consumer and retention GC.
 *
 * <p>Components are plain objects wired with explicit store instances:
 * <ul>
 *   <li>{@link io.recovery.queue.DurableQueue} over a {@link io.recovery.spi.StreamStore}</li>
 *   <li>{@link io.recovery.reclaim.ReclaimScheduler} for pending-entry recovery</li>
 *   <li>{@link io.recovery.dead.DeadLetterPipeline} and {@link io.recovery.dead.ArchiveTrimmer}</li>
 *   <li>{@link io.recovery.lock.DistributedLock}</li>
 *   <li>{@link io.recovery.outbox.OutboxProcessor}</li>
 *   <li>{@link io.recovery.retention.RetentionGC}</li>
 * </ul>
 */
package io.recovery;
