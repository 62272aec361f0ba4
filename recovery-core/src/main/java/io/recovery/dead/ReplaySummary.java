package io.recovery.dead;

/**
 * Outcome of a bulk replay.
 *
 * @param replayed entries re-enqueued
 * @param skipped  entries already replayed, already processed, or lost to a concurrent replayer
 * @param errors   entries whose replay failed and remain in the dead-letter stream
 */
public record ReplaySummary(int replayed, int skipped, int errors) {
}
