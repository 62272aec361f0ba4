package io.recovery.retention;

/**
 * Outcome of a reclaim-counter cleanup.
 *
 * @param checked counters examined
 * @param cleaned counters removed because their message is no longer pending
 */
public record ReclaimCounterGcResult(int checked, int cleaned) {
}
