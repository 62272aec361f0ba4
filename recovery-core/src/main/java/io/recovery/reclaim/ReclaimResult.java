package io.recovery.reclaim;

/**
 * Outcome of one reclaim pass.
 *
 * @param reclaimed       entries whose ownership moved to this consumer
 * @param deadLettered    entries moved to the dead-letter stream
 * @param skipped         eligible entries left for the next pass by the per-pass cap
 * @param backoffDeferred entries not yet idle long enough for their backoff
 * @param errors          store failures during the pass
 */
public record ReclaimResult(int reclaimed, int deadLettered, int skipped, int backoffDeferred, int errors) {

    public static final ReclaimResult EMPTY = new ReclaimResult(0, 0, 0, 0, 0);

    public boolean isEmpty() {
        return reclaimed == 0 && deadLettered == 0 && skipped == 0 && backoffDeferred == 0 && errors == 0;
    }
}
