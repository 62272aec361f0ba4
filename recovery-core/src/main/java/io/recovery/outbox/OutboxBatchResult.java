package io.recovery.outbox;

/**
 * Outcome of one {@link OutboxProcessor#processOnce()} call.
 */
public record OutboxBatchResult(int claimed, int processed, int failed) {

    public static final OutboxBatchResult EMPTY = new OutboxBatchResult(0, 0, 0);
}
