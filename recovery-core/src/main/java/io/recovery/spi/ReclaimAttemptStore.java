package io.recovery.spi;

import java.util.List;

/**
 * Per-message reclaim counters used to compute reclaim backoff.
 */
public interface ReclaimAttemptStore {

    /** Returns the current count, {@code 0} when untracked. */
    long get(String messageId);

    /** Increments and returns the new count. */
    long increment(String messageId);

    void clear(String messageId);

    void clear(List<String> messageIds);

    /** Lists up to {@code limit} tracked message ids. */
    List<String> trackedIds(int limit);
}
