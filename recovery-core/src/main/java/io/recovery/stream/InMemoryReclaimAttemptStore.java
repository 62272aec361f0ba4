package io.recovery.stream;

import io.recovery.spi.ReclaimAttemptStore;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ReclaimAttemptStore} held in a concurrent map. Counters do not expire.
 */
public final class InMemoryReclaimAttemptStore implements ReclaimAttemptStore {
    private final ConcurrentHashMap<String, Long> attempts = new ConcurrentHashMap<>();

    @Override
    public long get(String messageId) {
        return attempts.getOrDefault(messageId, 0L);
    }

    @Override
    public long increment(String messageId) {
        return attempts.merge(messageId, 1L, Long::sum);
    }

    @Override
    public void clear(String messageId) {
        attempts.remove(messageId);
    }

    @Override
    public void clear(List<String> messageIds) {
        messageIds.forEach(attempts::remove);
    }

    @Override
    public List<String> trackedIds(int limit) {
        return attempts.keySet().stream().limit(limit).toList();
    }
}
