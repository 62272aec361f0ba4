package io.recovery.stream;

import io.recovery.spi.ReplayTracker;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ReplayTracker} held in a concurrent set.
 */
public final class InMemoryReplayTracker implements ReplayTracker {
    private final Set<String> replayed = ConcurrentHashMap.newKeySet();

    @Override
    public boolean isReplayed(String dlMsgId) {
        return replayed.contains(dlMsgId);
    }

    @Override
    public void markReplayed(String dlMsgId) {
        replayed.add(dlMsgId);
    }
}
