package io.recovery.testing;

import io.recovery.model.OutboxRecord;
import io.recovery.spi.OutboxStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox table held in a sorted map; all methods synchronized.
 */
public final class InMemoryOutboxStore implements OutboxStore {
    private final TreeMap<Long, OutboxRecord> rows = new TreeMap<>();
    private final AtomicLong ids = new AtomicLong();

    public synchronized long insert(String aggregateType, String aggregateId, String eventKind,
            String payload, Instant createdAt) {
        long id = ids.incrementAndGet();
        rows.put(id, new OutboxRecord(id, aggregateType, aggregateId, eventKind, payload,
                createdAt, null, 0, null, null, null, null));
        return id;
    }

    public synchronized OutboxRecord get(long id) {
        return rows.get(id);
    }

    @Override
    public synchronized List<OutboxRecord> claim(Connection conn, String processorId, Instant now,
            Instant claimExpiry, int limit) {
        List<OutboxRecord> claimed = new ArrayList<>();
        for (Map.Entry<Long, OutboxRecord> entry : rows.entrySet()) {
            if (claimed.size() >= limit) {
                break;
            }
            OutboxRecord r = entry.getValue();
            boolean due = r.processedAt() == null && (r.processAfter() == null || !r.processAfter().isAfter(now));
            boolean free = r.claimedAt() == null || r.claimedAt().isBefore(claimExpiry);
            if (due && free) {
                OutboxRecord owned = new OutboxRecord(r.id(), r.aggregateType(), r.aggregateId(), r.eventKind(),
                        r.payload(), r.createdAt(), null, r.retryCount(), r.processAfter(), processorId, now,
                        r.lastError());
                entry.setValue(owned);
                claimed.add(owned);
            }
        }
        return claimed;
    }

    @Override
    public synchronized Optional<OutboxRecord> findForUpdate(Connection conn, long id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public synchronized int markProcessed(Connection conn, long id, String processorId, Instant processedAt) {
        OutboxRecord r = rows.get(id);
        if (r == null) {
            return 0;
        }
        rows.put(id, new OutboxRecord(r.id(), r.aggregateType(), r.aggregateId(), r.eventKind(), r.payload(),
                r.createdAt(), processedAt, r.retryCount(), r.processAfter(), null, null, r.lastError()));
        return 1;
    }

    @Override
    public synchronized int scheduleRetry(Connection conn, long id, Instant processAfter, String error) {
        OutboxRecord r = rows.get(id);
        if (r == null) {
            return 0;
        }
        rows.put(id, new OutboxRecord(r.id(), r.aggregateType(), r.aggregateId(), r.eventKind(), r.payload(),
                r.createdAt(), null, r.retryCount() + 1, processAfter, null, null, error));
        return 1;
    }

    @Override
    public synchronized int countPending(Connection conn) {
        return (int) rows.values().stream().filter(r -> r.processedAt() == null).count();
    }
}
