package io.recovery.jdbc;

import io.recovery.jdbc.lock.H2LockStore;
import io.recovery.jdbc.outbox.H2OutboxStore;
import io.recovery.lock.DistributedLock;
import io.recovery.model.OutboxRecord;
import io.recovery.outbox.OutboxBatchResult;
import io.recovery.outbox.OutboxProcessor;
import io.recovery.spi.ConnectionProvider;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcOutboxStoreTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private JdbcDataSource dataSource;
    private ConnectionProvider connections;
    private final H2OutboxStore store = new H2OutboxStore();

    @BeforeEach
    void setUp() throws Exception {
        dataSource = Schemas.h2();
        connections = dataSource::getConnection;
    }

    private OutboxProcessor processorAt(Instant now) {
        return OutboxProcessor.builder()
                .connectionProvider(connections)
                .outboxStore(store)
                .clock(Clock.fixed(now, ZoneOffset.UTC))
                .build();
    }

    private OutboxRecord read(long id) throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            return store.findForUpdate(conn, id).orElseThrow();
        }
    }

    @Test
    void claimReturnsDueRecordsOldestFirst() throws Exception {
        long second = OutboxRows.insert(dataSource, "b", T0.minusSeconds(10), null);
        long first = OutboxRows.insert(dataSource, "a", T0.minusSeconds(20), null);
        OutboxRows.insert(dataSource, "future", T0.minusSeconds(30), T0.plusSeconds(60));

        List<OutboxRecord> claimed = processorAt(T0).claim("p1", 10);

        assertEquals(List.of(first, second), claimed.stream().map(OutboxRecord::id).toList());
        assertEquals("p1", read(first).claimedBy());
    }

    @Test
    void claimedRecordsAreInvisibleUntilClaimGoesStale() throws Exception {
        long id = OutboxRows.insert(dataSource, "a", T0.minusSeconds(10), null);

        assertEquals(1, processorAt(T0).claim("p1", 10).size());
        assertTrue(processorAt(T0.plusSeconds(60)).claim("p2", 10).isEmpty());

        List<OutboxRecord> adopted = processorAt(T0.plus(Duration.ofMinutes(6))).claim("p2", 10);
        assertEquals(1, adopted.size());
        assertEquals(id, adopted.get(0).id());
        assertEquals("p2", read(id).claimedBy());
    }

    @Test
    void failureSchedulesRetryOnProcessAfterOnly() throws Exception {
        long id = OutboxRows.insert(dataSource, "a", T0.minusSeconds(10), null);
        OutboxProcessor processor = processorAt(T0);
        processor.claim("p1", 10);

        processor.complete(id, "p1", false, "smtp timeout");

        OutboxRecord record = read(id);
        assertEquals(1, record.retryCount());
        assertEquals(T0.plusSeconds(1), record.processAfter());
        assertEquals("smtp timeout", record.lastError());
        assertNull(record.claimedBy());
        assertNull(record.processedAt());

        assertTrue(processorAt(T0.plusMillis(500)).claim("p1", 10).isEmpty());
        assertEquals(1, processorAt(T0.plusSeconds(1)).claim("p1", 10).size());
    }

    @Test
    void repeatedFailuresBackOffExponentially() throws Exception {
        long id = OutboxRows.insert(dataSource, "a", T0.minusSeconds(10), null);
        OutboxProcessor processor = processorAt(T0);
        for (int i = 0; i < 3; i++) {
            processor.complete(id, "p1", false, "boom");
        }
        OutboxRecord record = read(id);
        assertEquals(3, record.retryCount());
        assertEquals(T0.plusSeconds(4), record.processAfter());
    }

    @Test
    void successSetsProcessedAtAndLeavesProcessAfter() throws Exception {
        Instant scheduled = T0.minusSeconds(5);
        long id = OutboxRows.insert(dataSource, "a", T0.minusSeconds(10), scheduled);
        OutboxProcessor processor = processorAt(T0);
        processor.claim("p1", 10);

        processor.complete(id, "p1", true, null);

        OutboxRecord record = read(id);
        assertEquals(T0, record.processedAt());
        assertEquals(scheduled, record.processAfter());
        assertNull(record.claimedBy());
        assertEquals(0, processor.pendingCount());
        assertTrue(processorAt(T0.plus(Duration.ofHours(1))).claim("p1", 10).isEmpty());
    }

    @Test
    void tableHasSingleSchedulingColumn() throws Exception {
        try (Connection conn = dataSource.getConnection();
             ResultSet columns = conn.getMetaData().getColumns(null, null, "OUTBOX", null)) {
            List<String> names = new ArrayList<>();
            while (columns.next()) {
                names.add(columns.getString("COLUMN_NAME").toLowerCase());
            }
            assertTrue(names.contains("process_after"));
            assertFalse(names.contains("next_retry_at"));
        }
    }

    @Test
    void processOnceDeliversUnderProcessorLock() throws Exception {
        OutboxRows.insert(dataSource, "ok", T0.minusSeconds(20), null);
        OutboxRows.insert(dataSource, "fail", T0.minusSeconds(10), null);
        List<String> delivered = new ArrayList<>();
        Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
        DistributedLock lock = new DistributedLock(connections, new H2LockStore(), clock);

        OutboxProcessor processor = OutboxProcessor.builder()
                .connectionProvider(connections)
                .outboxStore(store)
                .lock(lock)
                .processorId("p1")
                .clock(clock)
                .handler(record -> {
                    if (record.eventKind().equals("fail")) {
                        throw new IllegalStateException("downstream rejected");
                    }
                    delivered.add(record.eventKind());
                })
                .build();

        OutboxBatchResult result = processor.processOnce();

        assertEquals(new OutboxBatchResult(2, 1, 1), result);
        assertEquals(List.of("ok"), delivered);
        assertEquals(1, processor.pendingCount());
        assertTrue(lock.find("outbox_processor").isEmpty());
    }

    @Test
    void processOnceSkipsWhileAnotherProcessorHoldsTheLock() throws Exception {
        OutboxRows.insert(dataSource, "ok", T0.minusSeconds(20), null);
        Clock clock = Clock.fixed(T0, ZoneOffset.UTC);
        DistributedLock lock = new DistributedLock(connections, new H2LockStore(), clock);
        assertTrue(lock.acquire("outbox_processor", "other", Duration.ofMinutes(1)));

        OutboxProcessor processor = OutboxProcessor.builder()
                .connectionProvider(connections)
                .outboxStore(store)
                .lock(lock)
                .clock(clock)
                .handler(record -> fail("must not deliver"))
                .build();

        assertEquals(OutboxBatchResult.EMPTY, processor.processOnce());
        assertEquals(1, processor.pendingCount());
    }
}
