package io.recovery.jdbc;

import io.recovery.jdbc.ledger.JdbcDeadLetterArchiveStore;
import io.recovery.jdbc.ledger.JdbcReplayLogStore;
import io.recovery.jdbc.lock.AbstractJdbcLockStore;
import io.recovery.jdbc.lock.JdbcLockStores;
import io.recovery.jdbc.lock.PostgresLockStore;
import io.recovery.jdbc.outbox.AbstractJdbcOutboxStore;
import io.recovery.jdbc.outbox.JdbcOutboxStores;
import io.recovery.jdbc.purge.ProcessedOutboxPurger;
import io.recovery.jdbc.purge.ReplayLogPurger;
import io.recovery.lock.DistributedLock;
import io.recovery.model.DeadLetterArchiveRecord;
import io.recovery.model.OutboxRecord;
import io.recovery.model.ReplayLogRecord;
import io.recovery.outbox.OutboxProcessor;
import io.recovery.retention.RetentionGC;
import io.recovery.retention.RetentionReport;
import io.recovery.spi.ConnectionProvider;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.postgresql.ds.PGSimpleDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class PostgresStoresIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("recovery_test");

    private static PGSimpleDataSource dataSource;
    private static ConnectionProvider connections;

    @BeforeAll
    static void initSchema() throws Exception {
        dataSource = new PGSimpleDataSource();
        dataSource.setURL(postgres.getJdbcUrl());
        dataSource.setUser(postgres.getUsername());
        dataSource.setPassword(postgres.getPassword());
        Schemas.apply(dataSource, "/schema/postgresql.sql");
        connections = dataSource::getConnection;
    }

    @BeforeEach
    void truncate() throws Exception {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("TRUNCATE TABLE distributed_locks, outbox, replay_log, dead_letter_archive");
        }
    }

    @Test
    void detectsPostgresVariants() {
        assertInstanceOf(PostgresLockStore.class, JdbcLockStores.detect(dataSource));
        assertEquals("postgresql", JdbcOutboxStores.detect(dataSource).name());
    }

    @Test
    void exactlyOneConcurrentAcquirerWins() throws Exception {
        AbstractJdbcLockStore store = JdbcLockStores.detect(dataSource);
        DistributedLock lock = new DistributedLock(connections, store);
        int threads = 10;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                String holder = "worker-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    return lock.acquire("reclaim_leader", holder, Duration.ofSeconds(30));
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void upsertAcquireHonoursHolderAndExpiry() {
        Instant t0 = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        AbstractJdbcLockStore store = JdbcLockStores.detect(dataSource);
        DistributedLock now = new DistributedLock(connections, store, Clock.fixed(t0, ZoneOffset.UTC));
        DistributedLock later = new DistributedLock(connections, store, Clock.fixed(t0.plusSeconds(5), ZoneOffset.UTC));

        assertTrue(now.acquire("l", "a", Duration.ofSeconds(2)));
        assertTrue(now.acquire("l", "a", Duration.ofSeconds(2)));
        assertFalse(now.acquire("l", "b", Duration.ofSeconds(2)));
        assertTrue(later.acquire("l", "b", Duration.ofSeconds(2)));
        assertEquals("b", later.find("l").orElseThrow().holderId());
    }

    @Test
    void concurrentProcessorsNeverClaimTheSameRecord() throws Exception {
        Instant created = Instant.now().minusSeconds(60);
        for (int i = 0; i < 20; i++) {
            OutboxRows.insert(dataSource, "k" + i, created.plusMillis(i), null);
        }
        AbstractJdbcOutboxStore store = JdbcOutboxStores.detect(dataSource);
        OutboxProcessor processor = OutboxProcessor.builder()
                .connectionProvider(connections)
                .outboxStore(store)
                .build();

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<List<OutboxRecord>>> claims = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                String processorId = "p" + i;
                claims.add(pool.submit(() -> processor.claim(processorId, 5)));
            }
            Set<Long> seen = new HashSet<>();
            int total = 0;
            for (Future<List<OutboxRecord>> claim : claims) {
                for (OutboxRecord record : claim.get(30, TimeUnit.SECONDS)) {
                    assertTrue(seen.add(record.id()), "record claimed twice: " + record.id());
                    total++;
                }
            }
            for (OutboxRecord record : processor.claim("p-final", 20)) {
                assertTrue(seen.add(record.id()), "record claimed twice: " + record.id());
                total++;
            }
            assertEquals(20, total);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void failedCompletionSchedulesRetry() throws Exception {
        long id = OutboxRows.insert(dataSource, "mail", Instant.now().minusSeconds(10), null);
        Instant t0 = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        AbstractJdbcOutboxStore store = JdbcOutboxStores.detect(dataSource);
        OutboxProcessor processor = OutboxProcessor.builder()
                .connectionProvider(connections)
                .outboxStore(store)
                .clock(Clock.fixed(t0, ZoneOffset.UTC))
                .build();

        assertEquals(1, processor.claim("p1", 10).size());
        processor.complete(id, "p1", false, "timeout");

        try (Connection conn = dataSource.getConnection()) {
            OutboxRecord record = store.findForUpdate(conn, id).orElseThrow();
            assertEquals(1, record.retryCount());
            assertEquals(t0.plusSeconds(1), record.processAfter());
            assertNull(record.claimedBy());
        }
    }

    @Test
    void ledgerAndArchiveWorkOnPostgres() throws Exception {
        JdbcReplayLogStore replayLog = new JdbcReplayLogStore();
        JdbcDeadLetterArchiveStore archive = new JdbcDeadLetterArchiveStore();
        Instant t0 = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        try (Connection conn = dataSource.getConnection()) {
            ReplayLogRecord record = new ReplayLogRecord("1-0", "2-0", "42", null, null, "r", t0,
                    ReplayLogRecord.STATUS_REPLAYED);
            assertTrue(replayLog.insertIfAbsent(conn, record));
            assertFalse(replayLog.insertIfAbsent(conn, record));

            DeadLetterArchiveRecord dead = new DeadLetterArchiveRecord("2-0", "1-0", "42", "{}", "r", t0, "a");
            archive.upsert(conn, dead, t0);
            archive.upsert(conn, dead, t0.plusSeconds(60));
            assertEquals(t0.plusSeconds(60), archive.archivedAt(conn, "2-0").orElseThrow());
        }
        assertEquals(1, OutboxRows.count(dataSource, "dead_letter_archive"));
    }

    @Test
    void retentionDryRunMatchesRealRun() throws Exception {
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        JdbcReplayLogStore replayLog = new JdbcReplayLogStore();
        try (Connection conn = dataSource.getConnection()) {
            for (int i = 0; i < 3; i++) {
                replayLog.insertIfAbsent(conn, new ReplayLogRecord("old-" + i, null, null, null, null, "r",
                        now.minus(Duration.ofDays(40)), ReplayLogRecord.STATUS_REPLAYED));
            }
        }
        long processed = OutboxRows.insert(dataSource, "a", now.minus(Duration.ofDays(20)), null);
        OutboxRows.markProcessed(dataSource, processed, now.minus(Duration.ofDays(10)));

        RetentionGC gc = RetentionGC.builder()
                .connectionProvider(connections)
                .replayLogPurger(new ReplayLogPurger())
                .outboxPurger(new ProcessedOutboxPurger())
                .batchSize(2)
                .clock(Clock.fixed(now, ZoneOffset.UTC))
                .build();

        RetentionReport dry = gc.runAll(90, 30, 7, true);
        RetentionReport real = gc.runAll(90, 30, 7, false);

        assertEquals(4, dry.totalCandidates());
        assertEquals(dry.totalCandidates(), real.totalCandidates());
        assertEquals(4, real.totalDeleted());
    }
}
