package io.recovery.dead;

import io.recovery.model.DeadLetterArchiveRecord;
import io.recovery.model.DeadLetterEntry;
import io.recovery.model.StreamEntry;
import io.recovery.stream.InMemoryStreamStore;
import io.recovery.testing.FakeConnections;
import io.recovery.testing.FlakyStreamStore;
import io.recovery.testing.InMemoryArchiveStore;
import io.recovery.testing.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArchiveTrimmerTest {
    private static final String DL = "work:dl";

    private ManualClock clock;
    private FlakyStreamStore store;
    private InMemoryArchiveStore archive;
    private ArchiveTrimmer trimmer;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        store = new FlakyStreamStore(new InMemoryStreamStore(clock));
        archive = new InMemoryArchiveStore();
        trimmer = ArchiveTrimmer.builder()
                .store(store)
                .deadLetterStreamKey(DL)
                .connectionProvider(FakeConnections.provider())
                .archiveStore(archive)
                .archivedBy("archiver")
                .batchSize(2)
                .clock(clock)
                .build();
    }

    private List<String> seed(int count) {
        for (int i = 0; i < count; i++) {
            DeadLetterEntry entry = new DeadLetterEntry(null, "100-" + i, "work", "poison",
                    "2026-01-01T00:00:00Z", "worker-1", Map.of("candidate_id", String.valueOf(i)));
            store.add(DL, entry.toFields(), 0);
        }
        return store.range(DL, null, count).stream().map(StreamEntry::id).toList();
    }

    @Test
    void withinLimitDoesNothing() {
        seed(3);

        assertEquals(ArchiveResult.EMPTY, trimmer.archiveAndTrim(3));
        assertEquals(0, archive.size());
    }

    @Test
    void archivesOldestExcessThenTrims() {
        List<String> ids = seed(5);

        ArchiveResult result = trimmer.archiveAndTrim(2);

        assertEquals(new ArchiveResult(3, 3, 0), result);
        assertEquals(List.of(ids.get(3), ids.get(4)),
                store.range(DL, null, 10).stream().map(StreamEntry::id).toList());
        DeadLetterArchiveRecord record = archive.find(null, ids.get(0)).orElseThrow();
        assertEquals("100-0", record.originalMsgId());
        assertEquals("0", record.candidateId());
        assertEquals("poison", record.reason());
        assertEquals("archiver", record.archivedBy());
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), record.deadLetteredAt());
        assertTrue(record.payload().contains("\"original_msg_id\":\"100-0\""));
    }

    @Test
    void failedArchiveBlocksTrimOfThatEntry() {
        List<String> ids = seed(4);
        archive.reject(ids.get(1));

        ArchiveResult result = trimmer.archiveAndTrim(1);

        assertEquals(new ArchiveResult(2, 2, 1), result);
        assertTrue(store.get(DL, ids.get(1)).isPresent());
        assertEquals(2, store.length(DL));
    }

    @Test
    void failedDeleteCountsErrorsAndKeepsEntries() {
        seed(3);
        store.failDelete(true);

        ArchiveResult result = trimmer.archiveAndTrim(1);

        assertEquals(2, result.archived());
        assertEquals(0, result.trimmed());
        assertEquals(2, result.errors());
        assertEquals(3, store.length(DL));
    }

    @Test
    void missingConnectionArchivesNothing() {
        seed(3);
        AtomicInteger attempts = new AtomicInteger();
        ArchiveTrimmer offline = ArchiveTrimmer.builder()
                .store(store)
                .deadLetterStreamKey(DL)
                .connectionProvider(FakeConnections.failing(attempts))
                .archiveStore(archive)
                .build();

        ArchiveResult result = offline.archiveAndTrim(1);

        assertEquals(new ArchiveResult(0, 0, 2), result);
        assertEquals(3, store.length(DL));
        assertEquals(1, attempts.get());
        assertNull(archive.archivedAt("anything"));
    }
}
