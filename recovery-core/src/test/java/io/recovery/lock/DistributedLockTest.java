package io.recovery.lock;

import io.recovery.model.LockRecord;
import io.recovery.testing.FakeConnections;
import io.recovery.testing.InMemoryLockStore;
import io.recovery.testing.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DistributedLockTest {
    private static final Duration TTL = Duration.ofSeconds(30);

    private ManualClock clock;
    private DistributedLock lock;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        lock = new DistributedLock(FakeConnections.provider(), new InMemoryLockStore(), clock);
    }

    @Test
    void secondHolderIsRefusedWhileHeld() {
        assertTrue(lock.acquire("job", "a", TTL));
        assertFalse(lock.acquire("job", "b", TTL));
        assertEquals("a", lock.find("job").map(LockRecord::holderId).orElseThrow());
    }

    @Test
    void reacquireBySameHolderRefreshesExpiry() {
        lock.acquire("job", "a", TTL);
        clock.advance(Duration.ofSeconds(20));

        assertTrue(lock.acquire("job", "a", TTL));

        assertEquals(clock.instant().plus(TTL), lock.find("job").orElseThrow().expiresAt());
    }

    @Test
    void expiredLockCanBeTakenOver() {
        lock.acquire("job", "a", TTL);
        clock.advance(TTL.plusSeconds(1));

        assertTrue(lock.acquire("job", "b", TTL));
    }

    @Test
    void onlyHolderCanExtendOrRelease() {
        lock.acquire("job", "a", TTL);

        assertFalse(lock.extend("job", "b", TTL));
        assertFalse(lock.release("job", "b"));
        assertTrue(lock.extend("job", "a", Duration.ofMinutes(5)));
        assertTrue(lock.release("job", "a"));
        assertTrue(lock.find("job").isEmpty());
    }

    @Test
    void cleanupRemovesOnlyExpiredLocks() {
        lock.acquire("short", "a", Duration.ofSeconds(1));
        lock.acquire("long", "a", Duration.ofHours(1));
        clock.advance(Duration.ofSeconds(2));

        assertEquals(1, lock.countExpired());
        assertEquals(1, lock.cleanupExpired());
        assertTrue(lock.find("short").isEmpty());
        assertTrue(lock.find("long").isPresent());
    }

    @Test
    void runExclusiveReleasesAfterAction() {
        Optional<String> result = lock.runExclusive("job", "a", TTL, () -> "done");

        assertEquals(Optional.of("done"), result);
        assertTrue(lock.find("job").isEmpty());
    }

    @Test
    void runExclusiveSkipsWhenHeldElsewhere() {
        lock.acquire("job", "a", TTL);
        AtomicInteger runs = new AtomicInteger();

        assertTrue(lock.runExclusive("job", "b", TTL, runs::incrementAndGet).isEmpty());
        assertEquals(0, runs.get());
    }

    @Test
    void runExclusiveReleasesWhenActionThrows() {
        assertThrows(IllegalStateException.class, () -> lock.runExclusive("job", "a", TTL, () -> {
            throw new IllegalStateException("boom");
        }));

        assertTrue(lock.acquire("job", "b", TTL));
    }

    @Test
    void unavailableStoreReportsNotAcquired() {
        DistributedLock offline = new DistributedLock(
                FakeConnections.failing(new AtomicInteger()), new InMemoryLockStore(), clock);

        assertFalse(offline.acquire("job", "a", TTL));
        assertFalse(offline.release("job", "a"));
        assertEquals(0, offline.cleanupExpired());
    }

    @Test
    void rejectsNonPositiveTtl() {
        assertThrows(IllegalArgumentException.class, () -> lock.acquire("job", "a", Duration.ZERO));
    }
}
