package io.recovery.lock;

import io.recovery.model.LockRecord;
import io.recovery.spi.ConnectionProvider;
import io.recovery.spi.LockStore;
import io.recovery.spi.StoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TTL-based mutual exclusion across processes, backed by a relational table.
 *
 * <p>A lock is held by one holder until it is released or its expiry passes.
 * Re-acquiring by the current holder refreshes the expiry. An expired lock can be
 * taken by anyone; {@link #cleanupExpired()} removes expired rows eagerly.
 *
 * <p>Every operation is a single atomic statement in the {@link LockStore}. A
 * store failure is reported as {@code false} or {@code 0}: the caller behaves as
 * if the lock were held elsewhere.
 */
public final class DistributedLock {
    private static final Logger logger = Logger.getLogger(DistributedLock.class.getName());

    private final ConnectionProvider connectionProvider;
    private final LockStore lockStore;
    private final Clock clock;

    public DistributedLock(ConnectionProvider connectionProvider, LockStore lockStore) {
        this(connectionProvider, lockStore, Clock.systemUTC());
    }

    public DistributedLock(ConnectionProvider connectionProvider, LockStore lockStore, Clock clock) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.lockStore = Objects.requireNonNull(lockStore, "lockStore");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Takes {@code lockName} for {@code holderId} until {@code ttl} from now.
     *
     * @return {@code false} if another holder has an unexpired lock
     */
    public boolean acquire(String lockName, String holderId, Duration ttl) {
        requireTtl(ttl);
        Instant now = clock.instant();
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            boolean acquired = lockStore.tryAcquire(conn, lockName, holderId, now, now.plus(ttl));
            logger.log(Level.FINE, "Lock {0} {1} by {2}",
                    new Object[]{lockName, acquired ? "acquired" : "busy", holderId});
            return acquired;
        } catch (SQLException | StoreException e) {
            logger.log(Level.SEVERE, "Failed to acquire lock " + lockName, e);
            return false;
        }
    }

    /**
     * Moves the expiry of a lock held by {@code holderId} to {@code ttl} from now.
     *
     * @return {@code false} if {@code holderId} does not hold the lock
     */
    public boolean extend(String lockName, String holderId, Duration ttl) {
        requireTtl(ttl);
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return lockStore.extend(conn, lockName, holderId, clock.instant().plus(ttl));
        } catch (SQLException | StoreException e) {
            logger.log(Level.SEVERE, "Failed to extend lock " + lockName, e);
            return false;
        }
    }

    /**
     * @return {@code false} if {@code holderId} does not hold the lock
     */
    public boolean release(String lockName, String holderId) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return lockStore.release(conn, lockName, holderId);
        } catch (SQLException | StoreException e) {
            logger.log(Level.SEVERE, "Failed to release lock " + lockName, e);
            return false;
        }
    }

    /**
     * Deletes every expired lock.
     *
     * @return rows deleted
     */
    public int cleanupExpired() {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            int deleted = lockStore.deleteExpired(conn, clock.instant());
            if (deleted > 0) {
                logger.log(Level.INFO, "Removed {0} expired locks", deleted);
            }
            return deleted;
        } catch (SQLException | StoreException e) {
            logger.log(Level.SEVERE, "Failed to clean up expired locks", e);
            return 0;
        }
    }

    /** Counts expired locks without deleting them. */
    public int countExpired() {
        try (Connection conn = connectionProvider.getConnection()) {
            return lockStore.countExpired(conn, clock.instant());
        } catch (SQLException | StoreException e) {
            logger.log(Level.SEVERE, "Failed to count expired locks", e);
            return 0;
        }
    }

    public Optional<LockRecord> find(String lockName) {
        try (Connection conn = connectionProvider.getConnection()) {
            return lockStore.find(conn, lockName);
        } catch (SQLException | StoreException e) {
            logger.log(Level.SEVERE, "Failed to read lock " + lockName, e);
            return Optional.empty();
        }
    }

    /**
     * Runs {@code action} while holding {@code lockName}, releasing it afterwards.
     *
     * @return the action's result, or empty if the lock is held elsewhere
     */
    public <T> Optional<T> runExclusive(String lockName, String holderId, Duration ttl, Supplier<T> action) {
        if (!acquire(lockName, holderId, ttl)) {
            logger.log(Level.FINE, "Skipping {0}: lock held elsewhere", lockName);
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(action.get());
        } finally {
            release(lockName, holderId);
        }
    }

    private static void requireTtl(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
    }
}
