package io.recovery.spi;

import io.recovery.model.LockRecord;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * Persistence for TTL-based distributed locks.
 *
 * <p>Every mutating method must be a single atomic compare-and-set against the
 * lock row. All methods receive an explicit {@link Connection}; the caller owns
 * its lifecycle. Implementations live in the {@code recovery-jdbc} module.
 */
public interface LockStore {

    /**
     * Takes the lock if it is absent, expired at {@code now}, or already held by
     * {@code holderId}. A successful call sets the expiry to {@code expiresAt}.
     *
     * @return {@code true} if {@code holderId} now holds the lock
     */
    boolean tryAcquire(Connection conn, String lockName, String holderId, Instant now, Instant expiresAt);

    /**
     * Moves the expiry of a lock held by {@code holderId}.
     *
     * @return {@code false} if the lock is not held by {@code holderId}
     */
    boolean extend(Connection conn, String lockName, String holderId, Instant expiresAt);

    /**
     * Deletes the lock row if held by {@code holderId}.
     *
     * @return {@code false} if the lock is not held by {@code holderId}
     */
    boolean release(Connection conn, String lockName, String holderId);

    /**
     * Deletes every lock whose expiry is before {@code now}.
     *
     * @return the number of rows deleted
     */
    int deleteExpired(Connection conn, Instant now);

    /** Counts locks whose expiry is before {@code now}. */
    int countExpired(Connection conn, Instant now);

    Optional<LockRecord> find(Connection conn, String lockName);
}
