package io.recovery.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Row of the distributed lock table.
 *
 * @param lockName   lock key
 * @param holderId   current holder
 * @param acquiredAt time of the last successful acquire
 * @param expiresAt  the lock is free once this time has passed
 */
public record LockRecord(String lockName, String holderId, Instant acquiredAt, Instant expiresAt) {

    public LockRecord {
        Objects.requireNonNull(lockName, "lockName");
        Objects.requireNonNull(holderId, "holderId");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public boolean isExpired(Instant now) {
        return expiresAt.isBefore(now);
    }
}
