package io.recovery.jdbc.lock;

import io.recovery.jdbc.DatabaseVariant;
import io.recovery.jdbc.JdbcTemplate;
import io.recovery.jdbc.TableNames;
import io.recovery.model.LockRecord;
import io.recovery.spi.LockStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Base JDBC lock store using portable SQL.
 *
 * <p>{@link #tryAcquire} first takes over a row that is expired or already ours with
 * a conditional {@code UPDATE}, then falls back to an {@code INSERT} guarded by the
 * primary key. Both statements are atomic on their own, so concurrent acquirers
 * can never both succeed. Subclasses may replace this with a single upsert.
 *
 * <p>Register implementations via
 * {@code META-INF/services/io.recovery.jdbc.lock.AbstractJdbcLockStore}.
 *
 * @see JdbcLockStores
 */
public abstract class AbstractJdbcLockStore implements LockStore, DatabaseVariant {

    protected static final JdbcTemplate.RowMapper<LockRecord> LOCK_ROW_MAPPER = rs -> new LockRecord(
            rs.getString("lock_name"),
            rs.getString("holder_id"),
            JdbcTemplate.instant(rs, "acquired_at"),
            JdbcTemplate.instant(rs, "expires_at"));

    private final String tableName;

    protected AbstractJdbcLockStore() {
        this(TableNames.DEFAULT_LOCK_TABLE);
    }

    protected AbstractJdbcLockStore(String tableName) {
        this.tableName = TableNames.validate(tableName);
    }

    /**
     * Returns a copy of this store bound to another table.
     */
    public abstract AbstractJdbcLockStore withTableName(String tableName);

    protected String tableName() {
        return tableName;
    }

    @Override
    public boolean tryAcquire(Connection conn, String lockName, String holderId, Instant now, Instant expiresAt) {
        String takeOver = "UPDATE " + tableName() +
                " SET holder_id=?, acquired_at=?, expires_at=?" +
                " WHERE lock_name=? AND (holder_id=? OR expires_at < ?)";
        if (JdbcTemplate.update(conn, takeOver, holderId, now, expiresAt, lockName, holderId, now) > 0) {
            return true;
        }
        String insert = "INSERT INTO " + tableName() +
                " (lock_name, holder_id, acquired_at, expires_at) VALUES (?,?,?,?)";
        return JdbcTemplate.insertIfAbsent(conn, insert, lockName, holderId, now, expiresAt);
    }

    @Override
    public boolean extend(Connection conn, String lockName, String holderId, Instant expiresAt) {
        String sql = "UPDATE " + tableName() + " SET expires_at=? WHERE lock_name=? AND holder_id=?";
        return JdbcTemplate.update(conn, sql, expiresAt, lockName, holderId) > 0;
    }

    @Override
    public boolean release(Connection conn, String lockName, String holderId) {
        String sql = "DELETE FROM " + tableName() + " WHERE lock_name=? AND holder_id=?";
        return JdbcTemplate.update(conn, sql, lockName, holderId) > 0;
    }

    @Override
    public int deleteExpired(Connection conn, Instant now) {
        return JdbcTemplate.update(conn, "DELETE FROM " + tableName() + " WHERE expires_at < ?", now);
    }

    @Override
    public int countExpired(Connection conn, Instant now) {
        String sql = "SELECT COUNT(*) FROM " + tableName() + " WHERE expires_at < ?";
        return (int) JdbcTemplate.queryForLong(conn, sql, now);
    }

    @Override
    public Optional<LockRecord> find(Connection conn, String lockName) {
        String sql = "SELECT lock_name, holder_id, acquired_at, expires_at FROM " + tableName() +
                " WHERE lock_name=?";
        List<LockRecord> rows = JdbcTemplate.query(conn, sql, LOCK_ROW_MAPPER, lockName);
        return rows.stream().findFirst();
    }
}
