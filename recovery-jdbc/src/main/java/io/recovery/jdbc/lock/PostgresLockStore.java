package io.recovery.jdbc.lock;

import io.recovery.jdbc.JdbcTemplate;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL lock store.
 *
 * <p>Acquires with a single {@code INSERT ... ON CONFLICT DO UPDATE} whose
 * {@code WHERE} clause only lets an expired row or the current holder's row be
 * overwritten.
 */
public final class PostgresLockStore extends AbstractJdbcLockStore {

    public PostgresLockStore() {
        super();
    }

    public PostgresLockStore(String tableName) {
        super(tableName);
    }

    @Override
    public AbstractJdbcLockStore withTableName(String tableName) {
        return new PostgresLockStore(tableName);
    }

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    public boolean tryAcquire(Connection conn, String lockName, String holderId, Instant now, Instant expiresAt) {
        String sql = "INSERT INTO " + tableName() + " AS l (lock_name, holder_id, acquired_at, expires_at)" +
                " VALUES (?,?,?,?)" +
                " ON CONFLICT (lock_name) DO UPDATE" +
                " SET holder_id=EXCLUDED.holder_id, acquired_at=EXCLUDED.acquired_at, expires_at=EXCLUDED.expires_at" +
                " WHERE l.expires_at < ? OR l.holder_id=EXCLUDED.holder_id";
        return JdbcTemplate.update(conn, sql, lockName, holderId, now, expiresAt, now) > 0;
    }
}
