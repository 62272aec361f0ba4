package io.recovery.jdbc.outbox;

import io.recovery.jdbc.DatabaseVariant;
import io.recovery.jdbc.JdbcTemplate;
import io.recovery.jdbc.TableNames;
import io.recovery.model.OutboxRecord;
import io.recovery.spi.OutboxStore;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Base JDBC outbox store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #claim} to provide database-specific claim
 * strategies. Register custom implementations via
 * {@code META-INF/services/io.recovery.jdbc.outbox.AbstractJdbcOutboxStore}.
 *
 * @see JdbcOutboxStores
 */
public abstract class AbstractJdbcOutboxStore implements OutboxStore, DatabaseVariant {

    protected static final String COLUMNS = "id, aggregate_type, aggregate_id, event_kind, payload, " +
            "created_at, processed_at, retry_count, process_after, claimed_by, claimed_at, last_error";

    protected static final String DUE_PREDICATE = "processed_at IS NULL" +
            " AND (process_after IS NULL OR process_after <= ?)" +
            " AND (claimed_by IS NULL OR claimed_at < ?)";

    protected static final JdbcTemplate.RowMapper<OutboxRecord> RECORD_ROW_MAPPER = rs -> new OutboxRecord(
            rs.getLong("id"),
            rs.getString("aggregate_type"),
            rs.getString("aggregate_id"),
            rs.getString("event_kind"),
            rs.getString("payload"),
            JdbcTemplate.instant(rs, "created_at"),
            JdbcTemplate.instant(rs, "processed_at"),
            rs.getInt("retry_count"),
            JdbcTemplate.instant(rs, "process_after"),
            rs.getString("claimed_by"),
            JdbcTemplate.instant(rs, "claimed_at"),
            rs.getString("last_error"));

    private final String tableName;

    protected AbstractJdbcOutboxStore() {
        this(TableNames.DEFAULT_OUTBOX_TABLE);
    }

    protected AbstractJdbcOutboxStore(String tableName) {
        this.tableName = TableNames.validate(tableName);
    }

    /**
     * Returns a copy of this store bound to another table.
     */
    public abstract AbstractJdbcOutboxStore withTableName(String tableName);

    protected String tableName() {
        return tableName;
    }

    @Override
    public List<OutboxRecord> claim(Connection conn, String processorId, Instant now, Instant claimExpiry, int limit) {
        // Truncate to millis so stored value matches query (DB may drop nanos)
        Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
        // Phase 1: UPDATE with subquery (H2-compatible default)
        String claimSql = "UPDATE " + tableName() + " SET claimed_by=?, claimed_at=? " +
                "WHERE id IN (" +
                "SELECT id FROM " + tableName() + " WHERE " + DUE_PREDICATE +
                " ORDER BY created_at, id LIMIT ?)";
        int updated = JdbcTemplate.update(conn, claimSql, processorId, nowMs, now, claimExpiry, limit);
        if (updated == 0) {
            return List.of();
        }
        // Phase 2: SELECT rows claimed in this cycle
        String selectSql = "SELECT " + COLUMNS + " FROM " + tableName() +
                " WHERE claimed_by=? AND claimed_at=? AND processed_at IS NULL ORDER BY created_at, id";
        return JdbcTemplate.query(conn, selectSql, RECORD_ROW_MAPPER, processorId, nowMs);
    }

    @Override
    public Optional<OutboxRecord> findForUpdate(Connection conn, long id) {
        String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=? FOR UPDATE";
        return JdbcTemplate.query(conn, sql, RECORD_ROW_MAPPER, id).stream().findFirst();
    }

    @Override
    public int markProcessed(Connection conn, long id, String processorId, Instant processedAt) {
        String sql = "UPDATE " + tableName() +
                " SET processed_at=?, processed_by=?, claimed_by=NULL, claimed_at=NULL" +
                " WHERE id=? AND processed_at IS NULL";
        return JdbcTemplate.update(conn, sql, processedAt, processorId, id);
    }

    @Override
    public int scheduleRetry(Connection conn, long id, Instant processAfter, String error) {
        String sql = "UPDATE " + tableName() +
                " SET retry_count=retry_count+1, process_after=?, last_error=?, claimed_by=NULL, claimed_at=NULL" +
                " WHERE id=? AND processed_at IS NULL";
        return JdbcTemplate.update(conn, sql, processAfter, error, id);
    }

    @Override
    public int countPending(Connection conn) {
        String sql = "SELECT COUNT(*) FROM " + tableName() + " WHERE processed_at IS NULL";
        return (int) JdbcTemplate.queryForLong(conn, sql);
    }
}
