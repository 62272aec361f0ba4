package io.recovery.jdbc.outbox;

import io.recovery.jdbc.JdbcTemplate;
import io.recovery.model.OutboxRecord;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * PostgreSQL outbox store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for
 * single-round-trip claim, so concurrent processors never block on each other.
 */
public final class PostgresOutboxStore extends AbstractJdbcOutboxStore {

    private static final Comparator<OutboxRecord> OLDEST_FIRST =
            Comparator.comparing(OutboxRecord::createdAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparingLong(OutboxRecord::id);

    public PostgresOutboxStore() {
        super();
    }

    public PostgresOutboxStore(String tableName) {
        super(tableName);
    }

    @Override
    public AbstractJdbcOutboxStore withTableName(String tableName) {
        return new PostgresOutboxStore(tableName);
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
    public List<OutboxRecord> claim(Connection conn, String processorId, Instant now, Instant claimExpiry, int limit) {
        String sql = "UPDATE " + tableName() + " SET claimed_by=?, claimed_at=? " +
                "WHERE id IN (" +
                "SELECT id FROM " + tableName() + " WHERE " + DUE_PREDICATE +
                " ORDER BY created_at, id LIMIT ?" +
                " FOR UPDATE SKIP LOCKED" +
                ") RETURNING " + COLUMNS;
        List<OutboxRecord> claimed = new ArrayList<>(
                JdbcTemplate.updateReturning(conn, sql, RECORD_ROW_MAPPER, processorId, now, now, claimExpiry, limit));
        // RETURNING does not preserve the subquery order
        claimed.sort(OLDEST_FIRST);
        return claimed;
    }
}
