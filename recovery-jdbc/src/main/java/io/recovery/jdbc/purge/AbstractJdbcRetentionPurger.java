package io.recovery.jdbc.purge;

import io.recovery.jdbc.JdbcTemplate;
import io.recovery.jdbc.TableNames;
import io.recovery.spi.RetentionPurger;

import java.sql.Connection;
import java.time.Instant;

/**
 * Base JDBC purger deleting rows whose age column is older than a cutoff.
 *
 * <p>{@link #count} and {@link #purge} share one {@code WHERE} clause so a dry run
 * counts exactly the rows a real run deletes. Deletion uses a subquery-limited
 * {@code DELETE}, which works for H2 and PostgreSQL.
 */
public abstract class AbstractJdbcRetentionPurger implements RetentionPurger {

    private final String tableName;

    protected AbstractJdbcRetentionPurger(String tableName) {
        this.tableName = TableNames.validate(tableName);
    }

    /** Timestamp column compared with the cutoff. */
    protected abstract String ageColumn();

    /**
     * Condition selecting eligible rows, with one parameter for the cutoff.
     */
    protected String eligibility() {
        return ageColumn() + " < ?";
    }

    @Override
    public String table() {
        return tableName;
    }

    @Override
    public long count(Connection conn, Instant before) {
        return JdbcTemplate.queryForLong(conn,
                "SELECT COUNT(*) FROM " + tableName + " WHERE " + eligibility(), before);
    }

    @Override
    public int purge(Connection conn, Instant before, int limit) {
        String sql = "DELETE FROM " + tableName + " WHERE id IN (" +
                "SELECT id FROM " + tableName +
                " WHERE " + eligibility() +
                " ORDER BY " + ageColumn() + " LIMIT ?)";
        return JdbcTemplate.update(conn, sql, before, limit);
    }
}
