package io.recovery.spi;

import java.sql.Connection;
import java.time.Instant;

/**
 * Counts and deletes aged rows from one retention-managed table.
 *
 * <p>{@link #count} and {@link #purge} must select the same rows for the same
 * cutoff, so a dry run reports what a real run would delete.
 */
public interface RetentionPurger {

    /** Name reported in retention summaries, normally the table name. */
    String table();

    /** Counts rows eligible for deletion before {@code before}. */
    long count(Connection conn, Instant before);

    /**
     * Deletes up to {@code limit} eligible rows.
     *
     * @return rows deleted
     */
    int purge(Connection conn, Instant before, int limit);
}
