package io.recovery.jdbc.purge;

import io.recovery.jdbc.TableNames;

/**
 * Deletes outbox rows processed before the cutoff. Unprocessed rows are never
 * eligible, however old.
 */
public final class ProcessedOutboxPurger extends AbstractJdbcRetentionPurger {

    public ProcessedOutboxPurger() {
        this(TableNames.DEFAULT_OUTBOX_TABLE);
    }

    public ProcessedOutboxPurger(String tableName) {
        super(tableName);
    }

    @Override
    protected String ageColumn() {
        return "processed_at";
    }

    @Override
    protected String eligibility() {
        return "processed_at IS NOT NULL AND processed_at < ?";
    }
}
