package io.recovery.jdbc.purge;

import io.recovery.jdbc.TableNames;

/**
 * Deletes archived dead letters by {@code archived_at}.
 */
public final class DeadLetterArchivePurger extends AbstractJdbcRetentionPurger {

    public DeadLetterArchivePurger() {
        this(TableNames.DEFAULT_ARCHIVE_TABLE);
    }

    public DeadLetterArchivePurger(String tableName) {
        super(tableName);
    }

    @Override
    protected String ageColumn() {
        return "archived_at";
    }
}
