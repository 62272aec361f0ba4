package io.recovery.jdbc.purge;

import io.recovery.jdbc.TableNames;

/**
 * Deletes replay ledger rows by {@code replayed_at}.
 */
public final class ReplayLogPurger extends AbstractJdbcRetentionPurger {

    public ReplayLogPurger() {
        this(TableNames.DEFAULT_REPLAY_LOG_TABLE);
    }

    public ReplayLogPurger(String tableName) {
        super(tableName);
    }

    @Override
    protected String ageColumn() {
        return "replayed_at";
    }
}
