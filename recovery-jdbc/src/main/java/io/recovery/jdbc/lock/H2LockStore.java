package io.recovery.jdbc.lock;

import java.util.List;

/**
 * H2 lock store. Primarily for testing.
 *
 * <p>Uses the portable update-then-insert acquire from {@link AbstractJdbcLockStore}.
 */
public final class H2LockStore extends AbstractJdbcLockStore {

    public H2LockStore() {
        super();
    }

    public H2LockStore(String tableName) {
        super(tableName);
    }

    @Override
    public AbstractJdbcLockStore withTableName(String tableName) {
        return new H2LockStore(tableName);
    }

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:h2:");
    }
}
