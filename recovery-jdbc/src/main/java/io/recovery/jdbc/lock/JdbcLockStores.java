package io.recovery.jdbc.lock;

import io.recovery.jdbc.VariantRegistry;

import javax.sql.DataSource;
import java.util.List;

/**
 * Registry for JDBC lock stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link java.util.ServiceLoader} from
 * {@code META-INF/services/io.recovery.jdbc.lock.AbstractJdbcLockStore}.
 *
 * <pre>{@code
 * AbstractJdbcLockStore store = JdbcLockStores.detect(dataSource);
 * AbstractJdbcLockStore custom = JdbcLockStores.get("postgresql").withTableName("app_locks");
 * }</pre>
 */
public final class JdbcLockStores {

    private static final VariantRegistry<AbstractJdbcLockStore> REGISTRY =
            VariantRegistry.load(AbstractJdbcLockStore.class, "lock store");

    private JdbcLockStores() {
    }

    public static List<AbstractJdbcLockStore> all() {
        return REGISTRY.all();
    }

    public static AbstractJdbcLockStore get(String name) {
        return REGISTRY.get(name);
    }

    public static AbstractJdbcLockStore detect(DataSource dataSource) {
        return REGISTRY.detect(dataSource);
    }

    public static AbstractJdbcLockStore detect(String jdbcUrl) {
        return REGISTRY.detect(jdbcUrl);
    }
}
