package io.recovery.jdbc.outbox;

import io.recovery.jdbc.VariantRegistry;

import javax.sql.DataSource;
import java.util.List;

/**
 * Registry for JDBC outbox stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link java.util.ServiceLoader} from
 * {@code META-INF/services/io.recovery.jdbc.outbox.AbstractJdbcOutboxStore}.
 */
public final class JdbcOutboxStores {

    private static final VariantRegistry<AbstractJdbcOutboxStore> REGISTRY =
            VariantRegistry.load(AbstractJdbcOutboxStore.class, "outbox store");

    private JdbcOutboxStores() {
    }

    public static List<AbstractJdbcOutboxStore> all() {
        return REGISTRY.all();
    }

    public static AbstractJdbcOutboxStore get(String name) {
        return REGISTRY.get(name);
    }

    public static AbstractJdbcOutboxStore detect(DataSource dataSource) {
        return REGISTRY.detect(dataSource);
    }

    public static AbstractJdbcOutboxStore detect(String jdbcUrl) {
        return REGISTRY.detect(jdbcUrl);
    }
}
