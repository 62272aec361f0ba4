package io.recovery.jdbc;

import io.recovery.jdbc.lock.AbstractJdbcLockStore;
import io.recovery.jdbc.lock.JdbcLockStores;
import io.recovery.jdbc.lock.PostgresLockStore;
import io.recovery.jdbc.outbox.AbstractJdbcOutboxStore;
import io.recovery.jdbc.outbox.H2OutboxStore;
import io.recovery.jdbc.outbox.JdbcOutboxStores;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcStoreRegistriesTest {

    @Test
    void loadsBuiltInVariants() {
        List<AbstractJdbcLockStore> locks = JdbcLockStores.all();
        assertTrue(locks.stream().anyMatch(s -> s.name().equals("h2")));
        assertTrue(locks.stream().anyMatch(s -> s.name().equals("postgresql")));

        List<AbstractJdbcOutboxStore> outboxes = JdbcOutboxStores.all();
        assertTrue(outboxes.stream().anyMatch(s -> s.name().equals("h2")));
        assertTrue(outboxes.stream().anyMatch(s -> s.name().equals("postgresql")));
    }

    @Test
    void getByNameIsCaseInsensitive() {
        assertInstanceOf(PostgresLockStore.class, JdbcLockStores.get("PostgreSQL"));
        assertInstanceOf(H2OutboxStore.class, JdbcOutboxStores.get("H2"));
    }

    @Test
    void getByNameThrowsForUnknown() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> JdbcLockStores.get("oracle"));
        assertTrue(ex.getMessage().contains("Unknown lock store"));
        assertTrue(ex.getMessage().contains("oracle"));
    }

    @Test
    void detectFromJdbcUrl() {
        assertEquals("postgresql", JdbcLockStores.detect("jdbc:postgresql://localhost:5432/ops").name());
        assertEquals("h2", JdbcOutboxStores.detect("jdbc:h2:mem:test").name());
    }

    @Test
    void detectRejectsUnsupportedUrl() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> JdbcOutboxStores.detect("jdbc:oracle:thin:@localhost:1521:xe"));
        assertTrue(ex.getMessage().contains("Supported prefixes"));
        assertThrows(IllegalArgumentException.class, () -> JdbcOutboxStores.detect(""));
    }

    @Test
    void detectFromDataSource() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL(Schemas.h2Url());
        assertEquals("h2", JdbcLockStores.detect(dataSource).name());
    }

    @Test
    void withTableNameKeepsVariantAndValidates() {
        AbstractJdbcLockStore custom = JdbcLockStores.get("postgresql").withTableName("app_locks");
        assertInstanceOf(PostgresLockStore.class, custom);
        assertThrows(IllegalArgumentException.class,
                () -> JdbcOutboxStores.get("h2").withTableName("bad name"));
    }
}
