package io.recovery.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTemplateTest {

    private JdbcDataSource dataSource;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = Schemas.h2();
    }

    @Test
    void insertIfAbsentReportsDuplicateKeyAsFalse() throws Exception {
        String sql = "INSERT INTO distributed_locks (lock_name, holder_id, acquired_at, expires_at) VALUES (?,?,?,?)";
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        try (Connection conn = dataSource.getConnection()) {
            assertTrue(JdbcTemplate.insertIfAbsent(conn, sql, "l", "a", now, now.plusSeconds(5)));
            assertFalse(JdbcTemplate.insertIfAbsent(conn, sql, "l", "b", now, now.plusSeconds(5)));
        }
    }

    @Test
    void bindsInstantsAndReadsThemBack() throws Exception {
        Instant expiry = Instant.parse("2026-03-01T12:30:00Z");
        try (Connection conn = dataSource.getConnection()) {
            JdbcTemplate.update(conn,
                    "INSERT INTO distributed_locks (lock_name, holder_id, acquired_at, expires_at) VALUES (?,?,?,?)",
                    "l", "a", expiry.minusSeconds(60), expiry);
            List<Instant> rows = JdbcTemplate.query(conn, "SELECT expires_at FROM distributed_locks",
                    rs -> JdbcTemplate.instant(rs, "expires_at"));
            assertEquals(List.of(expiry), rows);
            assertEquals(1L, JdbcTemplate.queryForLong(conn, "SELECT COUNT(*) FROM distributed_locks"));
        }
    }

    @Test
    void wrapsStatementFailures() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            JdbcStoreException ex = assertThrows(JdbcStoreException.class,
                    () -> JdbcTemplate.update(conn, "UPDATE no_such_table SET x=1"));
            assertNotNull(ex.sqlState());
        }
    }

    @Test
    void insertIfAbsentStillThrowsForOtherErrors() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            assertThrows(JdbcStoreException.class,
                    () -> JdbcTemplate.insertIfAbsent(conn, "INSERT INTO no_such_table VALUES (1)"));
        }
    }

    @Test
    void insertIfAbsentThrowsForNotNullViolation() throws Exception {
        String sql = "INSERT INTO distributed_locks (lock_name, holder_id, acquired_at, expires_at) VALUES (?,?,?,?)";
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        try (Connection conn = dataSource.getConnection()) {
            JdbcStoreException ex = assertThrows(JdbcStoreException.class,
                    () -> JdbcTemplate.insertIfAbsent(conn, sql, "l", null, now, now.plusSeconds(5)));
            assertEquals("23502", ex.sqlState());
        }
    }
}
