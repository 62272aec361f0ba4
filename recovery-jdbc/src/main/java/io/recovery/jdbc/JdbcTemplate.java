package io.recovery.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lightweight JDBC helper shared by the relational stores.
 *
 * <p>Every {@link SQLException} is rethrown as a {@link JdbcStoreException}, except a
 * unique-constraint violation in {@link #insertIfAbsent}, which is reported as
 * {@code false}.
 */
public final class JdbcTemplate {
    /** Unique violation: 23505 is standard (PostgreSQL, H2), 23001 is H2's legacy code. */
    private static final Set<String> UNIQUE_VIOLATION_STATES = Set.of("23505", "23001");

    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    /** Execute INSERT/UPDATE/DELETE, return rows affected. */
    public static int update(Connection conn, String sql, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new JdbcStoreException("Failed to execute update", e);
        }
    }

    /**
     * Execute an INSERT that may collide with a unique key.
     *
     * @return {@code true} if a row was inserted, {@code false} if the key already existed
     */
    public static boolean insertIfAbsent(Connection conn, String sql, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                return false;
            }
            throw new JdbcStoreException("Failed to execute insert", e);
        }
    }

    /** Execute SELECT, map rows. */
    public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            return mapAll(ps, mapper);
        } catch (SQLException e) {
            throw new JdbcStoreException("Failed to execute query", e);
        }
    }

    /** Execute a single-value SELECT such as {@code COUNT(*)}. */
    public static long queryForLong(Connection conn, String sql, Object... params) {
        List<Long> values = query(conn, sql, rs -> rs.getLong(1), params);
        return values.isEmpty() ? 0L : values.get(0);
    }

    /** Execute UPDATE ... RETURNING, map returned rows (PostgreSQL). */
    public static <T> List<T> updateReturning(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            return mapAll(ps, mapper);
        } catch (SQLException e) {
            throw new JdbcStoreException("Failed to execute updateReturning", e);
        }
    }

    /** Reads a nullable timestamp column. */
    public static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    static boolean isUniqueViolation(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            if (UNIQUE_VIOLATION_STATES.contains(cur.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    private static <T> List<T> mapAll(PreparedStatement ps, RowMapper<T> mapper) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            List<T> results = new ArrayList<>();
            while (rs.next()) {
                results.add(mapper.map(rs));
            }
            return results;
        }
    }

    private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            Object param = params[i];
            if (param == null) {
                ps.setObject(i + 1, null);
            } else if (param instanceof String s) {
                ps.setString(i + 1, s);
            } else if (param instanceof Integer n) {
                ps.setInt(i + 1, n);
            } else if (param instanceof Long n) {
                ps.setLong(i + 1, n);
            } else if (param instanceof Instant instant) {
                ps.setTimestamp(i + 1, Timestamp.from(instant));
            } else if (param instanceof Timestamp ts) {
                ps.setTimestamp(i + 1, ts);
            } else {
                ps.setObject(i + 1, param);
            }
        }
    }

    private JdbcTemplate() {}
}
