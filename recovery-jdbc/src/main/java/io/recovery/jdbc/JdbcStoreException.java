package io.recovery.jdbc;

import io.recovery.spi.StoreException;

import java.sql.SQLException;

/**
 * Thrown when a JDBC statement issued by a relational store fails.
 */
public class JdbcStoreException extends StoreException {

    public JdbcStoreException(String message, SQLException cause) {
        super(message, cause);
    }

    /** SQLState of the underlying driver error, may be {@code null}. */
    public String sqlState() {
        return getCause() instanceof SQLException e ? e.getSQLState() : null;
    }
}
