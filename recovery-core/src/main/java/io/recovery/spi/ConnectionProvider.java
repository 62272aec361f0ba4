package io.recovery.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies JDBC connections to the relational components.
 *
 * <p>Callers close the returned connection when done.
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a JDBC connection.
     *
     * @return an open connection
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
