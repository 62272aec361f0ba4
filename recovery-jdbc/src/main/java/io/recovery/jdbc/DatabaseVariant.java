package io.recovery.jdbc;

import java.util.List;

/**
 * A store implementation tuned for one database product, discovered through
 * {@link java.util.ServiceLoader} and selected by JDBC URL.
 */
public interface DatabaseVariant {

    /** Unique identifier (e.g. "postgresql", "h2"). */
    String name();

    /** JDBC URL prefixes this implementation handles (e.g. "jdbc:postgresql:"). */
    List<String> jdbcUrlPrefixes();
}
