/**
 * Store SPIs. Stream operations go through {@link io.recovery.spi.StreamStore};
 * relational operations receive an explicit {@link java.sql.Connection} from a
 * {@link io.recovery.spi.ConnectionProvider}.
 */
package io.recovery.spi;
