/**
 * {@link io.recovery.spi.LockStore} implementations for H2 and PostgreSQL.
 */
package io.recovery.jdbc.lock;
