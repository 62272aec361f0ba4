/**
 * JDBC infrastructure shared across sub-packages.
 *
 * <p>{@link io.recovery.jdbc.JdbcTemplate} wraps statement boilerplate and translates
 * unique-key collisions. A {@link javax.sql.DataSource} serves as a
 * {@link io.recovery.spi.ConnectionProvider} through {@code dataSource::getConnection}.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code io.recovery.jdbc.lock}: {@link io.recovery.spi.LockStore} implementations</li>
 *   <li>{@code io.recovery.jdbc.outbox}: {@link io.recovery.spi.OutboxStore} implementations</li>
 *   <li>{@code io.recovery.jdbc.ledger}: replay ledger and dead-letter archive</li>
 *   <li>{@code io.recovery.jdbc.purge}: {@link io.recovery.spi.RetentionPurger} implementations</li>
 * </ul>
 */
package io.recovery.jdbc;
