/**
 * Age-based {@link io.recovery.spi.RetentionPurger} implementations, one per
 * retention-managed table.
 */
package io.recovery.jdbc.purge;
