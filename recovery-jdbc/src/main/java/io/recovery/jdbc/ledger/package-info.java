/**
 * Durable records of the dead-letter subsystem: the replay ledger and the archive
 * of trimmed dead letters.
 */
package io.recovery.jdbc.ledger;
