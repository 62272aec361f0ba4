/**
 * Canonical records for stream entries, dead letters, locks, outbox rows and the
 * replay ledger. Store implementations normalize their client types into these.
 */
package io.recovery.model;
