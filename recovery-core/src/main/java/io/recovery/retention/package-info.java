/**
 * Retention of archived dead letters, replay records, processed outbox rows and locks.
 */
package io.recovery.retention;
