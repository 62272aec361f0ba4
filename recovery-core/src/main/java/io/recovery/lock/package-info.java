/**
 * Relational TTL lock for single-active jobs.
 */
package io.recovery.lock;
