/**
 * Consumer-side claim and completion of transactional outbox records.
 */
package io.recovery.outbox;
