/**
 * Durable work queue with consumer-group consumption and acknowledgment.
 */
package io.recovery.queue;
