/**
 * Takeover of stalled messages with exponential backoff and dead-lettering.
 */
package io.recovery.reclaim;
