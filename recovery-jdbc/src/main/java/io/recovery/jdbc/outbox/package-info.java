/**
 * Consumer-side {@link io.recovery.spi.OutboxStore} implementations.
 *
 * <p>{@code process_after} is the only scheduling column these stores read or
 * write; claims are tracked in {@code claimed_by} / {@code claimed_at}.
 */
package io.recovery.jdbc.outbox;
