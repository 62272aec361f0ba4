package io.recovery.outbox;

import io.recovery.model.OutboxRecord;

/**
 * Delivers the side effect an outbox record stands for.
 *
 * <p>Delivery is at-least-once: a record may be handed over again after a crash
 * or an expired claim, so implementations must be idempotent.
 */
@FunctionalInterface
public interface OutboxHandler {

    /**
     * @throws Exception to mark the delivery failed and schedule a retry
     */
    void handle(OutboxRecord record) throws Exception;
}
