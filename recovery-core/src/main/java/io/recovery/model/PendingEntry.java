package io.recovery.model;

import java.time.Duration;
import java.util.Objects;

/**
 * A delivered but unacknowledged message in a consumer group's pending-entry list.
 *
 * @param id            message id
 * @param consumer      consumer currently owning the message
 * @param idle          time since the last delivery
 * @param deliveryCount number of times the message has been delivered
 */
public record PendingEntry(String id, String consumer, Duration idle, long deliveryCount) {

    public PendingEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(idle, "idle");
    }
}
