package io.recovery.reclaim;

import java.time.Duration;

/**
 * Delay before the next attempt of a unit of work, as a function of how many
 * attempts have already been made.
 *
 * <p>Implementations must be deterministic and non-decreasing in {@code attempt}.
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * @param attempt attempts made so far, {@code >= 1}; smaller values yield {@link Duration#ZERO}
     * @return the delay to apply
     */
    Duration delay(int attempt);
}
