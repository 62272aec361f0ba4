package io.recovery.reclaim;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExponentialBackoffPolicyTest {

    @Test
    void doublesFromBase() {
        ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(Duration.ofSeconds(60), Duration.ofHours(24));

        assertEquals(Duration.ofSeconds(60), policy.delay(1));
        assertEquals(Duration.ofSeconds(120), policy.delay(2));
        assertEquals(Duration.ofSeconds(240), policy.delay(3));
        assertEquals(Duration.ofSeconds(480), policy.delay(4));
    }

    @Test
    void cappedAtMax() {
        ExponentialBackoffPolicy policy = new ExponentialBackoffPolicy(Duration.ofSeconds(60), Duration.ofHours(24));

        assertEquals(Duration.ofHours(24), policy.delay(12));
        assertEquals(Duration.ofHours(24), policy.delay(63));
        assertEquals(Duration.ofHours(24), policy.delay(Integer.MAX_VALUE));
    }

    @Test
    void monotonicForAllAttempts() {
        ExponentialBackoffPolicy policy = ExponentialBackoffPolicy.reclaimDefaults();
        Duration previous = Duration.ZERO;
        for (int attempt = 1; attempt <= 200; attempt++) {
            Duration delay = policy.delay(attempt);
            assertTrue(delay.compareTo(previous) >= 0, "attempt " + attempt);
            assertTrue(delay.compareTo(policy.max()) <= 0, "attempt " + attempt);
            previous = delay;
        }
    }

    @Test
    void zeroBeforeFirstAttempt() {
        assertEquals(Duration.ZERO, ExponentialBackoffPolicy.reclaimDefaults().delay(0));
        assertEquals(Duration.ZERO, ExponentialBackoffPolicy.reclaimDefaults().delay(-3));
    }

    @Test
    void outboxDefaultsMatchPowersOfTwoSeconds() {
        ExponentialBackoffPolicy policy = ExponentialBackoffPolicy.outboxDefaults();

        assertEquals(Duration.ofSeconds(1), policy.delay(1));
        assertEquals(Duration.ofSeconds(8), policy.delay(4));
        assertEquals(Duration.ofSeconds(1024), policy.delay(11));
        assertEquals(Duration.ofSeconds(1024), policy.delay(30));
    }

    @Test
    void rejectsInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () ->
                new ExponentialBackoffPolicy(Duration.ZERO, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () ->
                new ExponentialBackoffPolicy(Duration.ofSeconds(10), Duration.ofSeconds(1)));
    }
}
