package io.recovery.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SideEffectsTest {

    @Test
    void runsAction() {
        AtomicInteger calls = new AtomicInteger();

        assertTrue(SideEffects.bestEffort("count", calls::incrementAndGet));
        assertEquals(1, calls.get());
    }

    @Test
    void failureIsContained() {
        assertFalse(SideEffects.bestEffort("boom", () -> {
            throw new IllegalStateException("boom");
        }));
    }
}
