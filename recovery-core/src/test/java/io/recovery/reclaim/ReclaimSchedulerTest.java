package io.recovery.reclaim;

import io.recovery.dead.DeadLetterPipeline;
import io.recovery.model.DeadLetterEntry;
import io.recovery.model.WorkMessage;
import io.recovery.queue.DurableQueue;
import io.recovery.spi.ReclaimAttemptStore;
import io.recovery.spi.StoreException;
import io.recovery.stream.InMemoryReclaimAttemptStore;
import io.recovery.stream.InMemoryStreamStore;
import io.recovery.testing.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReclaimSchedulerTest {
    private static final Duration IDLE = Duration.ofMinutes(5);

    private ManualClock clock;
    private InMemoryStreamStore store;
    private InMemoryReclaimAttemptStore attempts;
    private DurableQueue queue;
    private DeadLetterPipeline deadLetters;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        store = new InMemoryStreamStore(clock);
        attempts = new InMemoryReclaimAttemptStore();
        queue = DurableQueue.builder()
                .store(store)
                .streamKey("work")
                .group("workers")
                .consumer("reclaimer")
                .attemptStore(attempts)
                .clock(clock)
                .build();
        deadLetters = DeadLetterPipeline.builder().queue(queue).deadLetterStreamKey("work:dl").build();
    }

    private ReclaimScheduler scheduler(int maxAttempts, int maxPerPass) {
        return ReclaimScheduler.builder()
                .queue(queue)
                .deadLetters(deadLetters)
                .backoff(new ExponentialBackoffPolicy(Duration.ofMinutes(1), Duration.ofHours(1)))
                .idleThreshold(IDLE)
                .maxAttempts(maxAttempts)
                .maxPerPass(maxPerPass)
                .build();
    }

    private String deliverOne(String subject) {
        String id = queue.enqueue(Map.of(WorkMessage.CANDIDATE_ID, subject)).orElseThrow();
        queue.consumeBatch(1, Duration.ZERO);
        return id;
    }

    @Test
    void freshPendingEntryIsDeferred() {
        deliverOne("1");

        ReclaimResult result = scheduler(3, 20).reclaimStalled(IDLE, 3, 20, true);

        assertEquals(new ReclaimResult(0, 0, 0, 1, 0), result);
    }

    @Test
    void idleEntryIsReclaimedAndCounted() {
        String id = deliverOne("1");
        clock.advance(IDLE);

        ReclaimResult result = scheduler(3, 20).reclaimStalled(IDLE, 3, 20, true);

        assertEquals(1, result.reclaimed());
        assertEquals(1, attempts.get(id));
        assertEquals("reclaimer", queue.pending(1).get(0).consumer());
    }

    @Test
    void backoffLengthensRequiredIdleAfterReclaim() {
        String id = deliverOne("1");
        attempts.increment(id);
        attempts.increment(id);
        ReclaimScheduler reclaimer = scheduler(5, 20);

        // two earlier reclaims: backoff(2) = 2 minutes, below the 5 minute threshold
        clock.advance(Duration.ofSeconds(90));
        assertEquals(1, reclaimer.reclaimStalled(IDLE, 5, 20, true).backoffDeferred());

        clock.advance(Duration.ofSeconds(30));
        assertEquals(1, reclaimer.reclaimStalled(IDLE, 5, 20, true).reclaimed());
    }

    @Test
    void withoutBackoffIdleThresholdAlwaysApplies() {
        String id = deliverOne("1");
        attempts.increment(id);
        clock.advance(Duration.ofMinutes(2));

        ReclaimResult result = scheduler(5, 20).reclaimStalled(IDLE, 5, 20, false);

        assertEquals(1, result.backoffDeferred());
        assertEquals(0, result.reclaimed());
    }

    @Test
    void excessCandidatesAreSkipped() {
        for (int i = 0; i < 5; i++) {
            deliverOne(String.valueOf(i));
        }
        clock.advance(IDLE);

        ReclaimResult result = scheduler(3, 2).reclaimStalled(IDLE, 3, 2, true);

        assertEquals(2, result.reclaimed());
        assertEquals(3, result.skipped());

        ReclaimResult next = scheduler(3, 2).reclaimStalled(IDLE, 3, 2, true);
        assertEquals(2, next.reclaimed());
    }

    @Test
    void exhaustedEntryIsDeadLetteredIgnoringBackoff() {
        String id = deliverOne("7");
        ReclaimScheduler reclaimer = scheduler(2, 20);
        clock.advance(IDLE);
        assertEquals(1, reclaimer.reclaimStalled(IDLE, 2, 20, true).reclaimed());

        // delivery count is now 2; no idle time needed to dead-letter
        ReclaimResult result = reclaimer.reclaimStalled(IDLE, 2, 20, true);

        assertEquals(1, result.deadLettered());
        assertEquals(0, queue.pending(10).size());
        assertEquals(0, attempts.get(id));
        DeadLetterEntry entry = deadLetters.findByOriginalMsgId(id).orElseThrow();
        assertEquals(DeadLetterEntry.MAX_RECLAIMS_EXCEEDED, entry.reason());
        assertEquals("7", entry.subjectId());
        assertEquals("work", entry.originalStream());
    }

    @Test
    void concurrentReclaimersClaimEachEntryOnce() {
        deliverOne("1");
        clock.advance(IDLE);
        DurableQueue other = DurableQueue.builder()
                .store(store).streamKey("work").group("workers").consumer("other")
                .attemptStore(attempts).clock(clock).build();
        ReclaimScheduler first = scheduler(3, 20);
        ReclaimScheduler second = ReclaimScheduler.builder()
                .queue(other).deadLetters(deadLetters).idleThreshold(IDLE).build();

        int total = first.reclaimStalled(IDLE, 3, 20, false).reclaimed()
                + second.reclaimStalled(IDLE, 3, 20, false).reclaimed();

        assertEquals(1, total);
    }

    @Test
    void unreadableCounterUsesIdleThreshold() {
        ReclaimAttemptStore unreadable = new ReclaimAttemptStore() {
            @Override
            public long get(String messageId) {
                throw new StoreException("Reclaim count of " + messageId + " is not a number");
            }

            @Override
            public long increment(String messageId) {
                return attempts.increment(messageId);
            }

            @Override
            public void clear(String messageId) {
                attempts.clear(messageId);
            }

            @Override
            public void clear(List<String> messageIds) {
                attempts.clear(messageIds);
            }

            @Override
            public List<String> trackedIds(int limit) {
                return attempts.trackedIds(limit);
            }
        };
        queue = DurableQueue.builder()
                .store(store)
                .streamKey("work")
                .group("workers")
                .consumer("reclaimer")
                .attemptStore(unreadable)
                .clock(clock)
                .build();
        deadLetters = DeadLetterPipeline.builder().queue(queue).deadLetterStreamKey("work:dl").build();
        String id = deliverOne("1");
        clock.advance(IDLE);

        ReclaimResult result = scheduler(3, 20).reclaimStalled(IDLE, 3, 20, true);

        assertEquals(1, result.reclaimed());
        assertEquals(0, result.errors());
        assertEquals(1, attempts.get(id));
    }

    @Test
    void runOnceAfterCloseDoesNothing() {
        ReclaimScheduler reclaimer = scheduler(3, 20);
        reclaimer.close();

        assertTrue(reclaimer.runOnce().isEmpty());
    }
}
