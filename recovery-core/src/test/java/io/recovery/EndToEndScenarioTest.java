package io.recovery;

import io.recovery.dead.DeadLetterPipeline;
import io.recovery.model.DeadLetterEntry;
import io.recovery.model.ReplayLogRecord;
import io.recovery.model.WorkMessage;
import io.recovery.queue.DurableQueue;
import io.recovery.reclaim.ExponentialBackoffPolicy;
import io.recovery.reclaim.ReclaimResult;
import io.recovery.reclaim.ReclaimScheduler;
import io.recovery.stream.InMemoryReclaimAttemptStore;
import io.recovery.stream.InMemoryStreamStore;
import io.recovery.testing.FakeConnections;
import io.recovery.testing.InMemoryReplayLogStore;
import io.recovery.testing.ManualClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * A message that keeps crashing its consumer ends up dead-lettered and is then
 * replayed exactly once.
 */
class EndToEndScenarioTest {
    private static final Duration IDLE = Duration.ofMinutes(5);
    private static final int MAX_ATTEMPTS = 3;

    @Test
    void crashingMessageIsReclaimedDeadLetteredAndReplayedOnce() {
        ManualClock clock = new ManualClock();
        InMemoryStreamStore store = new InMemoryStreamStore(clock);
        InMemoryReclaimAttemptStore attempts = new InMemoryReclaimAttemptStore();
        InMemoryReplayLogStore replayLog = new InMemoryReplayLogStore();
        DurableQueue queue = DurableQueue.builder()
                .store(store)
                .streamKey("m10:evaluate:stream")
                .group("m10:evaluate:group")
                .consumer("worker-a")
                .attemptStore(attempts)
                .clock(clock)
                .build();
        DeadLetterPipeline deadLetters = DeadLetterPipeline.builder()
                .queue(queue)
                .connectionProvider(FakeConnections.provider())
                .replayLogStore(replayLog)
                .build();
        ReclaimScheduler reclaimer = ReclaimScheduler.builder()
                .queue(queue)
                .deadLetters(deadLetters)
                .backoff(new ExponentialBackoffPolicy(Duration.ofMinutes(1), Duration.ofHours(24)))
                .idleThreshold(IDLE)
                .maxAttempts(MAX_ATTEMPTS)
                .build();

        String messageId = queue.enqueue("42", 1.0, null, null).orElseThrow();
        List<WorkMessage> consumed = queue.consumeBatch(1, Duration.ZERO);
        assertEquals("42", consumed.get(0).subjectId());
        // consumer crashes without acking

        clock.advance(IDLE);
        ReclaimResult first = reclaimer.runOnce();
        assertEquals(1, first.reclaimed());
        assertEquals(1, attempts.get(messageId));

        // the reclaiming consumer crashes too; the next reclaim waits out backoff(1)
        clock.advance(Duration.ofMinutes(1));
        ReclaimResult second = reclaimer.runOnce();
        assertEquals(1, second.reclaimed());
        assertEquals(2, attempts.get(messageId));

        // delivery count has reached the ceiling
        ReclaimResult third = reclaimer.runOnce();
        assertEquals(1, third.deadLettered());
        assertEquals(0, queue.info().pendingCount());
        assertEquals(0, attempts.get(messageId));

        DeadLetterEntry deadLetter = deadLetters.findByOriginalMsgId(messageId).orElseThrow();
        String newId = deadLetters.replay(deadLetter.id(), true, false).orElseThrow();
        assertEquals("42", queue.read(newId).orElseThrow().subjectId());

        List<ReplayLogRecord> ledger = replayLog.all();
        assertEquals(1, ledger.size());
        assertEquals(messageId, ledger.get(0).originalMsgId());
        assertEquals(newId, ledger.get(0).newMsgId());

        assertTrue(deadLetters.replay(deadLetter.id(), true, false).isEmpty());
        assertEquals(0, deadLetters.deadLetterCount());
    }
}
