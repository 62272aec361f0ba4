package io.recovery.redis;

import io.recovery.dead.DeadLetterPipeline;
import io.recovery.model.GroupCreation;
import io.recovery.model.PendingEntry;
import io.recovery.model.StreamEntry;
import io.recovery.model.WorkMessage;
import io.recovery.queue.DurableQueue;
import io.recovery.reclaim.ReclaimResult;
import io.recovery.reclaim.ReclaimScheduler;
import io.recovery.spi.StoreException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class RedisStoresIntegrationTest {

    private static final String STREAM = "test:stream";
    private static final String GROUP = "test:group";

    @Container
    static final GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private static LettuceConnectionFactory connectionFactory;
    private static StringRedisTemplate redisTemplate;

    private RedisStreamStore store;

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(
                new RedisStandaloneConfiguration(redis.getHost(), redis.getMappedPort(6379)));
        connectionFactory.afterPropertiesSet();
        redisTemplate = new StringRedisTemplate(connectionFactory);
    }

    @AfterAll
    static void disconnect() {
        if (connectionFactory != null) {
            connectionFactory.destroy();
        }
    }

    @BeforeEach
    void flush() {
        redisTemplate.execute(connection -> {
            connection.serverCommands().flushAll();
            return null;
        }, true);
        store = new RedisStreamStore(redisTemplate);
    }

    @Test
    void createGroupIsIdempotentAndCreatesStream() {
        assertEquals(GroupCreation.CREATED, store.createGroup(STREAM, GROUP));
        assertEquals(GroupCreation.ALREADY_EXISTS, store.createGroup(STREAM, GROUP));
        assertEquals(0, store.length(STREAM));
    }

    @Test
    void readAckAndPending() {
        store.createGroup(STREAM, GROUP);
        String id = store.add(STREAM, Map.of("candidate_id", "42"), 0);

        List<StreamEntry> read = store.readGroup(STREAM, GROUP, "c1", 10, Duration.ZERO);
        assertEquals(1, read.size());
        assertEquals(id, read.get(0).id());
        assertEquals("42", read.get(0).fields().get("candidate_id"));
        assertTrue(store.readGroup(STREAM, GROUP, "c1", 10, Duration.ofMillis(50)).isEmpty());

        List<PendingEntry> pending = store.pending(STREAM, GROUP, 10);
        assertEquals(1, pending.size());
        assertEquals("c1", pending.get(0).consumer());
        assertEquals(1, pending.get(0).deliveryCount());
        assertEquals(1, store.pendingCount(STREAM, GROUP));

        assertEquals(1, store.ack(STREAM, GROUP, List.of(id)));
        assertEquals(0, store.ack(STREAM, GROUP, List.of(id)));
        assertEquals(0, store.pendingCount(STREAM, GROUP));
    }

    @Test
    void claimRespectsMinIdle() throws Exception {
        store.createGroup(STREAM, GROUP);
        String id = store.add(STREAM, Map.of("k", "v"), 0);
        store.readGroup(STREAM, GROUP, "c1", 10, Duration.ZERO);

        assertTrue(store.claim(STREAM, GROUP, "c2", Duration.ofMinutes(5), List.of(id)).isEmpty());
        Thread.sleep(150);
        List<StreamEntry> claimed = store.claim(STREAM, GROUP, "c2", Duration.ofMillis(100), List.of(id));
        assertEquals(1, claimed.size());
        assertEquals("c2", store.pending(STREAM, GROUP, 10).get(0).consumer());
        assertEquals(2, store.pending(STREAM, GROUP, 10).get(0).deliveryCount());
    }

    @Test
    void rangePagesWithExclusiveCursor() {
        String a = store.add(STREAM, Map.of("n", "1"), 0);
        String b = store.add(STREAM, Map.of("n", "2"), 0);
        String c = store.add(STREAM, Map.of("n", "3"), 0);

        assertEquals(List.of(a, b), ids(store.range(STREAM, null, 2)));
        assertEquals(List.of(c), ids(store.range(STREAM, b, 2)));
        assertTrue(store.range(STREAM, c, 2).isEmpty());
        assertEquals(List.of(c, b), ids(store.reverseRange(STREAM, 2)));
        assertEquals("2", store.get(STREAM, b).orElseThrow().fields().get("n"));

        assertEquals(1, store.delete(STREAM, List.of(b)));
        assertTrue(store.get(STREAM, b).isEmpty());
        assertEquals(2, store.length(STREAM));
    }

    @Test
    void approximateTrimKeepsAtLeastMaxLength() {
        for (int i = 0; i < 500; i++) {
            store.add(STREAM, Map.of("n", Integer.toString(i)), 100);
        }
        long length = store.length(STREAM);
        assertTrue(length >= 100, "length " + length);
        assertTrue(length < 500, "length " + length);
    }

    @Test
    void missingGroupSurfacesAsStoreException() {
        store.add(STREAM, Map.of("k", "v"), 0);
        assertThrows(StoreException.class, () -> store.pending(STREAM, "no-such-group", 10));
    }

    @Test
    void reclaimCountersExpireAsAHash() {
        RedisReclaimAttemptStore attempts = new RedisReclaimAttemptStore(redisTemplate);
        assertEquals(0, attempts.get("1-0"));
        assertEquals(1, attempts.increment("1-0"));
        assertEquals(2, attempts.increment("1-0"));
        attempts.increment("2-0");
        assertEquals(List.of("1-0", "2-0"), attempts.trackedIds(10));

        Long ttl = redisTemplate.getExpire(RedisReclaimAttemptStore.DEFAULT_KEY);
        assertNotNull(ttl);
        assertTrue(ttl > 0);

        attempts.clear(List.of("1-0"));
        assertEquals(0, attempts.get("1-0"));
        assertEquals(List.of("2-0"), attempts.trackedIds(10));
    }

    @Test
    void unreadableReclaimCounterFallsBackToIdleThreshold() throws Exception {
        RedisReclaimAttemptStore attempts = new RedisReclaimAttemptStore(redisTemplate);
        DurableQueue queue = DurableQueue.builder()
                .store(store)
                .streamKey(STREAM)
                .group(GROUP)
                .consumer("worker-a")
                .attemptStore(attempts)
                .build();
        ReclaimScheduler reclaimer = ReclaimScheduler.builder()
                .queue(queue)
                .deadLetters(DeadLetterPipeline.builder().queue(queue).deadLetterStreamKey("test:dead-letter").build())
                .maxAttempts(5)
                .build();

        String id = queue.enqueue(Map.of("candidate_id", "7")).orElseThrow();
        queue.consumeBatch(10, Duration.ZERO);
        redisTemplate.opsForHash().put(RedisReclaimAttemptStore.DEFAULT_KEY, id, "garbage");
        assertThrows(StoreException.class, () -> attempts.get(id));
        Thread.sleep(150);

        ReclaimResult result = reclaimer.reclaimStalled(Duration.ofMillis(100), 5, 20, true);
        assertEquals(1, result.reclaimed());
        assertEquals(0, result.errors());
    }

    @Test
    void replayTrackerRemembersIds() {
        RedisReplayTracker tracker = new RedisReplayTracker(redisTemplate);
        assertFalse(tracker.isReplayed("9-0"));
        tracker.markReplayed("9-0");
        assertTrue(tracker.isReplayed("9-0"));
        assertTrue(redisTemplate.getExpire(RedisReplayTracker.DEFAULT_KEY) > 0);
    }

    @Test
    void stalledMessageIsReclaimedThenDeadLettered() throws Exception {
        DurableQueue queue = DurableQueue.builder()
                .store(store)
                .streamKey(STREAM)
                .group(GROUP)
                .consumer("worker-a")
                .attemptStore(new RedisReclaimAttemptStore(redisTemplate))
                .build();
        DeadLetterPipeline deadLetters = DeadLetterPipeline.builder()
                .queue(queue)
                .deadLetterStreamKey("test:dead-letter")
                .replayTracker(new RedisReplayTracker(redisTemplate))
                .build();
        ReclaimScheduler reclaimer = ReclaimScheduler.builder()
                .queue(queue)
                .deadLetters(deadLetters)
                .maxAttempts(2)
                .useBackoff(false)
                .build();

        String id = queue.enqueue(Map.of("candidate_id", "42")).orElseThrow();
        List<WorkMessage> batch = queue.consumeBatch(10, Duration.ZERO);
        assertEquals(1, batch.size());
        Thread.sleep(150);

        ReclaimResult first = reclaimer.reclaimStalled(Duration.ofMillis(100), 2, 20, false);
        assertEquals(1, first.reclaimed());
        Thread.sleep(150);

        ReclaimResult second = reclaimer.reclaimStalled(Duration.ofMillis(100), 2, 20, false);
        assertEquals(1, second.deadLettered());
        assertEquals(1, deadLetters.deadLetterCount());
        assertEquals(id, deadLetters.findByOriginalMsgId(id).orElseThrow().originalMsgId());
        assertEquals(0, queue.info().pendingCount());
    }
}
