package io.recovery.redis;

import io.recovery.spi.ReclaimAttemptStore;
import io.recovery.spi.StoreException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Reclaim counters in one Redis hash, field per message id.
 *
 * <p>The hash expiry is refreshed on every increment, so counters of a queue
 * that stops reclaiming disappear on their own.
 */
public final class RedisReclaimAttemptStore implements ReclaimAttemptStore {
    public static final String DEFAULT_KEY = "m10:reclaim:attempts";
    public static final Duration DEFAULT_TTL = Duration.ofDays(7);

    private final StringRedisTemplate redisTemplate;
    private final String key;
    private final Duration ttl;

    public RedisReclaimAttemptStore(StringRedisTemplate redisTemplate) {
        this(redisTemplate, DEFAULT_KEY, DEFAULT_TTL);
    }

    public RedisReclaimAttemptStore(StringRedisTemplate redisTemplate, String key, Duration ttl) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate");
        this.key = Objects.requireNonNull(key, "key");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
    }

    @Override
    public long get(String messageId) {
        try {
            Object value = redisTemplate.opsForHash().get(key, messageId);
            return value == null ? 0L : Long.parseLong(value.toString());
        } catch (DataAccessException e) {
            throw new StoreException("Failed to read reclaim count of " + messageId, e);
        } catch (NumberFormatException e) {
            throw new StoreException("Reclaim count of " + messageId + " is not a number", e);
        }
    }

    @Override
    public long increment(String messageId) {
        try {
            Long count = redisTemplate.opsForHash().increment(key, messageId, 1L);
            redisTemplate.expire(key, ttl);
            return count == null ? 0L : count;
        } catch (DataAccessException e) {
            throw new StoreException("Failed to increment reclaim count of " + messageId, e);
        }
    }

    @Override
    public void clear(String messageId) {
        clear(List.of(messageId));
    }

    @Override
    public void clear(List<String> messageIds) {
        if (messageIds.isEmpty()) {
            return;
        }
        try {
            redisTemplate.opsForHash().delete(key, messageIds.toArray());
        } catch (DataAccessException e) {
            throw new StoreException("Failed to clear reclaim counts", e);
        }
    }

    @Override
    public List<String> trackedIds(int limit) {
        try {
            return redisTemplate.opsForHash().keys(key).stream()
                    .map(Object::toString)
                    .sorted()
                    .limit(limit)
                    .toList();
        } catch (DataAccessException e) {
            throw new StoreException("Failed to list reclaim counters", e);
        }
    }
}
