package io.recovery.redis;

import io.recovery.spi.ReplayTracker;
import io.recovery.spi.StoreException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Objects;

/**
 * Replayed dead-letter ids in a Redis set with a rolling expiry.
 */
public final class RedisReplayTracker implements ReplayTracker {
    public static final String DEFAULT_KEY = "m10:replay:processed";
    public static final Duration DEFAULT_TTL = Duration.ofDays(1);

    private final StringRedisTemplate redisTemplate;
    private final String key;
    private final Duration ttl;

    public RedisReplayTracker(StringRedisTemplate redisTemplate) {
        this(redisTemplate, DEFAULT_KEY, DEFAULT_TTL);
    }

    public RedisReplayTracker(StringRedisTemplate redisTemplate, String key, Duration ttl) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate");
        this.key = Objects.requireNonNull(key, "key");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
    }

    @Override
    public boolean isReplayed(String dlMsgId) {
        try {
            return Boolean.TRUE.equals(redisTemplate.opsForSet().isMember(key, dlMsgId));
        } catch (DataAccessException e) {
            throw new StoreException("Failed to check replay of " + dlMsgId, e);
        }
    }

    @Override
    public void markReplayed(String dlMsgId) {
        try {
            redisTemplate.opsForSet().add(key, dlMsgId);
            redisTemplate.expire(key, ttl);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to mark replay of " + dlMsgId, e);
        }
    }
}
