/**
 * Redis-backed stores: {@link io.recovery.redis.RedisStreamStore} for the work and
 * dead-letter streams, plus the reclaim counters and short-lived replay tracking.
 *
 * <p>All classes take a {@link org.springframework.data.redis.core.StringRedisTemplate}
 * built once by the application.
 */
package io.recovery.redis;
