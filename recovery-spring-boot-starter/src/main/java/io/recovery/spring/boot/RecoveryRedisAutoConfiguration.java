package io.recovery.spring.boot;

import io.recovery.redis.RedisReclaimAttemptStore;
import io.recovery.redis.RedisReplayTracker;
import io.recovery.redis.RedisStreamStore;
import io.recovery.spi.ReclaimAttemptStore;
import io.recovery.spi.ReplayTracker;
import io.recovery.spi.StreamStore;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis-backed stream store, reclaim counters and replay tracking, built on the
 * application's {@link StringRedisTemplate}.
 */
@AutoConfiguration(after = RedisAutoConfiguration.class)
@ConditionalOnClass({RedisStreamStore.class, StringRedisTemplate.class})
@ConditionalOnBean(StringRedisTemplate.class)
@EnableConfigurationProperties(RecoveryProperties.class)
public class RecoveryRedisAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(StreamStore.class)
    public RedisStreamStore streamStore(StringRedisTemplate redisTemplate) {
        return new RedisStreamStore(redisTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(ReclaimAttemptStore.class)
    public RedisReclaimAttemptStore reclaimAttemptStore(StringRedisTemplate redisTemplate,
                                                        RecoveryProperties props) {
        RecoveryProperties.Reclaim reclaim = props.getReclaim();
        return new RedisReclaimAttemptStore(redisTemplate, reclaim.getAttemptsKey(),
                Duration.ofSeconds(reclaim.getAttemptsTtlSeconds()));
    }

    @Bean
    @ConditionalOnMissingBean(ReplayTracker.class)
    public RedisReplayTracker replayTracker(StringRedisTemplate redisTemplate, RecoveryProperties props) {
        RecoveryProperties.DeadLetter deadLetter = props.getDeadLetter();
        return new RedisReplayTracker(redisTemplate, deadLetter.getReplayTrackingKey(),
                Duration.ofSeconds(deadLetter.getReplayTrackingTtlSeconds()));
    }
}
