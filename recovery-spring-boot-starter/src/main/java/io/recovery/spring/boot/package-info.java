/**
 * Spring Boot auto-configuration for the recovery components.
 *
 * <p>{@link io.recovery.spring.boot.RecoveryJdbcAutoConfiguration} contributes the relational
 * stores from the application's {@code DataSource}, and
 * {@link io.recovery.spring.boot.RecoveryRedisAutoConfiguration} the Redis stream store from its
 * {@code StringRedisTemplate}. {@link io.recovery.spring.boot.RecoveryAutoConfiguration} then
 * builds the queue, dead-letter pipeline and background loops from {@code recovery.*} properties.
 *
 * @see io.recovery.spring.boot.RecoveryProperties
 */
package io.recovery.spring.boot;
