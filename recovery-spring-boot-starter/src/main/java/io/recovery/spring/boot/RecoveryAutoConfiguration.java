package io.recovery.spring.boot;

import io.recovery.dead.ArchiveTrimmer;
import io.recovery.dead.DeadLetterPipeline;
import io.recovery.dead.ProcessedSubjectCheck;
import io.recovery.jdbc.purge.DeadLetterArchivePurger;
import io.recovery.jdbc.purge.ProcessedOutboxPurger;
import io.recovery.jdbc.purge.ReplayLogPurger;
import io.recovery.lock.DistributedLock;
import io.recovery.outbox.OutboxHandler;
import io.recovery.outbox.OutboxProcessor;
import io.recovery.queue.DurableQueue;
import io.recovery.reclaim.ExponentialBackoffPolicy;
import io.recovery.reclaim.ReclaimScheduler;
import io.recovery.retention.RetentionGC;
import io.recovery.spi.ConnectionProvider;
import io.recovery.spi.DeadLetterArchiveStore;
import io.recovery.spi.MetricsExporter;
import io.recovery.spi.OutboxStore;
import io.recovery.spi.ReclaimAttemptStore;
import io.recovery.spi.ReplayLogStore;
import io.recovery.spi.ReplayTracker;
import io.recovery.spi.StreamStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Duration;

/**
 * Auto-configuration for the recovery components.
 *
 * <p>Queue-side components need a {@link StreamStore} bean, which
 * {@link RecoveryRedisAutoConfiguration} contributes when Redis is configured.
 * The outbox processor and retention GC need the relational stores from
 * {@link RecoveryJdbcAutoConfiguration}. Background loops are started with the
 * context and closed with it.
 *
 * @see RecoveryProperties
 * @see RecoveryMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {RecoveryJdbcAutoConfiguration.class, RecoveryRedisAutoConfiguration.class})
@ConditionalOnClass(DurableQueue.class)
@EnableConfigurationProperties(RecoveryProperties.class)
public class RecoveryAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(StreamStore.class)
    public DurableQueue durableQueue(StreamStore streamStore,
                                     RecoveryProperties props,
                                     ObjectProvider<ReclaimAttemptStore> attemptStoreProvider,
                                     ObjectProvider<MetricsExporter> metricsProvider) {
        RecoveryProperties.Stream stream = props.getStream();
        DurableQueue.Builder builder = DurableQueue.builder()
                .store(streamStore)
                .streamKey(stream.getKey())
                .group(stream.getGroup())
                .maxLength(stream.getMaxLength())
                .attemptStore(attemptStoreProvider.getIfAvailable())
                .metrics(metrics(metricsProvider));
        if (!isBlank(stream.getConsumer())) {
            builder.consumer(stream.getConsumer());
        }
        DurableQueue queue = builder.build();
        queue.ensureGroup();
        return queue;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(StreamStore.class)
    public DeadLetterPipeline deadLetterPipeline(DurableQueue queue,
                                                 RecoveryProperties props,
                                                 ObjectProvider<ConnectionProvider> connectionProvider,
                                                 ObjectProvider<ReplayLogStore> replayLogStore,
                                                 ObjectProvider<ReplayTracker> replayTracker,
                                                 ObjectProvider<ProcessedSubjectCheck> processedCheck) {
        return DeadLetterPipeline.builder()
                .queue(queue)
                .deadLetterStreamKey(props.getDeadLetter().getStreamKey())
                .connectionProvider(connectionProvider.getIfAvailable())
                .replayLogStore(replayLogStore.getIfAvailable())
                .replayTracker(replayTracker.getIfAvailable())
                .processedCheck(processedCheck.getIfAvailable())
                .build();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean(StreamStore.class)
    @ConditionalOnProperty(prefix = "recovery.reclaim", name = "enabled", matchIfMissing = true)
    public ReclaimScheduler reclaimScheduler(DurableQueue queue,
                                             DeadLetterPipeline deadLetters,
                                             RecoveryProperties props) {
        RecoveryProperties.Reclaim reclaim = props.getReclaim();
        return ReclaimScheduler.builder()
                .queue(queue)
                .deadLetters(deadLetters)
                .backoff(new ExponentialBackoffPolicy(
                        Duration.ofMillis(reclaim.getBaseBackoffMs()),
                        Duration.ofMillis(reclaim.getMaxBackoffMs())))
                .idleThreshold(Duration.ofMillis(reclaim.getIdleMs()))
                .maxAttempts(reclaim.getMaxAttempts())
                .maxPerPass(reclaim.getMaxPerPass())
                .scanSize(reclaim.getScanSize())
                .useBackoff(reclaim.isUseBackoff())
                .intervalMillis(reclaim.getIntervalMs())
                .build();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean({StreamStore.class, ConnectionProvider.class, DeadLetterArchiveStore.class})
    @ConditionalOnProperty(prefix = "recovery.dead-letter", name = "archive-enabled", matchIfMissing = true)
    public ArchiveTrimmer archiveTrimmer(StreamStore streamStore,
                                         ConnectionProvider connectionProvider,
                                         DeadLetterArchiveStore archiveStore,
                                         RecoveryProperties props,
                                         ObjectProvider<MetricsExporter> metricsProvider) {
        RecoveryProperties.DeadLetter deadLetter = props.getDeadLetter();
        return ArchiveTrimmer.builder()
                .store(streamStore)
                .deadLetterStreamKey(deadLetter.getStreamKey())
                .maxLength(deadLetter.getMaxLength())
                .connectionProvider(connectionProvider)
                .archiveStore(archiveStore)
                .metrics(metrics(metricsProvider))
                .intervalSeconds(deadLetter.getArchiveIntervalSeconds())
                .build();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean({OutboxHandler.class, ConnectionProvider.class, OutboxStore.class})
    @ConditionalOnProperty(prefix = "recovery.outbox", name = "enabled", matchIfMissing = true)
    public OutboxProcessor outboxProcessor(OutboxHandler handler,
                                           ConnectionProvider connectionProvider,
                                           OutboxStore outboxStore,
                                           RecoveryProperties props,
                                           ObjectProvider<DistributedLock> lockProvider,
                                           ObjectProvider<MetricsExporter> metricsProvider) {
        RecoveryProperties.Outbox outbox = props.getOutbox();
        OutboxProcessor.Builder builder = OutboxProcessor.builder()
                .connectionProvider(connectionProvider)
                .outboxStore(outboxStore)
                .handler(handler)
                .batchSize(outbox.getBatchSize())
                .claimTimeout(outbox.getClaimTimeout())
                .backoff(new ExponentialBackoffPolicy(
                        Duration.ofMillis(outbox.getBaseDelayMs()),
                        Duration.ofMillis(outbox.getMaxDelayMs())))
                .lock(lockProvider.getIfAvailable())
                .lockName(outbox.getLockName())
                .metrics(metrics(metricsProvider))
                .intervalMillis(outbox.getIntervalMs());
        if (!isBlank(outbox.getProcessorId())) {
            builder.processorId(outbox.getProcessorId());
        }
        return builder.build();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean(ConnectionProvider.class)
    @ConditionalOnProperty(prefix = "recovery.retention", name = "enabled", matchIfMissing = true)
    public RetentionGC retentionGC(ConnectionProvider connectionProvider,
                                   RecoveryProperties props,
                                   ObjectProvider<DeadLetterArchivePurger> archivePurger,
                                   ObjectProvider<ReplayLogPurger> replayLogPurger,
                                   ObjectProvider<ProcessedOutboxPurger> outboxPurger,
                                   ObjectProvider<DistributedLock> lockProvider,
                                   ObjectProvider<DurableQueue> queueProvider,
                                   ObjectProvider<MetricsExporter> metricsProvider) {
        RecoveryProperties.Retention retention = props.getRetention();
        return RetentionGC.builder()
                .connectionProvider(connectionProvider)
                .deadLetterArchivePurger(archivePurger.getIfAvailable())
                .replayLogPurger(replayLogPurger.getIfAvailable())
                .outboxPurger(outboxPurger.getIfAvailable())
                .lock(lockProvider.getIfAvailable())
                .lockName(retention.getLockName())
                .deadLetterArchiveDays(retention.getDeadLetterArchiveDays())
                .replayLogDays(retention.getReplayLogDays())
                .outboxDays(retention.getOutboxDays())
                .dryRun(retention.isDryRun())
                .batchSize(retention.getBatchSize())
                .queue(queueProvider.getIfAvailable())
                .metrics(metrics(metricsProvider))
                .intervalSeconds(retention.getIntervalSeconds())
                .build();
    }

    private static MetricsExporter metrics(ObjectProvider<MetricsExporter> provider) {
        return provider.getIfAvailable(() -> MetricsExporter.NOOP);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
