package io.recovery.spring.boot;

import io.recovery.jdbc.ledger.JdbcDeadLetterArchiveStore;
import io.recovery.jdbc.ledger.JdbcReplayLogStore;
import io.recovery.jdbc.lock.AbstractJdbcLockStore;
import io.recovery.jdbc.lock.JdbcLockStores;
import io.recovery.jdbc.outbox.AbstractJdbcOutboxStore;
import io.recovery.jdbc.outbox.JdbcOutboxStores;
import io.recovery.jdbc.purge.DeadLetterArchivePurger;
import io.recovery.jdbc.purge.ProcessedOutboxPurger;
import io.recovery.jdbc.purge.ReplayLogPurger;
import io.recovery.lock.DistributedLock;
import io.recovery.spi.ConnectionProvider;
import io.recovery.spi.DeadLetterArchiveStore;
import io.recovery.spi.LockStore;
import io.recovery.spi.OutboxStore;
import io.recovery.spi.ReplayLogStore;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Relational stores backing the lock, the outbox, the replay ledger and the archive.
 *
 * <p>The lock and outbox dialects are detected from the {@link DataSource} URL.
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(JdbcLockStores.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(RecoveryProperties.class)
public class RecoveryJdbcAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public ConnectionProvider connectionProvider(DataSource dataSource) {
        return dataSource::getConnection;
    }

    @Bean
    @ConditionalOnMissingBean(LockStore.class)
    public AbstractJdbcLockStore lockStore(DataSource dataSource, RecoveryProperties props) {
        return JdbcLockStores.detect(dataSource).withTableName(props.getJdbc().getLockTable());
    }

    @Bean
    @ConditionalOnMissingBean(OutboxStore.class)
    public AbstractJdbcOutboxStore outboxStore(DataSource dataSource, RecoveryProperties props) {
        return JdbcOutboxStores.detect(dataSource).withTableName(props.getJdbc().getOutboxTable());
    }

    @Bean
    @ConditionalOnMissingBean(ReplayLogStore.class)
    public JdbcReplayLogStore replayLogStore(RecoveryProperties props) {
        return new JdbcReplayLogStore(props.getJdbc().getReplayLogTable());
    }

    @Bean
    @ConditionalOnMissingBean(DeadLetterArchiveStore.class)
    public JdbcDeadLetterArchiveStore deadLetterArchiveStore(RecoveryProperties props) {
        return new JdbcDeadLetterArchiveStore(props.getJdbc().getArchiveTable());
    }

    @Bean
    @ConditionalOnMissingBean
    public DistributedLock distributedLock(ConnectionProvider connectionProvider, LockStore lockStore) {
        return new DistributedLock(connectionProvider, lockStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterArchivePurger deadLetterArchivePurger(RecoveryProperties props) {
        return new DeadLetterArchivePurger(props.getJdbc().getArchiveTable());
    }

    @Bean
    @ConditionalOnMissingBean
    public ReplayLogPurger replayLogPurger(RecoveryProperties props) {
        return new ReplayLogPurger(props.getJdbc().getReplayLogTable());
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessedOutboxPurger processedOutboxPurger(RecoveryProperties props) {
        return new ProcessedOutboxPurger(props.getJdbc().getOutboxTable());
    }
}
