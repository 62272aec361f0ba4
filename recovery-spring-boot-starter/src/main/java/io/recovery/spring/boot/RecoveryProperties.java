package io.recovery.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the recovery components.
 *
 * <p>Defaults match the component builders, so an application that sets nothing
 * gets the same behavior as one wiring the builders by hand.
 *
 * @see RecoveryAutoConfiguration
 */
@ConfigurationProperties(prefix = "recovery")
public class RecoveryProperties {

    private final Stream stream = new Stream();
    private final Reclaim reclaim = new Reclaim();
    private final DeadLetter deadLetter = new DeadLetter();
    private final Jdbc jdbc = new Jdbc();
    private final Outbox outbox = new Outbox();
    private final Retention retention = new Retention();
    private final Metrics metrics = new Metrics();

    public Stream getStream() {
        return stream;
    }

    public Reclaim getReclaim() {
        return reclaim;
    }

    public DeadLetter getDeadLetter() {
        return deadLetter;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    public Outbox getOutbox() {
        return outbox;
    }

    public Retention getRetention() {
        return retention;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * The work stream and its consumer group.
     */
    public static class Stream {
        private String key = "m10:evaluate:stream";
        private String group = "m10:evaluate:group";

        /**
         * Consumer name within the group. Blank means {@code HOSTNAME}, or
         * {@code worker-<pid>} when that is unset.
         */
        private String consumer = "";
        private long maxLength = 100_000;

        /**
         * How long a consume loop blocks waiting for new entries.
         */
        private long blockMs = 2000;

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getGroup() {
            return group;
        }

        public void setGroup(String group) {
            this.group = group;
        }

        public String getConsumer() {
            return consumer;
        }

        public void setConsumer(String consumer) {
            this.consumer = consumer;
        }

        public long getMaxLength() {
            return maxLength;
        }

        public void setMaxLength(long maxLength) {
            this.maxLength = maxLength;
        }

        public long getBlockMs() {
            return blockMs;
        }

        public void setBlockMs(long blockMs) {
            this.blockMs = blockMs;
        }
    }

    public static class Reclaim {
        private boolean enabled = true;
        private long idleMs = 300_000;
        private int maxAttempts = 3;
        private int maxPerPass = 20;
        private int scanSize = 100;
        private boolean useBackoff = true;
        private long baseBackoffMs = 60_000;
        private long maxBackoffMs = 86_400_000;
        private String attemptsKey = "m10:reclaim:attempts";
        private long attemptsTtlSeconds = 604_800;
        private long intervalMs = 30_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIdleMs() {
            return idleMs;
        }

        public void setIdleMs(long idleMs) {
            this.idleMs = idleMs;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public int getMaxPerPass() {
            return maxPerPass;
        }

        public void setMaxPerPass(int maxPerPass) {
            this.maxPerPass = maxPerPass;
        }

        public int getScanSize() {
            return scanSize;
        }

        public void setScanSize(int scanSize) {
            this.scanSize = scanSize;
        }

        public boolean isUseBackoff() {
            return useBackoff;
        }

        public void setUseBackoff(boolean useBackoff) {
            this.useBackoff = useBackoff;
        }

        public long getBaseBackoffMs() {
            return baseBackoffMs;
        }

        public void setBaseBackoffMs(long baseBackoffMs) {
            this.baseBackoffMs = baseBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public String getAttemptsKey() {
            return attemptsKey;
        }

        public void setAttemptsKey(String attemptsKey) {
            this.attemptsKey = attemptsKey;
        }

        public long getAttemptsTtlSeconds() {
            return attemptsTtlSeconds;
        }

        public void setAttemptsTtlSeconds(long attemptsTtlSeconds) {
            this.attemptsTtlSeconds = attemptsTtlSeconds;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }

    public static class DeadLetter {
        private String streamKey = "m10:evaluate:dead-letter";
        private long maxLength = 10_000;
        private String replayTrackingKey = "m10:replay:processed";
        private long replayTrackingTtlSeconds = 86_400;
        private boolean archiveEnabled = true;
        private long archiveIntervalSeconds = 3600;

        public String getStreamKey() {
            return streamKey;
        }

        public void setStreamKey(String streamKey) {
            this.streamKey = streamKey;
        }

        public long getMaxLength() {
            return maxLength;
        }

        public void setMaxLength(long maxLength) {
            this.maxLength = maxLength;
        }

        public String getReplayTrackingKey() {
            return replayTrackingKey;
        }

        public void setReplayTrackingKey(String replayTrackingKey) {
            this.replayTrackingKey = replayTrackingKey;
        }

        public long getReplayTrackingTtlSeconds() {
            return replayTrackingTtlSeconds;
        }

        public void setReplayTrackingTtlSeconds(long replayTrackingTtlSeconds) {
            this.replayTrackingTtlSeconds = replayTrackingTtlSeconds;
        }

        public boolean isArchiveEnabled() {
            return archiveEnabled;
        }

        public void setArchiveEnabled(boolean archiveEnabled) {
            this.archiveEnabled = archiveEnabled;
        }

        public long getArchiveIntervalSeconds() {
            return archiveIntervalSeconds;
        }

        public void setArchiveIntervalSeconds(long archiveIntervalSeconds) {
            this.archiveIntervalSeconds = archiveIntervalSeconds;
        }
    }

    /**
     * Table names for the relational stores.
     */
    public static class Jdbc {
        private String lockTable = "distributed_locks";
        private String outboxTable = "outbox";
        private String replayLogTable = "replay_log";
        private String archiveTable = "dead_letter_archive";

        public String getLockTable() {
            return lockTable;
        }

        public void setLockTable(String lockTable) {
            this.lockTable = lockTable;
        }

        public String getOutboxTable() {
            return outboxTable;
        }

        public void setOutboxTable(String outboxTable) {
            this.outboxTable = outboxTable;
        }

        public String getReplayLogTable() {
            return replayLogTable;
        }

        public void setReplayLogTable(String replayLogTable) {
            this.replayLogTable = replayLogTable;
        }

        public String getArchiveTable() {
            return archiveTable;
        }

        public void setArchiveTable(String archiveTable) {
            this.archiveTable = archiveTable;
        }
    }

    public static class Outbox {
        private boolean enabled = true;

        /**
         * Identity recorded in {@code claimed_by}. Blank means a generated id.
         */
        private String processorId = "";
        private int batchSize = 10;
        private Duration claimTimeout = Duration.ofMinutes(5);
        private long baseDelayMs = 1000;
        private long maxDelayMs = 1_024_000;
        private long intervalMs = 1000;

        /**
         * Lock serializing processing across instances. Empty disables locking.
         */
        private String lockName = "outbox_processor";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getProcessorId() {
            return processorId;
        }

        public void setProcessorId(String processorId) {
            this.processorId = processorId;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getClaimTimeout() {
            return claimTimeout;
        }

        public void setClaimTimeout(Duration claimTimeout) {
            this.claimTimeout = claimTimeout;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public String getLockName() {
            return lockName;
        }

        public void setLockName(String lockName) {
            this.lockName = lockName;
        }
    }

    public static class Retention {
        private boolean enabled = true;
        private int deadLetterArchiveDays = 90;
        private int replayLogDays = 30;
        private int outboxDays = 7;
        private boolean dryRun = false;
        private int batchSize = 500;
        private long intervalSeconds = 86_400;
        private String lockName = "retention_cleanup";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getDeadLetterArchiveDays() {
            return deadLetterArchiveDays;
        }

        public void setDeadLetterArchiveDays(int deadLetterArchiveDays) {
            this.deadLetterArchiveDays = deadLetterArchiveDays;
        }

        public int getReplayLogDays() {
            return replayLogDays;
        }

        public void setReplayLogDays(int replayLogDays) {
            this.replayLogDays = replayLogDays;
        }

        public int getOutboxDays() {
            return outboxDays;
        }

        public void setOutboxDays(int outboxDays) {
            this.outboxDays = outboxDays;
        }

        public boolean isDryRun() {
            return dryRun;
        }

        public void setDryRun(boolean dryRun) {
            this.dryRun = dryRun;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }

        public String getLockName() {
            return lockName;
        }

        public void setLockName(String lockName) {
            this.lockName = lockName;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "recovery";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
