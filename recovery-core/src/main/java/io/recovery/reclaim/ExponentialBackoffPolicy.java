package io.recovery.reclaim;

import java.time.Duration;
import java.util.Objects;

/**
 * Doubling backoff: {@code delay(n) = min(max, base * 2^(n-1))} for {@code n >= 1}.
 *
 * <p>No jitter is applied. The reclaim scheduler compares the delay against a
 * message's idle time, which already spreads retries across workers.
 */
public final class ExponentialBackoffPolicy implements BackoffPolicy {
    private final long baseMillis;
    private final long maxMillis;

    public ExponentialBackoffPolicy(Duration base, Duration max) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(max, "max");
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base must be > 0");
        }
        if (max.compareTo(base) < 0) {
            throw new IllegalArgumentException("max must be >= base");
        }
        this.baseMillis = base.toMillis();
        this.maxMillis = max.toMillis();
    }

    /** Reclaim defaults: 60 seconds doubling up to 24 hours. */
    public static ExponentialBackoffPolicy reclaimDefaults() {
        return new ExponentialBackoffPolicy(Duration.ofMinutes(1), Duration.ofHours(24));
    }

    /** Outbox defaults: 1 second doubling up to 1024 seconds. */
    public static ExponentialBackoffPolicy outboxDefaults() {
        return new ExponentialBackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1024));
    }

    @Override
    public Duration delay(int attempt) {
        if (attempt <= 0) {
            return Duration.ZERO;
        }
        int shift = attempt - 1;
        if (shift >= Long.SIZE - 2 || baseMillis > (maxMillis >> shift)) {
            return Duration.ofMillis(maxMillis);
        }
        return Duration.ofMillis(Math.min(maxMillis, baseMillis << shift));
    }

    public Duration base() {
        return Duration.ofMillis(baseMillis);
    }

    public Duration max() {
        return Duration.ofMillis(maxMillis);
    }

    @Override
    public String toString() {
        return "ExponentialBackoffPolicy[base=" + baseMillis + "ms, max=" + maxMillis + "ms]";
    }
}
