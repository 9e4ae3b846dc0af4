package io.dispatch4j.internal;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning of {@link JobRunner}.
 *
 * @param workerId       lease owner name; blank means host-pid-uuid
 * @param processEvery   idle sleep between queue polls
 * @param batchSize      max entries claimed per poll
 * @param maxConcurrency worker pool size
 * @param leaseLifetime  how long a claimed entry stays with this worker
 */
public record JobRunnerOptions(
        String workerId,
        Duration processEvery,
        int batchSize,
        int maxConcurrency,
        Duration leaseLifetime
) {
    public JobRunnerOptions {
        Objects.requireNonNull(processEvery, "processEvery must not be null");
        Objects.requireNonNull(leaseLifetime, "leaseLifetime must not be null");
        if (processEvery.isZero() || processEvery.isNegative()) {
            throw new IllegalArgumentException("processEvery must be a positive duration");
        }
        if (leaseLifetime.isZero() || leaseLifetime.isNegative()) {
            throw new IllegalArgumentException("leaseLifetime must be a positive duration");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be a positive number");
        }
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("maxConcurrency must be a positive number");
        }
    }

    public static JobRunnerOptions defaults() {
        return new JobRunnerOptions(null, Duration.ofSeconds(5), 5, 10, Duration.ofMinutes(10));
    }
}
