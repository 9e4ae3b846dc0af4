package io.dispatch4j.spi;

import io.dispatch4j.core.JobType;
import io.dispatch4j.core.Priority;

import java.time.Instant;
import java.util.Objects;

/**
 * A unit of work in the {@link ExecutionQueue}. {@code key} is the job's store id.
 */
public record QueueEntry(
        String key,
        String jobId,
        String tenantId,
        JobType type,
        Priority priority,
        Instant readyAt
) {
    public QueueEntry {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
        Objects.requireNonNull(readyAt, "readyAt must not be null");
    }
}
