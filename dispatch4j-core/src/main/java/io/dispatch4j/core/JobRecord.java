package io.dispatch4j.core;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable snapshot of a persisted job.
 *
 * <p>A retry never mutates a {@code FAILED} record; it creates a new record whose
 * {@code retriedFrom} points at the failed one.
 */
public record JobRecord(

        // identity
        String id,
        String dedupKey,
        JobType type,
        String tenantId,
        String parentId,

        // payload
        Map<String, Object> payload,

        // lifecycle
        JobStatus status,
        Priority priority,
        int attempts,
        int maxAttempts,
        Instant runAt,
        Instant startedAt,
        Instant completedAt,
        String error,
        Map<String, Object> result,

        // history
        String retriedFrom,
        Instant createdAt,
        Instant updatedAt
) {

    public boolean hasAttemptsLeft() {
        return attempts < maxAttempts;
    }
}
