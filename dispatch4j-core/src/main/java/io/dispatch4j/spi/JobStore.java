package io.dispatch4j.spi;

import io.dispatch4j.core.JobPage;
import io.dispatch4j.core.JobQuery;
import io.dispatch4j.core.JobRecord;
import io.dispatch4j.core.JobStatus;
import io.dispatch4j.core.NewJob;
import io.dispatch4j.core.PersistResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable source of truth for jobs. Records are never deleted.
 *
 * <p>Every {@code mark*} transition is conditional on the current status and returns
 * the updated record, or empty when the record is missing or in a status the
 * transition does not start from.
 */
public interface JobStore {

    /**
     * Inserts a {@code PENDING} job. When the tenant already holds a job with the same
     * dedup key it is returned unchanged with {@code created == false}. Dedup keys of
     * different tenants never collide.
     */
    PersistResult create(NewJob job);

    /**
     * Tenant-scoped lookup by dedup key.
     */
    Optional<JobRecord> findByDedupKey(String tenantId, String dedupKey);

    /**
     * Unscoped lookup for the runner and the reconciler.
     */
    Optional<JobRecord> findById(String id);

    /**
     * Tenant-scoped lookup; a job owned by another tenant is reported as absent.
     */
    Optional<JobRecord> findById(String id, String tenantId);

    /**
     * Newest first (strictly decreasing id), cursor exclusive.
     */
    JobPage list(JobQuery query);

    long countByStatus(String tenantId, Set<JobStatus> statuses);

    /** {@code PENDING -> RUNNING}, attempts + 1. */
    Optional<JobRecord> markRunning(String id, Instant startedAt);

    /** {@code RUNNING -> COMPLETED}. */
    Optional<JobRecord> markCompleted(String id, Map<String, Object> result, Instant completedAt);

    /** {@code PENDING|RUNNING -> FAILED}. */
    Optional<JobRecord> markFailed(String id, String error, Instant failedAt);

    /** {@code RUNNING -> PENDING}, attempts kept. */
    Optional<JobRecord> markPendingForRetry(String id, String error, Instant runAt, Instant now);

    /** {@code PENDING|RUNNING -> CANCELLED}. */
    Optional<JobRecord> markCancelled(String id, Instant cancelledAt);

    /**
     * {@code PENDING} jobs created before {@code createdBefore}, ordered by id ascending,
     * starting strictly after {@code afterId} when it is not null.
     */
    List<JobRecord> findPendingCreatedBefore(Instant createdBefore, String afterId, int limit);
}
