package io.dispatch4j;

import io.dispatch4j.core.JobPage;
import io.dispatch4j.core.JobQuery;
import io.dispatch4j.core.JobRecord;

import java.util.Optional;

/**
 * Entry point for background work requests.
 *
 * <p>Typical usage:
 * <pre>{@code
 * JobRecord job = producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, payload)
 *         .parentId(brandId)
 *         .runAt(Instant.parse("2026-01-20T09:30:00Z"))
 *         .build());
 *
 * producer.cancelJob(job.id(), job.tenantId());
 * }</pre>
 */
public interface JobProducer {

    /**
     * Validate, check quota, persist, then enqueue.
     *
     * @throws PayloadValidationException payload does not match the type's schema
     * @throws QuotaExceededException     tenant is at one of its ceilings
     * @throws DispatchException          the record was stored but could not be enqueued
     */
    JobRecord enqueueJob(EnqueueRequest request);

    /**
     * Tenant-scoped lookup; a job owned by another tenant is reported as absent.
     */
    Optional<JobRecord> getJob(String jobId, String tenantId);

    JobPage listJobs(JobQuery query);

    /**
     * @throws JobNotFoundException     no such job for this tenant
     * @throws InvalidJobStateException the job is already terminal
     */
    JobRecord cancelJob(String jobId, String tenantId);

    /**
     * Creates a new HIGH priority job from a FAILED one. The failed record is kept as is.
     *
     * @throws JobNotFoundException     no such job for this tenant
     * @throws InvalidJobStateException the job is not FAILED
     */
    JobRecord retryJob(String jobId, String tenantId);
}
