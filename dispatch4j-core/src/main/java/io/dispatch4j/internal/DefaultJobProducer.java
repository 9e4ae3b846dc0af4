package io.dispatch4j.internal;

import io.dispatch4j.DispatchException;
import io.dispatch4j.EnqueueRequest;
import io.dispatch4j.InvalidJobStateException;
import io.dispatch4j.JobNotFoundException;
import io.dispatch4j.JobProducer;
import io.dispatch4j.PayloadValidationException;
import io.dispatch4j.QuotaExceededException;
import io.dispatch4j.core.JobPage;
import io.dispatch4j.core.JobQuery;
import io.dispatch4j.core.JobRecord;
import io.dispatch4j.core.JobStatus;
import io.dispatch4j.core.NewJob;
import io.dispatch4j.core.PersistResult;
import io.dispatch4j.core.Priority;
import io.dispatch4j.payload.FieldIssue;
import io.dispatch4j.payload.PayloadValidator;
import io.dispatch4j.ratelimit.RateLimitScope;
import io.dispatch4j.ratelimit.RateLimiter;
import io.dispatch4j.spi.ExecutionQueue;
import io.dispatch4j.spi.JobStore;
import io.dispatch4j.spi.QueueEntry;
import io.dispatch4j.spi.TenantResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link JobProducer} that writes the job to the store before handing it to the
 * execution queue, keyed by the store id.
 *
 * <p>An explicit {@code jobId} is a dedup key scoped to the resolved tenant: a repeated
 * submission returns the tenant's existing record without touching the quotas.
 *
 * <p>If the enqueue fails after the write, the {@code PENDING} record is left behind
 * and {@link QueueReconciler} picks it up.
 */
public class DefaultJobProducer implements JobProducer {
    private static final Logger log = LoggerFactory.getLogger(DefaultJobProducer.class);

    public static final int DEFAULT_MAX_ACTIVE_JOBS = 50;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private final JobStore jobStore;
    private final ExecutionQueue queue;
    private final PayloadValidator validator;
    private final RateLimiter rateLimiter;
    private final TenantResolver tenantResolver;
    private final Clock clock;
    private final int maxActiveJobs;
    private final int maxAttempts;

    public DefaultJobProducer(JobStore jobStore,
                              ExecutionQueue queue,
                              PayloadValidator validator,
                              RateLimiter rateLimiter,
                              TenantResolver tenantResolver,
                              Clock clock) {
        this(jobStore, queue, validator, rateLimiter, tenantResolver, clock, DEFAULT_MAX_ACTIVE_JOBS, DEFAULT_MAX_ATTEMPTS);
    }

    public DefaultJobProducer(JobStore jobStore,
                              ExecutionQueue queue,
                              PayloadValidator validator,
                              RateLimiter rateLimiter,
                              TenantResolver tenantResolver,
                              Clock clock,
                              int maxActiveJobs,
                              int maxAttempts) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
        this.tenantResolver = Objects.requireNonNull(tenantResolver, "tenantResolver must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (maxActiveJobs <= 0) {
            throw new IllegalArgumentException("maxActiveJobs must be a positive number");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be a positive number");
        }
        this.maxActiveJobs = maxActiveJobs;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public JobRecord enqueueJob(EnqueueRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        String tenantId = resolveTenant(request);
        Map<String, Object> payload = validator.normalize(request.type(), request.payload());
        if (request.jobId() != null) {
            // a re-submission creates nothing, so it is not charged against the quotas
            Optional<JobRecord> existing = jobStore.findByDedupKey(tenantId, request.jobId());
            if (existing.isPresent()) {
                log.debug("dispatch job already exists type={} id={} key={}",
                        existing.get().type(), existing.get().id(), request.jobId());
                return existing.get();
            }
        }
        checkQuota(tenantId);

        Instant now = clock.instant();
        Instant runAt = request.runAt() != null ? request.runAt() : now;
        Priority priority = request.priority() != null ? request.priority() : Priority.NORMAL;

        PersistResult persisted = jobStore.create(new NewJob(
                request.jobId(),
                request.type(),
                tenantId,
                request.parentId(),
                payload,
                priority,
                maxAttempts,
                runAt,
                request.retriedFrom()
        ));
        JobRecord job = persisted.job();
        if (!tenantId.equals(job.tenantId())) {
            throw new DispatchException("Job store returned job " + job.id() + " of another tenant for key " + request.jobId());
        }
        if (!persisted.created()) {
            log.debug("dispatch job already exists type={} id={} key={}", job.type(), job.id(), job.dedupKey());
            return job;
        }

        enqueue(job, now);
        log.debug("dispatch job enqueued type={} id={} tenant={} priority={} runAt={}",
                job.type(), job.id(), tenantId, priority, runAt);
        return job;
    }

    @Override
    public Optional<JobRecord> getJob(String jobId, String tenantId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        return jobStore.findById(jobId, tenantId);
    }

    @Override
    public JobPage listJobs(JobQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        return jobStore.list(query);
    }

    @Override
    public JobRecord cancelJob(String jobId, String tenantId) {
        JobRecord job = getJob(jobId, tenantId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (job.status().isTerminal()) {
            throw new InvalidJobStateException(jobId, job.status(), "cancel");
        }

        JobRecord cancelled = jobStore.markCancelled(jobId, clock.instant())
                .orElseThrow(() -> new InvalidJobStateException(jobId, currentStatus(jobId, tenantId), "cancel"));

        try {
            boolean removed = queue.cancel(job.id());
            log.debug("dispatch job cancelled id={} queueEntryRemoved={}", jobId, removed);
        } catch (RuntimeException e) {
            log.warn("dispatch queue cancel failed; runner will skip the job id={} msg={}",
                    jobId, e.getMessage(), e);
        }
        return cancelled;
    }

    @Override
    public JobRecord retryJob(String jobId, String tenantId) {
        JobRecord failed = getJob(jobId, tenantId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (failed.status() != JobStatus.FAILED) {
            throw new InvalidJobStateException(jobId, failed.status(), "retry");
        }

        JobRecord retry = enqueueJob(EnqueueRequest.builder(failed.type(), failed.payload())
                .tenantId(failed.tenantId())
                .parentId(failed.parentId())
                .priority(Priority.HIGH)
                .retriedFrom(failed.id())
                .build());
        log.info("dispatch job retried type={} failedId={} newId={}", failed.type(), failed.id(), retry.id());
        return retry;
    }

    private String resolveTenant(EnqueueRequest request) {
        if (request.parentId() != null) {
            Optional<String> owner = tenantResolver.ownerOf(request.parentId());
            if (owner.isPresent()) {
                if (request.tenantId() != null && !request.tenantId().equals(owner.get())) {
                    throw new PayloadValidationException(request.type(),
                            List.of(new FieldIssue("tenantId", "does not own parent " + request.parentId())));
                }
                return owner.get();
            }
        }
        if (request.tenantId() != null) {
            return request.tenantId();
        }
        throw new IllegalArgumentException("tenantId or a resolvable parentId is required");
    }

    private void checkQuota(String tenantId) {
        long active = jobStore.countByStatus(tenantId, JobStatus.ACTIVE);
        if (active >= maxActiveJobs) {
            throw new QuotaExceededException(tenantId, QuotaExceededException.Quota.ACTIVE_JOBS,
                    (int) active, maxActiveJobs);
        }

        RateLimitScope scope = RateLimitScope.jobDispatch();
        if (!rateLimiter.admit(tenantId, scope)) {
            throw new QuotaExceededException(tenantId, QuotaExceededException.Quota.DISPATCH_WINDOW,
                    rateLimiter.currentCount(tenantId, scope), rateLimiter.limitFor(scope));
        }
    }

    private void enqueue(JobRecord job, Instant now) {
        Instant readyAt = job.runAt().isAfter(now) ? job.runAt() : now;
        QueueEntry entry = new QueueEntry(job.id(), job.id(), job.tenantId(), job.type(), job.priority(), readyAt);
        try {
            if (!queue.enqueue(entry)) {
                log.warn("dispatch queue already knows job; not enqueued again id={}", job.id());
            }
        } catch (RuntimeException e) {
            log.error("dispatch enqueue failed; job stored without queue entry id={} msg={}",
                    job.id(), e.getMessage(), e);
            throw new DispatchException("Job " + job.id() + " was stored but could not be enqueued", e);
        }
    }

    private JobStatus currentStatus(String jobId, String tenantId) {
        return jobStore.findById(jobId, tenantId).map(JobRecord::status).orElse(null);
    }
}
