package io.dispatch4j.internal;

import io.dispatch4j.core.JobRecord;
import io.dispatch4j.spi.ExecutionQueue;
import io.dispatch4j.spi.JobStore;
import io.dispatch4j.spi.QueueEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Repairs jobs that were stored but never reached the execution queue.
 *
 * <p>A {@code PENDING} job older than the grace period whose dedup key is not live in
 * the queue is an orphan. Depending on {@link Mode} it is re-enqueued or failed.
 */
public class QueueReconciler {
    private static final Logger log = LoggerFactory.getLogger(QueueReconciler.class);

    public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofMinutes(5);
    public static final String MISSING_ENTRY_ERROR = "Execution queue entry missing";

    private static final int PAGE_SIZE = 100;

    public enum Mode {
        REENQUEUE,
        FAIL
    }

    private final JobStore jobStore;
    private final ExecutionQueue queue;
    private final Clock clock;
    private final Duration gracePeriod;
    private final Mode mode;

    public QueueReconciler(JobStore jobStore, ExecutionQueue queue, Clock clock) {
        this(jobStore, queue, clock, DEFAULT_GRACE_PERIOD, Mode.REENQUEUE);
    }

    public QueueReconciler(JobStore jobStore, ExecutionQueue queue, Clock clock, Duration gracePeriod, Mode mode) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.gracePeriod = Objects.requireNonNull(gracePeriod, "gracePeriod must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
        if (gracePeriod.isNegative()) {
            throw new IllegalArgumentException("gracePeriod must not be negative");
        }
    }

    public ReconcileResult reconcile() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(gracePeriod);
        int scanned = 0;
        int orphaned = 0;
        int reenqueued = 0;
        int failed = 0;

        String after = null;
        while (true) {
            List<JobRecord> page = jobStore.findPendingCreatedBefore(cutoff, after, PAGE_SIZE);
            for (JobRecord job : page) {
                scanned++;
                if (queue.isLive(job.id())) {
                    continue;
                }
                orphaned++;
                if (mode == Mode.REENQUEUE) {
                    reenqueue(job, now);
                    reenqueued++;
                } else if (jobStore.markFailed(job.id(), MISSING_ENTRY_ERROR, now).isPresent()) {
                    log.warn("dispatch orphan failed type={} id={}", job.type(), job.id());
                    failed++;
                }
            }
            if (page.size() < PAGE_SIZE) {
                break;
            }
            after = page.get(page.size() - 1).id();
        }

        if (orphaned > 0) {
            log.info("dispatch reconcile scanned={} orphaned={} reenqueued={} failed={}", scanned, orphaned, reenqueued, failed);
        } else {
            log.debug("dispatch reconcile scanned={} orphaned=0", scanned);
        }
        return new ReconcileResult(scanned, orphaned, reenqueued, failed);
    }

    private void reenqueue(JobRecord job, Instant now) {
        Instant readyAt = job.runAt().isAfter(now) ? job.runAt() : now;
        QueueEntry entry = new QueueEntry(job.id(), job.id(), job.tenantId(), job.type(), job.priority(), readyAt);
        if (!queue.enqueue(entry)) {
            // key is known but finished; revive it
            queue.release(job.id(), Duration.between(now, readyAt));
        }
        log.warn("dispatch orphan re-enqueued type={} id={}", job.type(), job.id());
    }
}
