package io.dispatch4j.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dispatch4j.JobHandler;
import io.dispatch4j.NonRetryableJobException;
import io.dispatch4j.PayloadValidationException;
import io.dispatch4j.core.JobHandlerRegistry;
import io.dispatch4j.core.JobRecord;
import io.dispatch4j.core.JobStatus;
import io.dispatch4j.payload.JobPayload;
import io.dispatch4j.payload.PayloadValidator;
import io.dispatch4j.spi.ExecutionQueue;
import io.dispatch4j.spi.JobStore;
import io.dispatch4j.spi.QueueEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Consumes the {@link ExecutionQueue} and drives jobs through
 * {@code PENDING -> RUNNING -> COMPLETED | FAILED}.
 *
 * <p>A poller thread claims ready entries in batches and hands them to a fixed worker
 * pool; a semaphore keeps claims within the pool's free capacity. A failed run is
 * retried on the same record after 1, 5 and then 15 minutes while attempts remain.
 *
 * <p>Cancellation is cooperative: a run in progress is not interrupted, and entries
 * whose job is no longer {@code PENDING} are completed without running.
 */
public class JobRunner {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    static final List<Duration> RETRY_DELAYS = List.of(
            Duration.ofMinutes(1),
            Duration.ofMinutes(5),
            Duration.ofMinutes(15)
    );

    private static final int MAX_CONSECUTIVE_POLL_FAILURES = 30;

    private final JobStore jobStore;
    private final ExecutionQueue queue;
    private final JobHandlerRegistry handlers;
    private final PayloadValidator validator;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final JobRunnerOptions options;
    private final String workerId;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Semaphore workerPermits;
    private final Semaphore refillSignal = new Semaphore(0);
    private final AtomicInteger workerSeq = new AtomicInteger();

    private ExecutorService workerPool;
    private Thread pollerThread;
    private int pollFailures = 0;

    public JobRunner(JobStore jobStore,
                     ExecutionQueue queue,
                     JobHandlerRegistry handlers,
                     PayloadValidator validator,
                     ObjectMapper objectMapper,
                     Clock clock,
                     JobRunnerOptions options) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.handlers = Objects.requireNonNull(handlers, "handlers must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.workerPermits = new Semaphore(options.maxConcurrency());
        this.workerId = resolveWorkerId(options.workerId());
    }

    /**
     * Start polling and executing. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("Job runner starting with processEvery={}, leaseLifetime={}, workerId={}, maxConcurrency={}, batchSize={}",
                options.processEvery(),
                options.leaseLifetime(),
                workerId,
                options.maxConcurrency(),
                options.batchSize());

        workerPool = Executors.newFixedThreadPool(options.maxConcurrency(), r -> {
            Thread t = new Thread(r);
            t.setName("dispatch.worker-" + workerSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("dispatch.poller");
        pollerThread.setDaemon(true);
        pollerThread.start();
        log.info("Job runner started.");
    }

    /**
     * Stop polling and wait up to one lease lifetime for running jobs. Idempotent.
     */
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Job runner stopping...");

        if (pollerThread != null) {
            pollerThread.interrupt();
            pollerThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(options.leaseLifetime().toSeconds(), TimeUnit.SECONDS)) {
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        refillSignal.drainPermits();
        log.info("Job runner stopped.");
    }

    public boolean isRunning() {
        return started.get();
    }

    public String workerId() {
        return workerId;
    }

    /**
     * Runs one claimed entry to its next state. Invoked by the worker pool; exposed so
     * a caller can drive the runner synchronously.
     */
    public void process(QueueEntry entry) {
        Optional<JobRecord> loaded = jobStore.findById(entry.jobId());
        if (loaded.isEmpty()) {
            log.warn("dispatch queue entry has no job; dropping key={} id={}", entry.key(), entry.jobId());
            queue.complete(entry.key());
            return;
        }

        JobRecord job = loaded.get();
        if (job.status() == JobStatus.RUNNING) {
            // lease expired under a previous worker; count that run as a failed attempt
            handleFailure(job, entry, new IllegalStateException("Worker lease expired while running"));
            return;
        }
        if (job.status() != JobStatus.PENDING) {
            log.debug("dispatch job skipped type={} id={} status={}", job.type(), job.id(), job.status());
            queue.complete(entry.key());
            return;
        }
        if (!job.hasAttemptsLeft()) {
            fail(job, entry, "Max attempts exceeded (" + job.attempts() + "/" + job.maxAttempts() + ")");
            return;
        }

        Optional<JobRecord> claimed = jobStore.markRunning(job.id(), clock.instant());
        if (claimed.isEmpty()) {
            log.debug("dispatch job changed state before start; skipping id={}", job.id());
            queue.complete(entry.key());
            return;
        }

        JobRecord running = claimed.get();
        log.debug("dispatch job started type={} id={} attempt={}/{}",
                running.type(), running.id(), running.attempts(), running.maxAttempts());
        try {
            JobHandler<?> handler = handlers.find(running.type())
                    .orElseThrow(() -> new NonRetryableJobException("No JobHandler registered for type: " + running.type()));
            Object result = invoke(handler, running);

            jobStore.markCompleted(running.id(), toResultMap(result), clock.instant());
            queue.complete(entry.key());
            log.debug("dispatch job succeeded type={} id={}", running.type(), running.id());
        } catch (Exception e) {
            handleFailure(running, entry, e);
        }
    }

    private <P extends JobPayload> Object invoke(JobHandler<P> handler, JobRecord job) throws Exception {
        JobPayload payload = validator.validate(job.type(), job.payload());
        return handler.execute(job, handler.payloadClass().cast(payload));
    }

    private void handleFailure(JobRecord job, QueueEntry entry, Exception e) {
        String error = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
        boolean retryable = !(e instanceof NonRetryableJobException) && !(e instanceof PayloadValidationException);

        if (!retryable || !job.hasAttemptsLeft()) {
            log.error("dispatch job failed type={} id={} attempts={}/{} msg={}",
                    job.type(), job.id(), job.attempts(), job.maxAttempts(), error, e);
            fail(job, entry, error);
            return;
        }

        Duration delay = retryDelay(job.attempts());
        log.warn("dispatch job failed; retrying type={} id={} attempts={}/{} retryIn={} msg={}",
                job.type(), job.id(), job.attempts(), job.maxAttempts(), delay, error);
        try {
            Instant now = clock.instant();
            if (jobStore.markPendingForRetry(job.id(), error, now.plus(delay), now).isPresent()) {
                queue.release(entry.key(), delay);
            } else {
                queue.complete(entry.key());
            }
        } catch (Exception storeEx) {
            log.error("dispatch retry bookkeeping failed id={} msg={}", job.id(), storeEx.getMessage(), storeEx);
        }
    }

    private void fail(JobRecord job, QueueEntry entry, String error) {
        try {
            jobStore.markFailed(job.id(), error, clock.instant());
            queue.complete(entry.key());
        } catch (Exception storeEx) {
            log.error("dispatch markFailed failed id={} msg={}", job.id(), storeEx.getMessage(), storeEx);
        }
    }

    private Map<String, Object> toResultMap(Object result) {
        if (result == null) {
            return null;
        }
        try {
            return objectMapper.convertValue(result, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            return Map.of("value", result);
        }
    }

    /**
     * Delay before the next run after {@code attempts} failed runs; the last delay
     * repeats once the table is exhausted.
     */
    static Duration retryDelay(int attempts) {
        int idx = Math.max(0, Math.min(attempts, RETRY_DELAYS.size()) - 1);
        return RETRY_DELAYS.get(idx);
    }

    private void pollerLoop() {
        while (started.get()) {
            boolean backlog;
            try {
                backlog = pollOnce();
                pollFailures = 0;
            } catch (Exception e) {
                pollFailures++;
                log.error("dispatch pollOnce failed msg={}", e.getMessage(), e);
                if (pollFailures >= MAX_CONSECUTIVE_POLL_FAILURES) {
                    log.error("Job runner stopped due to repeated poll failures count={}", pollFailures);
                    stop();
                    break;
                }
                if (!sleep(backoff(pollFailures))) {
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            if (backlog) {
                try {
                    refillSignal.tryAcquire(200, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!sleep(options.processEvery())) {
                break;
            }
        }
    }

    private boolean pollOnce() {
        int free = workerPermits.availablePermits();
        if (free == 0) {
            return true;
        }
        int take = Math.min(options.batchSize(), free);
        List<QueueEntry> entries = queue.claim(workerId, take, options.leaseLifetime());
        log.debug("dispatch polled entries count={} free={}", entries.size(), free);
        for (QueueEntry entry : entries) {
            submitToWorker(entry);
        }
        return entries.size() == take;
    }

    private void submitToWorker(QueueEntry entry) {
        workerPermits.acquireUninterruptibly();
        try {
            workerPool.submit(() -> {
                try {
                    process(entry);
                } catch (Exception e) {
                    log.error("dispatch worker failed key={} id={} msg={}", entry.key(), entry.jobId(), e.getMessage(), e);
                } finally {
                    workerPermits.release();
                    refillSignal.release();
                }
            });
        } catch (RuntimeException e) {
            workerPermits.release();
            throw e;
        }
    }

    // Exponential backoff for repeated poll failures: 1s doubling, capped at 60s.
    static Duration backoff(int failures) {
        int exp = Math.max(0, Math.min(failures - 1, 15));
        return Duration.ofMillis(Math.min(1000L * (1L << exp), 60_000L));
    }

    private static boolean sleep(Duration d) {
        try {
            Thread.sleep(d.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String resolveWorkerId(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }

        String host = "dispatch4j";
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("host name unavailable for worker id msg={}", e.getMessage());
        }

        String pid = String.valueOf(ManagementFactory.getRuntimeMXBean().getPid());
        String generated = host + "-" + pid + "-" + UUID.randomUUID();
        return generated.length() > 128 ? generated.substring(0, 128) : generated;
    }
}
