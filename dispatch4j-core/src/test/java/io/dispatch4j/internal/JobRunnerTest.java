package io.dispatch4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dispatch4j.EnqueueRequest;
import io.dispatch4j.JobHandler;
import io.dispatch4j.NonRetryableJobException;
import io.dispatch4j.core.JobHandlerRegistry;
import io.dispatch4j.core.JobRecord;
import io.dispatch4j.core.JobStatus;
import io.dispatch4j.core.JobType;
import io.dispatch4j.payload.ContextScrapingPayload;
import io.dispatch4j.payload.PayloadValidator;
import io.dispatch4j.ratelimit.InMemoryRateLimiter;
import io.dispatch4j.spi.QueueEntry;
import io.dispatch4j.testing.InMemoryJobStore;
import io.dispatch4j.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobRunnerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final Duration LEASE = Duration.ofMinutes(10);

    private final MutableClock clock = new MutableClock(NOW);
    private final InMemoryJobStore store = new InMemoryJobStore(clock);
    private final LocalExecutionQueue queue = new LocalExecutionQueue(clock);
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PayloadValidator validator = new PayloadValidator(objectMapper);
    private final DefaultJobProducer producer = new DefaultJobProducer(store, queue, validator,
            new InMemoryRateLimiter(clock), parentId -> Optional.empty(), clock);

    private final AtomicInteger calls = new AtomicInteger();

    private interface Behaviour {
        Object run(ContextScrapingPayload payload) throws Exception;
    }

    private JobRunner runner(Behaviour behaviour) {
        JobHandler<ContextScrapingPayload> handler = new JobHandler<>() {
            @Override
            public JobType type() {
                return JobType.SYNC_RSS;
            }

            @Override
            public Class<ContextScrapingPayload> payloadClass() {
                return ContextScrapingPayload.class;
            }

            @Override
            public Object execute(JobRecord job, ContextScrapingPayload payload) throws Exception {
                calls.incrementAndGet();
                return behaviour.run(payload);
            }
        };
        JobRunnerOptions options = new JobRunnerOptions("worker-1", Duration.ofMillis(20), 5, 2, LEASE);
        return new JobRunner(store, queue, new JobHandlerRegistry(List.of(handler)), validator, objectMapper, clock, options);
    }

    private JobRecord enqueueRss() {
        return producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, Map.of(
                "contextSourceId", "src-1",
                "brandId", "brand-1",
                "url", "https://example.com/feed.xml",
                "sourceType", "RSS"
        )).tenantId("org-1").build());
    }

    private int drain(JobRunner runner) {
        List<QueueEntry> entries = queue.claim(runner.workerId(), 10, LEASE);
        entries.forEach(runner::process);
        return entries.size();
    }

    private JobRecord reload(JobRecord job) {
        return store.findById(job.id()).orElseThrow();
    }

    @Test
    void successfulRunShouldCompleteWithResult() {
        JobRunner runner = runner(payload -> Map.of("items", 3, "source", payload.contextSourceId()));
        JobRecord job = enqueueRss();

        assertEquals(1, drain(runner));

        JobRecord done = reload(job);
        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals(1, done.attempts());
        assertEquals(NOW, done.startedAt());
        assertEquals(NOW, done.completedAt());
        assertEquals(Map.of("items", 3, "source", "src-1"), done.result());
        assertFalse(queue.isLive(job.id()));
    }

    @Test
    void scalarResultShouldBeWrapped() {
        JobRunner runner = runner(payload -> "ok");
        JobRecord job = enqueueRss();

        drain(runner);

        assertEquals(Map.of("value", "ok"), reload(job).result());
    }

    @Test
    void failedRunShouldBeRetriedOnSameRecordWithWideningDelay() {
        JobRunner runner = runner(payload -> {
            throw new IllegalStateException("feed unreachable");
        });
        JobRecord job = enqueueRss();

        drain(runner);
        JobRecord afterFirst = reload(job);
        assertEquals(JobStatus.PENDING, afterFirst.status());
        assertEquals(1, afterFirst.attempts());
        assertEquals("feed unreachable", afterFirst.error());
        assertEquals(NOW.plus(Duration.ofMinutes(1)), afterFirst.runAt());
        assertEquals(0, drain(runner));

        clock.advance(Duration.ofMinutes(1));
        assertEquals(1, drain(runner));
        JobRecord afterSecond = reload(job);
        assertEquals(2, afterSecond.attempts());
        assertEquals(clock.instant().plus(Duration.ofMinutes(5)), afterSecond.runAt());

        clock.advance(Duration.ofMinutes(5));
        assertEquals(1, drain(runner));
        JobRecord failed = reload(job);
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals(3, failed.attempts());
        assertEquals("feed unreachable", failed.error());
        assertEquals(3, calls.get());
        assertFalse(queue.isLive(job.id()));
    }

    @Test
    void nonRetryableFailureShouldFailImmediately() {
        JobRunner runner = runner(payload -> {
            throw new NonRetryableJobException("Context source not found");
        });
        JobRecord job = enqueueRss();

        drain(runner);

        JobRecord failed = reload(job);
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals(1, failed.attempts());
        assertEquals("Context source not found", failed.error());
    }

    @Test
    void missingHandlerShouldFailWithoutRetry() {
        JobRunner runner = new JobRunner(store, queue, new JobHandlerRegistry(List.of()), validator, objectMapper,
                clock, JobRunnerOptions.defaults());
        JobRecord job = enqueueRss();

        drain(runner);

        JobRecord failed = reload(job);
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals("No JobHandler registered for type: SYNC_RSS", failed.error());
    }

    @Test
    void cancelledJobShouldBeSkipped() {
        JobRunner runner = runner(payload -> null);
        JobRecord job = enqueueRss();
        List<QueueEntry> claimed = queue.claim("worker-1", 10, LEASE);
        store.markCancelled(job.id(), NOW);

        claimed.forEach(runner::process);

        assertEquals(0, calls.get());
        assertEquals(JobStatus.CANCELLED, reload(job).status());
        assertFalse(queue.isLive(job.id()));
    }

    @Test
    void runningJobWithExpiredLeaseShouldCountAsFailedAttempt() {
        JobRunner runner = runner(payload -> null);
        JobRecord job = enqueueRss();
        queue.claim("crashed-worker", 10, LEASE);
        store.markRunning(job.id(), NOW);

        clock.advance(LEASE);
        assertEquals(1, drain(runner));

        JobRecord retried = reload(job);
        assertEquals(JobStatus.PENDING, retried.status());
        assertEquals(1, retried.attempts());
        assertEquals("Worker lease expired while running", retried.error());
        assertEquals(0, calls.get());
    }

    @Test
    void retryDelayShouldRepeatLastStep() {
        assertEquals(Duration.ofMinutes(1), JobRunner.retryDelay(1));
        assertEquals(Duration.ofMinutes(5), JobRunner.retryDelay(2));
        assertEquals(Duration.ofMinutes(15), JobRunner.retryDelay(3));
        assertEquals(Duration.ofMinutes(15), JobRunner.retryDelay(7));
    }

    @Test
    void pollBackoffShouldDoubleUpToOneMinute() {
        assertEquals(Duration.ofSeconds(1), JobRunner.backoff(1));
        assertEquals(Duration.ofSeconds(2), JobRunner.backoff(2));
        assertEquals(Duration.ofSeconds(32), JobRunner.backoff(6));
        assertEquals(Duration.ofSeconds(60), JobRunner.backoff(12));
    }

    @Test
    void startedRunnerShouldProcessQueuedJobs() throws InterruptedException {
        JobRunner runner = runner(payload -> Map.of("items", 1));
        JobRecord first = enqueueRss();
        JobRecord second = enqueueRss();

        runner.start();
        runner.start();
        try {
            assertTrue(runner.isRunning());
            waitUntil(() -> reload(first).status() == JobStatus.COMPLETED
                    && reload(second).status() == JobStatus.COMPLETED, Duration.ofSeconds(5));
        } finally {
            runner.stop();
            runner.stop();
        }

        assertFalse(runner.isRunning());
        assertEquals(2, calls.get());
    }

    private static void waitUntil(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within " + timeout);
            }
            Thread.sleep(20);
        }
    }
}
