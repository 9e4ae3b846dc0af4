package io.dispatch4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dispatch4j.DispatchException;
import io.dispatch4j.EnqueueRequest;
import io.dispatch4j.InvalidJobStateException;
import io.dispatch4j.JobNotFoundException;
import io.dispatch4j.PayloadValidationException;
import io.dispatch4j.QuotaExceededException;
import io.dispatch4j.core.JobPage;
import io.dispatch4j.core.JobQuery;
import io.dispatch4j.core.JobRecord;
import io.dispatch4j.core.JobStatus;
import io.dispatch4j.core.JobType;
import io.dispatch4j.core.Priority;
import io.dispatch4j.payload.PayloadValidator;
import io.dispatch4j.ratelimit.InMemoryRateLimiter;
import io.dispatch4j.ratelimit.RateLimitScope;
import io.dispatch4j.spi.ExecutionQueue;
import io.dispatch4j.spi.QueueEntry;
import io.dispatch4j.spi.TenantResolver;
import io.dispatch4j.testing.InMemoryJobStore;
import io.dispatch4j.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DefaultJobProducerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final InMemoryJobStore store = new InMemoryJobStore(clock);
    private final LocalExecutionQueue queue = new LocalExecutionQueue(clock);
    private final PayloadValidator validator = new PayloadValidator(new ObjectMapper());
    private final TenantResolver brands = parentId -> Map.of("brand-1", "org-1", "brand-2", "org-2")
            .entrySet().stream().filter(e -> e.getKey().equals(parentId)).map(Map.Entry::getValue).findFirst();

    private DefaultJobProducer producer(ExecutionQueue q, InMemoryRateLimiter limiter, int maxActive) {
        return new DefaultJobProducer(store, q, validator, limiter, brands, clock, maxActive, 3);
    }

    private DefaultJobProducer producer() {
        return producer(queue, new InMemoryRateLimiter(clock), 50);
    }

    private static Map<String, Object> rssPayload() {
        return Map.of(
                "contextSourceId", "src-1",
                "brandId", "brand-1",
                "url", "https://example.com/feed.xml",
                "sourceType", "RSS"
        );
    }

    @Test
    void enqueueShouldPersistPendingJobAndQueueIt() {
        JobRecord job = producer().enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload())
                .tenantId("org-1")
                .build());

        assertEquals(JobStatus.PENDING, job.status());
        assertEquals(Priority.NORMAL, job.priority());
        assertEquals(0, job.attempts());
        assertEquals(3, job.maxAttempts());
        assertEquals(NOW, job.runAt());
        assertEquals(job.id(), job.dedupKey());
        assertTrue(queue.isLive(job.id()));

        List<QueueEntry> claimed = queue.claim("w", 10, Duration.ofMinutes(1));
        assertEquals(1, claimed.size());
        assertEquals(job.id(), claimed.get(0).jobId());
    }

    @Test
    void futureRunAtShouldDelayQueueEntry() {
        Instant runAt = NOW.plus(Duration.ofMinutes(10));
        producer().enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload())
                .tenantId("org-1")
                .runAt(runAt)
                .build());

        assertTrue(queue.claim("w", 10, Duration.ofMinutes(1)).isEmpty());
        clock.advance(Duration.ofMinutes(10));
        assertEquals(1, queue.claim("w", 10, Duration.ofMinutes(1)).size());
    }

    @Test
    void invalidPayloadShouldHaveNoSideEffects() {
        assertThrows(PayloadValidationException.class, () -> producer().enqueueJob(
                EnqueueRequest.builder(JobType.SYNC_RSS, Map.of("url", "nope")).tenantId("org-1").build()));

        assertTrue(store.all().isEmpty());
        assertEquals(0, queue.liveCount());
    }

    @Test
    void activeJobCeilingShouldRejectWithoutWriting() {
        DefaultJobProducer producer = producer(queue, new InMemoryRateLimiter(clock), 2);
        producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build());
        producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build());

        QuotaExceededException ex = assertThrows(QuotaExceededException.class, () -> producer.enqueueJob(
                EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build()));

        assertEquals(QuotaExceededException.Quota.ACTIVE_JOBS, ex.quota());
        assertEquals("org-1", ex.tenantId());
        assertEquals(2, ex.current());
        assertEquals(2, ex.limit());
        assertEquals(2, store.all().size());

        // other tenants are unaffected
        producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-2").build());
    }

    @Test
    void activeJobCeilingShouldFreeSlotOnceJobLeavesActiveState() {
        DefaultJobProducer producer = producer(queue, new InMemoryRateLimiter(clock), 2);
        JobRecord first = producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build());
        JobRecord second = producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build());
        store.markRunning(first.id(), NOW);
        assertThrows(QuotaExceededException.class, () -> producer.enqueueJob(
                EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build()));

        store.markCompleted(first.id(), Map.of(), NOW);
        JobRecord third = producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build());
        assertEquals(JobStatus.PENDING, third.status());

        assertThrows(QuotaExceededException.class, () -> producer.enqueueJob(
                EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build()));
        producer.cancelJob(second.id(), "org-1");
        producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build());
        assertEquals(4, store.all().size());
    }

    @Test
    void dispatchWindowShouldRejectOnceFull() {
        InMemoryRateLimiter limiter = new InMemoryRateLimiter(clock, Duration.ofHours(1), Map.of(), 2);
        DefaultJobProducer producer = producer(queue, limiter, 50);
        producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build());
        producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build());

        QuotaExceededException ex = assertThrows(QuotaExceededException.class, () -> producer.enqueueJob(
                EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build()));
        assertEquals(QuotaExceededException.Quota.DISPATCH_WINDOW, ex.quota());
        assertEquals(2, ex.limit());

        clock.advance(Duration.ofHours(1));
        producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build());
        assertEquals(3, store.all().size());
    }

    @Test
    void explicitJobIdShouldDeduplicate() {
        DefaultJobProducer producer = producer();
        JobRecord first = producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload())
                .tenantId("org-1").jobId("rss-src-1-2026-03-02").build());
        JobRecord second = producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload())
                .tenantId("org-1").jobId("rss-src-1-2026-03-02").build());

        assertEquals(first.id(), second.id());
        assertEquals("rss-src-1-2026-03-02", first.dedupKey());
        assertEquals(1, store.all().size());
        assertEquals(1, queue.claim("w", 10, Duration.ofMinutes(1)).size());
    }

    @Test
    void explicitJobIdShouldBeScopedToTenant() {
        DefaultJobProducer producer = producer();
        Map<String, Object> privateFeed = Map.of(
                "contextSourceId", "org1-secret-src",
                "brandId", "brand-1",
                "url", "https://org1.example/private-feed.xml",
                "sourceType", "RSS");
        JobRecord mine = producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, privateFeed)
                .tenantId("org-1").jobId("daily-sync").build());

        JobRecord theirs = producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload())
                .tenantId("org-2").jobId("daily-sync").build());

        assertFalse(mine.id().equals(theirs.id()));
        assertEquals("org-2", theirs.tenantId());
        assertEquals("daily-sync", theirs.dedupKey());
        assertEquals("https://example.com/feed.xml", theirs.payload().get("url"));
        assertEquals(2, store.all().size());
        assertTrue(queue.isLive(mine.id()));
        assertTrue(queue.isLive(theirs.id()));
        assertEquals(2, queue.claim("w", 10, Duration.ofMinutes(1)).size());

        JobRecord again = producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload())
                .tenantId("org-2").jobId("daily-sync").build());
        assertEquals(theirs.id(), again.id());
    }

    @Test
    void resubmittedJobIdShouldNotBeChargedAgainstQuotas() {
        InMemoryRateLimiter limiter = new InMemoryRateLimiter(clock, Duration.ofHours(1), Map.of(), 2);
        DefaultJobProducer producer = producer(queue, limiter, 1);

        JobRecord first = producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload())
                .tenantId("org-1").jobId("same").build());
        for (int i = 0; i < 3; i++) {
            JobRecord again = producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload())
                    .tenantId("org-1").jobId("same").build());
            assertEquals(first.id(), again.id());
        }

        assertEquals(1, store.all().size());
        assertEquals(1, limiter.currentCount("org-1", RateLimitScope.jobDispatch()));
    }

    @Test
    void parentOwnerShouldBeAuthoritativeTenant() {
        DefaultJobProducer producer = producer();

        JobRecord job = producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload())
                .parentId("brand-1").build());
        assertEquals("org-1", job.tenantId());
        assertEquals("brand-1", job.parentId());

        PayloadValidationException mismatch = assertThrows(PayloadValidationException.class, () -> producer.enqueueJob(
                EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).parentId("brand-1").tenantId("org-2").build()));
        assertEquals("tenantId", mismatch.issues().get(0).path());

        assertThrows(IllegalArgumentException.class, () -> producer.enqueueJob(
                EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).parentId("brand-unknown").build()));
    }

    @Test
    void enqueueFailureShouldLeavePendingRecordAndRaise() {
        ExecutionQueue broken = mock(ExecutionQueue.class);
        when(broken.enqueue(any())).thenThrow(new IllegalStateException("queue down"));
        DefaultJobProducer producer = producer(broken, new InMemoryRateLimiter(clock), 50);

        DispatchException ex = assertThrows(DispatchException.class, () -> producer.enqueueJob(
                EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build()));

        assertEquals("queue down", ex.getCause().getMessage());
        assertEquals(1, store.all().size());
        assertEquals(JobStatus.PENDING, store.all().get(0).status());
    }

    @Test
    void getJobShouldHideOtherTenantsJobs() {
        JobRecord job = producer().enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build());

        assertTrue(producer().getJob(job.id(), "org-1").isPresent());
        assertEquals(Optional.empty(), producer().getJob(job.id(), "org-2"));
    }

    @Test
    void cancelShouldMarkCancelledAndDropQueueEntry() {
        DefaultJobProducer producer = producer();
        JobRecord job = producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build());

        JobRecord cancelled = producer.cancelJob(job.id(), "org-1");

        assertEquals(JobStatus.CANCELLED, cancelled.status());
        assertFalse(queue.isLive(job.id()));
        InvalidJobStateException again = assertThrows(InvalidJobStateException.class, () -> producer.cancelJob(job.id(), "org-1"));
        assertEquals(JobStatus.CANCELLED, again.status());
        assertThrows(JobNotFoundException.class, () -> producer.cancelJob(job.id(), "org-2"));
        assertThrows(JobNotFoundException.class, () -> producer.cancelJob("000000000000000000000999", "org-1"));
    }

    @Test
    void cancelShouldRejectFinishedJobs() {
        DefaultJobProducer producer = producer();
        JobRecord completed = producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build());
        store.markRunning(completed.id(), NOW);
        store.markCompleted(completed.id(), Map.of("items", 3), NOW);
        JobRecord failed = producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build());
        store.markFailed(failed.id(), "feed unreachable", NOW);

        InvalidJobStateException done = assertThrows(InvalidJobStateException.class,
                () -> producer.cancelJob(completed.id(), "org-1"));
        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals(JobStatus.COMPLETED, store.findById(completed.id()).orElseThrow().status());

        InvalidJobStateException dead = assertThrows(InvalidJobStateException.class,
                () -> producer.cancelJob(failed.id(), "org-1"));
        assertEquals(JobStatus.FAILED, dead.status());
    }

    @Test
    void cancelShouldSucceedWhenQueueCancelFails() {
        ExecutionQueue flaky = mock(ExecutionQueue.class);
        when(flaky.enqueue(any())).thenReturn(true);
        when(flaky.cancel(anyString())).thenThrow(new IllegalStateException("queue down"));
        DefaultJobProducer producer = producer(flaky, new InMemoryRateLimiter(clock), 50);
        JobRecord job = producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build());

        assertEquals(JobStatus.CANCELLED, producer.cancelJob(job.id(), "org-1").status());
    }

    @Test
    void retryShouldCreateNewHighPriorityJobFromFailedOne() {
        DefaultJobProducer producer = producer();
        JobRecord job = producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload())
                .parentId("brand-1").priority(Priority.LOW).build());
        store.markRunning(job.id(), NOW);
        JobRecord failed = store.markFailed(job.id(), "feed unreachable", NOW).orElseThrow();

        JobRecord retry = producer.retryJob(job.id(), "org-1");

        assertTrue(retry.id().compareTo(failed.id()) > 0);
        assertEquals(Priority.HIGH, retry.priority());
        assertEquals(failed.id(), retry.retriedFrom());
        assertEquals(failed.payload(), retry.payload());
        assertEquals("brand-1", retry.parentId());
        assertEquals(JobStatus.PENDING, retry.status());
        assertEquals(failed, store.findById(failed.id()).orElseThrow());
    }

    @Test
    void retryShouldOnlyApplyToFailedJobs() {
        DefaultJobProducer producer = producer();
        JobRecord job = producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build());

        InvalidJobStateException ex = assertThrows(InvalidJobStateException.class, () -> producer.retryJob(job.id(), "org-1"));
        assertEquals(JobStatus.PENDING, ex.status());
        assertEquals(job.id(), ex.jobId());
    }

    @Test
    void listShouldPageNewestFirst() {
        DefaultJobProducer producer = producer();
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            ids.add(producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build()).id());
        }
        producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-2").build());

        JobQuery query = JobQuery.builder("org-1").limit(2).build();
        JobPage first = producer.listJobs(query);
        JobPage second = producer.listJobs(query.withCursor(first.nextCursor()));
        JobPage third = producer.listJobs(query.withCursor(second.nextCursor()));

        assertEquals(List.of(ids.get(4), ids.get(3)), first.jobs().stream().map(JobRecord::id).toList());
        assertTrue(first.hasMore());
        assertEquals(List.of(ids.get(2), ids.get(1)), second.jobs().stream().map(JobRecord::id).toList());
        assertEquals(List.of(ids.get(0)), third.jobs().stream().map(JobRecord::id).toList());
        assertFalse(third.hasMore());
        assertNull(third.nextCursor());
    }

    @Test
    void listShouldFilterByStatus() {
        DefaultJobProducer producer = producer();
        JobRecord a = producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build());
        producer.enqueueJob(EnqueueRequest.builder(JobType.SYNC_RSS, rssPayload()).tenantId("org-1").build());
        producer.cancelJob(a.id(), "org-1");

        JobPage page = producer.listJobs(JobQuery.builder("org-1").status(JobStatus.CANCELLED).build());

        assertEquals(List.of(a.id()), page.jobs().stream().map(JobRecord::id).toList());
    }
}
