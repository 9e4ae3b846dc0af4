package io.dispatch4j.internal.mongo;

import com.mongodb.client.MongoClients;
import io.dispatch4j.core.JobPage;
import io.dispatch4j.core.JobQuery;
import io.dispatch4j.core.JobRecord;
import io.dispatch4j.core.JobStatus;
import io.dispatch4j.core.JobType;
import io.dispatch4j.core.NewJob;
import io.dispatch4j.core.PersistResult;
import io.dispatch4j.core.Priority;
import io.dispatch4j.spi.QueueEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Query;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoJobStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private MongoTemplate mongoTemplate;
    private MongoJobStore jobStore;
    private MongoExecutionQueue queue;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "dispatch4j_test");
        mongoTemplate.dropCollection(JobDocument.class);
        mongoTemplate.dropCollection(QueueEntryDocument.class);
        mongoTemplate.indexOps(JobDocument.class)
                .ensureIndex(new Index().on("tenantId", Sort.Direction.ASC).on("dedupKey", Sort.Direction.ASC).unique());
        jobStore = new MongoJobStore(mongoTemplate, Clock.fixed(NOW, ZoneOffset.UTC));
        queue = queueAt(NOW);
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(JobDocument.class);
        mongoTemplate.dropCollection(QueueEntryDocument.class);
    }

    @Test
    void createShouldPersistPendingJobWithGeneratedDedupKey() {
        PersistResult result = jobStore.create(newJob(null, "org-1"));

        assertTrue(result.created());
        JobRecord job = result.job();
        assertNotNull(job.id());
        assertEquals(job.id(), job.dedupKey());
        assertEquals(JobStatus.PENDING, job.status());
        assertEquals(0, job.attempts());

        JobRecord stored = jobStore.findById(job.id()).orElseThrow();
        assertEquals(JobType.SYNC_ANALYTICS, stored.type());
        assertEquals(Priority.NORMAL, stored.priority());
        assertEquals("acc-1", stored.payload().get("socialAccountId"));
        assertEquals(NOW, stored.createdAt());
    }

    @Test
    void createShouldReturnExistingJobForSameDedupKey() {
        PersistResult first = jobStore.create(newJob("sync:acc-1", "org-1"));
        PersistResult second = jobStore.create(newJob("sync:acc-1", "org-1"));

        assertTrue(first.created());
        assertFalse(second.created());
        assertEquals(first.job().id(), second.job().id());
        assertEquals(1, mongoTemplate.count(new Query(), JobDocument.class));
    }

    @Test
    void dedupKeyShouldBeScopedToTenant() {
        JobRecord mine = jobStore.create(newJob("daily-sync", "org-1")).job();

        PersistResult theirs = jobStore.create(newJob("daily-sync", "org-2"));

        assertTrue(theirs.created());
        assertFalse(mine.id().equals(theirs.job().id()));
        assertEquals("org-2", theirs.job().tenantId());
        assertEquals(2, mongoTemplate.count(new Query(), JobDocument.class));
        assertEquals(mine.id(), jobStore.findByDedupKey("org-1", "daily-sync").orElseThrow().id());
        assertEquals(theirs.job().id(), jobStore.findByDedupKey("org-2", "daily-sync").orElseThrow().id());
        assertTrue(jobStore.findByDedupKey("org-3", "daily-sync").isEmpty());
    }

    @Test
    void findByIdShouldBeScopedToTenant() {
        JobRecord job = jobStore.create(newJob(null, "org-1")).job();

        assertTrue(jobStore.findById(job.id(), "org-1").isPresent());
        assertTrue(jobStore.findById(job.id(), "org-2").isEmpty());
    }

    @Test
    void transitionsShouldOnlyApplyFromExpectedStatus() {
        JobRecord job = jobStore.create(newJob(null, "org-1")).job();

        assertTrue(jobStore.markCompleted(job.id(), Map.of(), NOW).isEmpty());

        JobRecord running = jobStore.markRunning(job.id(), NOW).orElseThrow();
        assertEquals(JobStatus.RUNNING, running.status());
        assertEquals(1, running.attempts());
        assertTrue(jobStore.markRunning(job.id(), NOW).isEmpty());

        JobRecord pending = jobStore.markPendingForRetry(job.id(), "boom", NOW.plusSeconds(60), NOW).orElseThrow();
        assertEquals(JobStatus.PENDING, pending.status());
        assertEquals("boom", pending.error());
        assertEquals(NOW.plusSeconds(60), pending.runAt());

        jobStore.markRunning(job.id(), NOW.plusSeconds(60)).orElseThrow();
        JobRecord done = jobStore.markCompleted(job.id(), Map.of("synced", 12), NOW.plusSeconds(61)).orElseThrow();
        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals(2, done.attempts());
        assertNull(done.error());
        assertEquals(12, done.result().get("synced"));

        assertTrue(jobStore.markCancelled(job.id(), NOW).isEmpty());
        assertTrue(jobStore.markFailed(job.id(), "late", NOW).isEmpty());
    }

    @Test
    void cancelShouldApplyToPendingAndRunningJobs() {
        JobRecord pending = jobStore.create(newJob(null, "org-1")).job();
        JobRecord running = jobStore.create(newJob(null, "org-1")).job();
        jobStore.markRunning(running.id(), NOW);

        assertEquals(JobStatus.CANCELLED, jobStore.markCancelled(pending.id(), NOW).orElseThrow().status());
        assertEquals(JobStatus.CANCELLED, jobStore.markCancelled(running.id(), NOW).orElseThrow().status());
        assertEquals(0, jobStore.countByStatus("org-1", JobStatus.ACTIVE));
    }

    @Test
    void listShouldPageNewestFirstWithExclusiveCursor() {
        for (int i = 0; i < 5; i++) {
            jobStore.create(newJob(null, "org-1"));
        }
        jobStore.create(newJob(null, "org-2"));

        JobQuery query = JobQuery.builder("org-1").limit(2).build();
        JobPage first = jobStore.list(query);
        JobPage second = jobStore.list(query.withCursor(first.nextCursor()));
        JobPage third = jobStore.list(query.withCursor(second.nextCursor()));

        assertEquals(2, first.jobs().size());
        assertTrue(first.hasMore());
        assertTrue(first.jobs().get(0).id().compareTo(first.jobs().get(1).id()) > 0);
        assertTrue(second.jobs().get(0).id().compareTo(first.nextCursor()) < 0);
        assertEquals(1, third.jobs().size());
        assertFalse(third.hasMore());
        assertNull(third.nextCursor());
    }

    @Test
    void listCursorShouldBeStableWhenJobsAreInsertedBetweenPages() {
        for (int i = 0; i < 4; i++) {
            jobStore.create(newJob(null, "org-1"));
        }
        JobQuery query = JobQuery.builder("org-1").limit(2).build();
        JobPage first = jobStore.list(query);

        jobStore.create(newJob(null, "org-1"));
        jobStore.create(newJob(null, "org-1"));
        JobPage second = jobStore.list(query.withCursor(first.nextCursor()));

        List<String> seen = new ArrayList<>();
        first.jobs().forEach(j -> seen.add(j.id()));
        second.jobs().forEach(j -> seen.add(j.id()));
        assertEquals(4, seen.size());
        assertEquals(4, new HashSet<>(seen).size());
        assertFalse(second.hasMore());
    }

    @Test
    void listShouldRejectMalformedCursor() {
        JobQuery query = JobQuery.builder("org-1").cursor("not-an-id").build();

        assertThrows(IllegalArgumentException.class, () -> jobStore.list(query));
    }

    @Test
    void findPendingCreatedBeforeShouldPageByIdAscending() {
        JobRecord a = jobStore.create(newJob(null, "org-1")).job();
        JobRecord b = jobStore.create(newJob(null, "org-2")).job();
        JobRecord c = jobStore.create(newJob(null, "org-1")).job();
        jobStore.markRunning(b.id(), NOW);

        List<JobRecord> page = jobStore.findPendingCreatedBefore(NOW.plusSeconds(1), null, 10);
        assertEquals(List.of(a.id(), c.id()), page.stream().map(JobRecord::id).toList());

        List<JobRecord> after = jobStore.findPendingCreatedBefore(NOW.plusSeconds(1), a.id(), 10);
        assertEquals(List.of(c.id()), after.stream().map(JobRecord::id).toList());

        assertTrue(jobStore.findPendingCreatedBefore(NOW, null, 10).isEmpty());
    }

    @Test
    void queueShouldDedupByKeyAndClaimByPriority() {
        assertTrue(queue.enqueue(entry("low", Priority.LOW, NOW)));
        assertTrue(queue.enqueue(entry("high", Priority.HIGH, NOW)));
        assertTrue(queue.enqueue(entry("later", Priority.HIGH, NOW.plusSeconds(30))));
        assertFalse(queue.enqueue(entry("high", Priority.HIGH, NOW)));

        List<QueueEntry> claimed = queue.claim("worker-A", 5, Duration.ofMinutes(10));

        assertEquals(List.of("high", "low"), claimed.stream().map(QueueEntry::key).toList());
        assertTrue(queue.claim("worker-B", 5, Duration.ofMinutes(10)).isEmpty());
    }

    @Test
    void queueShouldReclaimExpiredLease() {
        queue.enqueue(entry("job-1", Priority.NORMAL, NOW));
        assertEquals(1, queue.claim("worker-A", 1, Duration.ofMinutes(10)).size());

        MongoExecutionQueue later = queueAt(NOW.plus(Duration.ofMinutes(11)));
        List<QueueEntry> reclaimed = later.claim("worker-B", 1, Duration.ofMinutes(10));

        assertEquals(1, reclaimed.size());
        QueueEntryDocument doc = mongoTemplate.findById("job-1", QueueEntryDocument.class);
        assertEquals("worker-B", doc.getLockedBy());
    }

    @Test
    void queueReleaseShouldDelayAndReviveCompletedKeys() {
        queue.enqueue(entry("job-1", Priority.NORMAL, NOW));
        queue.claim("worker-A", 1, Duration.ofMinutes(10));
        queue.release("job-1", Duration.ofMinutes(1));

        assertTrue(queue.isLive("job-1"));
        assertTrue(queue.claim("worker-A", 1, Duration.ofMinutes(10)).isEmpty());
        assertEquals(1, queueAt(NOW.plusSeconds(60)).claim("worker-A", 1, Duration.ofMinutes(10)).size());

        queue.complete("job-1");
        assertFalse(queue.isLive("job-1"));
        assertFalse(queue.enqueue(entry("job-1", Priority.NORMAL, NOW)));

        queue.release("job-1", Duration.ZERO);
        assertTrue(queue.isLive("job-1"));
    }

    @Test
    void queueCancelShouldOnlyDropWaitingEntries() {
        queue.enqueue(entry("waiting", Priority.NORMAL, NOW.plusSeconds(60)));
        queue.enqueue(entry("active", Priority.NORMAL, NOW));
        queue.claim("worker-A", 1, Duration.ofMinutes(10));

        assertTrue(queue.cancel("waiting"));
        assertFalse(queue.cancel("active"));
        assertFalse(queue.cancel("missing"));
        assertFalse(queue.isLive("waiting"));
        assertTrue(queue.isLive("active"));
    }

    private MongoExecutionQueue queueAt(Instant now) {
        return new MongoExecutionQueue(mongoTemplate, Clock.fixed(now, ZoneOffset.UTC));
    }

    private static QueueEntry entry(String key, Priority priority, Instant readyAt) {
        return new QueueEntry(key, key, "org-1", JobType.SYNC_ANALYTICS, priority, readyAt);
    }

    private static NewJob newJob(String dedupKey, String tenantId) {
        Map<String, Object> payload = Map.of(
                "socialAccountId", "acc-1",
                "organizationId", tenantId,
                "platform", "TWITTER",
                "syncType", "INCREMENTAL"
        );
        return new NewJob(dedupKey, JobType.SYNC_ANALYTICS, tenantId, null, payload,
                Priority.NORMAL, 3, NOW, null);
    }
}
