package io.dispatch4j.internal.mongo;

import io.dispatch4j.core.JobPage;
import io.dispatch4j.core.JobQuery;
import io.dispatch4j.core.JobRecord;
import io.dispatch4j.core.JobStatus;
import io.dispatch4j.core.NewJob;
import io.dispatch4j.core.PersistResult;
import io.dispatch4j.core.Priority;
import io.dispatch4j.spi.JobStore;
import org.bson.types.ObjectId;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * MongoDB persistence layer for jobs.
 *
 * <p>Dedup relies on the unique {@code (tenantId, dedupKey)} index from
 * {@code DispatchMongoIndexConfig}: a concurrent insert of the same key by the same
 * tenant loses with a duplicate-key error and the existing record is returned instead. Status changes are
 * conditional {@code findAndModify} calls, so a transition that no longer applies
 * returns empty rather than overwriting a newer state.
 */
public class MongoJobStore implements JobStore {

    private static final FindAndModifyOptions RETURN_NEW = FindAndModifyOptions.options().returnNew(true);

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoJobStore(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public PersistResult create(NewJob job) {
        Objects.requireNonNull(job, "job must not be null");

        if (!isBlank(job.dedupKey())) {
            JobDocument existing = findDocByDedupKey(job.tenantId(), job.dedupKey());
            if (existing != null) {
                return PersistResult.existingResult(toRecord(existing));
            }
        }

        JobDocument doc = toDocument(job, clock.instant());
        try {
            mongoTemplate.insert(doc);
        } catch (DuplicateKeyException e) {
            JobDocument existing = findDocByDedupKey(doc.getTenantId(), doc.getDedupKey());
            if (existing == null) {
                throw e;
            }
            return PersistResult.existingResult(toRecord(existing));
        }
        return PersistResult.createdResult(toRecord(doc));
    }

    @Override
    public Optional<JobRecord> findByDedupKey(String tenantId, String dedupKey) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(dedupKey, "dedupKey must not be null");
        return Optional.ofNullable(findDocByDedupKey(tenantId, dedupKey)).map(this::toRecord);
    }

    @Override
    public Optional<JobRecord> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(mongoTemplate.findById(id, JobDocument.class)).map(this::toRecord);
    }

    @Override
    public Optional<JobRecord> findById(String id, String tenantId) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Query q = new Query(Criteria.where("_id").is(id).and("tenantId").is(tenantId));
        return Optional.ofNullable(mongoTemplate.findOne(q, JobDocument.class)).map(this::toRecord);
    }

    /**
     * Newest first. Fetches one extra document to tell whether another page exists.
     */
    @Override
    public JobPage list(JobQuery query) {
        Objects.requireNonNull(query, "query must not be null");

        Criteria c = Criteria.where("tenantId").is(query.tenantId());
        if (query.status() != null) {
            c = c.and("status").is(query.status());
        }
        if (query.type() != null) {
            c = c.and("type").is(query.type());
        }
        if (query.parentId() != null) {
            c = c.and("parentId").is(query.parentId());
        }
        if (query.cursor() != null) {
            c = c.and("_id").lt(objectId(query.cursor(), "cursor"));
        }

        Query q = new Query(c);
        q.with(Sort.by(Sort.Order.desc("_id")));
        q.limit(query.limit() + 1);

        List<JobDocument> docs = mongoTemplate.find(q, JobDocument.class);
        boolean hasMore = docs.size() > query.limit();
        List<JobRecord> jobs = new ArrayList<>(Math.min(docs.size(), query.limit()));
        for (int i = 0; i < docs.size() && i < query.limit(); i++) {
            jobs.add(toRecord(docs.get(i)));
        }
        String nextCursor = hasMore ? jobs.get(jobs.size() - 1).id() : null;
        return new JobPage(jobs, nextCursor, hasMore);
    }

    @Override
    public long countByStatus(String tenantId, Set<JobStatus> statuses) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(statuses, "statuses must not be null");
        Query q = new Query(Criteria.where("tenantId").is(tenantId).and("status").in(statuses));
        return mongoTemplate.count(q, JobDocument.class);
    }

    @Override
    public Optional<JobRecord> markRunning(String id, Instant startedAt) {
        Update u = new Update()
                .set("status", JobStatus.RUNNING)
                .inc("attempts", 1)
                .set("startedAt", startedAt)
                .unset("completedAt")
                .unset("result")
                .set("updatedAt", startedAt);
        return transition(id, Set.of(JobStatus.PENDING), u);
    }

    @Override
    public Optional<JobRecord> markCompleted(String id, Map<String, Object> result, Instant completedAt) {
        Update u = new Update()
                .set("status", JobStatus.COMPLETED)
                .set("completedAt", completedAt)
                .unset("error")
                .set("updatedAt", completedAt);
        if (result != null) {
            u.set("result", result);
        } else {
            u.unset("result");
        }
        return transition(id, Set.of(JobStatus.RUNNING), u);
    }

    @Override
    public Optional<JobRecord> markFailed(String id, String error, Instant failedAt) {
        Update u = new Update()
                .set("status", JobStatus.FAILED)
                .set("error", error)
                .set("completedAt", failedAt)
                .set("updatedAt", failedAt);
        return transition(id, JobStatus.ACTIVE, u);
    }

    @Override
    public Optional<JobRecord> markPendingForRetry(String id, String error, Instant runAt, Instant now) {
        Update u = new Update()
                .set("status", JobStatus.PENDING)
                .set("error", error)
                .set("runAt", runAt)
                .set("updatedAt", now);
        return transition(id, Set.of(JobStatus.RUNNING), u);
    }

    @Override
    public Optional<JobRecord> markCancelled(String id, Instant cancelledAt) {
        Update u = new Update()
                .set("status", JobStatus.CANCELLED)
                .set("completedAt", cancelledAt)
                .set("updatedAt", cancelledAt);
        return transition(id, JobStatus.ACTIVE, u);
    }

    @Override
    public List<JobRecord> findPendingCreatedBefore(Instant createdBefore, String afterId, int limit) {
        Objects.requireNonNull(createdBefore, "createdBefore must not be null");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }

        Criteria c = Criteria.where("status").is(JobStatus.PENDING).and("createdAt").lt(createdBefore);
        if (!isBlank(afterId)) {
            c = c.and("_id").gt(objectId(afterId, "afterId"));
        }
        Query q = new Query(c);
        q.with(Sort.by(Sort.Order.asc("_id")));
        q.limit(limit);

        List<JobDocument> docs = mongoTemplate.find(q, JobDocument.class);
        List<JobRecord> jobs = new ArrayList<>(docs.size());
        for (JobDocument d : docs) {
            jobs.add(toRecord(d));
        }
        return jobs;
    }

    private Optional<JobRecord> transition(String id, Collection<JobStatus> from, Update update) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("_id").is(id).and("status").in(from));
        JobDocument doc = mongoTemplate.findAndModify(q, update, RETURN_NEW, JobDocument.class);
        return Optional.ofNullable(doc).map(this::toRecord);
    }

    private JobDocument findDocByDedupKey(String tenantId, String dedupKey) {
        Query q = new Query(Criteria.where("tenantId").is(tenantId).and("dedupKey").is(dedupKey));
        return mongoTemplate.findOne(q, JobDocument.class);
    }

    private static JobDocument toDocument(NewJob job, Instant now) {
        String id = new ObjectId().toHexString();

        JobDocument doc = new JobDocument();
        doc.setId(id);
        doc.setDedupKey(isBlank(job.dedupKey()) ? id : job.dedupKey());
        doc.setType(job.type());
        doc.setTenantId(job.tenantId());
        doc.setParentId(job.parentId());
        doc.setPayload(job.payload());
        doc.setStatus(JobStatus.PENDING);
        doc.setPriority(job.priority().value());
        doc.setAttempts(0);
        doc.setMaxAttempts(job.maxAttempts());
        doc.setRunAt(job.runAt());
        doc.setRetriedFrom(job.retriedFrom());
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(NewJob, Instant)}.
     */
    JobRecord toRecord(JobDocument doc) {
        return new JobRecord(
                doc.getId(),
                doc.getDedupKey(),
                doc.getType(),
                doc.getTenantId(),
                doc.getParentId(),
                doc.getPayload() == null ? Map.of() : doc.getPayload(),
                doc.getStatus(),
                Priority.fromValue(doc.getPriority()),
                doc.getAttempts(),
                doc.getMaxAttempts(),
                doc.getRunAt(),
                doc.getStartedAt(),
                doc.getCompletedAt(),
                doc.getError(),
                doc.getResult(),
                doc.getRetriedFrom(),
                doc.getCreatedAt(),
                doc.getUpdatedAt()
        );
    }

    private static ObjectId objectId(String value, String name) {
        if (!ObjectId.isValid(value)) {
            throw new IllegalArgumentException(name + " must be a job id");
        }
        return new ObjectId(value);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
