package io.dispatch4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.dispatch4j.core.Priority;
import io.dispatch4j.spi.ExecutionQueue;
import io.dispatch4j.spi.QueueEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link ExecutionQueue} shared by every process through one Mongo collection.
 *
 * <p>The entry key is the document {@code _id}, so a second enqueue of the same key
 * fails on the primary key and is reported as a dedup hit. Finished entries are kept
 * in {@code DONE} state for the same reason. Claims use {@code findAndModify}, one
 * document at a time, so two workers never lease the same entry.
 */
public class MongoExecutionQueue implements ExecutionQueue {
    private static final Logger log = LoggerFactory.getLogger(MongoExecutionQueue.class);

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoExecutionQueue(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public boolean enqueue(QueueEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");

        QueueEntryDocument doc = new QueueEntryDocument();
        doc.setKey(entry.key());
        doc.setJobId(entry.jobId());
        doc.setTenantId(entry.tenantId());
        doc.setType(entry.type());
        doc.setPriority(entry.priority().value());
        doc.setReadyAt(entry.readyAt());
        doc.setState(QueueEntryDocument.State.WAITING);
        doc.setEnqueuedAt(clock.instant());
        try {
            mongoTemplate.insert(doc);
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("queue dedup hit key={}", entry.key());
            return false;
        }
    }

    /**
     * Atomically leases at most {@code max} ready entries.
     *
     * <p>An entry is ready when it is {@code WAITING} with {@code readyAt <= now}, or
     * {@code ACTIVE} with an expired lease.
     */
    @Override
    public List<QueueEntry> claim(String workerId, int max, Duration lease) {
        Objects.requireNonNull(workerId, "workerId must not be null");
        Objects.requireNonNull(lease, "lease must not be null");
        if (max <= 0) {
            return List.of();
        }
        if (lease.isZero() || lease.isNegative()) {
            throw new IllegalArgumentException("lease must be a positive duration");
        }

        Instant now = clock.instant();
        Query ready = new Query(new Criteria().orOperator(
                Criteria.where("state").is(QueueEntryDocument.State.WAITING).and("readyAt").lte(now),
                Criteria.where("state").is(QueueEntryDocument.State.ACTIVE).and("leaseUntil").lte(now)
        ));
        ready.with(Sort.by(Sort.Order.desc("priority"), Sort.Order.asc("readyAt"), Sort.Order.asc("_id")));

        Update leaseUpdate = new Update()
                .set("state", QueueEntryDocument.State.ACTIVE)
                .set("lockedBy", workerId)
                .set("leaseUntil", now.plus(lease));

        // previous version, so an expired lease can be reported
        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(false);

        List<QueueEntry> claimed = new ArrayList<>(Math.min(max, 64));
        for (int i = 0; i < max; i++) {
            QueueEntryDocument doc = mongoTemplate.findAndModify(ready, leaseUpdate, options, QueueEntryDocument.class);
            if (doc == null) {
                break;
            }
            if (doc.getState() == QueueEntryDocument.State.ACTIVE) {
                log.warn("queue lease expired; reclaiming key={} previousOwner={}", doc.getKey(), doc.getLockedBy());
            }
            claimed.add(toEntry(doc));
        }
        return claimed;
    }

    /**
     * Returns a known key to waiting. A {@code DONE} key is revived, which is how the
     * reconciler resubmits a job whose entry was lost.
     */
    @Override
    public void release(String key, Duration delay) {
        Objects.requireNonNull(key, "key must not be null");
        Duration d = delay == null || delay.isNegative() ? Duration.ZERO : delay;

        Update u = new Update()
                .set("state", QueueEntryDocument.State.WAITING)
                .set("readyAt", clock.instant().plus(d))
                .unset("lockedBy")
                .unset("leaseUntil")
                .unset("completedAt");
        UpdateResult r = mongoTemplate.updateFirst(byKey(key), u, QueueEntryDocument.class);
        if (r.getMatchedCount() == 0) {
            log.warn("queue release of unknown key={}", key);
        }
    }

    @Override
    public void complete(String key) {
        Objects.requireNonNull(key, "key must not be null");
        Update u = new Update()
                .set("state", QueueEntryDocument.State.DONE)
                .set("completedAt", clock.instant())
                .unset("lockedBy")
                .unset("leaseUntil");
        mongoTemplate.updateFirst(byKey(key), u, QueueEntryDocument.class);
    }

    @Override
    public boolean cancel(String key) {
        Objects.requireNonNull(key, "key must not be null");
        Query q = new Query(Criteria.where("_id").is(key).and("state").is(QueueEntryDocument.State.WAITING));
        Update u = new Update()
                .set("state", QueueEntryDocument.State.DONE)
                .set("completedAt", clock.instant());
        return mongoTemplate.updateFirst(q, u, QueueEntryDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean isLive(String key) {
        Objects.requireNonNull(key, "key must not be null");
        Query q = new Query(Criteria.where("_id").is(key)
                .and("state").in(QueueEntryDocument.State.WAITING, QueueEntryDocument.State.ACTIVE));
        return mongoTemplate.exists(q, QueueEntryDocument.class);
    }

    private static Query byKey(String key) {
        return new Query(Criteria.where("_id").is(key));
    }

    private static QueueEntry toEntry(QueueEntryDocument doc) {
        return new QueueEntry(
                doc.getKey(),
                doc.getJobId(),
                doc.getTenantId(),
                doc.getType(),
                Priority.fromValue(doc.getPriority()),
                doc.getReadyAt()
        );
    }
}
