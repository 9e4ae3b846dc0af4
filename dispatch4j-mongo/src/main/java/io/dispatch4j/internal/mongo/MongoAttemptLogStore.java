package io.dispatch4j.internal.mongo;

import io.dispatch4j.publishing.AttemptOutcome;
import io.dispatch4j.publishing.PublishingAttempt;
import io.dispatch4j.spi.AttemptLogStore;
import org.bson.types.ObjectId;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link AttemptLogStore} over the {@code publishing_attempts} collection.
 */
public class MongoAttemptLogStore implements AttemptLogStore {

    private final MongoTemplate mongoTemplate;

    public MongoAttemptLogStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public PublishingAttempt append(PublishingAttempt attempt) {
        Objects.requireNonNull(attempt, "attempt must not be null");
        AttemptLogDocument doc = toDocument(attempt);
        doc.setId(new ObjectId().toHexString());
        AttemptLogDocument saved = mongoTemplate.insert(doc);
        return attempt.withId(saved.getId());
    }

    @Override
    public Optional<PublishingAttempt> latestFor(String variationId) {
        Objects.requireNonNull(variationId, "variationId must not be null");
        Query q = new Query(Criteria.where("variationId").is(variationId));
        q.with(Sort.by(Sort.Order.desc("attemptNumber"), Sort.Order.desc("_id")));
        return Optional.ofNullable(mongoTemplate.findOne(q, AttemptLogDocument.class))
                .map(MongoAttemptLogStore::toAttempt);
    }

    @Override
    public boolean hasPendingRetry(String variationId) {
        Objects.requireNonNull(variationId, "variationId must not be null");
        Query q = new Query(Criteria.where("variationId").is(variationId)
                .and("outcome").ne(AttemptOutcome.SUCCESS)
                .and("nextRetryAt").ne(null));
        return mongoTemplate.exists(q, AttemptLogDocument.class);
    }

    @Override
    public List<PublishingAttempt> findDueRetries(Instant now, int maxAttemptNumber, int limit) {
        Objects.requireNonNull(now, "now must not be null");
        if (limit <= 0) {
            return List.of();
        }
        Query q = new Query(Criteria.where("outcome").in(AttemptOutcome.FAILED, AttemptOutcome.RATE_LIMITED)
                .and("nextRetryAt").lte(now)
                .and("attemptNumber").lt(maxAttemptNumber));
        q.with(Sort.by(Sort.Direction.ASC, "nextRetryAt")).limit(limit);
        return mongoTemplate.find(q, AttemptLogDocument.class).stream()
                .map(MongoAttemptLogStore::toAttempt)
                .toList();
    }

    @Override
    public boolean clearNextRetry(String attemptId) {
        Objects.requireNonNull(attemptId, "attemptId must not be null");
        Query q = new Query(Criteria.where("_id").is(attemptId).and("nextRetryAt").ne(null));
        return mongoTemplate.updateFirst(q, new Update().unset("nextRetryAt"), AttemptLogDocument.class)
                .getModifiedCount() == 1;
    }

    @Override
    public List<PublishingAttempt> findByTenantSince(String tenantId, Instant since) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(since, "since must not be null");
        Query q = new Query(Criteria.where("tenantId").is(tenantId).and("attemptedAt").gte(since));
        q.with(Sort.by(Sort.Direction.ASC, "attemptedAt"));
        return mongoTemplate.find(q, AttemptLogDocument.class).stream()
                .map(MongoAttemptLogStore::toAttempt)
                .toList();
    }

    private static AttemptLogDocument toDocument(PublishingAttempt a) {
        AttemptLogDocument doc = new AttemptLogDocument();
        doc.setTenantId(a.tenantId());
        doc.setContentId(a.contentId());
        doc.setVariationId(a.variationId());
        doc.setPlatform(a.platform());
        doc.setAccountId(a.accountId());
        doc.setOutcome(a.outcome());
        doc.setPostId(a.postId());
        doc.setPostUrl(a.postUrl());
        doc.setError(a.error());
        doc.setAttemptNumber(a.attemptNumber());
        doc.setScheduledFor(a.scheduledFor());
        doc.setNextRetryAt(a.nextRetryAt());
        doc.setAttemptedAt(a.attemptedAt());
        doc.setCompletedAt(a.completedAt());
        return doc;
    }

    private static PublishingAttempt toAttempt(AttemptLogDocument d) {
        return new PublishingAttempt(
                d.getId(),
                d.getTenantId(),
                d.getContentId(),
                d.getVariationId(),
                d.getPlatform(),
                d.getAccountId(),
                d.getOutcome(),
                d.getPostId(),
                d.getPostUrl(),
                d.getError(),
                d.getAttemptNumber(),
                d.getScheduledFor(),
                d.getNextRetryAt(),
                d.getAttemptedAt(),
                d.getCompletedAt()
        );
    }
}
