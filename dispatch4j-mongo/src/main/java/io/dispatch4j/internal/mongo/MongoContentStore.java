package io.dispatch4j.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.dispatch4j.publishing.ApprovalStatus;
import io.dispatch4j.publishing.ContentStatus;
import io.dispatch4j.publishing.ScheduledContent;
import io.dispatch4j.publishing.Variation;
import io.dispatch4j.publishing.VariationStatus;
import io.dispatch4j.spi.ContentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ContentStore} over the {@code scheduled_content} collection. Variations are
 * embedded in their unit and updated in place with the positional operator.
 */
public class MongoContentStore implements ContentStore {
    private static final Logger log = LoggerFactory.getLogger(MongoContentStore.class);

    private final MongoTemplate mongoTemplate;

    public MongoContentStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<ScheduledContent> findDue(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        Query q = new Query(Criteria.where("status").is(ContentStatus.SCHEDULED)
                .and("approval").in(ApprovalStatus.APPROVED, ApprovalStatus.AUTO_APPROVED)
                .and("scheduledFor").lte(now));
        q.with(Sort.by(Sort.Direction.ASC, "scheduledFor"));
        return mongoTemplate.find(q, ContentDocument.class).stream()
                .map(MongoContentStore::toContent)
                .toList();
    }

    @Override
    public Optional<ScheduledContent> findById(String contentId) {
        Objects.requireNonNull(contentId, "contentId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(contentId, ContentDocument.class))
                .map(MongoContentStore::toContent);
    }

    @Override
    public Optional<ScheduledContent> findByVariationId(String variationId) {
        Objects.requireNonNull(variationId, "variationId must not be null");
        Query q = new Query(Criteria.where("variations.variationId").is(variationId));
        return Optional.ofNullable(mongoTemplate.findOne(q, ContentDocument.class))
                .map(MongoContentStore::toContent);
    }

    @Override
    public void updateStatus(String contentId, ContentStatus status, Instant publishedAt, String error) {
        Objects.requireNonNull(contentId, "contentId must not be null");
        Objects.requireNonNull(status, "status must not be null");

        Update u = new Update().set("status", status);
        if (publishedAt != null) {
            u.set("publishedAt", publishedAt);
        }
        if (error != null) {
            u.set("error", error);
        } else {
            u.unset("error");
        }
        UpdateResult r = mongoTemplate.updateFirst(new Query(Criteria.where("_id").is(contentId)), u, ContentDocument.class);
        if (r.getMatchedCount() == 0) {
            log.warn("content status update matched nothing contentId={} status={}", contentId, status);
        }
    }

    @Override
    public void markVariationPublishing(String variationId) {
        updateVariation(variationId, new Update().set("variations.$.status", VariationStatus.PUBLISHING));
    }

    @Override
    public void markVariationPublished(String variationId, String postId, String postUrl, Instant publishedAt) {
        updateVariation(variationId, new Update()
                .set("variations.$.status", VariationStatus.PUBLISHED)
                .set("variations.$.postId", postId)
                .set("variations.$.postUrl", postUrl)
                .set("variations.$.publishedAt", publishedAt)
                .unset("variations.$.error"));
    }

    @Override
    public void markVariationScheduled(String variationId, String error) {
        Update u = new Update().set("variations.$.status", VariationStatus.SCHEDULED);
        if (error != null) {
            u.set("variations.$.error", error);
        } else {
            u.unset("variations.$.error");
        }
        updateVariation(variationId, u);
    }

    @Override
    public void markVariationFailed(String variationId, String error) {
        updateVariation(variationId, new Update()
                .set("variations.$.status", VariationStatus.FAILED)
                .set("variations.$.error", error));
    }

    @Override
    public List<Instant> findScheduledSlots(String brandId, Instant from, Instant to) {
        Objects.requireNonNull(brandId, "brandId must not be null");
        Query q = new Query(Criteria.where("brandId").is(brandId)
                .and("status").is(ContentStatus.SCHEDULED)
                .and("scheduledFor").gte(from).lte(to));
        q.fields().include("scheduledFor");
        return mongoTemplate.find(q, ContentDocument.class).stream()
                .map(ContentDocument::getScheduledFor)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public boolean assignSchedule(String tenantId, String contentId, Instant slot) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(contentId, "contentId must not be null");
        Objects.requireNonNull(slot, "slot must not be null");

        Query q = new Query(Criteria.where("_id").is(contentId).and("tenantId").is(tenantId));
        Update u = new Update()
                .set("scheduledFor", slot)
                .set("status", ContentStatus.SCHEDULED)
                .set("variations.$[v].status", VariationStatus.SCHEDULED)
                .filterArray(Criteria.where("v.status").in(VariationStatus.PENDING, VariationStatus.APPROVED));
        return mongoTemplate.updateFirst(q, u, ContentDocument.class).getMatchedCount() > 0;
    }

    private void updateVariation(String variationId, Update update) {
        Objects.requireNonNull(variationId, "variationId must not be null");
        Query q = new Query(Criteria.where("variations.variationId").is(variationId));
        UpdateResult r = mongoTemplate.updateFirst(q, update, ContentDocument.class);
        if (r.getMatchedCount() == 0) {
            throw new IllegalStateException("no content holds variation " + variationId);
        }
    }

    static ScheduledContent toContent(ContentDocument doc) {
        List<Variation> variations = new ArrayList<>();
        if (doc.getVariations() != null) {
            for (ContentDocument.VariationDocument v : doc.getVariations()) {
                variations.add(new Variation(
                        v.getVariationId(),
                        doc.getId(),
                        v.getPlatform(),
                        v.getAccountId(),
                        v.getText(),
                        v.getMediaUrl(),
                        v.getStatus(),
                        v.getPostId(),
                        v.getPostUrl(),
                        v.getPublishedAt(),
                        v.getError()
                ));
            }
        }
        return new ScheduledContent(
                doc.getId(),
                doc.getTenantId(),
                doc.getBrandId(),
                doc.getBody(),
                doc.getMediaUrls(),
                doc.getScheduledFor(),
                doc.getApproval(),
                doc.getStatus(),
                doc.getPublishedAt(),
                doc.getError(),
                variations
        );
    }

    static ContentDocument toDocument(ScheduledContent content) {
        ContentDocument doc = new ContentDocument();
        doc.setId(content.id());
        doc.setTenantId(content.tenantId());
        doc.setBrandId(content.brandId());
        doc.setBody(content.body());
        doc.setMediaUrls(new ArrayList<>(content.mediaUrls()));
        doc.setScheduledFor(content.scheduledFor());
        doc.setApproval(content.approval());
        doc.setStatus(content.status());
        doc.setPublishedAt(content.publishedAt());
        doc.setError(content.error());
        List<ContentDocument.VariationDocument> variations = new ArrayList<>();
        for (Variation v : content.variations()) {
            ContentDocument.VariationDocument vd = new ContentDocument.VariationDocument();
            vd.setVariationId(v.id());
            vd.setPlatform(v.platform());
            vd.setAccountId(v.accountId());
            vd.setText(v.text());
            vd.setMediaUrl(v.mediaUrl());
            vd.setStatus(v.status());
            vd.setPostId(v.postId());
            vd.setPostUrl(v.postUrl());
            vd.setPublishedAt(v.publishedAt());
            vd.setError(v.error());
            variations.add(vd);
        }
        doc.setVariations(variations);
        return doc;
    }
}
