package io.dispatch4j.config;

import io.dispatch4j.internal.mongo.AttemptLogDocument;
import io.dispatch4j.internal.mongo.ContentDocument;
import io.dispatch4j.internal.mongo.JobDocument;
import io.dispatch4j.internal.mongo.PostingScheduleDocument;
import io.dispatch4j.internal.mongo.QueueEntryDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the dispatch module.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created automatically unless
 * {@code dispatch.ensure-indexes-on-startup=true}. In production they are usually managed
 * by migrations or ops scripts. Job dedup depends on {@code ux_tenant_dedup_key}: without
 * it two concurrent submissions of one tenant with the same key can both be inserted.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>ux_tenant_dedup_key</b> on {@code dispatch_jobs}: { tenantId: 1, dedupKey: 1 }, unique
 *       <br/>Dedup keys are per tenant; two tenants may use the same key.</li>
 *   <li><b>idx_tenant_status</b> on {@code dispatch_jobs}: { tenantId: 1, status: 1 }
 *       <br/>Active-job quota count and status-filtered listing.</li>
 *   <li><b>idx_tenant_id</b> on {@code dispatch_jobs}: { tenantId: 1, _id: -1 }
 *       <br/>Newest-first paging.</li>
 *   <li><b>idx_status_created</b> on {@code dispatch_jobs}: { status: 1, createdAt: 1 }
 *       <br/>Reconciliation sweep.</li>
 *   <li><b>idx_queue_claim</b> on {@code dispatch_queue}: { state: 1, priority: -1, readyAt: 1 }</li>
 *   <li><b>idx_queue_lease</b> on {@code dispatch_queue}: { state: 1, leaseUntil: 1 }</li>
 *   <li><b>idx_attempt_retry</b> on {@code publishing_attempts}: { nextRetryAt: 1 }</li>
 *   <li><b>idx_attempt_variation</b> on {@code publishing_attempts}: { variationId: 1, attemptNumber: -1 }</li>
 *   <li><b>idx_attempt_tenant</b> on {@code publishing_attempts}: { tenantId: 1, attemptedAt: 1 }</li>
 *   <li><b>idx_content_due</b> on {@code scheduled_content}: { status: 1, scheduledFor: 1 }</li>
 *   <li><b>idx_content_variation</b> on {@code scheduled_content}: { "variations.variationId": 1 }</li>
 *   <li><b>idx_content_brand</b> on {@code scheduled_content}: { brandId: 1, scheduledFor: 1 }</li>
 *   <li><b>idx_schedule_tenant</b> on {@code posting_schedules}: { tenantId: 1, active: 1 }</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.dispatch_jobs.createIndex({ tenantId: 1, dedupKey: 1 }, { name: "ux_tenant_dedup_key", unique: true });
 * db.dispatch_jobs.createIndex({ tenantId: 1, status: 1 }, { name: "idx_tenant_status" });
 * db.dispatch_jobs.createIndex({ tenantId: 1, _id: -1 }, { name: "idx_tenant_id" });
 * db.dispatch_jobs.createIndex({ status: 1, createdAt: 1 }, { name: "idx_status_created" });
 * db.dispatch_queue.createIndex({ state: 1, priority: -1, readyAt: 1 }, { name: "idx_queue_claim" });
 * db.dispatch_queue.createIndex({ state: 1, leaseUntil: 1 }, { name: "idx_queue_lease" });
 * db.publishing_attempts.createIndex({ nextRetryAt: 1 }, { name: "idx_attempt_retry" });
 * db.publishing_attempts.createIndex({ variationId: 1, attemptNumber: -1 }, { name: "idx_attempt_variation" });
 * db.publishing_attempts.createIndex({ tenantId: 1, attemptedAt: 1 }, { name: "idx_attempt_tenant" });
 * db.scheduled_content.createIndex({ status: 1, scheduledFor: 1 }, { name: "idx_content_due" });
 * db.scheduled_content.createIndex({ "variations.variationId": 1 }, { name: "idx_content_variation" });
 * db.scheduled_content.createIndex({ brandId: 1, scheduledFor: 1 }, { name: "idx_content_brand" });
 * db.posting_schedules.createIndex({ tenantId: 1, active: 1 }, { name: "idx_schedule_tenant" });
 * </pre>
 */
public class DispatchMongoIndexConfig {
    private static final Logger log = LoggerFactory.getLogger(DispatchMongoIndexConfig.class);

    public static final String UX_TENANT_DEDUP_KEY = "ux_tenant_dedup_key";
    public static final String IDX_TENANT_STATUS = "idx_tenant_status";
    public static final String IDX_TENANT_ID = "idx_tenant_id";
    public static final String IDX_STATUS_CREATED = "idx_status_created";
    public static final String IDX_QUEUE_CLAIM = "idx_queue_claim";
    public static final String IDX_QUEUE_LEASE = "idx_queue_lease";
    public static final String IDX_ATTEMPT_RETRY = "idx_attempt_retry";
    public static final String IDX_ATTEMPT_VARIATION = "idx_attempt_variation";
    public static final String IDX_ATTEMPT_TENANT = "idx_attempt_tenant";
    public static final String IDX_CONTENT_DUE = "idx_content_due";
    public static final String IDX_CONTENT_VARIATION = "idx_content_variation";
    public static final String IDX_CONTENT_BRAND = "idx_content_brand";
    public static final String IDX_SCHEDULE_TENANT = "idx_schedule_tenant";

    private final MongoTemplate mongoTemplate;

    public DispatchMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Creates every required index. Existing indexes with the same definition are left as is.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(dedupKeyIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(tenantStatusIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(tenantIdIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(statusCreatedIndex());

        mongoTemplate.indexOps(QueueEntryDocument.class).ensureIndex(queueClaimIndex());
        mongoTemplate.indexOps(QueueEntryDocument.class).ensureIndex(queueLeaseIndex());

        mongoTemplate.indexOps(AttemptLogDocument.class).ensureIndex(attemptRetryIndex());
        mongoTemplate.indexOps(AttemptLogDocument.class).ensureIndex(attemptVariationIndex());
        mongoTemplate.indexOps(AttemptLogDocument.class).ensureIndex(attemptTenantIndex());

        mongoTemplate.indexOps(ContentDocument.class).ensureIndex(contentDueIndex());
        mongoTemplate.indexOps(ContentDocument.class).ensureIndex(contentVariationIndex());
        mongoTemplate.indexOps(ContentDocument.class).ensureIndex(contentBrandIndex());

        mongoTemplate.indexOps(PostingScheduleDocument.class).ensureIndex(scheduleTenantIndex());
        log.info("Dispatch indexes ensured");
    }

    public static Index dedupKeyIndex() {
        return new Index()
                .on("tenantId", Sort.Direction.ASC)
                .on("dedupKey", Sort.Direction.ASC)
                .unique()
                .named(UX_TENANT_DEDUP_KEY);
    }

    public static Index tenantStatusIndex() {
        return new Index()
                .on("tenantId", Sort.Direction.ASC)
                .on("status", Sort.Direction.ASC)
                .named(IDX_TENANT_STATUS);
    }

    public static Index tenantIdIndex() {
        return new Index()
                .on("tenantId", Sort.Direction.ASC)
                .on("_id", Sort.Direction.DESC)
                .named(IDX_TENANT_ID);
    }

    public static Index statusCreatedIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_STATUS_CREATED);
    }

    /**
     * Keys: state ASC, priority DESC, readyAt ASC. Matches the claim sort.
     */
    public static Index queueClaimIndex() {
        return new Index()
                .on("state", Sort.Direction.ASC)
                .on("priority", Sort.Direction.DESC)
                .on("readyAt", Sort.Direction.ASC)
                .named(IDX_QUEUE_CLAIM);
    }

    public static Index queueLeaseIndex() {
        return new Index()
                .on("state", Sort.Direction.ASC)
                .on("leaseUntil", Sort.Direction.ASC)
                .named(IDX_QUEUE_LEASE);
    }

    public static Index attemptRetryIndex() {
        return new Index().on("nextRetryAt", Sort.Direction.ASC).named(IDX_ATTEMPT_RETRY);
    }

    public static Index attemptVariationIndex() {
        return new Index()
                .on("variationId", Sort.Direction.ASC)
                .on("attemptNumber", Sort.Direction.DESC)
                .named(IDX_ATTEMPT_VARIATION);
    }

    public static Index attemptTenantIndex() {
        return new Index()
                .on("tenantId", Sort.Direction.ASC)
                .on("attemptedAt", Sort.Direction.ASC)
                .named(IDX_ATTEMPT_TENANT);
    }

    public static Index contentDueIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("scheduledFor", Sort.Direction.ASC)
                .named(IDX_CONTENT_DUE);
    }

    public static Index contentVariationIndex() {
        return new Index().on("variations.variationId", Sort.Direction.ASC).named(IDX_CONTENT_VARIATION);
    }

    public static Index contentBrandIndex() {
        return new Index()
                .on("brandId", Sort.Direction.ASC)
                .on("scheduledFor", Sort.Direction.ASC)
                .named(IDX_CONTENT_BRAND);
    }

    public static Index scheduleTenantIndex() {
        return new Index()
                .on("tenantId", Sort.Direction.ASC)
                .on("active", Sort.Direction.ASC)
                .named(IDX_SCHEDULE_TENANT);
    }
}
