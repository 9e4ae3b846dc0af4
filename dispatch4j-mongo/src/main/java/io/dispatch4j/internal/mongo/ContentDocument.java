package io.dispatch4j.internal.mongo;

import io.dispatch4j.core.Platform;
import io.dispatch4j.publishing.ApprovalStatus;
import io.dispatch4j.publishing.ContentStatus;
import io.dispatch4j.publishing.VariationStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Content unit with its platform variations embedded.
 */
@Document(collection = "scheduled_content")
public class ContentDocument {

    @Id
    private String id;

    private String tenantId;
    private String brandId;
    private String body;
    private List<String> mediaUrls;
    private Instant scheduledFor;
    private ApprovalStatus approval;
    private ContentStatus status;
    private Instant publishedAt;
    private String error;
    private List<VariationDocument> variations = new ArrayList<>();

    public ContentDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public String getBrandId() {
        return brandId;
    }

    public void setBrandId(String brandId) {
        this.brandId = brandId;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public List<String> getMediaUrls() {
        return mediaUrls;
    }

    public void setMediaUrls(List<String> mediaUrls) {
        this.mediaUrls = mediaUrls;
    }

    public Instant getScheduledFor() {
        return scheduledFor;
    }

    public void setScheduledFor(Instant scheduledFor) {
        this.scheduledFor = scheduledFor;
    }

    public ApprovalStatus getApproval() {
        return approval;
    }

    public void setApproval(ApprovalStatus approval) {
        this.approval = approval;
    }

    public ContentStatus getStatus() {
        return status;
    }

    public void setStatus(ContentStatus status) {
        this.status = status;
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    public void setPublishedAt(Instant publishedAt) {
        this.publishedAt = publishedAt;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public List<VariationDocument> getVariations() {
        return variations;
    }

    public void setVariations(List<VariationDocument> variations) {
        this.variations = variations;
    }

    /**
     * Embedded variation. The id field is {@code variationId} so it is not mapped to
     * {@code _id}.
     */
    public static class VariationDocument {
        private String variationId;
        private Platform platform;
        private String accountId;
        private String text;
        private String mediaUrl;
        private VariationStatus status;
        private String postId;
        private String postUrl;
        private Instant publishedAt;
        private String error;

        public VariationDocument() {
        }

        public String getVariationId() {
            return variationId;
        }

        public void setVariationId(String variationId) {
            this.variationId = variationId;
        }

        public Platform getPlatform() {
            return platform;
        }

        public void setPlatform(Platform platform) {
            this.platform = platform;
        }

        public String getAccountId() {
            return accountId;
        }

        public void setAccountId(String accountId) {
            this.accountId = accountId;
        }

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text;
        }

        public String getMediaUrl() {
            return mediaUrl;
        }

        public void setMediaUrl(String mediaUrl) {
            this.mediaUrl = mediaUrl;
        }

        public VariationStatus getStatus() {
            return status;
        }

        public void setStatus(VariationStatus status) {
            this.status = status;
        }

        public String getPostId() {
            return postId;
        }

        public void setPostId(String postId) {
            this.postId = postId;
        }

        public String getPostUrl() {
            return postUrl;
        }

        public void setPostUrl(String postUrl) {
            this.postUrl = postUrl;
        }

        public Instant getPublishedAt() {
            return publishedAt;
        }

        public void setPublishedAt(Instant publishedAt) {
            this.publishedAt = publishedAt;
        }

        public String getError() {
            return error;
        }

        public void setError(String error) {
            this.error = error;
        }
    }
}
