package io.dispatch4j;

import io.dispatch4j.core.JobType;
import io.dispatch4j.core.Priority;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Request to enqueue one job. Either {@code tenantId} or {@code parentId} must be set;
 * when a parent is given its owner is authoritative.
 */
public final class EnqueueRequest {

    private final JobType type;
    private final Object payload;
    private final String tenantId;
    private final String parentId;
    private final Priority priority;
    private final Instant runAt;
    private final String jobId;
    private final String retriedFrom;

    private EnqueueRequest(Builder b) {
        this.type = b.type;
        this.payload = b.payload;
        this.tenantId = blankToNull(b.tenantId);
        this.parentId = blankToNull(b.parentId);
        this.priority = b.priority;
        this.runAt = b.runAt;
        this.jobId = blankToNull(b.jobId);
        this.retriedFrom = blankToNull(b.retriedFrom);
    }

    public JobType type() {
        return type;
    }

    /**
     * Untyped payload, usually a {@code Map<String, Object>}.
     */
    public Object payload() {
        return payload;
    }

    public String tenantId() {
        return tenantId;
    }

    public String parentId() {
        return parentId;
    }

    /**
     * Null means {@link Priority#NORMAL}.
     */
    public Priority priority() {
        return priority;
    }

    /**
     * Null means now.
     */
    public Instant runAt() {
        return runAt;
    }

    /**
     * Caller-chosen dedup key, unique per tenant. Submitting it again returns the
     * tenant's existing job.
     */
    public String jobId() {
        return jobId;
    }

    public String retriedFrom() {
        return retriedFrom;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }

    public static Builder builder(JobType type, Object payload) {
        return new Builder(type, payload);
    }

    public static final class Builder {
        private final JobType type;
        private final Object payload;
        private String tenantId;
        private String parentId;
        private Priority priority;
        private Instant runAt;
        private String jobId;
        private String retriedFrom;

        private Builder(JobType type, Object payload) {
            this.type = Objects.requireNonNull(type, "type must not be null");
            this.payload = payload == null ? Map.of() : payload;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder runAt(Instant runAt) {
            this.runAt = runAt;
            return this;
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder retriedFrom(String retriedFrom) {
            this.retriedFrom = retriedFrom;
            return this;
        }

        public EnqueueRequest build() {
            return new EnqueueRequest(this);
        }
    }
}
