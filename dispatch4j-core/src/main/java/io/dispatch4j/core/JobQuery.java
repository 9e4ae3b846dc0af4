package io.dispatch4j.core;

import java.util.Objects;

/**
 * JobQuery describes which jobs of one tenant to list and where the page starts.
 *
 * <p>This is an API-layer object. Each store translates it into its own query; the
 * ordering contract is always strictly decreasing id, with {@code cursor} exclusive.
 */
public final class JobQuery {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private final String tenantId;
    private final JobStatus status;
    private final JobType type;
    private final String parentId;
    private final String cursor;
    private final int limit;

    private JobQuery(String tenantId, JobStatus status, JobType type, String parentId, String cursor, int limit) {
        this.tenantId = tenantId;
        this.status = status;
        this.type = type;
        this.parentId = (parentId == null || parentId.isBlank()) ? null : parentId;
        this.cursor = (cursor == null || cursor.isBlank()) ? null : cursor;
        this.limit = limit;
    }

    public String tenantId() {
        return tenantId;
    }

    public JobStatus status() {
        return status;
    }

    public JobType type() {
        return type;
    }

    public String parentId() {
        return parentId;
    }

    /**
     * Id of the last job of the previous page; only ids strictly below it are returned.
     */
    public String cursor() {
        return cursor;
    }

    public int limit() {
        return limit;
    }

    public JobQuery withCursor(String cursor) {
        return new JobQuery(tenantId, status, type, parentId, cursor, limit);
    }

    public static Builder builder(String tenantId) {
        return new Builder(tenantId);
    }

    public static final class Builder {
        private final String tenantId;
        private JobStatus status;
        private JobType type;
        private String parentId;
        private String cursor;
        private int limit = DEFAULT_LIMIT;

        private Builder(String tenantId) {
            Objects.requireNonNull(tenantId, "tenantId must not be null");
            if (tenantId.isBlank()) {
                throw new IllegalArgumentException("tenantId must not be blank");
            }
            this.tenantId = tenantId;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder type(JobType type) {
            this.type = type;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder cursor(String cursor) {
            this.cursor = cursor;
            return this;
        }

        public Builder limit(int limit) {
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be a positive number");
            }
            this.limit = Math.min(limit, MAX_LIMIT);
            return this;
        }

        public JobQuery build() {
            return new JobQuery(tenantId, status, type, parentId, cursor, limit);
        }
    }
}
