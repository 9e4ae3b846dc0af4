package io.dispatch4j.core;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Input to {@link io.dispatch4j.spi.JobStore#create(NewJob)}. {@code dedupKey} is unique
 * per tenant; a null key means the store-generated id doubles as the dedup key.
 */
public record NewJob(
        String dedupKey,
        JobType type,
        String tenantId,
        String parentId,
        Map<String, Object> payload,
        Priority priority,
        int maxAttempts,
        Instant runAt,
        String retriedFrom
) {
    public NewJob {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
        Objects.requireNonNull(runAt, "runAt must not be null");
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be a positive number");
        }
        payload = payload == null ? Map.of() : payload;
    }
}
