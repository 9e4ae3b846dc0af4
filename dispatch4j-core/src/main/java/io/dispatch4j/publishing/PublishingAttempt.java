package io.dispatch4j.publishing;

import io.dispatch4j.core.Platform;

import java.time.Instant;

/**
 * One row of the append-only publishing attempt log. {@code nextRetryAt} is non-null
 * while the row still owes a retry.
 */
public record PublishingAttempt(
        String id,
        String tenantId,
        String contentId,
        String variationId,
        Platform platform,
        String accountId,
        AttemptOutcome outcome,
        String postId,
        String postUrl,
        String error,
        int attemptNumber,
        Instant scheduledFor,
        Instant nextRetryAt,
        Instant attemptedAt,
        Instant completedAt
) {

    public boolean awaitsRetry() {
        return nextRetryAt != null && outcome != AttemptOutcome.SUCCESS;
    }

    public PublishingAttempt withId(String id) {
        return new PublishingAttempt(id, tenantId, contentId, variationId, platform, accountId, outcome,
                postId, postUrl, error, attemptNumber, scheduledFor, nextRetryAt, attemptedAt, completedAt);
    }
}
