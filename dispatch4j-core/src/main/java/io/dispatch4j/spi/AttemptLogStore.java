package io.dispatch4j.spi;

import io.dispatch4j.publishing.PublishingAttempt;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only log of publishing attempts. The only update allowed on an existing row
 * is clearing its {@code nextRetryAt}.
 */
public interface AttemptLogStore {

    /**
     * @return the stored row with its generated id
     */
    PublishingAttempt append(PublishingAttempt attempt);

    Optional<PublishingAttempt> latestFor(String variationId);

    boolean hasPendingRetry(String variationId);

    /**
     * {@code RATE_LIMITED|FAILED} rows with {@code nextRetryAt <= now} and
     * {@code attemptNumber < maxAttemptNumber}, oldest retry time first.
     */
    List<PublishingAttempt> findDueRetries(Instant now, int maxAttemptNumber, int limit);

    /**
     * Clears the row's retry time.
     *
     * @return false when it was already cleared, so another pass owns the retry
     */
    boolean clearNextRetry(String attemptId);

    List<PublishingAttempt> findByTenantSince(String tenantId, Instant since);
}
