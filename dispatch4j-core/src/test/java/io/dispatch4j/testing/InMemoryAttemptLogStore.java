package io.dispatch4j.testing;

import io.dispatch4j.publishing.AttemptOutcome;
import io.dispatch4j.publishing.PublishingAttempt;
import io.dispatch4j.spi.AttemptLogStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public class InMemoryAttemptLogStore implements AttemptLogStore {

    private final List<PublishingAttempt> rows = new ArrayList<>();
    private long seq = 0;
    private int failingAppends = 0;

    /**
     * Makes the next {@code count} appends throw, as a store outage would.
     */
    public synchronized void failNextAppends(int count) {
        this.failingAppends = count;
    }

    @Override
    public synchronized PublishingAttempt append(PublishingAttempt attempt) {
        if (failingAppends > 0) {
            failingAppends--;
            throw new IllegalStateException("attempt log unavailable");
        }
        PublishingAttempt stored = attempt.withId("attempt-" + (++seq));
        rows.add(stored);
        return stored;
    }

    public synchronized List<PublishingAttempt> rowsFor(String variationId) {
        return rows.stream().filter(r -> r.variationId().equals(variationId)).toList();
    }

    public synchronized List<PublishingAttempt> all() {
        return List.copyOf(rows);
    }

    @Override
    public synchronized Optional<PublishingAttempt> latestFor(String variationId) {
        return rows.stream()
                .filter(r -> r.variationId().equals(variationId))
                .max(Comparator.comparingInt(PublishingAttempt::attemptNumber));
    }

    @Override
    public synchronized boolean hasPendingRetry(String variationId) {
        return rows.stream().anyMatch(r -> r.variationId().equals(variationId) && r.awaitsRetry());
    }

    @Override
    public synchronized List<PublishingAttempt> findDueRetries(Instant now, int maxAttemptNumber, int limit) {
        return rows.stream()
                .filter(r -> r.outcome() != AttemptOutcome.SUCCESS)
                .filter(r -> r.nextRetryAt() != null && !r.nextRetryAt().isAfter(now))
                .filter(r -> r.attemptNumber() < maxAttemptNumber)
                .sorted(Comparator.comparing(PublishingAttempt::nextRetryAt))
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized boolean clearNextRetry(String attemptId) {
        for (int i = 0; i < rows.size(); i++) {
            PublishingAttempt r = rows.get(i);
            if (r.id().equals(attemptId)) {
                if (r.nextRetryAt() == null) {
                    return false;
                }
                rows.set(i, new PublishingAttempt(r.id(), r.tenantId(), r.contentId(), r.variationId(), r.platform(),
                        r.accountId(), r.outcome(), r.postId(), r.postUrl(), r.error(), r.attemptNumber(),
                        r.scheduledFor(), null, r.attemptedAt(), r.completedAt()));
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized List<PublishingAttempt> findByTenantSince(String tenantId, Instant since) {
        return rows.stream()
                .filter(r -> r.tenantId().equals(tenantId) && !r.attemptedAt().isBefore(since))
                .toList();
    }
}
