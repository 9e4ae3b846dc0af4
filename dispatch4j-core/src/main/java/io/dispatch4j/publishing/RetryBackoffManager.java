package io.dispatch4j.publishing;

import io.dispatch4j.spi.AttemptLogStore;
import io.dispatch4j.spi.ContentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Re-attempts publishing for attempt rows whose retry time has come.
 *
 * <p>Each due row is claimed by clearing its {@code nextRetryAt}; the new attempt is
 * appended as a fresh row numbered one higher. The owning unit's status is recomputed
 * after every retry. A retry that breaks off with an exception once its row is claimed
 * fails the variation through {@link VariationPublisher#abandon}.
 */
public class RetryBackoffManager {
    private static final Logger log = LoggerFactory.getLogger(RetryBackoffManager.class);

    public static final int DEFAULT_BATCH_SIZE = 10;

    private final ContentStore contentStore;
    private final AttemptLogStore attemptLog;
    private final VariationPublisher publisher;
    private final Clock clock;
    private final int batchSize;

    public RetryBackoffManager(ContentStore contentStore,
                               AttemptLogStore attemptLog,
                               VariationPublisher publisher,
                               Clock clock) {
        this(contentStore, attemptLog, publisher, clock, DEFAULT_BATCH_SIZE);
    }

    public RetryBackoffManager(ContentStore contentStore,
                               AttemptLogStore attemptLog,
                               VariationPublisher publisher,
                               Clock clock,
                               int batchSize) {
        this.contentStore = Objects.requireNonNull(contentStore, "contentStore must not be null");
        this.attemptLog = Objects.requireNonNull(attemptLog, "attemptLog must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be a positive number");
        }
        this.batchSize = batchSize;
    }

    public RetryPassResult runOnce() {
        Instant now = clock.instant();
        List<PublishingAttempt> due = attemptLog.findDueRetries(now, publisher.backoff().maxAttempts(), batchSize);
        if (due.isEmpty()) {
            return RetryPassResult.empty();
        }

        int retried = 0;
        int published = 0;
        int failed = 0;
        int rateLimited = 0;
        int skipped = 0;

        for (PublishingAttempt row : due) {
            boolean claimed = false;
            try {
                if (!attemptLog.clearNextRetry(row.id())) {
                    skipped++;
                    continue;
                }
                claimed = true;

                Optional<ScheduledContent> content = contentStore.findById(row.contentId());
                Optional<Variation> variation = content.flatMap(c -> c.variations().stream()
                        .filter(v -> v.id().equals(row.variationId()))
                        .findFirst());

                if (variation.isEmpty()) {
                    log.debug("publish retry dropped; variation gone attempt={} variation={}", row.id(), row.variationId());
                    skipped++;
                    continue;
                }
                Variation v = variation.get();
                if (v.status() == VariationStatus.PUBLISHED) {
                    skipped++;
                    continue;
                }
                if (!v.hasAccount()) {
                    contentStore.markVariationFailed(v.id(), VariationPublisher.NO_ACCOUNT_ERROR);
                    publisher.refreshUnitStatus(row.contentId());
                    skipped++;
                    continue;
                }

                retried++;
                switch (publisher.attempt(content.get(), v, row.attemptNumber() + 1)) {
                    case SUCCESS -> published++;
                    case FAILED -> failed++;
                    case RATE_LIMITED -> rateLimited++;
                }
                publisher.refreshUnitStatus(row.contentId());
            } catch (Exception e) {
                log.error("publish retry failed attempt={} variation={} msg={}", row.id(), row.variationId(), e.getMessage(), e);
                // a claimed row no longer carries a retry time; nothing would pick the variation up again
                if (claimed && publisher.abandon(row.contentId(), row.variationId(), e)) {
                    failed++;
                }
            }
        }

        log.info("publish retry pass due={} retried={} published={} failed={} rateLimited={} skipped={}",
                due.size(), retried, published, failed, rateLimited, skipped);
        return new RetryPassResult(retried, published, failed, rateLimited, skipped);
    }
}
