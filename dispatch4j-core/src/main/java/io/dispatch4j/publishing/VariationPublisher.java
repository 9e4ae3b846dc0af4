package io.dispatch4j.publishing;

import io.dispatch4j.ratelimit.RateLimitScope;
import io.dispatch4j.ratelimit.RateLimiter;
import io.dispatch4j.spi.AccountLookup;
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
 * Publishes single variations and records the outcome: one attempt-log row per call,
 * the variation's new status, and on request the owning unit's status.
 *
 * <p>Shared by the scheduled pass and the retry pass so both apply the same rate
 * limits, backoff and status rules.
 */
public class VariationPublisher {
    private static final Logger log = LoggerFactory.getLogger(VariationPublisher.class);

    public static final String RATE_LIMITED_ERROR = "Rate limit exceeded, will retry";
    public static final String NO_ACCOUNT_ERROR = "No account assigned";
    public static final String NOTHING_PUBLISHED_ERROR = "No variation could be published";
    public static final String ABANDONED_ERROR = "Publish attempt aborted: ";

    private final ContentStore contentStore;
    private final AttemptLogStore attemptLog;
    private final RateLimiter rateLimiter;
    private final AccountLookup accountLookup;
    private final PlatformClientRegistry clients;
    private final BackoffPolicy backoff;
    private final Clock clock;

    public VariationPublisher(ContentStore contentStore,
                              AttemptLogStore attemptLog,
                              RateLimiter rateLimiter,
                              AccountLookup accountLookup,
                              PlatformClientRegistry clients,
                              BackoffPolicy backoff,
                              Clock clock) {
        this.contentStore = Objects.requireNonNull(contentStore, "contentStore must not be null");
        this.attemptLog = Objects.requireNonNull(attemptLog, "attemptLog must not be null");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
        this.accountLookup = Objects.requireNonNull(accountLookup, "accountLookup must not be null");
        this.clients = Objects.requireNonNull(clients, "clients must not be null");
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public BackoffPolicy backoff() {
        return backoff;
    }

    /**
     * Makes attempt {@code attemptNumber} for the variation.
     */
    public AttemptOutcome attempt(ScheduledContent content, Variation variation, int attemptNumber) {
        Instant now = clock.instant();
        boolean retryLeft = backoff.hasRetriesLeft(attemptNumber);

        if (!rateLimiter.admit(content.tenantId(), RateLimitScope.platform(variation.platform()))) {
            Instant nextRetryAt = retryLeft ? now.plus(backoff.rateLimitedDelay(attemptNumber)) : null;
            attemptLog.append(row(content, variation, AttemptOutcome.RATE_LIMITED, null, RATE_LIMITED_ERROR,
                    attemptNumber, nextRetryAt, now, null));
            if (retryLeft) {
                contentStore.markVariationScheduled(variation.id(), null);
            } else {
                contentStore.markVariationFailed(variation.id(),
                        "Rate limit exceeded after " + attemptNumber + " attempts");
            }
            log.info("publish rate limited tenant={} platform={} variation={} attempt={} nextRetryAt={}",
                    content.tenantId(), variation.platform(), variation.id(), attemptNumber, nextRetryAt);
            return AttemptOutcome.RATE_LIMITED;
        }

        contentStore.markVariationPublishing(variation.id());
        PublishResult result = send(content, variation);
        Instant done = clock.instant();

        if (result.success()) {
            contentStore.markVariationPublished(variation.id(), result.postId(), result.postUrl(), done);
            attemptLog.append(row(content, variation, AttemptOutcome.SUCCESS, result, null, attemptNumber, null, now, done));
            log.info("publish succeeded platform={} variation={} postId={} attempt={}",
                    variation.platform(), variation.id(), result.postId(), attemptNumber);
            return AttemptOutcome.SUCCESS;
        }

        Instant nextRetryAt = retryLeft ? done.plus(backoff.failureDelay(attemptNumber)) : null;
        attemptLog.append(row(content, variation, AttemptOutcome.FAILED, result, result.error(),
                attemptNumber, nextRetryAt, now, null));
        if (retryLeft) {
            contentStore.markVariationScheduled(variation.id(), result.error());
        } else {
            contentStore.markVariationFailed(variation.id(), result.error());
        }
        log.warn("publish failed platform={} variation={} attempt={} nextRetryAt={} msg={}",
                variation.platform(), variation.id(), attemptNumber, nextRetryAt, result.error());
        return AttemptOutcome.FAILED;
    }

    /**
     * Makes one attempt for a {@code PUBLISH_CONTENT} job, numbered after the latest row
     * of the variation. The job runner owns the retry schedule, so the rows written here
     * carry no retry time. Unless {@code lastAttempt} is set, a denied or failed attempt
     * leaves the variation {@code SCHEDULED}.
     */
    public PublishResult attemptForJob(ScheduledContent content,
                                       Variation variation,
                                       PublishCredentials credentials,
                                       String text,
                                       boolean lastAttempt) {
        Instant now = clock.instant();
        int attemptNumber = nextAttemptNumber(variation.id());

        if (!rateLimiter.admit(content.tenantId(), RateLimitScope.platform(variation.platform()))) {
            attemptLog.append(row(content, variation, AttemptOutcome.RATE_LIMITED, null, RATE_LIMITED_ERROR,
                    attemptNumber, null, now, null));
            settleJobFailure(content, variation, lastAttempt ? "Rate limit exceeded" : null, lastAttempt);
            log.info("publish job rate limited tenant={} platform={} variation={} attempt={} lastAttempt={}",
                    content.tenantId(), variation.platform(), variation.id(), attemptNumber, lastAttempt);
            return PublishResult.failed(RATE_LIMITED_ERROR);
        }

        contentStore.markVariationPublishing(variation.id());
        PublishResult result = send(credentials, text, mediaOf(content, variation));
        Instant done = clock.instant();

        if (result.success()) {
            contentStore.markVariationPublished(variation.id(), result.postId(), result.postUrl(), done);
            attemptLog.append(row(content, variation, AttemptOutcome.SUCCESS, result, null, attemptNumber, null, now, done));
            refreshUnitStatus(content.id());
            return result;
        }

        attemptLog.append(row(content, variation, AttemptOutcome.FAILED, result, result.error(),
                attemptNumber, null, now, null));
        settleJobFailure(content, variation, result.error(), lastAttempt);
        log.warn("publish job attempt failed platform={} variation={} attempt={} lastAttempt={} msg={}",
                variation.platform(), variation.id(), attemptNumber, lastAttempt, result.error());
        return result;
    }

    public int nextAttemptNumber(String variationId) {
        return attemptLog.latestFor(variationId)
                .map(a -> a.attemptNumber() + 1)
                .orElse(1);
    }

    /**
     * Calls the platform without touching any record. Missing accounts, unsupported
     * platforms and client exceptions come back as failed results.
     */
    public PublishResult send(ScheduledContent content, Variation variation) {
        if (!variation.hasAccount()) {
            return PublishResult.failed(NO_ACCOUNT_ERROR);
        }
        Optional<PublishCredentials> credentials = accountLookup.credentialsFor(variation.accountId());
        if (credentials.isEmpty()) {
            return PublishResult.failed("Social account not found: " + variation.accountId());
        }
        if (credentials.get().platform() != variation.platform()) {
            return PublishResult.failed("Platform mismatch: account is " + credentials.get().platform()
                    + ", variation is " + variation.platform());
        }
        return send(credentials.get(), textOf(content, variation), mediaOf(content, variation));
    }

    public PublishResult send(PublishCredentials credentials, String text, List<String> mediaUrls) {
        Optional<PlatformPublishClient> client = clients.clientFor(credentials);
        if (client.isEmpty()) {
            return PublishResult.failed("Unsupported platform: " + credentials.platform());
        }
        try {
            PublishResult result = client.get().publish(new PublishRequest(text, mediaUrls));
            if (result == null) {
                return PublishResult.failed("Platform client returned no result");
            }
            return result.success() ? result : PublishResult.failed(result.error());
        } catch (Exception e) {
            log.warn("platform client threw platform={} account={} msg={}",
                    credentials.platform(), credentials.accountId(), e.getMessage(), e);
            return PublishResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getName());
        }
    }

    /**
     * Settles a variation whose attempt broke off with an exception, so that it does not
     * stay {@code PUBLISHING} or {@code SCHEDULED} without a pending retry. Unless it was
     * published meanwhile, the variation is marked {@code FAILED} with the cause; the unit
     * status is then recomputed.
     *
     * @return whether the variation was marked {@code FAILED}
     */
    public boolean abandon(String contentId, String variationId, Exception cause) {
        String error = ABANDONED_ERROR + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName());
        boolean failed = false;
        try {
            boolean published = contentStore.findById(contentId).stream()
                    .flatMap(c -> c.variations().stream())
                    .anyMatch(v -> v.id().equals(variationId) && v.status() == VariationStatus.PUBLISHED);
            if (!published) {
                contentStore.markVariationFailed(variationId, error);
                failed = true;
            }
            refreshUnitStatus(contentId);
        } catch (RuntimeException e) {
            log.error("publish variation left unsettled content={} variation={} msg={}",
                    contentId, variationId, e.getMessage(), e);
        }
        return failed;
    }

    /**
     * Recomputes the unit status from its variations: {@code PUBLISHED} when any was
     * published, {@code SCHEDULED} while any awaits a retry, {@code FAILED} otherwise.
     */
    public ContentStatus refreshUnitStatus(String contentId) {
        Optional<ScheduledContent> loaded = contentStore.findById(contentId);
        if (loaded.isEmpty()) {
            log.warn("publish unit vanished before status update content={}", contentId);
            return null;
        }
        ScheduledContent content = loaded.get();

        Optional<Variation> published = content.variations().stream()
                .filter(v -> v.status() == VariationStatus.PUBLISHED)
                .findFirst();
        if (published.isPresent()) {
            Instant publishedAt = content.publishedAt() != null
                    ? content.publishedAt()
                    : Optional.ofNullable(published.get().publishedAt()).orElseGet(clock::instant);
            contentStore.updateStatus(contentId, ContentStatus.PUBLISHED, publishedAt, null);
            return ContentStatus.PUBLISHED;
        }

        boolean pending = content.variations().stream().anyMatch(v -> attemptLog.hasPendingRetry(v.id()));
        if (pending) {
            contentStore.updateStatus(contentId, ContentStatus.SCHEDULED, null, null);
            return ContentStatus.SCHEDULED;
        }

        String error = content.variations().stream()
                .map(Variation::error)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(NOTHING_PUBLISHED_ERROR);
        contentStore.updateStatus(contentId, ContentStatus.FAILED, null, error);
        log.warn("publish unit failed content={} msg={}", contentId, error);
        return ContentStatus.FAILED;
    }

    private void settleJobFailure(ScheduledContent content, Variation variation, String error, boolean lastAttempt) {
        if (lastAttempt) {
            contentStore.markVariationFailed(variation.id(), error);
            refreshUnitStatus(content.id());
        } else {
            contentStore.markVariationScheduled(variation.id(), error);
        }
    }

    static String textOf(ScheduledContent content, Variation variation) {
        return variation.text() != null ? variation.text() : content.body();
    }

    static List<String> mediaOf(ScheduledContent content, Variation variation) {
        return variation.mediaUrl() != null ? List.of(variation.mediaUrl()) : content.mediaUrls();
    }

    private static PublishingAttempt row(ScheduledContent content,
                                         Variation variation,
                                         AttemptOutcome outcome,
                                         PublishResult result,
                                         String error,
                                         int attemptNumber,
                                         Instant nextRetryAt,
                                         Instant attemptedAt,
                                         Instant completedAt) {
        return new PublishingAttempt(
                null,
                content.tenantId(),
                content.id(),
                variation.id(),
                variation.platform(),
                variation.accountId(),
                outcome,
                result != null ? result.postId() : null,
                result != null ? result.postUrl() : null,
                error,
                attemptNumber,
                content.scheduledFor(),
                nextRetryAt,
                attemptedAt,
                completedAt
        );
    }
}
