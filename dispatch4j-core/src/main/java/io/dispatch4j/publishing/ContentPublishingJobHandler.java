package io.dispatch4j.publishing;

import io.dispatch4j.DispatchException;
import io.dispatch4j.JobHandler;
import io.dispatch4j.NonRetryableJobException;
import io.dispatch4j.core.JobRecord;
import io.dispatch4j.core.JobType;
import io.dispatch4j.core.Platform;
import io.dispatch4j.payload.ContentPublishingPayload;
import io.dispatch4j.spi.AccountLookup;
import io.dispatch4j.spi.ContentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Publishes one variation on request ({@code PUBLISH_CONTENT} jobs).
 *
 * <p>Problems another attempt cannot fix (unknown variation or account, platform
 * mismatch, expired token, text over the platform limit) fail the job at once. The
 * publish itself goes through {@link VariationPublisher#attemptForJob}, so the platform
 * rate limit and the attempt log apply as on the scheduled path. A denial or platform
 * error is thrown as retryable; the variation is only marked {@code FAILED} on the
 * job's last attempt.
 */
public class ContentPublishingJobHandler implements JobHandler<ContentPublishingPayload> {
    private static final Logger log = LoggerFactory.getLogger(ContentPublishingJobHandler.class);

    private final ContentStore contentStore;
    private final AccountLookup accountLookup;
    private final VariationPublisher publisher;
    private final Clock clock;

    public ContentPublishingJobHandler(ContentStore contentStore,
                                       AccountLookup accountLookup,
                                       VariationPublisher publisher,
                                       Clock clock) {
        this.contentStore = Objects.requireNonNull(contentStore, "contentStore must not be null");
        this.accountLookup = Objects.requireNonNull(accountLookup, "accountLookup must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public JobType type() {
        return JobType.PUBLISH_CONTENT;
    }

    @Override
    public Class<ContentPublishingPayload> payloadClass() {
        return ContentPublishingPayload.class;
    }

    @Override
    public Object execute(JobRecord job, ContentPublishingPayload payload) {
        String variationId = payload.contentVariationId();
        ScheduledContent content = contentStore.findByVariationId(variationId)
                .filter(c -> c.tenantId().equals(job.tenantId()))
                .orElseThrow(() -> new NonRetryableJobException("Content variation not found: " + variationId));
        Variation variation = content.variations().stream()
                .filter(v -> v.id().equals(variationId))
                .findFirst()
                .orElseThrow(() -> new NonRetryableJobException("Content variation not found: " + variationId));

        if (variation.status() == VariationStatus.PUBLISHED) {
            log.info("publish job found variation already published variation={} postId={}", variationId, variation.postId());
            return result(variation.postId(), variation.postUrl(), variation.publishedAt());
        }

        PublishCredentials credentials = accountLookup.credentialsFor(payload.socialAccountId())
                .orElseThrow(() -> new NonRetryableJobException("Social account not found: " + payload.socialAccountId()));
        if (credentials.platform() != payload.platform() || variation.platform() != payload.platform()) {
            throw new NonRetryableJobException("Platform mismatch: account is " + credentials.platform()
                    + ", variation is " + variation.platform() + ", requested " + payload.platform());
        }
        if (credentials.expiresAt() != null && !credentials.expiresAt().isAfter(clock.instant())) {
            throw new NonRetryableJobException("Social account token has expired. Please reconnect the account.");
        }

        String text = prepareContent(VariationPublisher.textOf(content, variation), payload.platform());
        if (payload.platform().exceedsCharacterLimit(text)) {
            throw new NonRetryableJobException("Content exceeds " + payload.platform() + " limit: "
                    + text.length() + " > " + payload.platform().characterLimit());
        }

        boolean lastAttempt = !job.hasAttemptsLeft();
        PublishResult published;
        try {
            published = publisher.attemptForJob(content, variation, credentials, text, lastAttempt);
        } catch (RuntimeException e) {
            if (lastAttempt) {
                publisher.abandon(content.id(), variationId, e);
            }
            throw e;
        }
        if (!published.success()) {
            throw new DispatchException(published.error());
        }

        Variation stored = contentStore.findByVariationId(variationId)
                .flatMap(c -> c.variations().stream().filter(v -> v.id().equals(variationId)).findFirst())
                .orElse(variation);
        Instant publishedAt = stored.publishedAt() != null ? stored.publishedAt() : clock.instant();
        log.info("publish job succeeded platform={} variation={} postId={}", payload.platform(), variationId, published.postId());
        return result(published.postId(), published.postUrl(), publishedAt);
    }

    static String prepareContent(String text, Platform platform) {
        if (text == null) {
            return "";
        }
        if (platform == Platform.LINKEDIN) {
            return text.replaceAll("\\n{3,}", "\n\n").trim();
        }
        return text.trim();
    }

    private static Map<String, Object> result(String postId, String postUrl, Instant publishedAt) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("postId", postId);
        result.put("postUrl", postUrl);
        result.put("publishedAt", publishedAt == null ? null : publishedAt.toString());
        return result;
    }
}
