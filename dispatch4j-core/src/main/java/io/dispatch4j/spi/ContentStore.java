package io.dispatch4j.spi;

import io.dispatch4j.publishing.ContentStatus;
import io.dispatch4j.publishing.ScheduledContent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Access to scheduled content units and their variations.
 */
public interface ContentStore {

    /**
     * Units in {@code SCHEDULED} status, approved or auto-approved, whose scheduled time
     * is at or before {@code now}.
     */
    List<ScheduledContent> findDue(Instant now);

    Optional<ScheduledContent> findById(String contentId);

    Optional<ScheduledContent> findByVariationId(String variationId);

    void updateStatus(String contentId, ContentStatus status, Instant publishedAt, String error);

    void markVariationPublishing(String variationId);

    void markVariationPublished(String variationId, String postId, String postUrl, Instant publishedAt);

    /**
     * Back to {@code SCHEDULED} awaiting a retry; {@code error} may be null.
     */
    void markVariationScheduled(String variationId, String error);

    void markVariationFailed(String variationId, String error);

    /**
     * Scheduled times of the brand's {@code SCHEDULED} units within {@code [from, to]}.
     */
    List<Instant> findScheduledSlots(String brandId, Instant from, Instant to);

    /**
     * Sets the unit's scheduled time and moves it to {@code SCHEDULED}, together with its
     * {@code PENDING|APPROVED} variations.
     *
     * @return false when no unit with this id belongs to the tenant
     */
    boolean assignSchedule(String tenantId, String contentId, Instant slot);
}
