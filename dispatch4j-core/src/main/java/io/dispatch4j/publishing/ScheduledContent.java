package io.dispatch4j.publishing;

import java.time.Instant;
import java.util.List;

/**
 * A unit of content scheduled for publishing, with one variation per target platform.
 */
public record ScheduledContent(
        String id,
        String tenantId,
        String brandId,
        String body,
        List<String> mediaUrls,
        Instant scheduledFor,
        ApprovalStatus approval,
        ContentStatus status,
        Instant publishedAt,
        String error,
        List<Variation> variations
) {
    public ScheduledContent {
        mediaUrls = mediaUrls == null ? List.of() : List.copyOf(mediaUrls);
        variations = variations == null ? List.of() : List.copyOf(variations);
    }
}
