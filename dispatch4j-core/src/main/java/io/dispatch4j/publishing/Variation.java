package io.dispatch4j.publishing;

import io.dispatch4j.core.Platform;

import java.time.Instant;

public record Variation(
        String id,
        String contentId,
        Platform platform,
        String accountId,
        String text,
        String mediaUrl,
        VariationStatus status,
        String postId,
        String postUrl,
        Instant publishedAt,
        String error
) {

    public boolean hasAccount() {
        return accountId != null && !accountId.isBlank();
    }

    /**
     * Status allows a publish attempt by the scheduled pass.
     */
    public boolean isPublishable() {
        return status == VariationStatus.APPROVED || status == VariationStatus.SCHEDULED;
    }
}
