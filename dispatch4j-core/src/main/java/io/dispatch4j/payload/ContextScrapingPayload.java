package io.dispatch4j.payload;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.hibernate.validator.constraints.URL;

/**
 * Shared by {@code SCRAPE_WEBSITE} and {@code SYNC_RSS}.
 */
public record ContextScrapingPayload(
        @NotBlank String contextSourceId,
        @NotBlank String brandId,
        @NotBlank @URL String url,
        @NotNull SourceType sourceType,
        @Positive Integer maxItems
) implements JobPayload {

    public enum SourceType {
        WEBSITE, RSS
    }
}
