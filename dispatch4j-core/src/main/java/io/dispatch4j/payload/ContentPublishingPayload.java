package io.dispatch4j.payload;

import io.dispatch4j.core.Platform;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

public record ContentPublishingPayload(
        @NotBlank String contentVariationId,
        @NotBlank String socialAccountId,
        @NotNull Platform platform,
        Instant scheduledFor
) implements JobPayload {
}
