package io.dispatch4j.payload;

import io.dispatch4j.core.Platform;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record TokenRefreshPayload(
        @NotBlank String socialAccountId,
        @NotNull Platform platform,
        @NotBlank String organizationId
) implements JobPayload {
}
