package io.dispatch4j.payload;

import io.dispatch4j.core.Platform;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record AnalyticsSyncPayload(
        @NotBlank String socialAccountId,
        @NotBlank String organizationId,
        @NotNull Platform platform,
        @NotNull SyncType syncType,
        List<String> postIds
) implements JobPayload {

    public enum SyncType {
        FULL, INCREMENTAL
    }
}
