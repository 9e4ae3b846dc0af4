package io.dispatch4j.publishing;

import io.dispatch4j.core.Platform;

import java.util.Map;

/**
 * Attempt counts of one tenant over a look-back window.
 */
public record PublishingStats(
        int total,
        int success,
        int failed,
        int rateLimited,
        Map<Platform, PlatformCounts> byPlatform
) {
    public record PlatformCounts(int success, int failed) {
    }
}
