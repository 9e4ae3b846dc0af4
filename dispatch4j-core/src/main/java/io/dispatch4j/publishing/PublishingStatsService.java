package io.dispatch4j.publishing;

import io.dispatch4j.core.Platform;
import io.dispatch4j.spi.AttemptLogStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class PublishingStatsService {

    public static final int DEFAULT_DAYS = 7;

    private final AttemptLogStore attemptLog;
    private final Clock clock;

    public PublishingStatsService(AttemptLogStore attemptLog, Clock clock) {
        this.attemptLog = Objects.requireNonNull(attemptLog, "attemptLog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public PublishingStats stats(String tenantId) {
        return stats(tenantId, DEFAULT_DAYS);
    }

    public PublishingStats stats(String tenantId, int days) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        if (days <= 0) {
            throw new IllegalArgumentException("days must be a positive number");
        }
        Instant since = clock.instant().minus(Duration.ofDays(days));
        List<PublishingAttempt> rows = attemptLog.findByTenantSince(tenantId, since);

        int success = 0;
        int failed = 0;
        int rateLimited = 0;
        Map<Platform, int[]> perPlatform = new EnumMap<>(Platform.class);
        for (PublishingAttempt row : rows) {
            int[] counts = perPlatform.computeIfAbsent(row.platform(), p -> new int[2]);
            switch (row.outcome()) {
                case SUCCESS -> {
                    success++;
                    counts[0]++;
                }
                case FAILED -> {
                    failed++;
                    counts[1]++;
                }
                case RATE_LIMITED -> rateLimited++;
            }
        }

        Map<Platform, PublishingStats.PlatformCounts> byPlatform = new EnumMap<>(Platform.class);
        perPlatform.forEach((p, c) -> byPlatform.put(p, new PublishingStats.PlatformCounts(c[0], c[1])));
        return new PublishingStats(rows.size(), success, failed, rateLimited, Collections.unmodifiableMap(byPlatform));
    }
}
