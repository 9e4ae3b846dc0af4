package io.dispatch4j.ratelimit;

import io.dispatch4j.core.Platform;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local fixed-window rate limiter.
 *
 * <p>A window opens on the first call for a key and lasts {@code window}; expired
 * windows are reset lazily on the next call. Counters are lost on restart.
 */
public class InMemoryRateLimiter implements RateLimiter {

    public static final Duration DEFAULT_WINDOW = Duration.ofHours(1);
    public static final int DEFAULT_JOB_DISPATCH_LIMIT = 200;

    private final Clock clock;
    private final Duration window;
    private final Map<Platform, Integer> platformLimits;
    private final int jobDispatchLimit;
    private final ConcurrentHashMap<WindowKey, Window> windows = new ConcurrentHashMap<>();

    public InMemoryRateLimiter(Clock clock) {
        this(clock, DEFAULT_WINDOW, Map.of(), DEFAULT_JOB_DISPATCH_LIMIT);
    }

    /**
     * @param platformLimits overrides of {@link Platform#defaultHourlyLimit()}; missing
     *                       platforms keep their default
     */
    public InMemoryRateLimiter(Clock clock, Duration window, Map<Platform, Integer> platformLimits, int jobDispatchLimit) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.window = Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(platformLimits, "platformLimits must not be null");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be a positive duration");
        }
        if (jobDispatchLimit <= 0) {
            throw new IllegalArgumentException("jobDispatchLimit must be a positive number");
        }
        this.platformLimits = new EnumMap<>(Platform.class);
        for (Platform platform : Platform.values()) {
            this.platformLimits.put(platform, platformLimits.getOrDefault(platform, platform.defaultHourlyLimit()));
        }
        this.jobDispatchLimit = jobDispatchLimit;
    }

    @Override
    public boolean admit(String tenantId, RateLimitScope scope) {
        Objects.requireNonNull(tenantId, "tenantId must not be null");
        Objects.requireNonNull(scope, "scope must not be null");
        int limit = limitFor(scope);
        AtomicBoolean admitted = new AtomicBoolean(false);

        windows.compute(new WindowKey(tenantId, scope.name()), (key, current) -> {
            Instant now = clock.instant();
            if (current == null || current.isExpired(now)) {
                if (limit <= 0) {
                    return new Window(0, now.plus(window));
                }
                admitted.set(true);
                return new Window(1, now.plus(window));
            }
            if (current.count() < limit) {
                admitted.set(true);
                return new Window(current.count() + 1, current.resetAt());
            }
            return current;
        });
        return admitted.get();
    }

    @Override
    public int currentCount(String tenantId, RateLimitScope scope) {
        Window current = windows.get(new WindowKey(tenantId, scope.name()));
        if (current == null || current.isExpired(clock.instant())) {
            return 0;
        }
        return current.count();
    }

    @Override
    public int limitFor(RateLimitScope scope) {
        if (scope.isPlatform()) {
            return platformLimits.get(scope.platform());
        }
        return jobDispatchLimit;
    }

    /**
     * Drops expired windows of idle tenants.
     *
     * @return number of windows removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = windows.size();
        windows.entrySet().removeIf(e -> e.getValue().isExpired(now));
        return before - windows.size();
    }

    private record WindowKey(String tenantId, String scope) {
    }

    private record Window(int count, Instant resetAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(resetAt);
        }
    }
}
