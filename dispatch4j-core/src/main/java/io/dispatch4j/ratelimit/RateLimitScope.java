package io.dispatch4j.ratelimit;

import io.dispatch4j.core.Platform;

import java.util.Objects;

/**
 * What a rate-limit counter is counting for a tenant: publish calls to one platform,
 * or jobs dispatched through the producer.
 */
public record RateLimitScope(String name, Platform platform) {

    private static final RateLimitScope JOB_DISPATCH = new RateLimitScope("jobs", null);

    public RateLimitScope {
        Objects.requireNonNull(name, "name must not be null");
    }

    public static RateLimitScope platform(Platform platform) {
        Objects.requireNonNull(platform, "platform must not be null");
        return new RateLimitScope("platform:" + platform.name(), platform);
    }

    public static RateLimitScope jobDispatch() {
        return JOB_DISPATCH;
    }

    public boolean isPlatform() {
        return platform != null;
    }
}
