package io.dispatch4j.publishing;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry schedule of publishing attempts. Attempt numbers start at 1; the delay after
 * attempt {@code n} is {@code base * 2^(n-1)}, capped at {@code maxDelay}. No retry is
 * scheduled once {@code maxAttempts} is reached.
 */
public record BackoffPolicy(
        Duration rateLimitedBase,
        Duration failureBase,
        Duration maxDelay,
        int maxAttempts
) {
    public BackoffPolicy {
        Objects.requireNonNull(rateLimitedBase, "rateLimitedBase must not be null");
        Objects.requireNonNull(failureBase, "failureBase must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be a positive number");
        }
    }

    public static BackoffPolicy defaults() {
        return new BackoffPolicy(Duration.ofMinutes(15), Duration.ofMinutes(30), Duration.ofHours(6), 3);
    }

    public Duration rateLimitedDelay(int attemptNumber) {
        return widen(rateLimitedBase, attemptNumber);
    }

    public Duration failureDelay(int attemptNumber) {
        return widen(failureBase, attemptNumber);
    }

    public boolean hasRetriesLeft(int attemptNumber) {
        return attemptNumber < maxAttempts;
    }

    private Duration widen(Duration base, int attemptNumber) {
        int exp = Math.max(0, Math.min(attemptNumber - 1, 20));
        Duration d = base.multipliedBy(1L << exp);
        return d.compareTo(maxDelay) > 0 ? maxDelay : d;
    }
}
