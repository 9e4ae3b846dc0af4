package io.dispatch4j.ratelimit;

/**
 * Fixed-window admission control keyed by (tenant, scope).
 *
 * <p>{@link InMemoryRateLimiter} keeps its counters in the process; deployments with
 * several processes that need a global limit provide a shared-counter implementation.
 */
public interface RateLimiter {

    /**
     * Counts one call and returns true, or returns false without counting when the
     * window is full.
     */
    boolean admit(String tenantId, RateLimitScope scope);

    /**
     * Calls counted in the current window; 0 when the window has expired.
     */
    int currentCount(String tenantId, RateLimitScope scope);

    int limitFor(RateLimitScope scope);
}
