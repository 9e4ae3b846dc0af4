package io.dispatch4j.publishing;

/**
 * @param retried     retries that reached the platform or the rate limiter
 * @param skipped     due rows dropped because the variation is gone, unbound, already
 *                    published, or another pass took the row first
 */
public record RetryPassResult(int retried, int published, int failed, int rateLimited, int skipped) {

    public static RetryPassResult empty() {
        return new RetryPassResult(0, 0, 0, 0, 0);
    }
}
