package io.dispatch4j.publishing;

/**
 * Outcome of one {@link PublishingScheduler#runOnce()}. Counters cover the scheduled
 * pass; {@code retries} covers the retry pass that follows it.
 *
 * @param skipped true when another pass was still running and this call did nothing
 */
public record PublishPassResult(
        int processed,
        int published,
        int failed,
        int rateLimited,
        boolean skipped,
        RetryPassResult retries
) {

    static PublishPassResult skippedPass() {
        return new PublishPassResult(0, 0, 0, 0, true, RetryPassResult.empty());
    }
}
