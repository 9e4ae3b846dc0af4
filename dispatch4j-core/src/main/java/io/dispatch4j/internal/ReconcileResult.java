package io.dispatch4j.internal;

/**
 * @param scanned    {@code PENDING} jobs past the grace period that were checked
 * @param orphaned   of those, jobs with no live queue entry
 * @param reenqueued orphans handed back to the queue
 * @param failed     orphans marked {@code FAILED}
 */
public record ReconcileResult(int scanned, int orphaned, int reenqueued, int failed) {
}
