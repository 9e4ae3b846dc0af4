package io.dispatch4j.spi;

import java.time.Duration;
import java.util.List;

/**
 * Priority-ordered, delayable work queue with dedup on the entry key.
 *
 * <p>An entry is WAITING until claimed, ACTIVE while a worker holds its lease, and
 * COMPLETED afterwards. A key stays known in every state, so enqueueing it again is
 * rejected.
 */
public interface ExecutionQueue {

    /**
     * @return false when the key is already known
     */
    boolean enqueue(QueueEntry entry);

    /**
     * Leases up to {@code max} ready entries to {@code workerId}: waiting entries whose
     * ready time has passed and active entries whose lease expired. Ordered by priority
     * descending, then ready time ascending.
     */
    List<QueueEntry> claim(String workerId, int max, Duration lease);

    /**
     * Returns an active entry to waiting, ready after {@code delay}.
     */
    void release(String key, Duration delay);

    void complete(String key);

    /**
     * Removes a waiting entry.
     *
     * @return true when an entry was removed
     */
    boolean cancel(String key);

    /**
     * True while the key is waiting or active.
     */
    boolean isLive(String key);
}
