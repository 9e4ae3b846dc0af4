package io.dispatch4j.internal;

import io.dispatch4j.spi.ExecutionQueue;
import io.dispatch4j.spi.QueueEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Single-process {@link ExecutionQueue}.
 *
 * <p>Completed and cancelled keys are remembered in a bounded LRU so that a late
 * duplicate enqueue is still rejected; beyond that bound the store's dedup key is the
 * only guard.
 */
public class LocalExecutionQueue implements ExecutionQueue {
    private static final Logger log = LoggerFactory.getLogger(LocalExecutionQueue.class);

    public static final int DEFAULT_COMPLETED_CAPACITY = 1000;

    private static final Comparator<Slot> DISPATCH_ORDER = Comparator
            .comparingInt((Slot s) -> s.entry.priority().value()).reversed()
            .thenComparing(s -> s.readyAt)
            .thenComparing(s -> s.entry.key());

    private enum State {WAITING, ACTIVE}

    private static final class Slot {
        private final QueueEntry entry;
        private State state = State.WAITING;
        private Instant readyAt;
        private String owner;
        private Instant leaseUntil;

        private Slot(QueueEntry entry, Instant readyAt) {
            this.entry = entry;
            this.readyAt = readyAt;
        }

        private boolean isClaimable(Instant now) {
            if (state == State.WAITING) {
                return !readyAt.isAfter(now);
            }
            return leaseUntil != null && !leaseUntil.isAfter(now);
        }
    }

    private final Clock clock;
    private final Map<String, Slot> live = new HashMap<>();
    private final Map<String, QueueEntry> completed;

    public LocalExecutionQueue(Clock clock) {
        this(clock, DEFAULT_COMPLETED_CAPACITY);
    }

    public LocalExecutionQueue(Clock clock, int completedCapacity) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (completedCapacity <= 0) {
            throw new IllegalArgumentException("completedCapacity must be a positive number");
        }
        this.completed = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, QueueEntry> eldest) {
                return size() > completedCapacity;
            }
        };
    }

    @Override
    public synchronized boolean enqueue(QueueEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        if (live.containsKey(entry.key()) || completed.containsKey(entry.key())) {
            log.debug("queue dedup hit key={}", entry.key());
            return false;
        }
        live.put(entry.key(), new Slot(entry, entry.readyAt()));
        return true;
    }

    @Override
    public synchronized List<QueueEntry> claim(String workerId, int max, Duration lease) {
        Objects.requireNonNull(workerId, "workerId must not be null");
        Objects.requireNonNull(lease, "lease must not be null");
        if (max <= 0) {
            return List.of();
        }
        Instant now = clock.instant();
        List<Slot> ready = new ArrayList<>();
        for (Slot slot : live.values()) {
            if (slot.isClaimable(now)) {
                ready.add(slot);
            }
        }
        ready.sort(DISPATCH_ORDER);

        List<QueueEntry> claimed = new ArrayList<>(Math.min(max, ready.size()));
        for (Slot slot : ready) {
            if (claimed.size() == max) {
                break;
            }
            if (slot.state == State.ACTIVE) {
                log.warn("queue lease expired; reclaiming key={} previousOwner={}", slot.entry.key(), slot.owner);
            }
            slot.state = State.ACTIVE;
            slot.owner = workerId;
            slot.leaseUntil = now.plus(lease);
            claimed.add(slot.entry);
        }
        return claimed;
    }

    /**
     * Returns a known key to waiting. A completed key is revived, which is how the
     * reconciler resubmits a job whose entry was lost.
     */
    @Override
    public synchronized void release(String key, Duration delay) {
        Objects.requireNonNull(key, "key must not be null");
        Instant readyAt = clock.instant().plus(delay == null || delay.isNegative() ? Duration.ZERO : delay);
        Slot slot = live.get(key);
        if (slot == null) {
            QueueEntry done = completed.remove(key);
            if (done == null) {
                log.warn("queue release of unknown key={}", key);
                return;
            }
            slot = new Slot(done, readyAt);
            live.put(key, slot);
        }
        slot.state = State.WAITING;
        slot.readyAt = readyAt;
        slot.owner = null;
        slot.leaseUntil = null;
    }

    @Override
    public synchronized void complete(String key) {
        Slot slot = live.remove(key);
        if (slot != null) {
            completed.put(key, slot.entry);
        }
    }

    @Override
    public synchronized boolean cancel(String key) {
        Slot slot = live.get(key);
        if (slot == null || slot.state != State.WAITING) {
            return false;
        }
        live.remove(key);
        completed.put(key, slot.entry);
        return true;
    }

    @Override
    public synchronized boolean isLive(String key) {
        return live.containsKey(key);
    }

    public synchronized int liveCount() {
        return live.size();
    }
}
