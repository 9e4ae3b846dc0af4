package io.dispatch4j.publishing;

import io.dispatch4j.spi.AttemptLogStore;
import io.dispatch4j.spi.ContentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Periodic publishing pass over due content.
 *
 * <p>Units are published concurrently on a bounded pool; the variations of one unit
 * are published one after another and the unit status is settled once all of them
 * are done. A call made while a pass is running returns immediately with
 * {@code skipped == true}.
 */
public class PublishingScheduler {
    private static final Logger log = LoggerFactory.getLogger(PublishingScheduler.class);

    public static final int DEFAULT_CONCURRENCY = 4;

    private final ContentStore contentStore;
    private final AttemptLogStore attemptLog;
    private final VariationPublisher publisher;
    private final RetryBackoffManager retries;
    private final Clock clock;
    private final int concurrency;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger threadSeq = new AtomicInteger();

    public PublishingScheduler(ContentStore contentStore,
                               AttemptLogStore attemptLog,
                               VariationPublisher publisher,
                               RetryBackoffManager retries,
                               Clock clock,
                               int concurrency) {
        this.contentStore = Objects.requireNonNull(contentStore, "contentStore must not be null");
        this.attemptLog = Objects.requireNonNull(attemptLog, "attemptLog must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.retries = Objects.requireNonNull(retries, "retries must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be a positive number");
        }
        this.concurrency = concurrency;
    }

    public PublishPassResult runOnce() {
        if (!running.compareAndSet(false, true)) {
            log.debug("publish pass already running; skipping");
            return PublishPassResult.skippedPass();
        }
        try {
            Counters counters = new Counters();
            Instant now = clock.instant();
            List<ScheduledContent> due = contentStore.findDue(now);
            if (!due.isEmpty()) {
                log.info("publish pass found due units count={} at={}", due.size(), now);
                publishAll(due, counters);
            }

            RetryPassResult retried = retries.runOnce();
            PublishPassResult result = new PublishPassResult(
                    counters.processed.get(),
                    counters.published.get(),
                    counters.failed.get(),
                    counters.rateLimited.get(),
                    false,
                    retried);
            log.debug("publish pass done processed={} published={} failed={} rateLimited={}",
                    result.processed(), result.published(), result.failed(), result.rateLimited());
            return result;
        } finally {
            running.set(false);
        }
    }

    private void publishAll(List<ScheduledContent> due, Counters counters) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(concurrency, due.size()), r -> {
            Thread t = new Thread(r);
            t.setName("dispatch.publisher-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<?>> futures = new ArrayList<>(due.size());
            for (ScheduledContent unit : due) {
                futures.add(pool.submit(() -> publishUnit(unit, counters)));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    log.error("publish unit failed content={} msg={}", due.get(i).id(), cause.getMessage(), cause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("publish pass interrupted; {} units left unsettled", futures.size() - i);
                    return;
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private void publishUnit(ScheduledContent unit, Counters counters) {
        counters.processed.incrementAndGet();
        contentStore.updateStatus(unit.id(), ContentStatus.PUBLISHING, null, null);

        for (Variation variation : unit.variations()) {
            if (!variation.isPublishable() || !variation.hasAccount()) {
                continue;
            }
            if (attemptLog.hasPendingRetry(variation.id())) {
                continue;
            }
            int attemptNumber = publisher.nextAttemptNumber(variation.id());

            try {
                switch (publisher.attempt(unit, variation, attemptNumber)) {
                    case SUCCESS -> counters.published.incrementAndGet();
                    case FAILED -> counters.failed.incrementAndGet();
                    case RATE_LIMITED -> counters.rateLimited.incrementAndGet();
                }
            } catch (RuntimeException e) {
                log.error("publish attempt could not be recorded content={} variation={} msg={}",
                        unit.id(), variation.id(), e.getMessage(), e);
                if (publisher.abandon(unit.id(), variation.id(), e)) {
                    counters.failed.incrementAndGet();
                }
            }
        }

        publisher.refreshUnitStatus(unit.id());
    }

    private static final class Counters {
        private final AtomicInteger processed = new AtomicInteger();
        private final AtomicInteger published = new AtomicInteger();
        private final AtomicInteger failed = new AtomicInteger();
        private final AtomicInteger rateLimited = new AtomicInteger();
    }
}
