package io.dispatch4j.internal;

import io.dispatch4j.utils.CadenceParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a task on a cadence (see {@link CadenceParser}). The next run is scheduled only
 * after the previous one returned, so runs never overlap. A failing run is logged and
 * does not stop the trigger.
 */
public class CadenceTrigger {
    private static final Logger log = LoggerFactory.getLogger(CadenceTrigger.class);

    private final String name;
    private final String cadence;
    private final ZoneId zone;
    private final Clock clock;
    private final Runnable task;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private ScheduledExecutorService executor;

    public CadenceTrigger(String name, String cadence, ZoneId zone, Clock clock, Runnable task) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.cadence = Objects.requireNonNull(cadence, "cadence must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.task = Objects.requireNonNull(task, "task must not be null");
        // fail fast on a bad cadence
        CadenceParser.nextRunAt(cadence, zone, clock.instant());
    }

    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("dispatch." + name);
            t.setDaemon(true);
            return t;
        });
        log.info("Cadence trigger started name={} cadence={} zone={}", name, cadence, zone);
        scheduleNext();
    }

    public synchronized void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        executor.shutdownNow();
        executor = null;
        log.info("Cadence trigger stopped name={}", name);
    }

    public boolean isRunning() {
        return started.get();
    }

    private synchronized void scheduleNext() {
        if (!started.get() || executor == null) {
            return;
        }
        Duration delay = CadenceParser.delayUntilNext(cadence, zone, clock.instant());
        executor.schedule(this::fire, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
    }

    private void fire() {
        try {
            task.run();
        } catch (Exception e) {
            log.error("dispatch {} run failed msg={}", name, e.getMessage(), e);
        } finally {
            scheduleNext();
        }
    }
}
