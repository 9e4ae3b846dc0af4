package io.dispatch4j.config;

import io.dispatch4j.internal.CadenceTrigger;
import io.dispatch4j.internal.JobRunner;
import org.springframework.context.SmartLifecycle;

import java.util.List;
import java.util.Objects;

/**
 * Bridges the runner and the cadence triggers with the Spring container lifecycle.
 * Triggers start after the runner and stop before it.
 */
public class DispatchLifecycle implements SmartLifecycle {
    private final JobRunner runner;
    private final List<CadenceTrigger> triggers;
    private volatile boolean running = false;

    public DispatchLifecycle(JobRunner runner, List<CadenceTrigger> triggers) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.triggers = List.copyOf(Objects.requireNonNull(triggers, "triggers must not be null"));
    }

    @Override
    public void start() {
        runner.start();
        for (CadenceTrigger trigger : triggers) {
            trigger.start();
        }
        running = true;
    }

    @Override
    public void stop() {
        for (CadenceTrigger trigger : triggers) {
            trigger.stop();
        }
        runner.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
