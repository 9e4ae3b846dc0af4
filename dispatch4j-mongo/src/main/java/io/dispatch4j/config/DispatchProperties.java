package io.dispatch4j.config;

import io.dispatch4j.core.Platform;
import io.dispatch4j.internal.QueueReconciler;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Runtime configuration for job dispatch and scheduled publishing.
 */
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {
    private boolean enabled = true;
    private String workerId;
    private Duration processEvery = Duration.ofSeconds(5);
    private int batchSize = 5;
    private int maxConcurrency = 10;
    private Duration leaseLifetime = Duration.ofMinutes(10);
    private int maxAttempts = 3;
    private int maxActiveJobs = 50; // PENDING + RUNNING per tenant
    private int maxQueuedJobs = 200; // per tenant per rate-limit window
    private Duration rateLimitWindow = Duration.ofHours(1);
    private Map<Platform, Integer> platformLimits = new EnumMap<>(Platform.class);
    private boolean ensureIndexesOnStartup = false;

    private final Publishing publishing = new Publishing();
    private final Reconcile reconcile = new Reconcile();
    private final AutoSchedule autoSchedule = new AutoSchedule();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getLeaseLifetime() {
        return leaseLifetime;
    }

    public void setLeaseLifetime(Duration leaseLifetime) {
        this.leaseLifetime = leaseLifetime;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public int getMaxActiveJobs() {
        return maxActiveJobs;
    }

    public void setMaxActiveJobs(int maxActiveJobs) {
        this.maxActiveJobs = maxActiveJobs;
    }

    public int getMaxQueuedJobs() {
        return maxQueuedJobs;
    }

    public void setMaxQueuedJobs(int maxQueuedJobs) {
        this.maxQueuedJobs = maxQueuedJobs;
    }

    public Duration getRateLimitWindow() {
        return rateLimitWindow;
    }

    public void setRateLimitWindow(Duration rateLimitWindow) {
        this.rateLimitWindow = rateLimitWindow;
    }

    public Map<Platform, Integer> getPlatformLimits() {
        return platformLimits;
    }

    public void setPlatformLimits(Map<Platform, Integer> platformLimits) {
        this.platformLimits = platformLimits;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Publishing getPublishing() {
        return publishing;
    }

    public Reconcile getReconcile() {
        return reconcile;
    }

    public AutoSchedule getAutoSchedule() {
        return autoSchedule;
    }

    public static class Publishing {
        private boolean enabled = true;
        private String cadence = "1 minute";
        private int concurrency = 4;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCadence() {
            return cadence;
        }

        public void setCadence(String cadence) {
            this.cadence = cadence;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }
    }

    public static class Reconcile {
        private boolean enabled = true;
        private String cadence = "5 minutes";
        private Duration gracePeriod = Duration.ofMinutes(5);
        private QueueReconciler.Mode mode = QueueReconciler.Mode.REENQUEUE;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCadence() {
            return cadence;
        }

        public void setCadence(String cadence) {
            this.cadence = cadence;
        }

        public Duration getGracePeriod() {
            return gracePeriod;
        }

        public void setGracePeriod(Duration gracePeriod) {
            this.gracePeriod = gracePeriod;
        }

        public QueueReconciler.Mode getMode() {
            return mode;
        }

        public void setMode(QueueReconciler.Mode mode) {
            this.mode = mode;
        }
    }

    public static class AutoSchedule {
        private Duration horizon = Duration.ofDays(7);
        private String zone = "UTC";

        public Duration getHorizon() {
            return horizon;
        }

        public void setHorizon(Duration horizon) {
            this.horizon = horizon;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }
    }
}
