package com.phillippitts.autorecovery.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for health monitoring and recovery scheduling.
 *
 * <p>Prefix {@code recovery}. Defaults match the orchestrator's historical constants:
 * 10s health-check interval, 5s check timeout, 5s queue interval, 3 concurrent recoveries
 * and a 60s retention window for completed executions.
 */
@ConfigurationProperties(prefix = "recovery")
@Validated
public class RecoveryProperties {

    /** Start the health-check and queue-dispatch loops with the application context. */
    private boolean enabled = true;

    @Valid
    private Health health = new Health();

    @Valid
    private Queue queue = new Queue();

    @Valid
    private Failover failover = new Failover();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Health getHealth() {
        return health;
    }

    public void setHealth(Health health) {
        this.health = health;
    }

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue;
    }

    public Failover getFailover() {
        return failover;
    }

    public void setFailover(Failover failover) {
        this.failover = failover;
    }

    /**
     * Health monitor settings.
     */
    public static class Health {

        @NotNull
        private Duration interval = Duration.ofSeconds(10);

        @NotNull
        private Duration checkTimeout = Duration.ofSeconds(5);

        /** Consecutive failures at which a service becomes DEGRADED. */
        @Positive(message = "Degraded threshold must be positive")
        private int degradedThreshold = 1;

        /** Consecutive failures at which a service becomes UNHEALTHY. */
        @Positive(message = "Unhealthy threshold must be positive")
        private int unhealthyThreshold = 3;

        /** Consecutive failures at which a service becomes FAILED. */
        @Positive(message = "Failed threshold must be positive")
        private int failedThreshold = 5;

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getCheckTimeout() {
            return checkTimeout;
        }

        public void setCheckTimeout(Duration checkTimeout) {
            this.checkTimeout = checkTimeout;
        }

        public int getDegradedThreshold() {
            return degradedThreshold;
        }

        public void setDegradedThreshold(int degradedThreshold) {
            this.degradedThreshold = degradedThreshold;
        }

        public int getUnhealthyThreshold() {
            return unhealthyThreshold;
        }

        public void setUnhealthyThreshold(int unhealthyThreshold) {
            this.unhealthyThreshold = unhealthyThreshold;
        }

        public int getFailedThreshold() {
            return failedThreshold;
        }

        public void setFailedThreshold(int failedThreshold) {
            this.failedThreshold = failedThreshold;
        }
    }

    /**
     * Recovery queue settings.
     */
    public static class Queue {

        @NotNull
        private Duration interval = Duration.ofSeconds(5);

        @Positive(message = "Max concurrent recoveries must be positive")
        private int maxConcurrent = 3;

        /** How long finished executions stay inspectable before being purged. */
        @NotNull
        private Duration completedRetention = Duration.ofSeconds(60);

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getMaxConcurrent() {
            return maxConcurrent;
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
        }

        public Duration getCompletedRetention() {
            return completedRetention;
        }

        public void setCompletedRetention(Duration completedRetention) {
            this.completedRetention = completedRetention;
        }
    }

    /**
     * Failover wiring: service name to backup service name.
     */
    public static class Failover {

        private Map<String, String> targets = new LinkedHashMap<>();

        public Map<String, String> getTargets() {
            return targets;
        }

        public void setTargets(Map<String, String> targets) {
            this.targets = targets;
        }
    }
}
