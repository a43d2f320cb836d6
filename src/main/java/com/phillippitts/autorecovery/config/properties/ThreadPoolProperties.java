package com.phillippitts.autorecovery.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the recovery executor (one task per running recovery),
 * the probe executor (health checks), the step executor (step actions) and the
 * scheduler that drives the periodic loops.
 */
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    /** Also caps how many recoveries can run at once, whatever {@code recovery.queue.max-concurrent} says. */
    @Valid
    private PoolProperties recovery = new PoolProperties(3, 3, 0, "recovery-");

    /** Health checks. No queue, so the pool grows to max size before rejecting. */
    @Valid
    private PoolProperties probe = new PoolProperties(4, 16, 0, "probe-");

    /** Step actions. Verify steps submit their health check to the probe pool from a step thread. */
    @Valid
    private PoolProperties step = new PoolProperties(3, 12, 0, "step-");

    /** Threads for the health and queue loops. */
    @Min(1)
    private int schedulerPoolSize = 2;

    public PoolProperties getRecovery() {
        return recovery;
    }

    public void setRecovery(PoolProperties recovery) {
        this.recovery = recovery;
    }

    public PoolProperties getProbe() {
        return probe;
    }

    public void setProbe(PoolProperties probe) {
        this.probe = probe;
    }

    public PoolProperties getStep() {
        return step;
    }

    public void setStep(PoolProperties step) {
        this.step = step;
    }

    public int getSchedulerPoolSize() {
        return schedulerPoolSize;
    }

    public void setSchedulerPoolSize(int schedulerPoolSize) {
        this.schedulerPoolSize = schedulerPoolSize;
    }

    /**
     * Executor pool configuration.
     */
    public static class PoolProperties {
        @Min(1)
        private int corePoolSize;
        @Min(1)
        private int maxPoolSize;
        @PositiveOrZero
        private int queueCapacity;
        @PositiveOrZero
        private int keepAliveSeconds = 60;
        @NotBlank
        private String threadNamePrefix;

        public PoolProperties() {
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
