package com.phillippitts.autorecovery.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes recovery and probe pool metrics via Micrometer.
 *
 * <ul>
 *   <li>recovery.pool.active / recovery.pool.size - running recovery executions</li>
 *   <li>probe.pool.active / probe.pool.size - in-flight health checks</li>
 *   <li>step.pool.active / step.pool.size - in-flight step actions</li>
 * </ul>
 *
 * <p>Additionally logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> recoveryExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> probeExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> stepExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("recoveryPool") ObjectProvider<ThreadPoolTaskExecutor> recoveryExecutorProvider,
            @Qualifier("probePool") ObjectProvider<ThreadPoolTaskExecutor> probeExecutorProvider,
            @Qualifier("stepPool") ObjectProvider<ThreadPoolTaskExecutor> stepExecutorProvider) {
        this.recoveryExecutorProvider = recoveryExecutorProvider;
        this.probeExecutorProvider = probeExecutorProvider;
        this.stepExecutorProvider = stepExecutorProvider;
    }

    @Bean
    public MeterBinder recoveryPoolMetrics() {
        return registry -> {
            ThreadPoolExecutor recovery = recoveryExecutorProvider.getObject().getThreadPoolExecutor();
            ThreadPoolExecutor probe = probeExecutorProvider.getObject().getThreadPoolExecutor();
            ThreadPoolExecutor step = stepExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("recovery.pool.size", recovery, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the recovery pool")
                    .register(registry);

            Gauge.builder("recovery.pool.active", recovery, ThreadPoolExecutor::getActiveCount)
                    .description("Recovery executions currently running")
                    .register(registry);

            Gauge.builder("probe.pool.active", probe, ThreadPoolExecutor::getActiveCount)
                    .description("Health checks currently running")
                    .register(registry);

            Gauge.builder("probe.pool.size", probe, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the probe pool")
                    .register(registry);

            Gauge.builder("step.pool.active", step, ThreadPoolExecutor::getActiveCount)
                    .description("Recovery step actions currently running")
                    .register(registry);

            Gauge.builder("step.pool.size", step, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the step pool")
                    .register(registry);

            LOG.info("Recovery thread pool metrics registered: recovery.pool.*, probe.pool.*, step.pool.*");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor recovery = recoveryExecutorProvider.getObject().getThreadPoolExecutor();
        ThreadPoolExecutor probe = probeExecutorProvider.getObject().getThreadPoolExecutor();
        ThreadPoolExecutor step = stepExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Recovery pool: size={}/{}, active={}, completed={}; probe pool: {}/{} active; step pool: {}/{} active",
                recovery.getPoolSize(),
                recovery.getMaximumPoolSize(),
                recovery.getActiveCount(),
                recovery.getCompletedTaskCount(),
                probe.getActiveCount(),
                probe.getPoolSize(),
                step.getActiveCount(),
                step.getPoolSize());
    }
}
