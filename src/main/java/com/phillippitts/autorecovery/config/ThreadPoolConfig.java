package com.phillippitts.autorecovery.config;

import com.phillippitts.autorecovery.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools and time source used by the recovery engine.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on the number of supervised services.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor running one task per RUNNING recovery execution.
     *
     * <p>The scheduler never submits more tasks than {@code recovery.queue.max-concurrent},
     * so the pool is sized to match and rejects instead of queueing: a rejected execution is
     * put back in the queue by the scheduler.
     *
     * <p>MDC propagation: copies Log4j2 ThreadContext from the dispatching thread so the
     * execution's log lines keep their correlation values.
     *
     * @return executor for recovery executions
     */
    @Bean(name = "recoveryPool")
    public ThreadPoolTaskExecutor recoveryPool() {
        ThreadPoolProperties.PoolProperties props = threadPoolProperties.getRecovery();
        ThreadPoolTaskExecutor executor = newExecutor(props);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * Executor for health checks. The caller waits on the returned future and cancels it
     * on timeout.
     *
     * <p>The default queue capacity is 0: a {@link ThreadPoolExecutor} only grows past its core
     * size once the queue is full, so with a queue a few checks that ignore interruption would
     * leave every later check waiting behind them until its own deadline passed.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Running the task on the
     * caller thread would defeat the timeout, so a saturated pool counts as a failed check.
     *
     * @return executor for deadline-bound health checks
     */
    @Bean(name = "probePool")
    public ThreadPoolTaskExecutor probePool() {
        return deadlinePool(threadPoolProperties.getProbe());
    }

    /**
     * Executor for recovery step actions, separate from {@link #probePool()}: a verify step
     * runs here and submits its health check to the probe pool, so it never waits on a
     * worker of its own pool.
     *
     * @return executor for deadline-bound step actions
     */
    @Bean(name = "stepPool")
    public ThreadPoolTaskExecutor stepPool() {
        return deadlinePool(threadPoolProperties.getStep());
    }

    /**
     * Scheduler driving the health-check and queue-dispatch loops.
     */
    @Bean(name = "recoveryTaskScheduler")
    public ThreadPoolTaskScheduler recoveryTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(threadPoolProperties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("recovery-loop-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public Clock recoveryClock() {
        return Clock.systemUTC();
    }

    private static ThreadPoolTaskExecutor deadlinePool(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = newExecutor(props);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    private static ThreadPoolTaskExecutor newExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setTaskDecorator(mdcPropagatingDecorator());
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
