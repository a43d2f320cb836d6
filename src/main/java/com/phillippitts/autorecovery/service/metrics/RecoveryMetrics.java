package com.phillippitts.autorecovery.service.metrics;

import com.phillippitts.autorecovery.domain.RecoveryStrategy;
import com.phillippitts.autorecovery.domain.ServiceStatus;
import com.phillippitts.autorecovery.service.recovery.RecoveryScheduler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralized metrics for health checks and recoveries.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Health check outcomes and latency</li>
 *   <li>Service status transitions per target status</li>
 *   <li>Recoveries started per strategy and finished per outcome, with duration</li>
 *   <li>Running and queued recoveries (gauges)</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 */
@Component
public class RecoveryMetrics {

    private static final String METRIC_PREFIX = "autorecovery";

    private final MeterRegistry registry;

    public RecoveryMetrics(MeterRegistry registry, RecoveryScheduler scheduler) {
        this.registry = registry;
        Gauge.builder(METRIC_PREFIX + ".recovery.active", scheduler, RecoveryScheduler::runningCount)
                .description("Recovery executions currently running")
                .register(registry);
        Gauge.builder(METRIC_PREFIX + ".recovery.queued", scheduler, RecoveryScheduler::queuedCount)
                .description("Recovery executions waiting for a slot")
                .register(registry);
    }

    /**
     * Records one health check.
     *
     * @param healthy whether the check passed
     * @param responseTimeMs time spent in the check
     */
    public void recordHealthCheck(boolean healthy, long responseTimeMs) {
        String result = healthy ? "healthy" : "unhealthy";
        Counter.builder(METRIC_PREFIX + ".health.check")
                .description("Number of health checks by result")
                .tag("result", result)
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".health.check.latency")
                .description("Time taken by service health checks")
                .register(registry)
                .record(Duration.ofMillis(responseTimeMs));
    }

    public void recordStatusChange(ServiceStatus newStatus) {
        Counter.builder(METRIC_PREFIX + ".health.transition")
                .description("Number of service status changes by target status")
                .tag("status", lower(newStatus))
                .register(registry)
                .increment();
    }

    public void recordTriggered(RecoveryStrategy strategy) {
        Counter.builder(METRIC_PREFIX + ".recovery.triggered")
                .description("Number of recoveries started by strategy")
                .tag("strategy", lower(strategy))
                .register(registry)
                .increment();
    }

    /**
     * Records a finished recovery.
     *
     * @param outcome success, failed or cancelled
     * @param duration wall time of the execution, may be null when unknown
     */
    public void recordCompleted(String outcome, Duration duration) {
        Counter.builder(METRIC_PREFIX + ".recovery.completed")
                .description("Number of finished recoveries by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        if (duration != null) {
            Timer.builder(METRIC_PREFIX + ".recovery.duration")
                    .description("Time taken by successful recoveries")
                    .register(registry)
                    .record(duration);
        }
    }

    private static String lower(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
