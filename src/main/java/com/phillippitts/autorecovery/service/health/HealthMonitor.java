package com.phillippitts.autorecovery.service.health;

import com.phillippitts.autorecovery.config.properties.RecoveryProperties;
import com.phillippitts.autorecovery.domain.ServiceStatus;
import com.phillippitts.autorecovery.service.metrics.RecoveryMetrics;
import com.phillippitts.autorecovery.service.recovery.RecoveryScheduler;
import com.phillippitts.autorecovery.service.registry.HealthRecord;
import com.phillippitts.autorecovery.service.registry.ServiceRegistry;
import com.phillippitts.autorecovery.util.Deadline;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodically health-checks every registered service and drives its status.
 *
 * <p>Status after a check is derived from the failure streak via {@link HealthStateMachine},
 * except:
 * <ul>
 *   <li>a status forced since the last check is kept for this check</li>
 *   <li>RECOVERING is never left by a check; a healthy check releases it only through
 *       {@link RecoveryScheduler#releaseIfIdle}, which refuses while an execution is PENDING or RUNNING</li>
 * </ul>
 * A failed check that leaves the service UNHEALTHY or FAILED with no active execution
 * triggers a recovery with cause {@code auto}.
 *
 * <p>The loop runs with a fixed delay, so a slow tick postpones the next one instead of
 * overlapping it.
 */
@Component
public class HealthMonitor implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(HealthMonitor.class);

    static final String AUTO_CAUSE = "auto";

    private final ServiceRegistry registry;
    private final HealthProbe probe;
    private final HealthStateMachine stateMachine;
    private final ErrorReporter errorReporter;
    private final RecoveryScheduler scheduler;
    private final RecoveryMetrics metrics;
    private final TaskScheduler taskScheduler;
    private final RecoveryProperties props;
    private final Clock clock;

    private volatile ScheduledFuture<?> loop;

    public HealthMonitor(ServiceRegistry registry,
                         HealthProbe probe,
                         HealthStateMachine stateMachine,
                         ErrorReporter errorReporter,
                         RecoveryScheduler scheduler,
                         RecoveryMetrics metrics,
                         @Qualifier("recoveryTaskScheduler") TaskScheduler taskScheduler,
                         RecoveryProperties props,
                         Clock clock) {
        this.registry = registry;
        this.probe = probe;
        this.stateMachine = stateMachine;
        this.errorReporter = errorReporter;
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.taskScheduler = taskScheduler;
        this.props = props;
        this.clock = clock;
    }

    /** Checks every registered service once. */
    public void tick() {
        for (String name : registry.names()) {
            try {
                check(name);
            } catch (RuntimeException e) {
                LOG.error("Health check bookkeeping failed for service={}", name, e);
            }
        }
    }

    /**
     * Checks one service and applies the outcome.
     *
     * @return true if the check triggered a recovery
     */
    boolean check(String name) {
        if (!registry.isRegistered(name)) {
            return false;
        }
        Object service = registry.handle(name).orElse(null);
        Deadline deadline = Deadline.after(props.getHealth().getCheckTimeout(), clock);
        HealthProbe.Outcome outcome = probe.probe(service, deadline);
        metrics.recordHealthCheck(outcome.healthy(), outcome.responseTimeMs());

        Verdict verdict = registry.update(name, r -> apply(r, outcome)).orElse(Verdict.NONE);
        if (verdict == Verdict.RELEASE) {
            scheduler.releaseIfIdle(name);
        }
        boolean shouldTrigger = verdict == Verdict.TRIGGER && !scheduler.hasActive(name);

        if (!outcome.healthy()) {
            int failures = registry.get(name).map(h -> h.consecutiveFailures()).orElse(0);
            report(name, outcome, failures);
        }
        if (shouldTrigger) {
            LOG.warn("Service {} is unhealthy; triggering automatic recovery", name);
            scheduler.trigger(name, AUTO_CAUSE, null);
        }
        return shouldTrigger;
    }

    private Verdict apply(HealthRecord record, HealthProbe.Outcome outcome) {
        Double reportedRate = outcome.result() != null ? outcome.result().errorRate() : null;
        record.recordCheck(outcome.healthy(), outcome.responseTimeMs(), reportedRate, clock.instant());
        if (outcome.result() != null) {
            record.mergeMetadata(outcome.result().details());
        }
        if (record.consumeOverride()) {
            return Verdict.NONE;
        }
        if (record.getStatus() == ServiceStatus.RECOVERING) {
            // the scheduler and executor own RECOVERING; a healthy check only asks for a release
            return outcome.healthy() ? Verdict.RELEASE : Verdict.NONE;
        }
        ServiceStatus derived = stateMachine.statusFor(record.getConsecutiveFailures());
        record.setStatus(derived);
        return !outcome.healthy() && derived.requiresRecovery() ? Verdict.TRIGGER : Verdict.NONE;
    }

    private enum Verdict { NONE, TRIGGER, RELEASE }

    private void report(String name, HealthProbe.Outcome outcome, int failures) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("consecutiveFailures", failures);
        context.put("responseTimeMs", outcome.responseTimeMs());
        try {
            errorReporter.report("RecoveryManager:" + name, outcome.error(), outcome.cause(), context);
        } catch (RuntimeException e) {
            LOG.warn("Error reporter failed for service={}: {}", name, e.toString());
        }
    }

    @Override
    public void start() {
        if (loop != null) {
            return;
        }
        if (!props.isEnabled()) {
            LOG.info("Health monitor disabled (recovery.enabled=false)");
            return;
        }
        Duration interval = props.getHealth().getInterval();
        loop = taskScheduler.scheduleWithFixedDelay(this::tickSafely, interval);
        LOG.info("Health monitor started: interval={}ms, checkTimeout={}ms",
                interval.toMillis(), props.getHealth().getCheckTimeout().toMillis());
    }

    @Override
    public void stop() {
        ScheduledFuture<?> current = loop;
        if (current == null) {
            return;
        }
        current.cancel(false);
        loop = null;
        LOG.info("Health monitor stopped");
    }

    @Override
    public boolean isRunning() {
        return loop != null;
    }

    private void tickSafely() {
        try {
            tick();
        } catch (RuntimeException e) {
            LOG.error("Health monitor tick failed", e);
        }
    }
}
