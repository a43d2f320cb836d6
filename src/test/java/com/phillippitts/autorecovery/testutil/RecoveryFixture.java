package com.phillippitts.autorecovery.testutil;

import com.phillippitts.autorecovery.config.properties.RecoveryProperties;
import com.phillippitts.autorecovery.config.properties.StrategyProperties;
import com.phillippitts.autorecovery.domain.RecoveryNotification;
import com.phillippitts.autorecovery.service.RecoveryManager;
import com.phillippitts.autorecovery.service.catalog.RecoveryPlanCatalog;
import com.phillippitts.autorecovery.service.health.ErrorReporter;
import com.phillippitts.autorecovery.service.health.HealthMonitor;
import com.phillippitts.autorecovery.service.health.HealthProbe;
import com.phillippitts.autorecovery.service.health.HealthStateMachine;
import com.phillippitts.autorecovery.service.metrics.RecoveryMetrics;
import com.phillippitts.autorecovery.service.notification.RecoveryNotifier;
import com.phillippitts.autorecovery.service.notification.UserNotifier;
import com.phillippitts.autorecovery.service.recovery.BackoffCalculator;
import com.phillippitts.autorecovery.service.recovery.RecoveryExecutor;
import com.phillippitts.autorecovery.service.recovery.RecoveryScheduler;
import com.phillippitts.autorecovery.service.registry.ServiceRegistry;
import com.phillippitts.autorecovery.service.strategy.FailoverRegistry;
import com.phillippitts.autorecovery.service.strategy.ThresholdStrategySelector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

import static org.mockito.Mockito.mock;

/**
 * Hand-wired orchestrator graph for tests: synchronous probes, a controllable clock, recorded
 * sleeps, captured events and notifications. The periodic loops are never started; tests call
 * {@code monitor.tick()} and {@code scheduler.dispatch()} directly.
 */
public final class RecoveryFixture {

    public final RecoveryProperties props = new RecoveryProperties();
    public final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    public final EventCapturingPublisher publisher = new EventCapturingPublisher();
    public final RecordingSleeper sleeper = new RecordingSleeper();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final List<RecoveryNotification> notifications = new CopyOnWriteArrayList<>();
    public final List<String> reportedErrors = new CopyOnWriteArrayList<>();

    public final ServiceRegistry registry;
    public final FailoverRegistry failover;
    public final HealthStateMachine stateMachine;
    public final HealthProbe probe;
    public final RecoveryPlanCatalog catalog;
    public final RecoveryExecutor executor;
    public final RecoveryScheduler scheduler;
    public final RecoveryMetrics metrics;
    public final HealthMonitor monitor;
    public final RecoveryManager manager;

    public RecoveryFixture() {
        this(p -> { }, new SyncExecutor());
    }

    public RecoveryFixture(Consumer<RecoveryProperties> customizer, Executor recoveryPool) {
        this(customizer, recoveryPool, new SyncExecutor());
    }

    public RecoveryFixture(Consumer<RecoveryProperties> customizer, Executor recoveryPool, Executor probePool) {
        customizer.accept(props);
        TaskScheduler taskScheduler = mock(TaskScheduler.class);
        ErrorReporter errorReporter = (source, message, cause, context) -> reportedErrors.add(source + ": " + message);

        registry = new ServiceRegistry(publisher, clock);
        failover = new FailoverRegistry(props);
        stateMachine = new HealthStateMachine(props);
        probe = new HealthProbe(probePool);
        catalog = new RecoveryPlanCatalog();
        RecoveryNotifier notifier = new RecoveryNotifier(List.<UserNotifier>of(notifications::add), clock);
        executor = new RecoveryExecutor(registry, probe, failover, stateMachine, notifier, publisher,
                new BackoffCalculator(new Random(42)), sleeper, probePool, clock);
        scheduler = new RecoveryScheduler(registry, catalog,
                new ThresholdStrategySelector(StrategyProperties.defaults(), failover),
                executor, stateMachine, recoveryPool, taskScheduler, props, publisher, clock);
        metrics = new RecoveryMetrics(meterRegistry, scheduler);
        monitor = new HealthMonitor(registry, probe, stateMachine, errorReporter, scheduler, metrics,
                taskScheduler, props, clock);
        manager = new RecoveryManager(registry, catalog, scheduler, failover);
    }

    /** Runs {@code n} health-check ticks. */
    public void ticks(int n) {
        for (int i = 0; i < n; i++) {
            monitor.tick();
        }
    }
}
