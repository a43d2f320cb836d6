package com.phillippitts.autorecovery.service.recovery;

import com.phillippitts.autorecovery.config.properties.RecoveryProperties;
import com.phillippitts.autorecovery.domain.ExecutionStatus;
import com.phillippitts.autorecovery.domain.RecoveryExecution;
import com.phillippitts.autorecovery.domain.RecoveryPlan;
import com.phillippitts.autorecovery.domain.RecoveryStrategy;
import com.phillippitts.autorecovery.domain.ServiceHealth;
import com.phillippitts.autorecovery.domain.ServiceStatus;
import com.phillippitts.autorecovery.service.catalog.RecoveryPlanCatalog;
import com.phillippitts.autorecovery.service.events.RecoveryCancelledEvent;
import com.phillippitts.autorecovery.service.health.HealthStateMachine;
import com.phillippitts.autorecovery.service.registry.ServiceRegistry;
import com.phillippitts.autorecovery.service.strategy.StrategySelector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Admission queue and concurrency cap for recovery executions.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * trigger  → PENDING (appended to the FIFO queue, service set to RECOVERING)
 * dispatch → RUNNING (oldest PENDING first, while fewer than max-concurrent are RUNNING)
 * executor → SUCCESS | FAILED
 * cancel   → CANCELLED (from PENDING or RUNNING)
 * rollback → ROLLED_BACK (from SUCCESS or FAILED)
 * </pre>
 *
 * <p>Triggers are idempotent per service: while a service has a PENDING or RUNNING execution
 * its id is returned instead of creating another one. Finished executions stay inspectable for
 * {@code recovery.queue.completed-retention} and are purged by the dispatch loop.
 *
 * <p><b>Thread Safety:</b> executions and queue are guarded by one {@link ReentrantLock}.
 * The lock is never held while a step runs; health-record locks may be taken under it, never
 * the other way round.
 */
@Component
public class RecoveryScheduler implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(RecoveryScheduler.class);

    private final ServiceRegistry registry;
    private final RecoveryPlanCatalog catalog;
    private final StrategySelector selector;
    private final RecoveryExecutor executor;
    private final HealthStateMachine stateMachine;
    private final Executor recoveryPool;
    private final TaskScheduler taskScheduler;
    private final RecoveryProperties props;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final Lock lock = new ReentrantLock();
    private final Map<String, Tracked> executions = new LinkedHashMap<>();
    private final Deque<String> queue = new ArrayDeque<>();

    private volatile ScheduledFuture<?> loop;

    public RecoveryScheduler(ServiceRegistry registry,
                             RecoveryPlanCatalog catalog,
                             StrategySelector selector,
                             RecoveryExecutor executor,
                             HealthStateMachine stateMachine,
                             @Qualifier("recoveryPool") Executor recoveryPool,
                             @Qualifier("recoveryTaskScheduler") TaskScheduler taskScheduler,
                             RecoveryProperties props,
                             ApplicationEventPublisher publisher,
                             Clock clock) {
        this.registry = registry;
        this.catalog = catalog;
        this.selector = selector;
        this.executor = executor;
        this.stateMachine = stateMachine;
        this.recoveryPool = recoveryPool;
        this.taskScheduler = taskScheduler;
        this.props = props;
        this.publisher = publisher;
        this.clock = clock;
    }

    /**
     * Queues a recovery for the service.
     *
     * @param strategy strategy to use, or null to let the {@link StrategySelector} decide
     * @return id of the new execution, or of the service's existing PENDING/RUNNING one;
     *         empty when the service is unknown or no plan matches
     */
    public Optional<String> trigger(String serviceName, String cause, RecoveryStrategy strategy) {
        lock.lock();
        try {
            Optional<ServiceHealth> health = registry.get(serviceName);
            if (health.isEmpty()) {
                LOG.warn("Cannot trigger recovery: service not registered: {}", serviceName);
                return Optional.empty();
            }
            Optional<Tracked> active = activeFor(serviceName);
            if (active.isPresent()) {
                LOG.debug("Recovery already active for service={}: {}", serviceName, active.get().execution.getId());
                return Optional.of(active.get().execution.getId());
            }
            RecoveryStrategy chosen = strategy != null ? strategy : selector.select(health.get());
            Optional<RecoveryPlan> plan = catalog.find(serviceName, chosen);
            if (plan.isEmpty()) {
                LOG.warn("Cannot trigger recovery: no {} plan for service={}", chosen, serviceName);
                return Optional.empty();
            }
            String id = UUID.randomUUID().toString();
            RecoveryExecution execution = new RecoveryExecution(id, plan.get(), serviceName, cause, clock.instant());
            executions.put(id, new Tracked(execution, plan.get()));
            queue.addLast(id);
            registry.update(serviceName, r -> {
                r.setStatus(ServiceStatus.RECOVERING);
                return null;
            });
            LOG.info("Recovery queued: executionId={}, service={}, plan={}, strategy={}, cause={}, queued={}",
                    id, serviceName, plan.get().id(), chosen, execution.getCause(), queue.size());
            return Optional.of(id);
        } finally {
            lock.unlock();
        }
    }

    /**
     * One pass of the dispatch loop: purges expired executions and starts queued ones
     * while fewer than {@code max-concurrent} are running.
     *
     * @return number of executions handed to the recovery pool
     */
    public int dispatch() {
        List<Tracked> started = new ArrayList<>();
        lock.lock();
        try {
            Instant now = clock.instant();
            purgeExpired(now);
            long running = countWithStatus(ExecutionStatus.RUNNING);
            int max = props.getQueue().getMaxConcurrent();
            while (running < max && !queue.isEmpty()) {
                Tracked t = executions.get(queue.pollFirst());
                if (t != null && t.execution.transition(ExecutionStatus.PENDING, ExecutionStatus.RUNNING, now)) {
                    started.add(t);
                    running++;
                }
            }
        } finally {
            lock.unlock();
        }

        List<Tracked> rejected = new ArrayList<>();
        for (Tracked t : started) {
            try {
                recoveryPool.execute(() -> executor.execute(t.execution, t.plan));
            } catch (RejectedExecutionException e) {
                LOG.warn("Recovery pool rejected execution {}; re-queueing", t.execution.getId());
                rejected.add(t);
            }
        }
        if (!rejected.isEmpty()) {
            requeue(rejected);
        }
        return started.size() - rejected.size();
    }

    /**
     * Cancels a PENDING or RUNNING execution. A running step is not interrupted; the executor
     * stops before its next step or attempt. The service leaves RECOVERING immediately.
     */
    public boolean cancel(String executionId) {
        RecoveryExecution execution;
        lock.lock();
        try {
            Tracked t = executionId == null ? null : executions.get(executionId);
            if (t == null || !t.execution.cancel(clock.instant())) {
                return false;
            }
            queue.remove(executionId);
            execution = t.execution;
            registry.update(execution.getServiceName(), stateMachine::leaveRecovering);
        } finally {
            lock.unlock();
        }
        LOG.info("Recovery cancelled: executionId={}, service={}", executionId, execution.getServiceName());
        publisher.publishEvent(new RecoveryCancelledEvent(executionId, execution.getServiceName(), clock.instant()));
        return true;
    }

    /** Runs the plan's rollback steps for a SUCCESS or FAILED execution on the calling thread. */
    public boolean rollback(String executionId) {
        Tracked t;
        lock.lock();
        try {
            t = executionId == null ? null : executions.get(executionId);
        } finally {
            lock.unlock();
        }
        return t != null && executor.rollback(t.execution, t.plan);
    }

    /** Cancels any active execution of a service that is being unregistered. */
    public void cancelForService(String serviceName) {
        String id;
        lock.lock();
        try {
            id = activeFor(serviceName).map(t -> t.execution.getId()).orElse(null);
        } finally {
            lock.unlock();
        }
        if (id != null) {
            cancel(id);
        }
    }

    /**
     * Moves a RECOVERING service back to its failure-derived status when it has no pending or
     * running execution. Holds the queue lock so a concurrent {@link #trigger} cannot be undone.
     *
     * @return true if the status was released
     */
    public boolean releaseIfIdle(String serviceName) {
        lock.lock();
        try {
            if (activeFor(serviceName).isPresent()) {
                return false;
            }
            return registry.update(serviceName, stateMachine::leaveRecovering).orElse(false);
        } finally {
            lock.unlock();
        }
    }

    public boolean hasActive(String serviceName) {
        lock.lock();
        try {
            return activeFor(serviceName).isPresent();
        } finally {
            lock.unlock();
        }
    }

    public Optional<RecoveryExecution> get(String executionId) {
        lock.lock();
        try {
            Tracked t = executionId == null ? null : executions.get(executionId);
            return t == null ? Optional.empty() : Optional.of(t.execution.copy());
        } finally {
            lock.unlock();
        }
    }

    /** Copies of all PENDING and RUNNING executions keyed by id, in admission order. */
    public Map<String, RecoveryExecution> getActive() {
        return snapshot(true);
    }

    /** Copies of every retained execution keyed by id, in admission order. */
    public Map<String, RecoveryExecution> getAll() {
        return snapshot(false);
    }

    public int queuedCount() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int runningCount() {
        lock.lock();
        try {
            return (int) countWithStatus(ExecutionStatus.RUNNING);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void start() {
        if (loop != null) {
            return;
        }
        if (!props.isEnabled()) {
            LOG.info("Recovery dispatch loop disabled (recovery.enabled=false)");
            return;
        }
        Duration interval = props.getQueue().getInterval();
        loop = taskScheduler.scheduleWithFixedDelay(this::dispatchSafely, interval);
        LOG.info("Recovery dispatch loop started: interval={}ms, maxConcurrent={}",
                interval.toMillis(), props.getQueue().getMaxConcurrent());
    }

    @Override
    public void stop() {
        ScheduledFuture<?> current = loop;
        if (current == null) {
            return;
        }
        current.cancel(false);
        loop = null;
        LOG.info("Recovery dispatch loop stopped");
    }

    @Override
    public boolean isRunning() {
        return loop != null;
    }

    private void dispatchSafely() {
        try {
            dispatch();
        } catch (RuntimeException e) {
            LOG.error("Recovery dispatch pass failed", e);
        }
    }

    private void requeue(List<Tracked> rejected) {
        lock.lock();
        try {
            for (int i = rejected.size() - 1; i >= 0; i--) {
                Tracked t = rejected.get(i);
                if (t.execution.transition(ExecutionStatus.RUNNING, ExecutionStatus.PENDING, clock.instant())) {
                    queue.addFirst(t.execution.getId());
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private void purgeExpired(Instant now) {
        Duration retention = props.getQueue().getCompletedRetention();
        Iterator<Tracked> it = executions.values().iterator();
        while (it.hasNext()) {
            RecoveryExecution e = it.next().execution;
            Instant end = e.getEndTime();
            if (e.getStatus().isTerminal() && end != null && !end.plus(retention).isAfter(now)) {
                it.remove();
                LOG.debug("Purged finished execution {} ({})", e.getId(), e.getStatus());
            }
        }
    }

    private Optional<Tracked> activeFor(String serviceName) {
        return executions.values().stream()
                .filter(t -> t.execution.getServiceName().equals(serviceName) && t.execution.getStatus().isActive())
                .findFirst();
    }

    private long countWithStatus(ExecutionStatus status) {
        return executions.values().stream().filter(t -> t.execution.getStatus() == status).count();
    }

    private Map<String, RecoveryExecution> snapshot(boolean activeOnly) {
        lock.lock();
        try {
            Map<String, RecoveryExecution> copy = new LinkedHashMap<>();
            for (Tracked t : executions.values()) {
                RecoveryExecution e = t.execution.copy();
                if (!activeOnly || e.getStatus().isActive()) {
                    copy.put(e.getId(), e);
                }
            }
            return copy;
        } finally {
            lock.unlock();
        }
    }

    private static final class Tracked {
        private final RecoveryExecution execution;
        private final RecoveryPlan plan;

        private Tracked(RecoveryExecution execution, RecoveryPlan plan) {
            this.execution = execution;
            this.plan = plan;
        }
    }
}
