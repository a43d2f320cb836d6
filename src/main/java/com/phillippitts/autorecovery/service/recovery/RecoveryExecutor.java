package com.phillippitts.autorecovery.service.recovery;

import com.phillippitts.autorecovery.domain.ExecutionStatus;
import com.phillippitts.autorecovery.domain.RecoveryExecution;
import com.phillippitts.autorecovery.domain.RecoveryPlan;
import com.phillippitts.autorecovery.domain.RecoveryStep;
import com.phillippitts.autorecovery.domain.RecoveryStrategy;
import com.phillippitts.autorecovery.domain.ServiceHealth;
import com.phillippitts.autorecovery.domain.ServiceStatus;
import com.phillippitts.autorecovery.domain.StepAction;
import com.phillippitts.autorecovery.exception.RecoveryStepException;
import com.phillippitts.autorecovery.exception.RecoveryStepExceptionBuilder;
import com.phillippitts.autorecovery.service.events.RecoveryCompletedEvent;
import com.phillippitts.autorecovery.service.events.RecoveryFailedEvent;
import com.phillippitts.autorecovery.service.events.RecoveryStartedEvent;
import com.phillippitts.autorecovery.service.events.ServiceRecoveredEvent;
import com.phillippitts.autorecovery.service.health.HealthProbe;
import com.phillippitts.autorecovery.service.health.HealthStateMachine;
import com.phillippitts.autorecovery.service.notification.RecoveryNotifier;
import com.phillippitts.autorecovery.service.registry.ServiceRegistry;
import com.phillippitts.autorecovery.service.strategy.FailoverRegistry;
import com.phillippitts.autorecovery.util.Deadline;
import com.phillippitts.autorecovery.util.DeadlineExecutor;
import com.phillippitts.autorecovery.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Runs the steps of a RUNNING execution in order.
 *
 * <p>Per step: up to {@code retryCount + 1} attempts; an attempt succeeds when the action and,
 * if present, the verification both return {@code true} before the attempt deadline (step
 * timeout capped by the remaining plan time). Failed attempts are retried after a backoff
 * delay. When a step runs out of attempts its rollback runs once, best-effort, and the
 * execution fails with the remaining steps skipped.
 *
 * <p>Cancellation is cooperative: it is checked before every step and every attempt, never
 * by interrupting a running action.
 *
 * <p>Outcome bookkeeping:
 * <ul>
 *   <li>SUCCESS: failure streak reset, service HEALTHY, recovery count incremented,
 *       {@link RecoveryCompletedEvent} and {@link ServiceRecoveredEvent} published</li>
 *   <li>FAILED: one error per failed step, service back to its failure-derived status,
 *       {@link RecoveryFailedEvent} published</li>
 * </ul>
 */
@Component
public class RecoveryExecutor {

    private static final Logger LOG = LogManager.getLogger(RecoveryExecutor.class);

    static final String MDC_SERVICE = "serviceName";
    static final String MDC_EXECUTION = "executionId";

    private final ServiceRegistry registry;
    private final HealthProbe probe;
    private final FailoverRegistry failover;
    private final HealthStateMachine stateMachine;
    private final RecoveryNotifier notifier;
    private final ApplicationEventPublisher publisher;
    private final BackoffCalculator backoff;
    private final BackoffSleeper sleeper;
    private final DeadlineExecutor stepExecutor;
    private final Clock clock;

    public RecoveryExecutor(ServiceRegistry registry,
                            HealthProbe probe,
                            FailoverRegistry failover,
                            HealthStateMachine stateMachine,
                            RecoveryNotifier notifier,
                            ApplicationEventPublisher publisher,
                            BackoffCalculator backoff,
                            BackoffSleeper sleeper,
                            @Qualifier("stepPool") Executor stepExecutor,
                            Clock clock) {
        this.registry = registry;
        this.probe = probe;
        this.failover = failover;
        this.stateMachine = stateMachine;
        this.notifier = notifier;
        this.publisher = publisher;
        this.backoff = backoff;
        this.sleeper = sleeper;
        this.stepExecutor = new DeadlineExecutor(stepExecutor);
        this.clock = clock;
    }

    /**
     * Runs every step of {@code plan} for an execution already marked RUNNING.
     * Never throws; the outcome is recorded on the execution.
     */
    public void execute(RecoveryExecution execution, RecoveryPlan plan) {
        ThreadContext.put(MDC_SERVICE, execution.getServiceName());
        ThreadContext.put(MDC_EXECUTION, execution.getId());
        long startNanos = System.nanoTime();
        try {
            announceStart(execution, plan);
            runSteps(execution, plan, startNanos);
        } catch (RuntimeException unexpected) {
            LOG.error("Recovery execution {} aborted by unexpected error", execution.getId(), unexpected);
            execution.addError("Unexpected error: " + unexpected);
            fail(execution, execution.getCurrentStep());
        } finally {
            ThreadContext.remove(MDC_SERVICE);
            ThreadContext.remove(MDC_EXECUTION);
        }
    }

    /**
     * Runs the plan's rollback steps for a finished execution, best-effort, then marks it
     * ROLLED_BACK.
     *
     * @return false if the execution was not SUCCESS or FAILED
     */
    public boolean rollback(RecoveryExecution execution, RecoveryPlan plan) {
        ExecutionStatus from = execution.getStatus();
        if (from != ExecutionStatus.SUCCESS && from != ExecutionStatus.FAILED) {
            return false;
        }
        ThreadContext.put(MDC_SERVICE, execution.getServiceName());
        ThreadContext.put(MDC_EXECUTION, execution.getId());
        try {
            LOG.info("Rolling back recovery: plan={}, rollbackSteps={}", plan.id(), plan.rollbackSteps().size());
            List<RecoveryStep> steps = plan.rollbackSteps();
            for (int i = 0; i < steps.size(); i++) {
                RecoveryStep step = steps.get(i);
                try {
                    Deadline deadline = Deadline.after(step.timeout(), clock);
                    if (!call(step.action(), execution, deadline, i + 1, step.name(), 1)) {
                        throw RecoveryStepExceptionBuilder.create("Rollback action returned false")
                                .step(i + 1, step.name()).build();
                    }
                } catch (RecoveryStepException e) {
                    LOG.warn("Rollback step {} ({}) failed: {}", i + 1, step.name(), e.getMessage());
                    execution.addError("Rollback step " + (i + 1) + " (" + step.name() + "): " + e.getMessage());
                }
            }
            boolean done = execution.transition(from, ExecutionStatus.ROLLED_BACK, clock.instant());
            LOG.info("Recovery rollback finished: rolledBack={}", done);
            return done;
        } finally {
            ThreadContext.remove(MDC_SERVICE);
            ThreadContext.remove(MDC_EXECUTION);
        }
    }

    private void announceStart(RecoveryExecution execution, RecoveryPlan plan) {
        LOG.info("Recovery started: plan={}, strategy={}, cause={}, steps={}",
                plan.id(), plan.strategy(), execution.getCause(), plan.steps().size());
        publisher.publishEvent(new RecoveryStartedEvent(execution.getId(), execution.getServiceName(),
                plan.id(), plan.strategy(), execution.getCause(), clock.instant()));
        notifier.started(execution);
    }

    private void runSteps(RecoveryExecution execution, RecoveryPlan plan, long startNanos) {
        Deadline planDeadline = Deadline.after(plan.timeout(), clock);
        List<RecoveryStep> steps = plan.steps();
        for (int i = 0; i < steps.size(); i++) {
            int index = i + 1;
            RecoveryStep step = steps.get(i);
            if (execution.isCancelled()) {
                LOG.info("Recovery cancelled before step {} ({})", index, step.name());
                return;
            }
            execution.setCurrentStep(index);
            LOG.debug("Executing step {}/{}: {}", index, steps.size(), step.name());

            StepResult result = runStep(execution, plan, step, index, planDeadline);
            if (result == StepResult.CANCELLED) {
                LOG.info("Recovery cancelled during step {} ({})", index, step.name());
                return;
            }
            if (result == StepResult.FAILED) {
                runStepRollback(execution, step, index);
                fail(execution, index);
                return;
            }
        }
        succeed(execution, plan, startNanos);
    }

    private StepResult runStep(RecoveryExecution execution,
                               RecoveryPlan plan,
                               RecoveryStep step,
                               int index,
                               Deadline planDeadline) {
        int attempts = step.attempts(plan.retryPolicy());
        String lastError = "no attempt made";
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (execution.isCancelled()) {
                return StepResult.CANCELLED;
            }
            if (planDeadline.isExpired()) {
                lastError = "plan timeout of " + plan.timeout().toMillis() + "ms exceeded";
                break;
            }
            Deadline deadline = Deadline.after(step.timeout(), clock).min(planDeadline);
            try {
                if (!call(step.action(), execution, deadline, index, step.name(), attempt)) {
                    throw RecoveryStepExceptionBuilder.create("Step action returned false")
                            .step(index, step.name()).attempt(attempt).build();
                }
                Optional<StepAction> verify = step.verify();
                if (verify.isPresent() && !call(verify.get(), execution, deadline, index, step.name(), attempt)) {
                    throw RecoveryStepExceptionBuilder.create("Step verification failed")
                            .step(index, step.name()).attempt(attempt).build();
                }
                return StepResult.SUCCEEDED;
            } catch (RecoveryStepException e) {
                lastError = e.getMessage();
            }

            if (attempt < attempts) {
                Duration delay = backoff.delayFor(plan.retryPolicy(), attempt);
                LOG.warn("Step {} ({}) attempt {}/{} failed: {}; retrying in {}ms",
                        index, step.name(), attempt, attempts, lastError, delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    lastError = "interrupted while waiting to retry";
                    break;
                }
            } else {
                LOG.warn("Step {} ({}) attempt {}/{} failed: {}", index, step.name(), attempt, attempts, lastError);
            }
        }
        execution.addError("Step " + index + " (" + step.name() + "): " + lastError);
        return StepResult.FAILED;
    }

    private void runStepRollback(RecoveryExecution execution, RecoveryStep step, int index) {
        Optional<StepAction> rollback = step.rollback();
        if (rollback.isEmpty()) {
            return;
        }
        LOG.info("Rolling back step {} ({})", index, step.name());
        try {
            if (!call(rollback.get(), execution, Deadline.after(step.timeout(), clock), index, step.name(), 1)) {
                throw RecoveryStepExceptionBuilder.create("Rollback returned false").step(index, step.name()).build();
            }
        } catch (RecoveryStepException e) {
            LOG.warn("Rollback of step {} ({}) failed: {}", index, step.name(), e.getMessage());
            execution.addError("Step " + index + " (" + step.name() + ") rollback failed: " + e.getMessage());
        }
    }

    private boolean call(StepAction action,
                         RecoveryExecution execution,
                         Deadline deadline,
                         int index,
                         String stepName,
                         int attempt) {
        DefaultRecoveryContext ctx = new DefaultRecoveryContext(execution, deadline, registry, probe, failover);
        long start = System.nanoTime();
        try {
            return Boolean.TRUE.equals(stepExecutor.call(() -> action.run(ctx), deadline));
        } catch (TimeoutException te) {
            throw RecoveryStepExceptionBuilder.create("Step timed out")
                    .step(index, stepName).attempt(attempt).durationMs(TimeUtils.elapsedMillis(start)).cause(te).build();
        } catch (RejectedExecutionException ree) {
            throw RecoveryStepExceptionBuilder.create("Step pool saturated")
                    .step(index, stepName).attempt(attempt).cause(ree).build();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw RecoveryStepExceptionBuilder.create("Step interrupted")
                    .step(index, stepName).attempt(attempt).cause(ie).build();
        } catch (Exception e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw RecoveryStepExceptionBuilder.create(msg)
                    .step(index, stepName).attempt(attempt).durationMs(TimeUtils.elapsedMillis(start)).cause(e).build();
        }
    }

    private void succeed(RecoveryExecution execution, RecoveryPlan plan, long startNanos) {
        Instant now = clock.instant();
        if (!execution.transition(ExecutionStatus.RUNNING, ExecutionStatus.SUCCESS, now)) {
            LOG.info("Recovery finished its steps after being cancelled; outcome discarded");
            return;
        }
        long durationMs = TimeUtils.elapsedMillis(startNanos);
        execution.putMetric("durationMs", durationMs);
        Optional<ServiceHealth> health = registry.update(execution.getServiceName(), r -> {
            r.markRecovered(now);
            r.setStatus(ServiceStatus.HEALTHY);
            return r.snapshot();
        });
        if (plan.strategy() == RecoveryStrategy.RESTART) {
            failover.clearRoute(execution.getServiceName());
        }
        LOG.info("Recovery completed: plan={}, durationMs={}", plan.id(), durationMs);
        publisher.publishEvent(new RecoveryCompletedEvent(execution.getId(), execution.getServiceName(),
                Duration.ofMillis(durationMs), now));
        health.ifPresent(h -> publisher.publishEvent(
                new ServiceRecoveredEvent(h.name(), plan.strategy(), h.recoveryCount(), now)));
        notifier.completed(execution);
    }

    private void fail(RecoveryExecution execution, int failedStep) {
        Instant now = clock.instant();
        if (!execution.transition(ExecutionStatus.RUNNING, ExecutionStatus.FAILED, now)) {
            return;
        }
        registry.update(execution.getServiceName(), stateMachine::leaveRecovering);
        List<String> errors = execution.getErrors();
        LOG.error("Recovery failed at step {}/{}: errors={}", failedStep, execution.getTotalSteps(), errors);
        publisher.publishEvent(new RecoveryFailedEvent(execution.getId(), execution.getServiceName(),
                failedStep, errors, now));
        notifier.failed(execution);
    }

    private enum StepResult { SUCCEEDED, FAILED, CANCELLED }
}
