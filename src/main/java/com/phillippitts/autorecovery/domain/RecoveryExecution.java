package com.phillippitts.autorecovery.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One concrete run of a {@link RecoveryPlan} against a service.
 *
 * <p>Mutated by the scheduler and executor; every accessor is synchronized so other
 * threads always see a consistent record. Callers outside the engine receive {@link #copy()}s.
 */
public final class RecoveryExecution {

    private final String id;
    private final String planId;
    private final String serviceName;
    private final RecoveryStrategy strategy;
    private final String cause;
    private final Instant startTime;
    private final int totalSteps;
    private final boolean userNotifications;

    private ExecutionStatus status;
    private Instant endTime;
    private int currentStep;
    private final List<String> errors;
    private final Map<String, Object> metrics;

    public RecoveryExecution(String id,
                             RecoveryPlan plan,
                             String serviceName,
                             String cause,
                             Instant startTime) {
        this.id = Objects.requireNonNull(id, "id");
        this.planId = plan.id();
        this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
        this.strategy = plan.strategy();
        this.cause = cause == null ? "manual" : cause;
        this.startTime = Objects.requireNonNull(startTime, "startTime");
        this.totalSteps = plan.steps().size();
        this.userNotifications = plan.userImpact() != UserImpact.NONE;
        this.status = ExecutionStatus.PENDING;
        this.currentStep = 0;
        this.errors = new ArrayList<>();
        this.metrics = new LinkedHashMap<>();
    }

    private RecoveryExecution(RecoveryExecution source) {
        this.id = source.id;
        this.planId = source.planId;
        this.serviceName = source.serviceName;
        this.strategy = source.strategy;
        this.cause = source.cause;
        this.startTime = source.startTime;
        this.totalSteps = source.totalSteps;
        this.userNotifications = source.userNotifications;
        this.status = source.status;
        this.endTime = source.endTime;
        this.currentStep = source.currentStep;
        this.errors = new ArrayList<>(source.errors);
        this.metrics = new LinkedHashMap<>(source.metrics);
    }

    /**
     * Moves from {@code expected} to {@code next}. Terminal targets stamp the end time.
     *
     * @return false when the execution was no longer in {@code expected} (for example cancelled meanwhile)
     */
    public synchronized boolean transition(ExecutionStatus expected, ExecutionStatus next, Instant now) {
        if (status != expected) {
            return false;
        }
        status = next;
        if (next.isTerminal()) {
            endTime = now;
        }
        return true;
    }

    /** Cancels a pending or running execution. */
    public synchronized boolean cancel(Instant now) {
        if (!status.isActive()) {
            return false;
        }
        status = ExecutionStatus.CANCELLED;
        endTime = now;
        return true;
    }

    public synchronized boolean isCancelled() {
        return status == ExecutionStatus.CANCELLED;
    }

    public synchronized void setCurrentStep(int step) {
        if (step < 0 || step > totalSteps) {
            throw new IllegalArgumentException("step " + step + " outside 0.." + totalSteps);
        }
        this.currentStep = step;
    }

    public synchronized void addError(String error) {
        errors.add(error);
    }

    public synchronized void putMetric(String key, Object value) {
        if (key != null && value != null) {
            metrics.put(key, value);
        }
    }

    /** Detached copy safe to hand across thread boundaries. */
    public synchronized RecoveryExecution copy() {
        return new RecoveryExecution(this);
    }

    public String getId() {
        return id;
    }

    public String getPlanId() {
        return planId;
    }

    public String getServiceName() {
        return serviceName;
    }

    public RecoveryStrategy getStrategy() {
        return strategy;
    }

    public String getCause() {
        return cause;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public int getTotalSteps() {
        return totalSteps;
    }

    public boolean isUserNotifications() {
        return userNotifications;
    }

    public synchronized ExecutionStatus getStatus() {
        return status;
    }

    public synchronized Instant getEndTime() {
        return endTime;
    }

    public synchronized int getCurrentStep() {
        return currentStep;
    }

    public synchronized List<String> getErrors() {
        return List.copyOf(errors);
    }

    public synchronized Map<String, Object> getMetrics() {
        return Map.copyOf(metrics);
    }

    @Override
    public synchronized String toString() {
        return "RecoveryExecution[id=" + id + ", service=" + serviceName + ", plan=" + planId
                + ", status=" + status + ", step=" + currentStep + "/" + totalSteps + "]";
    }
}
