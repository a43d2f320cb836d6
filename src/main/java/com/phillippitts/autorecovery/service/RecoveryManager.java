package com.phillippitts.autorecovery.service;

import com.phillippitts.autorecovery.domain.ExecutionStatus;
import com.phillippitts.autorecovery.domain.RecoveryExecution;
import com.phillippitts.autorecovery.domain.RecoveryPlan;
import com.phillippitts.autorecovery.domain.RecoveryStatistics;
import com.phillippitts.autorecovery.domain.RecoveryStrategy;
import com.phillippitts.autorecovery.domain.ServiceHealth;
import com.phillippitts.autorecovery.domain.ServiceStatus;
import com.phillippitts.autorecovery.service.catalog.RecoveryPlanCatalog;
import com.phillippitts.autorecovery.service.recovery.RecoveryScheduler;
import com.phillippitts.autorecovery.service.registry.ServiceRegistry;
import com.phillippitts.autorecovery.service.strategy.FailoverRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Public entry point of the recovery orchestrator.
 *
 * <p>Owns nothing itself: services and health records live in the {@link ServiceRegistry},
 * plans in the {@link RecoveryPlanCatalog}, executions in the {@link RecoveryScheduler}.
 * Every read returns a copy.
 */
@Service
public class RecoveryManager {

    private static final Logger LOG = LogManager.getLogger(RecoveryManager.class);

    static final String FORCED_CAUSE = "forced";

    private final ServiceRegistry registry;
    private final RecoveryPlanCatalog catalog;
    private final RecoveryScheduler scheduler;
    private final FailoverRegistry failover;

    public RecoveryManager(ServiceRegistry registry,
                           RecoveryPlanCatalog catalog,
                           RecoveryScheduler scheduler,
                           FailoverRegistry failover) {
        this.registry = registry;
        this.catalog = catalog;
        this.scheduler = scheduler;
        this.failover = failover;
    }

    /**
     * Starts supervising a service.
     *
     * @throws IllegalArgumentException if the name is empty
     */
    public void registerService(String name, Object service, List<String> dependencies) {
        registry.register(name, service, dependencies);
    }

    /** Stops supervising a service, cancelling its active recovery if any. */
    public boolean unregisterService(String name) {
        scheduler.cancelForService(name);
        failover.clearRoute(name);
        return registry.unregister(name);
    }

    /**
     * @throws com.phillippitts.autorecovery.exception.InvalidRecoveryPlanException if the plan is rejected
     */
    public void registerRecoveryPlan(RecoveryPlan plan) {
        catalog.register(plan);
    }

    /**
     * Queues a recovery.
     *
     * @param strategy strategy to use, or null to select one from the service's health
     * @return execution id, or empty if the service is unknown or no plan matches
     */
    public Optional<String> triggerRecovery(String serviceName, String cause, RecoveryStrategy strategy) {
        return scheduler.trigger(serviceName, cause, strategy);
    }

    public Optional<String> triggerRecovery(String serviceName, String cause) {
        return triggerRecovery(serviceName, cause, null);
    }

    public boolean cancelRecovery(String executionId) {
        return scheduler.cancel(executionId);
    }

    /** Runs the plan's rollback steps for a finished (SUCCESS or FAILED) execution. */
    public boolean rollbackRecovery(String executionId) {
        return scheduler.rollback(executionId);
    }

    /**
     * Sets a service's status by hand. The next health check keeps the forced status instead of
     * deriving one from the failure streak. Forcing UNHEALTHY or FAILED queues a recovery.
     *
     * @return false if the service is unknown
     */
    public boolean forceServiceStatus(String serviceName, ServiceStatus status) {
        if (status == null) {
            return false;
        }
        boolean known = registry.update(serviceName, r -> {
            r.setStatus(status);
            r.markOverridden();
            return Boolean.TRUE;
        }).orElse(false);
        if (!known) {
            LOG.warn("Cannot force status of unknown service: {}", serviceName);
            return false;
        }
        LOG.info("Service status forced: service={}, status={}", serviceName, status);
        if (status.requiresRecovery()) {
            scheduler.trigger(serviceName, FORCED_CAUSE, null);
        }
        return true;
    }

    public Optional<ServiceHealth> getServiceHealth(String name) {
        return registry.get(name);
    }

    public Map<String, ServiceHealth> getServiceHealth() {
        return registry.getAll();
    }

    public Map<String, RecoveryExecution> getActiveRecoveries() {
        return scheduler.getActive();
    }

    /** Every retained execution, active or finished. */
    public Map<String, RecoveryExecution> getRecoveryExecutions() {
        return scheduler.getAll();
    }

    public Optional<RecoveryExecution> getRecoveryExecution(String executionId) {
        return scheduler.get(executionId);
    }

    public Map<String, RecoveryPlan> getRecoveryPlans() {
        return catalog.getAll();
    }

    /**
     * Aggregates current in-memory state. Recovery counts cover the executions still retained.
     */
    public RecoveryStatistics getStatistics() {
        Collection<ServiceHealth> services = registry.getAll().values();
        Map<ServiceStatus, Long> byStatus = new EnumMap<>(ServiceStatus.class);
        for (ServiceStatus s : ServiceStatus.values()) {
            byStatus.put(s, 0L);
        }
        services.forEach(h -> byStatus.merge(h.status(), 1L, Long::sum));

        int healthy = byStatus.get(ServiceStatus.HEALTHY).intValue();
        int recovering = byStatus.get(ServiceStatus.RECOVERING).intValue();
        int unhealthy = services.size() - healthy - recovering;

        Collection<RecoveryExecution> executions = scheduler.getAll().values();
        int successful = count(executions, ExecutionStatus.SUCCESS);
        int failed = count(executions, ExecutionStatus.FAILED);
        int running = count(executions, ExecutionStatus.RUNNING);
        int queued = count(executions, ExecutionStatus.PENDING);

        return new RecoveryStatistics(services.size(), healthy, unhealthy, recovering, byStatus,
                executions.size(), successful, failed, running, queued);
    }

    private static int count(Collection<RecoveryExecution> executions, ExecutionStatus status) {
        return (int) executions.stream().filter(e -> e.getStatus() == status).count();
    }
}
