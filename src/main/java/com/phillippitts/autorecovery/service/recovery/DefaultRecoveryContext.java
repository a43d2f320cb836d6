package com.phillippitts.autorecovery.service.recovery;

import com.phillippitts.autorecovery.domain.RecoveryContext;
import com.phillippitts.autorecovery.domain.RecoveryExecution;
import com.phillippitts.autorecovery.domain.RecoveryStrategy;
import com.phillippitts.autorecovery.domain.ServiceHealth;
import com.phillippitts.autorecovery.service.health.HealthProbe;
import com.phillippitts.autorecovery.service.registry.ServiceRegistry;
import com.phillippitts.autorecovery.service.strategy.FailoverRegistry;
import com.phillippitts.autorecovery.util.Deadline;

import java.util.List;
import java.util.Optional;

/** Context of one step attempt. */
final class DefaultRecoveryContext implements RecoveryContext {

    private final RecoveryExecution execution;
    private final Deadline deadline;
    private final ServiceRegistry registry;
    private final HealthProbe probe;
    private final FailoverRegistry failover;

    DefaultRecoveryContext(RecoveryExecution execution,
                           Deadline deadline,
                           ServiceRegistry registry,
                           HealthProbe probe,
                           FailoverRegistry failover) {
        this.execution = execution;
        this.deadline = deadline;
        this.registry = registry;
        this.probe = probe;
        this.failover = failover;
    }

    @Override
    public String executionId() {
        return execution.getId();
    }

    @Override
    public String serviceName() {
        return execution.getServiceName();
    }

    @Override
    public RecoveryStrategy strategy() {
        return execution.getStrategy();
    }

    @Override
    public Deadline deadline() {
        return deadline;
    }

    @Override
    public Optional<Object> service() {
        return registry.handle(serviceName());
    }

    @Override
    public boolean probeHealth(String name) {
        if (!registry.isRegistered(name)) {
            return false;
        }
        return probe.probe(registry.handle(name).orElse(null), deadline).healthy();
    }

    @Override
    public Optional<ServiceHealth> health(String name) {
        return registry.get(name);
    }

    @Override
    public List<String> dependentsOf(String name) {
        return registry.getAll().values().stream()
                .filter(h -> h.dependencies().contains(name))
                .map(ServiceHealth::name)
                .sorted()
                .toList();
    }

    @Override
    public Optional<Object> lookupService(String name) {
        return registry.handle(name);
    }

    @Override
    public Optional<String> failoverTarget() {
        return failover.target(serviceName());
    }

    @Override
    public void activateFailover(String backupName) {
        failover.activate(serviceName(), backupName);
    }

    @Override
    public Optional<String> activeFailover() {
        return failover.activeRoute(serviceName());
    }

    @Override
    public void deactivateFailover() {
        failover.clearRoute(serviceName());
    }

    @Override
    public void recordMetric(String key, Object value) {
        execution.putMetric(key, value);
    }
}
