package com.phillippitts.autorecovery.domain;

import com.phillippitts.autorecovery.util.Deadline;

import java.util.List;
import java.util.Optional;

/**
 * What a step action can see and touch while a recovery execution runs.
 */
public interface RecoveryContext {

    String executionId();

    String serviceName();

    RecoveryStrategy strategy();

    /** Deadline of the current attempt: the step timeout capped by the plan timeout. */
    Deadline deadline();

    /** The registered service object, if it is still registered. */
    Optional<Object> service();

    /**
     * The registered service object viewed as an optional capability such as
     * {@code Restartable}; empty when the service does not implement it.
     */
    default <T> Optional<T> capability(Class<T> type) {
        return service().filter(type::isInstance).map(type::cast);
    }

    /** Runs a health check against the named service within the current deadline. */
    boolean probeHealth(String serviceName);

    /** Current health snapshot of the named service. */
    Optional<ServiceHealth> health(String serviceName);

    /** Names of registered services that declare the named service as a dependency. */
    List<String> dependentsOf(String serviceName);

    /** Registered object of another service (for example a failover backup). */
    Optional<Object> lookupService(String serviceName);

    /** Backup service configured for the service under recovery. */
    Optional<String> failoverTarget();

    /** Routes traffic for the service under recovery to {@code backupName}. */
    void activateFailover(String backupName);

    /** Backup currently serving traffic for the service under recovery, if failover is active. */
    Optional<String> activeFailover();

    /** Sends traffic back to the service under recovery. */
    void deactivateFailover();

    /** Adds a value to the execution's metrics bag. */
    void recordMetric(String key, Object value);
}
