package com.phillippitts.autorecovery.service.strategy;

import com.phillippitts.autorecovery.config.properties.RecoveryProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Backup wiring for the failover strategy.
 *
 * <p>Targets come from {@code recovery.failover.targets.<service>=<backup>} and can be
 * changed at runtime. An active route records that traffic for a service currently goes to
 * its backup; it is set by the failover plan and cleared when the service is recovered by
 * another strategy or unregistered.
 */
@Component
public class FailoverRegistry {

    private static final Logger LOG = LogManager.getLogger(FailoverRegistry.class);

    private final Map<String, String> targets = new ConcurrentHashMap<>();
    private final Map<String, String> activeRoutes = new ConcurrentHashMap<>();

    public FailoverRegistry(RecoveryProperties props) {
        props.getFailover().getTargets().forEach(this::setTarget);
    }

    public void setTarget(String serviceName, String backupName) {
        if (serviceName == null || serviceName.isBlank() || backupName == null || backupName.isBlank()) {
            throw new IllegalArgumentException("service and backup names must not be empty");
        }
        if (serviceName.equals(backupName)) {
            throw new IllegalArgumentException("service cannot fail over to itself: " + serviceName);
        }
        targets.put(serviceName, backupName);
        LOG.info("Failover target configured: service={}, backup={}", serviceName, backupName);
    }

    public void removeTarget(String serviceName) {
        targets.remove(serviceName);
    }

    public Optional<String> target(String serviceName) {
        return Optional.ofNullable(serviceName == null ? null : targets.get(serviceName));
    }

    public boolean hasTarget(String serviceName) {
        return target(serviceName).isPresent();
    }

    /** Routes the service's traffic to {@code backupName}. */
    public void activate(String serviceName, String backupName) {
        activeRoutes.put(serviceName, backupName);
        LOG.warn("Failover activated: service={} now served by {}", serviceName, backupName);
    }

    public Optional<String> activeRoute(String serviceName) {
        return Optional.ofNullable(serviceName == null ? null : activeRoutes.get(serviceName));
    }

    public void clearRoute(String serviceName) {
        if (serviceName != null && activeRoutes.remove(serviceName) != null) {
            LOG.info("Failover route cleared: service={}", serviceName);
        }
    }
}
