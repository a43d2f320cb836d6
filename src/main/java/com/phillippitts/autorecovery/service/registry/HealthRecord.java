package com.phillippitts.autorecovery.service.registry;

import com.phillippitts.autorecovery.domain.ServiceHealth;
import com.phillippitts.autorecovery.domain.ServiceStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable health record owned by {@link ServiceRegistry}.
 *
 * <p>Only reachable inside {@link ServiceRegistry#update}, which holds the record's lock and
 * publishes a health-changed event once the update returns with a different status.
 */
public final class HealthRecord {

    private final String name;
    private final List<String> dependencies;
    private final Instant uptimeStart;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    private ServiceStatus status = ServiceStatus.HEALTHY;
    private Instant lastCheckTime;
    private int consecutiveFailures;
    private long responseTimeMs;
    private double errorRate;
    private Instant lastRecoveryTime;
    private int recoveryCount;
    private boolean statusOverridden;

    HealthRecord(String name, List<String> dependencies, Instant now) {
        this.name = name;
        this.dependencies = List.copyOf(dependencies);
        this.uptimeStart = now;
        this.lastCheckTime = now;
    }

    /**
     * Records the outcome of one health check: updates the failure streak and response time.
     * The error rate only changes when the check reports one.
     */
    public void recordCheck(boolean healthy, long responseTimeMs, Double reportedErrorRate, Instant now) {
        this.lastCheckTime = now;
        this.responseTimeMs = responseTimeMs;
        this.consecutiveFailures = healthy ? 0 : consecutiveFailures + 1;
        if (reportedErrorRate != null) {
            this.errorRate = reportedErrorRate;
        }
    }

    /** Clears the failure streak after a successful recovery. */
    public void markRecovered(Instant now) {
        this.consecutiveFailures = 0;
        this.lastRecoveryTime = now;
        this.recoveryCount++;
        this.errorRate = 0.0;
    }

    public void mergeMetadata(Map<String, Object> details) {
        details.forEach((k, v) -> {
            if (k != null && v != null) {
                metadata.put(k, v);
            }
        });
    }

    public ServiceHealth snapshot() {
        return new ServiceHealth(name, status, lastCheckTime, consecutiveFailures, uptimeStart,
                responseTimeMs, errorRate, dependencies, lastRecoveryTime, recoveryCount, metadata);
    }

    /**
     * Consumes a pending manual override.
     *
     * @return true if the status was forced since the last check
     */
    public boolean consumeOverride() {
        boolean overridden = statusOverridden;
        statusOverridden = false;
        return overridden;
    }

    /** Marks the current status as forced so the next check leaves it alone. */
    public void markOverridden() {
        this.statusOverridden = true;
    }

    public String getName() {
        return name;
    }

    public ServiceStatus getStatus() {
        return status;
    }

    public void setStatus(ServiceStatus status) {
        this.status = status;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public List<String> getDependencies() {
        return dependencies;
    }
}
