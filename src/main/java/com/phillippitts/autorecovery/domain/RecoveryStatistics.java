package com.phillippitts.autorecovery.domain;

import java.util.Map;

/**
 * Aggregate view over all supervised services and known recovery executions.
 * Computed on demand from in-memory state.
 */
public record RecoveryStatistics(
        int totalServices,
        int healthyServices,
        int unhealthyServices,
        int recoveringServices,
        Map<ServiceStatus, Long> statusCounts,
        int totalRecoveries,
        int successfulRecoveries,
        int failedRecoveries,
        int activeRecoveries,
        int queuedRecoveries
) {
    public RecoveryStatistics {
        statusCounts = statusCounts == null ? Map.of() : Map.copyOf(statusCounts);
    }
}
