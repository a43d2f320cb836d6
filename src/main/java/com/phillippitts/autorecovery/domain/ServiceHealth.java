package com.phillippitts.autorecovery.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of a supervised service's health record.
 *
 * <p>Instances are detached from the registry; mutating the registry afterwards does not
 * affect a snapshot already handed out.
 */
public record ServiceHealth(
        String name,
        ServiceStatus status,
        Instant lastCheckTime,
        int consecutiveFailures,
        Instant uptimeStart,
        long responseTimeMs,
        double errorRate,
        List<String> dependencies,
        Instant lastRecoveryTime,
        int recoveryCount,
        Map<String, Object> metadata
) {
    public ServiceHealth {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
