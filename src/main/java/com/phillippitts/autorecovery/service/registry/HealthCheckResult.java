package com.phillippitts.autorecovery.service.registry;

import java.util.Map;

/**
 * Outcome of a service's own health check.
 *
 * @param healthy whether the service considers itself healthy
 * @param message short diagnostic, may be null
 * @param errorRate error rate reported by the service (0..1), or null to let the monitor compute it
 * @param details extra key/values merged into the service's health metadata
 */
public record HealthCheckResult(boolean healthy, String message, Double errorRate, Map<String, Object> details) {

    public HealthCheckResult {
        details = details == null ? Map.of() : Map.copyOf(details);
        if (errorRate != null && (errorRate < 0.0 || errorRate > 1.0)) {
            throw new IllegalArgumentException("errorRate must be within 0..1");
        }
    }

    public static HealthCheckResult ok() {
        return new HealthCheckResult(true, null, null, Map.of());
    }

    public static HealthCheckResult unhealthy(String message) {
        return new HealthCheckResult(false, message, null, Map.of());
    }

    public static HealthCheckResult of(boolean healthy) {
        return healthy ? ok() : unhealthy("Service health check returned false");
    }
}
