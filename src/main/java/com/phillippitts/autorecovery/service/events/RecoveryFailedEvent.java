package com.phillippitts.autorecovery.service.events;

import java.time.Instant;
import java.util.List;

/**
 * Published when a recovery execution failed. The service keeps its unhealthy status and
 * becomes eligible for another recovery on its next failing health check.
 */
public record RecoveryFailedEvent(
        String executionId,
        String serviceName,
        int failedStep,
        List<String> errors,
        Instant at
) {
    public RecoveryFailedEvent {
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (at == null) at = Instant.now();
    }
}
