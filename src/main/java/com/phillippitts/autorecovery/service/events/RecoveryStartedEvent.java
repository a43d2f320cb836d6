package com.phillippitts.autorecovery.service.events;

import com.phillippitts.autorecovery.domain.RecoveryStrategy;

import java.time.Instant;

/** Published when a recovery execution leaves the queue and begins running its steps. */
public record RecoveryStartedEvent(
        String executionId,
        String serviceName,
        String planId,
        RecoveryStrategy strategy,
        String cause,
        Instant at
) {
    public RecoveryStartedEvent {
        if (at == null) at = Instant.now();
    }
}
