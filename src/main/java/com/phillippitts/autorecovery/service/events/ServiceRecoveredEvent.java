package com.phillippitts.autorecovery.service.events;

import com.phillippitts.autorecovery.domain.RecoveryStrategy;

import java.time.Instant;

/** Published after a successful recovery returned the service to HEALTHY. */
public record ServiceRecoveredEvent(
        String serviceName,
        RecoveryStrategy recoveryType,
        int recoveryCount,
        Instant at
) {
    public ServiceRecoveredEvent {
        if (at == null) at = Instant.now();
    }
}
