package com.phillippitts.autorecovery.service.events;

import com.phillippitts.autorecovery.domain.ServiceHealth;
import com.phillippitts.autorecovery.domain.ServiceStatus;

import java.time.Instant;

/**
 * Published whenever a supervised service changes health status.
 */
public record ServiceHealthChangedEvent(
        String serviceName,
        ServiceStatus previousStatus,
        ServiceStatus newStatus,
        ServiceHealth health,
        Instant at
) {
    public ServiceHealthChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
