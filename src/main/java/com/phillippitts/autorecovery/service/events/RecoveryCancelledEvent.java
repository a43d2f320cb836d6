package com.phillippitts.autorecovery.service.events;

import java.time.Instant;

/** Published when a pending or running recovery execution is cancelled. */
public record RecoveryCancelledEvent(String executionId, String serviceName, Instant at) {
    public RecoveryCancelledEvent {
        if (at == null) at = Instant.now();
    }
}
