package com.phillippitts.autorecovery.service.events;

import java.time.Duration;
import java.time.Instant;

/** Published when every step of a recovery execution succeeded. */
public record RecoveryCompletedEvent(
        String executionId,
        String serviceName,
        Duration duration,
        Instant at
) {
    public RecoveryCompletedEvent {
        if (at == null) at = Instant.now();
    }
}
