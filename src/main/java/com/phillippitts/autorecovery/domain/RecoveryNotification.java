package com.phillippitts.autorecovery.domain;

import java.time.Instant;

/** User-facing message about a recovery execution. */
public record RecoveryNotification(
        String serviceName,
        String message,
        Severity severity,
        Phase phase,
        String executionId,
        Instant timestamp
) {

    public enum Phase { STARTED, COMPLETED, FAILED }

    public enum Severity { WARNING, SUCCESS, ERROR }
}
