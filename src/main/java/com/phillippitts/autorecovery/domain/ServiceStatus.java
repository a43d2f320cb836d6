package com.phillippitts.autorecovery.domain;

/**
 * Health state of a supervised service.
 *
 * <p>Outside of {@link #RECOVERING} the state is derived from the number of consecutive
 * failed health checks (see {@code HealthStateMachine}).
 */
public enum ServiceStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY,
    FAILED,
    RECOVERING;

    /** True for the states that start an automatic recovery. */
    public boolean requiresRecovery() {
        return this == UNHEALTHY || this == FAILED;
    }
}
