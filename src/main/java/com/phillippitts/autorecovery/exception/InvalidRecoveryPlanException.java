package com.phillippitts.autorecovery.exception;

/**
 * Thrown when a recovery plan is rejected at registration time
 * (missing id, no steps, unknown strategy, duplicate id, non-positive timeouts).
 */
public class InvalidRecoveryPlanException extends RecoveryManagerException {

    private final String planId;
    private final String reason;

    public InvalidRecoveryPlanException(String planId, String reason) {
        super("Invalid recovery plan '" + planId + "': " + reason);
        this.planId = planId;
        this.reason = reason;
    }

    public String getPlanId() {
        return planId;
    }

    public String getReason() {
        return reason;
    }
}
