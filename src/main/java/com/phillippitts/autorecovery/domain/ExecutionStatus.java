package com.phillippitts.autorecovery.domain;

/**
 * Lifecycle of a recovery execution.
 *
 * <pre>
 * PENDING → RUNNING → SUCCESS | FAILED | CANCELLED
 * PENDING → CANCELLED
 * SUCCESS | FAILED → ROLLED_BACK (post-hoc rollback)
 * </pre>
 */
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED,
    CANCELLED,
    ROLLED_BACK;

    /** Pending or running: the execution still owns its service. */
    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }

    public boolean isTerminal() {
        return !isActive();
    }
}
