package com.phillippitts.autorecovery.exception;

/**
 * Base exception for all recovery-orchestrator errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class RecoveryManagerException extends RuntimeException {

    public RecoveryManagerException(String message) {
        super(message);
    }

    public RecoveryManagerException(String message, Throwable cause) {
        super(message, cause);
    }
}
