package com.phillippitts.autorecovery.exception;

/**
 * Failure of a single recovery step attempt: the action or its verification returned
 * false, threw, or missed its deadline.
 */
public class RecoveryStepException extends RecoveryManagerException {

    private final int stepIndex;
    private final String stepName;

    public RecoveryStepException(String message, int stepIndex, String stepName) {
        super(message);
        this.stepIndex = stepIndex;
        this.stepName = stepName;
    }

    public RecoveryStepException(String message, int stepIndex, String stepName, Throwable cause) {
        super(message, cause);
        this.stepIndex = stepIndex;
        this.stepName = stepName;
    }

    /** 1-based index of the step inside its plan. */
    public int getStepIndex() {
        return stepIndex;
    }

    public String getStepName() {
        return stepName;
    }
}
