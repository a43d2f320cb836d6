package com.phillippitts.autorecovery.domain;

/**
 * Idempotent unit of work inside a recovery step (action, verification or rollback).
 *
 * <p>Returning {@code false} or throwing both count as a failed attempt.
 */
@FunctionalInterface
public interface StepAction {

    boolean run(RecoveryContext context) throws Exception;

    /** Action that always succeeds without doing anything. */
    static StepAction noop() {
        return context -> true;
    }
}
