package com.phillippitts.autorecovery.service.capability;

/**
 * Service that can keep running with reduced functionality. Used by the degrade plan.
 */
public interface Degradable {

    /** Whether a degraded mode is currently available. */
    default boolean canDegrade() {
        return true;
    }

    void applyPerformanceLimits() throws Exception;

    void disableNonEssentialFeatures() throws Exception;

    /** Whether the service reports itself as running in degraded mode. */
    boolean isDegraded();

    /** Leaves degraded mode. Called when a degrade recovery is rolled back. */
    default void restoreFullOperation() throws Exception {
    }
}
