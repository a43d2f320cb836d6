package com.phillippitts.autorecovery.service.capability;

/**
 * Service that can be cut off from the rest of the system. Used by the isolate plan.
 */
public interface Isolatable {

    void isolate() throws Exception;

    boolean isIsolated();

    /** Reconnects the service. Called when an isolate recovery is rolled back. */
    default void rejoin() throws Exception {
    }
}
