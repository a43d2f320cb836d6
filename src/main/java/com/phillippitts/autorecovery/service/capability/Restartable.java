package com.phillippitts.autorecovery.service.capability;

/**
 * Service that can be stopped and started in place. Used by the restart plan.
 */
public interface Restartable {

    /** Called before stopping; flush buffers, stop accepting new work. */
    default void prepareRestart() throws Exception {
    }

    void stop() throws Exception;

    /** Releases caches, connections and other resources held between stop and start. */
    default void clearResources() throws Exception {
    }

    void start() throws Exception;
}
