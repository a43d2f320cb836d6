package com.phillippitts.autorecovery.testutil;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Executor that parks submitted tasks until the test releases them. Used to keep executions
 * RUNNING while asserting on the scheduler.
 */
public class HoldingExecutor implements Executor {

    private final List<Runnable> held = new ArrayList<>();
    private boolean rejecting;

    @Override
    public synchronized void execute(Runnable command) {
        if (rejecting) {
            throw new RejectedExecutionException("rejecting");
        }
        held.add(command);
    }

    public synchronized int heldCount() {
        return held.size();
    }

    public synchronized void setRejecting(boolean rejecting) {
        this.rejecting = rejecting;
    }

    /** Runs every parked task on the calling thread. */
    public void runAll() {
        List<Runnable> toRun;
        synchronized (this) {
            toRun = new ArrayList<>(held);
            held.clear();
        }
        toRun.forEach(Runnable::run);
    }
}
