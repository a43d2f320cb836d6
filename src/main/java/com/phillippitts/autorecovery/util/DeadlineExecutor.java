package com.phillippitts.autorecovery.util;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a task on a worker pool and waits for it no longer than a {@link Deadline}.
 *
 * <p>On timeout the worker is interrupted and a {@link TimeoutException} is thrown, so a task
 * that ignores its deadline is abandoned rather than waited for. Exceptions thrown by the
 * task are rethrown unwrapped.
 */
public final class DeadlineExecutor {

    private final Executor executor;

    public DeadlineExecutor(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * @throws TimeoutException if the deadline expired before the task finished
     * @throws java.util.concurrent.RejectedExecutionException if the pool refused the task
     * @throws Exception whatever the task threw
     */
    public <T> T call(Callable<T> task, Deadline deadline) throws Exception {
        if (deadline.isExpired()) {
            throw new TimeoutException("deadline already expired");
        }
        FutureTask<T> future = new FutureTask<>(task);
        executor.execute(future);
        try {
            return future.get(Math.max(1, deadline.remaining().toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            future.cancel(true);
            throw te;
        } catch (InterruptedException ie) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw ie;
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw ee;
        }
    }
}
