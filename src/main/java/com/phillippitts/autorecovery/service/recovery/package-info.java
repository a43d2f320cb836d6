/**
 * Recovery queue and plan execution.
 *
 * <h2>Scheduling</h2>
 * <p>{@link com.phillippitts.autorecovery.service.recovery.RecoveryScheduler} keeps a FIFO
 * queue of pending executions and dispatches them every {@code recovery.queue.interval}
 * (default 5s) while fewer than {@code recovery.queue.max-concurrent} (default 3) are running.
 * A service never has more than one active execution. Finished executions are kept for
 * {@code recovery.queue.completed-retention} and then purged.
 *
 * <h2>Execution</h2>
 * <p>{@link com.phillippitts.autorecovery.service.recovery.RecoveryExecutor} runs the steps in
 * order. Each attempt is bounded by the step timeout; failed attempts are retried with the
 * delay computed by {@link com.phillippitts.autorecovery.service.recovery.BackoffCalculator}.
 * The first step that exhausts its attempts fails the execution and the rollback steps run
 * in reverse order.
 *
 * <h2>Thread Safety</h2>
 * <p>Queue and registry of executions are guarded by a single
 * {@link java.util.concurrent.locks.ReentrantLock}. Executions themselves synchronize their
 * accessors, so a cancel from the API is seen by the worker between attempts.
 *
 * @since 1.0
 * @see com.phillippitts.autorecovery.config.properties.RecoveryProperties
 */
package com.phillippitts.autorecovery.service.recovery;
