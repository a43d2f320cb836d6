package com.phillippitts.autorecovery.service.health;

import com.phillippitts.autorecovery.service.registry.HealthCheckResult;
import com.phillippitts.autorecovery.service.registry.HealthCheckable;
import com.phillippitts.autorecovery.util.Deadline;
import com.phillippitts.autorecovery.util.DeadlineExecutor;
import com.phillippitts.autorecovery.util.TimeUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Runs one health check against a service object within a deadline.
 *
 * <p>Services implementing {@link HealthCheckable} are called on the probe pool; any other
 * non-null object counts as healthy. A timeout, a thrown error or a saturated pool all
 * produce an unhealthy {@link Outcome} and never propagate.
 */
@Component
public class HealthProbe {

    private final DeadlineExecutor deadlineExecutor;

    public HealthProbe(@Qualifier("probePool") Executor probeExecutor) {
        this.deadlineExecutor = new DeadlineExecutor(probeExecutor);
    }

    public Outcome probe(Object service, Deadline deadline) {
        if (service == null) {
            return Outcome.failed(0L, "Service handle is missing", null);
        }
        if (!(service instanceof HealthCheckable checkable)) {
            return Outcome.of(HealthCheckResult.ok(), 0L);
        }
        long start = System.nanoTime();
        try {
            HealthCheckResult result = deadlineExecutor.call(() -> checkable.checkHealth(deadline), deadline);
            long elapsed = TimeUtils.elapsedMillis(start);
            if (result == null) {
                return Outcome.failed(elapsed, "Health check returned no result", null);
            }
            return Outcome.of(result, elapsed);
        } catch (TimeoutException te) {
            return Outcome.failed(TimeUtils.elapsedMillis(start),
                    "Health check timed out after " + TimeUtils.elapsedMillis(start) + "ms", te);
        } catch (RejectedExecutionException ree) {
            return Outcome.failed(TimeUtils.elapsedMillis(start), "Probe pool saturated", ree);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return Outcome.failed(TimeUtils.elapsedMillis(start), "Health check interrupted", ie);
        } catch (Exception e) {
            return Outcome.failed(TimeUtils.elapsedMillis(start), "Health check error: " + e.getMessage(), e);
        }
    }

    /**
     * Result of a single probe.
     *
     * @param healthy whether the check passed
     * @param responseTimeMs wall time spent in the check
     * @param result the service's own result, null when the check did not return
     * @param error failure description, null when healthy
     * @param cause thrown error, null unless the check threw or timed out
     */
    public record Outcome(boolean healthy, long responseTimeMs, HealthCheckResult result, String error, Throwable cause) {

        static Outcome of(HealthCheckResult result, long responseTimeMs) {
            String error = result.healthy() ? null
                    : (result.message() != null ? result.message() : "Service reported unhealthy");
            return new Outcome(result.healthy(), responseTimeMs, result, error, null);
        }

        static Outcome failed(long responseTimeMs, String error, Throwable cause) {
            return new Outcome(false, responseTimeMs, null, error, cause);
        }
    }
}
