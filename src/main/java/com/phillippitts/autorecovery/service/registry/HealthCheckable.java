package com.phillippitts.autorecovery.service.registry;

import com.phillippitts.autorecovery.util.Deadline;

/**
 * Health-check capability of a supervised service.
 *
 * <p>Services that do not implement this interface are considered healthy as long as
 * they are registered. Implementations should return before {@code deadline} expires;
 * a check that overruns is abandoned and counted as a failure.
 */
@FunctionalInterface
public interface HealthCheckable {

    HealthCheckResult checkHealth(Deadline deadline) throws Exception;
}
