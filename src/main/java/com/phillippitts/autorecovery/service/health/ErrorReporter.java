package com.phillippitts.autorecovery.service.health;

import java.util.Map;

/**
 * External error-reporting collaborator that receives health-check failures.
 */
public interface ErrorReporter {

    /**
     * @param source origin of the error, e.g. {@code RecoveryManager:cache}
     * @param message failure description
     * @param cause thrown error, may be null when the check simply returned unhealthy
     * @param context diagnostic key/values (consecutive failures, response time)
     */
    void report(String source, String message, Throwable cause, Map<String, Object> context);
}
