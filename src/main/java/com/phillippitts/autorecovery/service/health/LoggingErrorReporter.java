package com.phillippitts.autorecovery.service.health;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default {@link ErrorReporter}: logs health-check failures, throttled so a service failing
 * every tick does not flood the log. Declare a {@code @Primary} reporter to forward failures
 * elsewhere.
 *
 * <p>Failures are grouped by source and kind of failure (the cause's class, or a plain
 * unhealthy answer), not by message: messages carry per-call values such as elapsed time.
 */
@Component
class LoggingErrorReporter implements ErrorReporter {
    private static final Logger LOG = LogManager.getLogger(LoggingErrorReporter.class);

    static final Duration THROTTLE = Duration.ofMinutes(1);
    private static final String UNHEALTHY = "unhealthy";

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    LoggingErrorReporter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void report(String source, String message, Throwable cause, Map<String, Object> context) {
        if (!shouldLog(throttleKey(source, cause))) {
            return;
        }
        if (cause != null) {
            LOG.warn("Health check error: source={}, message={}, context={}, cause={}",
                    source, message, context, cause.toString());
        } else {
            LOG.warn("Health check error: source={}, message={}, context={}", source, message, context);
        }
    }

    static String throttleKey(String source, Throwable cause) {
        return source + '|' + (cause != null ? cause.getClass().getName() : UNHEALTHY);
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        lastLog.values().removeIf(at -> expired(at, now));
        Instant prev = lastLog.putIfAbsent(key, now);
        return prev == null;
    }

    int trackedKeys() {
        return lastLog.size();
    }

    private static boolean expired(Instant at, Instant now) {
        return Duration.between(at, now).compareTo(THROTTLE) > 0;
    }
}
