package com.phillippitts.autorecovery.service.recovery;

import java.time.Duration;

/**
 * Waits out a retry delay. Replaced in tests to avoid wall-clock sleeps.
 */
@FunctionalInterface
public interface BackoffSleeper {

    void sleep(Duration delay) throws InterruptedException;

    static BackoffSleeper threadSleep() {
        return delay -> {
            if (!delay.isZero() && !delay.isNegative()) {
                Thread.sleep(delay.toMillis());
            }
        };
    }
}
