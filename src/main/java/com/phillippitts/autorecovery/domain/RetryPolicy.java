package com.phillippitts.autorecovery.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry settings of a recovery plan.
 *
 * @param maxRetries default retries for steps that do not declare their own count
 * @param backoffStrategy delay growth between attempts
 * @param baseDelay delay of the first retry
 * @param maxDelay hard cap applied before jitter
 * @param jitter whether to perturb the delay by up to ±10%
 */
public record RetryPolicy(
        int maxRetries,
        BackoffStrategy backoffStrategy,
        Duration baseDelay,
        Duration maxDelay,
        boolean jitter
) {
    public RetryPolicy {
        Objects.requireNonNull(backoffStrategy, "backoffStrategy");
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
    }

    public static RetryPolicy fixed(int maxRetries, Duration delay) {
        return new RetryPolicy(maxRetries, BackoffStrategy.FIXED, delay, delay, false);
    }

    public static RetryPolicy exponential(int maxRetries, Duration baseDelay, Duration maxDelay, boolean jitter) {
        return new RetryPolicy(maxRetries, BackoffStrategy.EXPONENTIAL, baseDelay, maxDelay, jitter);
    }

    /** No retries and no delay. */
    public static RetryPolicy none() {
        return fixed(0, Duration.ZERO);
    }
}
