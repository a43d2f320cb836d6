package com.phillippitts.autorecovery.service.recovery;

import com.phillippitts.autorecovery.domain.RetryPolicy;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Delay before the next attempt of a failed step.
 *
 * <pre>
 * FIXED:       base
 * LINEAR:      base × a
 * EXPONENTIAL: base × 2^(a-1)
 * </pre>
 * where {@code a} is the 1-based number of the attempt that just failed. The result is capped
 * at {@code maxDelay}; with jitter it is then moved by a uniform offset of up to ±10% and
 * floored at zero.
 */
@Component
public class BackoffCalculator {

    private static final double JITTER_FRACTION = 0.10;

    private final Random random;

    public BackoffCalculator() {
        this(new Random());
    }

    /** Seeded constructor for reproducible delays in tests. */
    public BackoffCalculator(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public Duration delayFor(RetryPolicy policy, int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got " + attempt);
        }
        double base = policy.baseDelay().toMillis();
        double delay = switch (policy.backoffStrategy()) {
            case FIXED -> base;
            case LINEAR -> base * attempt;
            case EXPONENTIAL -> base * Math.pow(2, attempt - 1);
        };
        delay = Math.min(delay, policy.maxDelay().toMillis());
        if (policy.jitter()) {
            delay += delay * JITTER_FRACTION * (random.nextDouble() * 2.0 - 1.0);
        }
        return Duration.ofMillis(Math.max(0L, Math.round(delay)));
    }
}
