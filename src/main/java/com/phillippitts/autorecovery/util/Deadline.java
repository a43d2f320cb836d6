package com.phillippitts.autorecovery.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Absolute point in time by which a health check or recovery step must finish.
 *
 * <p>Handed to every health check and step action so long-running work can stop early.
 * Work that ignores its deadline is abandoned by the caller and counted as a timeout.
 */
public final class Deadline {

    private final Instant expiresAt;
    private final Clock clock;

    private Deadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public static Deadline after(Duration timeout, Clock clock) {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(clock, "clock");
        return new Deadline(clock.instant().plus(timeout), clock);
    }

    /** Returns whichever of this deadline and {@code other} expires first. */
    public Deadline min(Deadline other) {
        return other.expiresAt.isBefore(expiresAt) ? other : this;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /** Time left before expiry, never negative. */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    @Override
    public String toString() {
        return "Deadline[" + expiresAt + "]";
    }
}
