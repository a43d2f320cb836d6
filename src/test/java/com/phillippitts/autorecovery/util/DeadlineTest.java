package com.phillippitts.autorecovery.util;

import com.phillippitts.autorecovery.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class DeadlineTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

    @Test
    void expiresWhenClockReachesIt() {
        Deadline deadline = Deadline.after(Duration.ofSeconds(5), clock);

        assertThat(deadline.isExpired()).isFalse();
        assertThat(deadline.remaining()).isEqualTo(Duration.ofSeconds(5));

        clock.advance(Duration.ofSeconds(5));
        assertThat(deadline.isExpired()).isTrue();
        assertThat(deadline.remaining()).isZero();

        clock.advance(Duration.ofSeconds(5));
        assertThat(deadline.remaining()).isZero();
    }

    @Test
    void minPicksEarlierDeadline() {
        Deadline step = Deadline.after(Duration.ofSeconds(10), clock);
        Deadline plan = Deadline.after(Duration.ofSeconds(3), clock);

        assertThat(step.min(plan)).isSameAs(plan);
        assertThat(plan.min(step)).isSameAs(plan);
    }
}
