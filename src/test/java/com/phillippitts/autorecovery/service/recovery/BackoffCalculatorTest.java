package com.phillippitts.autorecovery.service.recovery;

import com.phillippitts.autorecovery.domain.BackoffStrategy;
import com.phillippitts.autorecovery.domain.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffCalculatorTest {

    private final BackoffCalculator calculator = new BackoffCalculator(new Random(7));

    @Test
    void exponentialDoublesUntilCapped() {
        RetryPolicy policy = RetryPolicy.exponential(5, Duration.ofSeconds(2), Duration.ofSeconds(30), false);

        assertThat(calculator.delayFor(policy, 1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(calculator.delayFor(policy, 2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(calculator.delayFor(policy, 3)).isEqualTo(Duration.ofSeconds(8));
        assertThat(calculator.delayFor(policy, 4)).isEqualTo(Duration.ofSeconds(16));
        assertThat(calculator.delayFor(policy, 5)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void linearGrowsWithAttempt() {
        RetryPolicy policy = new RetryPolicy(3, BackoffStrategy.LINEAR, Duration.ofMillis(500), Duration.ofSeconds(10), false);

        assertThat(calculator.delayFor(policy, 1)).isEqualTo(Duration.ofMillis(500));
        assertThat(calculator.delayFor(policy, 3)).isEqualTo(Duration.ofMillis(1500));
    }

    @Test
    void fixedIgnoresAttempt() {
        RetryPolicy policy = RetryPolicy.fixed(3, Duration.ofSeconds(1));

        assertThat(calculator.delayFor(policy, 1)).isEqualTo(calculator.delayFor(policy, 9));
    }

    @Test
    void jitterStaysWithinTenPercent() {
        RetryPolicy policy = RetryPolicy.exponential(5, Duration.ofSeconds(2), Duration.ofSeconds(30), true);

        for (int i = 0; i < 200; i++) {
            assertThat(calculator.delayFor(policy, 5).toMillis()).isBetween(27_000L, 33_000L);
            assertThat(calculator.delayFor(policy, 1).toMillis()).isBetween(1_800L, 2_200L);
        }
    }

    @Test
    void rejectsAttemptBelowOne() {
        assertThatThrownBy(() -> calculator.delayFor(RetryPolicy.none(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
