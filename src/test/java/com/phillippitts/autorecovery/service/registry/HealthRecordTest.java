package com.phillippitts.autorecovery.service.registry;

import com.phillippitts.autorecovery.domain.ServiceStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HealthRecordTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant T1 = Instant.parse("2024-01-01T00:01:00Z");

    @Test
    void failuresAccumulateAndResetOnSuccess() {
        HealthRecord record = new HealthRecord("cache", List.of(), T0);

        record.recordCheck(false, 10, null, T0);
        record.recordCheck(false, 10, null, T0);
        assertThat(record.getConsecutiveFailures()).isEqualTo(2);

        record.recordCheck(true, 3, null, T1);
        assertThat(record.getConsecutiveFailures()).isZero();
        assertThat(record.snapshot().lastCheckTime()).isEqualTo(T1);
        assertThat(record.snapshot().responseTimeMs()).isEqualTo(3);
    }

    @Test
    void errorRateChangesOnlyWhenReported() {
        HealthRecord record = new HealthRecord("cache", List.of(), T0);

        record.recordCheck(false, 10, 0.4, T0);
        record.recordCheck(false, 10, null, T0);

        assertThat(record.snapshot().errorRate()).isEqualTo(0.4);
    }

    @Test
    void markRecoveredResetsStreakAndCountsRecovery() {
        HealthRecord record = new HealthRecord("cache", List.of(), T0);
        record.recordCheck(false, 10, 0.9, T0);

        record.markRecovered(T1);

        assertThat(record.getConsecutiveFailures()).isZero();
        assertThat(record.snapshot().recoveryCount()).isEqualTo(1);
        assertThat(record.snapshot().lastRecoveryTime()).isEqualTo(T1);
        assertThat(record.snapshot().errorRate()).isZero();
    }

    @Test
    void overrideIsConsumedOnce() {
        HealthRecord record = new HealthRecord("cache", List.of(), T0);
        record.setStatus(ServiceStatus.FAILED);
        record.markOverridden();

        assertThat(record.consumeOverride()).isTrue();
        assertThat(record.consumeOverride()).isFalse();
        assertThat(record.getStatus()).isEqualTo(ServiceStatus.FAILED);
    }
}
