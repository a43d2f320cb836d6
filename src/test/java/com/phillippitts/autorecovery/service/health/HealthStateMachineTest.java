package com.phillippitts.autorecovery.service.health;

import com.phillippitts.autorecovery.config.properties.RecoveryProperties;
import com.phillippitts.autorecovery.domain.ServiceStatus;
import com.phillippitts.autorecovery.service.registry.HealthRecord;
import com.phillippitts.autorecovery.service.registry.ServiceRegistry;
import com.phillippitts.autorecovery.testutil.EventCapturingPublisher;
import com.phillippitts.autorecovery.testutil.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HealthStateMachineTest {

    private final HealthStateMachine machine = new HealthStateMachine(new RecoveryProperties());

    @ParameterizedTest
    @CsvSource({
            "0, HEALTHY",
            "1, DEGRADED",
            "2, DEGRADED",
            "3, UNHEALTHY",
            "4, UNHEALTHY",
            "5, FAILED",
            "42, FAILED"
    })
    void defaultThresholdsMapFailureCounts(int failures, ServiceStatus expected) {
        assertThat(machine.statusFor(failures)).isEqualTo(expected);
    }

    @Test
    void customThresholdsAreHonoured() {
        HealthStateMachine strict = new HealthStateMachine(2, 2, 4);

        assertThat(strict.statusFor(1)).isEqualTo(ServiceStatus.HEALTHY);
        assertThat(strict.statusFor(2)).isEqualTo(ServiceStatus.UNHEALTHY);
        assertThat(strict.statusFor(4)).isEqualTo(ServiceStatus.FAILED);
    }

    @Test
    void rejectsThresholdsOutOfOrder() {
        assertThatThrownBy(() -> new HealthStateMachine(3, 2, 5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("degraded <= unhealthy <= failed");
    }

    @Test
    void leaveRecoveringOnlyTouchesRecoveringRecords() {
        ServiceRegistry registry = new ServiceRegistry(new EventCapturingPublisher(),
                new MutableClock(Instant.parse("2024-01-01T00:00:00Z")));
        registry.register("svc", new Object(), List.of());
        registry.update("svc", r -> {
            r.recordCheck(false, 1, null, Instant.EPOCH);
            r.recordCheck(false, 1, null, Instant.EPOCH);
            r.recordCheck(false, 1, null, Instant.EPOCH);
            r.setStatus(ServiceStatus.RECOVERING);
            return null;
        });

        assertThat(registry.update("svc", machine::leaveRecovering)).contains(true);
        assertThat(registry.get("svc").orElseThrow().status()).isEqualTo(ServiceStatus.UNHEALTHY);

        registry.update("svc", (HealthRecord r) -> {
            r.setStatus(ServiceStatus.DEGRADED);
            return null;
        });
        assertThat(registry.update("svc", machine::leaveRecovering)).contains(false);
        assertThat(registry.get("svc").orElseThrow().status()).isEqualTo(ServiceStatus.DEGRADED);
    }
}
