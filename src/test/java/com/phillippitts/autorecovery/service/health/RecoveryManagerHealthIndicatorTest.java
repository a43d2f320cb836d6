package com.phillippitts.autorecovery.service.health;

import com.phillippitts.autorecovery.domain.RecoveryStatistics;
import com.phillippitts.autorecovery.service.RecoveryManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RecoveryManagerHealthIndicatorTest {

    private RecoveryManager manager;
    private RecoveryManagerHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        manager = mock(RecoveryManager.class);
        indicator = new RecoveryManagerHealthIndicator(manager);
    }

    @Test
    void upWhenServicesHealthyAndNoRecoveries() {
        when(manager.getStatistics()).thenReturn(stats(10, 10, 0, 0, 0));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("recoveryRate", 100.0);
        assertThat(health.getDetails()).containsEntry("servicesMonitored", 10);
    }

    @Test
    void downWhenMoreThanHalfUnhealthy() {
        when(manager.getStatistics()).thenReturn(stats(10, 4, 6, 0, 0));

        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }

    @Test
    void degradedWhenMoreThanFifthUnhealthy() {
        when(manager.getStatistics()).thenReturn(stats(10, 7, 3, 0, 0));

        assertThat(indicator.health().getStatus().getCode()).isEqualTo("DEGRADED");
    }

    @Test
    void exactlyFifthUnhealthyIsNotDegraded() {
        when(manager.getStatistics()).thenReturn(stats(10, 8, 2, 0, 0));

        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void warningWhenRecoveriesFail() {
        when(manager.getStatistics()).thenReturn(stats(10, 10, 0, 9, 1));

        Health health = indicator.health();

        assertThat(health.getStatus().getCode()).isEqualTo("WARNING");
        assertThat(health.getDetails()).containsEntry("recoveryRate", 90.0);
        assertThat(health.getDetails()).containsEntry("failedRecoveries", 1);
    }

    @Test
    void emptyRegistryIsUp() {
        when(manager.getStatistics()).thenReturn(stats(0, 0, 0, 0, 0));

        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);
    }

    private static RecoveryStatistics stats(int total, int healthy, int unhealthy, int succeeded, int failed) {
        return new RecoveryStatistics(total, healthy, unhealthy, 0, Map.of(),
                succeeded + failed, succeeded, failed, 0, 0);
    }
}
