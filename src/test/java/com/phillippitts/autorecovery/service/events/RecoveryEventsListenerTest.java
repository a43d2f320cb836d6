package com.phillippitts.autorecovery.service.events;

import com.phillippitts.autorecovery.domain.RecoveryStrategy;
import com.phillippitts.autorecovery.domain.ServiceStatus;
import com.phillippitts.autorecovery.service.metrics.RecoveryMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class RecoveryEventsListenerTest {

    private RecoveryMetrics metrics;
    private RecoveryEventsListener listener;

    @BeforeEach
    void setUp() {
        metrics = mock(RecoveryMetrics.class);
        listener = new RecoveryEventsListener(metrics);
    }

    @Test
    void statusChangeIsCounted() {
        listener.onHealthChanged(new ServiceHealthChangedEvent("cache", ServiceStatus.HEALTHY,
                ServiceStatus.DEGRADED, null, Instant.EPOCH));

        verify(metrics).recordStatusChange(ServiceStatus.DEGRADED);
    }

    @Test
    void startIsCountedByStrategy() {
        listener.onStarted(new RecoveryStartedEvent("e", "cache", "restart_generic",
                RecoveryStrategy.RESTART, "auto", Instant.EPOCH));

        verify(metrics).recordTriggered(RecoveryStrategy.RESTART);
    }

    @Test
    void outcomesAreCounted() {
        listener.onCompleted(new RecoveryCompletedEvent("e1", "cache", Duration.ofMillis(120), Instant.EPOCH));
        listener.onFailed(new RecoveryFailedEvent("e2", "cache", 4, List.of("Step 4"), Instant.EPOCH));
        listener.onCancelled(new RecoveryCancelledEvent("e3", "cache", Instant.EPOCH));

        verify(metrics).recordCompleted("success", Duration.ofMillis(120));
        verify(metrics).recordCompleted("failed", null);
        verify(metrics).recordCompleted("cancelled", null);
    }

    @Test
    void recoveredIsOnlyLogged() {
        listener.onRecovered(new ServiceRecoveredEvent("cache", RecoveryStrategy.RESTART, 1, Instant.EPOCH));

        verifyNoInteractions(metrics);
    }
}
