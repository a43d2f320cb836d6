package com.phillippitts.autorecovery.service.registry;

import com.phillippitts.autorecovery.domain.ServiceHealth;
import com.phillippitts.autorecovery.domain.ServiceStatus;
import com.phillippitts.autorecovery.service.events.ServiceHealthChangedEvent;
import com.phillippitts.autorecovery.testutil.EventCapturingPublisher;
import com.phillippitts.autorecovery.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceRegistryTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private EventCapturingPublisher publisher;
    private ServiceRegistry registry;

    @BeforeEach
    void setUp() {
        publisher = new EventCapturingPublisher();
        registry = new ServiceRegistry(publisher, clock);
    }

    @Test
    void newServiceStartsHealthy() {
        registry.register("cache", new Object(), List.of("db"));

        ServiceHealth health = registry.get("cache").orElseThrow();
        assertThat(health.status()).isEqualTo(ServiceStatus.HEALTHY);
        assertThat(health.consecutiveFailures()).isZero();
        assertThat(health.uptimeStart()).isEqualTo(clock.instant());
        assertThat(health.dependencies()).containsExactly("db");
        assertThat(health.recoveryCount()).isZero();
    }

    @Test
    void blankNameIsRejected() {
        assertThatThrownBy(() -> registry.register(" ", new Object(), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register(null, new Object(), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reRegisteringResetsRecord() {
        registry.register("cache", new Object(), List.of());
        registry.update("cache", r -> {
            r.recordCheck(false, 5, null, clock.instant());
            return null;
        });

        registry.register("cache", new Object(), null);

        assertThat(registry.get("cache").orElseThrow().consecutiveFailures()).isZero();
        assertThat(registry.names()).containsExactly("cache");
    }

    @Test
    void snapshotsAreDetached() {
        List<String> deps = new ArrayList<>(List.of("db"));
        registry.register("cache", new Object(), deps);
        deps.add("queue");
        ServiceHealth before = registry.get("cache").orElseThrow();

        registry.update("cache", r -> {
            r.recordCheck(false, 5, 0.3, clock.instant());
            r.mergeMetadata(Map.of("lag", 3));
            return null;
        });

        assertThat(before.consecutiveFailures()).isZero();
        assertThat(before.metadata()).isEmpty();
        assertThat(registry.get("cache").orElseThrow().dependencies()).containsExactly("db");
        assertThat(registry.get("cache").orElseThrow().errorRate()).isEqualTo(0.3);
    }

    @Test
    void unregisterUnknownReturnsFalse() {
        assertThat(registry.unregister("ghost")).isFalse();
        assertThat(registry.unregister(null)).isFalse();
        assertThat(registry.update("ghost", HealthRecord::snapshot)).isEmpty();
    }

    @Test
    void statusChangePublishesEvent() {
        registry.register("cache", new Object(), List.of());
        clock.advance(Duration.ofSeconds(1));

        registry.update("cache", r -> {
            r.setStatus(ServiceStatus.DEGRADED);
            return null;
        });
        registry.update("cache", r -> {
            r.setStatus(ServiceStatus.DEGRADED);
            return null;
        });

        assertThat(publisher.eventsOf(ServiceHealthChangedEvent.class)).singleElement().satisfies(e -> {
            assertThat(e.serviceName()).isEqualTo("cache");
            assertThat(e.previousStatus()).isEqualTo(ServiceStatus.HEALTHY);
            assertThat(e.newStatus()).isEqualTo(ServiceStatus.DEGRADED);
            assertThat(e.health().status()).isEqualTo(ServiceStatus.DEGRADED);
            assertThat(e.at()).isEqualTo(clock.instant());
        });
    }

    @Test
    void handleReturnsRegisteredObject() {
        Object svc = new Object();
        registry.register("cache", svc, List.of());

        assertThat(registry.handle("cache")).containsSame(svc);
        assertThat(registry.handle("ghost")).isEmpty();
        assertThat(registry.getAll()).containsOnlyKeys("cache");
    }
}
