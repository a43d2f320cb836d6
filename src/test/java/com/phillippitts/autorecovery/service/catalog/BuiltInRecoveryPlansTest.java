package com.phillippitts.autorecovery.service.catalog;

import com.phillippitts.autorecovery.domain.ExecutionStatus;
import com.phillippitts.autorecovery.domain.RecoveryExecution;
import com.phillippitts.autorecovery.domain.RecoveryPlan;
import com.phillippitts.autorecovery.domain.RecoveryStep;
import com.phillippitts.autorecovery.domain.RecoveryStrategy;
import com.phillippitts.autorecovery.domain.ServiceStatus;
import com.phillippitts.autorecovery.domain.UserImpact;
import com.phillippitts.autorecovery.service.capability.Degradable;
import com.phillippitts.autorecovery.service.capability.Isolatable;
import com.phillippitts.autorecovery.service.capability.StatefulService;
import com.phillippitts.autorecovery.service.registry.HealthCheckResult;
import com.phillippitts.autorecovery.service.registry.HealthCheckable;
import com.phillippitts.autorecovery.testutil.FakeService;
import com.phillippitts.autorecovery.testutil.RecoveryFixture;
import com.phillippitts.autorecovery.util.Deadline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class BuiltInRecoveryPlansTest {

    private RecoveryFixture fx;

    @BeforeEach
    void setUp() {
        fx = new RecoveryFixture();
    }

    @Test
    void builtInPlanShapes() {
        assertThat(BuiltInRecoveryPlans.restart().steps()).extracting(RecoveryStep::name).containsExactly(
                "Prepare Restart", "Stop Service", "Clear Resources", "Start Service", "Verify Health");
        assertThat(BuiltInRecoveryPlans.restart().timeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(BuiltInRecoveryPlans.degrade().steps()).hasSize(4);
        assertThat(BuiltInRecoveryPlans.isolate().userImpact()).isEqualTo(UserImpact.HIGH);
        assertThat(BuiltInRecoveryPlans.failover().steps()).hasSize(5);
        assertThat(BuiltInRecoveryPlans.all()).allMatch(RecoveryPlan::isWildcard);
    }

    @Test
    void failoverMovesStateAndActivatesBackup() {
        StatefulFake primary = new StatefulFake("session-42");
        StatefulFake backup = new StatefulFake(null);
        fx.registry.register("payments", primary, List.of());
        fx.registry.register("payments-standby", backup, List.of());
        fx.failover.setTarget("payments", "payments-standby");

        RecoveryExecution execution = run("payments", RecoveryStrategy.FAILOVER);

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(backup.state.get()).isEqualTo("session-42");
        assertThat(fx.failover.activeRoute("payments")).contains("payments-standby");
        assertThat(execution.getMetrics()).containsEntry("backupService", "payments-standby")
                .containsEntry("stateTransferred", true);
    }

    @Test
    void failoverWithoutTargetFailsAtFirstStep() {
        fx.registry.register("payments", new FakeService(), List.of());

        RecoveryExecution execution = run("payments", RecoveryStrategy.FAILOVER);

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(execution.getCurrentStep()).isEqualTo(1);
        assertThat(execution.getErrors()).singleElement().asString().startsWith("Step 1 (Identify Backup Service)");
    }

    @Test
    void successfulRestartClearsFailoverRoute() {
        fx.registry.register("payments", new FakeService(), List.of());
        fx.failover.activate("payments", "payments-standby");

        RecoveryExecution execution = run("payments", RecoveryStrategy.RESTART);

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(fx.failover.activeRoute("payments")).isEmpty();
    }

    @Test
    void restartFailsVerificationWhenDependencyFailed() {
        fx.registry.register("db", new FakeService(), List.of());
        fx.registry.register("api", new FakeService(), List.of("db"));
        fx.registry.update("db", r -> {
            r.setStatus(ServiceStatus.FAILED);
            return null;
        });

        RecoveryExecution execution = run("api", RecoveryStrategy.RESTART);

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(execution.getCurrentStep()).isEqualTo(5);
    }

    @Test
    void degradeAppliesLimitsAndRollbackRestores() {
        DegradableFake search = new DegradableFake();
        fx.registry.register("search", search, List.of());

        RecoveryExecution execution = run("search", RecoveryStrategy.DEGRADE);

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(search.degraded).isTrue();
        assertThat(search.limited).isTrue();

        assertThat(fx.scheduler.rollback(execution.getId())).isTrue();
        assertThat(search.degraded).isFalse();
    }

    @Test
    void isolateRecordsDependentsAndIsolates() {
        IsolatableFake queue = new IsolatableFake();
        fx.registry.register("queue", queue, List.of());
        fx.registry.register("worker", new FakeService(), List.of("queue"));
        fx.registry.register("mailer", new FakeService(), List.of("queue"));

        RecoveryExecution execution = run("queue", RecoveryStrategy.ISOLATE);

        assertThat(execution.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
        assertThat(queue.isolated).isTrue();
        assertThat(execution.getMetrics()).containsEntry("dependents", List.of("mailer", "worker"));

        assertThat(fx.scheduler.rollback(execution.getId())).isTrue();
        assertThat(queue.isolated).isFalse();
    }

    private RecoveryExecution run(String service, RecoveryStrategy strategy) {
        String id = fx.scheduler.trigger(service, "test", strategy).orElseThrow();
        fx.scheduler.dispatch();
        return fx.scheduler.get(id).orElseThrow();
    }

    private static final class StatefulFake implements StatefulService, HealthCheckable {
        private final AtomicReference<Object> state;

        private StatefulFake(Object initial) {
            this.state = new AtomicReference<>(initial);
        }

        @Override
        public Object exportState() {
            return state.get();
        }

        @Override
        public void importState(Object value) {
            state.set(value);
        }

        @Override
        public HealthCheckResult checkHealth(Deadline deadline) {
            return HealthCheckResult.ok();
        }
    }

    private static final class DegradableFake implements Degradable {
        private volatile boolean limited;
        private volatile boolean degraded;

        @Override
        public void applyPerformanceLimits() {
            limited = true;
        }

        @Override
        public void disableNonEssentialFeatures() {
            degraded = true;
        }

        @Override
        public boolean isDegraded() {
            return degraded;
        }

        @Override
        public void restoreFullOperation() {
            degraded = false;
            limited = false;
        }
    }

    private static final class IsolatableFake implements Isolatable {
        private volatile boolean isolated;

        @Override
        public void isolate() {
            isolated = true;
        }

        @Override
        public boolean isIsolated() {
            return isolated;
        }

        @Override
        public void rejoin() {
            isolated = false;
        }
    }
}
