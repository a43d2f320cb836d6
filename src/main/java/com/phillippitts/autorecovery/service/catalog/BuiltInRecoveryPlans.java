package com.phillippitts.autorecovery.service.catalog;

import com.phillippitts.autorecovery.domain.RecoveryContext;
import com.phillippitts.autorecovery.domain.RecoveryPlan;
import com.phillippitts.autorecovery.domain.RecoveryStep;
import com.phillippitts.autorecovery.domain.RecoveryStrategy;
import com.phillippitts.autorecovery.domain.RetryPolicy;
import com.phillippitts.autorecovery.domain.ServiceHealth;
import com.phillippitts.autorecovery.domain.ServiceStatus;
import com.phillippitts.autorecovery.domain.UserImpact;
import com.phillippitts.autorecovery.service.capability.Degradable;
import com.phillippitts.autorecovery.service.capability.Isolatable;
import com.phillippitts.autorecovery.service.capability.Restartable;
import com.phillippitts.autorecovery.service.capability.StatefulService;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * The four wildcard plans registered with every catalog, one per {@link RecoveryStrategy}.
 *
 * <p>Steps act on the supervised service through its optional capability interfaces
 * ({@link Restartable}, {@link Degradable}, {@link Isolatable}, {@link StatefulService}).
 * A service without the capability gets a successful no-op, so the verification step decides
 * whether the plan actually helped.
 */
public final class BuiltInRecoveryPlans {

    public static final String RESTART_ID = "restart_generic";
    public static final String DEGRADE_ID = "degrade_generic";
    public static final String ISOLATE_ID = "isolate_generic";
    public static final String FAILOVER_ID = "failover_generic";

    private BuiltInRecoveryPlans() {
    }

    public static List<RecoveryPlan> all() {
        return List.of(restart(), degrade(), isolate(), failover());
    }

    public static RecoveryPlan restart() {
        return RecoveryPlan.builder(RESTART_ID)
                .strategy(RecoveryStrategy.RESTART)
                .priority(100)
                .estimatedDuration(Duration.ofSeconds(30))
                .userImpact(UserImpact.LOW)
                .timeout(Duration.ofSeconds(60))
                .retryPolicy(RetryPolicy.exponential(2, Duration.ofSeconds(5), Duration.ofSeconds(30), true))
                .step(RecoveryStep.builder("Prepare Restart")
                        .description("Flush state and stop accepting new work")
                        .timeout(Duration.ofSeconds(5))
                        .retryCount(1)
                        .action(ctx -> with(ctx, Restartable.class, Restartable::prepareRestart))
                        .build())
                .step(RecoveryStep.builder("Stop Service")
                        .description("Stop the service gracefully")
                        .timeout(Duration.ofSeconds(10))
                        .retryCount(1)
                        .action(ctx -> with(ctx, Restartable.class, Restartable::stop))
                        .build())
                .step(RecoveryStep.builder("Clear Resources")
                        .description("Release caches and connections held by the service")
                        .timeout(Duration.ofSeconds(5))
                        .retryCount(1)
                        .action(ctx -> with(ctx, Restartable.class, Restartable::clearResources))
                        .build())
                .step(RecoveryStep.builder("Start Service")
                        .description("Start the service again")
                        .timeout(Duration.ofSeconds(15))
                        .retryCount(2)
                        .action(ctx -> with(ctx, Restartable.class, Restartable::start))
                        .build())
                .step(RecoveryStep.builder("Verify Health")
                        .description("Confirm the service and its dependencies are healthy")
                        .timeout(Duration.ofSeconds(10))
                        .retryCount(3)
                        .action(ctx -> ctx.probeHealth(ctx.serviceName()))
                        .verify(BuiltInRecoveryPlans::dependenciesAvailable)
                        .build())
                .build();
    }

    public static RecoveryPlan degrade() {
        return RecoveryPlan.builder(DEGRADE_ID)
                .strategy(RecoveryStrategy.DEGRADE)
                .priority(50)
                .estimatedDuration(Duration.ofSeconds(5))
                .userImpact(UserImpact.MEDIUM)
                .timeout(Duration.ofSeconds(30))
                .retryPolicy(RetryPolicy.fixed(1, Duration.ofSeconds(2)))
                .step(RecoveryStep.builder("Assess Degradation Options")
                        .description("Check whether the service offers a degraded mode")
                        .timeout(Duration.ofSeconds(3))
                        .retryCount(1)
                        .action(ctx -> ctx.capability(Degradable.class).map(Degradable::canDegrade).orElse(true))
                        .build())
                .step(RecoveryStep.builder("Apply Performance Limits")
                        .description("Reduce load on the service")
                        .timeout(Duration.ofSeconds(5))
                        .retryCount(1)
                        .action(ctx -> with(ctx, Degradable.class, Degradable::applyPerformanceLimits))
                        .build())
                .step(RecoveryStep.builder("Disable Non-Essential Features")
                        .description("Switch off optional features")
                        .timeout(Duration.ofSeconds(5))
                        .retryCount(1)
                        .action(ctx -> with(ctx, Degradable.class, Degradable::disableNonEssentialFeatures))
                        .rollback(ctx -> with(ctx, Degradable.class, Degradable::restoreFullOperation))
                        .build())
                .step(RecoveryStep.builder("Verify Degraded Operation")
                        .description("Confirm the service answers in degraded mode")
                        .timeout(Duration.ofSeconds(5))
                        .retryCount(2)
                        .action(ctx -> ctx.capability(Degradable.class).map(Degradable::isDegraded).orElse(true))
                        .verify(ctx -> ctx.probeHealth(ctx.serviceName()))
                        .build())
                .rollbackStep(RecoveryStep.builder("Restore Full Operation")
                        .action(ctx -> with(ctx, Degradable.class, Degradable::restoreFullOperation))
                        .build())
                .build();
    }

    public static RecoveryPlan isolate() {
        return RecoveryPlan.builder(ISOLATE_ID)
                .strategy(RecoveryStrategy.ISOLATE)
                .priority(200)
                .estimatedDuration(Duration.ofSeconds(10))
                .userImpact(UserImpact.HIGH)
                .timeout(Duration.ofSeconds(60))
                .retryPolicy(RetryPolicy.fixed(1, Duration.ofSeconds(1)))
                .step(RecoveryStep.builder("Assess Isolation Impact")
                        .description("Find the services that depend on this one")
                        .timeout(Duration.ofSeconds(3))
                        .retryCount(1)
                        .action(ctx -> {
                            ctx.recordMetric("dependents", ctx.dependentsOf(ctx.serviceName()));
                            return true;
                        })
                        .build())
                .step(RecoveryStep.builder("Reroute Dependencies")
                        .description("Send dependent traffic to a backup when one is configured")
                        .timeout(Duration.ofSeconds(5))
                        .retryCount(1)
                        .action(ctx -> {
                            ctx.failoverTarget().ifPresent(ctx::activateFailover);
                            return true;
                        })
                        .rollback(ctx -> {
                            ctx.deactivateFailover();
                            return true;
                        })
                        .build())
                .step(RecoveryStep.builder("Isolate Service")
                        .description("Cut the service off from the rest of the system")
                        .timeout(Duration.ofSeconds(5))
                        .retryCount(1)
                        .action(ctx -> with(ctx, Isolatable.class, Isolatable::isolate))
                        .build())
                .step(RecoveryStep.builder("Verify System Stability")
                        .description("Confirm the isolation holds and no dependent has failed")
                        .timeout(Duration.ofSeconds(5))
                        .retryCount(2)
                        .action(ctx -> ctx.capability(Isolatable.class).map(Isolatable::isIsolated).orElse(true))
                        .verify(BuiltInRecoveryPlans::dependentsStable)
                        .build())
                .rollbackStep(RecoveryStep.builder("Rejoin Service")
                        .action(ctx -> with(ctx, Isolatable.class, Isolatable::rejoin))
                        .build())
                .rollbackStep(RecoveryStep.builder("Restore Routing")
                        .action(ctx -> {
                            ctx.deactivateFailover();
                            return true;
                        })
                        .build())
                .build();
    }

    public static RecoveryPlan failover() {
        return RecoveryPlan.builder(FAILOVER_ID)
                .strategy(RecoveryStrategy.FAILOVER)
                .priority(150)
                .estimatedDuration(Duration.ofSeconds(60))
                .userImpact(UserImpact.MEDIUM)
                .timeout(Duration.ofSeconds(120))
                .retryPolicy(RetryPolicy.fixed(1, Duration.ofSeconds(5)))
                .step(RecoveryStep.builder("Identify Backup Service")
                        .description("Resolve the configured backup and check it is registered")
                        .timeout(Duration.ofSeconds(5))
                        .retryCount(1)
                        .action(ctx -> {
                            Optional<String> backup = ctx.failoverTarget();
                            backup.ifPresent(b -> ctx.recordMetric("backupService", b));
                            return backup.flatMap(ctx::lookupService).isPresent();
                        })
                        .build())
                .step(RecoveryStep.builder("Prepare Backup Service")
                        .description("Health-check the backup before moving traffic")
                        .timeout(Duration.ofSeconds(15))
                        .retryCount(1)
                        .action(ctx -> ctx.failoverTarget().map(ctx::probeHealth).orElse(false))
                        .build())
                .step(RecoveryStep.builder("Transfer Service State")
                        .description("Copy state from the failing service to the backup")
                        .timeout(Duration.ofSeconds(20))
                        .retryCount(1)
                        .action(BuiltInRecoveryPlans::transferState)
                        .build())
                .step(RecoveryStep.builder("Activate Backup Service")
                        .description("Route traffic to the backup")
                        .timeout(Duration.ofSeconds(10))
                        .retryCount(2)
                        .action(ctx -> {
                            Optional<String> backup = ctx.failoverTarget();
                            backup.ifPresent(ctx::activateFailover);
                            return backup.isPresent();
                        })
                        .rollback(ctx -> {
                            ctx.deactivateFailover();
                            return true;
                        })
                        .build())
                .step(RecoveryStep.builder("Verify Failover Success")
                        .description("Confirm the backup is serving and healthy")
                        .timeout(Duration.ofSeconds(10))
                        .retryCount(3)
                        .action(ctx -> ctx.activeFailover().map(ctx::probeHealth).orElse(false))
                        .verify(ctx -> ctx.activeFailover().equals(ctx.failoverTarget()))
                        .build())
                .rollbackStep(RecoveryStep.builder("Deactivate Failover")
                        .action(ctx -> {
                            ctx.deactivateFailover();
                            return true;
                        })
                        .build())
                .build();
    }

    private static <T> boolean with(RecoveryContext ctx, Class<T> capability, CapabilityCall<T> call) throws Exception {
        Optional<T> target = ctx.capability(capability);
        if (target.isPresent()) {
            call.apply(target.get());
        }
        return true;
    }

    static boolean dependenciesAvailable(RecoveryContext ctx) {
        List<String> deps = ctx.health(ctx.serviceName()).map(ServiceHealth::dependencies).orElse(List.of());
        return deps.stream().noneMatch(dep -> isFailed(ctx, dep));
    }

    static boolean dependentsStable(RecoveryContext ctx) {
        return ctx.dependentsOf(ctx.serviceName()).stream().noneMatch(dep -> isFailed(ctx, dep));
    }

    private static boolean isFailed(RecoveryContext ctx, String name) {
        return ctx.health(name).map(h -> h.status() == ServiceStatus.FAILED).orElse(false);
    }

    private static boolean transferState(RecoveryContext ctx) throws Exception {
        Optional<StatefulService> primary = ctx.capability(StatefulService.class);
        Optional<StatefulService> backup = ctx.failoverTarget()
                .flatMap(ctx::lookupService)
                .filter(StatefulService.class::isInstance)
                .map(StatefulService.class::cast);
        if (primary.isPresent() && backup.isPresent()) {
            backup.get().importState(primary.get().exportState());
            ctx.recordMetric("stateTransferred", true);
        }
        return true;
    }

    @FunctionalInterface
    private interface CapabilityCall<T> {
        void apply(T target) throws Exception;
    }
}
