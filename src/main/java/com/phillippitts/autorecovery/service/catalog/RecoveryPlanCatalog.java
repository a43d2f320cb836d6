package com.phillippitts.autorecovery.service.catalog;

import com.phillippitts.autorecovery.domain.RecoveryPlan;
import com.phillippitts.autorecovery.domain.RecoveryStep;
import com.phillippitts.autorecovery.domain.RecoveryStrategy;
import com.phillippitts.autorecovery.exception.InvalidRecoveryPlanException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of recovery plans, looked up by (service, strategy).
 *
 * <p>Holds the built-in wildcard plans plus any custom plans, either registered at runtime
 * or declared as {@link RecoveryPlan} beans. Plans are validated once on registration and
 * are read-only afterwards.
 *
 * <p>Lookup precedence: a plan naming the service exactly beats a wildcard plan; among
 * several candidates the highest priority wins, ties broken by plan id.
 */
@Component
public class RecoveryPlanCatalog {

    private static final Logger LOG = LogManager.getLogger(RecoveryPlanCatalog.class);

    private static final Comparator<RecoveryPlan> PREFERENCE =
            Comparator.comparingInt(RecoveryPlan::priority).reversed().thenComparing(RecoveryPlan::id);

    private final ConcurrentHashMap<String, RecoveryPlan> plans = new ConcurrentHashMap<>();

    /** Catalog with the built-in plans only. */
    public RecoveryPlanCatalog() {
        this(List.of());
    }

    public RecoveryPlanCatalog(Collection<RecoveryPlan> customPlans) {
        BuiltInRecoveryPlans.all().forEach(this::register);
        customPlans.forEach(this::register);
        LOG.info("Recovery plan catalog initialized: plans={}", plans.keySet());
    }

    @Autowired
    public RecoveryPlanCatalog(ObjectProvider<RecoveryPlan> customPlans) {
        this(customPlans.orderedStream().toList());
    }

    /**
     * Validates and adds a plan.
     *
     * @throws InvalidRecoveryPlanException if the plan is malformed or its id is taken
     */
    public void register(RecoveryPlan plan) {
        validate(plan);
        RecoveryPlan existing = plans.putIfAbsent(plan.id(), plan);
        if (existing != null) {
            throw new InvalidRecoveryPlanException(plan.id(), "a plan with this id is already registered");
        }
        LOG.debug("Recovery plan registered: {}", plan);
    }

    /**
     * Best plan for the service and strategy: exact name match first, then wildcard.
     */
    public Optional<RecoveryPlan> find(String serviceName, RecoveryStrategy strategy) {
        Optional<RecoveryPlan> exact = plans.values().stream()
                .filter(p -> p.strategy() == strategy && p.serviceName().equals(serviceName))
                .min(PREFERENCE);
        if (exact.isPresent()) {
            return exact;
        }
        return plans.values().stream()
                .filter(p -> p.strategy() == strategy && p.isWildcard())
                .min(PREFERENCE);
    }

    public Optional<RecoveryPlan> get(String planId) {
        return Optional.ofNullable(planId == null ? null : plans.get(planId));
    }

    /** Copy of all plans keyed by id, in id order. */
    public Map<String, RecoveryPlan> getAll() {
        Map<String, RecoveryPlan> copy = new LinkedHashMap<>();
        plans.values().stream()
                .sorted(Comparator.comparing(RecoveryPlan::id))
                .forEach(p -> copy.put(p.id(), p));
        return copy;
    }

    private static void validate(RecoveryPlan plan) {
        if (plan == null) {
            throw new InvalidRecoveryPlanException(null, "plan must not be null");
        }
        String id = plan.id();
        if (id == null || id.isBlank()) {
            throw new InvalidRecoveryPlanException(id, "id must not be empty");
        }
        if (plan.strategy() == null) {
            throw new InvalidRecoveryPlanException(id, "strategy is required");
        }
        if (plan.serviceName() == null || plan.serviceName().isBlank()) {
            throw new InvalidRecoveryPlanException(id, "target service name must not be empty (use '*' for any service)");
        }
        if (plan.steps().isEmpty()) {
            throw new InvalidRecoveryPlanException(id, "at least one step is required");
        }
        if (!isPositive(plan.timeout())) {
            throw new InvalidRecoveryPlanException(id, "timeout must be positive");
        }
        for (RecoveryStep step : plan.steps()) {
            validateStep(id, step);
        }
        for (RecoveryStep step : plan.rollbackSteps()) {
            validateStep(id, step);
        }
    }

    private static void validateStep(String planId, RecoveryStep step) {
        if (step.name() == null || step.name().isBlank()) {
            throw new InvalidRecoveryPlanException(planId, "step name must not be empty");
        }
        if (!isPositive(step.timeout())) {
            throw new InvalidRecoveryPlanException(planId, "step '" + step.name() + "' timeout must be positive");
        }
    }

    private static boolean isPositive(Duration d) {
        return d != null && !d.isNegative() && !d.isZero();
    }
}
