package com.phillippitts.autorecovery.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds used by the strategy selector.
 *
 * <p>The defaults (5 failures → isolate, error rate above 0.5 → degrade, 3 failures → restart)
 * are heuristics carried over from production use; tune them per deployment.
 */
@Validated
@ConfigurationProperties(prefix = "recovery.strategy")
public class StrategyProperties {

    /** Consecutive failures of a FAILED service at which isolation is chosen. */
    @Positive
    private final int isolateFailures;

    /** Consecutive failures at which a restart is chosen. */
    @Positive
    private final int restartFailures;

    /** Error rate strictly above which graceful degradation is chosen. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double degradeErrorRate;

    @ConstructorBinding
    public StrategyProperties(Integer isolateFailures, Integer restartFailures, Double degradeErrorRate) {
        this.isolateFailures = isolateFailures == null ? 5 : isolateFailures;
        this.restartFailures = restartFailures == null ? 3 : restartFailures;
        this.degradeErrorRate = degradeErrorRate == null ? 0.5 : degradeErrorRate;
    }

    /** Defaults for tests and programmatic construction. */
    public static StrategyProperties defaults() {
        return new StrategyProperties(null, null, null);
    }

    public int getIsolateFailures() {
        return isolateFailures;
    }

    public int getRestartFailures() {
        return restartFailures;
    }

    public double getDegradeErrorRate() {
        return degradeErrorRate;
    }
}
