package com.phillippitts.autorecovery.service.strategy;

import com.phillippitts.autorecovery.config.properties.StrategyProperties;
import com.phillippitts.autorecovery.domain.RecoveryStrategy;
import com.phillippitts.autorecovery.domain.ServiceHealth;
import com.phillippitts.autorecovery.domain.ServiceStatus;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Rule-ordered strategy selection. First matching rule wins:
 * <ol>
 *   <li>FAILED with at least {@code isolate-failures} failures → ISOLATE</li>
 *   <li>error rate above {@code degrade-error-rate} and not FAILED → DEGRADE</li>
 *   <li>at least {@code restart-failures} failures → RESTART</li>
 *   <li>UNHEALTHY with a configured failover target → FAILOVER</li>
 *   <li>otherwise → RESTART</li>
 * </ol>
 */
@Component
public class ThresholdStrategySelector implements StrategySelector {

    private final StrategyProperties props;
    private final FailoverRegistry failover;

    public ThresholdStrategySelector(StrategyProperties props, FailoverRegistry failover) {
        this.props = Objects.requireNonNull(props, "props");
        this.failover = Objects.requireNonNull(failover, "failover");
    }

    @Override
    public RecoveryStrategy select(ServiceHealth health) {
        ServiceStatus status = health.status();
        int failures = health.consecutiveFailures();

        if (status == ServiceStatus.FAILED && failures >= props.getIsolateFailures()) {
            return RecoveryStrategy.ISOLATE;
        }
        if (health.errorRate() > props.getDegradeErrorRate() && status != ServiceStatus.FAILED) {
            return RecoveryStrategy.DEGRADE;
        }
        if (failures >= props.getRestartFailures()) {
            return RecoveryStrategy.RESTART;
        }
        if (status == ServiceStatus.UNHEALTHY && failover.hasTarget(health.name())) {
            return RecoveryStrategy.FAILOVER;
        }
        return RecoveryStrategy.RESTART;
    }
}
