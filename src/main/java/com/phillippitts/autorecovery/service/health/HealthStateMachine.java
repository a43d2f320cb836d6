package com.phillippitts.autorecovery.service.health;

import com.phillippitts.autorecovery.config.properties.RecoveryProperties;
import com.phillippitts.autorecovery.domain.ServiceStatus;
import com.phillippitts.autorecovery.service.registry.HealthRecord;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Maps a consecutive-failure count to a health status.
 *
 * <pre>
 * failures &lt; degraded            → HEALTHY
 * degraded  ≤ failures &lt; unhealthy → DEGRADED
 * unhealthy ≤ failures &lt; failed    → UNHEALTHY
 * failures ≥ failed                 → FAILED
 * </pre>
 *
 * Defaults are 1, 3 and 5.
 */
@Component
public class HealthStateMachine {

    private final int degradedThreshold;
    private final int unhealthyThreshold;
    private final int failedThreshold;

    @Autowired
    public HealthStateMachine(RecoveryProperties props) {
        this(props.getHealth().getDegradedThreshold(),
                props.getHealth().getUnhealthyThreshold(),
                props.getHealth().getFailedThreshold());
    }

    HealthStateMachine(int degradedThreshold, int unhealthyThreshold, int failedThreshold) {
        if (!(degradedThreshold <= unhealthyThreshold && unhealthyThreshold <= failedThreshold)) {
            throw new IllegalArgumentException("thresholds must satisfy degraded <= unhealthy <= failed, got "
                    + degradedThreshold + "/" + unhealthyThreshold + "/" + failedThreshold);
        }
        this.degradedThreshold = degradedThreshold;
        this.unhealthyThreshold = unhealthyThreshold;
        this.failedThreshold = failedThreshold;
    }

    public ServiceStatus statusFor(int consecutiveFailures) {
        if (consecutiveFailures >= failedThreshold) {
            return ServiceStatus.FAILED;
        }
        if (consecutiveFailures >= unhealthyThreshold) {
            return ServiceStatus.UNHEALTHY;
        }
        if (consecutiveFailures >= degradedThreshold) {
            return ServiceStatus.DEGRADED;
        }
        return ServiceStatus.HEALTHY;
    }

    /**
     * Moves a RECOVERING record back to the status implied by its failure streak. Used when a
     * recovery fails or is cancelled. Other statuses are left alone.
     *
     * @return true if the record was RECOVERING
     */
    public boolean leaveRecovering(HealthRecord record) {
        if (record.getStatus() != ServiceStatus.RECOVERING) {
            return false;
        }
        record.setStatus(statusFor(record.getConsecutiveFailures()));
        return true;
    }
}
