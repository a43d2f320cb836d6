package com.phillippitts.autorecovery.service.health;

import com.phillippitts.autorecovery.domain.RecoveryStatistics;
import com.phillippitts.autorecovery.service.RecoveryManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the orchestrator as a whole.
 *
 * <p>Reports:
 * <ul>
 *   <li>DOWN: more than 50% of supervised services unhealthy</li>
 *   <li>DEGRADED: more than 20% unhealthy</li>
 *   <li>WARNING: recovery success rate below 95%</li>
 *   <li>UP: otherwise</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class RecoveryManagerHealthIndicator implements HealthIndicator {

    static final double CRITICAL_RATIO = 0.5;
    static final double DEGRADED_RATIO = 0.2;
    static final double MIN_SUCCESS_RATE = 95.0;

    private final RecoveryManager manager;

    public RecoveryManagerHealthIndicator(RecoveryManager manager) {
        this.manager = manager;
    }

    @Override
    public Health health() {
        RecoveryStatistics stats = manager.getStatistics();
        int finished = stats.successfulRecoveries() + stats.failedRecoveries();
        double recoveryRate = finished > 0 ? stats.successfulRecoveries() * 100.0 / finished : 100.0;

        Health.Builder builder;
        if (stats.unhealthyServices() > stats.totalServices() * CRITICAL_RATIO) {
            builder = Health.down().withDetail("status", "Most supervised services are unhealthy");
        } else if (stats.unhealthyServices() > stats.totalServices() * DEGRADED_RATIO) {
            builder = Health.status("DEGRADED").withDetail("status", "Some supervised services are unhealthy");
        } else if (recoveryRate < MIN_SUCCESS_RATE) {
            builder = Health.status("WARNING").withDetail("status", "Recoveries are failing");
        } else {
            builder = Health.up().withDetail("status", "Supervised services operational");
        }

        return builder
                .withDetail("recoveryRate", recoveryRate)
                .withDetail("servicesMonitored", stats.totalServices())
                .withDetail("healthyServices", stats.healthyServices())
                .withDetail("unhealthyServices", stats.unhealthyServices())
                .withDetail("recoveringServices", stats.recoveringServices())
                .withDetail("activeRecoveries", stats.activeRecoveries())
                .withDetail("queuedRecoveries", stats.queuedRecoveries())
                .withDetail("successfulRecoveries", stats.successfulRecoveries())
                .withDetail("failedRecoveries", stats.failedRecoveries())
                .build();
    }
}
