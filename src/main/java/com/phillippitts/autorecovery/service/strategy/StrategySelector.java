package com.phillippitts.autorecovery.service.strategy;

import com.phillippitts.autorecovery.domain.RecoveryStrategy;
import com.phillippitts.autorecovery.domain.ServiceHealth;

/**
 * Chooses a recovery strategy when a trigger does not name one.
 */
@FunctionalInterface
public interface StrategySelector {

    /**
     * @param health current snapshot of the service to recover
     * @return strategy to use, never null
     */
    RecoveryStrategy select(ServiceHealth health);
}
