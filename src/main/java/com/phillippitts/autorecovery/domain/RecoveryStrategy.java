package com.phillippitts.autorecovery.domain;

/** Category of remedy applied to a degraded service. */
public enum RecoveryStrategy {
    RESTART,
    DEGRADE,
    ISOLATE,
    FAILOVER
}
