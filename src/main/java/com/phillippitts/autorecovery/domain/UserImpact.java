package com.phillippitts.autorecovery.domain;

/** How visible a recovery plan is to end users. Anything above NONE triggers user notifications. */
public enum UserImpact {
    NONE,
    LOW,
    MEDIUM,
    HIGH
}
