package com.phillippitts.autorecovery.domain;

/** Growth function for the delay between retry attempts. */
public enum BackoffStrategy {
    FIXED,
    LINEAR,
    EXPONENTIAL
}
