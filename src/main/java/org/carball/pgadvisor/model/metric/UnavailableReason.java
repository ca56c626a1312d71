package org.carball.pgadvisor.model.metric;

public enum UnavailableReason {
    RESTART,
    COUNTER_RESET,
    ZERO_DURATION,
    MISSING_COUNTER,
    ZERO_DENOMINATOR
}
