package org.carball.pgadvisor.model.metric;

public enum MetricKind {
    /** Monotonically increasing until a reset; reported as delta per second. */
    CUMULATIVE,
    /** Point-in-time value; reported as is. */
    GAUGE
}
