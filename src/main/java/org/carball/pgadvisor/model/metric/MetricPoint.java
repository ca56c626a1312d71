package org.carball.pgadvisor.model.metric;

import java.time.Instant;

/**
 * One value of a series, stamped with the capture time of the later snapshot of its interval.
 */
public record MetricPoint(
        Instant timestamp,
        String metricName,
        double value,
        MetricSource source
) {}
