package org.carball.pgadvisor.model.metric;

import java.util.List;
import java.util.Optional;

/**
 * Ratio series computed from the deltas of counters of a single source over the same interval.
 * The value is the numerator delta divided by the sum of the denominator deltas, times {@code factor}.
 */
public enum DerivedMetric {
    AVG_RUNTIME("avg_runtime", MetricSource.QUERY_EXECUTION, "ms",
            "total_exec_time", List.of("calls"), 1.0),
    AVG_ROWS("avg_rows", MetricSource.QUERY_EXECUTION, "rows",
            "rows", List.of("calls"), 1.0),
    SHARED_HIT_RATIO("shared_hit_ratio", MetricSource.QUERY_EXECUTION, "%",
            "shared_blks_hit", List.of("shared_blks_hit", "shared_blks_read"), 100.0),
    HIT_RATIO("hit_ratio", MetricSource.CACHE, "%",
            "blks_hit", List.of("blks_hit", "blks_read"), 100.0);

    private final String metricName;
    private final MetricSource source;
    private final String unit;
    private final String numerator;
    private final List<String> denominators;
    private final double factor;

    DerivedMetric(String metricName, MetricSource source, String unit,
                  String numerator, List<String> denominators, double factor) {
        this.metricName = metricName;
        this.source = source;
        this.unit = unit;
        this.numerator = numerator;
        this.denominators = denominators;
        this.factor = factor;
    }

    public String getMetricName() {
        return metricName;
    }

    public MetricSource getSource() {
        return source;
    }

    public String getUnit() {
        return unit;
    }

    public String getNumerator() {
        return numerator;
    }

    public List<String> getDenominators() {
        return denominators;
    }

    public double getFactor() {
        return factor;
    }

    public static Optional<DerivedMetric> fromMetricName(String name) {
        for (DerivedMetric metric : values()) {
            if (metric.metricName.equals(name)) {
                return Optional.of(metric);
            }
        }
        return Optional.empty();
    }
}
