package org.carball.pgadvisor.model.metric;

public record MetricDefinition(
        String name,
        MetricSource source,
        MetricKind kind,
        String unit
) {

    public static MetricDefinition cumulative(String name, MetricSource source, String unit) {
        return new MetricDefinition(name, source, MetricKind.CUMULATIVE, unit);
    }

    public static MetricDefinition gauge(String name, MetricSource source, String unit) {
        return new MetricDefinition(name, source, MetricKind.GAUGE, unit);
    }

    public boolean isCumulative() {
        return kind == MetricKind.CUMULATIVE;
    }
}
