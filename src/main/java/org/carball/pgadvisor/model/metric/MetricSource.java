package org.carball.pgadvisor.model.metric;

/**
 * Counter sources a snapshot can come from. Each source is collected on its own cadence, so
 * its snapshots form an independent timeline.
 */
public enum MetricSource {
    QUERY_EXECUTION("pg_stat_statements"),
    IO("pg_stat_io"),
    CACHE("pg_stat_database"),
    WAIT_EVENT("pg_wait_sampling"),
    OS("pg_stat_kcache");

    private final String extension;

    MetricSource(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public static MetricSource fromName(String name) {
        for (MetricSource source : values()) {
            if (source.name().equalsIgnoreCase(name.replace('-', '_')) || source.extension.equalsIgnoreCase(name)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown metric source: " + name);
    }
}
