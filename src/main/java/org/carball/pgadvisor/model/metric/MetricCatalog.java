package org.carball.pgadvisor.model.metric;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Known counters and the source that publishes them. Unknown names are accepted by the series
 * builder and treated as cumulative counters of whatever source carries them.
 */
public class MetricCatalog {

    private final Map<String, MetricDefinition> definitions;

    public MetricCatalog(Collection<MetricDefinition> definitions) {
        Map<String, MetricDefinition> byName = new LinkedHashMap<>();
        for (MetricDefinition definition : definitions) {
            if (byName.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("Duplicate metric definition: " + definition.name());
            }
        }
        this.definitions = Collections.unmodifiableMap(byName);
    }

    public static MetricCatalog defaults() {
        return new MetricCatalog(List.of(
            // pg_stat_statements
            MetricDefinition.cumulative("calls", MetricSource.QUERY_EXECUTION, "calls"),
            MetricDefinition.cumulative("total_exec_time", MetricSource.QUERY_EXECUTION, "ms"),
            MetricDefinition.cumulative("total_plan_time", MetricSource.QUERY_EXECUTION, "ms"),
            MetricDefinition.cumulative("rows", MetricSource.QUERY_EXECUTION, "rows"),
            MetricDefinition.cumulative("shared_blks_hit", MetricSource.QUERY_EXECUTION, "blocks"),
            MetricDefinition.cumulative("shared_blks_read", MetricSource.QUERY_EXECUTION, "blocks"),
            MetricDefinition.cumulative("shared_blks_dirtied", MetricSource.QUERY_EXECUTION, "blocks"),
            MetricDefinition.cumulative("shared_blks_written", MetricSource.QUERY_EXECUTION, "blocks"),
            MetricDefinition.cumulative("local_blks_hit", MetricSource.QUERY_EXECUTION, "blocks"),
            MetricDefinition.cumulative("local_blks_read", MetricSource.QUERY_EXECUTION, "blocks"),
            MetricDefinition.cumulative("temp_blks_read", MetricSource.QUERY_EXECUTION, "blocks"),
            MetricDefinition.cumulative("temp_blks_written", MetricSource.QUERY_EXECUTION, "blocks"),
            MetricDefinition.cumulative("blk_read_time", MetricSource.QUERY_EXECUTION, "ms"),
            MetricDefinition.cumulative("blk_write_time", MetricSource.QUERY_EXECUTION, "ms"),
            MetricDefinition.cumulative("wal_records", MetricSource.QUERY_EXECUTION, "records"),
            MetricDefinition.cumulative("wal_bytes", MetricSource.QUERY_EXECUTION, "bytes"),
            // pg_stat_io
            MetricDefinition.cumulative("io_reads", MetricSource.IO, "operations"),
            MetricDefinition.cumulative("io_writes", MetricSource.IO, "operations"),
            MetricDefinition.cumulative("io_read_time", MetricSource.IO, "ms"),
            MetricDefinition.cumulative("io_write_time", MetricSource.IO, "ms"),
            // pg_stat_database
            MetricDefinition.cumulative("blks_hit", MetricSource.CACHE, "blocks"),
            MetricDefinition.cumulative("blks_read", MetricSource.CACHE, "blocks"),
            MetricDefinition.gauge("numbackends", MetricSource.CACHE, "backends"),
            // pg_wait_sampling
            MetricDefinition.cumulative("wait_event_count", MetricSource.WAIT_EVENT, "samples"),
            // pg_stat_kcache
            MetricDefinition.cumulative("os_reads", MetricSource.OS, "bytes"),
            MetricDefinition.cumulative("os_writes", MetricSource.OS, "bytes"),
            MetricDefinition.cumulative("os_user_time", MetricSource.OS, "s"),
            MetricDefinition.cumulative("os_system_time", MetricSource.OS, "s"),
            MetricDefinition.cumulative("os_minflts", MetricSource.OS, "faults"),
            MetricDefinition.cumulative("os_majflts", MetricSource.OS, "faults")
        ));
    }

    public Optional<MetricDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    /**
     * Definition to use for {@code name} when read from a snapshot of {@code source}.
     */
    public MetricDefinition resolve(String name, MetricSource source) {
        return find(name).orElseGet(() -> MetricDefinition.cumulative(name, source, "unknown"));
    }

    /**
     * Unit of a catalogued or derived metric as it appears in a series: per second for cumulative
     * counters, as-is for gauges and ratios. Empty for unknown names.
     */
    public Optional<String> seriesUnit(String name) {
        Optional<DerivedMetric> derived = DerivedMetric.fromMetricName(name);
        if (derived.isPresent()) {
            return Optional.of(derived.get().getUnit());
        }
        return find(name).map(definition -> definition.isCumulative() ? definition.unit() + "/s" : definition.unit());
    }

    public Collection<MetricDefinition> all() {
        return definitions.values();
    }
}
