package org.carball.pgadvisor.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.pgadvisor.model.metric.DerivedMetric;
import org.carball.pgadvisor.model.metric.MetricCatalog;
import org.carball.pgadvisor.model.metric.MetricDefinition;
import org.carball.pgadvisor.model.metric.MetricPoint;
import org.carball.pgadvisor.model.metric.MetricSource;
import org.carball.pgadvisor.model.metric.Normalization;
import org.carball.pgadvisor.model.snapshot.CounterSnapshot;
import org.carball.pgadvisor.model.snapshot.EntityId;
import org.carball.pgadvisor.model.snapshot.TimeRange;
import org.carball.pgadvisor.parser.SnapshotSource;
import org.carball.pgadvisor.parser.StoreUnavailableException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds per-metric time series for one entity from its stored snapshots.
 * <p>
 * Each counter source is its own timeline: snapshots are split by source, sorted, and every
 * consecutive pair goes through the {@link DeltaNormalizer}. Unavailable intervals are left out,
 * never interpolated. Points from different sources are merged by timestamp, not resampled, and
 * every series holds at most one point per instant.
 */
@Slf4j
public class MetricSeriesBuilder {

    private static final Comparator<MetricPoint> TIMELINE_ORDER = Comparator
            .comparing(MetricPoint::timestamp)
            .thenComparing(MetricPoint::source);

    private final SnapshotSource snapshotSource;
    private final DeltaNormalizer normalizer;

    public MetricSeriesBuilder(SnapshotSource snapshotSource) {
        this(snapshotSource, new DeltaNormalizer());
    }

    public MetricSeriesBuilder(SnapshotSource snapshotSource, DeltaNormalizer normalizer) {
        this.snapshotSource = snapshotSource;
        this.normalizer = normalizer;
    }

    /**
     * @return one entry per requested metric, in name order; each list is ordered by timestamp and
     *         may be empty
     * @throws StoreUnavailableException if the snapshot store cannot be read
     */
    public Map<String, List<MetricPoint>> buildSeries(EntityId entity, Set<String> metricNames, TimeRange range)
            throws StoreUnavailableException {
        List<CounterSnapshot> snapshots = new ArrayList<>(snapshotSource.fetchPrecedingSnapshots(entity, range.start()));
        snapshots.addAll(snapshotSource.fetchSnapshots(entity, range));
        log.debug("Building {} series for {} from {} snapshots", metricNames.size(), entity, snapshots.size());

        Map<MetricSource, List<CounterSnapshot>> timelines = splitBySource(entity, snapshots);

        Map<String, List<MetricPoint>> series = new LinkedHashMap<>();
        for (String metricName : new TreeSet<>(metricNames)) {
            List<MetricPoint> points = new ArrayList<>();
            for (Map.Entry<MetricSource, List<CounterSnapshot>> timeline : timelines.entrySet()) {
                points.addAll(buildTimeline(metricName, timeline.getKey(), timeline.getValue(), range));
            }
            points.sort(TIMELINE_ORDER);
            series.put(metricName, Collections.unmodifiableList(onePerTimestamp(metricName, points)));
        }
        return Collections.unmodifiableMap(series);
    }

    /**
     * An uncatalogued counter carried by several sources can land twice on the same instant; the
     * point of the first source in {@link MetricSource} order is kept.
     */
    private static List<MetricPoint> onePerTimestamp(String metricName, List<MetricPoint> sorted) {
        List<MetricPoint> kept = new ArrayList<>(sorted.size());
        for (MetricPoint point : sorted) {
            MetricPoint last = kept.isEmpty() ? null : kept.get(kept.size() - 1);
            if (last != null && last.timestamp().equals(point.timestamp())) {
                log.debug("Dropping {} value from {} at {}, already taken from {}",
                        metricName, point.source(), point.timestamp(), last.source());
                continue;
            }
            kept.add(point);
        }
        return kept;
    }

    private Map<MetricSource, List<CounterSnapshot>> splitBySource(EntityId entity, List<CounterSnapshot> snapshots) {
        Map<MetricSource, List<CounterSnapshot>> timelines = new EnumMap<>(MetricSource.class);
        for (CounterSnapshot snapshot : snapshots) {
            if (!snapshot.entityId().equals(entity)) {
                log.warn("Ignoring snapshot of {} returned for {}", snapshot.entityId(), entity);
                continue;
            }
            timelines.computeIfAbsent(snapshot.source(), source -> new ArrayList<>()).add(snapshot);
        }
        for (List<CounterSnapshot> timeline : timelines.values()) {
            timeline.sort(Comparator.comparing(CounterSnapshot::capturedAt));
        }
        return timelines;
    }

    private List<MetricPoint> buildTimeline(String metricName, MetricSource source,
                                            List<CounterSnapshot> timeline, TimeRange range) {
        Optional<DerivedMetric> derived = DerivedMetric.fromMetricName(metricName);
        if (derived.isPresent() && derived.get().getSource() != source) {
            return List.of();
        }
        if (derived.isEmpty() && !carries(metricName, source, timeline)) {
            return List.of();
        }

        List<MetricPoint> points = new ArrayList<>();
        int gaps = 0;
        for (int i = 1; i < timeline.size(); i++) {
            CounterSnapshot previous = timeline.get(i - 1);
            CounterSnapshot current = timeline.get(i);
            if (!range.contains(current.capturedAt())) {
                continue;
            }
            Normalization normalization = derived.isPresent()
                    ? normalizer.derive(previous, current, derived.get())
                    : normalizer.normalize(previous, current, metricName);
            if (normalization.isAvailable()) {
                points.add(normalization.point());
            } else {
                gaps++;
                log.debug("No {} value at {} ({}): {}", metricName, current.capturedAt(), source, normalization.reason());
            }
        }
        if (gaps > 0) {
            log.debug("{} series from {} has {} gaps", metricName, source, gaps);
        }
        return points;
    }

    /**
     * Catalogued metrics only come from the source that publishes them; unknown ones from any
     * source whose snapshots contain the counter.
     */
    private boolean carries(String metricName, MetricSource source, List<CounterSnapshot> timeline) {
        MetricCatalog catalog = normalizer.getCatalog();
        Optional<MetricDefinition> definition = catalog.find(metricName);
        if (definition.isPresent()) {
            return definition.get().source() == source;
        }
        return timeline.stream().anyMatch(snapshot -> snapshot.hasCounter(metricName));
    }
}
