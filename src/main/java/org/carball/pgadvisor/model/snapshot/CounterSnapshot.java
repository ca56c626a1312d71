package org.carball.pgadvisor.model.snapshot;

import lombok.Builder;
import lombok.Singular;
import org.carball.pgadvisor.model.metric.MetricSource;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Objects;

/**
 * Cumulative counters of one source for one entity, as captured by the collector at a point in time.
 * {@code restart} is set when the server restarted (or the extension reloaded) since the previous capture.
 * The capture instant is kept to the microsecond, the precision of a PostgreSQL timestamp.
 */
@Builder(toBuilder = true)
public record CounterSnapshot(
        EntityId entityId,
        MetricSource source,
        Instant capturedAt,
        @Singular Map<String, BigDecimal> counters,
        boolean restart
) {

    public CounterSnapshot {
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(capturedAt, "capturedAt");
        capturedAt = capturedAt.truncatedTo(ChronoUnit.MICROS);
        counters = counters == null ? Map.of() : Map.copyOf(counters);
    }

    public BigDecimal counter(String metricName) {
        return counters.get(metricName);
    }

    public boolean hasCounter(String metricName) {
        return counters.containsKey(metricName);
    }
}
