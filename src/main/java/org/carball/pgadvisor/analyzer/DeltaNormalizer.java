package org.carball.pgadvisor.analyzer;

import org.carball.pgadvisor.model.metric.DerivedMetric;
import org.carball.pgadvisor.model.metric.Interval;
import org.carball.pgadvisor.model.metric.MetricCatalog;
import org.carball.pgadvisor.model.metric.MetricDefinition;
import org.carball.pgadvisor.model.metric.MetricPoint;
import org.carball.pgadvisor.model.metric.Normalization;
import org.carball.pgadvisor.model.metric.UnavailableReason;
import org.carball.pgadvisor.model.snapshot.CounterSnapshot;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Turns two consecutive snapshots of the same entity and source into a per-second rate.
 * <p>
 * Durations are taken as whole microseconds between the two capture instants and all counter
 * arithmetic is done in {@link BigDecimal}, so a span that crosses a second boundary never comes out
 * negative or truncated. A counter that went down (stats reset, extension reload) and a snapshot
 * flagged as taken after a restart yield {@link Normalization#unavailable unavailable} rather than
 * a negative rate.
 */
public class DeltaNormalizer {

    private final MetricCatalog catalog;

    public DeltaNormalizer() {
        this(MetricCatalog.defaults());
    }

    public DeltaNormalizer(MetricCatalog catalog) {
        this.catalog = catalog;
    }

    public MetricCatalog getCatalog() {
        return catalog;
    }

    /**
     * @throws OutOfOrderSnapshotsException if {@code current} was captured before {@code previous}
     */
    public Interval interval(CounterSnapshot previous, CounterSnapshot current) {
        if (!previous.entityId().equals(current.entityId()) || previous.source() != current.source()) {
            throw new IllegalArgumentException("Snapshots belong to different series: "
                    + previous.entityId() + "/" + previous.source() + " and "
                    + current.entityId() + "/" + current.source());
        }
        if (current.capturedAt().isBefore(previous.capturedAt())) {
            throw new OutOfOrderSnapshotsException(previous.capturedAt(), current.capturedAt());
        }
        long durationMicros = ChronoUnit.MICROS.between(previous.capturedAt(), current.capturedAt());
        return new Interval(previous, current, durationMicros, durationMicros > 0 && !current.restart());
    }

    public Normalization normalize(CounterSnapshot previous, CounterSnapshot current, String metricName) {
        Interval interval = interval(previous, current);
        Optional<UnavailableReason> invalid = checkInterval(interval);
        if (invalid.isPresent()) {
            return Normalization.unavailable(invalid.get());
        }

        MetricDefinition definition = catalog.resolve(metricName, current.source());
        if (!definition.isCumulative()) {
            BigDecimal value = current.counter(metricName);
            if (value == null) {
                return Normalization.unavailable(UnavailableReason.MISSING_COUNTER);
            }
            return Normalization.available(point(current, metricName, value));
        }

        if (!previous.hasCounter(metricName) || !current.hasCounter(metricName)) {
            return Normalization.unavailable(UnavailableReason.MISSING_COUNTER);
        }
        BigDecimal delta = current.counter(metricName).subtract(previous.counter(metricName));
        if (delta.signum() < 0) {
            return Normalization.unavailable(UnavailableReason.COUNTER_RESET);
        }
        BigDecimal rate = delta.divide(interval.durationSeconds(), MathContext.DECIMAL64);
        return Normalization.available(point(current, metricName, rate));
    }

    /**
     * Ratio of counter deltas over the interval; duration cancels out but the interval must
     * still be valid and every counter must have moved forward.
     */
    public Normalization derive(CounterSnapshot previous, CounterSnapshot current, DerivedMetric metric) {
        Interval interval = interval(previous, current);
        Optional<UnavailableReason> invalid = checkInterval(interval);
        if (invalid.isPresent()) {
            return Normalization.unavailable(invalid.get());
        }

        Optional<BigDecimal> numerator = delta(previous, current, metric.getNumerator());
        if (numerator.isEmpty()) {
            return Normalization.unavailable(reasonForMissingDelta(previous, current, metric.getNumerator()));
        }
        BigDecimal denominator = BigDecimal.ZERO;
        for (String name : metric.getDenominators()) {
            Optional<BigDecimal> delta = delta(previous, current, name);
            if (delta.isEmpty()) {
                return Normalization.unavailable(reasonForMissingDelta(previous, current, name));
            }
            denominator = denominator.add(delta.get());
        }
        if (denominator.signum() == 0) {
            return Normalization.unavailable(UnavailableReason.ZERO_DENOMINATOR);
        }
        BigDecimal value = numerator.get()
                .multiply(BigDecimal.valueOf(metric.getFactor()))
                .divide(denominator, MathContext.DECIMAL64);
        return Normalization.available(point(current, metric.getMetricName(), value));
    }

    /**
     * Raw counter increase between two snapshots, empty when either side lacks the counter or it
     * went backwards.
     */
    public Optional<BigDecimal> delta(CounterSnapshot previous, CounterSnapshot current, String metricName) {
        BigDecimal before = previous.counter(metricName);
        BigDecimal after = current.counter(metricName);
        if (before == null || after == null) {
            return Optional.empty();
        }
        BigDecimal delta = after.subtract(before);
        return delta.signum() < 0 ? Optional.empty() : Optional.of(delta);
    }

    private Optional<UnavailableReason> checkInterval(Interval interval) {
        if (interval.to().restart()) {
            return Optional.of(UnavailableReason.RESTART);
        }
        if (interval.durationMicros() == 0) {
            return Optional.of(UnavailableReason.ZERO_DURATION);
        }
        return Optional.empty();
    }

    private UnavailableReason reasonForMissingDelta(CounterSnapshot previous, CounterSnapshot current, String name) {
        return previous.hasCounter(name) && current.hasCounter(name)
                ? UnavailableReason.COUNTER_RESET
                : UnavailableReason.MISSING_COUNTER;
    }

    private static MetricPoint point(CounterSnapshot current, String metricName, BigDecimal value) {
        return new MetricPoint(current.capturedAt(), metricName, value.doubleValue(), current.source());
    }
}
