package org.carball.pgadvisor.analyzer;

import org.carball.pgadvisor.model.metric.DerivedMetric;
import org.carball.pgadvisor.model.metric.Interval;
import org.carball.pgadvisor.model.metric.MetricSource;
import org.carball.pgadvisor.model.metric.Normalization;
import org.carball.pgadvisor.model.metric.UnavailableReason;
import org.carball.pgadvisor.model.snapshot.CounterSnapshot;
import org.carball.pgadvisor.model.snapshot.EntityId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class DeltaNormalizerTest {

    private static final EntityId QUERY = EntityId.query("pg1", "shop", "42");
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private DeltaNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new DeltaNormalizer();
    }

    @Test
    void shouldComputeRatePerSecondOverMicrosecondDuration() {
        // Given - span crosses a second boundary: 10.9995 -> 12.0005 is 1.001 s
        CounterSnapshot previous = snapshot(Instant.parse("2024-03-01T10:00:10.999500Z"), false)
                .counter("calls", new BigDecimal("1000")).build();
        CounterSnapshot current = snapshot(Instant.parse("2024-03-01T10:00:12.000500Z"), false)
                .counter("calls", new BigDecimal("2001")).build();

        // When
        Normalization result = normalizer.normalize(previous, current, "calls");

        // Then
        assertThat(result.isAvailable()).isTrue();
        assertThat(result.point().value()).isCloseTo(1000.0, within(1e-9));
        assertThat(result.point().timestamp()).isEqualTo(current.capturedAt());
        assertThat(result.point().source()).isEqualTo(MetricSource.QUERY_EXECUTION);
    }

    @Test
    void shouldKeepFractionalCounterDeltaExact() {
        // Given - cumulative seconds 10.9995 -> 12.0005 over exactly one second
        CounterSnapshot previous = snapshot(T0, false).counter("total_exec_time", new BigDecimal("10.999500")).build();
        CounterSnapshot current = snapshot(T0.plusSeconds(1), false).counter("total_exec_time", new BigDecimal("12.000500")).build();

        // When
        Normalization result = normalizer.normalize(previous, current, "total_exec_time");

        // Then
        assertThat(result.point().value()).isEqualTo(1.001);
    }

    @Test
    void shouldMeasureIntervalInWholeMicroseconds() {
        CounterSnapshot previous = snapshot(Instant.parse("2024-03-01T10:00:10.999500Z"), false).build();
        CounterSnapshot current = snapshot(Instant.parse("2024-03-01T10:00:12.000500Z"), false).build();

        Interval interval = normalizer.interval(previous, current);

        assertThat(interval.durationMicros()).isEqualTo(1_001_000L);
        assertThat(interval.durationSeconds()).isEqualByComparingTo("1.001");
        assertThat(interval.valid()).isTrue();
    }

    @Test
    void shouldIgnoreSubMicrosecondPartOfCaptureInstant() {
        CounterSnapshot previous = snapshot(T0, false).counter("calls", new BigDecimal("0")).build();
        CounterSnapshot sameMicrosecond = snapshot(T0.plusNanos(500), false).counter("calls", new BigDecimal("5")).build();
        CounterSnapshot oneSecondLater = snapshot(T0.plusNanos(1_000_000_900), false)
                .counter("calls", new BigDecimal("1000")).build();

        assertThat(normalizer.normalize(previous, sameMicrosecond, "calls").reason())
                .isEqualTo(UnavailableReason.ZERO_DURATION);

        Normalization result = normalizer.normalize(previous, oneSecondLater, "calls");
        assertThat(oneSecondLater.capturedAt()).isEqualTo(T0.plusSeconds(1));
        assertThat(normalizer.interval(previous, oneSecondLater).durationMicros()).isEqualTo(1_000_000L);
        assertThat(result.point().value()).isEqualTo(1000.0);
    }

    @Test
    void shouldReportCounterResetInsteadOfNegativeRate() {
        CounterSnapshot previous = snapshot(T0, false).counter("calls", new BigDecimal("500")).build();
        CounterSnapshot current = snapshot(T0.plusSeconds(60), false).counter("calls", new BigDecimal("20")).build();

        Normalization result = normalizer.normalize(previous, current, "calls");

        assertThat(result.isAvailable()).isFalse();
        assertThat(result.reason()).isEqualTo(UnavailableReason.COUNTER_RESET);
        assertThat(result.toOptional()).isEmpty();
    }

    @Test
    void shouldReportRestartEvenWhenCountersIncreased() {
        CounterSnapshot previous = snapshot(T0, false).counter("calls", new BigDecimal("10")).build();
        CounterSnapshot current = snapshot(T0.plusSeconds(60), true).counter("calls", new BigDecimal("50")).build();

        Normalization result = normalizer.normalize(previous, current, "calls");

        assertThat(result.reason()).isEqualTo(UnavailableReason.RESTART);
        assertThat(normalizer.interval(previous, current).valid()).isFalse();
    }

    @Test
    void shouldReportZeroDurationForEqualTimestamps() {
        CounterSnapshot previous = snapshot(T0, false).counter("calls", new BigDecimal("10")).build();
        CounterSnapshot current = snapshot(T0, false).counter("calls", new BigDecimal("20")).build();

        Normalization result = normalizer.normalize(previous, current, "calls");

        assertThat(result.reason()).isEqualTo(UnavailableReason.ZERO_DURATION);
    }

    @Test
    void shouldRejectSnapshotsOutOfOrder() {
        CounterSnapshot previous = snapshot(T0.plusSeconds(60), false).counter("calls", BigDecimal.ONE).build();
        CounterSnapshot current = snapshot(T0, false).counter("calls", BigDecimal.TEN).build();

        assertThatThrownBy(() -> normalizer.normalize(previous, current, "calls"))
                .isInstanceOf(OutOfOrderSnapshotsException.class);
    }

    @Test
    void shouldRejectSnapshotsOfDifferentSources() {
        CounterSnapshot previous = snapshot(T0, false).build();
        CounterSnapshot current = snapshot(T0.plusSeconds(60), false).source(MetricSource.IO).build();

        assertThatThrownBy(() -> normalizer.interval(previous, current))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("different series");
    }

    @Test
    void shouldReportMissingCounter() {
        CounterSnapshot previous = snapshot(T0, false).counter("rows", BigDecimal.ONE).build();
        CounterSnapshot current = snapshot(T0.plusSeconds(60), false).counter("calls", BigDecimal.TEN).build();

        assertThat(normalizer.normalize(previous, current, "calls").reason())
                .isEqualTo(UnavailableReason.MISSING_COUNTER);
    }

    @Test
    void shouldReturnGaugeValueAsIs() {
        CounterSnapshot previous = EntitySnapshots.cache(T0).counter("numbackends", new BigDecimal("12")).build();
        CounterSnapshot current = EntitySnapshots.cache(T0.plusSeconds(30)).counter("numbackends", new BigDecimal("7")).build();

        Normalization result = normalizer.normalize(previous, current, "numbackends");

        assertThat(result.isAvailable()).isTrue();
        assertThat(result.point().value()).isEqualTo(7.0);
    }

    @Test
    void shouldDeriveAverageRuntimeFromDeltas() {
        CounterSnapshot previous = snapshot(T0, false)
                .counter("calls", new BigDecimal("100"))
                .counter("total_exec_time", new BigDecimal("2500.0"))
                .build();
        CounterSnapshot current = snapshot(T0.plusSeconds(60), false)
                .counter("calls", new BigDecimal("140"))
                .counter("total_exec_time", new BigDecimal("2600.0"))
                .build();

        Normalization result = normalizer.derive(previous, current, DerivedMetric.AVG_RUNTIME);

        assertThat(result.isAvailable()).isTrue();
        assertThat(result.point().metricName()).isEqualTo("avg_runtime");
        assertThat(result.point().value()).isCloseTo(2.5, within(1e-9));
    }

    @Test
    void shouldDeriveHitRatioAsPercentage() {
        CounterSnapshot previous = EntitySnapshots.cache(T0)
                .counter("blks_hit", new BigDecimal("1000"))
                .counter("blks_read", new BigDecimal("100"))
                .build();
        CounterSnapshot current = EntitySnapshots.cache(T0.plusSeconds(60))
                .counter("blks_hit", new BigDecimal("1900"))
                .counter("blks_read", new BigDecimal("200"))
                .build();

        Normalization result = normalizer.derive(previous, current, DerivedMetric.HIT_RATIO);

        assertThat(result.point().value()).isCloseTo(90.0, within(1e-9));
    }

    @Test
    void shouldReportZeroDenominatorWhenNothingExecuted() {
        CounterSnapshot previous = snapshot(T0, false)
                .counter("calls", new BigDecimal("100"))
                .counter("total_exec_time", new BigDecimal("2500.0"))
                .build();
        CounterSnapshot current = previous.toBuilder().capturedAt(T0.plusSeconds(60)).build();

        Normalization result = normalizer.derive(previous, current, DerivedMetric.AVG_RUNTIME);

        assertThat(result.reason()).isEqualTo(UnavailableReason.ZERO_DENOMINATOR);
    }

    @Test
    void shouldReportResetWhenDerivedCounterWentBackwards() {
        CounterSnapshot previous = snapshot(T0, false)
                .counter("calls", new BigDecimal("100"))
                .counter("total_exec_time", new BigDecimal("2500.0"))
                .build();
        CounterSnapshot current = snapshot(T0.plusSeconds(60), false)
                .counter("calls", new BigDecimal("3"))
                .counter("total_exec_time", new BigDecimal("12.0"))
                .build();

        assertThat(normalizer.derive(previous, current, DerivedMetric.AVG_RUNTIME).reason())
                .isEqualTo(UnavailableReason.COUNTER_RESET);
    }

    private static CounterSnapshot.CounterSnapshotBuilder snapshot(Instant capturedAt, boolean restart) {
        return CounterSnapshot.builder()
                .entityId(QUERY)
                .source(MetricSource.QUERY_EXECUTION)
                .capturedAt(capturedAt)
                .restart(restart);
    }

    private static final class EntitySnapshots {
        static CounterSnapshot.CounterSnapshotBuilder cache(Instant capturedAt) {
            return CounterSnapshot.builder()
                    .entityId(EntityId.database("pg1", "shop"))
                    .source(MetricSource.CACHE)
                    .capturedAt(capturedAt);
        }
    }
}
