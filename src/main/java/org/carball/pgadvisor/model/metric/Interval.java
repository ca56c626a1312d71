package org.carball.pgadvisor.model.metric;

import org.carball.pgadvisor.model.snapshot.CounterSnapshot;

import java.math.BigDecimal;

/**
 * Span between two consecutive snapshots. Duration is kept in whole microseconds only.
 */
public record Interval(
        CounterSnapshot from,
        CounterSnapshot to,
        long durationMicros,
        boolean valid
) {

    private static final BigDecimal MICROS_PER_SECOND = BigDecimal.valueOf(1_000_000L);

    public BigDecimal durationSeconds() {
        return BigDecimal.valueOf(durationMicros).divide(MICROS_PER_SECOND);
    }
}
