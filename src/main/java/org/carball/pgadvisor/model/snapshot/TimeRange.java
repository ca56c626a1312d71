package org.carball.pgadvisor.model.snapshot;

import java.time.Instant;
import java.util.Objects;

/**
 * Closed time range {@code [start, end]}.
 */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Time range ends before it starts: " + start + " > " + end);
        }
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }
}
