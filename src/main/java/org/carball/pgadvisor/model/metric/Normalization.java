package org.carball.pgadvisor.model.metric;

import java.util.Optional;

/**
 * Outcome of normalizing one metric over one interval: either a point or the reason there is none.
 * An unavailable outcome becomes a gap in the series.
 */
public record Normalization(MetricPoint point, UnavailableReason reason) {

    public static Normalization available(MetricPoint point) {
        return new Normalization(point, null);
    }

    public static Normalization unavailable(UnavailableReason reason) {
        return new Normalization(null, reason);
    }

    public boolean isAvailable() {
        return point != null;
    }

    public Optional<MetricPoint> toOptional() {
        return Optional.ofNullable(point);
    }
}
