package org.carball.pgadvisor.analyzer;

import java.time.Instant;

/**
 * The later snapshot of a pair was captured before the earlier one.
 */
public class OutOfOrderSnapshotsException extends RuntimeException {

    public OutOfOrderSnapshotsException(Instant previous, Instant current) {
        super("Snapshot captured at " + current + " does not follow snapshot captured at " + previous);
    }
}
