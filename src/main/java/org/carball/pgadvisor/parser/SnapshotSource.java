package org.carball.pgadvisor.parser;

import org.carball.pgadvisor.model.snapshot.CounterSnapshot;
import org.carball.pgadvisor.model.snapshot.EntityId;
import org.carball.pgadvisor.model.snapshot.TimeRange;

import java.time.Instant;
import java.util.List;

/**
 * Read access to stored counter snapshots.
 */
public interface SnapshotSource {

    /**
     * Snapshots of {@code entity}, of every source, captured within {@code range}.
     */
    List<CounterSnapshot> fetchSnapshots(EntityId entity, TimeRange range) throws StoreUnavailableException;

    /**
     * For each source, the latest snapshot of {@code entity} captured strictly before {@code instant}.
     */
    List<CounterSnapshot> fetchPrecedingSnapshots(EntityId entity, Instant instant) throws StoreUnavailableException;
}
