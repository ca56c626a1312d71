package org.carball.pgadvisor.advisor;

import org.carball.pgadvisor.model.index.IndexCandidate;
import org.carball.pgadvisor.model.index.SimulationResult;

/**
 * Asks a planner whether it would use a candidate index that does not physically exist, and what
 * the queries behind the candidate would cost with and without it.
 */
@FunctionalInterface
public interface HypotheticalIndexSimulator {

    SimulationResult simulate(IndexCandidate candidate) throws SimulationException;
}
