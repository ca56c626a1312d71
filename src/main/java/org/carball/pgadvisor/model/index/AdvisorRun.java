package org.carball.pgadvisor.model.index;

import org.carball.pgadvisor.model.qual.NonOptimizableQual;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Full outcome of one advisor run: the ranked recommendations plus every simulated candidate with
 * its final status, and the quals that could not be considered at all.
 */
public record AdvisorRun(
        AdvisorScope scope,
        List<Recommendation> recommendations,
        List<IndexCandidate> candidates,
        List<NonOptimizableQual> nonOptimizable,
        List<String> diagnostics,
        int droppedByCapability
) {

    public Map<SimulationStatus, Long> statusCounts() {
        return candidates.stream()
                .collect(Collectors.groupingBy(IndexCandidate::status, Collectors.counting()));
    }

    public String getSummary() {
        Map<SimulationStatus, Long> counts = statusCounts();
        Function<SimulationStatus, Long> count = status -> counts.getOrDefault(status, 0L);
        return String.format("%s: %d recommendations | accepted %d, rejected %d, failed %d | %d unsupported, %d non-optimizable quals",
                scope, recommendations.size(),
                count.apply(SimulationStatus.ACCEPTED),
                count.apply(SimulationStatus.REJECTED),
                count.apply(SimulationStatus.SIMULATION_FAILED),
                droppedByCapability, nonOptimizable.size());
    }
}
