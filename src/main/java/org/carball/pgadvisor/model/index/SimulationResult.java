package org.carball.pgadvisor.model.index;

/**
 * What the hypothetical index simulator reported for a candidate: whether the planner picked the
 * index, and the total plan cost without and with it, summed over the example queries.
 */
public record SimulationResult(
        boolean indexUsed,
        double baseCost,
        double hypotheticalCost,
        String indexName
) {

    public double costReduction() {
        return baseCost - hypotheticalCost;
    }

    public double gainPercent() {
        if (baseCost <= 0) {
            return 0;
        }
        return Math.round((100 - hypotheticalCost * 100 / baseCost) * 100.0) / 100.0;
    }
}
