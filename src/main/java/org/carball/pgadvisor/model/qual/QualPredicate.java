package org.carball.pgadvisor.model.qual;

import org.carball.pgadvisor.model.index.AccessMethod;

import java.util.Set;

/**
 * A column/operator-class pair within a qual group, with usage summed over every row that contributed it.
 */
public record QualPredicate(
        String column,
        OperatorClass operatorClass,
        Set<String> operators,
        Set<AccessMethod> accessMethods,
        Double nDistinct,
        long executionCount,
        long filteredRows
) {

    public String signature() {
        return column + ":" + operatorClass;
    }

    /**
     * Estimated number of distinct values; negative pg_statistic values are a fraction of the live rows.
     */
    public double estimatedDistinctValues(Long tableLiveRows) {
        if (nDistinct == null) {
            return 0;
        }
        if (nDistinct >= 0) {
            return nDistinct;
        }
        long liveRows = tableLiveRows == null ? 0 : tableLiveRows;
        return Math.abs(nDistinct) * liveRows;
    }

    /**
     * Fraction of evaluated rows removed by this predicate, 0 when never executed.
     */
    public double filterRatio() {
        if (executionCount == 0) {
            return 0;
        }
        return (double) filteredRows / executionCount;
    }
}
