package org.carball.pgadvisor.model.qual;

/**
 * A qual (or a part of one) that no index can serve. Reported next to the qual groups, never in them.
 */
public record NonOptimizableQual(
        String server,
        String database,
        String queryId,
        String qualId,
        String description,
        Reason reason,
        long executionCount
) {

    public enum Reason {
        /** Parts of the same qual reference different tables. */
        CROSS_TABLE,
        /** No index access method has an operator class containing the operator. */
        NO_INDEXABLE_OPERATOR
    }
}
