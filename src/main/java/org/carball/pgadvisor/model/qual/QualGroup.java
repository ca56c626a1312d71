package org.carball.pgadvisor.model.qual;

import java.util.List;
import java.util.Set;

/**
 * Composed quals on one table that share the same set of (column, operator class) predicates.
 */
public record QualGroup(
        String server,
        String database,
        String tableIdentifier,
        List<QualPredicate> predicates,
        long executionCount,
        long filteredRows,
        Long tableLiveRows,
        Set<String> queryIds,
        List<String> exampleQueries
) {

    public String signature() {
        StringBuilder sb = new StringBuilder(tableIdentifier).append('(');
        for (int i = 0; i < predicates.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(predicates.get(i).signature());
        }
        return sb.append(')').toString();
    }
}
