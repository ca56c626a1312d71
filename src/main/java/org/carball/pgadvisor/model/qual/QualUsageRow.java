package org.carball.pgadvisor.model.qual;

import lombok.Builder;
import org.carball.pgadvisor.model.index.AccessMethod;

import java.util.Set;

/**
 * One predicate part of a qual as tracked by pg_qualstats, already resolved against the catalog.
 * Rows sharing server, database, query id and qual id are the AND-ed parts of one composed qual.
 * {@code accessMethods} lists the index methods whose operator classes contain the operator;
 * {@code null} means unknown, an empty set means none.
 */
@Builder(toBuilder = true)
public record QualUsageRow(
        String server,
        String database,
        String queryId,
        String qualId,
        String schemaName,
        String tableName,
        String columnName,
        String operator,
        Set<AccessMethod> accessMethods,
        long executionCount,
        long filteredRows,
        Double nDistinct,
        Long tableLiveRows,
        String exampleQuery
) {

    public String tableIdentifier() {
        String schema = schemaName == null || schemaName.isBlank() ? "public" : schemaName;
        return schema + "." + tableName;
    }

    public OperatorClass operatorClass() {
        return OperatorClass.fromOperator(operator);
    }

    @Override
    public String toString() {
        return tableIdentifier() + "." + columnName + " " + operator + " ?";
    }
}
