package org.carball.pgadvisor.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.pgadvisor.model.index.AccessMethod;
import org.carball.pgadvisor.model.index.AdvisorScope;
import org.carball.pgadvisor.model.qual.NonOptimizableQual;
import org.carball.pgadvisor.model.qual.OperatorClass;
import org.carball.pgadvisor.model.qual.QualAggregation;
import org.carball.pgadvisor.model.qual.QualGroup;
import org.carball.pgadvisor.model.qual.QualPredicate;
import org.carball.pgadvisor.model.qual.QualUsageRow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Groups pg_qualstats usage rows into the predicate groups the index advisor works from.
 * <p>
 * Rows are first put back together into composed quals (the AND-ed parts sharing a query and qual
 * id). A composed qual spanning several tables, and any part whose operator no index method can
 * serve, is reported as non-optimizable. The remaining quals are grouped by table and by the set of
 * (column, operator class) pairs they filter on, with execution and filtered-row counts summed.
 */
@Slf4j
public class QualUsageAggregator {

    private static final Comparator<QualGroup> GROUP_ORDER = Comparator
            .comparing(QualGroup::server)
            .thenComparing(QualGroup::database)
            .thenComparing(QualGroup::tableIdentifier)
            .thenComparing(QualGroup::signature);

    public QualAggregation aggregate(AdvisorScope scope, List<QualUsageRow> rows) {
        List<QualUsageRow> inScope = rows.stream()
                .filter(scope::includes)
                .collect(Collectors.toList());
        log.debug("{} of {} qual rows fall in {}", inScope.size(), rows.size(), scope);
        return aggregate(inScope);
    }

    public QualAggregation aggregate(List<QualUsageRow> rows) {
        List<String> diagnostics = new ArrayList<>();
        List<NonOptimizableQual> nonOptimizable = new ArrayList<>();
        Map<String, GroupBuilder> groups = new TreeMap<>();

        for (List<QualUsageRow> composed : compose(rows, diagnostics)) {
            QualUsageRow first = composed.get(0);
            long executionCount = composed.stream().mapToLong(QualUsageRow::executionCount).max().orElse(0);
            long filteredRows = composed.stream().mapToLong(QualUsageRow::filteredRows).max().orElse(0);

            Set<String> tables = composed.stream()
                    .map(QualUsageRow::tableIdentifier)
                    .collect(Collectors.toCollection(TreeSet::new));
            if (tables.size() > 1) {
                nonOptimizable.add(new NonOptimizableQual(first.server(), first.database(), first.queryId(),
                        first.qualId(), describe(composed), NonOptimizableQual.Reason.CROSS_TABLE, executionCount));
                continue;
            }

            List<QualUsageRow> usable = new ArrayList<>();
            for (QualUsageRow part : composed) {
                if (usableAccessMethods(part).isEmpty()) {
                    nonOptimizable.add(new NonOptimizableQual(part.server(), part.database(), part.queryId(),
                            part.qualId(), part.toString(), NonOptimizableQual.Reason.NO_INDEXABLE_OPERATOR,
                            part.executionCount()));
                } else {
                    usable.add(part);
                }
            }
            if (usable.isEmpty()) {
                continue;
            }

            Set<String> signature = usable.stream()
                    .map(part -> part.columnName() + ":" + part.operatorClass())
                    .collect(Collectors.toCollection(TreeSet::new));
            String groupKey = String.join("|", first.server(), first.database(), first.tableIdentifier(),
                    String.join(",", signature));
            groups.computeIfAbsent(groupKey, key -> new GroupBuilder(first))
                    .add(usable, executionCount, filteredRows);
        }

        List<QualGroup> result = groups.values().stream()
                .map(GroupBuilder::build)
                .sorted(GROUP_ORDER)
                .collect(Collectors.toList());

        log.info("Aggregated {} qual rows into {} groups ({} non-optimizable, {} dropped)",
                rows.size(), result.size(), nonOptimizable.size(), diagnostics.size());

        return new QualAggregation(
                Collections.unmodifiableList(result),
                Collections.unmodifiableList(nonOptimizable),
                Collections.unmodifiableList(diagnostics));
    }

    /**
     * Access methods able to serve the row's predicate. Methods declared by the catalog are trusted
     * only when they support the operator class.
     */
    static Set<AccessMethod> usableAccessMethods(QualUsageRow row) {
        OperatorClass operatorClass = row.operatorClass();
        Set<AccessMethod> declared = row.accessMethods() != null
                ? row.accessMethods()
                : operatorClass.defaultAccessMethods();
        Set<AccessMethod> usable = EnumSet.noneOf(AccessMethod.class);
        for (AccessMethod method : declared) {
            if (method.supports(operatorClass)) {
                usable.add(method);
            }
        }
        return usable;
    }

    private List<List<QualUsageRow>> compose(List<QualUsageRow> rows, List<String> diagnostics) {
        Map<List<String>, List<QualUsageRow>> composed = new LinkedHashMap<>();
        int anonymous = 0;
        for (QualUsageRow row : rows) {
            String problem = validate(row);
            if (problem != null) {
                String diagnostic = "Dropped qual row " + row.queryId() + "/" + row.qualId() + ": " + problem;
                log.warn(diagnostic);
                diagnostics.add(diagnostic);
                continue;
            }
            composed.computeIfAbsent(compositionKey(row, anonymous), k -> new ArrayList<>()).add(row);
            if (row.queryId() == null) {
                anonymous++;
            }
        }
        return new ArrayList<>(composed.values());
    }

    /**
     * Parts sharing a qual id are AND-ed together. Without a qual id, the predicates a query applies
     * to the same table are taken as one composed qual. A row without a query id stands alone.
     */
    private static List<String> compositionKey(QualUsageRow row, int anonymous) {
        if (row.queryId() == null) {
            return List.of(row.server(), row.database(), "#" + anonymous);
        }
        if (row.qualId() == null) {
            return List.of(row.server(), row.database(), row.queryId(), "table:" + row.tableIdentifier());
        }
        return List.of(row.server(), row.database(), row.queryId(), row.qualId());
    }

    private static String validate(QualUsageRow row) {
        if (isBlank(row.server()) || isBlank(row.database())) {
            return "missing server or database";
        }
        if (isBlank(row.tableName())) {
            return "missing table";
        }
        if (isBlank(row.columnName())) {
            return "missing column for table " + row.tableIdentifier();
        }
        if (isBlank(row.operator())) {
            return "missing operator on " + row.tableIdentifier() + "." + row.columnName();
        }
        if (row.executionCount() < 0 || row.filteredRows() < 0) {
            return "negative usage counters on " + row.tableIdentifier() + "." + row.columnName();
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String describe(List<QualUsageRow> parts) {
        return parts.stream().map(QualUsageRow::toString).collect(Collectors.joining(" AND "));
    }

    private static class GroupBuilder {
        private final String server;
        private final String database;
        private final String tableIdentifier;
        private final Map<String, PredicateBuilder> predicates = new TreeMap<>();
        private final Set<String> queryIds = new TreeSet<>();
        private final Set<String> exampleQueries = new LinkedHashSet<>();
        private long executionCount;
        private long filteredRows;
        private Long tableLiveRows;

        GroupBuilder(QualUsageRow first) {
            this.server = first.server();
            this.database = first.database();
            this.tableIdentifier = first.tableIdentifier();
        }

        void add(List<QualUsageRow> parts, long composedExecutions, long composedFiltered) {
            executionCount += composedExecutions;
            filteredRows += composedFiltered;
            for (QualUsageRow part : parts) {
                predicates.computeIfAbsent(part.columnName() + ":" + part.operatorClass(),
                        key -> new PredicateBuilder(part.columnName(), part.operatorClass())).add(part);
                if (part.queryId() != null) {
                    queryIds.add(part.queryId());
                }
                if (part.exampleQuery() != null && !part.exampleQuery().isBlank()) {
                    exampleQueries.add(part.exampleQuery());
                }
                if (part.tableLiveRows() != null) {
                    tableLiveRows = tableLiveRows == null ? part.tableLiveRows() : Math.max(tableLiveRows, part.tableLiveRows());
                }
            }
        }

        QualGroup build() {
            List<QualPredicate> built = predicates.values().stream()
                    .map(PredicateBuilder::build)
                    .collect(Collectors.toList());
            return new QualGroup(server, database, tableIdentifier, List.copyOf(built), executionCount,
                    filteredRows, tableLiveRows, Collections.unmodifiableSet(queryIds), List.copyOf(exampleQueries));
        }
    }

    private static class PredicateBuilder {
        private final String column;
        private final OperatorClass operatorClass;
        private final Set<String> operators = new TreeSet<>();
        private final Set<AccessMethod> accessMethods = EnumSet.noneOf(AccessMethod.class);
        private Double nDistinct;
        private long executionCount;
        private long filteredRows;

        PredicateBuilder(String column, OperatorClass operatorClass) {
            this.column = column;
            this.operatorClass = operatorClass;
        }

        void add(QualUsageRow row) {
            operators.add(row.operator());
            accessMethods.addAll(usableAccessMethods(row));
            if (row.nDistinct() != null) {
                nDistinct = row.nDistinct();
            }
            executionCount += row.executionCount();
            filteredRows += row.filteredRows();
        }

        QualPredicate build() {
            return new QualPredicate(column, operatorClass, Collections.unmodifiableSet(operators),
                    Collections.unmodifiableSet(accessMethods), nDistinct, executionCount, filteredRows);
        }
    }
}
