package org.carball.pgadvisor.analyzer;

import org.carball.pgadvisor.model.index.AccessMethod;
import org.carball.pgadvisor.model.index.AdvisorScope;
import org.carball.pgadvisor.model.qual.NonOptimizableQual;
import org.carball.pgadvisor.model.qual.QualAggregation;
import org.carball.pgadvisor.model.qual.QualGroup;
import org.carball.pgadvisor.model.qual.QualPredicate;
import org.carball.pgadvisor.model.qual.QualUsageRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

public class QualUsageAggregatorTest {

    private QualUsageAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new QualUsageAggregator();
    }

    @Test
    void shouldComposePartsOfSameQualIntoOneGroup() {
        // Given - WHERE a = ? AND b = ? tracked as two rows of qual 7
        List<QualUsageRow> rows = List.of(
                row("q1", "7", "orders", "a", "=").executionCount(100).filteredRows(900).build(),
                row("q1", "7", "orders", "b", "=").executionCount(100).filteredRows(500).build());

        // When
        QualAggregation aggregation = aggregator.aggregate(rows);

        // Then
        assertThat(aggregation.groups()).hasSize(1);
        QualGroup group = aggregation.groups().get(0);
        assertThat(group.tableIdentifier()).isEqualTo("public.orders");
        assertThat(group.predicates()).extracting(QualPredicate::column).containsExactly("a", "b");
        assertThat(group.executionCount()).isEqualTo(100);
        assertThat(group.signature()).isEqualTo("public.orders(a:EQUALITY, b:EQUALITY)");
        assertThat(aggregation.nonOptimizable()).isEmpty();
    }

    @Test
    void shouldSumCountsOfQualsWithSameSignature() {
        List<QualUsageRow> rows = List.of(
                row("q1", "7", "orders", "a", "=").executionCount(100).exampleQuery("SELECT 1").build(),
                row("q2", "3", "orders", "a", "=").executionCount(40).exampleQuery("SELECT 2").build());

        QualAggregation aggregation = aggregator.aggregate(rows);

        assertThat(aggregation.groups()).singleElement().satisfies(group -> {
            assertThat(group.executionCount()).isEqualTo(140);
            assertThat(group.queryIds()).containsExactly("q1", "q2");
            assertThat(group.exampleQueries()).containsExactly("SELECT 1", "SELECT 2");
        });
    }

    @Test
    void shouldSeparateGroupsByOperatorClass() {
        List<QualUsageRow> rows = List.of(
                row("q1", "1", "orders", "created_at", "=").executionCount(10).build(),
                row("q2", "2", "orders", "created_at", ">=").executionCount(10).build());

        QualAggregation aggregation = aggregator.aggregate(rows);

        assertThat(aggregation.groups()).extracting(QualGroup::signature)
                .containsExactly("public.orders(created_at:EQUALITY)", "public.orders(created_at:RANGE)");
    }

    @Test
    void shouldComposeRowsWithoutQualIdByQueryAndTable() {
        // Given - no qual ids: q1 filters orders on a and b, and joins customers on id
        List<QualUsageRow> rows = List.of(
                row("q1", null, "orders", "a", "=").executionCount(1000).build(),
                row("q1", null, "orders", "b", "=").executionCount(1000).build(),
                row("q1", null, "customers", "id", "=").executionCount(1000).build(),
                row(null, null, "orders", "c", "=").executionCount(5).build(),
                row(null, null, "orders", "d", "=").executionCount(5).build());

        // When
        QualAggregation aggregation = aggregator.aggregate(rows);

        // Then
        assertThat(aggregation.groups()).extracting(QualGroup::signature)
                .containsExactly(
                        "public.customers(id:EQUALITY)",
                        "public.orders(a:EQUALITY, b:EQUALITY)",
                        "public.orders(c:EQUALITY)",
                        "public.orders(d:EQUALITY)");
        assertThat(aggregation.groups().get(1).executionCount()).isEqualTo(1000);
        assertThat(aggregation.nonOptimizable()).isEmpty();
    }

    @Test
    void shouldReportCrossTableQualAsNonOptimizable() {
        List<QualUsageRow> rows = List.of(
                row("q1", "9", "orders", "customer_id", "=").executionCount(20).build(),
                row("q1", "9", "customers", "id", "=").executionCount(20).build());

        QualAggregation aggregation = aggregator.aggregate(rows);

        assertThat(aggregation.groups()).isEmpty();
        assertThat(aggregation.nonOptimizable()).singleElement().satisfies(qual -> {
            assertThat(qual.reason()).isEqualTo(NonOptimizableQual.Reason.CROSS_TABLE);
            assertThat(qual.executionCount()).isEqualTo(20);
        });
    }

    @Test
    void shouldReportOperatorWithoutIndexMethodAndKeepOtherParts() {
        List<QualUsageRow> rows = List.of(
                row("q1", "5", "orders", "status", "=").executionCount(30).build(),
                row("q1", "5", "orders", "note", "~").executionCount(30).build());

        QualAggregation aggregation = aggregator.aggregate(rows);

        assertThat(aggregation.groups()).singleElement()
                .satisfies(group -> assertThat(group.signature()).isEqualTo("public.orders(status:EQUALITY)"));
        assertThat(aggregation.nonOptimizable()).singleElement()
                .satisfies(qual -> assertThat(qual.reason()).isEqualTo(NonOptimizableQual.Reason.NO_INDEXABLE_OPERATOR));
    }

    @Test
    void shouldTrustDeclaredAccessMethodsOnlyWhenTheySupportOperator() {
        QualUsageRow row = row("q1", "5", "docs", "tags", "@>")
                .accessMethods(EnumSet.of(AccessMethod.GIN, AccessMethod.BTREE))
                .build();

        assertThat(QualUsageAggregator.usableAccessMethods(row)).containsExactly(AccessMethod.GIN);
    }

    @Test
    void shouldDropInvalidRowsWithDiagnostic() {
        List<QualUsageRow> rows = List.of(
                row("q1", "1", "orders", null, "=").executionCount(10).build(),
                row("q2", "2", "orders", "a", "=").executionCount(-1).build(),
                row("q3", "3", "orders", "a", "=").executionCount(5).build());

        QualAggregation aggregation = aggregator.aggregate(rows);

        assertThat(aggregation.groups()).hasSize(1);
        assertThat(aggregation.diagnostics()).hasSize(2)
                .anySatisfy(message -> assertThat(message).contains("q1/1").contains("missing column"))
                .anySatisfy(message -> assertThat(message).contains("q2/2").contains("negative"));
    }

    @Test
    void shouldRestrictRowsToScope() {
        List<QualUsageRow> rows = List.of(
                row("q1", "1", "orders", "a", "=").executionCount(10).build(),
                row("q2", "2", "orders", "b", "=").executionCount(10).build(),
                row("q3", "3", "orders", "c", "=").database("billing").executionCount(10).build());

        assertThat(aggregator.aggregate(AdvisorScope.query("pg1", "shop", "q2"), rows).groups())
                .extracting(QualGroup::signature)
                .containsExactly("public.orders(b:EQUALITY)");
        assertThat(aggregator.aggregate(AdvisorScope.database("pg1", "shop"), rows).groups()).hasSize(2);
        assertThat(aggregator.aggregate(AdvisorScope.workload("pg1"), rows).groups()).hasSize(3);
        assertThat(aggregator.aggregate(AdvisorScope.workload("other"), rows).groups()).isEmpty();
    }

    @Test
    void shouldUnionAccessMethodsOfMergedPredicates() {
        List<QualUsageRow> rows = List.of(
                row("q1", "1", "orders", "a", "=").accessMethods(Set.of(AccessMethod.BTREE)).executionCount(10).build(),
                row("q2", "2", "orders", "a", "=").accessMethods(Set.of(AccessMethod.HASH)).executionCount(10).build());

        QualPredicate predicate = aggregator.aggregate(rows).groups().get(0).predicates().get(0);

        assertThat(predicate.accessMethods()).containsExactlyInAnyOrder(AccessMethod.BTREE, AccessMethod.HASH);
        assertThat(predicate.executionCount()).isEqualTo(20);
    }

    private static QualUsageRow.QualUsageRowBuilder row(String queryId, String qualId, String table,
                                                        String column, String operator) {
        return QualUsageRow.builder()
                .server("pg1")
                .database("shop")
                .queryId(queryId)
                .qualId(qualId)
                .schemaName("public")
                .tableName(table)
                .columnName(column)
                .operator(operator);
    }
}
