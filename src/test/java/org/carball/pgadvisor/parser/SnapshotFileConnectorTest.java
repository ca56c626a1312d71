package org.carball.pgadvisor.parser;

import org.carball.pgadvisor.model.metric.MetricSource;
import org.carball.pgadvisor.model.snapshot.CounterSnapshot;
import org.carball.pgadvisor.model.snapshot.EntityId;
import org.carball.pgadvisor.model.snapshot.TimeRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SnapshotFileConnectorTest {

    private static final EntityId SHOP = EntityId.database("pg1", "shop");

    @TempDir
    Path tempDir;

    private Path exportFile;

    @BeforeEach
    void setUp() throws IOException {
        exportFile = tempDir.resolve("snapshots.json");
        String json = """
            {
              "export_metadata": {
                "server": "pg1",
                "export_timestamp": "2024-03-01T12:00:00Z"
              },
              "snapshots": [
                {
                  "server": "pg1",
                  "database": "shop",
                  "subject_kind": "database",
                  "subject": "shop",
                  "source": "pg_stat_statements",
                  "captured_at": "2024-03-01T10:00:10.999500Z",
                  "counters": {"calls": 1000, "total_exec_time": 2500.125}
                },
                {
                  "server": "pg1",
                  "database": "shop",
                  "subject_kind": "database",
                  "subject": "shop",
                  "source": "pg_stat_statements",
                  "captured_at": "2024-03-01T10:00:12.000500Z",
                  "restart": true,
                  "counters": {"calls": 2001, "total_exec_time": 2600.5}
                },
                {
                  "server": "pg1",
                  "database": "shop",
                  "subject_kind": "database",
                  "subject": "shop",
                  "source": "CACHE",
                  "captured_at": "2024-03-01T10:00:05Z",
                  "counters": {"blks_hit": 10, "blks_read": 2}
                },
                {
                  "server": "pg1",
                  "database": "billing",
                  "subject_kind": "database",
                  "subject": "billing",
                  "source": "pg_stat_statements",
                  "captured_at": "2024-03-01T10:00:11Z",
                  "counters": {"calls": 3}
                }
              ]
            }
            """;
        Files.writeString(exportFile, json);
    }

    @Test
    void shouldLoadSnapshotsWithExactCounterValues() throws Exception {
        SnapshotFileConnector connector = new SnapshotFileConnector(exportFile);

        List<CounterSnapshot> snapshots = connector.loadAll();

        assertThat(snapshots).hasSize(4);
        CounterSnapshot first = snapshots.get(0);
        assertThat(first.entityId()).isEqualTo(SHOP);
        assertThat(first.source()).isEqualTo(MetricSource.QUERY_EXECUTION);
        assertThat(first.capturedAt()).isEqualTo(Instant.parse("2024-03-01T10:00:10.999500Z"));
        assertThat(first.counter("total_exec_time")).isEqualTo(new BigDecimal("2500.125"));
        assertThat(first.restart()).isFalse();
        assertThat(snapshots.get(1).restart()).isTrue();
    }

    @Test
    void shouldFetchSnapshotsOfEntityInRange() throws Exception {
        SnapshotFileConnector connector = new SnapshotFileConnector(exportFile);

        List<CounterSnapshot> snapshots = connector.fetchSnapshots(SHOP,
                new TimeRange(Instant.parse("2024-03-01T10:00:06Z"), Instant.parse("2024-03-01T10:01:00Z")));

        assertThat(snapshots).extracting(CounterSnapshot::capturedAt).containsExactly(
                Instant.parse("2024-03-01T10:00:10.999500Z"),
                Instant.parse("2024-03-01T10:00:12.000500Z"));
    }

    @Test
    void shouldFetchLatestPrecedingSnapshotPerSource() throws Exception {
        SnapshotFileConnector connector = new SnapshotFileConnector(exportFile);

        List<CounterSnapshot> preceding = connector.fetchPrecedingSnapshots(SHOP, Instant.parse("2024-03-01T10:00:12.000500Z"));

        assertThat(preceding).hasSize(2);
        assertThat(preceding).extracting(CounterSnapshot::source)
                .containsExactlyInAnyOrder(MetricSource.QUERY_EXECUTION, MetricSource.CACHE);
        assertThat(preceding).extracting(CounterSnapshot::capturedAt)
                .doesNotContain(Instant.parse("2024-03-01T10:00:12.000500Z"));
    }

    @Test
    void shouldReportMissingFileAsStoreUnavailable() {
        SnapshotFileConnector connector = new SnapshotFileConnector(tempDir.resolve("missing.json"));

        assertThatThrownBy(connector::loadAll)
                .isInstanceOf(StoreUnavailableException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void shouldSkipSnapshotWithoutRequiredField() throws Exception {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, """
            {"snapshots": [
              {"server": "pg1", "subject_kind": "server", "source": "IO", "counters": {}},
              {"server": "pg1", "subject_kind": "server", "source": "IO",
               "captured_at": "2024-03-01T10:00:00Z", "counters": {"io_reads": 4}}
            ]}
            """);

        assertThat(new SnapshotFileConnector(broken).loadAll()).singleElement()
                .satisfies(snapshot -> assertThat(snapshot.counter("io_reads")).isEqualByComparingTo("4"));
    }

    @Test
    void shouldSkipMalformedSnapshotsAndKeepFetching() throws Exception {
        Path broken = tempDir.resolve("text-counter.json");
        Files.writeString(broken, """
            {"snapshots": [
              {"server": "pg1", "subject_kind": "server", "source": "IO",
               "captured_at": "2024-03-01T10:00:00Z", "counters": {"io_reads": "many"}},
              {"server": "pg1", "subject_kind": "server", "source": "IO",
               "captured_at": "yesterday", "counters": {"io_reads": 1}},
              {"server": "pg1", "subject_kind": "galaxy", "source": "IO",
               "captured_at": "2024-03-01T10:00:30Z", "counters": {"io_reads": 2}},
              {"server": "pg1", "subject_kind": "server", "source": "IO",
               "captured_at": "2024-03-01T10:01:00Z", "counters": {"io_reads": 10}}
            ]}
            """);
        EntityId server = EntityId.server("pg1");

        List<CounterSnapshot> snapshots = new SnapshotFileConnector(broken).fetchSnapshots(server,
                new TimeRange(Instant.parse("2024-03-01T09:00:00Z"), Instant.parse("2024-03-01T11:00:00Z")));

        assertThat(snapshots).singleElement()
                .satisfies(snapshot -> assertThat(snapshot.capturedAt()).isEqualTo(Instant.parse("2024-03-01T10:01:00Z")));
    }

    @Test
    void shouldRejectFileWithoutSnapshotsSection() throws IOException {
        Path broken = tempDir.resolve("no-snapshots.json");
        Files.writeString(broken, "{\"export_metadata\": {}}");

        assertThatThrownBy(() -> new SnapshotFileConnector(broken).loadAll())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("snapshots section");
    }
}
