package org.carball.pgadvisor.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.pgadvisor.advisor.HypoPgSimulator;
import org.carball.pgadvisor.advisor.IndexAdvisor;
import org.carball.pgadvisor.advisor.PgAccessMethodCatalog;
import org.carball.pgadvisor.analyzer.MetricSeriesBuilder;
import org.carball.pgadvisor.config.AdvisorConfig;
import org.carball.pgadvisor.config.ConfigurationLoader;
import org.carball.pgadvisor.model.index.AdvisorRun;
import org.carball.pgadvisor.model.index.AdvisorScope;
import org.carball.pgadvisor.model.index.IndexCandidate;
import org.carball.pgadvisor.model.index.Recommendation;
import org.carball.pgadvisor.model.metric.DerivedMetric;
import org.carball.pgadvisor.model.metric.MetricCatalog;
import org.carball.pgadvisor.model.metric.MetricDefinition;
import org.carball.pgadvisor.model.metric.MetricPoint;
import org.carball.pgadvisor.model.metric.MetricSource;
import org.carball.pgadvisor.model.qual.QualGroup;
import org.carball.pgadvisor.model.qual.QualUsageRow;
import org.carball.pgadvisor.model.snapshot.EntityId;
import org.carball.pgadvisor.model.snapshot.SubjectKind;
import org.carball.pgadvisor.model.snapshot.TimeRange;
import org.carball.pgadvisor.parser.DatabaseConnector;
import org.carball.pgadvisor.parser.QualUsageFileConnector;
import org.carball.pgadvisor.parser.SnapshotFileConnector;
import org.carball.pgadvisor.parser.StoreUnavailableException;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
public class WorkloadAdvisorCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║          PostgreSQL Workload Advisor v%s                   ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 2 || isHelpRequested(args)) {
            printUsage();
            System.exit(args.length < 2 ? 1 : 0);
        }

        try {
            switch (args[0]) {
                case "series":
                    runSeries(args);
                    break;
                case "advise":
                    runAdvise(args);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown command: " + args[0]);
            }
            System.out.println("\n✅ Done!");
        } catch (IllegalArgumentException | IllegalStateException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            System.exit(1);
        } catch (StoreUnavailableException e) {
            System.err.println("\n❌ Data source unavailable: " + e.getMessage());
            log.debug("Data source error details", e);
            System.exit(2);
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            System.exit(1);
        }
    }

    private static void runSeries(String[] args) throws StoreUnavailableException, IOException {
        Path snapshotFile = Paths.get(args[1]);
        String server = requireOption(args, "--server");
        String database = getOption(args, "--database");
        String subjectKindName = getOption(args, "--subject-kind");
        SubjectKind subjectKind = subjectKindName != null
                ? SubjectKind.fromName(subjectKindName)
                : database != null ? SubjectKind.DATABASE : SubjectKind.SERVER;
        String subject = getOption(args, "--subject");
        if (subject == null && subjectKind == SubjectKind.DATABASE) {
            subject = database;
        }
        EntityId entity = new EntityId(server, database, subjectKind, subject);

        Set<String> metrics = Arrays.stream(requireOption(args, "--metrics").split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        TimeRange range = new TimeRange(parseInstant(requireOption(args, "--from")),
                parseInstant(requireOption(args, "--to")));
        String outputFile = getOptionOrDefault(args, "--output", "series.json");

        System.out.println("\n🔍 Building series...");
        System.out.println("   Snapshot file: " + snapshotFile);
        System.out.println("   Entity: " + entity);
        System.out.println("   Metrics: " + metrics);

        MetricSeriesBuilder builder = new MetricSeriesBuilder(new SnapshotFileConnector(snapshotFile));
        Map<String, List<MetricPoint>> series = builder.buildSeries(entity, metrics, range);

        createObjectMapper().writeValue(Paths.get(outputFile).toFile(), series);

        MetricCatalog catalog = MetricCatalog.defaults();
        System.out.println("\n📊 Series summary:");
        series.forEach((name, points) -> System.out.printf("   %-24s %-14s %4d points %s%n", name,
                catalog.seriesUnit(name).orElse("?"), points.size(),
                points.stream()
                        .map(point -> point.source().getExtension())
                        .distinct()
                        .collect(Collectors.joining(", ", "(", ")"))));
        System.out.println("   Output file: " + outputFile);
    }

    private static void runAdvise(String[] args) throws StoreUnavailableException, IOException {
        QualUsageFileConnector quals = new QualUsageFileConnector(Paths.get(args[1]));
        QualUsageFileConnector.ExportMetadata metadata = quals.getExportMetadata();
        AdvisorScope scope = parseScope(args, metadata.server());

        String settingsFile = getOption(args, "--config");
        AdvisorConfig config = new ConfigurationLoader().loadConfiguration(
                getOption(args, "--profile"),
                settingsFile != null ? Paths.get(settingsFile) : null,
                args);

        DatabaseConnector connector = DatabaseConnector.forUrlTemplate(requireOption(args, "--jdbc-url"));
        String outputFile = getOptionOrDefault(args, "--output", "recommendations.json");

        System.out.println("\n🔍 Starting index advisor...");
        System.out.println("   Qual export: " + args[1] + " (" + metadata.totalQuals() + " quals)");
        System.out.println("   Scope: " + scope);
        System.out.println("   " + config.getConfigurationSummary());

        List<QualUsageRow> rows = quals.getAllQuals();
        AdvisorRun run;
        try (IndexAdvisor advisor = new IndexAdvisor(config, new HypoPgSimulator(connector),
                new PgAccessMethodCatalog(connector, getOptionOrDefault(args, "--maintenance-db", "postgres")))) {
            run = advisor.run(scope, rows);
        }

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("scope", scope.toString());
        report.put("summary", run.getSummary());
        report.put("recommendations", toReport(run.recommendations()));
        report.put("non_optimizable_quals", run.nonOptimizable());
        report.put("failed_candidates", run.candidates().stream()
                .filter(candidate -> candidate.failureReason() != null)
                .map(candidate -> Map.of("candidate", candidate.toString(), "reason", candidate.failureReason()))
                .collect(Collectors.toList()));
        report.put("diagnostics", run.diagnostics());
        createObjectMapper().writeValue(Paths.get(outputFile).toFile(), report);

        printSummary(run);
        System.out.println("   Output file: " + outputFile);
    }

    private static AdvisorScope parseScope(String[] args, String exportServer) {
        String server = getOptionOrDefault(args, "--server", exportServer);
        String kind = getOptionOrDefault(args, "--scope", "workload");
        switch (kind.toLowerCase()) {
            case "workload":
                return AdvisorScope.workload(server);
            case "database":
                return AdvisorScope.database(server, requireOption(args, "--database"));
            case "query":
                return AdvisorScope.query(server, requireOption(args, "--database"), requireOption(args, "--query"));
            default:
                throw new IllegalArgumentException("Invalid scope: " + kind + ". Valid options: workload, database, query");
        }
    }

    private static List<Map<String, Object>> toReport(List<Recommendation> recommendations) {
        List<Map<String, Object>> report = new ArrayList<>();
        int rank = 1;
        for (Recommendation recommendation : recommendations) {
            IndexCandidate candidate = recommendation.candidate();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("rank", rank++);
            entry.put("database", candidate.database());
            entry.put("ddl", recommendation.ddl());
            entry.put("benefit_score", recommendation.benefitScore());
            entry.put("gain_percent", candidate.simulation().gainPercent());
            entry.put("executions", candidate.totalExecutionCount());
            entry.put("quals", recommendation.supportingQualGroups().stream()
                    .map(QualGroup::signature)
                    .collect(Collectors.toList()));
            report.add(entry);
        }
        return report;
    }

    private static void printSummary(AdvisorRun run) {
        System.out.println("\n📊 Advisor Summary:");
        System.out.println("   " + run.getSummary());

        if (run.recommendations().isEmpty()) {
            System.out.println("\n💡 No index recommendations for this scope.");
            return;
        }
        System.out.println("\n🎯 Top Recommendations:");
        run.recommendations().stream()
                .limit(5)
                .forEach(recommendation -> System.out.printf("   • %s (benefit %.1f, gain %.2f%%)%n",
                        recommendation.ddl(), recommendation.benefitScore(),
                        recommendation.candidate().simulation().gainPercent()));
    }

    private static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    private static Instant parseInstant(String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid ISO-8601 instant: " + value);
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static String getOption(String[] args, String name) {
        for (int i = 2; i < args.length - 1; i++) {
            if (args[i].equals(name)) {
                return args[i + 1];
            }
        }
        return null;
    }

    private static String getOptionOrDefault(String[] args, String name, String defaultValue) {
        String value = getOption(args, name);
        return value != null ? value : defaultValue;
    }

    private static String requireOption(String[] args, String name) {
        String value = getOption(args, name);
        if (value == null) {
            throw new IllegalArgumentException("Missing required option " + name);
        }
        return value;
    }

    private static void printUsage() {
        System.out.println("\nUsage:");
        System.out.println("  java -jar pg-workload-advisor.jar series <snapshot-file> [options]");
        System.out.println("  java -jar pg-workload-advisor.jar advise <qual-file> [options]");
        System.out.println();
        System.out.println("Series options:");
        System.out.println("  --server            Server name (required)");
        System.out.println("  --database          Database name");
        System.out.println("  --subject-kind      server|database|query|wait-event|table");
        System.out.println("  --subject           Query id, wait event or table name");
        System.out.println("  --metrics           Comma separated metric names, e.g. calls,total_exec_time,avg_runtime");
        System.out.println("  --from, --to        ISO-8601 instants bounding the series (required)");
        System.out.println("  --output            Output JSON file (default: series.json)");
        System.out.println();
        System.out.println("Known metrics:");
        for (MetricSource source : MetricSource.values()) {
            System.out.printf("  %-20s %s%n", source.getExtension(), MetricCatalog.defaults().all().stream()
                    .filter(definition -> definition.source() == source)
                    .map(MetricDefinition::name)
                    .collect(Collectors.joining(", ")));
        }
        System.out.printf("  %-20s %s%n", "derived", Arrays.stream(DerivedMetric.values())
                .map(DerivedMetric::getMetricName)
                .collect(Collectors.joining(", ")));
        System.out.println();
        System.out.println("Advise options:");
        System.out.println("  --jdbc-url          JDBC URL template with {database}, e.g.");
        System.out.println("                      jdbc:postgresql://localhost:5432/{database}?user=powa (required)");
        System.out.println("  --scope             workload|database|query (default: workload)");
        System.out.println("  --server            Server name (default: from export metadata)");
        System.out.println("  --database          Database for database/query scope");
        System.out.println("  --query             Query id for query scope");
        System.out.println("  --maintenance-db    Database used to read installed access methods (default: postgres)");
        System.out.println("  --profile           conservative|balanced|aggressive");
        System.out.println("  --config            YAML file with advisor settings");
        System.out.println("  --output            Output JSON file (default: recommendations.json)");
        System.out.println();
        System.out.println(ConfigurationLoader.getConfigurationHelp());
    }
}
