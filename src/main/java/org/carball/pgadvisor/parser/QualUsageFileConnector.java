package org.carball.pgadvisor.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.pgadvisor.model.index.AccessMethod;
import org.carball.pgadvisor.model.qual.QualUsageRow;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Reads resolved pg_qualstats rows from an exported JSON file.
 */
public class QualUsageFileConnector {

    private final JsonNode exportData;

    public QualUsageFileConnector(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Qual usage export file not found: " + path);
        }
        ObjectMapper objectMapper = new ObjectMapper();
        exportData = objectMapper.readTree(Files.readString(path));

        validateExportFormat();
    }

    public List<QualUsageRow> getAllQuals() {
        List<QualUsageRow> results = new ArrayList<>();
        for (JsonNode qualNode : exportData.get("quals")) {
            results.add(parseQual(qualNode));
        }
        return results;
    }

    public ExportMetadata getExportMetadata() {
        JsonNode metadata = exportData.get("export_metadata");
        return new ExportMetadata(
                metadata.get("server").asText(),
                metadata.path("export_timestamp").asText(null),
                metadata.path("postgres_version").asText(null),
                exportData.get("quals").size());
    }

    private void validateExportFormat() {
        if (exportData == null || !exportData.isObject()) {
            throw new IllegalStateException("Invalid JSON format in qual usage export file");
        }
        JsonNode metadata = exportData.get("export_metadata");
        if (metadata == null || !metadata.has("server")) {
            throw new IllegalStateException("Missing export_metadata.server in qual usage export file");
        }
        JsonNode quals = exportData.get("quals");
        if (quals == null || !quals.isArray()) {
            throw new IllegalStateException("Missing or invalid quals section in qual usage export file");
        }
    }

    /**
     * Missing fields are kept as nulls or zeros: the aggregator decides what is usable and reports the rest.
     */
    private QualUsageRow parseQual(JsonNode node) {
        String server = node.hasNonNull("server")
                ? node.get("server").asText()
                : exportData.get("export_metadata").get("server").asText();

        return QualUsageRow.builder()
                .server(server)
                .database(text(node, "database"))
                .queryId(text(node, "query_id"))
                .qualId(text(node, "qual_id"))
                .schemaName(text(node, "schema"))
                .tableName(text(node, "table"))
                .columnName(text(node, "column"))
                .operator(text(node, "operator"))
                .accessMethods(parseAccessMethods(node.get("access_methods")))
                .executionCount(node.path("execution_count").asLong(0))
                .filteredRows(node.path("filtered_rows").asLong(0))
                .nDistinct(node.hasNonNull("n_distinct") ? node.get("n_distinct").asDouble() : null)
                .tableLiveRows(node.hasNonNull("table_live_rows") ? node.get("table_live_rows").asLong() : null)
                .exampleQuery(text(node, "example_query"))
                .build();
    }

    private static Set<AccessMethod> parseAccessMethods(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        Set<AccessMethod> methods = EnumSet.noneOf(AccessMethod.class);
        for (JsonNode name : node) {
            AccessMethod.fromName(name.asText()).ifPresent(methods::add);
        }
        return methods;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    public record ExportMetadata(String server, String exportTimestamp, String postgresVersion, int totalQuals) {}
}
