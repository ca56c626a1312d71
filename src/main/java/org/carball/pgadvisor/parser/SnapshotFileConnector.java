package org.carball.pgadvisor.parser;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.pgadvisor.model.metric.MetricSource;
import org.carball.pgadvisor.model.snapshot.CounterSnapshot;
import org.carball.pgadvisor.model.snapshot.EntityId;
import org.carball.pgadvisor.model.snapshot.SubjectKind;
import org.carball.pgadvisor.model.snapshot.TimeRange;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads counter snapshots from an exported JSON file. The file is read again on every fetch, so a
 * collector may keep appending to it between calls.
 */
@Slf4j
public class SnapshotFileConnector implements SnapshotSource {

    private final Path path;
    private final ObjectMapper objectMapper;

    public SnapshotFileConnector(Path path) {
        this.path = path;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    @Override
    public List<CounterSnapshot> fetchSnapshots(EntityId entity, TimeRange range) throws StoreUnavailableException {
        List<CounterSnapshot> results = new ArrayList<>();
        for (CounterSnapshot snapshot : loadAll()) {
            if (snapshot.entityId().equals(entity) && range.contains(snapshot.capturedAt())) {
                results.add(snapshot);
            }
        }
        results.sort(Comparator.comparing(CounterSnapshot::capturedAt));
        return results;
    }

    @Override
    public List<CounterSnapshot> fetchPrecedingSnapshots(EntityId entity, Instant instant) throws StoreUnavailableException {
        Map<MetricSource, CounterSnapshot> latest = new EnumMap<>(MetricSource.class);
        for (CounterSnapshot snapshot : loadAll()) {
            if (snapshot.entityId().equals(entity) && snapshot.capturedAt().isBefore(instant)) {
                latest.merge(snapshot.source(), snapshot,
                        (a, b) -> a.capturedAt().isAfter(b.capturedAt()) ? a : b);
            }
        }
        return new ArrayList<>(latest.values());
    }

    /**
     * Every well-formed snapshot in the file, in file order. Malformed entries are skipped with a
     * warning; only an unreadable file fails the fetch.
     */
    public List<CounterSnapshot> loadAll() throws StoreUnavailableException {
        JsonNode exportData = readExport();
        List<CounterSnapshot> snapshots = new ArrayList<>();
        int index = 0;
        int skipped = 0;
        for (JsonNode node : exportData.get("snapshots")) {
            try {
                snapshots.add(parseSnapshot(node));
            } catch (IllegalStateException | IllegalArgumentException e) {
                log.warn("Skipping snapshot #{} in {}: {}", index, path, e.getMessage());
                skipped++;
            }
            index++;
        }
        log.debug("Loaded {} snapshots from {} ({} skipped)", snapshots.size(), path, skipped);
        return snapshots;
    }

    private JsonNode readExport() throws StoreUnavailableException {
        if (!Files.exists(path)) {
            throw new StoreUnavailableException("Snapshot export file not found: " + path);
        }
        JsonNode exportData;
        try {
            exportData = objectMapper.readTree(Files.readString(path));
        } catch (IOException e) {
            throw new StoreUnavailableException("Cannot read snapshot export file " + path + ": " + e.getMessage(), e);
        }
        validateExportFormat(exportData);
        return exportData;
    }

    private void validateExportFormat(JsonNode exportData) {
        if (exportData == null || !exportData.isObject()) {
            throw new IllegalStateException("Invalid JSON format in snapshot export file");
        }
        JsonNode snapshots = exportData.get("snapshots");
        if (snapshots == null || !snapshots.isArray()) {
            throw new IllegalStateException("Missing or invalid snapshots section in export file");
        }
    }

    private CounterSnapshot parseSnapshot(JsonNode node) {
        String[] requiredFields = {"server", "subject_kind", "source", "captured_at", "counters"};
        for (String field : requiredFields) {
            if (!node.hasNonNull(field)) {
                throw new IllegalStateException("Snapshot missing required field: " + field);
            }
        }

        EntityId entityId = new EntityId(
                node.get("server").asText(),
                textOrNull(node, "database"),
                SubjectKind.fromName(node.get("subject_kind").asText()),
                textOrNull(node, "subject"));

        Instant capturedAt;
        try {
            capturedAt = Instant.parse(node.get("captured_at").asText());
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("Invalid captured_at timestamp: " + node.get("captured_at").asText(), e);
        }

        CounterSnapshot.CounterSnapshotBuilder builder = CounterSnapshot.builder()
                .entityId(entityId)
                .source(MetricSource.fromName(node.get("source").asText()))
                .capturedAt(capturedAt)
                .restart(node.path("restart").asBoolean(false));

        Iterator<Map.Entry<String, JsonNode>> counters = node.get("counters").fields();
        while (counters.hasNext()) {
            Map.Entry<String, JsonNode> counter = counters.next();
            if (!counter.getValue().isNumber()) {
                throw new IllegalStateException("Counter " + counter.getKey() + " is not numeric: " + counter.getValue());
            }
            // floats are read as BigDecimal, so the exported digits are kept exactly
            BigDecimal value = counter.getValue().decimalValue();
            builder.counter(counter.getKey(), value);
        }
        return builder.build();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
