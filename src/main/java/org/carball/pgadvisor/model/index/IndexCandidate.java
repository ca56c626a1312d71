package org.carball.pgadvisor.model.index;

import org.carball.pgadvisor.model.qual.QualGroup;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A proposed index and where it stands in simulation. Instances are immutable: every state
 * transition returns a new candidate.
 */
public record IndexCandidate(
        String server,
        String database,
        String tableIdentifier,
        List<String> columns,
        AccessMethod accessMethod,
        Double estimatedBenefit,
        SimulationStatus status,
        SimulationResult simulation,
        String failureReason,
        List<QualGroup> supportingGroups
) {

    public IndexCandidate {
        columns = List.copyOf(columns);
        supportingGroups = List.copyOf(supportingGroups);
    }

    public static IndexCandidate proposed(QualGroup group, List<String> columns, AccessMethod accessMethod) {
        return new IndexCandidate(group.server(), group.database(), group.tableIdentifier(), columns,
                accessMethod, null, SimulationStatus.UNTESTED, null, null, List.of(group));
    }

    public Key key() {
        return new Key(server, database, tableIdentifier, columns, accessMethod);
    }

    public IndexCandidate withSupportingGroup(QualGroup group) {
        if (supportingGroups.contains(group)) {
            return this;
        }
        List<QualGroup> groups = new ArrayList<>(supportingGroups);
        groups.add(group);
        return new IndexCandidate(server, database, tableIdentifier, columns, accessMethod,
                estimatedBenefit, status, simulation, failureReason, groups);
    }

    public IndexCandidate accepted(SimulationResult result, double benefit) {
        requireUntested();
        return new IndexCandidate(server, database, tableIdentifier, columns, accessMethod,
                benefit, SimulationStatus.ACCEPTED, result, null, supportingGroups);
    }

    public IndexCandidate rejected(SimulationResult result) {
        requireUntested();
        return new IndexCandidate(server, database, tableIdentifier, columns, accessMethod,
                null, SimulationStatus.REJECTED, result, null, supportingGroups);
    }

    public IndexCandidate simulationFailed(String reason) {
        requireUntested();
        return new IndexCandidate(server, database, tableIdentifier, columns, accessMethod,
                null, SimulationStatus.SIMULATION_FAILED, null, reason, supportingGroups);
    }

    private void requireUntested() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Candidate " + this + " was already simulated: " + status);
        }
    }

    public long totalExecutionCount() {
        return supportingGroups.stream().mapToLong(QualGroup::executionCount).sum();
    }

    public List<String> exampleQueries() {
        return supportingGroups.stream()
                .flatMap(group -> group.exampleQueries().stream())
                .distinct()
                .collect(Collectors.toList());
    }

    /**
     * CREATE INDEX statement for this candidate, identifiers quoted.
     */
    public String ddl() {
        String[] parts = tableIdentifier.split("\\.", 2);
        String qualifiedTable = parts.length == 2
                ? quoteIdent(parts[0]) + "." + quoteIdent(parts[1])
                : quoteIdent(tableIdentifier);
        return "CREATE INDEX ON " + qualifiedTable + " USING " + accessMethod.getAmName() + " ("
                + columns.stream().map(IndexCandidate::quoteIdent).collect(Collectors.joining(", ")) + ")";
    }

    @Override
    public String toString() {
        return database + ":" + tableIdentifier + " USING " + accessMethod.getAmName() + " " + columns + " [" + status + "]";
    }

    private static String quoteIdent(String name) {
        return '"' + name.replace("\"", "\"\"") + '"';
    }

    public record Key(
            String server,
            String database,
            String tableIdentifier,
            List<String> columns,
            AccessMethod accessMethod
    ) {}
}
