package org.carball.pgadvisor.advisor;

import lombok.extern.slf4j.Slf4j;
import org.carball.pgadvisor.model.index.AccessMethod;
import org.carball.pgadvisor.model.index.IndexCandidate;
import org.carball.pgadvisor.model.index.SimulationResult;
import org.carball.pgadvisor.parser.DatabaseConnector;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Simulates candidates with the hypopg extension in the candidate's database.
 * <p>
 * The hypothetical index is created in the session, each example query of the candidate is
 * EXPLAINed with hypopg disabled and enabled, and the total costs are summed. The planner is
 * considered to use the index when its name shows up in at least one of the hypothetical plans.
 * Hypothetical indexes are always reset before the connection is closed.
 */
@Slf4j
public class HypoPgSimulator implements HypotheticalIndexSimulator {

    private static final Set<AccessMethod> HYPOPG_METHODS = EnumSet.of(AccessMethod.BTREE, AccessMethod.BRIN, AccessMethod.HASH);

    // Total cost: the number after ".." in "cost=0.00..35.50"
    private static final Pattern COST_PATTERN = Pattern.compile("(?<=\\.\\.)\\d+\\.\\d+");

    private static final String CREATE_HYPOTHETICAL_INDEX = "SELECT indexname FROM hypopg_create_index(?)";

    private final DatabaseConnector connector;

    public HypoPgSimulator(DatabaseConnector connector) {
        this.connector = connector;
    }

    @Override
    public SimulationResult simulate(IndexCandidate candidate) throws SimulationException {
        if (!HYPOPG_METHODS.contains(candidate.accessMethod())) {
            throw new SimulationException("hypopg cannot simulate " + candidate.accessMethod().getAmName() + " indexes");
        }
        List<String> queries = candidate.exampleQueries();
        if (queries.isEmpty()) {
            throw new SimulationException("No example query with constants to explain for " + candidate);
        }

        try (Connection conn = connector.open(candidate.database())) {
            String indexName = createHypotheticalIndex(conn, candidate.ddl());
            try {
                double baseCost = 0;
                double hypotheticalCost = 0;
                boolean used = false;
                for (String query : queries) {
                    baseCost += parseTotalCost(explain(conn, query, false));
                    String hypoPlan = explain(conn, query, true);
                    hypotheticalCost += parseTotalCost(hypoPlan);
                    used |= hypoPlan.contains(indexName);
                }
                log.debug("Simulated {} over {} queries: cost {} -> {}, used={}", candidate, queries.size(),
                        baseCost, hypotheticalCost, used);
                return new SimulationResult(used, baseCost, hypotheticalCost, indexName);
            } finally {
                reset(conn);
            }
        } catch (SQLException e) {
            throw new SimulationException("hypopg simulation failed for " + candidate + ": " + e.getMessage(), e);
        }
    }

    private String createHypotheticalIndex(Connection conn, String ddl) throws SQLException, SimulationException {
        try (PreparedStatement stmt = conn.prepareStatement(CREATE_HYPOTHETICAL_INDEX)) {
            stmt.setString(1, ddl);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new SimulationException("hypopg did not create an index for: " + ddl);
                }
                return rs.getString(1);
            }
        }
    }

    private String explain(Connection conn, String query, boolean hypothetical) throws SQLException {
        StringBuilder plan = new StringBuilder();
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("SET hypopg.enabled = " + (hypothetical ? "on" : "off"));
            try (ResultSet rs = stmt.executeQuery("EXPLAIN " + query)) {
                while (rs.next()) {
                    plan.append(rs.getString(1)).append('\n');
                }
            }
        }
        return plan.toString();
    }

    private void reset(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("SELECT hypopg_reset()");
        }
    }

    /**
     * Total cost of the top plan node.
     */
    static double parseTotalCost(String plan) throws SimulationException {
        Matcher matcher = COST_PATTERN.matcher(plan);
        if (!matcher.find()) {
            throw new SimulationException("No cost found in plan: " + plan);
        }
        return Double.parseDouble(matcher.group());
    }
}
