package org.carball.pgadvisor.advisor;

import lombok.extern.slf4j.Slf4j;
import org.carball.pgadvisor.model.index.AccessMethod;
import org.carball.pgadvisor.parser.DatabaseConnector;
import org.carball.pgadvisor.parser.StoreUnavailableException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.EnumSet;
import java.util.Set;

/**
 * Reads installed index access methods from {@code pg_am}. Nothing is cached: callers fetch the set
 * once per advisor run.
 */
@Slf4j
public class PgAccessMethodCatalog implements AccessMethodCapabilities {

    private static final String INDEX_ACCESS_METHODS = """
        SELECT amname
        FROM pg_am
        WHERE amtype = 'i'
        ORDER BY amname
    """;

    private final DatabaseConnector connector;
    private final String maintenanceDatabase;

    public PgAccessMethodCatalog(DatabaseConnector connector, String maintenanceDatabase) {
        this.connector = connector;
        this.maintenanceDatabase = maintenanceDatabase;
    }

    @Override
    public Set<AccessMethod> supportedAccessMethods(String server) throws StoreUnavailableException {
        Set<AccessMethod> methods = EnumSet.noneOf(AccessMethod.class);
        try (Connection conn = connector.open(maintenanceDatabase);
             PreparedStatement stmt = conn.prepareStatement(INDEX_ACCESS_METHODS);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                String amName = rs.getString(1);
                AccessMethod.fromName(amName).ifPresentOrElse(methods::add,
                        () -> log.debug("Ignoring unknown access method {} on {}", amName, server));
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Cannot read access methods of " + server + ": " + e.getMessage(), e);
        }
        log.info("Access methods installed on {}: {}", server, methods);
        return methods;
    }
}
