package org.carball.pgadvisor.parser;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens JDBC connections to a named database of the target server.
 */
@FunctionalInterface
public interface DatabaseConnector {

    String DATABASE_PLACEHOLDER = "{database}";

    Connection open(String database) throws SQLException;

    /**
     * Connector for a JDBC URL in which {@value #DATABASE_PLACEHOLDER} is replaced by the database name,
     * e.g. {@code jdbc:postgresql://localhost:5432/{database}?user=powa}.
     */
    static DatabaseConnector forUrlTemplate(String urlTemplate) {
        if (!urlTemplate.contains(DATABASE_PLACEHOLDER)) {
            throw new IllegalArgumentException("JDBC URL template must contain " + DATABASE_PLACEHOLDER + ": " + urlTemplate);
        }
        return database -> DriverManager.getConnection(urlTemplate.replace(DATABASE_PLACEHOLDER, database));
    }
}
