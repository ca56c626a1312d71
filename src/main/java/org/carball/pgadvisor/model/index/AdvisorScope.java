package org.carball.pgadvisor.model.index;

import org.carball.pgadvisor.model.qual.QualUsageRow;

import java.util.Objects;

/**
 * What an advisor run covers: one query, one database, or every database of a server.
 */
public record AdvisorScope(Kind kind, String server, String database, String queryId) {

    public enum Kind {
        QUERY,
        DATABASE,
        WORKLOAD
    }

    public AdvisorScope {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(server, "server");
        if (kind != Kind.WORKLOAD && database == null) {
            throw new IllegalArgumentException(kind + " scope requires a database");
        }
        if (kind == Kind.QUERY && queryId == null) {
            throw new IllegalArgumentException("QUERY scope requires a query id");
        }
    }

    public static AdvisorScope workload(String server) {
        return new AdvisorScope(Kind.WORKLOAD, server, null, null);
    }

    public static AdvisorScope database(String server, String database) {
        return new AdvisorScope(Kind.DATABASE, server, database, null);
    }

    public static AdvisorScope query(String server, String database, String queryId) {
        return new AdvisorScope(Kind.QUERY, server, database, queryId);
    }

    public boolean includes(QualUsageRow row) {
        if (!server.equals(row.server())) {
            return false;
        }
        switch (kind) {
            case QUERY:
                return database.equals(row.database()) && queryId.equals(row.queryId());
            case DATABASE:
                return database.equals(row.database());
            default:
                return true;
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case QUERY:
                return "query " + queryId + " on " + server + "/" + database;
            case DATABASE:
                return "database " + server + "/" + database;
            default:
                return "workload " + server;
        }
    }
}
