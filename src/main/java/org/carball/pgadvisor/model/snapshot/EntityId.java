package org.carball.pgadvisor.model.snapshot;

import java.util.Objects;

/**
 * Identifies the scope a series of cumulative counters belongs to: a server, optionally a
 * database, and a subject (a query id, a wait event, a table) within it.
 */
public record EntityId(
        String server,
        String database,
        SubjectKind subjectKind,
        String subject
) {

    public EntityId {
        Objects.requireNonNull(server, "server");
        Objects.requireNonNull(subjectKind, "subjectKind");
    }

    public static EntityId server(String server) {
        return new EntityId(server, null, SubjectKind.SERVER, null);
    }

    public static EntityId database(String server, String database) {
        return new EntityId(server, database, SubjectKind.DATABASE, database);
    }

    public static EntityId query(String server, String database, String queryId) {
        return new EntityId(server, database, SubjectKind.QUERY, queryId);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(server);
        if (database != null) {
            sb.append('/').append(database);
        }
        sb.append(':').append(subjectKind.name().toLowerCase());
        if (subject != null) {
            sb.append('=').append(subject);
        }
        return sb.toString();
    }
}
