package org.carball.pgadvisor.model.snapshot;

/**
 * What a counter snapshot is scoped to, below the server/database pair.
 */
public enum SubjectKind {
    SERVER,
    DATABASE,
    QUERY,
    WAIT_EVENT,
    TABLE;

    public static SubjectKind fromName(String name) {
        for (SubjectKind kind : values()) {
            if (kind.name().equalsIgnoreCase(name.replace('-', '_'))) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown subject kind: " + name);
    }
}
