package com.naturalsql.model;

import java.util.Locale;
import java.util.Set;

/**
 * Statement kinds the pipeline distinguishes. Everything that is not one of the four data kinds is OTHER.
 */
public enum StatementKind {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    OTHER;

    public static final Set<StatementKind> PERMITTED = Set.of(SELECT, INSERT, UPDATE, DELETE);

    public boolean isMutation() {
        return this == INSERT || this == UPDATE || this == DELETE;
    }

    /**
     * Parse a mutation kind as supplied by a caller ({@code insert|update|delete}).
     *
     * @param raw incoming kind
     * @return mutation kind
     * @throws IllegalArgumentException for anything else
     */
    public static StatementKind mutationFromName(String raw) {
        String v = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        for (StatementKind kind : values()) {
            if (kind.isMutation() && kind.name().equals(v)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("kind must be one of insert, update, delete: " + raw);
    }
}
