package com.naturalsql.model;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Point-in-time table/column metadata for one connection. Immutable; a refresh replaces the whole snapshot.
 */
public final class SchemaSnapshot {

    private final String connectionId;
    private final Map<String, List<ColumnInfo>> tables;
    private final Map<String, String> canonicalNames;
    private final OffsetDateTime takenAt;

    /**
     * Create a snapshot.
     *
     * @param connectionId identity of the connection it was taken from
     * @param tables table name to ordered columns; iteration order is kept
     * @param takenAt introspection time
     */
    public SchemaSnapshot(String connectionId, Map<String, List<ColumnInfo>> tables, OffsetDateTime takenAt) {
        this.connectionId = connectionId;
        Map<String, List<ColumnInfo>> copy = new LinkedHashMap<>();
        Map<String, String> canonical = new LinkedHashMap<>();
        tables.forEach((name, cols) -> {
            copy.put(name, List.copyOf(cols));
            canonical.put(name.toLowerCase(Locale.ROOT), name);
        });
        this.tables = Collections.unmodifiableMap(copy);
        this.canonicalNames = Collections.unmodifiableMap(canonical);
        this.takenAt = takenAt;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public OffsetDateTime getTakenAt() {
        return takenAt;
    }

    /**
     * All tables with their columns, in introspection order.
     *
     * @return unmodifiable map
     */
    public Map<String, List<ColumnInfo>> getTables() {
        return tables;
    }

    public List<String> tableNames() {
        return List.copyOf(tables.keySet());
    }

    /**
     * Case-insensitive lookup of the canonical table name.
     *
     * @param name table name as written
     * @return canonical name if present
     */
    public Optional<String> resolveTable(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(canonicalNames.get(name.toLowerCase(Locale.ROOT)));
    }

    public boolean containsTable(String name) {
        return resolveTable(name).isPresent();
    }

    /**
     * Columns of a table, looked up case-insensitively.
     *
     * @param name table name
     * @return columns, if the table exists
     */
    public Optional<List<ColumnInfo>> columns(String name) {
        return resolveTable(name).map(tables::get);
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }
}
