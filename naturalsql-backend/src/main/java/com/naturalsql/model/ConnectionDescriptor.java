package com.naturalsql.model;

import com.naturalsql.util.Digests;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * Everything needed to open a connection to one database.
 *
 * <p>{@link #identity()} is a stable digest of the normalized descriptor and keys the schema cache, the query
 * cache and the history. The password is not part of it.
 */
@Value
@Builder(toBuilder = true)
public class ConnectionDescriptor {
    EngineKind engine;
    String host;
    int port;
    String username;
    String password;
    String database;
    String path;

    /**
     * Port to connect to, falling back to the engine default when unset.
     *
     * @return effective port, or -1 for file engines
     */
    public int effectivePort() {
        return port > 0 ? port : engine.getDefaultPort();
    }

    /**
     * Stable identity of this descriptor.
     *
     * @return lowercase hex SHA-256 of the normalized descriptor
     */
    public String identity() {
        String normalized = String.join("|",
                engine.name(),
                engine.isFileBased() ? "" : lower(host),
                engine.isFileBased() ? "" : String.valueOf(effectivePort()),
                engine.isFileBased() ? "" : nullToEmpty(database),
                engine.isFileBased() ? nullToEmpty(path).trim() : "",
                nullToEmpty(username));
        return Digests.sha256Hex(normalized);
    }

    /**
     * JDBC URL for this descriptor.
     *
     * @return jdbc url
     */
    public String jdbcUrl() {
        return engine.jdbcUrl(this);
    }

    /**
     * Database label shown in status output: the database name, or the file path for file engines.
     *
     * @return label
     */
    public String databaseLabel() {
        return engine.isFileBased() ? path : database;
    }

    @Override
    public String toString() {
        if (engine.isFileBased()) {
            return engine.name().toLowerCase(Locale.ROOT) + ":" + path;
        }
        return engine.name().toLowerCase(Locale.ROOT) + "://" + nullToEmpty(username) + ":****@"
                + host + ":" + effectivePort() + "/" + nullToEmpty(database);
    }

    private static String lower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
