package com.naturalsql.model;

import java.util.Locale;
import java.util.Map;

/**
 * Supported database engines. Each kind knows its JDBC driver and how to render a JDBC URL.
 */
public enum EngineKind {
    POSTGRES("org.postgresql.Driver", 5432, "PostgreSQL"),
    MYSQL("com.mysql.cj.jdbc.Driver", 3306, "MySQL"),
    SQLITE("org.sqlite.JDBC", -1, "SQLite");

    private static final Map<String, EngineKind> ALIASES = Map.ofEntries(
            Map.entry("postgres", POSTGRES),
            Map.entry("postgresql", POSTGRES),
            Map.entry("pg", POSTGRES),
            Map.entry("mysql", MYSQL),
            Map.entry("mariadb", MYSQL),
            Map.entry("sqlite", SQLITE),
            Map.entry("sqlite3", SQLITE),
            Map.entry("file", SQLITE)
    );

    private final String driverClassName;
    private final int defaultPort;
    private final String dialect;

    EngineKind(String driverClassName, int defaultPort, String dialect) {
        this.driverClassName = driverClassName;
        this.defaultPort = defaultPort;
        this.dialect = dialect;
    }

    /**
     * Resolve an engine from a user-supplied type name or alias.
     *
     * @param dbType incoming type, e.g. {@code postgresql}
     * @return engine kind
     * @throws IllegalArgumentException when the type is not supported
     */
    public static EngineKind fromName(String dbType) {
        String v = dbType == null ? "" : dbType.trim().toLowerCase(Locale.ROOT);
        EngineKind kind = ALIASES.get(v);
        if (kind == null) {
            throw new IllegalArgumentException("Unsupported database type: " + dbType);
        }
        return kind;
    }

    public String getDriverClassName() {
        return driverClassName;
    }

    public int getDefaultPort() {
        return defaultPort;
    }

    /**
     * Dialect name used when prompting the language model.
     *
     * @return dialect display name
     */
    public String getDialect() {
        return dialect;
    }

    public boolean isFileBased() {
        return this == SQLITE;
    }

    /**
     * Build the JDBC URL for a descriptor of this engine.
     *
     * @param descriptor connection descriptor
     * @return jdbc url
     */
    public String jdbcUrl(ConnectionDescriptor descriptor) {
        return switch (this) {
            case POSTGRES -> String.format("jdbc:postgresql://%s:%d/%s",
                    descriptor.getHost(), descriptor.effectivePort(), nullToEmpty(descriptor.getDatabase()));
            case MYSQL -> String.format("jdbc:mysql://%s:%d/%s",
                    descriptor.getHost(), descriptor.effectivePort(), nullToEmpty(descriptor.getDatabase()));
            case SQLITE -> "jdbc:sqlite:" + descriptor.getPath();
        };
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
