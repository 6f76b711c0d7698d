package org.schemaforge.render;

import java.util.Locale;
import java.util.Set;

/**
 * Target warehouses and databases.
 */
public enum Platform {
    BIGQUERY("bigquery", "BigQuery", Set.of("bq")),
    SNOWFLAKE("snowflake", "Snowflake", Set.of()),
    REDSHIFT("redshift", "Redshift", Set.of()),
    POSTGRESQL("postgresql", "PostgreSQL", Set.of("postgres", "pg")),
    SQLSERVER("sqlserver", "SQL Server", Set.of("mssql", "tsql"));

    private final String token;
    private final String displayName;
    private final Set<String> aliases;

    Platform(String token, String displayName, Set<String> aliases) {
        this.token = token;
        this.displayName = displayName;
        this.aliases = aliases;
    }

    public String token() {
        return token;
    }

    public String displayName() {
        return displayName;
    }

    public static Platform fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Platform name must not be empty");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Platform platform : values()) {
            if (platform.token.equals(normalized) || platform.aliases.contains(normalized)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unsupported platform: " + name);
    }
}
