package com.cgi.dbsurveyor.collector.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Database engines known to the collector.
 * A known engine is not necessarily a supported one; support is decided by the adapter registry.
 */
public enum DatabaseType {
    POSTGRESQL("postgresql", true),
    MYSQL("mysql", true),
    SQLITE("sqlite", true),
    MONGODB("mongodb", false),
    SQLSERVER("sqlserver", true);

    private final String id;
    private final boolean relational;

    DatabaseType(String id, boolean relational) {
        this.id = id;
        this.relational = relational;
    }

    /**
     * Gets the lower-case identifier used in configuration and output.
     *
     * @return Engine identifier
     */
    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Whether the engine belongs to the relational SQL family.
     *
     * @return true for SQL engines, false for document stores
     */
    public boolean isRelational() {
        return relational;
    }

    /**
     * Resolves an engine from its identifier or enum name.
     *
     * @param value Identifier, case-insensitive
     * @return The engine
     * @throws IllegalArgumentException If the value is unknown
     */
    public static DatabaseType fromId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Database type cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DatabaseType type : values()) {
            if (type.id.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported database type: " + value);
    }
}
