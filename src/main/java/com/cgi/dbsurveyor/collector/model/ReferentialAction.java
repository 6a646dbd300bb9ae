package com.cgi.dbsurveyor.collector.model;

import java.util.Locale;

/**
 * ON DELETE / ON UPDATE behaviour of a foreign key.
 */
public enum ReferentialAction {
    CASCADE,
    SET_NULL,
    SET_DEFAULT,
    RESTRICT,
    NO_ACTION;

    /**
     * Parses the SQL spelling used by information_schema and PRAGMA output.
     *
     * @param value Rule such as "SET NULL" or "NO ACTION"
     * @return The action, or null when the value is null or unknown
     */
    public static ReferentialAction fromSql(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "CASCADE" -> CASCADE;
            case "SET NULL" -> SET_NULL;
            case "SET DEFAULT" -> SET_DEFAULT;
            case "RESTRICT" -> RESTRICT;
            case "NO ACTION" -> NO_ACTION;
            default -> null;
        };
    }

    /**
     * Parses PostgreSQL's single-letter pg_constraint codes.
     *
     * @param code confupdtype / confdeltype value
     * @return The action, or null when unknown
     */
    public static ReferentialAction fromPostgresCode(String code) {
        if (code == null || code.isEmpty()) {
            return null;
        }
        return switch (code.charAt(0)) {
            case 'a' -> NO_ACTION;
            case 'r' -> RESTRICT;
            case 'c' -> CASCADE;
            case 'n' -> SET_NULL;
            case 'd' -> SET_DEFAULT;
            default -> null;
        };
    }
}
