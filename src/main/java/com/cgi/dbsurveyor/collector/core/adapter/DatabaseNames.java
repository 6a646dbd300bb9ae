package com.cgi.dbsurveyor.collector.core.adapter;

import com.cgi.dbsurveyor.collector.exception.InvalidConnectionTargetException;

import java.util.regex.Pattern;

/**
 * Allow-list validation of database names before they are used in a connection.
 */
public final class DatabaseNames {

    /**
     * Maximum accepted length, matching the longest identifier of the supported engines.
     */
    public static final int MAX_LENGTH = 128;

    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9_$.\\-]+");

    private DatabaseNames() {
    }

    /**
     * Validates a database name.
     *
     * @param databaseName Database name
     * @return The same name
     * @throws InvalidConnectionTargetException If the name is empty, too long, or contains anything
     *                                          outside letters, digits, '_', '$', '.', '-'
     */
    public static String validate(String databaseName) {
        if (databaseName == null || databaseName.isEmpty()) {
            throw new InvalidConnectionTargetException("Database name cannot be empty");
        }
        if (databaseName.length() > MAX_LENGTH) {
            throw new InvalidConnectionTargetException("Database name exceeds " + MAX_LENGTH + " characters");
        }
        if (!SAFE_NAME.matcher(databaseName).matches()) {
            // The name itself is not echoed, it may be hostile
            throw new InvalidConnectionTargetException("Database name contains unsupported characters");
        }
        return databaseName;
    }

    /**
     * Checks a database name without throwing.
     *
     * @param databaseName Database name
     * @return true if the name is safe
     */
    public static boolean isSafe(String databaseName) {
        return databaseName != null && !databaseName.isEmpty() && databaseName.length() <= MAX_LENGTH
                && SAFE_NAME.matcher(databaseName).matches();
    }
}
