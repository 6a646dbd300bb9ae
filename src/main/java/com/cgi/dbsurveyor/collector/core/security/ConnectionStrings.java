package com.cgi.dbsurveyor.collector.core.security;

import com.cgi.dbsurveyor.collector.config.ConnectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionSecret;
import com.cgi.dbsurveyor.collector.exception.ConfigurationException;
import com.cgi.dbsurveyor.collector.model.DatabaseType;
import lombok.Getter;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Connection-string helpers: engine detection, redaction and splitting into
 * a sanitized {@link ConnectionConfig} plus a {@link ConnectionSecret}.
 * Error messages produced here never contain the connection string.
 */
public final class ConnectionStrings {

    private ConnectionStrings() {
    }

    /**
     * Result of {@link #parse(String, ConnectionConfig)}.
     */
    @Getter
    public static final class ParsedConnection {
        private final DatabaseType databaseType;
        private final ConnectionConfig config;
        private final ConnectionSecret secret;

        ParsedConnection(DatabaseType databaseType, ConnectionConfig config, ConnectionSecret secret) {
            this.databaseType = databaseType;
            this.config = config;
            this.secret = secret;
        }
    }

    /**
     * Detects the engine from a connection string.
     *
     * @param connectionString Connection string
     * @return Engine
     * @throws ConfigurationException If the engine cannot be determined
     */
    public static DatabaseType detectDatabaseType(String connectionString) {
        if (connectionString == null || connectionString.isBlank()) {
            throw new ConfigurationException("Connection string cannot be empty");
        }
        String lower = connectionString.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("postgres://") || lower.startsWith("postgresql://")) {
            return DatabaseType.POSTGRESQL;
        }
        if (lower.startsWith("mysql://")) {
            return DatabaseType.MYSQL;
        }
        if (lower.startsWith("sqlite://") || lower.endsWith(".db") || lower.endsWith(".sqlite")
                || lower.endsWith(".sqlite3")) {
            return DatabaseType.SQLITE;
        }
        if (lower.startsWith("mongodb://") || lower.startsWith("mongodb+srv://")) {
            return DatabaseType.MONGODB;
        }
        if (lower.startsWith("mssql://") || lower.startsWith("sqlserver://")) {
            return DatabaseType.SQLSERVER;
        }
        throw new ConfigurationException("Unsupported database type: unable to detect the engine from the connection string");
    }

    /**
     * Masks the password of a URL-style connection string.
     *
     * @param connectionString Connection string
     * @return Connection string with the password replaced by ****
     */
    public static String redact(String connectionString) {
        return CredentialSanitizer.sanitize(connectionString);
    }

    /**
     * Splits a connection string into configuration and secret.
     *
     * @param connectionString Connection string
     * @param defaults Timeouts, pool size and read-only flag to apply
     * @return Parsed connection
     * @throws ConfigurationException If the string is malformed
     */
    public static ParsedConnection parse(String connectionString, ConnectionConfig defaults) {
        DatabaseType type = detectDatabaseType(connectionString);
        ConnectionConfig.ConnectionConfigBuilder builder = defaults != null
                ? defaults.toBuilder()
                : ConnectionConfig.builder();
        String trimmed = connectionString.trim();

        if (type == DatabaseType.SQLITE) {
            String path = trimmed.regionMatches(true, 0, "sqlite://", 0, 9) ? trimmed.substring(9) : trimmed;
            int query = path.indexOf('?');
            if (query >= 0) {
                path = path.substring(0, query);
            }
            ConnectionConfig config = builder.host(path).port(null).database("main").username(null).build();
            return new ParsedConnection(type, config, ConnectionSecret.none());
        }

        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            // The exception text contains the input, so it is not chained
            throw new ConfigurationException("Malformed " + type.getId() + " connection string");
        }
        if (uri.getHost() == null) {
            throw new ConfigurationException("Connection string has no host");
        }

        String username = null;
        ConnectionSecret secret = ConnectionSecret.none();
        String userInfo = uri.getRawUserInfo();
        if (userInfo != null && !userInfo.isEmpty()) {
            int colon = userInfo.indexOf(':');
            username = decode(colon >= 0 ? userInfo.substring(0, colon) : userInfo);
            if (colon >= 0) {
                secret = ConnectionSecret.of(decode(userInfo.substring(colon + 1)));
            }
        }

        String database = uri.getPath();
        if (database != null && database.startsWith("/")) {
            database = database.substring(1);
        }
        if (database != null && database.isEmpty()) {
            database = null;
        }

        ConnectionConfig config = builder
                .host(uri.getHost())
                .port(uri.getPort() > 0 ? uri.getPort() : null)
                .database(database)
                .username(username)
                .build();
        return new ParsedConnection(type, config, secret);
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
