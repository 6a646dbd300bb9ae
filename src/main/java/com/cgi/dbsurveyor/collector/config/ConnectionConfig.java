package com.cgi.dbsurveyor.collector.config;

import com.cgi.dbsurveyor.collector.exception.ConfigurationException;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

/**
 * Sanitized connection descriptor. It never carries a password; secrets travel
 * separately in a {@link ConnectionSecret} that is wiped after use.
 */
@Getter
@Builder(toBuilder = true)
public class ConnectionConfig {

    /**
     * Maximum pool size accepted by {@link #validate()}.
     */
    public static final int MAX_POOL_SIZE = 100;

    /**
     * Host name, or the file path for file-based engines.
     */
    private final String host;

    /**
     * Port, null for the engine default.
     */
    private final Integer port;

    /**
     * Database to connect to, null for the engine default.
     */
    private final String database;

    /**
     * Login name.
     */
    private final String username;

    @Builder.Default
    private final Duration connectTimeout = Duration.ofSeconds(30);

    @Builder.Default
    private final Duration queryTimeout = Duration.ofSeconds(30);

    @Builder.Default
    private final int maxConnections = 10;

    @Builder.Default
    private final boolean readOnly = true;

    /**
     * Validates the configuration.
     *
     * @throws ConfigurationException If a value is out of range
     */
    public void validate() {
        if (host == null || host.trim().isEmpty()) {
            throw new ConfigurationException("Host cannot be empty");
        }
        if (port != null && (port < 1 || port > 65535)) {
            throw new ConfigurationException("Port must be between 1 and 65535");
        }
        if (maxConnections < 1 || maxConnections > MAX_POOL_SIZE) {
            throw new ConfigurationException("Max connections must be between 1 and " + MAX_POOL_SIZE);
        }
        if (connectTimeout == null || connectTimeout.isZero() || connectTimeout.isNegative()) {
            throw new ConfigurationException("Connect timeout must be greater than 0");
        }
        if (queryTimeout == null || queryTimeout.isZero() || queryTimeout.isNegative()) {
            throw new ConfigurationException("Query timeout must be greater than 0");
        }
    }

    /**
     * Same settings against another database of the same server.
     *
     * @param databaseName Database name
     * @return New configuration
     */
    public ConnectionConfig withDatabase(String databaseName) {
        return toBuilder().database(databaseName).build();
    }

    /**
     * Port or the given default.
     *
     * @param defaultPort Engine default port
     * @return Effective port
     */
    public int portOr(int defaultPort) {
        return port != null ? port : defaultPort;
    }

    /**
     * Renders host, port and database only.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ConnectionConfig(").append(host);
        if (port != null) {
            sb.append(':').append(port);
        }
        if (database != null) {
            sb.append('/').append(database);
        }
        return sb.append(')').toString();
    }
}
