package com.cgi.dbsurveyor.collector.core.jdbc;

import com.cgi.dbsurveyor.collector.config.ConnectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionSecret;
import com.cgi.dbsurveyor.collector.exception.ConfigurationException;
import com.cgi.dbsurveyor.collector.model.DatabaseType;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates read-only Hikari pools for the JDBC engines.
 * Every pool belongs to exactly one adapter and is never registered or shared.
 */
@Slf4j
@Component
public class JdbcDataSourceFactory {

    private final AtomicInteger poolSequence = new AtomicInteger();

    /**
     * Creates a pool.
     *
     * @param type Engine
     * @param config Connection configuration
     * @param secret Password, read once here
     * @return Pool
     */
    public HikariDataSource create(DatabaseType type, ConnectionConfig config, ConnectionSecret secret) {
        return create(type, config, secret == null ? null : secret.reveal());
    }

    /**
     * Creates a pool for another database of the same server, reusing the credentials
     * held by an existing pool.
     *
     * @param type Engine
     * @param config Connection configuration pointing at the new database
     * @param existing Existing pool
     * @return New pool
     */
    public HikariDataSource reconnect(DatabaseType type, ConnectionConfig config, HikariDataSource existing) {
        return create(type, config, existing.getPassword());
    }

    String nextPoolName(DatabaseType type) {
        return "dbsurveyor-" + type.getId() + "-" + poolSequence.incrementAndGet();
    }

    private HikariDataSource create(DatabaseType type, ConnectionConfig config, String password) {
        String poolName = nextPoolName(type);
        log.info("Creating {} pool {} for {}", type.getId(), poolName, config);

        HikariDataSource dataSource = DataSourceBuilder.create()
                .url(buildJdbcUrl(type, config))
                .username(config.getUsername())
                .password(password)
                .driverClassName(getDriverClassName(type))
                .type(HikariDataSource.class)
                .build();

        dataSource.setPoolName(poolName);
        dataSource.setMaximumPoolSize(type == DatabaseType.SQLITE ? 1 : config.getMaxConnections());
        dataSource.setMinimumIdle(0);
        dataSource.setConnectionTimeout(Math.max(250L, config.getConnectTimeout().toMillis()));

        if (type == DatabaseType.SQLITE && config.isReadOnly()) {
            // sqlite-jdbc cannot switch an open connection to read-only; the open flags must match the pool flag
            Properties properties = new Properties();
            properties.setProperty("open_mode", "1");
            dataSource.setDataSourceProperties(properties);
        }
        dataSource.setReadOnly(config.isReadOnly());
        return dataSource;
    }

    /**
     * Builds a JDBC URL. Credentials are never part of it.
     *
     * @param type Engine
     * @param config Connection configuration
     * @return JDBC URL
     */
    String buildJdbcUrl(DatabaseType type, ConnectionConfig config) {
        return switch (type) {
            case POSTGRESQL -> String.format(
                    "jdbc:postgresql://%s:%d/%s?connectTimeout=%d",
                    config.getHost(),
                    config.portOr(5432),
                    encode(config.getDatabase() != null ? config.getDatabase() : "postgres"),
                    Math.max(1, config.getConnectTimeout().toSeconds())
            );
            case MYSQL -> String.format(
                    "jdbc:mysql://%s:%d/%s?connectTimeout=%d",
                    config.getHost(),
                    config.portOr(3306),
                    config.getDatabase() != null ? encode(config.getDatabase()) : "",
                    config.getConnectTimeout().toMillis()
            );
            case SQLITE -> "jdbc:sqlite:" + config.getHost();
            default -> throw new ConfigurationException("Unsupported JDBC database type: " + type.getId());
        };
    }

    /**
     * Gets the driver class name for an engine.
     *
     * @param type Engine
     * @return Driver class name
     */
    String getDriverClassName(DatabaseType type) {
        return switch (type) {
            case POSTGRESQL -> "org.postgresql.Driver";
            case MYSQL -> "com.mysql.cj.jdbc.Driver";
            case SQLITE -> "org.sqlite.JDBC";
            default -> throw new ConfigurationException("Unsupported JDBC database type: " + type.getId());
        };
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
