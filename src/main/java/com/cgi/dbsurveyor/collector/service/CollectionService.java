package com.cgi.dbsurveyor.collector.service;

import com.cgi.dbsurveyor.collector.config.CollectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionSecret;
import com.cgi.dbsurveyor.collector.config.SamplingConfig;
import com.cgi.dbsurveyor.collector.core.adapter.AdapterRegistry;
import com.cgi.dbsurveyor.collector.core.adapter.DatabaseAdapter;
import com.cgi.dbsurveyor.collector.core.security.ConnectionStrings;
import com.cgi.dbsurveyor.collector.exception.BaseException;
import com.cgi.dbsurveyor.collector.model.CollectionResult;
import com.cgi.dbsurveyor.collector.model.DatabaseSchema;
import com.cgi.dbsurveyor.collector.model.DatabaseType;
import com.cgi.dbsurveyor.collector.model.ServerInfo;
import com.cgi.dbsurveyor.collector.service.orchestrator.MultiDatabaseOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;

import java.time.Duration;
import java.time.Instant;

/**
 * Entry point for collections.
 * Connection strings are split into a sanitized configuration and a secret; the
 * secret is wiped as soon as the adapter has been created.
 */
@Slf4j
@Service
public class CollectionService {

    /**
     * Registry of engine adapters.
     */
    private final AdapterRegistry adapterRegistry;

    private final MultiDatabaseOrchestrator orchestrator;
    private final CollectionResultAggregator aggregator;

    /**
     * Defaults applied when the caller passes no configuration.
     */
    private final SamplingConfig defaultSamplingConfig;
    private final CollectionConfig defaultCollectionConfig;
    private final ConnectionConfig connectionDefaults;

    /**
     * Constructor.
     *
     * @param adapterRegistry Registry of engine adapters
     * @param orchestrator Multi-database orchestrator
     * @param aggregator Result aggregator
     * @param defaultSamplingConfig Configured sampling settings
     * @param defaultCollectionConfig Configured collection settings
     * @param connectionDefaults Configured timeouts, pool size and read-only flag
     */
    public CollectionService(AdapterRegistry adapterRegistry,
                             MultiDatabaseOrchestrator orchestrator,
                             CollectionResultAggregator aggregator,
                             SamplingConfig defaultSamplingConfig,
                             CollectionConfig defaultCollectionConfig,
                             ConnectionConfig connectionDefaults) {
        this.adapterRegistry = adapterRegistry;
        this.orchestrator = orchestrator;
        this.aggregator = aggregator;
        this.defaultSamplingConfig = defaultSamplingConfig;
        this.defaultCollectionConfig = defaultCollectionConfig;
        this.connectionDefaults = connectionDefaults;
    }

    /**
     * Collects the database named in a connection string with the configured defaults.
     *
     * @param connectionString Connection string, possibly carrying credentials
     * @return Single-database result
     */
    public CollectionResult collectDatabase(String connectionString) {
        ConnectionStrings.ParsedConnection parsed = ConnectionStrings.parse(connectionString, connectionDefaults);
        return collectDatabase(parsed.getDatabaseType(), parsed.getConfig(), parsed.getSecret());
    }

    /**
     * Collects one database with the configured defaults.
     *
     * @param type Engine
     * @param config Connection configuration
     * @param secret Password, destroyed once the adapter is connected
     * @return Single-database result
     */
    public CollectionResult collectDatabase(DatabaseType type, ConnectionConfig config, ConnectionSecret secret) {
        return collectDatabase(type, config, secret, defaultCollectionConfig, defaultSamplingConfig);
    }

    /**
     * Collects one database.
     *
     * @param type Engine
     * @param config Connection configuration
     * @param secret Password, destroyed once the adapter is connected
     * @param collectionConfig Collection configuration
     * @param samplingConfig Sampling configuration
     * @return Single-database result
     */
    public CollectionResult collectDatabase(DatabaseType type, ConnectionConfig config, ConnectionSecret secret,
                                            CollectionConfig collectionConfig, SamplingConfig samplingConfig) {
        Instant startedAt = Instant.now();
        StopWatch watch = new StopWatch("database collection");
        log.info("Collecting {} database {}", type.getId(), config);

        try (DatabaseAdapter adapter = adapterRegistry.connect(type, config, secret, collectionConfig)) {
            watch.start("schema");
            ServerInfo serverInfo = adapter.describeServer();
            DatabaseSchema schema = orchestrator.collectConnected(adapter, collectionConfig, samplingConfig);
            watch.stop();
            log.debug(watch.prettyPrint());
            return aggregator.aggregateSingle(serverInfo, schema, startedAt);
        } catch (BaseException e) {
            log.error("Collection of {} failed [{}]: {}", config, e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    /**
     * Collects every database of the server named in a connection string.
     *
     * @param connectionString Connection string, possibly carrying credentials
     * @param deadline Overall deadline, null for none
     * @return Multi-database result
     */
    public CollectionResult collectServer(String connectionString, Duration deadline) {
        ConnectionStrings.ParsedConnection parsed = ConnectionStrings.parse(connectionString, connectionDefaults);
        return collectServer(parsed.getDatabaseType(), parsed.getConfig(), parsed.getSecret(), deadline);
    }

    /**
     * Collects every database of a server with the configured defaults.
     *
     * @param type Engine
     * @param config Connection configuration; its database is used for discovery
     * @param secret Password, destroyed once the discovery adapter is connected
     * @param deadline Overall deadline, null for none
     * @return Multi-database result
     */
    public CollectionResult collectServer(DatabaseType type, ConnectionConfig config, ConnectionSecret secret,
                                          Duration deadline) {
        return collectServer(type, config, secret, defaultCollectionConfig, defaultSamplingConfig, deadline);
    }

    /**
     * Collects every database of a server.
     * Per-database adapters are derived from the discovery adapter, so the secret is
     * never needed again after the first connection.
     *
     * @param type Engine
     * @param config Connection configuration; its database is used for discovery
     * @param secret Password, destroyed once the discovery adapter is connected
     * @param collectionConfig Collection configuration
     * @param samplingConfig Sampling configuration
     * @param deadline Overall deadline, null for none
     * @return Multi-database result
     */
    public CollectionResult collectServer(DatabaseType type, ConnectionConfig config, ConnectionSecret secret,
                                          CollectionConfig collectionConfig, SamplingConfig samplingConfig,
                                          Duration deadline) {
        log.info("Collecting all databases of {} server {}", type.getId(), config);
        try (DatabaseAdapter serverAdapter = adapterRegistry.connect(type, config, secret, collectionConfig)) {
            return orchestrator.collect(serverAdapter, collectionConfig, samplingConfig, deadline);
        } catch (BaseException e) {
            log.error("Server collection of {} failed [{}]: {}", config, e.getErrorCode(), e.getMessage());
            throw e;
        }
    }
}
