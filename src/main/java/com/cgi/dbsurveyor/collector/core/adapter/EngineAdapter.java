package com.cgi.dbsurveyor.collector.core.adapter;

import com.cgi.dbsurveyor.collector.config.SamplingConfig;
import com.cgi.dbsurveyor.collector.model.DatabaseInfo;
import com.cgi.dbsurveyor.collector.model.DatabaseSchema;
import com.cgi.dbsurveyor.collector.model.DatabaseType;
import com.cgi.dbsurveyor.collector.model.ServerInfo;
import com.cgi.dbsurveyor.collector.model.TableSample;
import com.cgi.dbsurveyor.collector.model.Table;

import java.util.List;
import java.util.Set;

/**
 * Engine-specific adapter with access to its typed connection handle.
 * Callers that only orchestrate use {@link DatabaseAdapter}; the
 * {@link EngineAdapterBridge} turns an engine adapter into one.
 *
 * @param <C> Connection handle type (a JdbcTemplate, a MongoDatabase, ...)
 */
public interface EngineAdapter<C> extends AutoCloseable {

    /**
     * Gets the typed connection handle.
     *
     * @return Connection handle
     */
    C connection();

    DatabaseType databaseType();

    Set<AdapterFeature> features();

    /**
     * Runs a trivial round trip.
     */
    void ping();

    /**
     * Enumerates databases on the server.
     *
     * @param includeSystem Whether to include system databases
     * @return Databases sorted by name
     */
    List<DatabaseInfo> enumerateDatabases(boolean includeSystem);

    /**
     * Opens an adapter of the same engine on another database. The name has
     * already been validated.
     *
     * @param databaseName Safe database name
     * @return New engine adapter with its own pool
     */
    EngineAdapter<C> reconnect(String databaseName);

    /**
     * Extracts the full schema.
     *
     * @return Schema
     */
    DatabaseSchema extractSchema();

    /**
     * Extracts table definitions only, for sampling.
     *
     * @return Tables with columns and primary keys
     */
    List<Table> extractTables();

    /**
     * Samples the given tables.
     *
     * @param tables Tables to sample
     * @param config Sampling configuration
     * @return Samples
     */
    List<TableSample> sampleTables(List<Table> tables, SamplingConfig config);

    ServerInfo describeServer();

    @Override
    void close();
}
