package com.cgi.dbsurveyor.collector.core.adapter;

import com.cgi.dbsurveyor.collector.config.SamplingConfig;
import com.cgi.dbsurveyor.collector.model.DatabaseInfo;
import com.cgi.dbsurveyor.collector.model.DatabaseSchema;
import com.cgi.dbsurveyor.collector.model.DatabaseType;
import com.cgi.dbsurveyor.collector.model.ServerInfo;
import com.cgi.dbsurveyor.collector.model.TableSample;

import java.util.List;

/**
 * Capability contract every database adapter satisfies.
 * One instance holds one live connection pool, which it owns exclusively and
 * releases on {@link #close()}. Every operation is read-only.
 */
public interface DatabaseAdapter extends AutoCloseable {

    /**
     * Verifies that the connection is usable.
     *
     * @throws com.cgi.dbsurveyor.collector.exception.ConnectionFailedException If the server cannot be reached
     */
    void testConnection();

    /**
     * Lists the databases visible to the connected identity, each annotated with
     * its access level. Never attempts to gain privileges.
     *
     * @return Databases sorted by name
     */
    List<DatabaseInfo> listDatabases();

    /**
     * Opens a new adapter, with its own pool, on another database of the same server.
     *
     * @param databaseName Database name, validated against a safe-character allow-list
     * @return New adapter; the caller owns and closes it
     * @throws com.cgi.dbsurveyor.collector.exception.InvalidConnectionTargetException If the name is unsafe
     */
    DatabaseAdapter connectToDatabase(String databaseName);

    /**
     * Collects the schema of the connected database. Object classes that cannot be
     * read are reported through a PARTIAL status instead of failing the collection.
     *
     * @return Database schema
     */
    DatabaseSchema collectSchema();

    /**
     * Samples rows from every table of the connected database.
     *
     * @param config Sampling configuration
     * @return One sample per table that could be sampled
     */
    List<TableSample> sampleData(SamplingConfig config);

    /**
     * Describes the server the adapter is connected to.
     *
     * @return Server information
     */
    ServerInfo describeServer();

    /**
     * Gets the engine type.
     *
     * @return Engine
     */
    DatabaseType getDatabaseType();

    /**
     * Checks whether a feature is supported.
     *
     * @param feature Feature
     * @return true if supported
     */
    boolean supportsFeature(AdapterFeature feature);

    /**
     * Releases the connection pool.
     */
    @Override
    void close();
}
