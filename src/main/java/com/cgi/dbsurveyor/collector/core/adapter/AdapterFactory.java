package com.cgi.dbsurveyor.collector.core.adapter;

import com.cgi.dbsurveyor.collector.config.CollectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionSecret;

/**
 * Creates connected adapters for one engine.
 */
@FunctionalInterface
public interface AdapterFactory {

    /**
     * Opens a connection pool and wraps it in an adapter.
     *
     * @param config Validated connection configuration
     * @param secret Password, only read while the pool is being created
     * @param collectionConfig Schema object classes to collect
     * @return Connected adapter
     */
    DatabaseAdapter create(ConnectionConfig config, ConnectionSecret secret, CollectionConfig collectionConfig);
}
