package com.cgi.dbsurveyor.collector.core.adapter;

/**
 * Optional capabilities an adapter may support.
 */
public enum AdapterFeature {
    SCHEMA_COLLECTION,
    DATA_SAMPLING,
    MULTI_DATABASE,
    CONNECTION_POOLING,
    QUERY_TIMEOUT,
    READ_ONLY_MODE
}
