package com.cgi.dbsurveyor.collector.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.io.Serial;
import java.io.Serializable;

/**
 * Server-level facts gathered before collection.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class ServerInfo implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Engine.
     */
    private final DatabaseType serverType;

    /**
     * Short version string, e.g. "16.2".
     */
    private final String version;

    private final String host;
    private final Integer port;

    /**
     * Databases visible to the connected identity.
     */
    private final int totalDatabases;

    /**
     * Databases whose schema was collected.
     */
    private final int collectedDatabases;

    /**
     * System databases left out of the run.
     */
    private final int systemDatabasesExcluded;

    /**
     * Identity the collector is connected as.
     */
    private final String connectionUser;

    private final boolean superuser;

    @Builder.Default
    private final CollectionMode collectionMode = CollectionMode.singleDatabase();
}
