package com.cgi.dbsurveyor.collector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serial;
import java.io.Serializable;

/**
 * Represents a database as enumerated on a server or as collected.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseInfo implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Database name.
     */
    private String name;

    /**
     * Server version, when known.
     */
    private String version;

    /**
     * Size in bytes, null when not readable.
     */
    private Long sizeBytes;

    /**
     * Owner role.
     */
    private String owner;

    private String encoding;
    private String collation;

    /**
     * Whether the engine flags this database as a system or template database.
     */
    private boolean systemDatabase;

    /**
     * Access of the connected identity.
     */
    @Builder.Default
    private AccessLevel accessLevel = AccessLevel.FULL;

    /**
     * Collection outcome.
     */
    @Builder.Default
    private CollectionStatus collectionStatus = CollectionStatus.success();
}
