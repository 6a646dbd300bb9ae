package com.cgi.dbsurveyor.collector.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;

/**
 * Versioned output of a collection run, handed to the output encoder.
 * The format version is fixed at construction.
 */
@Getter
@ToString
public class CollectionResult implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Version of the output structure.
     */
    public static final String FORMAT_VERSION = "1.0";

    private final String formatVersion;
    private final ServerInfo serverInfo;

    /**
     * Per-database schemas sorted by database name, including FAILED and SKIPPED placeholders.
     */
    private final List<DatabaseSchema> databases;

    private final List<DatabaseFailure> failures;
    private final CollectionMetadata collectionMetadata;

    @Builder
    private CollectionResult(ServerInfo serverInfo, List<DatabaseSchema> databases,
                             List<DatabaseFailure> failures, CollectionMetadata collectionMetadata) {
        this.formatVersion = FORMAT_VERSION;
        this.serverInfo = serverInfo;
        this.databases = databases == null ? List.of() : List.copyOf(databases);
        this.failures = failures == null ? List.of() : List.copyOf(failures);
        this.collectionMetadata = collectionMetadata;
    }
}
