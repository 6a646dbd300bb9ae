package com.cgi.dbsurveyor.collector.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Timing and diagnostics for a collection.
 */
@Getter
@Builder
@ToString
public class CollectionMetadata implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Name and version of this collector, stamped on every artifact.
     */
    public static final String COLLECTOR_VERSION = "dbsurveyor-collector/0.1.0";

    private final Instant collectedAt;
    private final long collectionDurationMs;

    @Builder.Default
    private final String collectorVersion = COLLECTOR_VERSION;

    /**
     * Non-fatal problems met during the collection.
     */
    @Builder.Default
    private final List<String> warnings = List.of();
}
