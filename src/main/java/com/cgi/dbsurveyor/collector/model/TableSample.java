package com.cgi.dbsurveyor.collector.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Represents a sample of rows from a table.
 * Values are kept exactly as retrieved; only non JSON-native values are
 * re-encoded losslessly (binary as base64).
 */
@Getter
@Builder
@ToString(exclude = "rows")
public class TableSample implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Name of the table.
     */
    private final String tableName;

    /**
     * Schema of the table, null when the engine has none.
     */
    private final String schemaName;

    /**
     * Sampled rows in sampling order, each mapping column name to value in column order.
     */
    private final List<Map<String, Object>> rows;

    /**
     * Requested number of rows.
     */
    private final int sampleSize;

    /**
     * Total rows in the table, null when it could not be determined.
     */
    private final Long totalRows;

    /**
     * Ordering used to select the rows.
     */
    private final OrderingStrategy orderingStrategy;

    /**
     * When the sample was taken.
     */
    private final Instant collectedAt;

    /**
     * Sensitive-field detections and fallback notices.
     */
    @Builder.Default
    private final List<String> warnings = List.of();
}
