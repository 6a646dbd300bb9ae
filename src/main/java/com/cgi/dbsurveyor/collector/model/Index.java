package com.cgi.dbsurveyor.collector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serial;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Represents an index on a table or collection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Index implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Index name.
     */
    private String name;

    /**
     * Name of the indexed table.
     */
    private String tableName;

    /**
     * Schema of the indexed table.
     */
    private String schema;

    /**
     * Indexed columns in key order.
     */
    @Builder.Default
    private List<IndexColumn> columns = new ArrayList<>();

    /**
     * Indicates whether the index enforces uniqueness.
     */
    private boolean unique;

    /**
     * Indicates whether the index backs the primary key.
     */
    private boolean primary;

    /**
     * Access method (btree, hash, gin, ...), when reported.
     */
    private String indexType;
}
