package com.cgi.dbsurveyor.collector.model;

import com.cgi.dbsurveyor.collector.core.type.UnifiedDataType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serial;
import java.io.Serializable;

/**
 * Represents a column of a table or view, or an inferred field of a document collection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Column implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Column name.
     */
    private String name;

    /**
     * Unified data type.
     */
    private UnifiedDataType dataType;

    /**
     * Native type name as declared in the source.
     */
    private String nativeType;

    /**
     * Indicates whether the column can contain NULL values.
     */
    private boolean nullable;

    /**
     * Indicates whether the column is part of the primary key.
     */
    private boolean primaryKey;

    /**
     * Indicates whether the engine generates values for this column (serial, identity, AUTO_INCREMENT).
     */
    private boolean autoIncrement;

    /**
     * Default value expression of the column.
     */
    private String defaultValue;

    /**
     * Column comment.
     */
    private String comment;

    /**
     * Ordinal position of the column in the table, 1-based, unique within the table.
     */
    private int ordinalPosition;
}
