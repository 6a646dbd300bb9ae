package com.cgi.dbsurveyor.collector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serial;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Represents a table (or a document collection) with its structure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Table implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Table name.
     */
    private String name;

    /**
     * Schema or namespace, null when the engine has none.
     */
    private String schema;

    /**
     * Columns ordered by ordinal position.
     */
    @Builder.Default
    private List<Column> columns = new ArrayList<>();

    /**
     * Declared primary key, null if the table has none.
     */
    private PrimaryKey primaryKey;

    @Builder.Default
    private List<ForeignKey> foreignKeys = new ArrayList<>();

    @Builder.Default
    private List<Index> indexes = new ArrayList<>();

    @Builder.Default
    private List<Constraint> constraints = new ArrayList<>();

    /**
     * Table comment.
     */
    private String comment;

    /**
     * Row count or engine estimate, null when unknown.
     */
    private Long rowCount;

    /**
     * Finds a column by name, ignoring case.
     *
     * @param columnName Column name
     * @return The column, if present
     */
    public Optional<Column> findColumn(String columnName) {
        if (columnName == null || columns == null) {
            return Optional.empty();
        }
        return columns.stream()
                .filter(column -> columnName.equalsIgnoreCase(column.getName()))
                .findFirst();
    }

    /**
     * Whether the table declares a non-empty primary key.
     *
     * @return true if a primary key with at least one column exists
     */
    public boolean hasPrimaryKey() {
        return primaryKey != null && primaryKey.getColumns() != null && !primaryKey.getColumns().isEmpty();
    }
}
