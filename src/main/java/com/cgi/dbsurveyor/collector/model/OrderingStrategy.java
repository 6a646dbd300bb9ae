package com.cgi.dbsurveyor.collector.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;

/**
 * Row ordering used to sample a table.
 * Resolved once per table and run; instances are immutable.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class OrderingStrategy implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public enum Kind {
        PRIMARY_KEY,
        TIMESTAMP,
        AUTO_INCREMENT,
        SYSTEM_ROW_ID,
        UNORDERED
    }

    private static final OrderingStrategy UNORDERED =
            new OrderingStrategy(Kind.UNORDERED, List.of(), null);

    private final Kind kind;

    /**
     * Ordering columns; several only for composite primary keys, none for UNORDERED.
     */
    private final List<String> columns;

    /**
     * Sort direction, null for UNORDERED.
     */
    private final SortDirection direction;

    private OrderingStrategy(Kind kind, List<String> columns, SortDirection direction) {
        this.kind = kind;
        this.columns = columns;
        this.direction = direction;
    }

    public static OrderingStrategy primaryKey(List<String> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Primary key ordering needs at least one column");
        }
        return new OrderingStrategy(Kind.PRIMARY_KEY, List.copyOf(columns), SortDirection.DESCENDING);
    }

    public static OrderingStrategy timestamp(String column, SortDirection direction) {
        return new OrderingStrategy(Kind.TIMESTAMP, List.of(column), direction);
    }

    public static OrderingStrategy autoIncrement(String column) {
        return new OrderingStrategy(Kind.AUTO_INCREMENT, List.of(column), SortDirection.DESCENDING);
    }

    public static OrderingStrategy systemRowId(String column) {
        return new OrderingStrategy(Kind.SYSTEM_ROW_ID, List.of(column), SortDirection.DESCENDING);
    }

    public static OrderingStrategy unordered() {
        return UNORDERED;
    }

    /**
     * Whether repeated sampling returns the same rows for unchanged data.
     *
     * @return false only for UNORDERED
     */
    public boolean isDeterministic() {
        return kind != Kind.UNORDERED;
    }
}
