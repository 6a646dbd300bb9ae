package com.cgi.dbsurveyor.collector.service.ordering;

import com.cgi.dbsurveyor.collector.model.Column;
import com.cgi.dbsurveyor.collector.model.OrderingStrategy;
import com.cgi.dbsurveyor.collector.model.SortDirection;
import com.cgi.dbsurveyor.collector.model.Table;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Chooses how rows of a table are ordered for sampling.
 * Precedence, first match wins: primary key, timestamp candidate column,
 * auto-increment column, engine row identifier, unordered.
 * The resolver only looks at its arguments and never touches a connection.
 */
@Component
public class OrderingStrategyResolver {

    /**
     * Warning attached to samples taken without a reliable ordering.
     */
    public static final String UNORDERED_WARNING =
            "No reliable ordering found - using random sampling which may not be reproducible";

    /**
     * Resolves the ordering strategy of a table.
     *
     * @param table Table definition
     * @param timestampCandidates Timestamp column names in priority order, matched ignoring case
     * @param systemRowIdColumn Engine row identifier (e.g. SQLite rowid), null if the engine has none
     * @return Ordering strategy
     */
    public OrderingStrategy resolve(Table table, List<String> timestampCandidates, String systemRowIdColumn) {
        if (table.hasPrimaryKey()) {
            return OrderingStrategy.primaryKey(table.getPrimaryKey().getColumns());
        }

        List<Column> columns = table.getColumns() == null ? List.of() : table.getColumns();

        Optional<Column> timestamp = findTimestampColumn(columns, timestampCandidates);
        if (timestamp.isPresent()) {
            return OrderingStrategy.timestamp(timestamp.get().getName(), SortDirection.DESCENDING);
        }

        Optional<Column> autoIncrement = columns.stream()
                .filter(Column::isAutoIncrement)
                .min(Comparator.comparingInt(Column::getOrdinalPosition));
        if (autoIncrement.isPresent()) {
            return OrderingStrategy.autoIncrement(autoIncrement.get().getName());
        }

        if (systemRowIdColumn != null && !systemRowIdColumn.isBlank()) {
            return OrderingStrategy.systemRowId(systemRowIdColumn);
        }

        return OrderingStrategy.unordered();
    }

    /**
     * Finds the first candidate, in candidate order, that names a date/time column.
     *
     * @param columns Table columns
     * @param candidates Candidate names
     * @return Matching column
     */
    private Optional<Column> findTimestampColumn(List<Column> columns, List<String> candidates) {
        if (candidates == null) {
            return Optional.empty();
        }
        for (String candidate : candidates) {
            for (Column column : columns) {
                if (candidate.equalsIgnoreCase(column.getName())
                        && column.getDataType() != null
                        && column.getDataType().isTemporal()) {
                    return Optional.of(column);
                }
            }
        }
        return Optional.empty();
    }
}
