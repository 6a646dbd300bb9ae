package com.cgi.dbsurveyor.collector.service.sampling;

import com.cgi.dbsurveyor.collector.model.OrderingStrategy;
import com.cgi.dbsurveyor.collector.model.Table;

import java.time.Duration;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Engine side of sampling: turns an ordering strategy into a query and streams raw rows.
 */
public interface SampleSource {

    /**
     * Engine row identifier usable for ordering.
     *
     * @param table Table
     * @return Column name, or null if the engine exposes none for this table
     */
    String systemRowIdColumn(Table table);

    /**
     * Runs the sampling query. Rows are handed to the consumer while the cursor is open.
     *
     * @param table Table
     * @param strategy Ordering strategy
     * @param limit Maximum rows
     * @param timeout Query timeout; only this query is aborted when it expires
     * @param rowConsumer Receives each raw row in column order
     * @throws com.cgi.dbsurveyor.collector.exception.QueryTimeoutException If the timeout expires
     */
    void fetchRows(Table table, OrderingStrategy strategy, int limit, Duration timeout,
                   Consumer<Map<String, Object>> rowConsumer);

    /**
     * Counts rows, exactly or by engine estimate.
     *
     * @param table Table
     * @param timeout Query timeout
     * @return Row count, null if unknown
     */
    Long countRows(Table table, Duration timeout);

    /**
     * Converter for values produced by this source.
     *
     * @return Converter
     */
    default SampleValueConverter valueConverter() {
        return new SampleValueConverter();
    }
}
