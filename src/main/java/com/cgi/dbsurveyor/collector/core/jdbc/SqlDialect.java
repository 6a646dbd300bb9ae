package com.cgi.dbsurveyor.collector.core.jdbc;

import com.cgi.dbsurveyor.collector.model.OrderingStrategy;
import com.cgi.dbsurveyor.collector.model.SortDirection;

import java.util.stream.Collectors;

/**
 * SQL rendering rules of the supported JDBC engines.
 */
public enum SqlDialect {
    POSTGRESQL('"', "RANDOM()"),
    MYSQL('`', "RAND()"),
    SQLITE('"', "RANDOM()");

    private final char quote;
    private final String randomFunction;

    SqlDialect(char quote, String randomFunction) {
        this.quote = quote;
        this.randomFunction = randomFunction;
    }

    /**
     * Quotes an identifier, doubling any embedded quote character.
     *
     * @param identifier Identifier
     * @return Quoted identifier
     */
    public String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be empty");
        }
        String q = String.valueOf(quote);
        return q + identifier.replace(q, q + q) + q;
    }

    /**
     * Schema-qualified, quoted table name.
     *
     * @param schema Schema, may be null
     * @param table Table
     * @return Qualified name
     */
    public String qualify(String schema, String table) {
        return schema == null || schema.isEmpty()
                ? quoteIdentifier(table)
                : quoteIdentifier(schema) + "." + quoteIdentifier(table);
    }

    /**
     * ORDER BY clause implementing an ordering strategy.
     *
     * @param strategy Ordering strategy
     * @return Clause starting with "ORDER BY"
     */
    public String orderByClause(OrderingStrategy strategy) {
        if (!strategy.isDeterministic()) {
            return "ORDER BY " + randomFunction;
        }
        String direction = strategy.getDirection() == SortDirection.ASCENDING ? " ASC" : " DESC";
        return strategy.getColumns().stream()
                .map(column -> quoteIdentifier(column) + direction)
                .collect(Collectors.joining(", ", "ORDER BY ", ""));
    }
}
