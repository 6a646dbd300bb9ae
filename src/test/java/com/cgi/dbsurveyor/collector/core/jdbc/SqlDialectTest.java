package com.cgi.dbsurveyor.collector.core.jdbc;

import com.cgi.dbsurveyor.collector.model.OrderingStrategy;
import com.cgi.dbsurveyor.collector.model.SortDirection;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlDialectTest {

    @Test
    void testQuotingDoublesEmbeddedQuotes() {
        assertEquals("\"we\"\"ird\"", SqlDialect.POSTGRESQL.quoteIdentifier("we\"ird"));
        assertEquals("`we``ird`", SqlDialect.MYSQL.quoteIdentifier("we`ird"));
        assertThrows(IllegalArgumentException.class, () -> SqlDialect.SQLITE.quoteIdentifier(""));
    }

    @Test
    void testQualify() {
        assertEquals("\"public\".\"users\"", SqlDialect.POSTGRESQL.qualify("public", "users"));
        assertEquals("`users`", SqlDialect.MYSQL.qualify(null, "users"));
    }

    @Test
    void testCompositeKeyOrdering() {
        String clause = SqlDialect.POSTGRESQL.orderByClause(OrderingStrategy.primaryKey(List.of("tenant", "id")));

        assertEquals("ORDER BY \"tenant\" DESC, \"id\" DESC", clause);
    }

    @Test
    void testAscendingTimestamp() {
        String clause = SqlDialect.MYSQL.orderByClause(OrderingStrategy.timestamp("created_at", SortDirection.ASCENDING));

        assertEquals("ORDER BY `created_at` ASC", clause);
    }

    @Test
    void testUnorderedUsesEngineRandom() {
        assertEquals("ORDER BY RAND()", SqlDialect.MYSQL.orderByClause(OrderingStrategy.unordered()));
        assertEquals("ORDER BY RANDOM()", SqlDialect.SQLITE.orderByClause(OrderingStrategy.unordered()));
    }
}
