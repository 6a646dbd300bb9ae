package com.cgi.dbsurveyor.collector.service.ordering;

import com.cgi.dbsurveyor.collector.config.SamplingConfig;
import com.cgi.dbsurveyor.collector.core.type.UnifiedDataType;
import com.cgi.dbsurveyor.collector.model.Column;
import com.cgi.dbsurveyor.collector.model.OrderingStrategy;
import com.cgi.dbsurveyor.collector.model.PrimaryKey;
import com.cgi.dbsurveyor.collector.model.SortDirection;
import com.cgi.dbsurveyor.collector.model.Table;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrderingStrategyResolverTest {

    private final OrderingStrategyResolver resolver = new OrderingStrategyResolver();
    private final List<String> candidates = SamplingConfig.DEFAULT_TIMESTAMP_COLUMNS;

    private static Column column(String name, UnifiedDataType type, int position) {
        return Column.builder().name(name).dataType(type).ordinalPosition(position).nullable(true).build();
    }

    private static Table table(Column... columns) {
        return Table.builder().name("t").columns(new ArrayList<>(List.of(columns))).build();
    }

    @Test
    void testCompositePrimaryKeyKeepsDeclarationOrder() {
        Table table = table(
                column("a", UnifiedDataType.integer(32, true), 1),
                column("b", UnifiedDataType.integer(32, true), 2),
                column("created_at", UnifiedDataType.dateTime(false), 3));
        table.setPrimaryKey(PrimaryKey.builder().columns(new ArrayList<>(List.of("b", "a"))).build());

        OrderingStrategy strategy = resolver.resolve(table, candidates, "rowid");

        assertEquals(OrderingStrategy.Kind.PRIMARY_KEY, strategy.getKind());
        assertEquals(List.of("b", "a"), strategy.getColumns());
        assertEquals(SortDirection.DESCENDING, strategy.getDirection());
        assertTrue(strategy.isDeterministic());
    }

    @Test
    void testTimestampColumnFollowsCandidateOrder() {
        Table table = table(
                column("updated_at", UnifiedDataType.dateTime(true), 1),
                column("created_at", UnifiedDataType.dateTime(true), 2));

        OrderingStrategy strategy = resolver.resolve(table, candidates, null);

        assertEquals(OrderingStrategy.Kind.TIMESTAMP, strategy.getKind());
        assertEquals(List.of("created_at"), strategy.getColumns());
        assertEquals(SortDirection.DESCENDING, strategy.getDirection());
    }

    @Test
    void testTimestampMatchIgnoresCase() {
        Table table = table(column("CreatedAt", UnifiedDataType.date(), 1));

        OrderingStrategy strategy = resolver.resolve(table, candidates, null);

        assertEquals(OrderingStrategy.Kind.TIMESTAMP, strategy.getKind());
        assertEquals(List.of("CreatedAt"), strategy.getColumns());
    }

    @Test
    void testTimestampCandidateWithNonTemporalTypeIsIgnored() {
        Table table = table(column("created_at", UnifiedDataType.string(20, false), 1));

        OrderingStrategy strategy = resolver.resolve(table, candidates, null);

        assertEquals(OrderingStrategy.Kind.UNORDERED, strategy.getKind());
    }

    @Test
    void testAutoIncrementBeforeRowId() {
        Column id = column("seq", UnifiedDataType.integer(64, true), 2);
        id.setAutoIncrement(true);
        Table table = table(column("name", UnifiedDataType.string(null, false), 1), id);

        OrderingStrategy strategy = resolver.resolve(table, candidates, "rowid");

        assertEquals(OrderingStrategy.Kind.AUTO_INCREMENT, strategy.getKind());
        assertEquals(List.of("seq"), strategy.getColumns());
    }

    @Test
    void testSystemRowIdWhenNothingElseMatches() {
        Table table = table(column("name", UnifiedDataType.string(null, false), 1));

        OrderingStrategy strategy = resolver.resolve(table, candidates, "rowid");

        assertEquals(OrderingStrategy.Kind.SYSTEM_ROW_ID, strategy.getKind());
        assertEquals(List.of("rowid"), strategy.getColumns());
    }

    @Test
    void testUnorderedFallback() {
        Table table = table(column("name", UnifiedDataType.string(null, false), 1));

        OrderingStrategy strategy = resolver.resolve(table, candidates, null);

        assertEquals(OrderingStrategy.unordered(), strategy);
        assertFalse(strategy.isDeterministic());
        assertTrue(strategy.getColumns().isEmpty());
    }

    @Test
    void testEmptyPrimaryKeyIsIgnored() {
        Table table = table(column("name", UnifiedDataType.string(null, false), 1));
        table.setPrimaryKey(PrimaryKey.builder().build());

        assertEquals(OrderingStrategy.Kind.UNORDERED, resolver.resolve(table, candidates, null).getKind());
    }

    @Test
    void testResolveIsStable() {
        Table table = table(column("modified", UnifiedDataType.dateTime(false), 1));

        assertEquals(resolver.resolve(table, candidates, null), resolver.resolve(table, candidates, null));
    }
}
