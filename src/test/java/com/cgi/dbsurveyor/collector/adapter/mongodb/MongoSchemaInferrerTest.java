package com.cgi.dbsurveyor.collector.adapter.mongodb;

import com.cgi.dbsurveyor.collector.core.type.UnifiedDataType;
import com.cgi.dbsurveyor.collector.model.Column;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.util.Date;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MongoSchemaInferrerTest {

    private final MongoSchemaInferrer inferrer = new MongoSchemaInferrer();

    @Test
    void testIdComesFirstAndIsNotNullable() {
        List<Column> columns = inferrer.inferColumns(List.of(
                new Document("name", "alice").append("_id", new ObjectId())));

        assertEquals("_id", columns.get(0).getName());
        assertTrue(columns.get(0).isPrimaryKey());
        assertFalse(columns.get(0).isNullable());
        assertEquals(1, columns.get(0).getOrdinalPosition());
        assertEquals("name", columns.get(1).getName());
        assertEquals(2, columns.get(1).getOrdinalPosition());
    }

    @Test
    void testMissingOrNullFieldIsNullable() {
        List<Column> columns = inferrer.inferColumns(List.of(
                new Document("_id", 1).append("email", "a@example.com").append("age", 30),
                new Document("_id", 2).append("email", null),
                new Document("_id", 3).append("email", "c@example.com").append("age", 41)));

        Column email = columns.stream().filter(c -> c.getName().equals("email")).findFirst().orElseThrow();
        Column age = columns.stream().filter(c -> c.getName().equals("age")).findFirst().orElseThrow();
        assertTrue(email.isNullable());
        assertTrue(age.isNullable());
        assertEquals(UnifiedDataType.string(null, false), email.getDataType());
        assertEquals(UnifiedDataType.integer(32, true), age.getDataType());
    }

    @Test
    void testMixedTypesBecomeCustomType() {
        List<Column> columns = inferrer.inferColumns(List.of(
                new Document("_id", 1).append("code", 7),
                new Document("_id", 2).append("code", "seven")));

        Column code = columns.get(1);
        assertFalse(code.isNullable());
        UnifiedDataType.CustomType type = assertInstanceOf(UnifiedDataType.CustomType.class, code.getDataType());
        assertEquals("mixed(int|string)", type.getTypeName());
        assertEquals("int|string", code.getNativeType());
    }

    @Test
    void testNestedDocumentsAndArrays() {
        List<Column> columns = inferrer.inferColumns(List.of(
                new Document("_id", 1)
                        .append("address", new Document("city", "Lyon").append("zip", 69001))
                        .append("tags", List.of("a", "b"))
                        .append("createdAt", new Date(0))));

        UnifiedDataType.ObjectType address = assertInstanceOf(UnifiedDataType.ObjectType.class, columns.get(1).getDataType());
        assertEquals(UnifiedDataType.string(null, false), address.getFields().get("city"));
        assertEquals(UnifiedDataType.integer(32, true), address.getFields().get("zip"));

        UnifiedDataType.ArrayType tags = assertInstanceOf(UnifiedDataType.ArrayType.class, columns.get(2).getDataType());
        assertEquals(UnifiedDataType.string(null, false), tags.getElementType());

        assertTrue(columns.get(3).getDataType().isTemporal());
    }

    @Test
    void testEmptyCollectionStillReportsId() {
        List<Column> columns = inferrer.inferColumns(List.of());

        assertEquals(1, columns.size());
        assertEquals("_id", columns.get(0).getName());
    }
}
