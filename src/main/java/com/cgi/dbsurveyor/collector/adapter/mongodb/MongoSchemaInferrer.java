package com.cgi.dbsurveyor.collector.adapter.mongodb;

import com.cgi.dbsurveyor.collector.core.type.NativeType;
import com.cgi.dbsurveyor.collector.core.type.TypeMapper;
import com.cgi.dbsurveyor.collector.core.type.TypeMappers;
import com.cgi.dbsurveyor.collector.core.type.UnifiedDataType;
import com.cgi.dbsurveyor.collector.model.Column;
import com.cgi.dbsurveyor.collector.model.DatabaseType;
import org.bson.BsonTimestamp;
import org.bson.Document;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Infers collection columns from sampled documents.
 * A field seen with several BSON types maps to a custom "mixed" type; a field
 * missing from some documents, or null in any, is nullable.
 */
class MongoSchemaInferrer {

    private static final String NULL_ALIAS = "null";

    private final TypeMapper typeMapper = TypeMappers.forEngine(DatabaseType.MONGODB);

    /**
     * Observed shape of one field.
     */
    private static final class FieldStats {
        private final Set<String> aliases = new LinkedHashSet<>();
        private final Map<String, FieldStats> children = new LinkedHashMap<>();
        private FieldStats elements;
        private int present;
    }

    /**
     * Infers the columns of a collection.
     *
     * @param documents Sampled documents
     * @return Columns in first-seen order, _id first
     */
    List<Column> inferColumns(List<Document> documents) {
        Map<String, FieldStats> fields = new LinkedHashMap<>();
        fields.put("_id", new FieldStats());
        for (Document document : documents) {
            observeDocument(fields, document);
        }

        List<Column> columns = new ArrayList<>();
        int position = 1;
        for (Map.Entry<String, FieldStats> entry : fields.entrySet()) {
            FieldStats stats = entry.getValue();
            if (stats.present == 0 && !"_id".equals(entry.getKey())) {
                continue;
            }
            boolean id = "_id".equals(entry.getKey());
            columns.add(Column.builder()
                    .name(entry.getKey())
                    .dataType(stats.present == 0 ? typeMapper.custom("objectId") : toType(stats))
                    .nativeType(stats.aliases.isEmpty() ? "objectId" : String.join("|", stats.aliases))
                    .nullable(!id && (stats.present < documents.size() || stats.aliases.contains(NULL_ALIAS)))
                    .primaryKey(id)
                    .ordinalPosition(position++)
                    .build());
        }
        return columns;
    }

    private void observeDocument(Map<String, FieldStats> fields, Map<String, Object> document) {
        for (Map.Entry<String, Object> entry : document.entrySet()) {
            FieldStats stats = fields.computeIfAbsent(entry.getKey(), key -> new FieldStats());
            stats.present++;
            observeValue(stats, entry.getValue());
        }
    }

    @SuppressWarnings("unchecked")
    private void observeValue(FieldStats stats, Object value) {
        String alias = alias(value);
        stats.aliases.add(alias);
        if (value instanceof Map) {
            observeDocument(stats.children, (Map<String, Object>) value);
        } else if (value instanceof List) {
            for (Object element : (List<?>) value) {
                if (stats.elements == null) {
                    stats.elements = new FieldStats();
                }
                stats.elements.present++;
                observeValue(stats.elements, element);
            }
        }
    }

    private UnifiedDataType toType(FieldStats stats) {
        Set<String> aliases = new LinkedHashSet<>(stats.aliases);
        aliases.remove(NULL_ALIAS);
        if (aliases.isEmpty()) {
            return typeMapper.custom(NULL_ALIAS);
        }
        if (aliases.size() > 1) {
            return typeMapper.custom("mixed(" + String.join("|", aliases) + ")");
        }
        String alias = aliases.iterator().next();
        if ("object".equals(alias)) {
            Map<String, UnifiedDataType> nested = new LinkedHashMap<>();
            stats.children.forEach((name, child) -> nested.put(name, toType(child)));
            return UnifiedDataType.object(nested);
        }
        if ("array".equals(alias)) {
            return UnifiedDataType.array(stats.elements == null
                    ? typeMapper.custom("unknown")
                    : toType(stats.elements));
        }
        return typeMapper.map(NativeType.of(alias));
    }

    /**
     * BSON type alias as used by the $type operator.
     */
    static String alias(Object value) {
        if (value == null) {
            return NULL_ALIAS;
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Integer) {
            return "int";
        }
        if (value instanceof Long) {
            return "long";
        }
        if (value instanceof Double) {
            return "double";
        }
        if (value instanceof Decimal128) {
            return "decimal";
        }
        if (value instanceof Boolean) {
            return "bool";
        }
        if (value instanceof Date) {
            return "date";
        }
        if (value instanceof BsonTimestamp) {
            return "timestamp";
        }
        if (value instanceof Binary || value instanceof byte[] || value instanceof UUID) {
            return "binData";
        }
        if (value instanceof ObjectId) {
            return "objectId";
        }
        if (value instanceof Map) {
            return "object";
        }
        if (value instanceof List) {
            return "array";
        }
        if (value instanceof Pattern) {
            return "regex";
        }
        return value.getClass().getSimpleName();
    }
}
