package com.cgi.dbsurveyor.collector.core.type;

import com.cgi.dbsurveyor.collector.model.DatabaseType;

/**
 * BSON type aliases, as produced by the document schema inference.
 * Arrays and embedded documents are built by the inference itself since
 * their element and field types come from the sampled values.
 */
public class MongoTypeMapper implements TypeMapper {

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.MONGODB;
    }

    @Override
    public UnifiedDataType map(NativeType nativeType) {
        if (nativeType == null || nativeType.getTypeName() == null) {
            return custom(null);
        }
        String alias = nativeType.getTypeName();
        return switch (alias) {
            case "string", "symbol" -> UnifiedDataType.string(null, false);
            case "int" -> UnifiedDataType.integer(32, true);
            case "long" -> UnifiedDataType.integer(64, true);
            case "double" -> UnifiedDataType.floating(53);
            case "decimal" -> UnifiedDataType.decimal(34, null);
            case "bool" -> UnifiedDataType.bool();
            case "date" -> UnifiedDataType.dateTime(true);
            case "timestamp" -> UnifiedDataType.dateTime(true);
            case "binData" -> UnifiedDataType.binary(null);
            case "object" -> UnifiedDataType.object(null);
            case "array" -> UnifiedDataType.array(custom("unknown"));
            default -> custom(alias);
        };
    }
}
