package com.cgi.dbsurveyor.collector.core.type;

import com.cgi.dbsurveyor.collector.model.DatabaseType;

import java.util.Locale;

/**
 * PostgreSQL types, keyed on information_schema data_type with udt_name as fallback.
 */
public class PostgresTypeMapper implements TypeMapper {

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.POSTGRESQL;
    }

    @Override
    public UnifiedDataType map(NativeType nativeType) {
        if (nativeType == null || nativeType.getTypeName() == null) {
            return custom(null);
        }
        String dataType = nativeType.getTypeName().toLowerCase(Locale.ROOT).trim();
        String udtName = nativeType.getUdtName();

        if ("array".equals(dataType)) {
            return mapArray(nativeType);
        }
        if ("user-defined".equals(dataType)) {
            return udtName == null ? custom(nativeType.getTypeName()) : mapName(udtName, nativeType);
        }
        return mapName(dataType, nativeType);
    }

    private UnifiedDataType mapArray(NativeType nativeType) {
        String element = nativeType.getElementType();
        if (element == null && nativeType.getUdtName() != null && nativeType.getUdtName().startsWith("_")) {
            element = nativeType.getUdtName().substring(1);
        }
        if (element == null) {
            return custom(nativeType.getUdtName() != null ? nativeType.getUdtName() : nativeType.getTypeName());
        }
        return UnifiedDataType.array(mapName(element.toLowerCase(Locale.ROOT), NativeType.of(element)));
    }

    private UnifiedDataType mapName(String name, NativeType source) {
        return switch (name) {
            case "character varying", "varchar" -> UnifiedDataType.string(source.getMaxLength(), false);
            case "character", "char", "bpchar" -> UnifiedDataType.string(source.getMaxLength(), true);
            case "text", "name", "citext" -> UnifiedDataType.string(null, false);
            case "smallint", "int2" -> UnifiedDataType.integer(16, true);
            case "integer", "int", "int4" -> UnifiedDataType.integer(32, true);
            case "bigint", "int8" -> UnifiedDataType.integer(64, true);
            case "real", "float4" -> UnifiedDataType.floating(24);
            case "double precision", "float8" -> UnifiedDataType.floating(53);
            case "numeric", "decimal" -> UnifiedDataType.decimal(source.getPrecision(), source.getScale());
            case "boolean", "bool" -> UnifiedDataType.bool();
            case "timestamp without time zone", "timestamp" -> UnifiedDataType.dateTime(false);
            case "timestamp with time zone", "timestamptz" -> UnifiedDataType.dateTime(true);
            case "date" -> UnifiedDataType.date();
            case "time without time zone", "time", "time with time zone", "timetz" -> UnifiedDataType.time();
            case "bytea" -> UnifiedDataType.binary(null);
            case "json", "jsonb" -> UnifiedDataType.json();
            default -> custom(source.getUdtName() != null ? source.getUdtName() : name);
        };
    }
}
