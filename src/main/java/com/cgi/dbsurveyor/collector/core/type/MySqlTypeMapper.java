package com.cgi.dbsurveyor.collector.core.type;

import com.cgi.dbsurveyor.collector.model.DatabaseType;

import java.util.Locale;

/**
 * MySQL types, keyed on information_schema DATA_TYPE with COLUMN_TYPE for modifiers.
 */
public class MySqlTypeMapper implements TypeMapper {

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.MYSQL;
    }

    @Override
    public UnifiedDataType map(NativeType nativeType) {
        if (nativeType == null || nativeType.getTypeName() == null) {
            return custom(null);
        }
        String dataType = nativeType.getTypeName().toLowerCase(Locale.ROOT).trim();
        String columnType = nativeType.getColumnType() == null
                ? dataType
                : nativeType.getColumnType().toLowerCase(Locale.ROOT);
        boolean signed = !columnType.contains("unsigned");

        return switch (dataType) {
            case "char", "character" -> UnifiedDataType.string(nativeType.getMaxLength(), true);
            case "varchar", "character varying", "tinytext", "text", "mediumtext", "longtext" ->
                    UnifiedDataType.string(nativeType.getMaxLength(), false);
            case "tinyint" -> columnType.startsWith("tinyint(1)")
                    ? UnifiedDataType.bool()
                    : UnifiedDataType.integer(8, signed);
            case "smallint" -> UnifiedDataType.integer(16, signed);
            case "mediumint" -> UnifiedDataType.integer(24, signed);
            case "int", "integer" -> UnifiedDataType.integer(32, signed);
            case "bigint" -> UnifiedDataType.integer(64, signed);
            case "decimal", "numeric", "dec", "fixed" ->
                    UnifiedDataType.decimal(nativeType.getPrecision(), nativeType.getScale());
            case "float" -> UnifiedDataType.floating(24);
            case "double", "double precision", "real" -> UnifiedDataType.floating(53);
            case "boolean", "bool" -> UnifiedDataType.bool();
            case "date" -> UnifiedDataType.date();
            case "time" -> UnifiedDataType.time();
            case "datetime" -> UnifiedDataType.dateTime(false);
            case "timestamp" -> UnifiedDataType.dateTime(true);
            case "year" -> UnifiedDataType.integer(16, false);
            case "binary", "varbinary", "tinyblob", "blob", "mediumblob", "longblob" ->
                    UnifiedDataType.binary(nativeType.getMaxLength());
            case "bit" -> "bit(1)".equals(columnType)
                    ? UnifiedDataType.bool()
                    : UnifiedDataType.binary(nativeType.getPrecision());
            case "json" -> UnifiedDataType.json();
            default -> custom(columnType);
        };
    }
}
