package com.cgi.dbsurveyor.collector.core.type;

import com.cgi.dbsurveyor.collector.model.DatabaseType;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SQLite declared types. SQLite stores by affinity, so the declared type is
 * matched on well-known names first and on affinity substrings second.
 */
public class SQLiteTypeMapper implements TypeMapper {

    private static final Pattern MODIFIERS = Pattern.compile("\\(\\s*(\\d+)\\s*(?:,\\s*(\\d+)\\s*)?\\)");

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.SQLITE;
    }

    @Override
    public UnifiedDataType map(NativeType nativeType) {
        String declared = nativeType == null || nativeType.getTypeName() == null
                ? ""
                : nativeType.getTypeName().trim();
        String upper = declared.toUpperCase(Locale.ROOT);
        Integer first = null;
        Integer second = null;
        Matcher matcher = MODIFIERS.matcher(upper);
        if (matcher.find()) {
            first = Integer.valueOf(matcher.group(1));
            second = matcher.group(2) == null ? null : Integer.valueOf(matcher.group(2));
        }
        String base = upper.replaceAll("\\(.*\\)", "").trim();

        // Names that would otherwise fall into the wrong affinity bucket
        switch (base) {
            case "":
                return UnifiedDataType.binary(null);
            case "BOOLEAN":
            case "BOOL":
                return UnifiedDataType.bool();
            case "DATETIME":
            case "TIMESTAMP":
                return UnifiedDataType.dateTime(false);
            case "DATE":
                return UnifiedDataType.date();
            case "TIME":
                return UnifiedDataType.time();
            case "JSON":
                return UnifiedDataType.json();
            case "TINYINT":
                return UnifiedDataType.integer(8, true);
            case "SMALLINT":
                return UnifiedDataType.integer(16, true);
            case "INT":
            case "MEDIUMINT":
                return UnifiedDataType.integer(32, true);
            case "NCHAR":
            case "CHARACTER":
            case "CHAR":
                return UnifiedDataType.string(first, true);
            case "DECIMAL":
            case "NUMERIC":
                return UnifiedDataType.decimal(first, second);
            default:
                break;
        }

        if (base.contains("INT")) {
            return UnifiedDataType.integer(64, true);
        }
        if (base.contains("CHAR") || base.contains("CLOB") || base.contains("TEXT")) {
            return UnifiedDataType.string(first, false);
        }
        if (base.contains("BLOB")) {
            return UnifiedDataType.binary(first);
        }
        if (base.contains("REAL") || base.contains("FLOA") || base.contains("DOUB")) {
            return UnifiedDataType.floating(53);
        }
        return custom(declared);
    }
}
