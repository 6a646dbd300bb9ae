package com.cgi.dbsurveyor.collector.core.jdbc;

import org.springframework.jdbc.core.ColumnMapRowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.Locale;

/**
 * Column map row mapper reading timestamp columns through java.time types.
 * Zone-aware columns come back as {@link OffsetDateTime} and plain ones as {@link LocalDateTime},
 * so neither passes through the JVM default time zone.
 */
class SampleRowMapper extends ColumnMapRowMapper {

    private final SqlDialect dialect;

    SampleRowMapper(SqlDialect dialect) {
        this.dialect = dialect;
    }

    @Override
    protected Object getColumnValue(ResultSet rs, int index) throws SQLException {
        Class<?> temporalType = temporalType(dialect, rs.getMetaData().getColumnTypeName(index));
        if (temporalType != null) {
            return rs.getObject(index, temporalType);
        }
        return super.getColumnValue(rs, index);
    }

    /**
     * Java type a timestamp column is read as, or null to use the driver default.
     * SQLite keeps timestamps as text or numbers and is left alone.
     */
    static Class<?> temporalType(SqlDialect dialect, String typeName) {
        if (typeName == null || dialect == SqlDialect.SQLITE) {
            return null;
        }
        String type = typeName.toLowerCase(Locale.ROOT);
        if (dialect == SqlDialect.POSTGRESQL) {
            switch (type) {
                case "timestamptz":
                case "timestamp with time zone":
                    return OffsetDateTime.class;
                case "timestamp":
                case "timestamp without time zone":
                    return LocalDateTime.class;
                default:
                    return null;
            }
        }
        // MySQL TIMESTAMP is stored as UTC, DATETIME is a wall-clock value
        switch (type) {
            case "timestamp":
                return OffsetDateTime.class;
            case "datetime":
                return LocalDateTime.class;
            default:
                return null;
        }
    }
}
