package com.cgi.dbsurveyor.collector.core.jdbc;

import com.cgi.dbsurveyor.collector.service.sampling.SampleValueConverter;
import org.junit.jupiter.api.Test;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.TimeZone;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class SampleRowMapperTest {

    @Test
    void testPostgresTimestampTypes() {
        assertEquals(OffsetDateTime.class, SampleRowMapper.temporalType(SqlDialect.POSTGRESQL, "timestamptz"));
        assertEquals(LocalDateTime.class, SampleRowMapper.temporalType(SqlDialect.POSTGRESQL, "timestamp"));
        assertNull(SampleRowMapper.temporalType(SqlDialect.POSTGRESQL, "int4"));
    }

    @Test
    void testMysqlTimestampTypes() {
        assertEquals(OffsetDateTime.class, SampleRowMapper.temporalType(SqlDialect.MYSQL, "TIMESTAMP"));
        assertEquals(LocalDateTime.class, SampleRowMapper.temporalType(SqlDialect.MYSQL, "DATETIME"));
        assertNull(SampleRowMapper.temporalType(SqlDialect.MYSQL, "VARCHAR"));
    }

    @Test
    void testSqliteUsesDriverDefault() {
        assertNull(SampleRowMapper.temporalType(SqlDialect.SQLITE, "DATETIME"));
        assertNull(SampleRowMapper.temporalType(SqlDialect.POSTGRESQL, null));
    }

    @Test
    void testZonedColumnRendersSameInstantInAnyDefaultZone() throws SQLException {
        OffsetDateTime stored = OffsetDateTime.parse("2024-01-01T00:00:00Z");
        SampleValueConverter converter = new SampleValueConverter();
        TimeZone original = TimeZone.getDefault();
        try {
            TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
            Object inUtc = converter.convert(mapCreatedAt(stored).get("created_at"));
            TimeZone.setDefault(TimeZone.getTimeZone("America/New_York"));
            Object inNewYork = converter.convert(mapCreatedAt(stored).get("created_at"));

            assertEquals("2024-01-01T00:00Z", inUtc);
            assertEquals(inUtc, inNewYork);
        } finally {
            TimeZone.setDefault(original);
        }
    }

    private Map<String, Object> mapCreatedAt(OffsetDateTime stored) throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData metaData = mock(ResultSetMetaData.class);
        when(rs.getMetaData()).thenReturn(metaData);
        when(metaData.getColumnCount()).thenReturn(1);
        when(metaData.getColumnLabel(1)).thenReturn("created_at");
        when(metaData.getColumnTypeName(1)).thenReturn("timestamptz");
        when(rs.getObject(1, OffsetDateTime.class)).thenReturn(stored);

        Map<String, Object> row = new SampleRowMapper(SqlDialect.POSTGRESQL).mapRow(rs, 1);

        verify(rs, never()).getTimestamp(anyInt());
        verify(rs, never()).getObject(anyInt());
        return row;
    }
}
