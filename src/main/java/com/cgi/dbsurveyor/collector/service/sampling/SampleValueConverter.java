package com.cgi.dbsurveyor.collector.service.sampling;

import com.cgi.dbsurveyor.collector.exception.SamplingException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Array;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.SQLException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Converts retrieved values into JSON-friendly values without altering them.
 * JSON-native values pass through untouched; binary content is base64 encoded;
 * temporal and other driver types are rendered as their ISO or canonical text.
 * Must be called while the underlying cursor is still open (LOBs and arrays).
 */
public class SampleValueConverter {

    /**
     * Converts a row, keeping column order.
     *
     * @param row Raw row
     * @return Converted row
     */
    public Map<String, Object> convertRow(Map<String, Object> row) {
        Map<String, Object> converted = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            converted.put(entry.getKey(), convert(entry.getValue()));
        }
        return converted;
    }

    /**
     * Converts a single value.
     *
     * @param value Raw value
     * @return Converted value
     */
    public Object convert(Object value) {
        if (value == null
                || value instanceof String
                || value instanceof Boolean
                || value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger
                || value instanceof BigDecimal) {
            return value;
        }
        if (value instanceof Double) {
            Double d = (Double) value;
            return d.isNaN() || d.isInfinite() ? d.toString() : d;
        }
        if (value instanceof Float) {
            Float f = (Float) value;
            return f.isNaN() || f.isInfinite() ? f.toString() : f;
        }
        if (value instanceof byte[]) {
            return encodeBinary((byte[]) value);
        }
        if (value instanceof Character) {
            return value.toString();
        }
        try {
            if (value instanceof Blob) {
                Blob blob = (Blob) value;
                return encodeBinary(blob.getBytes(1, (int) blob.length()));
            }
            if (value instanceof Clob) {
                Clob clob = (Clob) value;
                return clob.getSubString(1, (int) clob.length());
            }
            if (value instanceof Array) {
                Object elements = ((Array) value).getArray();
                return elements instanceof Object[] ? convertAll(Arrays.asList((Object[]) elements)) : convert(elements);
            }
        } catch (SQLException e) {
            throw new SamplingException("Failed to read " + value.getClass().getSimpleName() + " value", e);
        }
        if (value instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) value).toLocalDateTime().toString();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().toString();
        }
        if (value instanceof java.sql.Time) {
            return ((java.sql.Time) value).toLocalTime().toString();
        }
        if (value instanceof java.util.Date) {
            return ((java.util.Date) value).toInstant().toString();
        }
        if (value instanceof TemporalAccessor || value instanceof UUID) {
            return value.toString();
        }
        if (value instanceof Map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                nested.put(String.valueOf(entry.getKey()), convert(entry.getValue()));
            }
            return nested;
        }
        if (value instanceof Collection) {
            return convertAll((Collection<?>) value);
        }
        if (value instanceof Object[]) {
            return convertAll(Arrays.asList((Object[]) value));
        }
        return convertOther(value);
    }

    /**
     * Hook for engine-specific value types. The default renders the value's text form.
     *
     * @param value Value of a type not handled above
     * @return Converted value
     */
    protected Object convertOther(Object value) {
        return value.toString();
    }

    protected String encodeBinary(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }

    private List<Object> convertAll(Collection<?> values) {
        List<Object> converted = new ArrayList<>(values.size());
        for (Object element : values) {
            converted.add(convert(element));
        }
        return converted;
    }
}
