package com.cgi.dbsurveyor.collector.core.type;

import com.cgi.dbsurveyor.collector.model.DatabaseType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.Serial;
import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Engine-independent representation of a column or field type.
 * Every native type maps to exactly one variant; anything without a
 * dedicated variant becomes {@link CustomType} carrying the native name.
 * Length, precision and scale are null when the source does not expose them.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(UnifiedDataType.IntegerType.class),
        @JsonSubTypes.Type(UnifiedDataType.FloatType.class),
        @JsonSubTypes.Type(UnifiedDataType.DecimalType.class),
        @JsonSubTypes.Type(UnifiedDataType.StringType.class),
        @JsonSubTypes.Type(UnifiedDataType.BooleanType.class),
        @JsonSubTypes.Type(UnifiedDataType.DateTimeType.class),
        @JsonSubTypes.Type(UnifiedDataType.DateType.class),
        @JsonSubTypes.Type(UnifiedDataType.TimeType.class),
        @JsonSubTypes.Type(UnifiedDataType.BinaryType.class),
        @JsonSubTypes.Type(UnifiedDataType.ArrayType.class),
        @JsonSubTypes.Type(UnifiedDataType.ObjectType.class),
        @JsonSubTypes.Type(UnifiedDataType.JsonType.class),
        @JsonSubTypes.Type(UnifiedDataType.CustomType.class)
})
public abstract class UnifiedDataType implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    UnifiedDataType() {
    }

    /**
     * Whether values of this type carry a date or time component.
     *
     * @return true for date, time and timestamp types
     */
    @JsonIgnore
    public boolean isTemporal() {
        return false;
    }

    public static UnifiedDataType integer(int bits, boolean signed) {
        return new IntegerType(bits, signed);
    }

    public static UnifiedDataType floating(Integer precision) {
        return new FloatType(precision);
    }

    public static UnifiedDataType decimal(Integer precision, Integer scale) {
        return new DecimalType(precision, scale);
    }

    public static UnifiedDataType string(Integer maxLength, boolean fixed) {
        return new StringType(maxLength, fixed);
    }

    public static UnifiedDataType bool() {
        return BooleanType.INSTANCE;
    }

    public static UnifiedDataType dateTime(boolean tzAware) {
        return new DateTimeType(tzAware);
    }

    public static UnifiedDataType date() {
        return DateType.INSTANCE;
    }

    public static UnifiedDataType time() {
        return TimeType.INSTANCE;
    }

    public static UnifiedDataType binary(Integer maxLength) {
        return new BinaryType(maxLength);
    }

    public static UnifiedDataType array(UnifiedDataType elementType) {
        return new ArrayType(elementType);
    }

    public static UnifiedDataType object(Map<String, UnifiedDataType> fields) {
        return new ObjectType(fields);
    }

    public static UnifiedDataType json() {
        return JsonType.INSTANCE;
    }

    public static UnifiedDataType custom(String typeName, DatabaseType engine) {
        return new CustomType(typeName, engine);
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    @ToString
    @JsonTypeName("integer")
    public static final class IntegerType extends UnifiedDataType {
        @Serial
        private static final long serialVersionUID = 1L;

        private final int bits;
        private final boolean signed;

        IntegerType(int bits, boolean signed) {
            this.bits = bits;
            this.signed = signed;
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    @ToString
    @JsonTypeName("float")
    public static final class FloatType extends UnifiedDataType {
        @Serial
        private static final long serialVersionUID = 1L;

        /**
         * Precision in bits, when known.
         */
        private final Integer precision;

        FloatType(Integer precision) {
            this.precision = precision;
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    @ToString
    @JsonTypeName("decimal")
    public static final class DecimalType extends UnifiedDataType {
        @Serial
        private static final long serialVersionUID = 1L;

        private final Integer precision;
        private final Integer scale;

        DecimalType(Integer precision, Integer scale) {
            this.precision = precision;
            this.scale = scale;
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    @ToString
    @JsonTypeName("string")
    public static final class StringType extends UnifiedDataType {
        @Serial
        private static final long serialVersionUID = 1L;

        private final Integer maxLength;

        /**
         * Fixed-width (CHAR) rather than variable-width storage.
         */
        private final boolean fixed;

        StringType(Integer maxLength, boolean fixed) {
            this.maxLength = maxLength;
            this.fixed = fixed;
        }
    }

    @EqualsAndHashCode(callSuper = false)
    @ToString
    @JsonTypeName("boolean")
    public static final class BooleanType extends UnifiedDataType {
        @Serial
        private static final long serialVersionUID = 1L;

        static final BooleanType INSTANCE = new BooleanType();

        private BooleanType() {
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    @ToString
    @JsonTypeName("datetime")
    public static final class DateTimeType extends UnifiedDataType {
        @Serial
        private static final long serialVersionUID = 1L;

        private final boolean tzAware;

        DateTimeType(boolean tzAware) {
            this.tzAware = tzAware;
        }

        @Override
        public boolean isTemporal() {
            return true;
        }
    }

    @EqualsAndHashCode(callSuper = false)
    @ToString
    @JsonTypeName("date")
    public static final class DateType extends UnifiedDataType {
        @Serial
        private static final long serialVersionUID = 1L;

        static final DateType INSTANCE = new DateType();

        private DateType() {
        }

        @Override
        public boolean isTemporal() {
            return true;
        }
    }

    @EqualsAndHashCode(callSuper = false)
    @ToString
    @JsonTypeName("time")
    public static final class TimeType extends UnifiedDataType {
        @Serial
        private static final long serialVersionUID = 1L;

        static final TimeType INSTANCE = new TimeType();

        private TimeType() {
        }

        @Override
        public boolean isTemporal() {
            return true;
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    @ToString
    @JsonTypeName("binary")
    public static final class BinaryType extends UnifiedDataType {
        @Serial
        private static final long serialVersionUID = 1L;

        private final Integer maxLength;

        BinaryType(Integer maxLength) {
            this.maxLength = maxLength;
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    @ToString
    @JsonTypeName("array")
    public static final class ArrayType extends UnifiedDataType {
        @Serial
        private static final long serialVersionUID = 1L;

        private final UnifiedDataType elementType;

        ArrayType(UnifiedDataType elementType) {
            this.elementType = elementType;
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    @ToString
    @JsonTypeName("object")
    public static final class ObjectType extends UnifiedDataType {
        @Serial
        private static final long serialVersionUID = 1L;

        /**
         * Field name to field type, in first-seen order.
         */
        private final Map<String, UnifiedDataType> fields;

        ObjectType(Map<String, UnifiedDataType> fields) {
            this.fields = fields == null
                    ? Collections.emptyMap()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }
    }

    @EqualsAndHashCode(callSuper = false)
    @ToString
    @JsonTypeName("json")
    public static final class JsonType extends UnifiedDataType {
        @Serial
        private static final long serialVersionUID = 1L;

        static final JsonType INSTANCE = new JsonType();

        private JsonType() {
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    @ToString
    @JsonTypeName("custom")
    public static final class CustomType extends UnifiedDataType {
        @Serial
        private static final long serialVersionUID = 1L;

        /**
         * Native type name exactly as reported by the engine.
         */
        private final String typeName;
        private final DatabaseType engine;

        CustomType(String typeName, DatabaseType engine) {
            this.typeName = typeName;
            this.engine = engine;
        }
    }
}
