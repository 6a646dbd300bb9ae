package com.cgi.dbsurveyor.collector.core.type;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Native type descriptor as reported by an engine's catalog.
 */
@Getter
@Builder
@ToString
public class NativeType {

    /**
     * Type name (information_schema data_type, declared SQLite type or BSON type alias).
     */
    private final String typeName;

    /**
     * Underlying type name where the engine reports one separately (PostgreSQL udt_name).
     */
    private final String udtName;

    /**
     * Full column type including modifiers (MySQL COLUMN_TYPE, e.g. "int(10) unsigned").
     */
    private final String columnType;

    private final Integer maxLength;
    private final Integer precision;
    private final Integer scale;

    /**
     * Element type name for array types.
     */
    private final String elementType;

    /**
     * Descriptor holding only a type name.
     *
     * @param typeName Type name
     * @return Descriptor
     */
    public static NativeType of(String typeName) {
        return NativeType.builder().typeName(typeName).build();
    }
}
