package com.cgi.dbsurveyor.collector.core.type;

import com.cgi.dbsurveyor.collector.model.DatabaseType;

/**
 * Maps an engine-native type descriptor to a {@link UnifiedDataType}.
 * Implementations are pure and total: unknown types map to a custom type.
 */
public interface TypeMapper {

    /**
     * Gets the engine this mapper handles.
     *
     * @return Engine
     */
    DatabaseType getDatabaseType();

    /**
     * Maps a native type.
     *
     * @param nativeType Native type descriptor
     * @return Unified type, never null
     */
    UnifiedDataType map(NativeType nativeType);

    /**
     * Fallback for types without a dedicated variant.
     *
     * @param typeName Native type name
     * @return Custom type preserving the name
     */
    default UnifiedDataType custom(String typeName) {
        return UnifiedDataType.custom(typeName == null ? "unknown" : typeName, getDatabaseType());
    }
}
