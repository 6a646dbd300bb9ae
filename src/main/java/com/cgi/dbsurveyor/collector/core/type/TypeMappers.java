package com.cgi.dbsurveyor.collector.core.type;

import com.cgi.dbsurveyor.collector.model.DatabaseType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Entry point of the unified type system.
 */
public final class TypeMappers {

    private static final Map<DatabaseType, TypeMapper> MAPPERS = new EnumMap<>(DatabaseType.class);

    static {
        register(new PostgresTypeMapper());
        register(new MySqlTypeMapper());
        register(new SQLiteTypeMapper());
        register(new MongoTypeMapper());
    }

    private TypeMappers() {
    }

    private static void register(TypeMapper mapper) {
        MAPPERS.put(mapper.getDatabaseType(), mapper);
    }

    /**
     * Gets the mapper for an engine.
     *
     * @param engine Engine
     * @return Mapper, or a mapper that maps everything to a custom type for engines without one
     */
    public static TypeMapper forEngine(DatabaseType engine) {
        TypeMapper mapper = MAPPERS.get(engine);
        if (mapper != null) {
            return mapper;
        }
        return new TypeMapper() {
            @Override
            public DatabaseType getDatabaseType() {
                return engine;
            }

            @Override
            public UnifiedDataType map(NativeType nativeType) {
                return custom(nativeType == null ? null : nativeType.getTypeName());
            }
        };
    }

    /**
     * Maps a native type of the given engine.
     *
     * @param engine Engine
     * @param nativeType Native type descriptor
     * @return Unified type
     */
    public static UnifiedDataType map(DatabaseType engine, NativeType nativeType) {
        return forEngine(engine).map(nativeType);
    }
}
