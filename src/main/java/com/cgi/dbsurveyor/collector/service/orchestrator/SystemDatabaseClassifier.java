package com.cgi.dbsurveyor.collector.service.orchestrator;

import com.cgi.dbsurveyor.collector.model.DatabaseInfo;
import com.cgi.dbsurveyor.collector.model.DatabaseType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether a database belongs to the engine rather than to its users.
 */
public final class SystemDatabaseClassifier {

    private static final Map<DatabaseType, Set<String>> SYSTEM_DATABASES = new EnumMap<>(DatabaseType.class);

    static {
        SYSTEM_DATABASES.put(DatabaseType.POSTGRESQL, Set.of("template0", "template1"));
        SYSTEM_DATABASES.put(DatabaseType.MYSQL, Set.of("information_schema", "mysql", "performance_schema", "sys"));
        SYSTEM_DATABASES.put(DatabaseType.MONGODB, Set.of("admin", "config", "local"));
        SYSTEM_DATABASES.put(DatabaseType.SQLSERVER, Set.of("master", "model", "msdb", "tempdb"));
        SYSTEM_DATABASES.put(DatabaseType.SQLITE, Set.of());
    }

    private SystemDatabaseClassifier() {
    }

    /**
     * A database is a system database if the engine flags it or its name is a known system name.
     *
     * @param type Engine
     * @param database Database as listed by the engine
     * @return true for system databases
     */
    public static boolean isSystemDatabase(DatabaseType type, DatabaseInfo database) {
        return database.isSystemDatabase() || isSystemName(type, database.getName());
    }

    public static boolean isSystemName(DatabaseType type, String name) {
        return name != null && SYSTEM_DATABASES.getOrDefault(type, Set.of()).contains(name);
    }
}
