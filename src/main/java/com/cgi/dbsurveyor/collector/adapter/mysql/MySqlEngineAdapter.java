package com.cgi.dbsurveyor.collector.adapter.mysql;

import com.cgi.dbsurveyor.collector.config.CollectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionConfig;
import com.cgi.dbsurveyor.collector.core.adapter.EngineAdapter;
import com.cgi.dbsurveyor.collector.core.jdbc.AbstractJdbcEngineAdapter;
import com.cgi.dbsurveyor.collector.core.jdbc.JdbcDataSourceFactory;
import com.cgi.dbsurveyor.collector.core.jdbc.SqlDialect;
import com.cgi.dbsurveyor.collector.core.type.NativeType;
import com.cgi.dbsurveyor.collector.core.type.TypeMapper;
import com.cgi.dbsurveyor.collector.core.type.TypeMappers;
import com.cgi.dbsurveyor.collector.exception.BaseException;
import com.cgi.dbsurveyor.collector.model.AccessLevel;
import com.cgi.dbsurveyor.collector.model.Column;
import com.cgi.dbsurveyor.collector.model.Constraint;
import com.cgi.dbsurveyor.collector.model.ConstraintType;
import com.cgi.dbsurveyor.collector.model.DatabaseInfo;
import com.cgi.dbsurveyor.collector.model.DatabaseType;
import com.cgi.dbsurveyor.collector.model.ForeignKey;
import com.cgi.dbsurveyor.collector.model.Index;
import com.cgi.dbsurveyor.collector.model.IndexColumn;
import com.cgi.dbsurveyor.collector.model.Parameter;
import com.cgi.dbsurveyor.collector.model.ParameterDirection;
import com.cgi.dbsurveyor.collector.model.PrimaryKey;
import com.cgi.dbsurveyor.collector.model.ReferentialAction;
import com.cgi.dbsurveyor.collector.model.Routine;
import com.cgi.dbsurveyor.collector.model.RoutineKind;
import com.cgi.dbsurveyor.collector.model.ServerInfo;
import com.cgi.dbsurveyor.collector.model.SortOrder;
import com.cgi.dbsurveyor.collector.model.Table;
import com.cgi.dbsurveyor.collector.model.Trigger;
import com.cgi.dbsurveyor.collector.model.TriggerEvent;
import com.cgi.dbsurveyor.collector.model.TriggerTiming;
import com.cgi.dbsurveyor.collector.model.View;
import com.cgi.dbsurveyor.collector.service.sampling.SamplingExecutor;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * MySQL adapter reading information_schema for the current database.
 * MySQL has no schemas inside a database, so every object carries a null schema.
 */
public class MySqlEngineAdapter extends AbstractJdbcEngineAdapter {

    private static final String SQL_LIST_DATABASES = """
        SELECT
            s.SCHEMA_NAME AS name,
            s.DEFAULT_CHARACTER_SET_NAME AS encoding,
            s.DEFAULT_COLLATION_NAME AS collation_name,
            (SELECT SUM(t.DATA_LENGTH + t.INDEX_LENGTH)
             FROM information_schema.TABLES t
             WHERE t.TABLE_SCHEMA = s.SCHEMA_NAME) AS size_bytes
        FROM information_schema.SCHEMATA s
        ORDER BY s.SCHEMA_NAME
    """;

    private static final String SQL_DESCRIBE_DATABASE = """
        SELECT
            s.SCHEMA_NAME AS name,
            s.DEFAULT_CHARACTER_SET_NAME AS encoding,
            s.DEFAULT_COLLATION_NAME AS collation_name,
            (SELECT SUM(t.DATA_LENGTH + t.INDEX_LENGTH)
             FROM information_schema.TABLES t
             WHERE t.TABLE_SCHEMA = s.SCHEMA_NAME) AS size_bytes,
            VERSION() AS version
        FROM information_schema.SCHEMATA s
        WHERE s.SCHEMA_NAME = DATABASE()
    """;

    private static final String SQL_TABLES = """
        SELECT TABLE_NAME, TABLE_COMMENT, TABLE_ROWS
        FROM information_schema.TABLES
        WHERE TABLE_SCHEMA = DATABASE()
          AND TABLE_TYPE = 'BASE TABLE'
        ORDER BY TABLE_NAME
    """;

    private static final String SQL_COLUMNS = """
        SELECT
            c.TABLE_NAME,
            c.COLUMN_NAME,
            c.DATA_TYPE,
            c.COLUMN_TYPE,
            c.IS_NULLABLE,
            c.COLUMN_DEFAULT,
            c.EXTRA,
            c.CHARACTER_MAXIMUM_LENGTH,
            c.NUMERIC_PRECISION,
            c.NUMERIC_SCALE,
            c.ORDINAL_POSITION,
            c.COLUMN_COMMENT
        FROM information_schema.COLUMNS c
        WHERE c.TABLE_SCHEMA = DATABASE()
        ORDER BY c.TABLE_NAME, c.ORDINAL_POSITION
    """;

    private static final String SQL_PRIMARY_KEYS = """
        SELECT TABLE_NAME, COLUMN_NAME
        FROM information_schema.KEY_COLUMN_USAGE
        WHERE TABLE_SCHEMA = DATABASE()
          AND CONSTRAINT_NAME = 'PRIMARY'
        ORDER BY TABLE_NAME, ORDINAL_POSITION
    """;

    private static final String SQL_FOREIGN_KEYS = """
        SELECT
            kcu.TABLE_NAME,
            kcu.CONSTRAINT_NAME,
            kcu.COLUMN_NAME,
            kcu.REFERENCED_TABLE_SCHEMA,
            kcu.REFERENCED_TABLE_NAME,
            kcu.REFERENCED_COLUMN_NAME,
            rc.UPDATE_RULE,
            rc.DELETE_RULE
        FROM information_schema.KEY_COLUMN_USAGE kcu
        JOIN information_schema.REFERENTIAL_CONSTRAINTS rc
            ON rc.CONSTRAINT_SCHEMA = kcu.CONSTRAINT_SCHEMA
            AND rc.CONSTRAINT_NAME = kcu.CONSTRAINT_NAME
            AND rc.TABLE_NAME = kcu.TABLE_NAME
        WHERE kcu.TABLE_SCHEMA = DATABASE()
          AND kcu.REFERENCED_TABLE_NAME IS NOT NULL
        ORDER BY kcu.TABLE_NAME, kcu.CONSTRAINT_NAME, kcu.ORDINAL_POSITION
    """;

    private static final String SQL_INDEXES = """
        SELECT TABLE_NAME, INDEX_NAME, NON_UNIQUE, INDEX_TYPE, COLUMN_NAME, COLLATION, SEQ_IN_INDEX
        FROM information_schema.STATISTICS
        WHERE TABLE_SCHEMA = DATABASE()
        ORDER BY TABLE_NAME, INDEX_NAME, SEQ_IN_INDEX
    """;

    private static final String SQL_CONSTRAINTS = """
        SELECT
            tc.TABLE_NAME,
            tc.CONSTRAINT_NAME,
            tc.CONSTRAINT_TYPE,
            kcu.COLUMN_NAME
        FROM information_schema.TABLE_CONSTRAINTS tc
        LEFT JOIN information_schema.KEY_COLUMN_USAGE kcu
            ON kcu.CONSTRAINT_SCHEMA = tc.CONSTRAINT_SCHEMA
            AND kcu.CONSTRAINT_NAME = tc.CONSTRAINT_NAME
            AND kcu.TABLE_NAME = tc.TABLE_NAME
        WHERE tc.TABLE_SCHEMA = DATABASE()
        ORDER BY tc.TABLE_NAME, tc.CONSTRAINT_NAME, kcu.ORDINAL_POSITION
    """;

    // CHECK_CONSTRAINTS exists from 8.0.16 on
    private static final String SQL_CHECK_CLAUSES = """
        SELECT CONSTRAINT_NAME, CHECK_CLAUSE
        FROM information_schema.CHECK_CONSTRAINTS
        WHERE CONSTRAINT_SCHEMA = DATABASE()
    """;

    private static final String SQL_VIEWS = """
        SELECT v.TABLE_NAME, v.VIEW_DEFINITION, t.TABLE_COMMENT
        FROM information_schema.VIEWS v
        LEFT JOIN information_schema.TABLES t
            ON t.TABLE_SCHEMA = v.TABLE_SCHEMA AND t.TABLE_NAME = v.TABLE_NAME
        WHERE v.TABLE_SCHEMA = DATABASE()
        ORDER BY v.TABLE_NAME
    """;

    private static final String SQL_ROUTINES = """
        SELECT
            ROUTINE_NAME,
            SPECIFIC_NAME,
            ROUTINE_TYPE,
            DTD_IDENTIFIER,
            ROUTINE_DEFINITION,
            ROUTINE_BODY,
            ROUTINE_COMMENT
        FROM information_schema.ROUTINES
        WHERE ROUTINE_SCHEMA = DATABASE()
        ORDER BY ROUTINE_NAME
    """;

    private static final String SQL_ROUTINE_PARAMETERS = """
        SELECT SPECIFIC_NAME, PARAMETER_NAME, PARAMETER_MODE, DTD_IDENTIFIER, ORDINAL_POSITION
        FROM information_schema.PARAMETERS
        WHERE SPECIFIC_SCHEMA = DATABASE()
          AND ORDINAL_POSITION > 0
        ORDER BY SPECIFIC_NAME, ORDINAL_POSITION
    """;

    private static final String SQL_TRIGGERS = """
        SELECT TRIGGER_NAME, EVENT_OBJECT_TABLE, EVENT_MANIPULATION, ACTION_TIMING, ACTION_STATEMENT
        FROM information_schema.TRIGGERS
        WHERE TRIGGER_SCHEMA = DATABASE()
        ORDER BY EVENT_OBJECT_TABLE, TRIGGER_NAME
    """;

    private static final String SQL_SERVER_INFO = """
        SELECT
            VERSION() AS version,
            CURRENT_USER() AS connection_user,
            (SELECT COUNT(*) FROM information_schema.USER_PRIVILEGES
             WHERE PRIVILEGE_TYPE = 'SUPER'
               AND GRANTEE = CONCAT('''', SUBSTRING_INDEX(CURRENT_USER(), '@', 1), '''@''',
                                    SUBSTRING_INDEX(CURRENT_USER(), '@', -1), '''')) AS super_count
    """;

    private final JdbcDataSourceFactory dataSourceFactory;
    private final TypeMapper typeMapper = TypeMappers.forEngine(DatabaseType.MYSQL);

    /**
     * Constructor.
     *
     * @param dataSource Pool owned by this adapter
     * @param connectionConfig Connection configuration
     * @param collectionConfig Collection configuration
     * @param samplingExecutor Sampling executor
     * @param dataSourceFactory Factory used to open pools on other databases
     */
    public MySqlEngineAdapter(HikariDataSource dataSource, ConnectionConfig connectionConfig,
                              CollectionConfig collectionConfig, SamplingExecutor samplingExecutor,
                              JdbcDataSourceFactory dataSourceFactory) {
        super(dataSource, connectionConfig, collectionConfig, SqlDialect.MYSQL, samplingExecutor);
        this.dataSourceFactory = dataSourceFactory;
    }

    @Override
    public DatabaseType databaseType() {
        return DatabaseType.MYSQL;
    }

    /**
     * MySQL only lists schemas on which the user holds some privilege, so every
     * returned database is accessible.
     */
    @Override
    public List<DatabaseInfo> enumerateDatabases(boolean includeSystem) {
        return executeQuery("listDatabases", jdbc -> jdbc.query(SQL_LIST_DATABASES, (rs, rowNum) -> DatabaseInfo.builder()
                .name(rs.getString("name"))
                .encoding(rs.getString("encoding"))
                .collation(rs.getString("collation_name"))
                .sizeBytes(getLong(rs, "size_bytes"))
                .accessLevel(AccessLevel.FULL)
                .build()));
    }

    @Override
    public EngineAdapter<JdbcTemplate> reconnect(String databaseName) {
        ConnectionConfig target = connectionConfig.withDatabase(databaseName);
        HikariDataSource pool = dataSourceFactory.reconnect(DatabaseType.MYSQL, target, (HikariDataSource) dataSource);
        return new MySqlEngineAdapter(pool, target, collectionConfig, samplingExecutor, dataSourceFactory);
    }

    @Override
    public ServerInfo describeServer() {
        return executeQuery("describeServer", jdbc -> jdbc.queryForObject(SQL_SERVER_INFO, (rs, rowNum) ->
                ServerInfo.builder()
                        .serverType(DatabaseType.MYSQL)
                        .version(rs.getString("version"))
                        .host(connectionConfig.getHost())
                        .port(connectionConfig.portOr(3306))
                        .connectionUser(rs.getString("connection_user"))
                        .superuser(rs.getLong("super_count") > 0)
                        .build()));
    }

    @Override
    protected DatabaseInfo describeDatabase() {
        return executeQuery("describeDatabase", jdbc -> jdbc.queryForObject(SQL_DESCRIBE_DATABASE, (rs, rowNum) ->
                DatabaseInfo.builder()
                        .name(rs.getString("name"))
                        .version(rs.getString("version"))
                        .encoding(rs.getString("encoding"))
                        .collation(rs.getString("collation_name"))
                        .sizeBytes(getLong(rs, "size_bytes"))
                        .build()));
    }

    @Override
    protected List<Table> loadTables() {
        Map<String, Table> tables = new LinkedHashMap<>();
        executeQuery("loadTables", jdbc -> {
            jdbc.query(SQL_TABLES, rs -> {
                String comment = rs.getString("TABLE_COMMENT");
                Table table = Table.builder()
                        .name(rs.getString("TABLE_NAME"))
                        .comment(comment == null || comment.isEmpty() ? null : comment)
                        .rowCount(getLong(rs, "TABLE_ROWS"))
                        .build();
                tables.put(table.getName(), table);
            });
            jdbc.query(SQL_COLUMNS, rs -> {
                Table table = tables.get(rs.getString("TABLE_NAME"));
                if (table != null) {
                    table.getColumns().add(mapColumn(rs));
                }
            });
            jdbc.query(SQL_PRIMARY_KEYS, rs -> {
                Table table = tables.get(rs.getString("TABLE_NAME"));
                if (table == null) {
                    return;
                }
                if (table.getPrimaryKey() == null) {
                    table.setPrimaryKey(PrimaryKey.builder().name("PRIMARY").build());
                }
                String column = rs.getString("COLUMN_NAME");
                table.getPrimaryKey().getColumns().add(column);
                table.findColumn(column).ifPresent(c -> c.setPrimaryKey(true));
            });
            return null;
        });
        return new ArrayList<>(tables.values());
    }

    @Override
    protected void loadForeignKeys(Map<String, Table> tablesByKey) {
        executeQuery("loadForeignKeys", jdbc -> {
            jdbc.query(SQL_FOREIGN_KEYS, rs -> {
                Table table = tablesByKey.get(tableKey(null, rs.getString("TABLE_NAME")));
                if (table == null) {
                    return;
                }
                String name = rs.getString("CONSTRAINT_NAME");
                ForeignKey fk = table.getForeignKeys().stream()
                        .filter(existing -> name.equals(existing.getName()))
                        .findFirst()
                        .orElse(null);
                if (fk == null) {
                    fk = ForeignKey.builder()
                            .name(name)
                            .referencedSchema(rs.getString("REFERENCED_TABLE_SCHEMA"))
                            .referencedTable(rs.getString("REFERENCED_TABLE_NAME"))
                            .onUpdate(ReferentialAction.fromSql(rs.getString("UPDATE_RULE")))
                            .onDelete(ReferentialAction.fromSql(rs.getString("DELETE_RULE")))
                            .build();
                    table.getForeignKeys().add(fk);
                }
                fk.getColumns().add(rs.getString("COLUMN_NAME"));
                fk.getReferencedColumns().add(rs.getString("REFERENCED_COLUMN_NAME"));
            });
            return null;
        });
    }

    @Override
    protected List<Index> loadIndexes() {
        Map<String, Index> indexes = new LinkedHashMap<>();
        executeQuery("loadIndexes", jdbc -> {
            jdbc.query(SQL_INDEXES, rs -> {
                String tableName = rs.getString("TABLE_NAME");
                String indexName = rs.getString("INDEX_NAME");
                Index index = indexes.get(tableKey(tableName, indexName));
                if (index == null) {
                    index = Index.builder()
                            .tableName(tableName)
                            .name(indexName)
                            .unique(rs.getInt("NON_UNIQUE") == 0)
                            .primary("PRIMARY".equals(indexName))
                            .indexType(rs.getString("INDEX_TYPE"))
                            .build();
                    indexes.put(tableKey(tableName, indexName), index);
                }
                String column = rs.getString("COLUMN_NAME");
                index.getColumns().add(IndexColumn.builder()
                        .name(column != null ? column : "(expression)")
                        .sortOrder("D".equals(rs.getString("COLLATION")) ? SortOrder.DESCENDING : SortOrder.ASCENDING)
                        .build());
            });
            return null;
        });
        return new ArrayList<>(indexes.values());
    }

    @Override
    protected List<Constraint> loadConstraints() {
        Map<String, String> checkClauses = loadCheckClauses();
        Map<String, Constraint> constraints = new LinkedHashMap<>();
        executeQuery("loadConstraints", jdbc -> {
            jdbc.query(SQL_CONSTRAINTS, rs -> {
                String tableName = rs.getString("TABLE_NAME");
                String name = rs.getString("CONSTRAINT_NAME");
                Constraint constraint = constraints.get(tableKey(tableName, name));
                if (constraint == null) {
                    ConstraintType type = mapConstraintType(rs.getString("CONSTRAINT_TYPE"));
                    constraint = Constraint.builder()
                            .tableName(tableName)
                            .name(name)
                            .constraintType(type)
                            .checkClause(type == ConstraintType.CHECK ? checkClauses.get(name) : null)
                            .build();
                    constraints.put(tableKey(tableName, name), constraint);
                }
                String column = rs.getString("COLUMN_NAME");
                if (column != null) {
                    constraint.getColumns().add(column);
                }
            });
            return null;
        });
        return new ArrayList<>(constraints.values());
    }

    @Override
    protected List<View> loadViews() {
        return executeQuery("loadViews", jdbc -> jdbc.query(SQL_VIEWS, (rs, rowNum) -> {
            String comment = rs.getString("TABLE_COMMENT");
            return View.builder()
                    .name(rs.getString("TABLE_NAME"))
                    .definition(rs.getString("VIEW_DEFINITION"))
                    // MySQL stores "VIEW" as the comment of views without one
                    .comment(comment == null || comment.isEmpty() || "VIEW".equals(comment) ? null : comment)
                    .build();
        }));
    }

    @Override
    protected List<Routine> loadRoutines() {
        Map<String, Routine> routines = new LinkedHashMap<>();
        executeQuery("loadRoutines", jdbc -> {
            jdbc.query(SQL_ROUTINES, rs -> {
                boolean procedure = "PROCEDURE".equalsIgnoreCase(rs.getString("ROUTINE_TYPE"));
                String comment = rs.getString("ROUTINE_COMMENT");
                routines.put(rs.getString("SPECIFIC_NAME"), Routine.builder()
                        .name(rs.getString("ROUTINE_NAME"))
                        .kind(procedure ? RoutineKind.PROCEDURE : RoutineKind.FUNCTION)
                        .returnType(procedure ? null : rs.getString("DTD_IDENTIFIER"))
                        .definition(rs.getString("ROUTINE_DEFINITION"))
                        .language(rs.getString("ROUTINE_BODY"))
                        .comment(comment == null || comment.isEmpty() ? null : comment)
                        .build());
            });
            jdbc.query(SQL_ROUTINE_PARAMETERS, rs -> {
                Routine routine = routines.get(rs.getString("SPECIFIC_NAME"));
                if (routine != null) {
                    routine.getParameters().add(Parameter.builder()
                            .name(rs.getString("PARAMETER_NAME"))
                            .direction(ParameterDirection.fromMode(rs.getString("PARAMETER_MODE")))
                            .dataType(rs.getString("DTD_IDENTIFIER"))
                            .build());
                }
            });
            return null;
        });
        return new ArrayList<>(routines.values());
    }

    @Override
    protected List<Trigger> loadTriggers() {
        return executeQuery("loadTriggers", jdbc -> jdbc.query(SQL_TRIGGERS, (rs, rowNum) -> Trigger.builder()
                .tableName(rs.getString("EVENT_OBJECT_TABLE"))
                .name(rs.getString("TRIGGER_NAME"))
                .event(TriggerEvent.valueOf(rs.getString("EVENT_MANIPULATION").toUpperCase(Locale.ROOT)))
                .timing(TriggerTiming.valueOf(rs.getString("ACTION_TIMING").toUpperCase(Locale.ROOT)))
                .definition(rs.getString("ACTION_STATEMENT"))
                .build()));
    }

    /**
     * CHECK clauses by constraint name; empty on servers without CHECK_CONSTRAINTS.
     */
    private Map<String, String> loadCheckClauses() {
        Map<String, String> clauses = new LinkedHashMap<>();
        try {
            executeQuery("loadCheckClauses", jdbc -> {
                jdbc.query(SQL_CHECK_CLAUSES, rs -> {
                    clauses.put(rs.getString("CONSTRAINT_NAME"), rs.getString("CHECK_CLAUSE"));
                });
                return null;
            });
        } catch (BaseException e) {
            logger.debug("CHECK constraint clauses unavailable: {}", e.getMessage());
        }
        return clauses;
    }

    private Column mapColumn(ResultSet rs) throws SQLException {
        String columnType = rs.getString("COLUMN_TYPE");
        String extra = rs.getString("EXTRA");
        String comment = rs.getString("COLUMN_COMMENT");
        NativeType nativeType = NativeType.builder()
                .typeName(rs.getString("DATA_TYPE"))
                .columnType(columnType)
                .maxLength(getInteger(rs, "CHARACTER_MAXIMUM_LENGTH"))
                .precision(getInteger(rs, "NUMERIC_PRECISION"))
                .scale(getInteger(rs, "NUMERIC_SCALE"))
                .build();
        return Column.builder()
                .name(rs.getString("COLUMN_NAME"))
                .dataType(typeMapper.map(nativeType))
                .nativeType(columnType)
                .nullable("YES".equalsIgnoreCase(rs.getString("IS_NULLABLE")))
                .defaultValue(rs.getString("COLUMN_DEFAULT"))
                .autoIncrement(extra != null && extra.toLowerCase(Locale.ROOT).contains("auto_increment"))
                .comment(comment == null || comment.isEmpty() ? null : comment)
                .ordinalPosition(rs.getInt("ORDINAL_POSITION"))
                .build();
    }

    private static ConstraintType mapConstraintType(String type) {
        return switch (type.toUpperCase(Locale.ROOT)) {
            case "PRIMARY KEY" -> ConstraintType.PRIMARY_KEY;
            case "FOREIGN KEY" -> ConstraintType.FOREIGN_KEY;
            case "UNIQUE" -> ConstraintType.UNIQUE;
            default -> ConstraintType.CHECK;
        };
    }
}
