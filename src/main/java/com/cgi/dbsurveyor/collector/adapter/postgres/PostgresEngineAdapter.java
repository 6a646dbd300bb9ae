package com.cgi.dbsurveyor.collector.adapter.postgres;

import com.cgi.dbsurveyor.collector.config.CollectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionConfig;
import com.cgi.dbsurveyor.collector.core.adapter.EngineAdapter;
import com.cgi.dbsurveyor.collector.core.jdbc.AbstractJdbcEngineAdapter;
import com.cgi.dbsurveyor.collector.core.jdbc.JdbcDataSourceFactory;
import com.cgi.dbsurveyor.collector.core.jdbc.SqlDialect;
import com.cgi.dbsurveyor.collector.core.type.NativeType;
import com.cgi.dbsurveyor.collector.core.type.TypeMapper;
import com.cgi.dbsurveyor.collector.core.type.TypeMappers;
import com.cgi.dbsurveyor.collector.model.AccessLevel;
import com.cgi.dbsurveyor.collector.model.Column;
import com.cgi.dbsurveyor.collector.model.Constraint;
import com.cgi.dbsurveyor.collector.model.ConstraintType;
import com.cgi.dbsurveyor.collector.model.CustomType;
import com.cgi.dbsurveyor.collector.model.CustomTypeCategory;
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
 * PostgreSQL adapter reading pg_catalog and information_schema.
 * System schemas (pg_catalog, information_schema, pg_toast) are never collected.
 */
public class PostgresEngineAdapter extends AbstractJdbcEngineAdapter {

    private static final String USER_SCHEMA_FILTER =
            "NOT IN ('pg_catalog', 'information_schema') AND %s NOT LIKE 'pg_toast%%' AND %s NOT LIKE 'pg_temp%%'";

    private static final String SQL_LIST_DATABASES = """
        SELECT
            d.datname AS name,
            r.rolname AS owner,
            pg_encoding_to_char(d.encoding) AS encoding,
            d.datcollate AS collation,
            d.datistemplate AS is_template,
            has_database_privilege(d.datname, 'CONNECT') AS can_connect,
            CASE WHEN has_database_privilege(d.datname, 'CONNECT')
                 THEN pg_database_size(d.datname) END AS size_bytes
        FROM pg_database d
        LEFT JOIN pg_roles r ON r.oid = d.datdba
        WHERE d.datallowconn
        ORDER BY d.datname
    """;

    private static final String SQL_DESCRIBE_DATABASE = """
        SELECT
            current_database() AS name,
            r.rolname AS owner,
            pg_encoding_to_char(d.encoding) AS encoding,
            d.datcollate AS collation,
            pg_database_size(current_database()) AS size_bytes
        FROM pg_database d
        LEFT JOIN pg_roles r ON r.oid = d.datdba
        WHERE d.datname = current_database()
    """;

    private static final String SQL_TABLES = """
        SELECT
            n.nspname AS table_schema,
            c.relname AS table_name,
            obj_description(c.oid, 'pg_class') AS table_comment,
            CASE WHEN c.reltuples < 0 THEN NULL ELSE c.reltuples::bigint END AS row_estimate
        FROM pg_class c
        JOIN pg_namespace n ON n.oid = c.relnamespace
        WHERE c.relkind IN ('r', 'p')
          AND NOT c.relispartition
          AND n.nspname %s
        ORDER BY n.nspname, c.relname
    """.formatted(USER_SCHEMA_FILTER.formatted("n.nspname", "n.nspname"));

    private static final String SQL_COLUMNS = """
        SELECT
            c.table_schema,
            c.table_name,
            c.column_name,
            c.data_type,
            c.udt_name,
            c.is_nullable,
            c.column_default,
            c.is_identity,
            c.character_maximum_length,
            c.numeric_precision,
            c.numeric_scale,
            c.ordinal_position,
            col_description(
                (quote_ident(c.table_schema) || '.' || quote_ident(c.table_name))::regclass,
                c.ordinal_position) AS column_comment
        FROM information_schema.columns c
        JOIN information_schema.tables t
            ON t.table_schema = c.table_schema AND t.table_name = c.table_name
        WHERE t.table_type = 'BASE TABLE'
          AND c.table_schema %s
        ORDER BY c.table_schema, c.table_name, c.ordinal_position
    """.formatted(USER_SCHEMA_FILTER.formatted("c.table_schema", "c.table_schema"));

    private static final String SQL_PRIMARY_KEYS = """
        SELECT
            n.nspname AS table_schema,
            cl.relname AS table_name,
            con.conname AS constraint_name,
            a.attname AS column_name
        FROM pg_constraint con
        JOIN pg_class cl ON cl.oid = con.conrelid
        JOIN pg_namespace n ON n.oid = cl.relnamespace
        JOIN pg_attribute a ON a.attrelid = con.conrelid AND a.attnum = ANY (con.conkey)
        WHERE con.contype = 'p'
          AND n.nspname %s
        ORDER BY n.nspname, cl.relname, array_position(con.conkey, a.attnum)
    """.formatted(USER_SCHEMA_FILTER.formatted("n.nspname", "n.nspname"));

    private static final String SQL_FOREIGN_KEYS = """
        SELECT
            n.nspname AS table_schema,
            cl.relname AS table_name,
            con.conname AS constraint_name,
            src.attname AS column_name,
            rn.nspname AS referenced_schema,
            rcl.relname AS referenced_table,
            ref.attname AS referenced_column,
            con.confupdtype AS update_rule,
            con.confdeltype AS delete_rule
        FROM pg_constraint con
        JOIN pg_class cl ON cl.oid = con.conrelid
        JOIN pg_namespace n ON n.oid = cl.relnamespace
        JOIN pg_class rcl ON rcl.oid = con.confrelid
        JOIN pg_namespace rn ON rn.oid = rcl.relnamespace
        CROSS JOIN LATERAL unnest(con.conkey, con.confkey) WITH ORDINALITY AS k(src_attnum, ref_attnum, pos)
        JOIN pg_attribute src ON src.attrelid = con.conrelid AND src.attnum = k.src_attnum
        JOIN pg_attribute ref ON ref.attrelid = con.confrelid AND ref.attnum = k.ref_attnum
        WHERE con.contype = 'f'
          AND n.nspname %s
        ORDER BY n.nspname, cl.relname, con.conname, k.pos
    """.formatted(USER_SCHEMA_FILTER.formatted("n.nspname", "n.nspname"));

    private static final String SQL_INDEXES = """
        SELECT
            n.nspname AS table_schema,
            t.relname AS table_name,
            i.relname AS index_name,
            ix.indisunique AS is_unique,
            ix.indisprimary AS is_primary,
            am.amname AS index_type,
            a.attname AS column_name,
            (ix.indoption[(k.pos - 1)::int] & 1) = 1 AS is_desc,
            k.pos
        FROM pg_index ix
        JOIN pg_class i ON i.oid = ix.indexrelid
        JOIN pg_class t ON t.oid = ix.indrelid
        JOIN pg_namespace n ON n.oid = t.relnamespace
        JOIN pg_am am ON am.oid = i.relam
        CROSS JOIN LATERAL unnest(ix.indkey::int2[]) WITH ORDINALITY AS k(attnum, pos)
        LEFT JOIN pg_attribute a ON a.attrelid = t.oid AND a.attnum = k.attnum
        WHERE t.relkind IN ('r', 'p', 'm')
          AND n.nspname %s
        ORDER BY n.nspname, t.relname, i.relname, k.pos
    """.formatted(USER_SCHEMA_FILTER.formatted("n.nspname", "n.nspname"));

    private static final String SQL_CONSTRAINTS = """
        SELECT
            n.nspname AS table_schema,
            cl.relname AS table_name,
            con.conname AS constraint_name,
            con.contype AS constraint_type,
            pg_get_constraintdef(con.oid) AS definition,
            array_to_string(ARRAY(
                SELECT a.attname FROM unnest(con.conkey) WITH ORDINALITY AS k(attnum, pos)
                JOIN pg_attribute a ON a.attrelid = con.conrelid AND a.attnum = k.attnum
                ORDER BY k.pos), ',') AS column_names
        FROM pg_constraint con
        JOIN pg_class cl ON cl.oid = con.conrelid
        JOIN pg_namespace n ON n.oid = cl.relnamespace
        WHERE con.contype IN ('p', 'f', 'u', 'c')
          AND n.nspname %s
        ORDER BY n.nspname, cl.relname, con.conname
    """.formatted(USER_SCHEMA_FILTER.formatted("n.nspname", "n.nspname"));

    private static final String SQL_VIEWS = """
        SELECT
            v.table_schema,
            v.table_name,
            v.view_definition,
            obj_description((quote_ident(v.table_schema) || '.' || quote_ident(v.table_name))::regclass,
                'pg_class') AS view_comment
        FROM information_schema.views v
        WHERE v.table_schema %s
        ORDER BY v.table_schema, v.table_name
    """.formatted(USER_SCHEMA_FILTER.formatted("v.table_schema", "v.table_schema"));

    private static final String SQL_VIEW_COLUMNS = """
        SELECT table_schema, table_name, column_name, data_type, udt_name, is_nullable,
               character_maximum_length, numeric_precision, numeric_scale, ordinal_position
        FROM information_schema.columns
        WHERE (table_schema, table_name) IN (
            SELECT table_schema, table_name FROM information_schema.views WHERE table_schema %s)
        ORDER BY table_schema, table_name, ordinal_position
    """.formatted(USER_SCHEMA_FILTER.formatted("table_schema", "table_schema"));

    private static final String SQL_ROUTINES = """
        SELECT
            n.nspname AS routine_schema,
            p.proname AS routine_name,
            p.proname || '_' || p.oid AS specific_name,
            p.prokind AS kind,
            l.lanname AS language,
            pg_get_function_result(p.oid) AS return_type,
            CASE WHEN l.lanname IN ('sql', 'plpgsql') THEN pg_get_functiondef(p.oid) END AS definition,
            obj_description(p.oid, 'pg_proc') AS routine_comment
        FROM pg_proc p
        JOIN pg_namespace n ON n.oid = p.pronamespace
        JOIN pg_language l ON l.oid = p.prolang
        WHERE p.prokind IN ('f', 'p')
          AND n.nspname %s
        ORDER BY n.nspname, p.proname, p.oid
    """.formatted(USER_SCHEMA_FILTER.formatted("n.nspname", "n.nspname"));

    private static final String SQL_ROUTINE_PARAMETERS = """
        SELECT specific_schema, specific_name, parameter_name, parameter_mode, data_type,
               parameter_default, ordinal_position
        FROM information_schema.parameters
        WHERE specific_schema %s
        ORDER BY specific_schema, specific_name, ordinal_position
    """.formatted(USER_SCHEMA_FILTER.formatted("specific_schema", "specific_schema"));

    private static final String SQL_TRIGGERS = """
        SELECT
            trigger_schema,
            trigger_name,
            event_object_schema,
            event_object_table,
            event_manipulation,
            action_timing,
            action_statement
        FROM information_schema.triggers
        WHERE trigger_schema %s
        ORDER BY trigger_schema, event_object_table, trigger_name, event_manipulation
    """.formatted(USER_SCHEMA_FILTER.formatted("trigger_schema", "trigger_schema"));

    private static final String SQL_CUSTOM_TYPES = """
        SELECT
            n.nspname AS type_schema,
            t.typname AS type_name,
            t.typtype AS type_kind,
            CASE t.typtype
                WHEN 'e' THEN (SELECT string_agg(quote_literal(e.enumlabel), ', ' ORDER BY e.enumsortorder)
                               FROM pg_enum e WHERE e.enumtypid = t.oid)
                WHEN 'd' THEN format_type(t.typbasetype, t.typtypmod)
                WHEN 'r' THEN (SELECT format_type(r.rngsubtype, NULL) FROM pg_range r WHERE r.rngtypid = t.oid)
                WHEN 'c' THEN (SELECT string_agg(a.attname || ' ' || format_type(a.atttypid, a.atttypmod), ', '
                                                 ORDER BY a.attnum)
                               FROM pg_attribute a WHERE a.attrelid = t.typrelid AND a.attnum > 0)
            END AS definition
        FROM pg_type t
        JOIN pg_namespace n ON n.oid = t.typnamespace
        WHERE t.typtype IN ('e', 'd', 'r', 'c')
          AND (t.typtype <> 'c' OR (SELECT c.relkind FROM pg_class c WHERE c.oid = t.typrelid) = 'c')
          AND n.nspname %s
        ORDER BY n.nspname, t.typname
    """.formatted(USER_SCHEMA_FILTER.formatted("n.nspname", "n.nspname"));

    private static final String SQL_SERVER_INFO = """
        SELECT
            current_setting('server_version') AS version,
            current_user AS connection_user,
            COALESCE((SELECT rolsuper FROM pg_roles WHERE rolname = current_user), false) AS superuser
    """;

    private final JdbcDataSourceFactory dataSourceFactory;
    private final TypeMapper typeMapper = TypeMappers.forEngine(DatabaseType.POSTGRESQL);

    /**
     * Constructor.
     *
     * @param dataSource Pool owned by this adapter
     * @param connectionConfig Connection configuration
     * @param collectionConfig Collection configuration
     * @param samplingExecutor Sampling executor
     * @param dataSourceFactory Factory used to open pools on other databases
     */
    public PostgresEngineAdapter(HikariDataSource dataSource, ConnectionConfig connectionConfig,
                                 CollectionConfig collectionConfig, SamplingExecutor samplingExecutor,
                                 JdbcDataSourceFactory dataSourceFactory) {
        super(dataSource, connectionConfig, collectionConfig, SqlDialect.POSTGRESQL, samplingExecutor);
        this.dataSourceFactory = dataSourceFactory;
    }

    @Override
    public DatabaseType databaseType() {
        return DatabaseType.POSTGRESQL;
    }

    @Override
    public List<DatabaseInfo> enumerateDatabases(boolean includeSystem) {
        return executeQuery("listDatabases", jdbc -> jdbc.query(SQL_LIST_DATABASES, (rs, rowNum) -> {
            boolean canConnect = rs.getBoolean("can_connect");
            return DatabaseInfo.builder()
                    .name(rs.getString("name"))
                    .owner(rs.getString("owner"))
                    .encoding(rs.getString("encoding"))
                    .collation(rs.getString("collation"))
                    .sizeBytes(getLong(rs, "size_bytes"))
                    .systemDatabase(rs.getBoolean("is_template"))
                    .accessLevel(canConnect ? AccessLevel.FULL : AccessLevel.NONE)
                    .build();
        })).stream()
                .filter(db -> includeSystem || !db.isSystemDatabase())
                .toList();
    }

    @Override
    public EngineAdapter<JdbcTemplate> reconnect(String databaseName) {
        ConnectionConfig target = connectionConfig.withDatabase(databaseName);
        HikariDataSource pool = dataSourceFactory.reconnect(DatabaseType.POSTGRESQL, target, (HikariDataSource) dataSource);
        return new PostgresEngineAdapter(pool, target, collectionConfig, samplingExecutor, dataSourceFactory);
    }

    @Override
    public ServerInfo describeServer() {
        return executeQuery("describeServer", jdbc -> jdbc.queryForObject(SQL_SERVER_INFO, (rs, rowNum) ->
                ServerInfo.builder()
                        .serverType(DatabaseType.POSTGRESQL)
                        .version(rs.getString("version"))
                        .host(connectionConfig.getHost())
                        .port(connectionConfig.portOr(5432))
                        .connectionUser(rs.getString("connection_user"))
                        .superuser(rs.getBoolean("superuser"))
                        .build()));
    }

    @Override
    protected DatabaseInfo describeDatabase() {
        String version = executeQuery("serverVersion",
                jdbc -> jdbc.queryForObject("SHOW server_version", String.class));
        return executeQuery("describeDatabase", jdbc -> jdbc.queryForObject(SQL_DESCRIBE_DATABASE, (rs, rowNum) ->
                DatabaseInfo.builder()
                        .name(rs.getString("name"))
                        .version(version)
                        .owner(rs.getString("owner"))
                        .encoding(rs.getString("encoding"))
                        .collation(rs.getString("collation"))
                        .sizeBytes(getLong(rs, "size_bytes"))
                        .build()));
    }

    @Override
    protected List<Table> loadTables() {
        Map<String, Table> tables = new LinkedHashMap<>();
        executeQuery("loadTables", jdbc -> {
            jdbc.query(SQL_TABLES, rs -> {
                Table table = Table.builder()
                        .schema(rs.getString("table_schema"))
                        .name(rs.getString("table_name"))
                        .comment(rs.getString("table_comment"))
                        .rowCount(getLong(rs, "row_estimate"))
                        .build();
                tables.put(tableKey(table.getSchema(), table.getName()), table);
            });
            jdbc.query(SQL_COLUMNS, rs -> {
                Table table = tables.get(tableKey(rs.getString("table_schema"), rs.getString("table_name")));
                if (table != null) {
                    table.getColumns().add(mapColumn(rs));
                }
            });
            jdbc.query(SQL_PRIMARY_KEYS, rs -> {
                Table table = tables.get(tableKey(rs.getString("table_schema"), rs.getString("table_name")));
                if (table == null) {
                    return;
                }
                if (table.getPrimaryKey() == null) {
                    table.setPrimaryKey(PrimaryKey.builder().name(rs.getString("constraint_name")).build());
                }
                String column = rs.getString("column_name");
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
                Table table = tablesByKey.get(tableKey(rs.getString("table_schema"), rs.getString("table_name")));
                if (table == null) {
                    return;
                }
                String name = rs.getString("constraint_name");
                ForeignKey fk = table.getForeignKeys().stream()
                        .filter(existing -> name.equals(existing.getName()))
                        .findFirst()
                        .orElseGet(() -> {
                            ForeignKey created = ForeignKey.builder().name(name).build();
                            table.getForeignKeys().add(created);
                            return created;
                        });
                fk.setReferencedSchema(rs.getString("referenced_schema"));
                fk.setReferencedTable(rs.getString("referenced_table"));
                fk.setOnUpdate(ReferentialAction.fromPostgresCode(rs.getString("update_rule")));
                fk.setOnDelete(ReferentialAction.fromPostgresCode(rs.getString("delete_rule")));
                fk.getColumns().add(rs.getString("column_name"));
                fk.getReferencedColumns().add(rs.getString("referenced_column"));
            });
            return null;
        });
    }

    @Override
    protected List<Index> loadIndexes() {
        Map<String, Index> indexes = new LinkedHashMap<>();
        executeQuery("loadIndexes", jdbc -> {
            jdbc.query(SQL_INDEXES, rs -> {
                String schema = rs.getString("table_schema");
                String indexName = rs.getString("index_name");
                Index index = indexes.get(tableKey(schema, indexName));
                if (index == null) {
                    index = Index.builder()
                            .schema(schema)
                            .tableName(rs.getString("table_name"))
                            .name(indexName)
                            .unique(rs.getBoolean("is_unique"))
                            .primary(rs.getBoolean("is_primary"))
                            .indexType(rs.getString("index_type"))
                            .build();
                    indexes.put(tableKey(schema, indexName), index);
                }
                String column = rs.getString("column_name");
                index.getColumns().add(IndexColumn.builder()
                        // expression indexes have no attribute name
                        .name(column != null ? column : "(expression)")
                        .sortOrder(rs.getBoolean("is_desc") ? SortOrder.DESCENDING : SortOrder.ASCENDING)
                        .build());
            });
            return null;
        });
        return new ArrayList<>(indexes.values());
    }

    @Override
    protected List<Constraint> loadConstraints() {
        return executeQuery("loadConstraints", jdbc -> jdbc.query(SQL_CONSTRAINTS, (rs, rowNum) -> {
            String type = rs.getString("constraint_type");
            String columns = rs.getString("column_names");
            return Constraint.builder()
                    .schema(rs.getString("table_schema"))
                    .tableName(rs.getString("table_name"))
                    .name(rs.getString("constraint_name"))
                    .constraintType(switch (type) {
                        case "p" -> ConstraintType.PRIMARY_KEY;
                        case "f" -> ConstraintType.FOREIGN_KEY;
                        case "u" -> ConstraintType.UNIQUE;
                        default -> ConstraintType.CHECK;
                    })
                    .columns(columns == null || columns.isEmpty()
                            ? new ArrayList<>()
                            : new ArrayList<>(List.of(columns.split(","))))
                    .checkClause("c".equals(type) ? rs.getString("definition") : null)
                    .build();
        }));
    }

    @Override
    protected List<View> loadViews() {
        Map<String, View> views = new LinkedHashMap<>();
        executeQuery("loadViews", jdbc -> {
            jdbc.query(SQL_VIEWS, rs -> {
                View view = View.builder()
                        .schema(rs.getString("table_schema"))
                        .name(rs.getString("table_name"))
                        .definition(rs.getString("view_definition"))
                        .comment(rs.getString("view_comment"))
                        .build();
                views.put(tableKey(view.getSchema(), view.getName()), view);
            });
            jdbc.query(SQL_VIEW_COLUMNS, rs -> {
                View view = views.get(tableKey(rs.getString("table_schema"), rs.getString("table_name")));
                if (view != null) {
                    view.getColumns().add(mapColumn(rs));
                }
            });
            return null;
        });
        return new ArrayList<>(views.values());
    }

    @Override
    protected List<Routine> loadRoutines() {
        Map<String, Routine> routines = new LinkedHashMap<>();
        executeQuery("loadRoutines", jdbc -> {
            jdbc.query(SQL_ROUTINES, rs -> {
                Routine routine = Routine.builder()
                        .schema(rs.getString("routine_schema"))
                        .name(rs.getString("routine_name"))
                        .kind("p".equals(rs.getString("kind")) ? RoutineKind.PROCEDURE : RoutineKind.FUNCTION)
                        .language(rs.getString("language"))
                        .returnType(rs.getString("return_type"))
                        .definition(rs.getString("definition"))
                        .comment(rs.getString("routine_comment"))
                        .build();
                routines.put(tableKey(routine.getSchema(), rs.getString("specific_name")), routine);
            });
            jdbc.query(SQL_ROUTINE_PARAMETERS, rs -> {
                Routine routine = routines.get(tableKey(rs.getString("specific_schema"), rs.getString("specific_name")));
                if (routine != null) {
                    routine.getParameters().add(Parameter.builder()
                            .name(rs.getString("parameter_name"))
                            .direction(ParameterDirection.fromMode(rs.getString("parameter_mode")))
                            .dataType(rs.getString("data_type"))
                            .defaultValue(rs.getString("parameter_default"))
                            .build());
                }
            });
            return null;
        });
        return new ArrayList<>(routines.values());
    }

    @Override
    protected List<Trigger> loadTriggers() {
        // information_schema lists one row per event; each becomes its own entry
        return executeQuery("loadTriggers", jdbc -> jdbc.query(SQL_TRIGGERS, (rs, rowNum) -> Trigger.builder()
                .schema(rs.getString("event_object_schema"))
                .tableName(rs.getString("event_object_table"))
                .name(rs.getString("trigger_name"))
                .event(TriggerEvent.valueOf(rs.getString("event_manipulation").toUpperCase(Locale.ROOT)))
                .timing(mapTiming(rs.getString("action_timing")))
                .definition(rs.getString("action_statement"))
                .build()));
    }

    @Override
    protected List<CustomType> loadCustomTypes() {
        return executeQuery("loadCustomTypes", jdbc -> jdbc.query(SQL_CUSTOM_TYPES, (rs, rowNum) -> CustomType.builder()
                .schema(rs.getString("type_schema"))
                .name(rs.getString("type_name"))
                .category(switch (rs.getString("type_kind")) {
                    case "e" -> CustomTypeCategory.ENUM;
                    case "d" -> CustomTypeCategory.DOMAIN;
                    case "r" -> CustomTypeCategory.RANGE;
                    default -> CustomTypeCategory.COMPOSITE;
                })
                .definition(rs.getString("definition"))
                .build()));
    }

    private Column mapColumn(ResultSet rs) throws SQLException {
        String dataType = rs.getString("data_type");
        String udtName = rs.getString("udt_name");
        NativeType nativeType = NativeType.builder()
                .typeName(dataType)
                .udtName(udtName)
                .maxLength(getInteger(rs, "character_maximum_length"))
                .precision(getInteger(rs, "numeric_precision"))
                .scale(getInteger(rs, "numeric_scale"))
                .build();
        String defaultValue = hasColumn(rs, "column_default") ? rs.getString("column_default") : null;
        boolean identity = hasColumn(rs, "is_identity") && "YES".equalsIgnoreCase(rs.getString("is_identity"));
        return Column.builder()
                .name(rs.getString("column_name"))
                .dataType(typeMapper.map(nativeType))
                .nativeType("USER-DEFINED".equalsIgnoreCase(dataType) || "ARRAY".equalsIgnoreCase(dataType)
                        ? udtName : dataType)
                .nullable("YES".equalsIgnoreCase(rs.getString("is_nullable")))
                .defaultValue(defaultValue)
                .autoIncrement(identity || (defaultValue != null && defaultValue.startsWith("nextval(")))
                .comment(hasColumn(rs, "column_comment") ? rs.getString("column_comment") : null)
                .ordinalPosition(rs.getInt("ordinal_position"))
                .build();
    }

    private static boolean hasColumn(ResultSet rs, String column) throws SQLException {
        for (int i = 1; i <= rs.getMetaData().getColumnCount(); i++) {
            if (column.equalsIgnoreCase(rs.getMetaData().getColumnLabel(i))) {
                return true;
            }
        }
        return false;
    }

    private static TriggerTiming mapTiming(String timing) {
        return "INSTEAD OF".equalsIgnoreCase(timing) ? TriggerTiming.INSTEAD_OF : TriggerTiming.valueOf(timing.toUpperCase(Locale.ROOT));
    }
}
