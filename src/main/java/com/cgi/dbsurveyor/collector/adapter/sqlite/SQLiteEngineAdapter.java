package com.cgi.dbsurveyor.collector.adapter.sqlite;

import com.cgi.dbsurveyor.collector.config.CollectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionConfig;
import com.cgi.dbsurveyor.collector.core.adapter.AdapterFeature;
import com.cgi.dbsurveyor.collector.core.adapter.EngineAdapter;
import com.cgi.dbsurveyor.collector.core.jdbc.AbstractJdbcEngineAdapter;
import com.cgi.dbsurveyor.collector.core.jdbc.SqlDialect;
import com.cgi.dbsurveyor.collector.core.type.NativeType;
import com.cgi.dbsurveyor.collector.core.type.TypeMapper;
import com.cgi.dbsurveyor.collector.core.type.TypeMappers;
import com.cgi.dbsurveyor.collector.exception.InvalidConnectionTargetException;
import com.cgi.dbsurveyor.collector.model.AccessLevel;
import com.cgi.dbsurveyor.collector.model.Column;
import com.cgi.dbsurveyor.collector.model.Constraint;
import com.cgi.dbsurveyor.collector.model.ConstraintType;
import com.cgi.dbsurveyor.collector.model.DatabaseInfo;
import com.cgi.dbsurveyor.collector.model.DatabaseType;
import com.cgi.dbsurveyor.collector.model.ForeignKey;
import com.cgi.dbsurveyor.collector.model.Index;
import com.cgi.dbsurveyor.collector.model.IndexColumn;
import com.cgi.dbsurveyor.collector.model.PrimaryKey;
import com.cgi.dbsurveyor.collector.model.ReferentialAction;
import com.cgi.dbsurveyor.collector.model.ServerInfo;
import com.cgi.dbsurveyor.collector.model.SortOrder;
import com.cgi.dbsurveyor.collector.model.Table;
import com.cgi.dbsurveyor.collector.model.Trigger;
import com.cgi.dbsurveyor.collector.model.TriggerEvent;
import com.cgi.dbsurveyor.collector.model.TriggerTiming;
import com.cgi.dbsurveyor.collector.model.View;
import com.cgi.dbsurveyor.collector.service.sampling.SamplingExecutor;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SQLite adapter reading sqlite_master and the table PRAGMAs.
 * A file holds exactly one database, reported as "main".
 */
public class SQLiteEngineAdapter extends AbstractJdbcEngineAdapter {

    static final String MAIN_DATABASE = "main";

    private static final String SQL_TABLES = """
        SELECT name FROM sqlite_master
        WHERE type = 'table' AND name NOT LIKE 'sqlite_%'
        ORDER BY name
    """;

    private static final String SQL_VIEWS = """
        SELECT name, sql FROM sqlite_master
        WHERE type = 'view'
        ORDER BY name
    """;

    private static final String SQL_TRIGGERS = """
        SELECT name, tbl_name, sql FROM sqlite_master
        WHERE type = 'trigger'
        ORDER BY tbl_name, name
    """;

    private static final Pattern TRIGGER_HEADER = Pattern.compile(
            "\\bTRIGGER\\b.*?\\b(BEFORE|AFTER|INSTEAD\\s+OF)?\\s*\\b(INSERT|UPDATE|DELETE)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern CHECK_CLAUSE = Pattern.compile(
            "\\bCHECK\\s*\\(", Pattern.CASE_INSENSITIVE);

    private final TypeMapper typeMapper = TypeMappers.forEngine(DatabaseType.SQLITE);

    /**
     * Opens another data source on the same file.
     */
    private final Supplier<DataSource> dataSourceSupplier;

    /**
     * Constructor.
     *
     * @param dataSource Data source on the database file, owned by this adapter
     * @param connectionConfig Connection configuration; the host holds the file path
     * @param collectionConfig Collection configuration
     * @param samplingExecutor Sampling executor
     * @param dataSourceSupplier Opens another data source on the same file
     */
    public SQLiteEngineAdapter(DataSource dataSource, ConnectionConfig connectionConfig,
                               CollectionConfig collectionConfig, SamplingExecutor samplingExecutor,
                               Supplier<DataSource> dataSourceSupplier) {
        super(dataSource, connectionConfig, collectionConfig, SqlDialect.SQLITE, samplingExecutor);
        this.dataSourceSupplier = dataSourceSupplier;
    }

    @Override
    public DatabaseType databaseType() {
        return DatabaseType.SQLITE;
    }

    @Override
    public Set<AdapterFeature> features() {
        Set<AdapterFeature> features = EnumSet.allOf(AdapterFeature.class);
        features.remove(AdapterFeature.MULTI_DATABASE);
        features.remove(AdapterFeature.CONNECTION_POOLING);
        return Collections.unmodifiableSet(features);
    }

    @Override
    public List<DatabaseInfo> enumerateDatabases(boolean includeSystem) {
        return List.of(describeDatabase());
    }

    /**
     * Only "main" is reachable; the new adapter opens the same file again.
     */
    @Override
    public EngineAdapter<JdbcTemplate> reconnect(String databaseName) {
        if (!MAIN_DATABASE.equals(databaseName)) {
            throw new InvalidConnectionTargetException("SQLite files contain a single database named main");
        }
        return new SQLiteEngineAdapter(dataSourceSupplier.get(), connectionConfig, collectionConfig,
                samplingExecutor, dataSourceSupplier);
    }

    @Override
    public ServerInfo describeServer() {
        return ServerInfo.builder()
                .serverType(DatabaseType.SQLITE)
                .version(sqliteVersion())
                .host(connectionConfig.getHost())
                .totalDatabases(1)
                .build();
    }

    @Override
    protected DatabaseInfo describeDatabase() {
        Long pageCount = executeQuery("pageCount", jdbc -> jdbc.queryForObject("PRAGMA page_count", Long.class));
        Long pageSize = executeQuery("pageSize", jdbc -> jdbc.queryForObject("PRAGMA page_size", Long.class));
        String encoding = executeQuery("encoding", jdbc -> jdbc.queryForObject("PRAGMA encoding", String.class));
        return DatabaseInfo.builder()
                .name(MAIN_DATABASE)
                .version(sqliteVersion())
                .encoding(encoding)
                .sizeBytes(pageCount != null && pageSize != null ? pageCount * pageSize : null)
                .accessLevel(AccessLevel.FULL)
                .build();
    }

    @Override
    protected List<Table> loadTables() {
        List<String> names = executeQuery("loadTables", jdbc -> jdbc.queryForList(SQL_TABLES, String.class));
        List<Table> tables = new ArrayList<>(names.size());
        for (String name : names) {
            Table table = Table.builder().name(name).build();
            Map<Integer, String> pkColumns = new TreeMap<>();
            executeQuery("loadColumns", jdbc -> {
                jdbc.query("PRAGMA table_info(" + dialect.quoteIdentifier(name) + ")", rs -> {
                    String declared = rs.getString("type");
                    int pkPosition = rs.getInt("pk");
                    String columnName = rs.getString("name");
                    if (pkPosition > 0) {
                        pkColumns.put(pkPosition, columnName);
                    }
                    table.getColumns().add(Column.builder()
                            .name(columnName)
                            .dataType(typeMapper.map(NativeType.of(declared)))
                            .nativeType(declared)
                            .nullable(rs.getInt("notnull") == 0 && pkPosition == 0)
                            .defaultValue(rs.getString("dflt_value"))
                            .primaryKey(pkPosition > 0)
                            .ordinalPosition(rs.getInt("cid") + 1)
                            .build());
                });
                return null;
            });
            if (!pkColumns.isEmpty()) {
                table.setPrimaryKey(PrimaryKey.builder().columns(new ArrayList<>(pkColumns.values())).build());
                // A lone INTEGER PRIMARY KEY aliases the rowid and auto-increments
                if (pkColumns.size() == 1) {
                    table.findColumn(pkColumns.values().iterator().next())
                            .filter(c -> c.getNativeType() != null && "INTEGER".equalsIgnoreCase(c.getNativeType().trim()))
                            .ifPresent(c -> c.setAutoIncrement(true));
                }
            }
            tables.add(table);
        }
        return tables;
    }

    @Override
    protected void loadForeignKeys(Map<String, Table> tablesByKey) {
        for (Table table : tablesByKey.values()) {
            Map<Integer, ForeignKey> byId = new LinkedHashMap<>();
            executeQuery("loadForeignKeys", jdbc -> {
                jdbc.query("PRAGMA foreign_key_list(" + dialect.quoteIdentifier(table.getName()) + ")", rs -> {
                    int id = rs.getInt("id");
                    ForeignKey fk = byId.get(id);
                    if (fk == null) {
                        fk = ForeignKey.builder()
                                .referencedTable(rs.getString("table"))
                                .onUpdate(ReferentialAction.fromSql(rs.getString("on_update")))
                                .onDelete(ReferentialAction.fromSql(rs.getString("on_delete")))
                                .build();
                        byId.put(id, fk);
                    }
                    fk.getColumns().add(rs.getString("from"));
                    String to = rs.getString("to");
                    if (to != null) {
                        fk.getReferencedColumns().add(to);
                    }
                });
                return null;
            });
            table.getForeignKeys().addAll(byId.values());
        }
    }

    @Override
    protected List<Index> loadIndexes() {
        List<Index> indexes = new ArrayList<>();
        for (Table table : extractTableNames()) {
            List<Index> tableIndexes = executeQuery("loadIndexes", jdbc -> jdbc.query(
                    "PRAGMA index_list(" + dialect.quoteIdentifier(table.getName()) + ")", (rs, rowNum) -> Index.builder()
                            .tableName(table.getName())
                            .name(rs.getString("name"))
                            .unique(rs.getInt("unique") == 1)
                            .primary("pk".equals(rs.getString("origin")))
                            .indexType("btree")
                            .build()));
            for (Index index : tableIndexes) {
                executeQuery("loadIndexColumns", jdbc -> {
                    jdbc.query("PRAGMA index_xinfo(" + dialect.quoteIdentifier(index.getName()) + ")", rs -> {
                        if (rs.getInt("key") == 1) {
                            String column = rs.getString("name");
                            index.getColumns().add(IndexColumn.builder()
                                    .name(column != null ? column : "(expression)")
                                    .sortOrder(rs.getInt("desc") == 1 ? SortOrder.DESCENDING : SortOrder.ASCENDING)
                                    .build());
                        }
                    });
                    return null;
                });
            }
            indexes.addAll(tableIndexes);
        }
        return indexes;
    }

    /**
     * PRIMARY KEY, UNIQUE and FOREIGN KEY constraints come from the PRAGMAs;
     * CHECK constraints are only visible in the stored CREATE statement.
     */
    @Override
    protected List<Constraint> loadConstraints() {
        List<Constraint> constraints = new ArrayList<>();
        for (Table table : extractTables()) {
            if (table.hasPrimaryKey()) {
                constraints.add(Constraint.builder()
                        .tableName(table.getName())
                        .name(table.getName() + "_pk")
                        .constraintType(ConstraintType.PRIMARY_KEY)
                        .columns(new ArrayList<>(table.getPrimaryKey().getColumns()))
                        .build());
            }
            String ddl = executeQuery("loadTableSql", jdbc -> jdbc.queryForObject(
                    "SELECT sql FROM sqlite_master WHERE type = 'table' AND name = ?", String.class, table.getName()));
            int checkNumber = 0;
            for (String clause : checkClauses(ddl)) {
                constraints.add(Constraint.builder()
                        .tableName(table.getName())
                        .name(table.getName() + "_check_" + (++checkNumber))
                        .constraintType(ConstraintType.CHECK)
                        .checkClause(clause)
                        .build());
            }
        }
        for (Index index : loadIndexes()) {
            if (index.isUnique() && !index.isPrimary()) {
                constraints.add(Constraint.builder()
                        .tableName(index.getTableName())
                        .name(index.getName())
                        .constraintType(ConstraintType.UNIQUE)
                        .columns(new ArrayList<>(index.getColumns().stream().map(IndexColumn::getName).toList()))
                        .build());
            }
        }
        return constraints;
    }

    @Override
    protected List<View> loadViews() {
        return executeQuery("loadViews", jdbc -> jdbc.query(SQL_VIEWS, (rs, rowNum) -> View.builder()
                .name(rs.getString("name"))
                .definition(rs.getString("sql"))
                .build()));
    }

    @Override
    protected List<Trigger> loadTriggers() {
        return executeQuery("loadTriggers", jdbc -> jdbc.query(SQL_TRIGGERS, (rs, rowNum) -> {
            String sql = rs.getString("sql");
            TriggerTiming timing = TriggerTiming.BEFORE;
            TriggerEvent event = TriggerEvent.INSERT;
            Matcher matcher = TRIGGER_HEADER.matcher(sql == null ? "" : sql);
            if (matcher.find()) {
                String when = matcher.group(1);
                if (when != null) {
                    String normalized = when.toUpperCase(Locale.ROOT).replaceAll("\\s+", "_");
                    timing = TriggerTiming.valueOf(normalized);
                }
                event = TriggerEvent.valueOf(matcher.group(2).toUpperCase(Locale.ROOT));
            }
            return Trigger.builder()
                    .tableName(rs.getString("tbl_name"))
                    .name(rs.getString("name"))
                    .event(event)
                    .timing(timing)
                    .definition(sql)
                    .build();
        }));
    }

    private List<Table> extractTableNames() {
        return executeQuery("loadTables", jdbc -> jdbc.queryForList(SQL_TABLES, String.class)).stream()
                .map(name -> Table.builder().name(name).build())
                .toList();
    }

    private String sqliteVersion() {
        return executeQuery("version", jdbc -> jdbc.queryForObject("SELECT sqlite_version()", String.class));
    }

    /**
     * Extracts the bodies of CHECK (...) clauses, honoring nested parentheses.
     *
     * @param ddl CREATE TABLE statement
     * @return Clause bodies
     */
    static List<String> checkClauses(String ddl) {
        List<String> clauses = new ArrayList<>();
        if (ddl == null) {
            return clauses;
        }
        Matcher matcher = CHECK_CLAUSE.matcher(ddl);
        while (matcher.find()) {
            int depth = 1;
            int start = matcher.end();
            int i = start;
            while (i < ddl.length() && depth > 0) {
                char c = ddl.charAt(i);
                if (c == '(') {
                    depth++;
                } else if (c == ')') {
                    depth--;
                }
                i++;
            }
            if (depth == 0) {
                clauses.add(ddl.substring(start, i - 1).trim());
            }
        }
        return clauses;
    }
}
