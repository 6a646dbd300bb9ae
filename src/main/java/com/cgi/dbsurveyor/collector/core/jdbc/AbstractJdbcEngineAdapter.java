package com.cgi.dbsurveyor.collector.core.jdbc;

import com.cgi.dbsurveyor.collector.config.CollectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionConfig;
import com.cgi.dbsurveyor.collector.config.SamplingConfig;
import com.cgi.dbsurveyor.collector.core.adapter.AdapterFeature;
import com.cgi.dbsurveyor.collector.core.adapter.EngineAdapter;
import com.cgi.dbsurveyor.collector.core.security.CredentialSanitizer;
import com.cgi.dbsurveyor.collector.exception.BaseException;
import com.cgi.dbsurveyor.collector.model.CollectionMetadata;
import com.cgi.dbsurveyor.collector.model.CollectionStatus;
import com.cgi.dbsurveyor.collector.model.Constraint;
import com.cgi.dbsurveyor.collector.model.CustomType;
import com.cgi.dbsurveyor.collector.model.DatabaseInfo;
import com.cgi.dbsurveyor.collector.model.DatabaseSchema;
import com.cgi.dbsurveyor.collector.model.DatabaseType;
import com.cgi.dbsurveyor.collector.model.Index;
import com.cgi.dbsurveyor.collector.model.Routine;
import com.cgi.dbsurveyor.collector.model.RoutineKind;
import com.cgi.dbsurveyor.collector.model.Table;
import com.cgi.dbsurveyor.collector.model.TableSample;
import com.cgi.dbsurveyor.collector.model.Trigger;
import com.cgi.dbsurveyor.collector.model.View;
import com.cgi.dbsurveyor.collector.service.sampling.SamplingExecutor;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.util.StopWatch;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Base class for JDBC engine adapters.
 * Owns the adapter's pool, runs catalog queries with standardized error
 * translation and assembles the schema, degrading to a PARTIAL status when
 * individual object classes cannot be read.
 */
public abstract class AbstractJdbcEngineAdapter implements EngineAdapter<JdbcTemplate> {

    /**
     * The JDBC template used for catalog queries.
     */
    protected final JdbcTemplate jdbcTemplate;

    /**
     * The pool owned by this adapter.
     */
    protected final DataSource dataSource;

    protected final ConnectionConfig connectionConfig;

    protected final CollectionConfig collectionConfig;

    protected final SqlDialect dialect;

    protected final SamplingExecutor samplingExecutor;

    /**
     * Logger for this class.
     */
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    /**
     * Constructor.
     *
     * @param dataSource Pool, owned by the adapter from now on
     * @param connectionConfig Connection configuration
     * @param collectionConfig Collection configuration
     * @param dialect SQL dialect
     * @param samplingExecutor Sampling executor
     */
    protected AbstractJdbcEngineAdapter(DataSource dataSource, ConnectionConfig connectionConfig,
                                        CollectionConfig collectionConfig, SqlDialect dialect,
                                        SamplingExecutor samplingExecutor) {
        this.dataSource = dataSource;
        this.connectionConfig = connectionConfig;
        this.collectionConfig = collectionConfig;
        this.dialect = dialect;
        this.samplingExecutor = samplingExecutor;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.jdbcTemplate.setQueryTimeout((int) Math.max(1, connectionConfig.getQueryTimeout().toSeconds()));
        this.jdbcTemplate.setFetchSize(1000);
    }

    @Override
    public JdbcTemplate connection() {
        return jdbcTemplate;
    }

    @Override
    public Set<AdapterFeature> features() {
        return Collections.unmodifiableSet(EnumSet.allOf(AdapterFeature.class));
    }

    @Override
    public void ping() {
        executeQuery("ping", jdbc -> jdbc.queryForObject("SELECT 1", Integer.class));
    }

    @Override
    public DatabaseSchema extractSchema() {
        StopWatch watch = new StopWatch(databaseType().getId() + " schema");
        Instant startedAt = Instant.now();
        List<String> errors = new ArrayList<>();

        watch.start("database");
        DatabaseInfo info = collectPartial(errors, "database info", this::describeDatabase,
                DatabaseInfo.builder().name(connectionConfig.getDatabase()).build());
        watch.stop();

        watch.start("tables");
        List<Table> tables = extractTables();
        Map<String, Table> tablesByKey = new LinkedHashMap<>();
        tables.forEach(table -> tablesByKey.put(tableKey(table.getSchema(), table.getName()), table));
        watch.stop();

        watch.start("relations");
        runPartial(errors, "foreign keys", () -> loadForeignKeys(tablesByKey));
        List<Index> indexes = collectionConfig.isIncludeIndexes()
                ? collectPartial(errors, "indexes", this::loadIndexes, List.of())
                : List.of();
        List<Constraint> constraints = collectionConfig.isIncludeConstraints()
                ? collectPartial(errors, "constraints", this::loadConstraints, List.of())
                : List.of();
        attach(tablesByKey, indexes, constraints);
        watch.stop();

        watch.start("objects");
        List<View> views = collectionConfig.isIncludeViews()
                ? collectPartial(errors, "views", this::loadViews, List.of())
                : List.of();
        List<Routine> routines = collectionConfig.isIncludeRoutines()
                ? collectPartial(errors, "routines", this::loadRoutines, List.of())
                : List.of();
        List<Trigger> triggers = collectionConfig.isIncludeTriggers()
                ? collectPartial(errors, "triggers", this::loadTriggers, List.of())
                : List.of();
        List<CustomType> customTypes = collectionConfig.isIncludeCustomTypes()
                ? collectPartial(errors, "custom types", this::loadCustomTypes, List.of())
                : List.of();
        watch.stop();

        info.setCollectionStatus(CollectionStatus.partial(errors));
        logger.info("Collected schema of {}: {} tables, {} views, {} routines in {} ms{}",
                info.getName(), tables.size(), views.size(), routines.size(), watch.getTotalTimeMillis(),
                errors.isEmpty() ? "" : " (" + errors.size() + " object classes unavailable)");
        logger.debug(watch.prettyPrint());

        return DatabaseSchema.builder()
                .databaseInfo(info)
                .tables(tables)
                .views(views)
                .indexes(indexes)
                .constraints(constraints)
                .procedures(routines.stream().filter(r -> r.getKind() == RoutineKind.PROCEDURE).toList())
                .functions(routines.stream().filter(r -> r.getKind() != RoutineKind.PROCEDURE).toList())
                .triggers(triggers)
                .customTypes(customTypes)
                .collectionMetadata(CollectionMetadata.builder()
                        .collectedAt(startedAt)
                        .collectionDurationMs(watch.getTotalTimeMillis())
                        .warnings(List.copyOf(errors))
                        .build())
                .build();
    }

    @Override
    public List<Table> extractTables() {
        List<Table> tables = new ArrayList<>(loadTables());
        tables.sort(Comparator.comparing((Table t) -> t.getSchema() == null ? "" : t.getSchema())
                .thenComparing(Table::getName));
        return tables;
    }

    @Override
    public List<TableSample> sampleTables(List<Table> tables, SamplingConfig config) {
        return samplingExecutor.sampleAll(new JdbcSampleSource(dataSource, dialect), tables, config);
    }

    @Override
    public void close() {
        if (dataSource instanceof HikariDataSource) {
            HikariDataSource pool = (HikariDataSource) dataSource;
            if (!pool.isClosed()) {
                logger.debug("Closing pool {}", pool.getPoolName());
                pool.close();
            }
        }
    }

    /**
     * Describes the connected database.
     *
     * @return Database information
     */
    protected abstract DatabaseInfo describeDatabase();

    /**
     * Loads tables with columns and primary keys.
     *
     * @return Tables
     */
    protected abstract List<Table> loadTables();

    /**
     * Loads foreign keys and adds them to their tables.
     *
     * @param tablesByKey Tables keyed by {@link #tableKey(String, String)}
     */
    protected abstract void loadForeignKeys(Map<String, Table> tablesByKey);

    protected abstract List<Index> loadIndexes();

    protected abstract List<Constraint> loadConstraints();

    protected abstract List<View> loadViews();

    protected List<Routine> loadRoutines() {
        return List.of();
    }

    protected abstract List<Trigger> loadTriggers();

    protected List<CustomType> loadCustomTypes() {
        return List.of();
    }

    /**
     * Executes a query with standardized error handling.
     *
     * @param operationName Operation name for logging
     * @param query Function that executes the query
     * @return Query result
     * @throws BaseException Translated failure
     */
    protected <T> T executeQuery(String operationName, Function<JdbcTemplate, T> query) {
        try {
            logger.debug("Executing operation: {}", operationName);
            T result = query.apply(jdbcTemplate);
            logger.debug("Operation completed successfully: {}", operationName);
            return result;
        } catch (DataAccessException e) {
            BaseException translated = JdbcErrorTranslator.translate(operationName, e);
            logger.debug("Database error executing {}: {}", operationName, translated.getMessage());
            throw translated;
        }
    }

    /**
     * Key identifying a table across schemas.
     *
     * @param schema Schema, may be null
     * @param table Table name
     * @return Key
     */
    protected static String tableKey(String schema, String table) {
        return (schema == null ? "" : schema) + "\u0000" + table;
    }

    /**
     * Reads a nullable long column.
     */
    protected static Long getLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    /**
     * Reads a nullable int column.
     */
    protected static Integer getInteger(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private <T> T collectPartial(List<String> errors, String objectClass, Supplier<T> loader, T fallback) {
        try {
            return loader.get();
        } catch (BaseException e) {
            recordPartial(errors, objectClass, e);
        } catch (RuntimeException e) {
            recordPartial(errors, objectClass, JdbcErrorTranslator.translate(objectClass, e));
        }
        return fallback;
    }

    private void runPartial(List<String> errors, String objectClass, Runnable loader) {
        collectPartial(errors, objectClass, () -> {
            loader.run();
            return Boolean.TRUE;
        }, Boolean.FALSE);
    }

    private void recordPartial(List<String> errors, String objectClass, BaseException e) {
        String message = objectClass + ": " + e.getMessage();
        logger.warn("Could not collect {} [{}]: {}", objectClass, e.getErrorCode(),
                CredentialSanitizer.sanitize(e.getMessage()));
        errors.add(message);
    }

    private static void attach(Map<String, Table> tablesByKey, List<Index> indexes, List<Constraint> constraints) {
        for (Index index : indexes) {
            Table table = tablesByKey.get(tableKey(index.getSchema(), index.getTableName()));
            if (table != null) {
                table.getIndexes().add(index);
            }
        }
        for (Constraint constraint : constraints) {
            Table table = tablesByKey.get(tableKey(constraint.getSchema(), constraint.getTableName()));
            if (table != null) {
                table.getConstraints().add(constraint);
            }
        }
    }
}
