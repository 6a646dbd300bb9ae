package com.cgi.dbsurveyor.collector.adapter.mongodb;

import com.cgi.dbsurveyor.collector.config.CollectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionConfig;
import com.cgi.dbsurveyor.collector.config.SamplingConfig;
import com.cgi.dbsurveyor.collector.core.adapter.AdapterFeature;
import com.cgi.dbsurveyor.collector.core.adapter.EngineAdapter;
import com.cgi.dbsurveyor.collector.exception.BaseException;
import com.cgi.dbsurveyor.collector.model.AccessLevel;
import com.cgi.dbsurveyor.collector.model.CollectionMetadata;
import com.cgi.dbsurveyor.collector.model.CollectionStatus;
import com.cgi.dbsurveyor.collector.model.DatabaseInfo;
import com.cgi.dbsurveyor.collector.model.DatabaseSchema;
import com.cgi.dbsurveyor.collector.model.DatabaseType;
import com.cgi.dbsurveyor.collector.model.Index;
import com.cgi.dbsurveyor.collector.model.IndexColumn;
import com.cgi.dbsurveyor.collector.model.PrimaryKey;
import com.cgi.dbsurveyor.collector.model.ServerInfo;
import com.cgi.dbsurveyor.collector.model.SortOrder;
import com.cgi.dbsurveyor.collector.model.Table;
import com.cgi.dbsurveyor.collector.model.TableSample;
import com.cgi.dbsurveyor.collector.model.View;
import com.cgi.dbsurveyor.collector.service.sampling.SamplingExecutor;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Aggregates;
import com.mongodb.client.model.EstimatedDocumentCountOptions;
import com.mongodb.client.model.Filters;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.util.StopWatch;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * MongoDB adapter. Collections are reported as tables whose columns are
 * inferred from a random sample of documents; _id is the primary key.
 */
@Slf4j
public class MongoEngineAdapter implements EngineAdapter<MongoDatabase> {

    /**
     * Documents read per collection to infer its fields.
     */
    static final int SCHEMA_SAMPLE_SIZE = 100;

    private static final Set<String> ADMIN_DATABASES = Set.of("admin", "config", "local");

    private final MongoClient client;
    private final MongoClientSettings settings;
    private final MongoDatabase database;
    private final ConnectionConfig connectionConfig;
    private final CollectionConfig collectionConfig;
    private final SamplingExecutor samplingExecutor;
    private final MongoSchemaInferrer schemaInferrer = new MongoSchemaInferrer();

    /**
     * Constructor.
     *
     * @param settings Client settings; a new client is created from them
     * @param connectionConfig Connection configuration
     * @param collectionConfig Collection configuration
     * @param samplingExecutor Sampling executor
     */
    public MongoEngineAdapter(MongoClientSettings settings, ConnectionConfig connectionConfig,
                              CollectionConfig collectionConfig, SamplingExecutor samplingExecutor) {
        this.settings = settings;
        this.client = MongoClients.create(settings);
        this.connectionConfig = connectionConfig;
        this.collectionConfig = collectionConfig;
        this.samplingExecutor = samplingExecutor;
        this.database = client.getDatabase(databaseName(connectionConfig));
    }

    @Override
    public MongoDatabase connection() {
        return database;
    }

    @Override
    public DatabaseType databaseType() {
        return DatabaseType.MONGODB;
    }

    @Override
    public Set<AdapterFeature> features() {
        return Collections.unmodifiableSet(EnumSet.allOf(AdapterFeature.class));
    }

    @Override
    public void ping() {
        execute("ping", () -> database.runCommand(new Document("ping", 1)));
    }

    @Override
    public List<DatabaseInfo> enumerateDatabases(boolean includeSystem) {
        return execute("listDatabases", () -> {
            List<DatabaseInfo> databases = new ArrayList<>();
            for (Document document : client.listDatabases().authorizedDatabasesOnly(true)) {
                String name = document.getString("name");
                boolean system = ADMIN_DATABASES.contains(name);
                if (system && !includeSystem) {
                    continue;
                }
                Number size = document.get("sizeOnDisk", Number.class);
                databases.add(DatabaseInfo.builder()
                        .name(name)
                        .sizeBytes(size == null ? null : size.longValue())
                        .systemDatabase(system)
                        .accessLevel(AccessLevel.FULL)
                        .build());
            }
            databases.sort((a, b) -> a.getName().compareTo(b.getName()));
            return databases;
        });
    }

    @Override
    public EngineAdapter<MongoDatabase> reconnect(String databaseName) {
        return new MongoEngineAdapter(settings, connectionConfig.withDatabase(databaseName), collectionConfig,
                samplingExecutor);
    }

    @Override
    public DatabaseSchema extractSchema() {
        StopWatch watch = new StopWatch("mongodb schema");
        watch.start();
        Instant startedAt = Instant.now();
        List<String> errors = new ArrayList<>();

        DatabaseInfo info = partial(errors, "database info", this::describeDatabase,
                DatabaseInfo.builder().name(database.getName()).build());
        List<Table> tables = extractTables();
        List<Index> indexes = collectionConfig.isIncludeIndexes()
                ? partial(errors, "indexes", () -> loadIndexes(tables), List.of())
                : List.of();
        List<View> views = collectionConfig.isIncludeViews()
                ? partial(errors, "views", this::loadViews, List.of())
                : List.of();
        watch.stop();

        info.setCollectionStatus(CollectionStatus.partial(errors));
        log.info("Collected schema of {}: {} collections, {} views in {} ms",
                info.getName(), tables.size(), views.size(), watch.getTotalTimeMillis());

        return DatabaseSchema.builder()
                .databaseInfo(info)
                .tables(tables)
                .views(views)
                .indexes(indexes)
                .collectionMetadata(CollectionMetadata.builder()
                        .collectedAt(startedAt)
                        .collectionDurationMs(watch.getTotalTimeMillis())
                        .warnings(List.copyOf(errors))
                        .build())
                .build();
    }

    @Override
    public List<Table> extractTables() {
        return execute("loadCollections", () -> {
            List<Table> tables = new ArrayList<>();
            for (String name : collectionNames("collection")) {
                MongoCollection<Document> collection = database.getCollection(name);
                List<Document> documents = collection.aggregate(List.of(Aggregates.sample(SCHEMA_SAMPLE_SIZE)))
                        .maxTime(connectionConfig.getQueryTimeout().toMillis(), TimeUnit.MILLISECONDS)
                        .into(new ArrayList<>());
                long estimate = collection.estimatedDocumentCount(new EstimatedDocumentCountOptions()
                        .maxTime(connectionConfig.getQueryTimeout().toMillis(), TimeUnit.MILLISECONDS));
                tables.add(Table.builder()
                        .name(name)
                        .columns(schemaInferrer.inferColumns(documents))
                        .primaryKey(PrimaryKey.builder().name("_id_").columns(new ArrayList<>(List.of("_id"))).build())
                        .rowCount(estimate)
                        .build());
            }
            return tables;
        });
    }

    @Override
    public List<TableSample> sampleTables(List<Table> tables, SamplingConfig config) {
        return samplingExecutor.sampleAll(new MongoSampleSource(database), tables, config);
    }

    @Override
    public ServerInfo describeServer() {
        return execute("describeServer", () -> {
            MongoDatabase admin = client.getDatabase("admin");
            Document buildInfo = admin.runCommand(new Document("buildInfo", 1));
            Document status = admin.runCommand(new Document("connectionStatus", 1));
            Document authInfo = status.get("authInfo", Document.class);
            String user = null;
            boolean superuser = false;
            if (authInfo != null) {
                List<Document> users = authInfo.getList("authenticatedUsers", Document.class, List.of());
                if (!users.isEmpty()) {
                    user = users.get(0).getString("user");
                }
                superuser = authInfo.getList("authenticatedUserRoles", Document.class, List.of()).stream()
                        .anyMatch(role -> "root".equals(role.getString("role")));
            }
            return ServerInfo.builder()
                    .serverType(DatabaseType.MONGODB)
                    .version(buildInfo.getString("version"))
                    .host(connectionConfig.getHost())
                    .port(connectionConfig.portOr(27017))
                    .connectionUser(user)
                    .superuser(superuser)
                    .build();
        });
    }

    @Override
    public void close() {
        client.close();
    }

    private DatabaseInfo describeDatabase() {
        return execute("describeDatabase", () -> {
            Document stats = database.runCommand(new Document("dbStats", 1));
            Number size = stats.get("storageSize", Number.class);
            String version = client.getDatabase("admin").runCommand(new Document("buildInfo", 1)).getString("version");
            return DatabaseInfo.builder()
                    .name(database.getName())
                    .version(version)
                    .sizeBytes(size == null ? null : size.longValue())
                    .systemDatabase(ADMIN_DATABASES.contains(database.getName()))
                    .build();
        });
    }

    private List<Index> loadIndexes(List<Table> tables) {
        return execute("loadIndexes", () -> {
            List<Index> indexes = new ArrayList<>();
            for (Table table : tables) {
                for (Document document : database.getCollection(table.getName()).listIndexes()) {
                    Document key = document.get("key", Document.class);
                    String indexType = "btree";
                    List<IndexColumn> columns = new ArrayList<>();
                    for (Map.Entry<String, Object> entry : key.entrySet()) {
                        Object direction = entry.getValue();
                        if (direction instanceof String) {
                            indexType = (String) direction;
                        }
                        columns.add(IndexColumn.builder()
                                .name(entry.getKey())
                                .sortOrder(direction instanceof Number && ((Number) direction).intValue() < 0
                                        ? SortOrder.DESCENDING
                                        : SortOrder.ASCENDING)
                                .build());
                    }
                    Index index = Index.builder()
                            .tableName(table.getName())
                            .name(document.getString("name"))
                            .columns(columns)
                            .unique(Boolean.TRUE.equals(document.getBoolean("unique")))
                            .primary("_id_".equals(document.getString("name")))
                            .indexType(indexType)
                            .build();
                    indexes.add(index);
                    table.getIndexes().add(index);
                }
            }
            return indexes;
        });
    }

    private List<View> loadViews() {
        return execute("loadViews", () -> {
            List<View> views = new ArrayList<>();
            for (Document document : database.listCollections().filter(Filters.eq("type", "view"))) {
                Document options = document.get("options", Document.class);
                views.add(View.builder()
                        .name(document.getString("name"))
                        .definition(options == null ? null : options.toJson())
                        .build());
            }
            views.sort((a, b) -> a.getName().compareTo(b.getName()));
            return views;
        });
    }

    private List<String> collectionNames(String type) {
        List<String> names = new ArrayList<>();
        for (Document document : database.listCollections().filter(Filters.eq("type", type))) {
            String name = document.getString("name");
            if (!name.startsWith("system.")) {
                names.add(name);
            }
        }
        Collections.sort(names);
        return names;
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            log.debug("Executing operation: {}", operation);
            return action.get();
        } catch (MongoException e) {
            throw MongoErrorTranslator.translate(operation, e);
        }
    }

    private <T> T partial(List<String> errors, String objectClass, Supplier<T> loader, T fallback) {
        try {
            return loader.get();
        } catch (BaseException e) {
            log.warn("Could not collect {} [{}]: {}", objectClass, e.getErrorCode(), e.getMessage());
            errors.add(objectClass + ": " + e.getMessage());
            return fallback;
        }
    }

    private static String databaseName(ConnectionConfig config) {
        return config.getDatabase() != null ? config.getDatabase() : "admin";
    }
}
