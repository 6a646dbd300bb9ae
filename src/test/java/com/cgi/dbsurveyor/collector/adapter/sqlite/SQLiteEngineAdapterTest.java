package com.cgi.dbsurveyor.collector.adapter.sqlite;

import com.cgi.dbsurveyor.collector.config.CollectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionSecret;
import com.cgi.dbsurveyor.collector.config.SamplingConfig;
import com.cgi.dbsurveyor.collector.core.adapter.AdapterFeature;
import com.cgi.dbsurveyor.collector.core.adapter.DatabaseAdapter;
import com.cgi.dbsurveyor.collector.core.jdbc.JdbcDataSourceFactory;
import com.cgi.dbsurveyor.collector.exception.ConnectionFailedException;
import com.cgi.dbsurveyor.collector.exception.InvalidConnectionTargetException;
import com.cgi.dbsurveyor.collector.model.Constraint;
import com.cgi.dbsurveyor.collector.model.ConstraintType;
import com.cgi.dbsurveyor.collector.model.DatabaseInfo;
import com.cgi.dbsurveyor.collector.model.DatabaseSchema;
import com.cgi.dbsurveyor.collector.model.DatabaseType;
import com.cgi.dbsurveyor.collector.model.ForeignKey;
import com.cgi.dbsurveyor.collector.model.Index;
import com.cgi.dbsurveyor.collector.model.OrderingStrategy;
import com.cgi.dbsurveyor.collector.model.ReferentialAction;
import com.cgi.dbsurveyor.collector.model.SortOrder;
import com.cgi.dbsurveyor.collector.model.Table;
import com.cgi.dbsurveyor.collector.model.TableSample;
import com.cgi.dbsurveyor.collector.model.Trigger;
import com.cgi.dbsurveyor.collector.model.TriggerEvent;
import com.cgi.dbsurveyor.collector.model.TriggerTiming;
import com.cgi.dbsurveyor.collector.service.ordering.OrderingStrategyResolver;
import com.cgi.dbsurveyor.collector.service.sampling.SamplingExecutor;
import com.cgi.dbsurveyor.collector.service.sampling.SensitiveFieldDetector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SQLiteEngineAdapterTest {

    @TempDir
    Path tempDir;

    private Path databaseFile;
    private SQLiteAdapterFactory factory;

    @BeforeEach
    void setUp() throws Exception {
        databaseFile = tempDir.resolve("shop.db");
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + databaseFile);
             Statement statement = connection.createStatement()) {
            statement.executeUpdate("""
                CREATE TABLE customers (
                    id INTEGER PRIMARY KEY,
                    email TEXT NOT NULL UNIQUE,
                    created_at DATETIME,
                    balance NUMERIC(10,2) CHECK (balance >= 0)
                )""");
            statement.executeUpdate("""
                CREATE TABLE orders (
                    order_id INTEGER,
                    line INTEGER,
                    customer_id INTEGER REFERENCES customers(id) ON DELETE CASCADE,
                    PRIMARY KEY (order_id, line)
                )""");
            statement.executeUpdate("CREATE TABLE notes (body TEXT)");
            statement.executeUpdate("CREATE INDEX idx_orders_customer ON orders(customer_id DESC)");
            statement.executeUpdate("CREATE VIEW big_customers AS SELECT * FROM customers WHERE balance > 100");
            statement.executeUpdate("""
                CREATE TRIGGER trg_orders_audit AFTER DELETE ON orders
                BEGIN
                    SELECT 1;
                END""");
            for (int i = 1; i <= 5; i++) {
                statement.executeUpdate("INSERT INTO customers (id, email, created_at, balance) VALUES ("
                        + i + ", 'c" + i + "@example.com', '2024-01-0" + i + " 10:00:00', " + (i * 50) + ")");
            }
            statement.executeUpdate("INSERT INTO orders VALUES (1, 1, 1), (1, 2, 1), (2, 1, 3)");
            statement.executeUpdate("INSERT INTO notes VALUES ('first'), ('second'), ('third')");
        }

        SamplingExecutor samplingExecutor = new SamplingExecutor(new OrderingStrategyResolver(), new SensitiveFieldDetector());
        factory = new SQLiteAdapterFactory(new JdbcDataSourceFactory(), samplingExecutor);
    }

    private DatabaseAdapter connect() {
        ConnectionConfig config = ConnectionConfig.builder()
                .host(databaseFile.toString())
                .database("main")
                .build();
        return factory.create(config, ConnectionSecret.none(), CollectionConfig.defaults());
    }

    private static Table table(DatabaseSchema schema, String name) {
        return schema.getTables().stream().filter(t -> t.getName().equals(name)).findFirst().orElseThrow();
    }

    @Test
    void testCollectSchema() {
        try (DatabaseAdapter adapter = connect()) {
            DatabaseSchema schema = adapter.collectSchema();

            assertEquals("1.0", schema.getFormatVersion());
            assertEquals("main", schema.getDatabaseInfo().getName());
            assertTrue(schema.getDatabaseInfo().getCollectionStatus().isSuccess());
            assertEquals(List.of("customers", "notes", "orders"),
                    schema.getTables().stream().map(Table::getName).toList());

            Table customers = table(schema, "customers");
            assertEquals(List.of("id"), customers.getPrimaryKey().getColumns());
            assertTrue(customers.findColumn("id").orElseThrow().isAutoIncrement());
            assertFalse(customers.findColumn("email").orElseThrow().isNullable());
            assertTrue(customers.findColumn("created_at").orElseThrow().getDataType().isTemporal());
            assertEquals(4, customers.findColumn("balance").orElseThrow().getOrdinalPosition());

            Table orders = table(schema, "orders");
            assertEquals(List.of("order_id", "line"), orders.getPrimaryKey().getColumns());
            ForeignKey fk = orders.getForeignKeys().get(0);
            assertEquals("customers", fk.getReferencedTable());
            assertEquals(List.of("customer_id"), fk.getColumns());
            assertEquals(List.of("id"), fk.getReferencedColumns());
            assertEquals(ReferentialAction.CASCADE, fk.getOnDelete());
        }
    }

    @Test
    void testIndexesConstraintsViewsAndTriggers() {
        try (DatabaseAdapter adapter = connect()) {
            DatabaseSchema schema = adapter.collectSchema();

            Index index = schema.getIndexes().stream()
                    .filter(i -> i.getName().equals("idx_orders_customer")).findFirst().orElseThrow();
            assertEquals("orders", index.getTableName());
            assertFalse(index.isUnique());
            assertEquals("customer_id", index.getColumns().get(0).getName());
            assertEquals(SortOrder.DESCENDING, index.getColumns().get(0).getSortOrder());

            List<Constraint> customerConstraints = schema.getConstraints().stream()
                    .filter(c -> c.getTableName().equals("customers")).toList();
            assertTrue(customerConstraints.stream().anyMatch(c -> c.getConstraintType() == ConstraintType.CHECK
                    && "balance >= 0".equals(c.getCheckClause())));
            assertTrue(customerConstraints.stream().anyMatch(c -> c.getConstraintType() == ConstraintType.UNIQUE
                    && c.getColumns().equals(List.of("email"))));
            assertTrue(customerConstraints.stream().anyMatch(c -> c.getConstraintType() == ConstraintType.PRIMARY_KEY));

            assertEquals(1, schema.getViews().size());
            assertEquals("big_customers", schema.getViews().get(0).getName());

            Trigger trigger = schema.getTriggers().get(0);
            assertEquals("trg_orders_audit", trigger.getName());
            assertEquals("orders", trigger.getTableName());
            assertEquals(TriggerTiming.AFTER, trigger.getTiming());
            assertEquals(TriggerEvent.DELETE, trigger.getEvent());
        }
    }

    @Test
    void testSampleData() {
        try (DatabaseAdapter adapter = connect()) {
            adapter.collectSchema();
            List<TableSample> samples = adapter.sampleData(SamplingConfig.builder().sampleSize(2).build());

            assertEquals(3, samples.size());
            TableSample customers = samples.stream()
                    .filter(s -> s.getTableName().equals("customers")).findFirst().orElseThrow();
            assertEquals(OrderingStrategy.Kind.PRIMARY_KEY, customers.getOrderingStrategy().getKind());
            assertEquals(2, customers.getRows().size());
            assertEquals(5, ((Number) customers.getRows().get(0).get("id")).intValue());
            assertEquals(4, ((Number) customers.getRows().get(1).get("id")).intValue());
            assertEquals(5L, customers.getTotalRows());
            assertTrue(customers.getWarnings().stream().anyMatch(w -> w.contains("'email'")));

            TableSample notes = samples.stream()
                    .filter(s -> s.getTableName().equals("notes")).findFirst().orElseThrow();
            assertEquals(OrderingStrategy.systemRowId("rowid"), notes.getOrderingStrategy());
            assertEquals("third", notes.getRows().get(0).get("body"));

            TableSample orders = samples.stream()
                    .filter(s -> s.getTableName().equals("orders")).findFirst().orElseThrow();
            assertEquals(List.of("order_id", "line"), orders.getOrderingStrategy().getColumns());
            assertEquals(2, ((Number) orders.getRows().get(0).get("order_id")).intValue());
        }
    }

    @Test
    void testSingleDatabaseServer() {
        try (DatabaseAdapter adapter = connect()) {
            List<DatabaseInfo> databases = adapter.listDatabases();

            assertEquals(1, databases.size());
            assertEquals("main", databases.get(0).getName());
            assertFalse(adapter.supportsFeature(AdapterFeature.MULTI_DATABASE));
            assertTrue(adapter.supportsFeature(AdapterFeature.DATA_SAMPLING));
            assertEquals(DatabaseType.SQLITE, adapter.describeServer().getServerType());
            assertNotNull(adapter.describeServer().getVersion());

            try (DatabaseAdapter main = adapter.connectToDatabase("main")) {
                assertEquals(3, main.collectSchema().getTables().size());
            }
            assertThrows(InvalidConnectionTargetException.class, () -> adapter.connectToDatabase("other"));
            assertThrows(InvalidConnectionTargetException.class, () -> adapter.connectToDatabase("main; --"));
        }
    }

    @Test
    void testMissingFileIsNotCreated() {
        Path missing = tempDir.resolve("missing.db");
        ConnectionConfig config = ConnectionConfig.builder().host(missing.toString()).build();

        assertThrows(ConnectionFailedException.class,
                () -> factory.create(config, ConnectionSecret.none(), CollectionConfig.defaults()));
        assertFalse(missing.toFile().exists());
    }
}
