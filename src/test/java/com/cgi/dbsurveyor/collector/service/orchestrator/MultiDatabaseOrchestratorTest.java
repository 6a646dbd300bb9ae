package com.cgi.dbsurveyor.collector.service.orchestrator;

import com.cgi.dbsurveyor.collector.config.CollectionConfig;
import com.cgi.dbsurveyor.collector.config.SamplingConfig;
import com.cgi.dbsurveyor.collector.core.adapter.AdapterFeature;
import com.cgi.dbsurveyor.collector.core.adapter.DatabaseAdapter;
import com.cgi.dbsurveyor.collector.exception.CollectionException;
import com.cgi.dbsurveyor.collector.exception.ConnectionFailedException;
import com.cgi.dbsurveyor.collector.exception.SamplingException;
import com.cgi.dbsurveyor.collector.model.AccessLevel;
import com.cgi.dbsurveyor.collector.model.CollectionMetadata;
import com.cgi.dbsurveyor.collector.model.CollectionMode;
import com.cgi.dbsurveyor.collector.model.CollectionResult;
import com.cgi.dbsurveyor.collector.model.CollectionStatus;
import com.cgi.dbsurveyor.collector.model.DatabaseInfo;
import com.cgi.dbsurveyor.collector.model.DatabaseSchema;
import com.cgi.dbsurveyor.collector.model.DatabaseType;
import com.cgi.dbsurveyor.collector.model.ServerInfo;
import com.cgi.dbsurveyor.collector.model.TableSample;
import com.cgi.dbsurveyor.collector.service.CollectionResultAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class MultiDatabaseOrchestratorTest {

    private FakeServer server;
    private MultiDatabaseOrchestrator orchestrator;

    /**
     * Server-level adapter handing out one {@link FakeDatabase} per connect.
     */
    private static class FakeServer implements DatabaseAdapter {
        final List<DatabaseInfo> listing = new ArrayList<>();
        final Set<String> failing = ConcurrentHashMap.newKeySet();
        final Set<String> blocking = ConcurrentHashMap.newKeySet();
        final Set<String> samplingFails = ConcurrentHashMap.newKeySet();
        final Map<String, Integer> connectFailures = new ConcurrentHashMap<>();
        final Set<String> connected = ConcurrentHashMap.newKeySet();
        final AtomicInteger active = new AtomicInteger();
        final AtomicInteger maxActive = new AtomicInteger();
        final AtomicInteger opened = new AtomicInteger();
        final AtomicInteger closed = new AtomicInteger();
        final AtomicInteger connectAttempts = new AtomicInteger();
        long workMillis = 30;

        void database(String name) {
            listing.add(DatabaseInfo.builder().name(name).build());
        }

        @Override
        public void testConnection() {
        }

        @Override
        public List<DatabaseInfo> listDatabases() {
            return listing;
        }

        @Override
        public DatabaseAdapter connectToDatabase(String databaseName) {
            connectAttempts.incrementAndGet();
            Integer remaining = connectFailures.get(databaseName);
            if (remaining != null && remaining > 0) {
                connectFailures.put(databaseName, remaining - 1);
                throw new ConnectionFailedException("Connection refused");
            }
            connected.add(databaseName);
            opened.incrementAndGet();
            return new FakeDatabase(this, databaseName);
        }

        @Override
        public DatabaseSchema collectSchema() {
            throw new UnsupportedOperationException();
        }

        @Override
        public List<TableSample> sampleData(SamplingConfig config) {
            throw new UnsupportedOperationException();
        }

        @Override
        public ServerInfo describeServer() {
            return ServerInfo.builder().serverType(DatabaseType.POSTGRESQL).version("16.2").host("db.local").build();
        }

        @Override
        public DatabaseType getDatabaseType() {
            return DatabaseType.POSTGRESQL;
        }

        @Override
        public boolean supportsFeature(AdapterFeature feature) {
            return true;
        }

        @Override
        public void close() {
        }
    }

    private static class FakeDatabase implements DatabaseAdapter {
        private final FakeServer server;
        private final String name;

        FakeDatabase(FakeServer server, String name) {
            this.server = server;
            this.name = name;
        }

        @Override
        public DatabaseSchema collectSchema() {
            int now = server.active.incrementAndGet();
            server.maxActive.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(server.blocking.contains(name) ? 10_000 : server.workMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CollectionException("interrupted");
            } finally {
                server.active.decrementAndGet();
            }
            if (server.failing.contains(name)) {
                throw new CollectionException("Catalog unreadable");
            }
            return DatabaseSchema.builder()
                    .databaseInfo(DatabaseInfo.builder().name(name).owner("app").build())
                    .collectionMetadata(CollectionMetadata.builder()
                            .collectedAt(Instant.now())
                            .warnings(List.of("routines: permission denied"))
                            .build())
                    .build();
        }

        @Override
        public List<TableSample> sampleData(SamplingConfig config) {
            if (server.samplingFails.contains(name)) {
                throw new SamplingException("Sampling interrupted");
            }
            return List.of(TableSample.builder().tableName("t").rows(List.of()).build());
        }

        @Override
        public void testConnection() {
        }

        @Override
        public List<DatabaseInfo> listDatabases() {
            return List.of();
        }

        @Override
        public DatabaseAdapter connectToDatabase(String databaseName) {
            throw new UnsupportedOperationException();
        }

        @Override
        public ServerInfo describeServer() {
            return server.describeServer();
        }

        @Override
        public DatabaseType getDatabaseType() {
            return DatabaseType.POSTGRESQL;
        }

        @Override
        public boolean supportsFeature(AdapterFeature feature) {
            return true;
        }

        @Override
        public void close() {
            server.closed.incrementAndGet();
        }
    }

    @BeforeEach
    void setUp() {
        server = new FakeServer();
        RetryPolicy retry = RetryPolicy.builder().sleeper(duration -> { }).build();
        orchestrator = new MultiDatabaseOrchestrator(retry, new CollectionResultAggregator());
    }

    private CollectionResult collect(CollectionConfig config) {
        return orchestrator.collect(server, config, SamplingConfig.defaults(), null);
    }

    private static List<String> names(CollectionResult result) {
        return result.getDatabases().stream().map(DatabaseSchema::databaseName).toList();
    }

    @Test
    void testConcurrencyNeverExceedsBound() {
        for (String name : List.of("e", "d", "c", "b", "a")) {
            server.database(name);
        }

        CollectionResult result = collect(CollectionConfig.builder().maxConcurrentConnections(2).build());

        assertEquals(5, result.getDatabases().size());
        assertTrue(server.maxActive.get() <= 2, "max active " + server.maxActive.get());
        assertEquals(server.opened.get(), server.closed.get());
    }

    @Test
    void testResultIsSortedByName() {
        for (String name : List.of("zeta", "alpha", "mid")) {
            server.database(name);
        }

        CollectionResult result = collect(CollectionConfig.defaults());

        assertEquals(List.of("alpha", "mid", "zeta"), names(result));
        assertEquals(CollectionResult.FORMAT_VERSION, result.getFormatVersion());
    }

    @Test
    void testFailureIsIsolatedToItsDatabase() {
        server.database("a");
        server.database("b");
        server.database("c");
        server.failing.add("b");

        CollectionResult result = collect(CollectionConfig.defaults());

        assertEquals(List.of("a", "b", "c"), names(result));
        CollectionStatus failed = result.getDatabases().get(1).getDatabaseInfo().getCollectionStatus();
        assertEquals(CollectionStatus.State.FAILED, failed.getState());
        assertEquals("Catalog unreadable", failed.getMessage());
        assertTrue(result.getDatabases().get(0).getDatabaseInfo().getCollectionStatus().isSuccess());
        assertTrue(result.getDatabases().get(2).getDatabaseInfo().getCollectionStatus().isSuccess());

        assertEquals(1, result.getFailures().size());
        assertEquals("b", result.getFailures().get(0).getDatabaseName());
        assertEquals("COLLECTION_ERROR", result.getFailures().get(0).getErrorCode());

        CollectionMode mode = result.getServerInfo().getCollectionMode();
        assertEquals(CollectionMode.Mode.MULTI_DATABASE, mode.getMode());
        assertEquals(3, mode.getDiscovered());
        assertEquals(2, mode.getCollected());
        assertEquals(1, mode.getFailed());
    }

    @Test
    void testConnectFailureLeavesOtherDatabasesAsIfExcluded() {
        for (String name : List.of("a", "b", "c")) {
            server.database(name);
        }
        server.connectFailures.put("b", 10);

        CollectionResult withFailure = collect(CollectionConfig.builder().continueOnError(true).build());

        server = new FakeServer();
        for (String name : List.of("a", "b", "c")) {
            server.database(name);
        }
        CollectionResult withExclusion = collect(CollectionConfig.builder().excludeDatabases(List.of("b")).build());

        assertEquals(List.of("a", "b", "c"), names(withFailure));
        assertEquals(CollectionStatus.State.FAILED,
                withFailure.getDatabases().get(1).getDatabaseInfo().getCollectionStatus().getState());
        assertEquals(1, withFailure.getFailures().size());
        assertTrue(withFailure.getFailures().get(0).isConnectionError());
        assertEquals(List.of("a", "c"), names(withExclusion));
        for (String name : List.of("a", "c")) {
            DatabaseSchema failedRun = schemaNamed(withFailure, name);
            DatabaseSchema excludedRun = schemaNamed(withExclusion, name);
            assertTrue(failedRun.getDatabaseInfo().getCollectionStatus().isSuccess());
            assertEquals(excludedRun.getDatabaseInfo(), failedRun.getDatabaseInfo());
            assertEquals(excludedRun.getTables(), failedRun.getTables());
            assertEquals(excludedRun.getSamples(), failedRun.getSamples());
            assertEquals(excludedRun.getCollectionMetadata().getWarnings(),
                    failedRun.getCollectionMetadata().getWarnings());
        }
    }

    private static DatabaseSchema schemaNamed(CollectionResult result, String name) {
        return result.getDatabases().stream()
                .filter(schema -> name.equals(schema.databaseName()))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void testStopsOnFirstFailureWhenContinueOnErrorIsOff() {
        server.database("a");
        server.database("b");
        server.failing.add("b");

        CollectionConfig config = CollectionConfig.builder().continueOnError(false).build();

        CollectionException error = assertThrows(CollectionException.class, () -> collect(config));
        assertEquals("Catalog unreadable", error.getMessage());
    }

    @Test
    void testSystemDatabasesAreExcludedAndCounted() {
        server.database("template0");
        server.database("template1");
        server.database("postgres");
        server.database("app");

        CollectionResult result = collect(CollectionConfig.defaults());

        assertEquals(List.of("app", "postgres"), names(result));
        assertEquals(2, result.getServerInfo().getSystemDatabasesExcluded());
        assertEquals(4, result.getServerInfo().getTotalDatabases());
        assertEquals(Set.of("app", "postgres"), server.connected);
    }

    @Test
    void testSystemDatabasesIncludedOnRequest() {
        server.database("template1");
        server.database("app");

        CollectionResult result = collect(CollectionConfig.builder().includeSystemDatabases(true).build());

        assertEquals(List.of("app", "template1"), names(result));
        assertTrue(result.getDatabases().get(1).getDatabaseInfo().isSystemDatabase());
    }

    @Test
    void testExcludedDatabasesAreNeverConnected() {
        server.database("sales");
        server.database("sales_archive");
        server.database("tmp_1");

        CollectionConfig config = CollectionConfig.builder()
                .excludeDatabases(List.of("*_archive", "/tmp_\\d+/"))
                .build();
        CollectionResult result = collect(config);

        assertEquals(List.of("sales"), names(result));
        assertEquals(Set.of("sales"), server.connected);
    }

    @Test
    void testInaccessibleDatabaseIsSkippedWithoutConnecting() {
        server.database("open");
        server.listing.add(DatabaseInfo.builder().name("locked").accessLevel(AccessLevel.NONE).build());

        CollectionResult result = collect(CollectionConfig.defaults());

        assertEquals(List.of("locked", "open"), names(result));
        CollectionStatus skipped = result.getDatabases().get(0).getDatabaseInfo().getCollectionStatus();
        assertEquals(CollectionStatus.State.SKIPPED, skipped.getState());
        assertEquals("insufficient privilege", skipped.getMessage());
        assertFalse(server.connected.contains("locked"));
        assertTrue(result.getCollectionMetadata().getWarnings()
                .contains("1 database(s) were inaccessible and skipped"));
        assertTrue(result.getFailures().isEmpty());
    }

    @Test
    void testDeadlineCancelsUnfinishedDatabases() {
        server.database("fast");
        server.database("stuck");
        server.blocking.add("stuck");

        CollectionResult result = orchestrator.collect(server, CollectionConfig.defaults(),
                SamplingConfig.defaults(), Duration.ofMillis(500));

        assertEquals(List.of("fast", "stuck"), names(result));
        assertTrue(result.getDatabases().get(0).getDatabaseInfo().getCollectionStatus().isSuccess());
        CollectionStatus cancelled = result.getDatabases().get(1).getDatabaseInfo().getCollectionStatus();
        assertEquals(CollectionStatus.State.FAILED, cancelled.getState());
        assertEquals("cancelled", cancelled.getMessage());
        assertEquals("stuck", result.getFailures().get(0).getDatabaseName());
    }

    @Test
    void testConnectionFailuresAreRetried() {
        server.database("flaky");
        server.connectFailures.put("flaky", 2);

        CollectionResult result = collect(CollectionConfig.defaults());

        assertTrue(result.getDatabases().get(0).getDatabaseInfo().getCollectionStatus().isSuccess());
        assertEquals(3, server.connectAttempts.get());
    }

    @Test
    void testPersistentConnectionFailureIsMarkedAsConnectionError() {
        server.database("down");
        server.connectFailures.put("down", 10);

        CollectionResult result = collect(CollectionConfig.defaults());

        assertEquals(1, result.getFailures().size());
        assertTrue(result.getFailures().get(0).isConnectionError());
        assertEquals(3, server.connectAttempts.get());
    }

    @Test
    void testSamplingFailureKeepsSchema() {
        server.database("a");
        server.database("b");
        server.samplingFails.add("b");

        CollectionConfig config = CollectionConfig.builder().enableDataSampling(true).build();
        CollectionResult result = collect(config);

        DatabaseSchema sampled = result.getDatabases().get(0);
        DatabaseSchema unsampled = result.getDatabases().get(1);
        assertEquals(1, sampled.getSamples().size());
        assertTrue(unsampled.getSamples().isEmpty());
        assertTrue(unsampled.getDatabaseInfo().getCollectionStatus().isSuccess());
        assertTrue(unsampled.getCollectionMetadata().getWarnings().contains("Sampling failed: Sampling interrupted"));
        assertTrue(unsampled.getCollectionMetadata().getWarnings().contains("routines: permission denied"));
    }

    @Test
    void testListingValuesAreMergedIntoCollectedInfo() {
        server.listing.add(DatabaseInfo.builder().name("app").sizeBytes(4096L).accessLevel(AccessLevel.LIMITED).build());

        CollectionResult result = collect(CollectionConfig.defaults());

        DatabaseInfo info = result.getDatabases().get(0).getDatabaseInfo();
        assertEquals(4096L, info.getSizeBytes());
        assertEquals(AccessLevel.LIMITED, info.getAccessLevel());
        assertEquals("app", info.getOwner());
    }

    @Test
    void testEmptyServerYieldsEmptyResult() {
        CollectionResult result = collect(CollectionConfig.defaults());

        assertTrue(result.getDatabases().isEmpty());
        assertEquals(0, result.getServerInfo().getCollectionMode().getDiscovered());
        assertEquals(new HashSet<>(), server.connected);
    }

    @Test
    void testThreadNamesAreNumberedPerOrchestrator() {
        MultiDatabaseOrchestrator other = new MultiDatabaseOrchestrator(RetryPolicy.builder().build(),
                new CollectionResultAggregator());

        ThreadFactory firstRun = orchestrator.threadFactory();
        ThreadFactory secondRun = orchestrator.threadFactory();

        assertEquals("dbsurveyor-collect-1-1", firstRun.newThread(() -> { }).getName());
        assertEquals("dbsurveyor-collect-1-2", firstRun.newThread(() -> { }).getName());
        assertEquals("dbsurveyor-collect-2-1", secondRun.newThread(() -> { }).getName());
        assertEquals("dbsurveyor-collect-1-1", other.threadFactory().newThread(() -> { }).getName());
    }
}
