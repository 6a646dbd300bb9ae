package com.cgi.dbsurveyor.collector.service;

import com.cgi.dbsurveyor.collector.config.CollectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionSecret;
import com.cgi.dbsurveyor.collector.config.SamplingConfig;
import com.cgi.dbsurveyor.collector.core.adapter.AdapterFactory;
import com.cgi.dbsurveyor.collector.core.adapter.AdapterRegistry;
import com.cgi.dbsurveyor.collector.core.adapter.DatabaseAdapter;
import com.cgi.dbsurveyor.collector.exception.AdapterNotFoundException;
import com.cgi.dbsurveyor.collector.exception.CollectionException;
import com.cgi.dbsurveyor.collector.model.CollectionMetadata;
import com.cgi.dbsurveyor.collector.model.CollectionResult;
import com.cgi.dbsurveyor.collector.model.DatabaseInfo;
import com.cgi.dbsurveyor.collector.model.DatabaseSchema;
import com.cgi.dbsurveyor.collector.model.DatabaseType;
import com.cgi.dbsurveyor.collector.model.ServerInfo;
import com.cgi.dbsurveyor.collector.service.orchestrator.MultiDatabaseOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CollectionServiceTest {

    private AdapterFactory postgresFactory;
    private DatabaseAdapter adapter;
    private MultiDatabaseOrchestrator orchestrator;
    private final SamplingConfig samplingConfig = SamplingConfig.defaults();
    private final CollectionConfig collectionConfig = CollectionConfig.defaults();
    private CollectionService service;

    @BeforeEach
    void setUp() {
        postgresFactory = mock(AdapterFactory.class);
        adapter = mock(DatabaseAdapter.class);
        orchestrator = mock(MultiDatabaseOrchestrator.class);
        AdapterRegistry registry = AdapterRegistry.builder()
                .register(DatabaseType.POSTGRESQL, postgresFactory)
                .build();
        service = new CollectionService(registry, orchestrator, new CollectionResultAggregator(),
                samplingConfig, collectionConfig, ConnectionConfig.builder().build());

        when(postgresFactory.create(any(), any(), any())).thenReturn(adapter);
        when(adapter.describeServer()).thenReturn(ServerInfo.builder()
                .serverType(DatabaseType.POSTGRESQL)
                .version("16.2")
                .build());
    }

    private static DatabaseSchema schema(String name) {
        return DatabaseSchema.builder()
                .databaseInfo(DatabaseInfo.builder().name(name).build())
                .collectionMetadata(CollectionMetadata.builder()
                        .collectedAt(Instant.now())
                        .collectionDurationMs(12)
                        .warnings(List.of("views: permission denied"))
                        .build())
                .build();
    }

    @Test
    void testCollectDatabaseFromConnectionString() {
        when(orchestrator.collectConnected(eq(adapter), any(), any())).thenReturn(schema("sales"));

        CollectionResult result = service.collectDatabase("postgresql://svc:pw@db.local:5432/sales");

        ArgumentCaptor<ConnectionConfig> config = ArgumentCaptor.forClass(ConnectionConfig.class);
        ArgumentCaptor<ConnectionSecret> secret = ArgumentCaptor.forClass(ConnectionSecret.class);
        verify(postgresFactory).create(config.capture(), secret.capture(), eq(collectionConfig));
        assertEquals("db.local", config.getValue().getHost());
        assertEquals("svc", config.getValue().getUsername());
        assertTrue(secret.getValue().isDestroyed());
        verify(orchestrator).collectConnected(adapter, collectionConfig, samplingConfig);
        verify(adapter).close();

        assertEquals(1, result.getDatabases().size());
        assertEquals("sales", result.getDatabases().get(0).getDatabaseInfo().getName());
        assertEquals(1, result.getServerInfo().getTotalDatabases());
        assertEquals("16.2", result.getServerInfo().getVersion());
        assertTrue(result.getFailures().isEmpty());
        assertEquals(List.of("views: permission denied"), result.getCollectionMetadata().getWarnings());
    }

    @Test
    void testFailureClosesAdapterAndPropagates() {
        CollectionException failure = new CollectionException("Error during collectSchema: boom");
        when(orchestrator.collectConnected(eq(adapter), any(), any())).thenThrow(failure);
        ConnectionConfig config = ConnectionConfig.builder().host("db.local").database("sales").build();

        CollectionException thrown = assertThrows(CollectionException.class,
                () -> service.collectDatabase(DatabaseType.POSTGRESQL, config, ConnectionSecret.of("pw")));

        assertSame(failure, thrown);
        verify(adapter).close();
    }

    @Test
    void testCollectServerDelegatesToOrchestrator() {
        CollectionResult expected = CollectionResult.builder().build();
        Duration deadline = Duration.ofMinutes(5);
        when(orchestrator.collect(adapter, collectionConfig, samplingConfig, deadline)).thenReturn(expected);
        ConnectionConfig config = ConnectionConfig.builder().host("db.local").build();

        CollectionResult result = service.collectServer(DatabaseType.POSTGRESQL, config, ConnectionSecret.of("pw"), deadline);

        assertSame(expected, result);
        verify(adapter).close();
    }

    @Test
    void testUnsupportedEngineDestroysSecret() {
        ConnectionSecret secret = ConnectionSecret.of("pw");
        ConnectionConfig config = ConnectionConfig.builder().host("db.local").build();

        assertThrows(AdapterNotFoundException.class,
                () -> service.collectDatabase(DatabaseType.MYSQL, config, secret));

        assertTrue(secret.isDestroyed());
        verifyNoInteractions(postgresFactory, orchestrator);
    }
}
