package com.cgi.dbsurveyor.collector.core.adapter;

import com.cgi.dbsurveyor.collector.config.CollectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionSecret;
import com.cgi.dbsurveyor.collector.exception.AdapterNotFoundException;
import com.cgi.dbsurveyor.collector.exception.ConfigurationException;
import com.cgi.dbsurveyor.collector.exception.ConnectionFailedException;
import com.cgi.dbsurveyor.collector.model.DatabaseType;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AdapterRegistryTest {

    private final ConnectionConfig config = ConnectionConfig.builder().host("db.local").database("app").build();

    @Test
    void testConnectUsesRegisteredFactoryAndWipesSecret() {
        DatabaseAdapter adapter = mock(DatabaseAdapter.class);
        AtomicReference<String> seen = new AtomicReference<>();
        AdapterRegistry registry = AdapterRegistry.builder()
                .register(DatabaseType.POSTGRESQL, (cfg, secret, collection) -> {
                    seen.set(secret.reveal());
                    return adapter;
                })
                .build();
        ConnectionSecret secret = ConnectionSecret.of("s3cret");

        DatabaseAdapter result = registry.connect(DatabaseType.POSTGRESQL, config, secret, CollectionConfig.defaults());

        assertSame(adapter, result);
        assertEquals("s3cret", seen.get());
        assertTrue(secret.isDestroyed());
        assertThrows(IllegalStateException.class, secret::reveal);
    }

    @Test
    void testSecretIsWipedWhenConnectFails() {
        AdapterRegistry registry = AdapterRegistry.builder()
                .register(DatabaseType.MYSQL, (cfg, secret, collection) -> {
                    throw new ConnectionFailedException("Connection refused");
                })
                .build();
        ConnectionSecret secret = ConnectionSecret.of("s3cret");

        assertThrows(ConnectionFailedException.class,
                () -> registry.connect(DatabaseType.MYSQL, config, secret, CollectionConfig.defaults()));
        assertTrue(secret.isDestroyed());
    }

    @Test
    void testUnregisteredEngineIsAdapterNotFound() {
        AdapterRegistry registry = AdapterRegistry.builder().build();

        AdapterNotFoundException e = assertThrows(AdapterNotFoundException.class,
                () -> registry.connect(DatabaseType.SQLSERVER, config, ConnectionSecret.none(), CollectionConfig.defaults()));
        assertTrue(e.getMessage().contains("sqlserver"));
        assertFalse(registry.supports(DatabaseType.SQLSERVER));
    }

    @Test
    void testInvalidConfigurationNeverReachesFactory() {
        AdapterFactory factory = mock(AdapterFactory.class);
        AdapterRegistry registry = AdapterRegistry.builder().register(DatabaseType.POSTGRESQL, factory).build();
        ConnectionConfig invalid = config.toBuilder().maxConnections(0).build();

        assertThrows(ConfigurationException.class,
                () -> registry.connect(DatabaseType.POSTGRESQL, invalid, ConnectionSecret.none(), CollectionConfig.defaults()));
        verify(factory, never()).create(any(), any(), any());
    }

    @Test
    void testDuplicateRegistrationIsRejected() {
        AdapterFactory factory = mock(AdapterFactory.class);
        AdapterRegistry.Builder builder = AdapterRegistry.builder().register(DatabaseType.SQLITE, factory);

        assertThrows(IllegalStateException.class, () -> builder.register(DatabaseType.SQLITE, factory));
    }
}
