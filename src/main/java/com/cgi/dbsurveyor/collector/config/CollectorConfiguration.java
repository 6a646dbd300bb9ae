package com.cgi.dbsurveyor.collector.config;

import com.cgi.dbsurveyor.collector.adapter.mongodb.MongoAdapterFactory;
import com.cgi.dbsurveyor.collector.adapter.mysql.MySqlAdapterFactory;
import com.cgi.dbsurveyor.collector.adapter.postgres.PostgresAdapterFactory;
import com.cgi.dbsurveyor.collector.adapter.sqlite.SQLiteAdapterFactory;
import com.cgi.dbsurveyor.collector.core.adapter.AdapterRegistry;
import com.cgi.dbsurveyor.collector.model.DatabaseType;
import com.cgi.dbsurveyor.collector.service.orchestrator.RetryPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the adapter registry and the immutable runtime configuration.
 */
@Configuration
@EnableConfigurationProperties(CollectorProperties.class)
public class CollectorConfiguration {

    /**
     * Registry of the built-in engines. SQL Server has no adapter and resolves to AdapterNotFound.
     */
    @Bean
    public AdapterRegistry adapterRegistry(PostgresAdapterFactory postgres,
                                           MySqlAdapterFactory mysql,
                                           SQLiteAdapterFactory sqlite,
                                           MongoAdapterFactory mongo) {
        return AdapterRegistry.builder()
                .register(DatabaseType.POSTGRESQL, postgres)
                .register(DatabaseType.MYSQL, mysql)
                .register(DatabaseType.SQLITE, sqlite)
                .register(DatabaseType.MONGODB, mongo)
                .build();
    }

    @Bean
    public SamplingConfig samplingConfig(CollectorProperties properties) {
        return properties.getSampling().toConfig();
    }

    @Bean
    public CollectionConfig collectionConfig(CollectorProperties properties) {
        return properties.getCollection().toConfig();
    }

    @Bean
    public ConnectionConfig connectionDefaults(CollectorProperties properties) {
        return properties.getConnection().toDefaults();
    }

    @Bean
    public RetryPolicy retryPolicy(CollectorProperties properties) {
        return properties.getRetry().toPolicy();
    }
}
