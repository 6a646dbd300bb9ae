package com.cgi.dbsurveyor.collector.adapter.mongodb;

import com.cgi.dbsurveyor.collector.config.CollectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionSecret;
import com.cgi.dbsurveyor.collector.core.adapter.AdapterFactory;
import com.cgi.dbsurveyor.collector.core.adapter.DatabaseAdapter;
import com.cgi.dbsurveyor.collector.core.adapter.EngineAdapterBridge;
import com.cgi.dbsurveyor.collector.service.sampling.SamplingExecutor;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.ReadPreference;
import com.mongodb.ServerAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Creates connected MongoDB adapters. Users authenticate against the admin database.
 */
@Slf4j
@Component
public class MongoAdapterFactory implements AdapterFactory {

    private static final int DEFAULT_PORT = 27017;
    private static final String AUTH_SOURCE = "admin";

    private final SamplingExecutor samplingExecutor;

    public MongoAdapterFactory(SamplingExecutor samplingExecutor) {
        this.samplingExecutor = samplingExecutor;
    }

    @Override
    public DatabaseAdapter create(ConnectionConfig config, ConnectionSecret secret, CollectionConfig collectionConfig) {
        log.info("Creating mongodb client for {}", config);
        DatabaseAdapter adapter = new EngineAdapterBridge<>(
                new MongoEngineAdapter(buildSettings(config, secret), config, collectionConfig, samplingExecutor));
        try {
            adapter.testConnection();
            return adapter;
        } catch (RuntimeException e) {
            adapter.close();
            throw e;
        }
    }

    MongoClientSettings buildSettings(ConnectionConfig config, ConnectionSecret secret) {
        int connectMillis = (int) config.getConnectTimeout().toMillis();
        int readMillis = (int) config.getQueryTimeout().toMillis();
        MongoClientSettings.Builder builder = MongoClientSettings.builder()
                .applicationName("dbsurveyor")
                .readPreference(ReadPreference.primaryPreferred())
                .applyToClusterSettings(cluster -> cluster
                        .hosts(List.of(new ServerAddress(config.getHost(), config.portOr(DEFAULT_PORT))))
                        .serverSelectionTimeout(connectMillis, TimeUnit.MILLISECONDS))
                .applyToSocketSettings(socket -> socket
                        .connectTimeout(connectMillis, TimeUnit.MILLISECONDS)
                        .readTimeout(readMillis, TimeUnit.MILLISECONDS))
                .applyToConnectionPoolSettings(pool -> pool.maxSize(config.getMaxConnections()));
        if (config.getUsername() != null) {
            String password = secret == null ? null : secret.reveal();
            builder.credential(MongoCredential.createCredential(
                    config.getUsername(), AUTH_SOURCE, password == null ? new char[0] : password.toCharArray()));
        }
        return builder.build();
    }
}
