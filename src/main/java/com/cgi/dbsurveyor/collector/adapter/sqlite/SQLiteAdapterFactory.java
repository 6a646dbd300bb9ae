package com.cgi.dbsurveyor.collector.adapter.sqlite;

import com.cgi.dbsurveyor.collector.config.CollectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionSecret;
import com.cgi.dbsurveyor.collector.core.adapter.AdapterFactory;
import com.cgi.dbsurveyor.collector.core.adapter.DatabaseAdapter;
import com.cgi.dbsurveyor.collector.core.adapter.EngineAdapterBridge;
import com.cgi.dbsurveyor.collector.core.jdbc.JdbcDataSourceFactory;
import com.cgi.dbsurveyor.collector.exception.ConnectionFailedException;
import com.cgi.dbsurveyor.collector.model.DatabaseType;
import com.cgi.dbsurveyor.collector.service.sampling.SamplingExecutor;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Creates SQLite adapters on existing database files. The file is opened
 * read-only and never created.
 */
@Component
public class SQLiteAdapterFactory implements AdapterFactory {

    private final JdbcDataSourceFactory dataSourceFactory;
    private final SamplingExecutor samplingExecutor;

    public SQLiteAdapterFactory(JdbcDataSourceFactory dataSourceFactory, SamplingExecutor samplingExecutor) {
        this.dataSourceFactory = dataSourceFactory;
        this.samplingExecutor = samplingExecutor;
    }

    @Override
    public DatabaseAdapter create(ConnectionConfig config, ConnectionSecret secret, CollectionConfig collectionConfig) {
        requireExistingFile(config.getHost());
        DatabaseAdapter adapter = new EngineAdapterBridge<>(new SQLiteEngineAdapter(
                dataSourceFactory.create(DatabaseType.SQLITE, config, ConnectionSecret.none()),
                config, collectionConfig, samplingExecutor,
                () -> dataSourceFactory.create(DatabaseType.SQLITE, config, ConnectionSecret.none())));
        try {
            adapter.testConnection();
            return adapter;
        } catch (RuntimeException e) {
            adapter.close();
            throw e;
        }
    }

    private static void requireExistingFile(String location) {
        if (location == null || location.startsWith(":memory:") || location.startsWith("file:")) {
            return;
        }
        try {
            if (!Files.isRegularFile(Path.of(location))) {
                throw new ConnectionFailedException("SQLite database file not found");
            }
        } catch (InvalidPathException e) {
            throw new ConnectionFailedException("Invalid SQLite database path", e);
        }
    }
}
