package com.cgi.dbsurveyor.collector.adapter.mysql;

import com.cgi.dbsurveyor.collector.config.CollectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionSecret;
import com.cgi.dbsurveyor.collector.core.adapter.AdapterFactory;
import com.cgi.dbsurveyor.collector.core.adapter.DatabaseAdapter;
import com.cgi.dbsurveyor.collector.core.adapter.EngineAdapterBridge;
import com.cgi.dbsurveyor.collector.core.jdbc.JdbcDataSourceFactory;
import com.cgi.dbsurveyor.collector.model.DatabaseType;
import com.cgi.dbsurveyor.collector.service.sampling.SamplingExecutor;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.stereotype.Component;

/**
 * Creates connected MySQL adapters.
 */
@Component
public class MySqlAdapterFactory implements AdapterFactory {

    private final JdbcDataSourceFactory dataSourceFactory;
    private final SamplingExecutor samplingExecutor;

    public MySqlAdapterFactory(JdbcDataSourceFactory dataSourceFactory, SamplingExecutor samplingExecutor) {
        this.dataSourceFactory = dataSourceFactory;
        this.samplingExecutor = samplingExecutor;
    }

    @Override
    public DatabaseAdapter create(ConnectionConfig config, ConnectionSecret secret, CollectionConfig collectionConfig) {
        HikariDataSource pool = dataSourceFactory.create(DatabaseType.MYSQL, config, secret);
        DatabaseAdapter adapter = new EngineAdapterBridge<>(
                new MySqlEngineAdapter(pool, config, collectionConfig, samplingExecutor, dataSourceFactory));
        try {
            adapter.testConnection();
            return adapter;
        } catch (RuntimeException e) {
            adapter.close();
            throw e;
        }
    }
}
