package com.cgi.dbsurveyor.collector.core.adapter;

import com.cgi.dbsurveyor.collector.config.SamplingConfig;
import com.cgi.dbsurveyor.collector.core.security.CredentialSanitizer;
import com.cgi.dbsurveyor.collector.exception.BaseException;
import com.cgi.dbsurveyor.collector.exception.CollectionException;
import com.cgi.dbsurveyor.collector.model.DatabaseInfo;
import com.cgi.dbsurveyor.collector.model.DatabaseSchema;
import com.cgi.dbsurveyor.collector.model.DatabaseType;
import com.cgi.dbsurveyor.collector.model.ServerInfo;
import com.cgi.dbsurveyor.collector.model.Table;
import com.cgi.dbsurveyor.collector.model.TableSample;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Supplier;

/**
 * Exposes a typed {@link EngineAdapter} through the narrow {@link DatabaseAdapter} contract.
 * Validates database names before reconnecting and turns any engine failure that is not
 * already part of the error taxonomy into a sanitized {@link CollectionException}.
 *
 * @param <C> Connection handle type of the wrapped engine adapter
 */
@Slf4j
public class EngineAdapterBridge<C> implements DatabaseAdapter {

    /**
     * The wrapped engine adapter.
     */
    private final EngineAdapter<C> engine;

    /**
     * Tables of the last collected schema, reused by sampling.
     */
    private volatile List<Table> collectedTables;

    /**
     * Constructor.
     *
     * @param engine Engine adapter, owned by this bridge from now on
     */
    public EngineAdapterBridge(EngineAdapter<C> engine) {
        this.engine = engine;
    }

    /**
     * Gets the wrapped engine adapter for callers needing typed access.
     *
     * @return Engine adapter
     */
    public EngineAdapter<C> unwrap() {
        return engine;
    }

    @Override
    public void testConnection() {
        call("testConnection", () -> {
            engine.ping();
            return null;
        });
    }

    @Override
    public List<DatabaseInfo> listDatabases() {
        return call("listDatabases", () -> engine.enumerateDatabases(true));
    }

    @Override
    public DatabaseAdapter connectToDatabase(String databaseName) {
        DatabaseNames.validate(databaseName);
        if (!engine.features().contains(AdapterFeature.MULTI_DATABASE)) {
            log.debug("{} adapter does not enumerate databases, reconnecting to the same target", engine.databaseType().getId());
        }
        EngineAdapterBridge<C> adapter = call("connectToDatabase", () -> new EngineAdapterBridge<>(engine.reconnect(databaseName)));
        try {
            adapter.testConnection();
            return adapter;
        } catch (RuntimeException e) {
            adapter.close();
            throw e;
        }
    }

    @Override
    public DatabaseSchema collectSchema() {
        DatabaseSchema schema = call("collectSchema", engine::extractSchema);
        collectedTables = schema.getTables();
        return schema;
    }

    @Override
    public List<TableSample> sampleData(SamplingConfig config) {
        if (!supportsFeature(AdapterFeature.DATA_SAMPLING)) {
            throw new CollectionException("Data sampling is not supported by the " + engine.databaseType().getId() + " adapter");
        }
        config.validate();
        List<Table> tables = collectedTables;
        List<Table> targets = tables != null ? tables : call("extractTables", engine::extractTables);
        return call("sampleData", () -> engine.sampleTables(targets, config));
    }

    @Override
    public ServerInfo describeServer() {
        return call("describeServer", engine::describeServer);
    }

    @Override
    public DatabaseType getDatabaseType() {
        return engine.databaseType();
    }

    @Override
    public boolean supportsFeature(AdapterFeature feature) {
        return engine.features().contains(feature);
    }

    @Override
    public void close() {
        try {
            engine.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close {} adapter: {}", engine.databaseType().getId(), CredentialSanitizer.describe(e));
        }
    }

    /**
     * Runs an engine operation with standardized error translation.
     *
     * @param operationName Operation name for logging
     * @param operation Operation
     * @return Operation result
     */
    private <T> T call(String operationName, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (BaseException e) {
            throw e;
        } catch (RuntimeException e) {
            String message = CredentialSanitizer.describe(e);
            log.debug("Unexpected {} failure during {}: {}", engine.databaseType().getId(), operationName, message);
            throw new CollectionException("Error during " + operationName + ": " + message, e);
        }
    }
}
