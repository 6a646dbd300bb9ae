package com.cgi.dbsurveyor.collector.core.adapter;

import com.cgi.dbsurveyor.collector.config.CollectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionConfig;
import com.cgi.dbsurveyor.collector.config.ConnectionSecret;
import com.cgi.dbsurveyor.collector.exception.AdapterNotFoundException;
import com.cgi.dbsurveyor.collector.model.DatabaseType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable map from engine to adapter factory, built once at startup.
 * Additional adapters (for instance from an extension loader) register through
 * the same builder and are treated exactly like the built-in ones.
 */
public final class AdapterRegistry {
    private static final Logger logger = LoggerFactory.getLogger(AdapterRegistry.class);

    /**
     * Map of database types to adapter factories.
     */
    private final Map<DatabaseType, AdapterFactory> factories;

    private AdapterRegistry(Map<DatabaseType, AdapterFactory> factories) {
        this.factories = Collections.unmodifiableMap(new EnumMap<>(factories));
        logger.info("Registered database adapters: {}", this.factories.keySet());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Connects to a database with the adapter registered for its engine.
     * The secret is destroyed once the factory has returned, whether or not it succeeded.
     *
     * @param type Engine
     * @param config Connection configuration
     * @param secret Password
     * @param collectionConfig Collection configuration
     * @return Connected adapter
     * @throws AdapterNotFoundException If no adapter is registered for the engine
     */
    public DatabaseAdapter connect(DatabaseType type, ConnectionConfig config, ConnectionSecret secret,
                                   CollectionConfig collectionConfig) {
        try {
            AdapterFactory factory = getFactory(type);
            config.validate();
            collectionConfig.validate();
            logger.debug("Creating {} adapter for {}", type.getId(), config);
            return factory.create(config, secret, collectionConfig);
        } finally {
            secret.destroy();
        }
    }

    /**
     * Gets the factory for an engine.
     *
     * @param type Engine
     * @return Factory
     * @throws AdapterNotFoundException If no adapter is registered for the engine
     */
    public AdapterFactory getFactory(DatabaseType type) {
        AdapterFactory factory = type == null ? null : factories.get(type);
        if (factory == null) {
            throw new AdapterNotFoundException("No adapter registered for database type: "
                    + (type == null ? "null" : type.getId()));
        }
        return factory;
    }

    public boolean supports(DatabaseType type) {
        return factories.containsKey(type);
    }

    public Set<DatabaseType> getSupportedDatabaseTypes() {
        return factories.keySet();
    }

    /**
     * Collects registrations; {@link #build()} freezes them.
     */
    public static final class Builder {
        private final Map<DatabaseType, AdapterFactory> factories = new EnumMap<>(DatabaseType.class);

        private Builder() {
        }

        /**
         * Registers a factory.
         *
         * @param type Engine
         * @param factory Factory
         * @return This builder
         * @throws IllegalStateException If the engine is already registered
         */
        public Builder register(DatabaseType type, AdapterFactory factory) {
            if (factories.putIfAbsent(type, factory) != null) {
                throw new IllegalStateException("Adapter already registered for database type: " + type.getId());
            }
            return this;
        }

        public AdapterRegistry build() {
            return new AdapterRegistry(factories);
        }
    }
}
