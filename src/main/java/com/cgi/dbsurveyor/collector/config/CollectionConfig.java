package com.cgi.dbsurveyor.collector.config;

import com.cgi.dbsurveyor.collector.exception.ConfigurationException;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * Immutable collection settings: which databases and which schema object classes to collect.
 * The builder copies the pattern lists it is given.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class CollectionConfig {

    public static final int MAX_CONCURRENCY = 50;

    /**
     * Collect system databases (template0, mysql, admin, ...).
     */
    @Builder.Default
    private final boolean includeSystemDatabases = false;

    /**
     * Exclusion patterns: exact names, globs, or /regex/.
     */
    @Singular
    private final List<String> excludeDatabases;

    /**
     * When non-empty, only matching databases are collected.
     */
    @Singular
    private final List<String> includeDatabases;

    /**
     * Upper bound of databases collected at the same time.
     */
    @Builder.Default
    private final int maxConcurrentConnections = 4;

    /**
     * Record a failed database and keep going, instead of aborting the run.
     */
    @Builder.Default
    private final boolean continueOnError = true;

    @Builder.Default
    private final boolean includeViews = true;

    @Builder.Default
    private final boolean includeRoutines = true;

    @Builder.Default
    private final boolean includeTriggers = true;

    @Builder.Default
    private final boolean includeIndexes = true;

    @Builder.Default
    private final boolean includeConstraints = true;

    @Builder.Default
    private final boolean includeCustomTypes = true;

    /**
     * Sample table data after schema extraction.
     */
    @Builder.Default
    private final boolean enableDataSampling = false;

    public static CollectionConfig defaults() {
        return CollectionConfig.builder().build();
    }

    /**
     * Validates the configuration.
     *
     * @throws ConfigurationException If a value is out of range
     */
    public void validate() {
        if (maxConcurrentConnections < 1 || maxConcurrentConnections > MAX_CONCURRENCY) {
            throw new ConfigurationException("Max concurrent connections must be between 1 and " + MAX_CONCURRENCY);
        }
    }
}
