package com.cgi.dbsurveyor.collector.config;

import com.cgi.dbsurveyor.collector.service.orchestrator.RetryPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the collector.
 * Maps to properties with the prefix "dbsurveyor" in the application properties.
 * Each section converts into the immutable value used at runtime.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "dbsurveyor")
public class CollectorProperties {

    private Sampling sampling = new Sampling();
    private Collection collection = new Collection();
    private Connection connection = new Connection();
    private Retry retry = new Retry();

    /**
     * dbsurveyor.sampling.*
     */
    @Getter
    @Setter
    public static class Sampling {
        private int sampleSize = 100;
        private Duration queryTimeout = Duration.ofSeconds(30);

        /**
         * Delay before each sampling query; unset disables throttling.
         */
        private Duration throttle;

        private boolean warnSensitive = true;
        private List<String> timestampColumns = new ArrayList<>(SamplingConfig.DEFAULT_TIMESTAMP_COLUMNS);

        /**
         * Replaces the built-in sensitive patterns when non-empty.
         */
        private List<Pattern> sensitivePatterns = new ArrayList<>();

        public SamplingConfig toConfig() {
            List<SensitivePattern> patterns = sensitivePatterns.isEmpty()
                    ? SamplingConfig.DEFAULT_SENSITIVE_PATTERNS
                    : sensitivePatterns.stream()
                            .map(p -> new SensitivePattern(p.getPattern(), p.getDescription()))
                            .toList();
            SamplingConfig config = SamplingConfig.builder()
                    .sampleSize(sampleSize)
                    .queryTimeout(queryTimeout)
                    .throttleDelay(throttle == null ? Duration.ZERO : throttle)
                    .warnSensitive(warnSensitive)
                    .timestampColumns(List.copyOf(timestampColumns))
                    .sensitivePatterns(patterns)
                    .build();
            config.validate();
            return config;
        }
    }

    @Getter
    @Setter
    public static class Pattern {
        private String pattern;
        private String description;
    }

    /**
     * dbsurveyor.collection.*
     */
    @Getter
    @Setter
    public static class Collection {
        private boolean includeSystemDatabases = false;
        private List<String> excludeDatabases = new ArrayList<>();
        private List<String> includeDatabases = new ArrayList<>();
        private int maxConcurrentConnections = 4;
        private boolean continueOnError = true;
        private boolean includeViews = true;
        private boolean includeRoutines = true;
        private boolean includeTriggers = true;
        private boolean includeIndexes = true;
        private boolean includeConstraints = true;
        private boolean includeCustomTypes = true;
        private boolean enableDataSampling = false;

        public CollectionConfig toConfig() {
            CollectionConfig config = CollectionConfig.builder()
                    .includeSystemDatabases(includeSystemDatabases)
                    .excludeDatabases(List.copyOf(excludeDatabases))
                    .includeDatabases(List.copyOf(includeDatabases))
                    .maxConcurrentConnections(maxConcurrentConnections)
                    .continueOnError(continueOnError)
                    .includeViews(includeViews)
                    .includeRoutines(includeRoutines)
                    .includeTriggers(includeTriggers)
                    .includeIndexes(includeIndexes)
                    .includeConstraints(includeConstraints)
                    .includeCustomTypes(includeCustomTypes)
                    .enableDataSampling(enableDataSampling)
                    .build();
            config.validate();
            return config;
        }
    }

    /**
     * dbsurveyor.connection.*
     * Host, port, database and credentials always come from the caller.
     */
    @Getter
    @Setter
    public static class Connection {
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration queryTimeout = Duration.ofSeconds(30);
        private int maxConnections = 10;
        private boolean readOnly = true;

        public ConnectionConfig toDefaults() {
            return ConnectionConfig.builder()
                    .connectTimeout(connectTimeout)
                    .queryTimeout(queryTimeout)
                    .maxConnections(maxConnections)
                    .readOnly(readOnly)
                    .build();
        }
    }

    /**
     * dbsurveyor.retry.*
     */
    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private Duration jitterMin = Duration.ofMillis(100);
        private Duration jitterMax = Duration.ofMillis(300);
        private Duration maxTotal = Duration.ofSeconds(5);

        public RetryPolicy toPolicy() {
            RetryPolicy policy = RetryPolicy.builder()
                    .maxAttempts(maxAttempts)
                    .initialBackoff(initialBackoff)
                    .jitterMin(jitterMin)
                    .jitterMax(jitterMax)
                    .maxTotal(maxTotal)
                    .build();
            policy.validate();
            return policy;
        }
    }
}
