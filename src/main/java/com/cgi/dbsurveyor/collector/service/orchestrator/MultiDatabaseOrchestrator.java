package com.cgi.dbsurveyor.collector.service.orchestrator;

import com.cgi.dbsurveyor.collector.config.CollectionConfig;
import com.cgi.dbsurveyor.collector.config.SamplingConfig;
import com.cgi.dbsurveyor.collector.core.adapter.AdapterFeature;
import com.cgi.dbsurveyor.collector.core.adapter.DatabaseAdapter;
import com.cgi.dbsurveyor.collector.core.security.CredentialSanitizer;
import com.cgi.dbsurveyor.collector.exception.BaseException;
import com.cgi.dbsurveyor.collector.exception.CollectionException;
import com.cgi.dbsurveyor.collector.model.AccessLevel;
import com.cgi.dbsurveyor.collector.model.CollectionMetadata;
import com.cgi.dbsurveyor.collector.model.CollectionResult;
import com.cgi.dbsurveyor.collector.model.CollectionStatus;
import com.cgi.dbsurveyor.collector.model.DatabaseFailure;
import com.cgi.dbsurveyor.collector.model.DatabaseInfo;
import com.cgi.dbsurveyor.collector.model.DatabaseSchema;
import com.cgi.dbsurveyor.collector.model.DatabaseType;
import com.cgi.dbsurveyor.collector.model.ServerInfo;
import com.cgi.dbsurveyor.collector.model.TableSample;
import com.cgi.dbsurveyor.collector.service.CollectionResultAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StopWatch;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Collects every database of a server.
 * <p>
 * Databases are discovered and filtered before any per-database connection is opened.
 * Each database is then collected by its own task on a pool whose size is the
 * configured concurrency bound, so no more tasks run at once; queued tasks wait
 * for a free worker. Tasks never share adapters and report through the completion
 * queue only.
 */
@Slf4j
@Component
public class MultiDatabaseOrchestrator {

    static final String CANCELLED = "cancelled";
    static final String INSUFFICIENT_PRIVILEGE = "insufficient privilege";

    private final RetryPolicy retryPolicy;
    private final CollectionResultAggregator aggregator;
    private final AtomicInteger runSequence = new AtomicInteger();

    /**
     * Constructor.
     *
     * @param retryPolicy Reconnect policy applied per database
     * @param aggregator Result aggregator
     */
    public MultiDatabaseOrchestrator(RetryPolicy retryPolicy, CollectionResultAggregator aggregator) {
        this.retryPolicy = retryPolicy;
        this.aggregator = aggregator;
    }

    /**
     * Outcome of one database task.
     */
    private static final class Outcome {
        private final DatabaseSchema schema;
        private final DatabaseFailure failure;
        private final BaseException error;

        private Outcome(DatabaseSchema schema, DatabaseFailure failure, BaseException error) {
            this.schema = schema;
            this.failure = failure;
            this.error = error;
        }
    }

    /**
     * Collects all accessible, non-excluded databases of the server.
     *
     * @param serverAdapter Adapter connected with server-level credentials; not closed here
     * @param config Collection configuration
     * @param samplingConfig Sampling configuration, used when sampling is enabled
     * @param deadline Overall deadline, null for none
     * @return Result with one entry per considered database
     * @throws BaseException The first database failure when continue-on-error is off,
     *                       or a discovery failure
     */
    public CollectionResult collect(DatabaseAdapter serverAdapter, CollectionConfig config,
                                    SamplingConfig samplingConfig, Duration deadline) {
        config.validate();
        if (config.isEnableDataSampling()) {
            samplingConfig.validate();
        }
        Instant startedAt = Instant.now();
        StopWatch watch = new StopWatch("server collection");
        DatabaseType type = serverAdapter.getDatabaseType();
        List<String> warnings = new ArrayList<>();

        watch.start("discover");
        ServerInfo serverInfo = describeServer(serverAdapter, warnings);
        List<DatabaseInfo> discovered = serverAdapter.listDatabases();
        watch.stop();

        DatabaseFilter filter = new DatabaseFilter(config.getExcludeDatabases(), config.getIncludeDatabases());
        List<DatabaseInfo> targets = new ArrayList<>();
        List<DatabaseSchema> databases = new ArrayList<>();
        int systemExcluded = 0;
        int inaccessible = 0;

        for (DatabaseInfo listed : discovered) {
            boolean system = SystemDatabaseClassifier.isSystemDatabase(type, listed);
            DatabaseInfo database = listed.toBuilder().systemDatabase(system).build();
            if (system && !config.isIncludeSystemDatabases()) {
                systemExcluded++;
                continue;
            }
            if (!filter.accepts(database.getName())) {
                log.debug("Database {} filtered out", database.getName());
                continue;
            }
            if (database.getAccessLevel() == AccessLevel.NONE) {
                inaccessible++;
                databases.add(DatabaseSchema.placeholder(
                        database.toBuilder().collectionStatus(CollectionStatus.skipped(INSUFFICIENT_PRIVILEGE)).build(),
                        emptyMetadata()));
                continue;
            }
            targets.add(database);
        }
        if (inaccessible > 0) {
            warnings.add(inaccessible + " database(s) were inaccessible and skipped");
        }
        log.info("Discovered {} databases on {} server, collecting {} ({} system excluded, {} inaccessible)",
                discovered.size(), type.getId(), targets.size(), systemExcluded, inaccessible);

        watch.start("collect");
        List<DatabaseFailure> failures = new ArrayList<>();
        runTasks(serverAdapter, targets, config, samplingConfig, deadline, databases, failures, warnings);
        watch.stop();
        log.debug(watch.prettyPrint());

        return aggregator.aggregateServer(serverInfo, discovered.size(), systemExcluded,
                databases, failures, startedAt, warnings);
    }

    private void runTasks(DatabaseAdapter serverAdapter, List<DatabaseInfo> targets, CollectionConfig config,
                          SamplingConfig samplingConfig, Duration deadline, List<DatabaseSchema> databases,
                          List<DatabaseFailure> failures, List<String> warnings) {
        if (targets.isEmpty()) {
            return;
        }
        int workers = Math.min(config.getMaxConcurrentConnections(), targets.size());
        ExecutorService executor = Executors.newFixedThreadPool(workers, threadFactory());
        CompletionService<Outcome> completionService = new ExecutorCompletionService<>(executor);
        Map<Future<Outcome>, DatabaseInfo> pending = new LinkedHashMap<>();
        long deadlineNanos = deadline == null ? Long.MAX_VALUE : System.nanoTime() + deadline.toNanos();

        try {
            for (DatabaseInfo database : targets) {
                pending.put(completionService.submit(
                        () -> collectDatabase(serverAdapter, database, config, samplingConfig)), database);
            }

            while (!pending.isEmpty()) {
                Future<Outcome> done;
                if (deadline == null) {
                    done = completionService.take();
                } else {
                    long remaining = deadlineNanos - System.nanoTime();
                    done = remaining > 0 ? completionService.poll(remaining, TimeUnit.NANOSECONDS) : null;
                }
                if (done == null) {
                    log.warn("Collection deadline of {} ms reached with {} databases unresolved",
                            deadline.toMillis(), pending.size());
                    break;
                }
                DatabaseInfo database = pending.remove(done);
                Outcome outcome = resultOf(done, database);
                if (outcome.error != null && !config.isContinueOnError()) {
                    log.error("Collection of {} failed, aborting remaining databases: {}",
                            database.getName(), outcome.error.getMessage());
                    cancelAll(pending);
                    throw outcome.error;
                }
                databases.add(outcome.schema);
                if (outcome.failure != null) {
                    failures.add(outcome.failure);
                }
            }

            for (Map.Entry<Future<Outcome>, DatabaseInfo> entry : pending.entrySet()) {
                entry.getKey().cancel(true);
                DatabaseInfo database = entry.getValue();
                databases.add(failedPlaceholder(database, CANCELLED));
                failures.add(new DatabaseFailure(database.getName(), CANCELLED, "CANCELLED", false));
            }
            if (!pending.isEmpty()) {
                warnings.add(pending.size() + " database(s) were cancelled by the collection deadline");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll(pending);
            throw new CollectionException("Collection interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Collects one database. Never throws: every failure becomes a FAILED outcome.
     */
    private Outcome collectDatabase(DatabaseAdapter serverAdapter, DatabaseInfo database,
                                    CollectionConfig config, SamplingConfig samplingConfig) {
        String name = database.getName();
        StopWatch watch = new StopWatch(name);
        watch.start();
        try (DatabaseAdapter adapter = retryPolicy.execute("connect " + name,
                () -> serverAdapter.connectToDatabase(name))) {
            DatabaseSchema schema = collectConnected(adapter, config, samplingConfig);
            DatabaseInfo info = schema.getDatabaseInfo();
            DatabaseInfo collected = info.toBuilder()
                    .name(name)
                    .systemDatabase(database.isSystemDatabase())
                    .accessLevel(database.getAccessLevel())
                    .owner(info.getOwner() != null ? info.getOwner() : database.getOwner())
                    .sizeBytes(info.getSizeBytes() != null ? info.getSizeBytes() : database.getSizeBytes())
                    .build();
            watch.stop();
            log.debug("Collected {} in {} ms", name, watch.getTotalTimeMillis());
            return new Outcome(schema.toBuilder().databaseInfo(collected).build(), null, null);
        } catch (BaseException e) {
            return failedOutcome(database, e);
        } catch (RuntimeException e) {
            return failedOutcome(database, new CollectionException(
                    "Error collecting database: " + CredentialSanitizer.describe(e), e));
        }
    }

    /**
     * Collects the schema of an already connected database and, when enabled and
     * supported, samples its tables. A sampling failure is recorded as a warning in
     * the schema metadata and never discards the schema.
     *
     * @param adapter Connected adapter
     * @param config Collection configuration
     * @param samplingConfig Sampling configuration
     * @return Schema, with samples when sampling ran
     */
    public DatabaseSchema collectConnected(DatabaseAdapter adapter, CollectionConfig config,
                                           SamplingConfig samplingConfig) {
        DatabaseSchema schema = adapter.collectSchema();
        if (!config.isEnableDataSampling() || !adapter.supportsFeature(AdapterFeature.DATA_SAMPLING)) {
            return schema;
        }
        CollectionMetadata metadata = schema.getCollectionMetadata();
        List<String> warnings = new ArrayList<>(metadata == null ? List.of() : metadata.getWarnings());
        List<TableSample> samples = List.of();
        try {
            samples = adapter.sampleData(samplingConfig);
        } catch (BaseException e) {
            log.warn("Sampling of {} failed [{}]: {}", schema.databaseName(), e.getErrorCode(), e.getMessage());
            warnings.add("Sampling failed: " + e.getMessage());
        }
        return schema.toBuilder()
                .samples(samples)
                .collectionMetadata(CollectionMetadata.builder()
                        .collectedAt(metadata == null ? Instant.now() : metadata.getCollectedAt())
                        .collectionDurationMs(metadata == null ? 0 : metadata.getCollectionDurationMs())
                        .warnings(List.copyOf(warnings))
                        .build())
                .build();
    }

    private Outcome failedOutcome(DatabaseInfo database, BaseException error) {
        log.warn("Collection of {} failed [{}]: {}", database.getName(), error.getErrorCode(), error.getMessage());
        return new Outcome(
                failedPlaceholder(database, error.getMessage()),
                new DatabaseFailure(database.getName(), error.getMessage(), error.getErrorCode(), error.isConnectionError()),
                error);
    }

    private Outcome resultOf(Future<Outcome> done, DatabaseInfo database) throws InterruptedException {
        try {
            return done.get();
        } catch (ExecutionException e) {
            // Only Errors escape collectDatabase
            return failedOutcome(database, new CollectionException(
                    "Error collecting database: " + CredentialSanitizer.describe(e.getCause()), e.getCause()));
        }
    }

    private ServerInfo describeServer(DatabaseAdapter serverAdapter, List<String> warnings) {
        try {
            return serverAdapter.describeServer();
        } catch (BaseException e) {
            log.warn("Could not describe server [{}]: {}", e.getErrorCode(), e.getMessage());
            warnings.add("Server description unavailable: " + e.getMessage());
            return ServerInfo.builder().serverType(serverAdapter.getDatabaseType()).build();
        }
    }

    private static DatabaseSchema failedPlaceholder(DatabaseInfo database, String error) {
        return DatabaseSchema.placeholder(
                database.toBuilder().collectionStatus(CollectionStatus.failed(error)).build(),
                emptyMetadata());
    }

    private static CollectionMetadata emptyMetadata() {
        return CollectionMetadata.builder().collectedAt(Instant.now()).build();
    }

    private static void cancelAll(Map<Future<Outcome>, DatabaseInfo> pending) {
        pending.keySet().forEach(future -> future.cancel(true));
    }

    /**
     * Thread factory for one run; threads are named after this orchestrator's run number.
     */
    ThreadFactory threadFactory() {
        int run = runSequence.incrementAndGet();
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "dbsurveyor-collect-" + run + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
