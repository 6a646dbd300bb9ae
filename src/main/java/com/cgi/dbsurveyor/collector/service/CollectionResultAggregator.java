package com.cgi.dbsurveyor.collector.service;

import com.cgi.dbsurveyor.collector.model.CollectionMetadata;
import com.cgi.dbsurveyor.collector.model.CollectionMode;
import com.cgi.dbsurveyor.collector.model.CollectionResult;
import com.cgi.dbsurveyor.collector.model.CollectionStatus;
import com.cgi.dbsurveyor.collector.model.DatabaseFailure;
import com.cgi.dbsurveyor.collector.model.DatabaseSchema;
import com.cgi.dbsurveyor.collector.model.ServerInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Assembles the final {@link CollectionResult}.
 * Databases and failures are sorted by name so that output does not depend on
 * the order in which tasks completed.
 */
@Slf4j
@Component
public class CollectionResultAggregator {

    private static final Comparator<DatabaseSchema> BY_DATABASE_NAME =
            Comparator.comparing(DatabaseSchema::databaseName, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final Comparator<DatabaseFailure> FAILURE_BY_NAME =
            Comparator.comparing(DatabaseFailure::getDatabaseName, Comparator.nullsLast(Comparator.naturalOrder()));

    private final Clock clock;

    public CollectionResultAggregator() {
        this(Clock.systemUTC());
    }

    CollectionResultAggregator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Result of a single-database collection.
     *
     * @param serverInfo Server description
     * @param schema Collected schema
     * @param startedAt Start of the run
     * @return Result
     */
    public CollectionResult aggregateSingle(ServerInfo serverInfo, DatabaseSchema schema, Instant startedAt) {
        ServerInfo server = serverInfo.toBuilder()
                .totalDatabases(1)
                .collectedDatabases(1)
                .systemDatabasesExcluded(0)
                .collectionMode(CollectionMode.singleDatabase())
                .build();
        List<String> warnings = schema.getCollectionMetadata() == null
                ? List.of()
                : schema.getCollectionMetadata().getWarnings();
        return build(server, List.of(schema), List.of(), startedAt, warnings);
    }

    /**
     * Result of a multi-database collection.
     *
     * @param serverInfo Server description
     * @param discovered Number of databases the server listed
     * @param systemExcluded Number of system databases left out
     * @param databases Per-database schemas, including placeholders, in any order
     * @param failures Database-level failures, in any order
     * @param startedAt Start of the run
     * @param warnings Run-level warnings
     * @return Result
     */
    public CollectionResult aggregateServer(ServerInfo serverInfo, int discovered, int systemExcluded,
                                            List<DatabaseSchema> databases, List<DatabaseFailure> failures,
                                            Instant startedAt, List<String> warnings) {
        int collected = (int) databases.stream()
                .map(DatabaseSchema::getDatabaseInfo)
                .filter(info -> info != null && (info.getCollectionStatus().isSuccess()
                        || info.getCollectionStatus().getState() == CollectionStatus.State.PARTIAL))
                .count();
        ServerInfo server = serverInfo.toBuilder()
                .totalDatabases(discovered)
                .collectedDatabases(collected)
                .systemDatabasesExcluded(systemExcluded)
                .collectionMode(CollectionMode.multiDatabase(discovered, collected, failures.size()))
                .build();
        log.info("Collection finished: {} discovered, {} collected, {} failed, {} system excluded",
                discovered, collected, failures.size(), systemExcluded);
        return build(server, databases, failures, startedAt, warnings);
    }

    private CollectionResult build(ServerInfo server, List<DatabaseSchema> databases, List<DatabaseFailure> failures,
                                   Instant startedAt, List<String> warnings) {
        List<DatabaseSchema> sortedDatabases = new ArrayList<>(databases);
        sortedDatabases.sort(BY_DATABASE_NAME);
        List<DatabaseFailure> sortedFailures = new ArrayList<>(failures);
        sortedFailures.sort(FAILURE_BY_NAME);

        Instant now = clock.instant();
        return CollectionResult.builder()
                .serverInfo(server)
                .databases(sortedDatabases)
                .failures(sortedFailures)
                .collectionMetadata(CollectionMetadata.builder()
                        .collectedAt(startedAt)
                        .collectionDurationMs(Math.max(0, Duration.between(startedAt, now).toMillis()))
                        .warnings(warnings == null ? List.of() : List.copyOf(warnings))
                        .build())
                .build();
    }
}
