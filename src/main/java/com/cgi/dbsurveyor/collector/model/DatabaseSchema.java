package com.cgi.dbsurveyor.collector.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;

/**
 * Complete schema of one database, plus optional samples.
 * The format version is not settable.
 */
@Getter
@ToString
public class DatabaseSchema implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private final String formatVersion;
    private final DatabaseInfo databaseInfo;
    private final List<Table> tables;
    private final List<View> views;
    private final List<Index> indexes;
    private final List<Constraint> constraints;
    private final List<Routine> procedures;
    private final List<Routine> functions;
    private final List<Trigger> triggers;
    private final List<CustomType> customTypes;
    private final List<TableSample> samples;
    private final CollectionMetadata collectionMetadata;

    @Builder(toBuilder = true)
    private DatabaseSchema(DatabaseInfo databaseInfo, List<Table> tables, List<View> views,
                           List<Index> indexes, List<Constraint> constraints, List<Routine> procedures,
                           List<Routine> functions, List<Trigger> triggers, List<CustomType> customTypes,
                           List<TableSample> samples, CollectionMetadata collectionMetadata) {
        this.formatVersion = CollectionResult.FORMAT_VERSION;
        this.databaseInfo = databaseInfo;
        this.tables = nonNull(tables);
        this.views = nonNull(views);
        this.indexes = nonNull(indexes);
        this.constraints = nonNull(constraints);
        this.procedures = nonNull(procedures);
        this.functions = nonNull(functions);
        this.triggers = nonNull(triggers);
        this.customTypes = nonNull(customTypes);
        this.samples = nonNull(samples);
        this.collectionMetadata = collectionMetadata;
    }

    private static <T> List<T> nonNull(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }

    /**
     * Placeholder entry for a database that was not collected.
     *
     * @param databaseInfo Database, carrying a FAILED or SKIPPED status
     * @param metadata Collection metadata
     * @return Empty schema
     */
    public static DatabaseSchema placeholder(DatabaseInfo databaseInfo, CollectionMetadata metadata) {
        return DatabaseSchema.builder()
                .databaseInfo(databaseInfo)
                .collectionMetadata(metadata)
                .build();
    }

    /**
     * Name of the database this schema describes.
     *
     * @return Database name, null when unknown
     */
    public String databaseName() {
        return databaseInfo == null ? null : databaseInfo.getName();
    }
}
