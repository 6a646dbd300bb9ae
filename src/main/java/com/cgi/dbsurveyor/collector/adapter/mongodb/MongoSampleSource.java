package com.cgi.dbsurveyor.collector.adapter.mongodb;

import com.cgi.dbsurveyor.collector.model.OrderingStrategy;
import com.cgi.dbsurveyor.collector.model.SortDirection;
import com.cgi.dbsurveyor.collector.model.Table;
import com.cgi.dbsurveyor.collector.service.sampling.SampleSource;
import com.cgi.dbsurveyor.collector.service.sampling.SampleValueConverter;
import com.mongodb.MongoException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Aggregates;
import com.mongodb.client.model.EstimatedDocumentCountOptions;
import com.mongodb.client.model.Sorts;
import org.bson.Document;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Samples collections with sorted finds, or $sample when no ordering exists.
 */
class MongoSampleSource implements SampleSource {

    private final MongoDatabase database;

    MongoSampleSource(MongoDatabase database) {
        this.database = database;
    }

    @Override
    public String systemRowIdColumn(Table table) {
        // natural order is not stable across storage engines
        return null;
    }

    @Override
    public void fetchRows(Table table, OrderingStrategy strategy, int limit, Duration timeout,
                          Consumer<Map<String, Object>> rowConsumer) {
        MongoCollection<Document> collection = database.getCollection(table.getName());
        try {
            if (strategy.isDeterministic()) {
                collection.find()
                        .sort(strategy.getDirection() == SortDirection.ASCENDING
                                ? Sorts.ascending(strategy.getColumns())
                                : Sorts.descending(strategy.getColumns()))
                        .limit(limit)
                        .maxTime(timeout.toMillis(), TimeUnit.MILLISECONDS)
                        .forEach(rowConsumer::accept);
            } else {
                collection.aggregate(List.of(Aggregates.sample(limit)))
                        .maxTime(timeout.toMillis(), TimeUnit.MILLISECONDS)
                        .forEach(rowConsumer::accept);
            }
        } catch (MongoException e) {
            throw MongoErrorTranslator.translate("sampling " + table.getName(), e);
        }
    }

    @Override
    public Long countRows(Table table, Duration timeout) {
        try {
            return database.getCollection(table.getName())
                    .estimatedDocumentCount(new EstimatedDocumentCountOptions()
                            .maxTime(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (MongoException e) {
            throw MongoErrorTranslator.translate("counting " + table.getName(), e);
        }
    }

    @Override
    public SampleValueConverter valueConverter() {
        return new BsonValueConverter();
    }
}
