package com.cgi.dbsurveyor.collector.service.sampling;

import com.cgi.dbsurveyor.collector.config.SamplingConfig;
import com.cgi.dbsurveyor.collector.core.security.CredentialSanitizer;
import com.cgi.dbsurveyor.collector.exception.BaseException;
import com.cgi.dbsurveyor.collector.exception.QueryTimeoutException;
import com.cgi.dbsurveyor.collector.exception.SamplingException;
import com.cgi.dbsurveyor.collector.model.OrderingStrategy;
import com.cgi.dbsurveyor.collector.model.Table;
import com.cgi.dbsurveyor.collector.model.TableSample;
import com.cgi.dbsurveyor.collector.service.Sleeper;
import com.cgi.dbsurveyor.collector.service.ordering.OrderingStrategyResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StopWatch;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Samples tables through a {@link SampleSource}: resolves the ordering, throttles,
 * runs the timeout-bounded query, converts values and attaches warnings.
 */
@Slf4j
@Component
public class SamplingExecutor {

    private final OrderingStrategyResolver orderingResolver;
    private final SensitiveFieldDetector sensitiveFieldDetector;
    private final Sleeper sleeper;

    /**
     * Constructor.
     *
     * @param orderingResolver Ordering strategy resolver
     * @param sensitiveFieldDetector Sensitive column detector
     */
    @Autowired
    public SamplingExecutor(OrderingStrategyResolver orderingResolver, SensitiveFieldDetector sensitiveFieldDetector) {
        this(orderingResolver, sensitiveFieldDetector, Sleeper.SYSTEM);
    }

    /**
     * Constructor with an explicit sleeper.
     *
     * @param orderingResolver Ordering strategy resolver
     * @param sensitiveFieldDetector Sensitive column detector
     * @param sleeper Sleeper used for throttling
     */
    public SamplingExecutor(OrderingStrategyResolver orderingResolver, SensitiveFieldDetector sensitiveFieldDetector,
                            Sleeper sleeper) {
        this.orderingResolver = orderingResolver;
        this.sensitiveFieldDetector = sensitiveFieldDetector;
        this.sleeper = sleeper;
    }

    /**
     * Samples every table. A table that cannot be sampled yields an empty sample
     * whose warnings explain why; the other tables are unaffected.
     *
     * @param source Sample source
     * @param tables Tables
     * @param config Sampling configuration
     * @return One sample per table, in table order
     * @throws SamplingException If the thread is interrupted
     */
    public List<TableSample> sampleAll(SampleSource source, List<Table> tables, SamplingConfig config) {
        StopWatch watch = new StopWatch();
        watch.start();
        List<TableSample> samples = new ArrayList<>(tables.size());
        for (Table table : tables) {
            OrderingStrategy strategy = resolveOrdering(source, table, config);
            List<String> warnings = planWarnings(table, strategy, config);
            try {
                samples.add(fetch(source, table, config, strategy, warnings));
            } catch (SamplingException e) {
                if (Thread.currentThread().isInterrupted()) {
                    throw e;
                }
                samples.add(failedSample(table, config, strategy, warnings, e));
            } catch (BaseException e) {
                samples.add(failedSample(table, config, strategy, warnings, e));
            }
        }
        watch.stop();
        log.debug("Sampled {} tables in {} ms", tables.size(), watch.getTotalTimeMillis());
        return samples;
    }

    /**
     * Samples one table.
     *
     * @param source Sample source
     * @param table Table
     * @param config Sampling configuration
     * @return Sample
     * @throws QueryTimeoutException If the sampling query times out
     * @throws SamplingException If the thread is interrupted while throttling
     */
    public TableSample sample(SampleSource source, Table table, SamplingConfig config) {
        OrderingStrategy strategy = resolveOrdering(source, table, config);
        return fetch(source, table, config, strategy, planWarnings(table, strategy, config));
    }

    private OrderingStrategy resolveOrdering(SampleSource source, Table table, SamplingConfig config) {
        return orderingResolver.resolve(table, config.getTimestampColumns(), source.systemRowIdColumn(table));
    }

    /**
     * Warnings known before any query runs: non-deterministic ordering and sensitive column names.
     */
    private List<String> planWarnings(Table table, OrderingStrategy strategy, SamplingConfig config) {
        List<String> warnings = new ArrayList<>();
        if (!strategy.isDeterministic()) {
            warnings.add(OrderingStrategyResolver.UNORDERED_WARNING);
        }
        if (config.isWarnSensitive()) {
            warnings.addAll(sensitiveFieldDetector.detect(table, config.getSensitivePatterns()));
        }
        return warnings;
    }

    private TableSample fetch(SampleSource source, Table table, SamplingConfig config,
                              OrderingStrategy strategy, List<String> warnings) {
        SampleValueConverter converter = source.valueConverter();
        List<Map<String, Object>> rows = new ArrayList<>();

        throttle(config.getThrottleDelay());
        log.debug("Sampling {} with {} ordering", qualifiedName(table), strategy.getKind());
        source.fetchRows(table, strategy, config.getSampleSize(), config.getQueryTimeout(),
                row -> rows.add(converter.convertRow(row)));

        Long totalRows = countRows(source, table, config);

        return TableSample.builder()
                .tableName(table.getName())
                .schemaName(table.getSchema())
                .rows(rows)
                .sampleSize(config.getSampleSize())
                .totalRows(totalRows)
                .orderingStrategy(strategy)
                .collectedAt(Instant.now())
                .warnings(List.copyOf(warnings))
                .build();
    }

    /**
     * Best-effort row count; failures leave the count unset.
     */
    private Long countRows(SampleSource source, Table table, SamplingConfig config) {
        if (table.getRowCount() != null && table.getRowCount() >= 0) {
            return table.getRowCount();
        }
        try {
            throttle(config.getThrottleDelay());
            return source.countRows(table, config.getQueryTimeout());
        } catch (SamplingException e) {
            throw e;
        } catch (RuntimeException e) {
            log.debug("Row count unavailable for {}: {}", qualifiedName(table), CredentialSanitizer.describe(e));
            return null;
        }
    }

    private void throttle(Duration delay) {
        if (delay == null || delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SamplingException("Sampling interrupted", e);
        }
    }

    private TableSample failedSample(Table table, SamplingConfig config, OrderingStrategy strategy,
                                     List<String> plannedWarnings, BaseException cause) {
        String reason = cause instanceof QueryTimeoutException
                ? "Sampling query timed out after " + config.getQueryTimeout().toSeconds() + "s"
                : "Sampling failed: " + cause.getMessage();
        log.warn("Could not sample {}: {}", qualifiedName(table), reason);
        List<String> warnings = new ArrayList<>(plannedWarnings);
        warnings.add(reason);
        return TableSample.builder()
                .tableName(table.getName())
                .schemaName(table.getSchema())
                .rows(List.of())
                .sampleSize(config.getSampleSize())
                .totalRows(table.getRowCount())
                .orderingStrategy(strategy)
                .collectedAt(Instant.now())
                .warnings(List.copyOf(warnings))
                .build();
    }

    private static String qualifiedName(Table table) {
        return table.getSchema() == null ? table.getName() : table.getSchema() + "." + table.getName();
    }
}
