package com.cgi.dbsurveyor.collector.config;

import com.cgi.dbsurveyor.collector.exception.ConfigurationException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.List;

/**
 * Immutable sampling settings shared by every concurrent collection task.
 */
@Getter
@ToString
public class SamplingConfig {

    public static final List<String> DEFAULT_TIMESTAMP_COLUMNS = List.of(
            "created_at", "updated_at", "modified_at", "inserted_at", "timestamp",
            "created", "updated", "modified", "date_created", "date_updated", "date_modified",
            "createdat", "updatedat", "modifiedat", "creation_time", "modification_time",
            "update_time", "create_time");

    public static final List<SensitivePattern> DEFAULT_SENSITIVE_PATTERNS = List.of(
            new SensitivePattern("(password|passwd|pwd)", "Password field detected"),
            new SensitivePattern("(email|mail)", "Email field detected"),
            new SensitivePattern("(ssn|social_security)", "Social Security Number field detected"),
            new SensitivePattern("(credit_card|card_number|cvv)", "Credit card field detected"),
            new SensitivePattern("(api_key|apikey|secret_key)", "API key field detected"),
            new SensitivePattern("(token|auth_token|bearer)", "Authentication token field detected"),
            new SensitivePattern("(phone|mobile)", "Phone number field detected"));

    public static final int DEFAULT_SAMPLE_SIZE = 100;
    public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Rows to sample per table.
     */
    private final int sampleSize;

    /**
     * Hard timeout for each sampling query.
     */
    private final Duration queryTimeout;

    /**
     * Delay before each query; zero disables throttling.
     */
    private final Duration throttleDelay;

    /**
     * Whether sensitive column names produce warnings.
     */
    private final boolean warnSensitive;

    /**
     * Timestamp column candidates in priority order.
     */
    private final List<String> timestampColumns;

    private final List<SensitivePattern> sensitivePatterns;

    /**
     * Builder constructor. Unset values take their defaults; lists are copied.
     */
    @Builder(toBuilder = true)
    private SamplingConfig(Integer sampleSize, Duration queryTimeout, Duration throttleDelay, Boolean warnSensitive,
                           List<String> timestampColumns, List<SensitivePattern> sensitivePatterns) {
        this.sampleSize = sampleSize == null ? DEFAULT_SAMPLE_SIZE : sampleSize;
        this.queryTimeout = queryTimeout == null ? DEFAULT_QUERY_TIMEOUT : queryTimeout;
        this.throttleDelay = throttleDelay == null ? Duration.ZERO : throttleDelay;
        this.warnSensitive = warnSensitive == null || warnSensitive;
        this.timestampColumns = timestampColumns == null ? DEFAULT_TIMESTAMP_COLUMNS : List.copyOf(timestampColumns);
        this.sensitivePatterns = sensitivePatterns == null ? DEFAULT_SENSITIVE_PATTERNS : List.copyOf(sensitivePatterns);
    }

    public static SamplingConfig defaults() {
        return SamplingConfig.builder().build();
    }

    /**
     * Validates the configuration.
     *
     * @throws ConfigurationException If a value is out of range
     */
    public void validate() {
        if (sampleSize < 1) {
            throw new ConfigurationException("Sample size must be greater than 0");
        }
        if (queryTimeout.isZero() || queryTimeout.isNegative()) {
            throw new ConfigurationException("Sampling query timeout must be greater than 0");
        }
        if (throttleDelay.isNegative()) {
            throw new ConfigurationException("Throttle delay cannot be negative");
        }
    }
}
