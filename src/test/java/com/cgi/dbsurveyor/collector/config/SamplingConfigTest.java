package com.cgi.dbsurveyor.collector.config;

import com.cgi.dbsurveyor.collector.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SamplingConfigTest {

    @Test
    void testDefaults() {
        SamplingConfig config = SamplingConfig.defaults();

        assertEquals(100, config.getSampleSize());
        assertEquals(Duration.ofSeconds(30), config.getQueryTimeout());
        assertEquals(Duration.ZERO, config.getThrottleDelay());
        assertTrue(config.isWarnSensitive());
        assertEquals(SamplingConfig.DEFAULT_TIMESTAMP_COLUMNS, config.getTimestampColumns());
        assertEquals(SamplingConfig.DEFAULT_SENSITIVE_PATTERNS, config.getSensitivePatterns());
    }

    @Test
    void testListsAreCopiedWhenBuilt() {
        List<String> columns = new ArrayList<>(List.of("created_at"));
        List<SensitivePattern> patterns = new ArrayList<>(List.of(new SensitivePattern("(pin)", "PIN field detected")));

        SamplingConfig config = SamplingConfig.builder()
                .timestampColumns(columns)
                .sensitivePatterns(patterns)
                .build();
        columns.add("updated_at");
        patterns.clear();

        assertEquals(List.of("created_at"), config.getTimestampColumns());
        assertEquals(1, config.getSensitivePatterns().size());
        assertThrows(UnsupportedOperationException.class, () -> config.getTimestampColumns().add("x"));
    }

    @Test
    void testToBuilderKeepsValues() {
        SamplingConfig config = SamplingConfig.builder().sampleSize(5).warnSensitive(false).build();

        SamplingConfig copy = config.toBuilder().throttleDelay(Duration.ofMillis(20)).build();

        assertEquals(5, copy.getSampleSize());
        assertFalse(copy.isWarnSensitive());
        assertEquals(Duration.ofMillis(20), copy.getThrottleDelay());
    }

    @Test
    void testValidationRejectsOutOfRangeValues() {
        assertThrows(ConfigurationException.class, () -> SamplingConfig.builder().sampleSize(0).build().validate());
        assertThrows(ConfigurationException.class,
                () -> SamplingConfig.builder().queryTimeout(Duration.ZERO).build().validate());
        assertThrows(ConfigurationException.class,
                () -> SamplingConfig.builder().throttleDelay(Duration.ofMillis(-1)).build().validate());
    }
}
