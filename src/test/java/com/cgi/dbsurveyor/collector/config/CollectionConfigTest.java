package com.cgi.dbsurveyor.collector.config;

import com.cgi.dbsurveyor.collector.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CollectionConfigTest {

    @Test
    void testDefaultFiltersAreEmpty() {
        CollectionConfig config = CollectionConfig.defaults();

        assertTrue(config.getExcludeDatabases().isEmpty());
        assertTrue(config.getIncludeDatabases().isEmpty());
        assertTrue(config.isContinueOnError());
    }

    @Test
    void testFilterListsAreCopiedWhenBuilt() {
        List<String> excludes = new ArrayList<>(List.of("tmp_*"));
        List<String> includes = new ArrayList<>(List.of("app"));

        CollectionConfig config = CollectionConfig.builder()
                .excludeDatabases(excludes)
                .includeDatabases(includes)
                .build();
        excludes.add("app");
        includes.clear();

        assertEquals(List.of("tmp_*"), config.getExcludeDatabases());
        assertEquals(List.of("app"), config.getIncludeDatabases());
        assertThrows(UnsupportedOperationException.class, () -> config.getExcludeDatabases().add("x"));
    }

    @Test
    void testConcurrencyBounds() {
        assertThrows(ConfigurationException.class,
                () -> CollectionConfig.builder().maxConcurrentConnections(0).build().validate());
        assertThrows(ConfigurationException.class,
                () -> CollectionConfig.builder().maxConcurrentConnections(CollectionConfig.MAX_CONCURRENCY + 1).build().validate());
        CollectionConfig.builder().maxConcurrentConnections(CollectionConfig.MAX_CONCURRENCY).build().validate();
    }
}
