package com.cgi.dbsurveyor.collector.model;

/**
 * Sort order of an index column.
 */
public enum SortOrder {
    ASCENDING,
    DESCENDING
}
