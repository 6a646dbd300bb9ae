package com.cgi.dbsurveyor.collector.model;

public enum SortDirection {
    ASCENDING,
    DESCENDING
}
