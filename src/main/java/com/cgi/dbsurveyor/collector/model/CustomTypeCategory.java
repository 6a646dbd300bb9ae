package com.cgi.dbsurveyor.collector.model;

public enum CustomTypeCategory {
    ENUM,
    COMPOSITE,
    DOMAIN,
    RANGE
}
