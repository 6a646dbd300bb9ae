package com.cgi.dbsurveyor.collector.model;

public enum TriggerTiming {
    BEFORE,
    AFTER,
    INSTEAD_OF
}
