package com.cgi.dbsurveyor.collector.model;

public enum TriggerEvent {
    INSERT,
    UPDATE,
    DELETE,
    TRUNCATE
}
