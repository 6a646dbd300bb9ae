package com.cgi.dbsurveyor.collector.model;

public enum RoutineKind {
    PROCEDURE,
    FUNCTION
}
