package com.cgi.dbsurveyor.collector.model;

/**
 * What the connected identity may do with a database.
 */
public enum AccessLevel {
    /**
     * Can connect and read the catalog.
     */
    FULL,

    /**
     * Can connect, but part of the catalog is hidden.
     */
    LIMITED,

    /**
     * Cannot connect.
     */
    NONE
}
