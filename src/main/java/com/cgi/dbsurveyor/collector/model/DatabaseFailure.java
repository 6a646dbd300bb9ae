package com.cgi.dbsurveyor.collector.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.io.Serial;
import java.io.Serializable;

/**
 * A database whose collection failed. The message is already sanitized.
 */
@Getter
@AllArgsConstructor
@ToString
public class DatabaseFailure implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private final String databaseName;
    private final String errorMessage;
    private final String errorCode;
    private final boolean connectionError;
}
