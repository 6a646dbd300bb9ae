package com.cgi.dbsurveyor.collector.exception;

/**
 * Raised when a single query exceeds its timeout. Only that query is aborted.
 */
public class QueryTimeoutException extends BaseException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new QueryTimeoutException with the specified message.
     *
     * @param message Exception message
     */
    public QueryTimeoutException(String message) {
        super(message, "QUERY_TIMEOUT");
    }

    /**
     * Creates a new QueryTimeoutException with the specified message and cause.
     *
     * @param message Exception message
     * @param cause The cause of the exception
     */
    public QueryTimeoutException(String message, Throwable cause) {
        super(message, cause, "QUERY_TIMEOUT");
    }
}
