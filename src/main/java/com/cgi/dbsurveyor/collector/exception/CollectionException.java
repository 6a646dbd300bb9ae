package com.cgi.dbsurveyor.collector.exception;

/**
 * Exception for schema collection errors.
 */
public class CollectionException extends BaseException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new CollectionException with the specified message.
     *
     * @param message Exception message
     */
    public CollectionException(String message) {
        super(message, "COLLECTION_ERROR");
    }

    /**
     * Creates a new CollectionException with the specified message and cause.
     *
     * @param message Exception message
     * @param cause The cause of the exception
     */
    public CollectionException(String message, Throwable cause) {
        super(message, cause, "COLLECTION_ERROR");
    }
}
