package com.cgi.dbsurveyor.collector.exception;

/**
 * Raised for malformed or unsafe connection targets such as database names with quotes.
 */
public class InvalidConnectionTargetException extends BaseException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new InvalidConnectionTargetException with the specified message.
     *
     * @param message Exception message
     */
    public InvalidConnectionTargetException(String message) {
        super(message, "INVALID_CONNECTION_TARGET");
    }

    /**
     * Creates a new InvalidConnectionTargetException with the specified message and cause.
     *
     * @param message Exception message
     * @param cause The cause of the exception
     */
    public InvalidConnectionTargetException(String message, Throwable cause) {
        super(message, cause, "INVALID_CONNECTION_TARGET");
    }
}
