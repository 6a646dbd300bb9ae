package com.cgi.dbsurveyor.collector.exception;

/**
 * Raised when a connection cannot be established (network or authentication).
 */
public class ConnectionFailedException extends BaseException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new ConnectionFailedException with the specified message.
     *
     * @param message Exception message
     */
    public ConnectionFailedException(String message) {
        super(message, "CONNECTION_FAILED");
    }

    /**
     * Creates a new ConnectionFailedException with the specified message and cause.
     *
     * @param message Exception message
     * @param cause The cause of the exception
     */
    public ConnectionFailedException(String message, Throwable cause) {
        super(message, cause, "CONNECTION_FAILED");
    }

    @Override
    public boolean isConnectionError() {
        return true;
    }
}
