package com.cgi.dbsurveyor.collector.exception;

/**
 * Raised when establishing a connection exceeds the connect timeout.
 */
public class ConnectionTimeoutException extends BaseException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new ConnectionTimeoutException with the specified message.
     *
     * @param message Exception message
     */
    public ConnectionTimeoutException(String message) {
        super(message, "CONNECTION_TIMEOUT");
    }

    /**
     * Creates a new ConnectionTimeoutException with the specified message and cause.
     *
     * @param message Exception message
     * @param cause The cause of the exception
     */
    public ConnectionTimeoutException(String message, Throwable cause) {
        super(message, cause, "CONNECTION_TIMEOUT");
    }

    @Override
    public boolean isConnectionError() {
        return true;
    }
}
