package com.cgi.dbsurveyor.collector.exception;

import com.cgi.dbsurveyor.collector.core.security.CredentialSanitizer;

/**
 * Base exception class for all exceptions raised by the collector.
 * Messages are sanitized on construction so that no connection string or
 * password can travel upward inside an error.
 */
public abstract class BaseException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    /**
     * Error code for categorizing exceptions.
     */
    private final String errorCode;

    /**
     * Creates a new BaseException with the specified message and error code.
     *
     * @param message Exception message
     * @param errorCode Error code
     */
    protected BaseException(String message, String errorCode) {
        this(message, null, errorCode);
    }

    /**
     * Creates a new BaseException with the specified message, cause, and error code.
     *
     * @param message Exception message
     * @param cause The cause of the exception
     * @param errorCode Error code
     */
    protected BaseException(String message, Throwable cause, String errorCode) {
        super(CredentialSanitizer.sanitize(message), cause);
        this.errorCode = errorCode;
    }

    /**
     * Gets the error code.
     *
     * @return Error code
     */
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Whether the failure happened while establishing a connection.
     *
     * @return true for connection-level failures
     */
    public boolean isConnectionError() {
        return false;
    }
}
