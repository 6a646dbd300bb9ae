package com.cgi.dbsurveyor.collector.exception;

/**
 * Raised when the connected identity lacks the privilege to read an object.
 */
public class InsufficientPrivilegeException extends BaseException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new InsufficientPrivilegeException with the specified message.
     *
     * @param message Exception message
     */
    public InsufficientPrivilegeException(String message) {
        super(message, "INSUFFICIENT_PRIVILEGE");
    }

    /**
     * Creates a new InsufficientPrivilegeException with the specified message and cause.
     *
     * @param message Exception message
     * @param cause The cause of the exception
     */
    public InsufficientPrivilegeException(String message, Throwable cause) {
        super(message, cause, "INSUFFICIENT_PRIVILEGE");
    }
}
